package org.javai.nl2sql.llm;

import java.util.Locale;

/**
 * OpenAI-compatible chat providers. All are reached through Spring AI's OpenAI client
 * with a provider-specific base URL.
 */
public enum LlmProvider {

	DEEPSEEK("https://api.deepseek.com", "deepseek-chat"),
	QWEN("https://dashscope.aliyuncs.com/compatible-mode", "qwen-plus"),
	OPENAI("https://api.openai.com", "gpt-4o-mini");

	private final String defaultBaseUrl;
	private final String defaultModel;

	LlmProvider(String defaultBaseUrl, String defaultModel) {
		this.defaultBaseUrl = defaultBaseUrl;
		this.defaultModel = defaultModel;
	}

	public String defaultBaseUrl() {
		return defaultBaseUrl;
	}

	public String defaultModel() {
		return defaultModel;
	}

	/**
	 * Name of the environment variable holding this provider's API key, e.g.
	 * {@code DEEPSEEK_API_KEY}.
	 */
	public String apiKeyVariable() {
		return name() + "_API_KEY";
	}

	public static LlmProvider fromName(String name) {
		if (name == null || name.isBlank()) {
			return DEEPSEEK;
		}
		try {
			return valueOf(name.trim().toUpperCase(Locale.ROOT));
		} catch (IllegalArgumentException e) {
			throw new IllegalArgumentException("Unknown LLM provider '" + name + "'. Supported: deepseek, qwen, openai", e);
		}
	}
}

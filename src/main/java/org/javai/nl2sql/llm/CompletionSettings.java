package org.javai.nl2sql.llm;

import java.time.Duration;
import java.util.Objects;

/**
 * Connection and sampling settings for the language model.
 *
 * @param provider which OpenAI-compatible provider to call
 * @param baseUrl provider endpoint; defaults to the provider's public endpoint
 * @param model model name; defaults to the provider's default model
 * @param apiKey API key (never logged)
 * @param temperature sampling temperature
 * @param maxTokens completion token limit
 * @param timeout wall-clock budget for one completion, retries included
 * @param maxAttempts attempts made before the call fails
 */
public record CompletionSettings(
		LlmProvider provider,
		String baseUrl,
		String model,
		String apiKey,
		double temperature,
		int maxTokens,
		Duration timeout,
		int maxAttempts
) {

	public static final double DEFAULT_TEMPERATURE = 0.0;
	public static final int DEFAULT_MAX_TOKENS = 2000;
	public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);
	public static final int DEFAULT_MAX_ATTEMPTS = 3;

	public CompletionSettings {
		Objects.requireNonNull(provider, "provider must not be null");
		Objects.requireNonNull(timeout, "timeout must not be null");
		baseUrl = baseUrl == null || baseUrl.isBlank() ? provider.defaultBaseUrl() : baseUrl;
		model = model == null || model.isBlank() ? provider.defaultModel() : model;
		if (maxTokens < 1) {
			throw new IllegalArgumentException("maxTokens must be >= 1");
		}
		if (maxAttempts < 1) {
			throw new IllegalArgumentException("maxAttempts must be >= 1");
		}
		if (timeout.isNegative() || timeout.isZero()) {
			throw new IllegalArgumentException("timeout must be positive");
		}
	}

	public static CompletionSettings defaults() {
		return builder().build();
	}

	public static Builder builder() {
		return new Builder();
	}

	public boolean hasApiKey() {
		return apiKey != null && !apiKey.isBlank();
	}

	@Override
	public String toString() {
		return "CompletionSettings[provider=%s, baseUrl=%s, model=%s, apiKey=%s, temperature=%s, maxTokens=%d, timeout=%s, maxAttempts=%d]"
				.formatted(provider, baseUrl, model, hasApiKey() ? "****" : "<none>", temperature, maxTokens, timeout,
						maxAttempts);
	}

	public static class Builder {
		private LlmProvider provider = LlmProvider.DEEPSEEK;
		private String baseUrl;
		private String model;
		private String apiKey;
		private double temperature = DEFAULT_TEMPERATURE;
		private int maxTokens = DEFAULT_MAX_TOKENS;
		private Duration timeout = DEFAULT_TIMEOUT;
		private int maxAttempts = DEFAULT_MAX_ATTEMPTS;

		private Builder() {}

		public Builder provider(LlmProvider provider) {
			this.provider = provider;
			return this;
		}

		public Builder baseUrl(String baseUrl) {
			this.baseUrl = baseUrl;
			return this;
		}

		public Builder model(String model) {
			this.model = model;
			return this;
		}

		public Builder apiKey(String apiKey) {
			this.apiKey = apiKey;
			return this;
		}

		public Builder temperature(double temperature) {
			this.temperature = temperature;
			return this;
		}

		public Builder maxTokens(int maxTokens) {
			this.maxTokens = maxTokens;
			return this;
		}

		public Builder timeout(Duration timeout) {
			this.timeout = timeout;
			return this;
		}

		public Builder maxAttempts(int maxAttempts) {
			this.maxAttempts = maxAttempts;
			return this;
		}

		public CompletionSettings build() {
			return new CompletionSettings(provider, baseUrl, model, apiKey, temperature, maxTokens, timeout, maxAttempts);
		}
	}
}

package org.javai.nl2sql.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.javai.nl2sql.llm.CompletionSettings;
import org.javai.nl2sql.llm.LlmProvider;
import org.javai.nl2sql.memory.ContextMemoryConfig;
import org.javai.nl2sql.sandbox.SandboxPolicy;
import org.javai.nl2sql.workflow.WorkflowConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

/**
 * All settings of the application, read from a YAML document with environment
 * overrides for secrets and deployment-specific values.
 *
 * <p>Recognised environment variables: {@code LLM_PROVIDER}, {@code LLM_MODEL},
 * {@code LLM_BASE_URL}, {@code LLM_TIMEOUT} (seconds), {@code MAX_RETRIES} and the
 * provider's key variable, e.g. {@code DEEPSEEK_API_KEY}. Missing sections and keys
 * take their defaults.</p>
 *
 * @param completion language model settings
 * @param workflow loop bounds
 * @param sandbox SQL policy
 * @param memory context memory bounds
 * @param catalogPath location of the schema catalog document, or null
 */
public record Nl2SqlProperties(
		CompletionSettings completion,
		WorkflowConfig workflow,
		SandboxPolicy sandbox,
		ContextMemoryConfig memory,
		String catalogPath
) {

	private static final Logger logger = LoggerFactory.getLogger(Nl2SqlProperties.class);

	public static final String DEFAULT_RESOURCE = "nl2sql.yaml";

	public Nl2SqlProperties {
		Objects.requireNonNull(completion, "completion must not be null");
		Objects.requireNonNull(workflow, "workflow must not be null");
		Objects.requireNonNull(sandbox, "sandbox must not be null");
		Objects.requireNonNull(memory, "memory must not be null");
	}

	public static Nl2SqlProperties defaults() {
		return fromMap(Map.of(), Map.of());
	}

	/**
	 * Loads the {@value #DEFAULT_RESOURCE} classpath resource with the process environment.
	 */
	public static Nl2SqlProperties loadDefault() {
		try (InputStream in = Nl2SqlProperties.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
			if (in == null) {
				logger.info("No {} on the classpath; using defaults", DEFAULT_RESOURCE);
				return fromMap(Map.of(), System.getenv());
			}
			return load(in, System.getenv());
		}
		catch (IOException e) {
			throw new ConfigurationException("Failed to read " + DEFAULT_RESOURCE, e);
		}
	}

	public static Nl2SqlProperties load(Path path, Map<String, String> env) {
		try (InputStream in = Files.newInputStream(path)) {
			return load(in, env);
		}
		catch (IOException e) {
			throw new ConfigurationException("Failed to read configuration " + path, e);
		}
	}

	public static Nl2SqlProperties load(InputStream in, Map<String, String> env) {
		Object document = new Yaml().load(in);
		if (document == null) {
			return fromMap(Map.of(), env);
		}
		if (!(document instanceof Map<?, ?> map)) {
			throw new ConfigurationException("Configuration root must be a mapping");
		}
		return fromMap(map, env);
	}

	static Nl2SqlProperties fromMap(Map<?, ?> root, Map<String, String> env) {
		Map<?, ?> llm = section(root, "llm");
		Map<?, ?> workflow = section(root, "workflow");
		Map<?, ?> sandbox = section(root, "sandbox");
		Map<?, ?> memory = section(root, "memory");
		Map<?, ?> catalog = section(root, "catalog");
		try {
			return new Nl2SqlProperties(
					completionSettings(llm, env),
					WorkflowConfig.builder()
							.maxRegenerations(intValue(workflow, "max_regenerations", WorkflowConfig.DEFAULT_MAX_REGENERATIONS))
							.maxClarificationRounds(intValue(workflow, "max_clarification_rounds",
									WorkflowConfig.DEFAULT_MAX_CLARIFICATION_ROUNDS))
							.memoryWindow(intValue(workflow, "memory_window", WorkflowConfig.DEFAULT_MEMORY_WINDOW))
							.maxSteps(intValue(workflow, "max_steps", WorkflowConfig.DEFAULT_MAX_STEPS))
							.failOnClarificationExhausted(boolValue(workflow, "fail_on_clarification_exhausted", false))
							.build(),
					sandboxPolicy(sandbox),
					ContextMemoryConfig.builder()
							.maxEntries(intValue(memory, "max_entries", ContextMemoryConfig.DEFAULT_MAX_ENTRIES))
							.ttl(Duration.ofMinutes(intValue(memory, "ttl_minutes",
									(int) ContextMemoryConfig.DEFAULT_TTL.toMinutes())))
							.build(),
					stringValue(catalog, "path", null));
		}
		catch (IllegalArgumentException e) {
			throw new ConfigurationException("Invalid configuration: " + e.getMessage(), e);
		}
	}

	private static CompletionSettings completionSettings(Map<?, ?> llm, Map<String, String> env) {
		LlmProvider provider = LlmProvider.fromName(firstNonBlank(env.get("LLM_PROVIDER"), stringValue(llm, "provider", null)));
		int timeoutSeconds = intValue(llm, "timeout_seconds", (int) CompletionSettings.DEFAULT_TIMEOUT.toSeconds());
		int maxAttempts = intValue(llm, "max_attempts", CompletionSettings.DEFAULT_MAX_ATTEMPTS);
		if (env.get("LLM_TIMEOUT") != null) {
			timeoutSeconds = parseInt("LLM_TIMEOUT", env.get("LLM_TIMEOUT"));
		}
		if (env.get("MAX_RETRIES") != null) {
			maxAttempts = parseInt("MAX_RETRIES", env.get("MAX_RETRIES"));
		}
		return CompletionSettings.builder()
				.provider(provider)
				.baseUrl(firstNonBlank(env.get("LLM_BASE_URL"), stringValue(llm, "base_url", null)))
				.model(firstNonBlank(env.get("LLM_MODEL"), stringValue(llm, "model", null)))
				.apiKey(firstNonBlank(env.get(provider.apiKeyVariable()), stringValue(llm, "api_key", null)))
				.temperature(doubleValue(llm, "temperature", CompletionSettings.DEFAULT_TEMPERATURE))
				.maxTokens(intValue(llm, "max_tokens", CompletionSettings.DEFAULT_MAX_TOKENS))
				.timeout(Duration.ofSeconds(timeoutSeconds))
				.maxAttempts(maxAttempts)
				.build();
	}

	private static SandboxPolicy sandboxPolicy(Map<?, ?> sandbox) {
		SandboxPolicy.Builder builder = SandboxPolicy.builder()
				.defaultLimit(intValue(sandbox, "default_limit", SandboxPolicy.DEFAULT_LIMIT))
				.maxRows(intValue(sandbox, "max_rows", SandboxPolicy.DEFAULT_MAX_ROWS))
				.statementTimeout(Duration.ofSeconds(intValue(sandbox, "statement_timeout_seconds",
						(int) SandboxPolicy.DEFAULT_STATEMENT_TIMEOUT.toSeconds())));
		Object extra = sandbox.get("extra_forbidden_keywords");
		if (extra instanceof List<?> keywords) {
			keywords.forEach(k -> builder.addForbiddenKeyword(String.valueOf(k).toLowerCase(Locale.ROOT)));
		}
		return builder.build();
	}

	private static Map<?, ?> section(Map<?, ?> root, String name) {
		Object value = root.get(name);
		if (value == null) {
			return Map.of();
		}
		if (value instanceof Map<?, ?> map) {
			return map;
		}
		throw new ConfigurationException("Section '" + name + "' must be a mapping");
	}

	private static String stringValue(Map<?, ?> section, String key, String defaultValue) {
		Object value = section.get(key);
		return value != null ? value.toString() : defaultValue;
	}

	private static int intValue(Map<?, ?> section, String key, int defaultValue) {
		Object value = section.get(key);
		if (value == null) {
			return defaultValue;
		}
		if (value instanceof Number number) {
			return number.intValue();
		}
		return parseInt(key, value.toString());
	}

	private static double doubleValue(Map<?, ?> section, String key, double defaultValue) {
		Object value = section.get(key);
		if (value == null) {
			return defaultValue;
		}
		if (value instanceof Number number) {
			return number.doubleValue();
		}
		try {
			return Double.parseDouble(value.toString().trim());
		}
		catch (NumberFormatException e) {
			throw new ConfigurationException("'" + key + "' must be a number, got: " + value, e);
		}
	}

	private static boolean boolValue(Map<?, ?> section, String key, boolean defaultValue) {
		Object value = section.get(key);
		if (value == null) {
			return defaultValue;
		}
		return value instanceof Boolean b ? b : Boolean.parseBoolean(value.toString().trim());
	}

	private static int parseInt(String key, String value) {
		try {
			return Integer.parseInt(value.trim());
		}
		catch (NumberFormatException e) {
			throw new ConfigurationException("'" + key + "' must be an integer, got: " + value, e);
		}
	}

	private static String firstNonBlank(String first, String second) {
		if (first != null && !first.isBlank()) {
			return first;
		}
		return second != null && !second.isBlank() ? second : null;
	}

	/**
	 * Thrown for unreadable or malformed configuration.
	 */
	public static class ConfigurationException extends RuntimeException {

		public ConfigurationException(String message) {
			super(message);
		}

		public ConfigurationException(String message, Throwable cause) {
			super(message, cause);
		}
	}
}

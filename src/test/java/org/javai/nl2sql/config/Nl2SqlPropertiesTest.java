package org.javai.nl2sql.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import org.javai.nl2sql.config.Nl2SqlProperties.ConfigurationException;
import org.javai.nl2sql.llm.CompletionSettings;
import org.javai.nl2sql.llm.LlmProvider;
import org.javai.nl2sql.workflow.WorkflowConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class Nl2SqlPropertiesTest {

	private static final String DOCUMENT = """
			llm:
			  provider: qwen
			  model: qwen-max
			  temperature: 0.2
			  timeout_seconds: 20
			  max_attempts: 2
			  api_key: from-file
			workflow:
			  max_regenerations: 5
			  max_clarification_rounds: 1
			  fail_on_clarification_exhausted: true
			sandbox:
			  default_limit: 100
			  max_rows: 50
			  statement_timeout_seconds: 5
			  extra_forbidden_keywords: [VACUUM]
			memory:
			  max_entries: 4
			  ttl_minutes: 10
			catalog:
			  path: /data/chinook.yaml
			""";

	private static InputStream yaml(String text) {
		return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
	}

	@Test
	void readsEverySection() {
		Nl2SqlProperties properties = Nl2SqlProperties.load(yaml(DOCUMENT), Map.of());

		CompletionSettings completion = properties.completion();
		assertThat(completion.provider()).isEqualTo(LlmProvider.QWEN);
		assertThat(completion.model()).isEqualTo("qwen-max");
		assertThat(completion.baseUrl()).isEqualTo(LlmProvider.QWEN.defaultBaseUrl());
		assertThat(completion.temperature()).isEqualTo(0.2);
		assertThat(completion.timeout()).isEqualTo(Duration.ofSeconds(20));
		assertThat(completion.maxAttempts()).isEqualTo(2);
		assertThat(completion.apiKey()).isEqualTo("from-file");

		assertThat(properties.workflow().maxRegenerations()).isEqualTo(5);
		assertThat(properties.workflow().maxClarificationRounds()).isEqualTo(1);
		assertThat(properties.workflow().failOnClarificationExhausted()).isTrue();

		assertThat(properties.sandbox().effectiveLimit()).isEqualTo(50);
		assertThat(properties.sandbox().statementTimeout()).isEqualTo(Duration.ofSeconds(5));
		assertThat(properties.sandbox().forbiddenKeywords()).contains("vacuum", "drop");

		assertThat(properties.memory().maxEntries()).isEqualTo(4);
		assertThat(properties.memory().ttl()).isEqualTo(Duration.ofMinutes(10));
		assertThat(properties.catalogPath()).isEqualTo("/data/chinook.yaml");
	}

	@Test
	void emptyDocumentGivesDefaults() {
		Nl2SqlProperties properties = Nl2SqlProperties.load(yaml(""), Map.of());

		assertThat(properties.completion().provider()).isEqualTo(LlmProvider.DEEPSEEK);
		assertThat(properties.completion().model()).isEqualTo("deepseek-chat");
		assertThat(properties.completion().hasApiKey()).isFalse();
		assertThat(properties.workflow()).isEqualTo(WorkflowConfig.defaults());
		assertThat(properties.sandbox().effectiveLimit()).isEqualTo(200);
		assertThat(properties.catalogPath()).isNull();
	}

	@Test
	void apiKeyNeverAppearsInToString() {
		Nl2SqlProperties properties = Nl2SqlProperties.load(yaml(DOCUMENT), Map.of());

		assertThat(properties.completion().toString()).doesNotContain("from-file").contains("apiKey=****");
	}

	@Nested
	@DisplayName("environment overrides")
	class EnvironmentOverrides {

		@Test
		void environmentWinsOverFile() {
			Map<String, String> env = Map.of(
					"LLM_PROVIDER", "openai",
					"LLM_MODEL", "gpt-4o",
					"LLM_BASE_URL", "http://localhost:8080",
					"LLM_TIMEOUT", "45",
					"MAX_RETRIES", "4",
					"OPENAI_API_KEY", "sk-env");

			CompletionSettings completion = Nl2SqlProperties.load(yaml(DOCUMENT), env).completion();

			assertThat(completion.provider()).isEqualTo(LlmProvider.OPENAI);
			assertThat(completion.model()).isEqualTo("gpt-4o");
			assertThat(completion.baseUrl()).isEqualTo("http://localhost:8080");
			assertThat(completion.timeout()).isEqualTo(Duration.ofSeconds(45));
			assertThat(completion.maxAttempts()).isEqualTo(4);
			assertThat(completion.apiKey()).isEqualTo("sk-env");
		}

		@Test
		void keyVariableFollowsSelectedProvider() {
			Map<String, String> env = Map.of("DEEPSEEK_API_KEY", "ds-key", "QWEN_API_KEY", "qw-key");

			assertThat(Nl2SqlProperties.fromMap(Map.of(), env).completion().apiKey()).isEqualTo("ds-key");
			assertThat(Nl2SqlProperties.load(yaml(DOCUMENT), env).completion().apiKey()).isEqualTo("qw-key");
		}

		@Test
		void blankVariablesAreIgnored() {
			CompletionSettings completion = Nl2SqlProperties.load(yaml(DOCUMENT), Map.of("LLM_MODEL", " ")).completion();

			assertThat(completion.model()).isEqualTo("qwen-max");
		}
	}

	@Nested
	@DisplayName("invalid configuration")
	class Invalid {

		@Test
		void unknownProvider() {
			assertThatThrownBy(() -> Nl2SqlProperties.fromMap(Map.of(), Map.of("LLM_PROVIDER", "claude")))
					.isInstanceOf(ConfigurationException.class)
					.hasMessageContaining("Unknown LLM provider 'claude'");
		}

		@Test
		void nonNumericTimeout() {
			assertThatThrownBy(() -> Nl2SqlProperties.fromMap(Map.of(), Map.of("LLM_TIMEOUT", "soon")))
					.isInstanceOf(ConfigurationException.class)
					.hasMessage("'LLM_TIMEOUT' must be an integer, got: soon");
		}

		@Test
		void outOfRangeValue() {
			assertThatThrownBy(() -> Nl2SqlProperties.load(yaml("sandbox:\n  max_rows: 0\n"), Map.of()))
					.isInstanceOf(ConfigurationException.class)
					.hasMessage("Invalid configuration: maxRows must be >= 1");
		}

		@Test
		void sectionMustBeMapping() {
			assertThatThrownBy(() -> Nl2SqlProperties.load(yaml("workflow: 3\n"), Map.of()))
					.isInstanceOf(ConfigurationException.class)
					.hasMessage("Section 'workflow' must be a mapping");
		}

		@Test
		void rootMustBeMapping() {
			assertThatThrownBy(() -> Nl2SqlProperties.load(yaml("- a\n- b\n"), Map.of()))
					.isInstanceOf(ConfigurationException.class)
					.hasMessage("Configuration root must be a mapping");
		}
	}
}

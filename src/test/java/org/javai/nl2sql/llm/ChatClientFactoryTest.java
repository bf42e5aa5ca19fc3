package org.javai.nl2sql.llm;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ChatClientFactoryTest {

	@Nested
	@DisplayName("settings")
	class Settings {

		@Test
		void defaultsFollowProvider() {
			CompletionSettings settings = CompletionSettings.builder().provider(LlmProvider.QWEN).build();

			assertThat(settings.baseUrl()).isEqualTo(LlmProvider.QWEN.defaultBaseUrl());
			assertThat(settings.model()).isEqualTo("qwen-plus");
			assertThat(settings.timeout()).isEqualTo(Duration.ofSeconds(30));
			assertThat(settings.temperature()).isZero();
		}

		@Test
		void toStringMasksApiKey() {
			CompletionSettings settings = CompletionSettings.builder().apiKey("sk-secret-123").build();

			assertThat(settings.toString()).doesNotContain("sk-secret-123").contains("****");
		}

		@Test
		void providerNamesAreCaseInsensitive() {
			assertThat(LlmProvider.fromName("OpenAI")).isEqualTo(LlmProvider.OPENAI);
			assertThat(LlmProvider.fromName(null)).isEqualTo(LlmProvider.DEEPSEEK);
			assertThat(LlmProvider.DEEPSEEK.apiKeyVariable()).isEqualTo("DEEPSEEK_API_KEY");
			assertThatThrownBy(() -> LlmProvider.fromName("llama")).isInstanceOf(IllegalArgumentException.class);
		}
	}

	@Test
	void refusesToBuildWithoutApiKey() {
		CompletionSettings settings = CompletionSettings.defaults();

		assertThatThrownBy(() -> ChatClientFactory.createChatClient(settings))
				.isInstanceOf(IllegalStateException.class)
				.hasMessageContaining("DEEPSEEK_API_KEY");
	}

	@Test
	void buildsClientWithoutContactingProvider() {
		CompletionSettings settings = CompletionSettings.builder()
				.provider(LlmProvider.OPENAI)
				.apiKey("test-key")
				.build();

		try (ChatClientCompletionClient client = ChatClientFactory.createCompletionClient(settings)) {
			assertThat(client).isNotNull();
		}
	}
}

package org.javai.nl2sql.llm;

import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.OpenAiApi;

/**
 * Builds Spring AI chat clients and completion clients from {@link CompletionSettings}.
 */
public final class ChatClientFactory {

	private static final Logger logger = LoggerFactory.getLogger(ChatClientFactory.class);

	private ChatClientFactory() {
	}

	public static ChatClient createChatClient(CompletionSettings settings) {
		Objects.requireNonNull(settings, "settings must not be null");
		if (!settings.hasApiKey()) {
			throw new IllegalStateException(
					"No API key configured for provider " + settings.provider() + "; set " + settings.provider().apiKeyVariable());
		}
		OpenAiApi openAiApi = OpenAiApi.builder()
				.baseUrl(settings.baseUrl())
				.apiKey(settings.apiKey())
				.build();
		OpenAiChatOptions options = OpenAiChatOptions.builder()
				.model(settings.model())
				.temperature(settings.temperature())
				.maxTokens(settings.maxTokens())
				.build();
		OpenAiChatModel chatModel = OpenAiChatModel.builder()
				.openAiApi(openAiApi)
				.defaultOptions(options)
				.build();
		logger.info("Created chat client for {}", settings);
		return ChatClient.builder(Objects.requireNonNull(chatModel))
				.defaultOptions(Objects.requireNonNull(options))
				.build();
	}

	/**
	 * A completion client with a single tier that makes up to
	 * {@link CompletionSettings#maxAttempts()} attempts within the configured timeout.
	 */
	public static ChatClientCompletionClient createCompletionClient(CompletionSettings settings) {
		ChatClient chatClient = createChatClient(settings);
		return new ChatClientCompletionClient(
				List.of(new CompletionTier(chatClient, settings.maxAttempts(), settings.model())),
				settings.timeout());
	}
}

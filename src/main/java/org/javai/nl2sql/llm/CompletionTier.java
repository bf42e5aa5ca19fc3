package org.javai.nl2sql.llm;

import org.springframework.ai.chat.client.ChatClient;

/**
 * A chat client with its maximum attempt count; one tier of the retry/fallback chain.
 * Up to {@code maxAttempts} calls are made on this client before the next tier is
 * tried.
 *
 * @param chatClient the Spring AI ChatClient
 * @param maxAttempts attempts before moving to the next tier (≥1)
 * @param modelId optional identifier for logs (e.g. "deepseek-chat")
 */
public record CompletionTier(
		ChatClient chatClient,
		int maxAttempts,
		String modelId
) {

	public CompletionTier {
		if (chatClient == null) {
			throw new IllegalArgumentException("chatClient must not be null");
		}
		if (maxAttempts < 1) {
			throw new IllegalArgumentException("maxAttempts must be >= 1");
		}
	}

	public CompletionTier(ChatClient chatClient, String modelId) {
		this(chatClient, 1, modelId);
	}
}

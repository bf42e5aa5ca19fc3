package org.javai.nl2sql.llm;

import java.util.Objects;

/**
 * A single text-completion call.
 *
 * @param purpose short tag for logs and metrics, e.g. "generate" or "critique"
 * @param systemPrompt instructions for the model (may be blank)
 * @param userPrompt the rendered task
 */
public record CompletionRequest(String purpose, String systemPrompt, String userPrompt) {

	public CompletionRequest {
		Objects.requireNonNull(purpose, "purpose must not be null");
		Objects.requireNonNull(userPrompt, "userPrompt must not be null");
		systemPrompt = systemPrompt != null ? systemPrompt : "";
	}
}

package org.javai.nl2sql.llm;

/**
 * Text-in, text-out access to a language model.
 *
 * <p>Implementations must bound every call in time: a call either returns text,
 * throws {@link CompletionTimeoutException} once its budget is spent, or throws
 * {@link CompletionException} for any other failure.</p>
 */
public interface TextCompletionClient {

	String complete(CompletionRequest request);
}

package org.javai.nl2sql.llm;

/**
 * Thrown when a language-model call fails.
 */
public class CompletionException extends RuntimeException {

	public CompletionException(String message) {
		super(message);
	}

	public CompletionException(String message, Throwable cause) {
		super(message, cause);
	}
}

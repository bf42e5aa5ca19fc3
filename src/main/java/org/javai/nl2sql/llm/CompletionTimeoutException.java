package org.javai.nl2sql.llm;

import java.time.Duration;

/**
 * Thrown when a language-model call exceeds its wall-clock budget. The call has been
 * cancelled by the time this is thrown.
 */
public class CompletionTimeoutException extends CompletionException {

	private final Duration timeout;

	public CompletionTimeoutException(String purpose, Duration timeout) {
		super("Completion '" + purpose + "' timed out after " + timeout.toMillis() + " ms");
		this.timeout = timeout;
	}

	public Duration timeout() {
		return timeout;
	}
}

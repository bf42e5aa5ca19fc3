package org.javai.nl2sql.llm;

/**
 * Record of one call made by {@link ChatClientCompletionClient}.
 *
 * @param purpose the request purpose
 * @param modelId model of the tier (may be null)
 * @param tierIndex 0-based tier index
 * @param attemptWithinTier 1-based attempt number within the tier
 * @param outcome how the call ended
 * @param durationMillis wall-clock time of the call
 * @param errorDetails failure message, null on success
 */
public record CompletionAttempt(
		String purpose,
		String modelId,
		int tierIndex,
		int attemptWithinTier,
		Outcome outcome,
		long durationMillis,
		String errorDetails
) {

	public enum Outcome {
		SUCCESS,
		EMPTY_RESPONSE,
		TIMEOUT,
		ERROR
	}

	public CompletionAttempt {
		if (tierIndex < 0) {
			throw new IllegalArgumentException("tierIndex must be >= 0");
		}
		if (attemptWithinTier < 1) {
			throw new IllegalArgumentException("attemptWithinTier must be >= 1");
		}
		if (outcome == null) {
			throw new IllegalArgumentException("outcome must not be null");
		}
	}

	public boolean isSuccess() {
		return outcome == Outcome.SUCCESS;
	}
}

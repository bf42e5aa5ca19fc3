package org.javai.nl2sql.workflow;

/**
 * Stable reason codes exposed to callers. The message is safe to show to users.
 */
public enum ErrorCode {
	INTENT_PARSE_DEFAULT("The question could not be classified; it was answered as a general query."),
	SYNTAX_VALIDATION_ERROR("The generated SQL was not valid."),
	SANDBOX_DENIED("The generated SQL was refused by the security policy."),
	JOIN_PATH_NOT_FOUND("The tables in the question are not connected by foreign keys."),
	EXECUTION_ERROR("The database could not run the query."),
	COLLABORATOR_TIMEOUT("The language model did not respond in time."),
	COLLABORATOR_ERROR("The language model could not be reached."),
	MAX_REGENERATIONS_EXCEEDED("No valid query could be produced after repeated attempts."),
	MAX_CLARIFICATION_ROUNDS_EXCEEDED("The question is still ambiguous after the allowed number of clarifications.");

	private final String message;

	ErrorCode(String message) {
		this.message = message;
	}

	public String message() {
		return message;
	}
}

package org.javai.nl2sql.workflow;

/**
 * States of a single question's run through the workflow.
 */
public enum WorkflowState {
	START,
	INTENT_PARSED,
	GENERATED,
	CLARIFY_NEEDED,
	AWAITING_USER,
	VALIDATING,
	VALID,
	INVALID,
	CRITIQUING,
	SANDBOX_CHECK,
	EXECUTING,
	ANSWERING,
	DONE,
	FAILED;

	public boolean isTerminal() {
		return this == DONE || this == FAILED;
	}

	/**
	 * @return true if the run is parked until the user answers a clarification
	 */
	public boolean isSuspended() {
		return this == AWAITING_USER;
	}
}

package org.javai.nl2sql.workflow;

import java.util.List;
import org.javai.nl2sql.execute.QueryResult;

/**
 * What a caller gets back from a question or a clarification answer.
 *
 * @param sessionId the session
 * @param status DONE, FAILED or AWAITING_USER
 * @param candidateSql the last SQL candidate
 * @param executedSql the statement actually sent to the database, null if none was
 * @param validationPassed whether the last candidate passed the syntax check
 * @param regenerationCount critique and regenerate cycles used
 * @param clarificationRoundCount clarification answers merged
 * @param executionResult rows returned, null if nothing was executed
 * @param answer the answer text; null while awaiting clarification
 * @param chatReply true if the answer is a conversational reply
 * @param needsClarification true if the caller must answer {@code clarificationQuestion}
 * @param clarificationQuestion the question to show the user
 * @param clarificationOptions enumerated answers; a numeric reply selects one
 * @param reasonCode why the run failed, or a non-fatal notice; null otherwise
 * @param reasonMessage user-facing text for {@code reasonCode}
 * @param lastDiagnostic the last problem seen, for failed runs
 */
public record QueryResponse(
		String sessionId,
		WorkflowState status,
		String candidateSql,
		String executedSql,
		boolean validationPassed,
		int regenerationCount,
		int clarificationRoundCount,
		QueryResult executionResult,
		String answer,
		boolean chatReply,
		boolean needsClarification,
		String clarificationQuestion,
		List<String> clarificationOptions,
		ErrorCode reasonCode,
		String reasonMessage,
		String lastDiagnostic
) {

	public QueryResponse {
		clarificationOptions = clarificationOptions != null ? List.copyOf(clarificationOptions) : List.of();
	}

	public static QueryResponse from(SessionState state) {
		ErrorCode code = reasonCodeOf(state);
		String reasonMessage = state.failure() != null ? state.failure().message() : code != null ? code.message() : null;
		boolean clarify = state.needsClarification();
		String answer = state.status() == WorkflowState.FAILED && state.failure() != null
				? state.failure().message()
				: state.finalAnswer();
		return new QueryResponse(
				state.sessionId(),
				state.status(),
				state.failure() != null && state.failure().lastSql() != null ? state.failure().lastSql() : state.candidateSql(),
				state.sandboxDecision() != null && state.sandboxDecision().allowed() && state.executionResult() != null
						? state.sandboxDecision().normalizedSql()
						: null,
				state.validationPassed(),
				state.regenerationCount(),
				state.clarificationRoundCount(),
				state.executionResult(),
				clarify ? null : answer,
				state.chatReply(),
				clarify,
				clarify ? state.pendingClarification().question() : null,
				clarify ? state.pendingClarification().options() : List.of(),
				code,
				reasonMessage,
				state.failure() != null ? state.failure().lastDiagnostic() : null);
	}

	/**
	 * The failure code of a failed run; INTENT_PARSE_DEFAULT for a run answered from a
	 * default intent; otherwise null.
	 */
	static ErrorCode reasonCodeOf(SessionState state) {
		if (state.failure() != null) {
			return state.failure().code();
		}
		if (state.status() == WorkflowState.DONE && !state.chatReply()
				&& state.intent() != null && state.intent().defaulted()) {
			return ErrorCode.INTENT_PARSE_DEFAULT;
		}
		return null;
	}

	public boolean isDone() {
		return status == WorkflowState.DONE;
	}

	public boolean isFailed() {
		return status == WorkflowState.FAILED;
	}
}

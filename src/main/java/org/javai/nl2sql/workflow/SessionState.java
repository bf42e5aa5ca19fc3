package org.javai.nl2sql.workflow;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.javai.nl2sql.clarify.AmbiguityFinding;
import org.javai.nl2sql.clarify.ClarificationRequest;
import org.javai.nl2sql.execute.QueryResult;
import org.javai.nl2sql.intent.Intent;
import org.javai.nl2sql.join.JoinPath;
import org.javai.nl2sql.sandbox.SandboxDecision;
import org.javai.nl2sql.validate.ValidationResult;

/**
 * Everything known about one question while it moves through the workflow.
 *
 * <p>Immutable; every transition returns a new value. Fields that a state has not
 * reached yet are null.</p>
 *
 * @param sessionId the conversation this question belongs to
 * @param turnIndex position of the question in the conversation, starting at 1
 * @param rawQuestion the question as asked
 * @param workingQuestion the question with clarification answers merged in
 * @param intent parsed intent
 * @param matchedTables catalog tables the question mentions
 * @param joinPath join path for the matched tables
 * @param candidateSql the current SQL candidate
 * @param validationResult syntax check of {@code candidateSql}
 * @param regenerationCount critique and regenerate cycles used
 * @param clarificationRoundCount clarification answers merged
 * @param critique rationale of the last critique
 * @param pendingFinding ambiguity awaiting a clarification question
 * @param pendingClarification question put to the user while suspended
 * @param sandboxDecision last sandbox decision
 * @param executionResult rows returned by the database
 * @param finalAnswer answer text for the user
 * @param chatReply true if the model answered conversationally without SQL
 * @param status current workflow state
 * @param lastErrorCode code of the last step failure, or null
 * @param lastDiagnostic detail of the last step failure that callers may see, or null
 * @param lastErrorDetail collaborator text about the last failure; it feeds the repair
 *        prompt only and is never reported to callers
 * @param failure set when {@code status} is FAILED
 * @param stepTimings time spent in each step so far, in execution order
 */
public record SessionState(
		String sessionId,
		int turnIndex,
		String rawQuestion,
		String workingQuestion,
		Intent intent,
		List<String> matchedTables,
		JoinPath joinPath,
		String candidateSql,
		ValidationResult validationResult,
		int regenerationCount,
		int clarificationRoundCount,
		String critique,
		AmbiguityFinding pendingFinding,
		ClarificationRequest pendingClarification,
		SandboxDecision sandboxDecision,
		QueryResult executionResult,
		String finalAnswer,
		boolean chatReply,
		WorkflowState status,
		ErrorCode lastErrorCode,
		String lastDiagnostic,
		String lastErrorDetail,
		Failure failure,
		List<StepTiming> stepTimings
) {

	public SessionState {
		Objects.requireNonNull(sessionId, "sessionId must not be null");
		Objects.requireNonNull(rawQuestion, "rawQuestion must not be null");
		Objects.requireNonNull(workingQuestion, "workingQuestion must not be null");
		Objects.requireNonNull(status, "status must not be null");
		matchedTables = matchedTables != null ? List.copyOf(matchedTables) : List.of();
		stepTimings = stepTimings != null ? List.copyOf(stepTimings) : List.of();
		if (regenerationCount < 0 || clarificationRoundCount < 0) {
			throw new IllegalArgumentException("counters must not be negative");
		}
	}

	/**
	 * Creates the state of a newly asked question.
	 */
	public static SessionState start(String sessionId, int turnIndex, String question) {
		Objects.requireNonNull(question, "question must not be null");
		return new Builder(sessionId, turnIndex, question, question).build();
	}

	public Builder toBuilder() {
		return new Builder(this);
	}

	public boolean isTerminal() {
		return status.isTerminal();
	}

	public boolean needsClarification() {
		return status == WorkflowState.AWAITING_USER && pendingClarification != null;
	}

	public boolean validationPassed() {
		return validationResult != null && validationResult.valid();
	}

	public SessionState withStepTiming(StepTiming timing) {
		return toBuilder().addStepTiming(timing).build();
	}

	/**
	 * @return milliseconds spent in all steps so far
	 */
	public long elapsedMillis() {
		return stepTimings.stream().mapToLong(StepTiming::elapsedMillis).sum();
	}

	/**
	 * Mutable copy used by {@link Transitions} to derive the next state.
	 */
	public static final class Builder {
		private final String sessionId;
		private final int turnIndex;
		private final String rawQuestion;
		private String workingQuestion;
		private Intent intent;
		private List<String> matchedTables = List.of();
		private JoinPath joinPath;
		private String candidateSql;
		private ValidationResult validationResult;
		private int regenerationCount;
		private int clarificationRoundCount;
		private String critique;
		private AmbiguityFinding pendingFinding;
		private ClarificationRequest pendingClarification;
		private SandboxDecision sandboxDecision;
		private QueryResult executionResult;
		private String finalAnswer;
		private boolean chatReply;
		private WorkflowState status = WorkflowState.START;
		private ErrorCode lastErrorCode;
		private String lastDiagnostic;
		private String lastErrorDetail;
		private Failure failure;
		private List<StepTiming> stepTimings = List.of();

		private Builder(String sessionId, int turnIndex, String rawQuestion, String workingQuestion) {
			this.sessionId = sessionId;
			this.turnIndex = turnIndex;
			this.rawQuestion = rawQuestion;
			this.workingQuestion = workingQuestion;
		}

		private Builder(SessionState s) {
			this(s.sessionId, s.turnIndex, s.rawQuestion, s.workingQuestion);
			this.intent = s.intent;
			this.matchedTables = s.matchedTables;
			this.joinPath = s.joinPath;
			this.candidateSql = s.candidateSql;
			this.validationResult = s.validationResult;
			this.regenerationCount = s.regenerationCount;
			this.clarificationRoundCount = s.clarificationRoundCount;
			this.critique = s.critique;
			this.pendingFinding = s.pendingFinding;
			this.pendingClarification = s.pendingClarification;
			this.sandboxDecision = s.sandboxDecision;
			this.executionResult = s.executionResult;
			this.finalAnswer = s.finalAnswer;
			this.chatReply = s.chatReply;
			this.status = s.status;
			this.lastErrorCode = s.lastErrorCode;
			this.lastDiagnostic = s.lastDiagnostic;
			this.lastErrorDetail = s.lastErrorDetail;
			this.failure = s.failure;
			this.stepTimings = s.stepTimings;
		}

		public Builder workingQuestion(String workingQuestion) {
			this.workingQuestion = workingQuestion;
			return this;
		}

		public Builder intent(Intent intent) {
			this.intent = intent;
			return this;
		}

		public Builder matchedTables(List<String> matchedTables) {
			this.matchedTables = matchedTables;
			return this;
		}

		public Builder joinPath(JoinPath joinPath) {
			this.joinPath = joinPath;
			return this;
		}

		public Builder candidateSql(String candidateSql) {
			this.candidateSql = candidateSql;
			return this;
		}

		public Builder validationResult(ValidationResult validationResult) {
			this.validationResult = validationResult;
			return this;
		}

		public Builder regenerationCount(int regenerationCount) {
			this.regenerationCount = regenerationCount;
			return this;
		}

		public Builder clarificationRoundCount(int clarificationRoundCount) {
			this.clarificationRoundCount = clarificationRoundCount;
			return this;
		}

		public Builder critique(String critique) {
			this.critique = critique;
			return this;
		}

		public Builder pendingFinding(AmbiguityFinding pendingFinding) {
			this.pendingFinding = pendingFinding;
			return this;
		}

		public Builder pendingClarification(ClarificationRequest pendingClarification) {
			this.pendingClarification = pendingClarification;
			return this;
		}

		public Builder sandboxDecision(SandboxDecision sandboxDecision) {
			this.sandboxDecision = sandboxDecision;
			return this;
		}

		public Builder executionResult(QueryResult executionResult) {
			this.executionResult = executionResult;
			return this;
		}

		public Builder finalAnswer(String finalAnswer) {
			this.finalAnswer = finalAnswer;
			return this;
		}

		public Builder chatReply(boolean chatReply) {
			this.chatReply = chatReply;
			return this;
		}

		public Builder status(WorkflowState status) {
			this.status = status;
			return this;
		}

		public Builder lastError(ErrorCode code, String diagnostic) {
			return lastError(code, diagnostic, null);
		}

		public Builder lastError(ErrorCode code, String diagnostic, String detail) {
			this.lastErrorCode = code;
			this.lastDiagnostic = diagnostic;
			this.lastErrorDetail = detail;
			return this;
		}

		public Builder failure(Failure failure) {
			this.failure = failure;
			return this;
		}

		public Builder addStepTiming(StepTiming timing) {
			List<StepTiming> timings = new ArrayList<>(stepTimings);
			timings.add(Objects.requireNonNull(timing, "timing must not be null"));
			this.stepTimings = timings;
			return this;
		}

		public SessionState build() {
			return new SessionState(sessionId, turnIndex, rawQuestion, workingQuestion, intent, matchedTables,
					joinPath, candidateSql, validationResult, regenerationCount, clarificationRoundCount, critique,
					pendingFinding, pendingClarification, sandboxDecision, executionResult, finalAnswer, chatReply,
					status, lastErrorCode, lastDiagnostic, lastErrorDetail, failure, stepTimings);
		}
	}
}

package org.javai.nl2sql.workflow;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.javai.nl2sql.intent.Intent;
import org.javai.nl2sql.sandbox.SandboxDecision;

/**
 * One completed turn, as written to the turn log.
 */
public record TurnRecord(
		String sessionId,
		int turnIndex,
		Instant timestamp,
		String question,
		String workingQuestion,
		Intent intent,
		String candidateSql,
		boolean validationPassed,
		int regenerationCount,
		int clarificationRoundCount,
		SandboxSummary sandboxDecision,
		String executionSummary,
		WorkflowState status,
		ErrorCode reasonCode,
		Timings timings
) {

	/**
	 * Where the turn spent its time.
	 *
	 * @param steps every step in execution order
	 * @param perState total milliseconds per state, in first-seen order
	 * @param slowestState the state with the largest total, null if no step ran
	 * @param totalMillis time spent in all steps
	 */
	public record Timings(List<StepTiming> steps, Map<WorkflowState, Long> perState, WorkflowState slowestState,
			long totalMillis) {

		static Timings of(List<StepTiming> steps) {
			Map<WorkflowState, Long> perState = new LinkedHashMap<>();
			steps.forEach(t -> perState.merge(t.state(), t.elapsedMillis(), Long::sum));
			WorkflowState slowest = null;
			long slowestMillis = -1;
			for (Map.Entry<WorkflowState, Long> entry : perState.entrySet()) {
				if (entry.getValue() > slowestMillis) {
					slowest = entry.getKey();
					slowestMillis = entry.getValue();
				}
			}
			long total = steps.stream().mapToLong(StepTiming::elapsedMillis).sum();
			return new Timings(List.copyOf(steps), Collections.unmodifiableMap(perState), slowest, total);
		}
	}

	/**
	 * @param allowed whether the statement was allowed
	 * @param reasonCode deny reason, null when allowed
	 * @param normalizedSql the statement sent to the database, null when denied
	 * @param referencedIdentifiers tables and columns referenced
	 */
	public record SandboxSummary(boolean allowed, String reasonCode, String normalizedSql,
			List<String> referencedIdentifiers) {

		static SandboxSummary of(SandboxDecision decision) {
			if (decision == null) {
				return null;
			}
			return new SandboxSummary(decision.allowed(),
					decision.denyReason() != null ? decision.denyReason().name() : null,
					decision.normalizedSql(), decision.referencedIdentifiers());
		}
	}

	public static TurnRecord of(SessionState state, Instant at) {
		String execution;
		if (state.executionResult() != null) {
			execution = state.executionResult().rowCount() + " rows"
					+ (state.executionResult().truncated() ? " (truncated)" : "");
		}
		else if (state.chatReply()) {
			execution = "chat reply";
		}
		else {
			execution = "not executed";
		}
		return new TurnRecord(state.sessionId(), state.turnIndex(), at, state.rawQuestion(), state.workingQuestion(),
				state.intent(), state.candidateSql(), state.validationPassed(), state.regenerationCount(),
				state.clarificationRoundCount(), SandboxSummary.of(state.sandboxDecision()), execution, state.status(),
				QueryResponse.reasonCodeOf(state), Timings.of(state.stepTimings()));
	}
}

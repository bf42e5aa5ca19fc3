package org.javai.nl2sql.workflow;

import java.util.Objects;
import org.javai.nl2sql.sandbox.SandboxDecision;
import org.javai.nl2sql.workflow.WorkflowEvent.Advance;
import org.javai.nl2sql.workflow.WorkflowEvent.AmbiguityChecked;
import org.javai.nl2sql.workflow.WorkflowEvent.Answered;
import org.javai.nl2sql.workflow.WorkflowEvent.ChatReplied;
import org.javai.nl2sql.workflow.WorkflowEvent.ClarificationAnswered;
import org.javai.nl2sql.workflow.WorkflowEvent.ClarificationPrepared;
import org.javai.nl2sql.workflow.WorkflowEvent.Executed;
import org.javai.nl2sql.workflow.WorkflowEvent.IntentParsed;
import org.javai.nl2sql.workflow.WorkflowEvent.Regenerated;
import org.javai.nl2sql.workflow.WorkflowEvent.SandboxChecked;
import org.javai.nl2sql.workflow.WorkflowEvent.SqlGenerated;
import org.javai.nl2sql.workflow.WorkflowEvent.StepFailed;
import org.javai.nl2sql.workflow.WorkflowEvent.Validated;

/**
 * The workflow's transition function.
 *
 * <p>{@link #apply} depends only on the current state, the event and the config; it
 * performs no I/O. Counters only grow, and a transition that would exceed a bound
 * goes to FAILED (or, for clarification, past the ambiguity check) instead.</p>
 */
public final class Transitions {

	private Transitions() {
	}

	/**
	 * @throws IllegalStateException if the event is not accepted in the current state
	 */
	public static SessionState apply(SessionState state, WorkflowEvent event, WorkflowConfig config) {
		Objects.requireNonNull(state, "state must not be null");
		Objects.requireNonNull(event, "event must not be null");
		Objects.requireNonNull(config, "config must not be null");
		SessionState.Builder next = state.toBuilder();

		switch (state.status()) {
			case START -> {
				if (event instanceof IntentParsed parsed) {
					return next.status(WorkflowState.INTENT_PARSED)
							.intent(parsed.parsed().intent())
							.matchedTables(parsed.parsed().matchedTables())
							.joinPath(parsed.joinPath())
							.build();
				}
			}
			case INTENT_PARSED -> {
				if (event instanceof SqlGenerated generated) {
					return next.status(WorkflowState.GENERATED)
							.candidateSql(generated.sql())
							.validationResult(null)
							.sandboxDecision(null)
							.build();
				}
				if (event instanceof ChatReplied chat) {
					return next.status(WorkflowState.ANSWERING)
							.chatReply(true)
							.finalAnswer(chat.reply())
							.build();
				}
				if (event instanceof StepFailed failed) {
					return next.status(WorkflowState.INVALID)
							.lastError(failed.code(), failed.diagnostic(), failed.detail())
							.build();
				}
			}
			case GENERATED -> {
				if (event instanceof AmbiguityChecked checked) {
					return afterAmbiguityCheck(state, checked, config, next);
				}
			}
			case CLARIFY_NEEDED -> {
				if (event instanceof ClarificationPrepared prepared) {
					return next.status(WorkflowState.AWAITING_USER)
							.pendingClarification(prepared.request())
							.build();
				}
				if (event instanceof StepFailed) {
					// the question is answered as asked rather than blocked
					return next.status(WorkflowState.VALIDATING)
							.pendingFinding(null)
							.build();
				}
			}
			case AWAITING_USER -> {
				if (event instanceof ClarificationAnswered answered) {
					return next.status(WorkflowState.INTENT_PARSED)
							.workingQuestion(answered.mergedQuestion())
							.intent(answered.parsed().intent())
							.matchedTables(answered.parsed().matchedTables())
							.joinPath(answered.joinPath())
							.clarificationRoundCount(state.clarificationRoundCount() + 1)
							.pendingFinding(null)
							.pendingClarification(null)
							.candidateSql(null)
							.build();
				}
			}
			case VALIDATING -> {
				if (event instanceof Validated validated) {
					next.validationResult(validated.result());
					if (validated.result().valid()) {
						return next.status(WorkflowState.VALID).build();
					}
					return next.status(WorkflowState.INVALID)
							.lastError(ErrorCode.SYNTAX_VALIDATION_ERROR, validated.result().describe())
							.build();
				}
			}
			case INVALID -> {
				if (event instanceof Advance) {
					if (state.regenerationCount() < config.maxRegenerations()) {
						return next.status(WorkflowState.CRITIQUING).build();
					}
					return next.status(WorkflowState.FAILED)
							.failure(Failure.of(ErrorCode.MAX_REGENERATIONS_EXCEEDED, describeLastError(state),
									state.candidateSql()))
							.build();
				}
			}
			case CRITIQUING -> {
				if (event instanceof Regenerated regenerated) {
					return next.status(WorkflowState.GENERATED)
							.regenerationCount(state.regenerationCount() + 1)
							.candidateSql(regenerated.sql())
							.critique(regenerated.critique())
							.validationResult(null)
							.sandboxDecision(null)
							.build();
				}
				if (event instanceof StepFailed failed) {
					return next.status(WorkflowState.INVALID)
							.regenerationCount(state.regenerationCount() + 1)
							.lastError(failed.code(), failed.diagnostic(), failed.detail())
							.build();
				}
			}
			case VALID -> {
				if (event instanceof Advance) {
					return next.status(WorkflowState.SANDBOX_CHECK).build();
				}
			}
			case SANDBOX_CHECK -> {
				if (event instanceof SandboxChecked checked) {
					SandboxDecision decision = checked.decision();
					next.sandboxDecision(decision);
					if (decision.allowed()) {
						return next.status(WorkflowState.EXECUTING).build();
					}
					return next.status(WorkflowState.INVALID)
							.lastError(ErrorCode.SANDBOX_DENIED, decision.denyReason() + ": " + decision.reasonMessage())
							.build();
				}
			}
			case EXECUTING -> {
				if (event instanceof Executed executed) {
					return next.status(WorkflowState.ANSWERING)
							.executionResult(executed.result())
							.build();
				}
				if (event instanceof StepFailed failed) {
					return next.status(WorkflowState.INVALID)
							.lastError(failed.code(), failed.diagnostic(), failed.detail())
							.build();
				}
			}
			case ANSWERING -> {
				if (event instanceof Answered answered) {
					return next.status(WorkflowState.DONE)
							.finalAnswer(answered.answer())
							.build();
				}
			}
			case DONE, FAILED -> {
				// terminal
			}
		}
		throw new IllegalStateException(
				"Event " + event.getClass().getSimpleName() + " is not accepted in state " + state.status());
	}

	private static SessionState afterAmbiguityCheck(SessionState state, AmbiguityChecked checked,
			WorkflowConfig config, SessionState.Builder next) {
		if (checked.finding() == null) {
			return next.status(WorkflowState.VALIDATING).build();
		}
		if (state.clarificationRoundCount() < config.maxClarificationRounds()) {
			return next.status(WorkflowState.CLARIFY_NEEDED)
					.pendingFinding(checked.finding())
					.build();
		}
		if (config.failOnClarificationExhausted()) {
			return next.status(WorkflowState.FAILED)
					.failure(Failure.of(ErrorCode.MAX_CLARIFICATION_ROUNDS_EXCEEDED,
							checked.finding().describe(), state.candidateSql()))
					.build();
		}
		return next.status(WorkflowState.VALIDATING).build();
	}

	private static String describeLastError(SessionState state) {
		if (state.lastErrorCode() == null) {
			return state.lastDiagnostic();
		}
		return state.lastErrorCode() + ": " + state.lastDiagnostic();
	}
}

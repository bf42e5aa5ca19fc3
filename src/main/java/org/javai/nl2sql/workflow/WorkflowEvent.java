package org.javai.nl2sql.workflow;

import java.util.Objects;
import org.javai.nl2sql.clarify.AmbiguityFinding;
import org.javai.nl2sql.clarify.ClarificationRequest;
import org.javai.nl2sql.execute.QueryResult;
import org.javai.nl2sql.intent.ParsedQuestion;
import org.javai.nl2sql.join.JoinPath;
import org.javai.nl2sql.sandbox.SandboxDecision;
import org.javai.nl2sql.validate.ValidationResult;

/**
 * Outcome of one workflow step, fed to {@link Transitions#apply}.
 */
public sealed interface WorkflowEvent {

	record IntentParsed(ParsedQuestion parsed, JoinPath joinPath) implements WorkflowEvent {
		public IntentParsed {
			Objects.requireNonNull(parsed, "parsed must not be null");
			Objects.requireNonNull(joinPath, "joinPath must not be null");
		}
	}

	record SqlGenerated(String sql) implements WorkflowEvent {
		public SqlGenerated {
			Objects.requireNonNull(sql, "sql must not be null");
		}
	}

	record ChatReplied(String reply) implements WorkflowEvent {
		public ChatReplied {
			Objects.requireNonNull(reply, "reply must not be null");
		}
	}

	/**
	 * @param finding the ambiguity found, or null if the question is clear
	 */
	record AmbiguityChecked(AmbiguityFinding finding) implements WorkflowEvent {
	}

	record ClarificationPrepared(ClarificationRequest request) implements WorkflowEvent {
		public ClarificationPrepared {
			Objects.requireNonNull(request, "request must not be null");
		}
	}

	record ClarificationAnswered(String mergedQuestion, ParsedQuestion parsed, JoinPath joinPath)
			implements WorkflowEvent {
		public ClarificationAnswered {
			Objects.requireNonNull(mergedQuestion, "mergedQuestion must not be null");
			Objects.requireNonNull(parsed, "parsed must not be null");
			Objects.requireNonNull(joinPath, "joinPath must not be null");
		}
	}

	record Validated(ValidationResult result) implements WorkflowEvent {
		public Validated {
			Objects.requireNonNull(result, "result must not be null");
		}
	}

	/** Moves out of VALID or INVALID. */
	record Advance() implements WorkflowEvent {
	}

	record Regenerated(String sql, String critique) implements WorkflowEvent {
		public Regenerated {
			Objects.requireNonNull(sql, "sql must not be null");
		}
	}

	record SandboxChecked(SandboxDecision decision) implements WorkflowEvent {
		public SandboxChecked {
			Objects.requireNonNull(decision, "decision must not be null");
		}
	}

	record Executed(QueryResult result) implements WorkflowEvent {
		public Executed {
			Objects.requireNonNull(result, "result must not be null");
		}
	}

	record Answered(String answer) implements WorkflowEvent {
		public Answered {
			Objects.requireNonNull(answer, "answer must not be null");
		}
	}

	/**
	 * A step could not produce its normal outcome.
	 *
	 * @param code what kind of failure
	 * @param diagnostic description that may be shown to callers
	 * @param detail collaborator text for the repair prompt only, or null
	 */
	record StepFailed(ErrorCode code, String diagnostic, String detail) implements WorkflowEvent {
		public StepFailed {
			Objects.requireNonNull(code, "code must not be null");
			diagnostic = diagnostic != null ? diagnostic : code.message();
		}

		public StepFailed(ErrorCode code, String diagnostic) {
			this(code, diagnostic, null);
		}
	}
}

package org.javai.nl2sql.workflow;

import java.util.Objects;

/**
 * Why a run ended in {@link WorkflowState#FAILED}.
 *
 * @param code the stable reason code
 * @param message user-facing reason
 * @param lastDiagnostic the last problem seen before giving up (may be null)
 * @param lastSql the last SQL attempted (may be null)
 */
public record Failure(ErrorCode code, String message, String lastDiagnostic, String lastSql) {

	public Failure {
		Objects.requireNonNull(code, "code must not be null");
		message = message != null ? message : code.message();
	}

	public static Failure of(ErrorCode code, String lastDiagnostic, String lastSql) {
		return new Failure(code, code.message(), lastDiagnostic, lastSql);
	}
}

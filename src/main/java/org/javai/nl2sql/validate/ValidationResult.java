package org.javai.nl2sql.validate;

import java.util.List;
import java.util.stream.Collectors;

/**
 * @param valid true if the SQL parsed
 * @param diagnostics ordered problems; empty when valid
 */
public record ValidationResult(boolean valid, List<Diagnostic> diagnostics) {

	public ValidationResult {
		diagnostics = diagnostics != null ? List.copyOf(diagnostics) : List.of();
		if (valid && !diagnostics.isEmpty()) {
			throw new IllegalArgumentException("a valid result carries no diagnostics");
		}
	}

	public static ValidationResult ok() {
		return new ValidationResult(true, List.of());
	}

	public static ValidationResult failed(List<Diagnostic> diagnostics) {
		return new ValidationResult(false, diagnostics);
	}

	public static ValidationResult failed(Diagnostic diagnostic) {
		return new ValidationResult(false, List.of(diagnostic));
	}

	/**
	 * @return the first diagnostic, or null when valid
	 */
	public Diagnostic firstDiagnostic() {
		return diagnostics.isEmpty() ? null : diagnostics.get(0);
	}

	public String describe() {
		return diagnostics.stream().map(d -> "- " + d.describe()).collect(Collectors.joining("\n"));
	}
}

package org.javai.nl2sql.validate;

import java.util.Objects;

/**
 * A syntax problem located in the SQL text.
 *
 * @param message parser message
 * @param fragment the offending token, or empty if unknown
 * @param line 1-based line, 0 if unknown
 * @param column 1-based column, 0 if unknown
 */
public record Diagnostic(String message, String fragment, int line, int column) {

	public Diagnostic {
		Objects.requireNonNull(message, "message must not be null");
		fragment = fragment != null ? fragment : "";
	}

	public static Diagnostic of(String message) {
		return new Diagnostic(message, "", 0, 0);
	}

	/**
	 * @return a one-line description such as "line 1, column 10 near 'FORM': ..."
	 */
	public String describe() {
		StringBuilder sb = new StringBuilder();
		if (line > 0) {
			sb.append("line ").append(line).append(", column ").append(column);
			if (!fragment.isEmpty()) {
				sb.append(" near '").append(fragment).append("'");
			}
			sb.append(": ");
		}
		return sb.append(message).toString();
	}
}

package org.javai.nl2sql.join;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Result of join synthesis: either an ordered list of join steps rooted at
 * {@code anchor}, or NO_PATH with the required tables that could not be reached.
 */
public record JoinPath(
		Status status,
		String anchor,
		List<JoinStep> steps,
		List<String> unreachable
) {

	public enum Status {
		FOUND,
		NO_PATH
	}

	public JoinPath {
		Objects.requireNonNull(status, "status must not be null");
		steps = steps != null ? List.copyOf(steps) : List.of();
		unreachable = unreachable != null ? List.copyOf(unreachable) : List.of();
	}

	public static JoinPath empty() {
		return new JoinPath(Status.FOUND, null, List.of(), List.of());
	}

	public static JoinPath found(String anchor, List<JoinStep> steps) {
		return new JoinPath(Status.FOUND, anchor, steps, List.of());
	}

	public static JoinPath noPath(List<String> unreachable) {
		return new JoinPath(Status.NO_PATH, null, List.of(), unreachable);
	}

	public boolean isFound() {
		return status == Status.FOUND;
	}

	public boolean isEmpty() {
		return steps.isEmpty();
	}

	/**
	 * @return the anchor followed by every joined table, in join order
	 */
	public List<String> tables() {
		List<String> tables = new ArrayList<>();
		if (anchor != null) {
			tables.add(anchor);
		}
		steps.forEach(step -> tables.add(step.table()));
		return tables;
	}

	/**
	 * Renders the path as a FROM clause with its joins, one per line.
	 */
	public String toSql() {
		if (!isFound() || anchor == null) {
			return "";
		}
		StringBuilder sb = new StringBuilder("FROM ").append(anchor);
		for (JoinStep step : steps) {
			sb.append('\n').append(step.toSql());
		}
		return sb.toString();
	}

	/**
	 * Renders the path as a hint block for a generation prompt.
	 */
	public String toPromptHint() {
		if (!isFound() || steps.isEmpty()) {
			return "";
		}
		StringBuilder sb = new StringBuilder("Suggested join path (derived from foreign keys):\n");
		sb.append(toSql());
		return sb.toString();
	}
}

package org.javai.nl2sql.clarify;

import java.util.List;
import java.util.Objects;

/**
 * A closed question put to the user.
 *
 * @param question the question text
 * @param options enumerated answers, at most {@link #MAX_OPTIONS}
 * @param kind the ambiguity being resolved
 */
public record ClarificationRequest(String question, List<String> options, AmbiguityKind kind) {

	public static final int MAX_OPTIONS = 5;

	public ClarificationRequest {
		Objects.requireNonNull(question, "question must not be null");
		Objects.requireNonNull(kind, "kind must not be null");
		options = options != null ? List.copyOf(options) : List.of();
		if (options.size() > MAX_OPTIONS) {
			throw new IllegalArgumentException("at most " + MAX_OPTIONS + " options are allowed");
		}
	}

	/**
	 * @return the question followed by its numbered options, one per line
	 */
	public String render() {
		StringBuilder sb = new StringBuilder(question);
		for (int i = 0; i < options.size(); i++) {
			sb.append('\n').append(i + 1).append(". ").append(options.get(i));
		}
		return sb.toString();
	}
}

package org.javai.nl2sql.clarify;

import java.util.Objects;

/**
 * @param kind what is missing
 * @param trigger the words of the question that raised the finding
 * @param rule name of the rule that matched
 */
public record AmbiguityFinding(AmbiguityKind kind, String trigger, String rule) {

	public AmbiguityFinding {
		Objects.requireNonNull(kind, "kind must not be null");
		trigger = trigger != null ? trigger : "";
		rule = rule != null ? rule : "";
	}

	/**
	 * @return a short statement of the problem for the clarification prompt
	 */
	public String describe() {
		if (trigger.isBlank()) {
			return "It is unclear " + kind.description() + ".";
		}
		return "\"" + trigger + "\": it is unclear " + kind.description() + ".";
	}
}

package org.javai.nl2sql.clarify;

/**
 * What is missing from an ambiguous question.
 */
public enum AmbiguityKind {

	/** A pronoun refers to something the conversation never mentioned. */
	REFERENCE("what the question refers to"),
	/** No time bound where one is needed. */
	TIME_RANGE("which time period the question is about"),
	/** A ranking without a field to rank by. */
	ORDERING("which measure the ranking should use"),
	/** A summary request without an aggregation. */
	AGGREGATION("which figure should be computed");

	private final String description;

	AmbiguityKind(String description) {
		this.description = description;
	}

	public String description() {
		return description;
	}
}

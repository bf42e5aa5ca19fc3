package org.javai.nl2sql.sandbox;

/**
 * Why the sandbox refused a statement.
 */
public enum DenyReason {
	EMPTY_STATEMENT("No SQL statement was produced"),
	MULTI_STATEMENT("Only a single statement may be executed"),
	FORBIDDEN_KEYWORD("The statement contains a forbidden keyword"),
	NOT_SELECT("Only SELECT statements may be executed"),
	UNKNOWN_IDENTIFIER("The statement references a table or column that is not in the catalog"),
	FORBIDDEN_SCHEMA("The statement references a system schema or table");

	private final String description;

	DenyReason(String description) {
		this.description = description;
	}

	public String description() {
		return description;
	}
}

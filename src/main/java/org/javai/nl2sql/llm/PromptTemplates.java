package org.javai.nl2sql.llm;

/**
 * Prompt wording for every model call of the workflow. Only this class knows the
 * wording; callers supply the parts.
 */
public final class PromptTemplates {

	private PromptTemplates() {
	}

	public static final String GENERATION_SYSTEM = """
			You translate questions about a relational database into SQL.
			Rules:
			- Produce exactly ONE read-only SELECT statement (WITH ... SELECT is allowed).
			- Use only tables and columns from the catalog.
			- Return the SQL in a single ```sql code block and nothing else.
			- If the message is small talk or cannot be answered from the database, reply with
			  "CHAT:" followed by a short helpful answer instead of SQL.
			""";

	public static final String REPAIR_SYSTEM = """
			You repair SQL queries. Return the corrected, single read-only SELECT statement
			in a ```sql code block and nothing else. Use only tables and columns from the catalog.
			""";

	public static final String CRITIQUE_SYSTEM = """
			You review SQL queries that failed. Explain briefly what is wrong and how to fix it.
			Do not write the corrected query.
			""";

	public static final String CLARIFY_SYSTEM = """
			You help users make ambiguous database questions precise. Ask ONE short closed
			question and offer at most five concrete options.
			Answer in the same language as the user's question, using exactly this format:
			QUESTION: <the question>
			1. <option>
			2. <option>
			""";

	public static final String ANSWER_SYSTEM = """
			You explain query results to the user in plain language, in the language of the
			question. Be concise and mention concrete values. Do not show SQL.
			""";

	public static String generationUser(String question, String catalog, String joinHint, String intent,
			String history) {
		StringBuilder sb = new StringBuilder();
		sb.append(catalog).append("\n\n");
		if (!joinHint.isBlank()) {
			sb.append(joinHint).append("\n\n");
		}
		if (!history.isBlank()) {
			sb.append(history).append("\n");
		}
		if (!intent.isBlank()) {
			sb.append("Parsed intent: ").append(intent).append("\n\n");
		}
		sb.append("Question: ").append(question);
		return sb.toString();
	}

	public static String critiqueUser(String question, String sql, String diagnostics, String catalog) {
		return """
				%s

				Question: %s

				Failed SQL:
				%s

				Problems:
				%s
				""".formatted(catalog, question, sql, diagnostics);
	}

	public static String repairUser(String question, String sql, String diagnostics, String critique,
			String catalog, String joinHint) {
		StringBuilder sb = new StringBuilder();
		sb.append(catalog).append("\n\n");
		if (!joinHint.isBlank()) {
			sb.append(joinHint).append("\n\n");
		}
		sb.append("Question: ").append(question).append("\n\n");
		sb.append("Previous SQL:\n").append(sql == null || sql.isBlank() ? "<none>" : sql).append("\n\n");
		sb.append("Problems:\n").append(diagnostics).append("\n\n");
		sb.append("Review:\n").append(critique).append("\n\n");
		sb.append("Write the corrected SQL.");
		return sb.toString();
	}

	public static String clarificationUser(String question, String ambiguity, String history) {
		StringBuilder sb = new StringBuilder();
		if (!history.isBlank()) {
			sb.append(history).append("\n");
		}
		sb.append("Question: ").append(question).append("\n");
		sb.append("What is unclear: ").append(ambiguity);
		return sb.toString();
	}

	public static String answerUser(String question, String sql, String resultPreview) {
		return """
				Question: %s

				Executed SQL:
				%s

				Result:
				%s
				""".formatted(question, sql, resultPreview);
	}
}

package org.javai.nl2sql.workflow;

import java.util.Objects;
import org.javai.nl2sql.catalog.CatalogPromptFormatter;
import org.javai.nl2sql.catalog.SchemaCatalog;
import org.javai.nl2sql.llm.CompletionException;
import org.javai.nl2sql.llm.CompletionRequest;
import org.javai.nl2sql.llm.PromptTemplates;
import org.javai.nl2sql.llm.TextCompletionClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Explains why a candidate failed. Never fails itself: when the model cannot be
 * reached, the rationale is built from the diagnostic alone.
 */
public class SqlCritic {

	private static final Logger logger = LoggerFactory.getLogger(SqlCritic.class);

	private final TextCompletionClient completionClient;

	public SqlCritic(TextCompletionClient completionClient) {
		this.completionClient = Objects.requireNonNull(completionClient, "completionClient must not be null");
	}

	public String critique(String question, String sql, String diagnostic, SchemaCatalog catalog) {
		String userPrompt = PromptTemplates.critiqueUser(question, sql == null || sql.isBlank() ? "<none>" : sql,
				diagnostic, CatalogPromptFormatter.format(catalog));
		try {
			String response = completionClient.complete(
					new CompletionRequest("critique", PromptTemplates.CRITIQUE_SYSTEM, userPrompt));
			if (response != null && !response.isBlank()) {
				return response.trim();
			}
			logger.warn("Critique returned an empty response; using the diagnostic");
		}
		catch (CompletionException e) {
			logger.warn("Critique failed; using the diagnostic instead", e);
		}
		return fallback(diagnostic);
	}

	static String fallback(String diagnostic) {
		return "The previous SQL failed with:\n" + (diagnostic == null ? "" : diagnostic)
				+ "\nFix exactly these problems. Use only tables and columns from the catalog and return one SELECT statement.";
	}
}

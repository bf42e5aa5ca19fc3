package org.javai.nl2sql.workflow;

import java.util.List;
import java.util.Objects;
import java.util.StringJoiner;
import org.javai.nl2sql.catalog.CatalogPromptFormatter;
import org.javai.nl2sql.catalog.SchemaCatalog;
import org.javai.nl2sql.intent.Intent;
import org.javai.nl2sql.llm.CompletionRequest;
import org.javai.nl2sql.llm.ModelReply;
import org.javai.nl2sql.llm.PromptTemplates;
import org.javai.nl2sql.llm.ResponseClassifier;
import org.javai.nl2sql.llm.TextCompletionClient;
import org.javai.nl2sql.memory.MemoryEntry;
import org.javai.nl2sql.memory.MemoryFormatter;

/**
 * Turns the working question into SQL, or repairs a failed candidate, through the
 * completion client. Completion failures propagate to the caller.
 */
public class SqlGenerator {

	private final TextCompletionClient completionClient;

	public SqlGenerator(TextCompletionClient completionClient) {
		this.completionClient = Objects.requireNonNull(completionClient, "completionClient must not be null");
	}

	/**
	 * @return SQL or, when the model answers conversationally, a chat reply
	 */
	public ModelReply generate(SessionState state, SchemaCatalog catalog, List<MemoryEntry> history) {
		String userPrompt = PromptTemplates.generationUser(
				state.workingQuestion(),
				catalogFor(state, catalog),
				joinHint(state),
				describeIntent(state.intent()),
				MemoryFormatter.forGeneration(history));
		String response = completionClient.complete(
				new CompletionRequest("generate", PromptTemplates.GENERATION_SYSTEM, userPrompt));
		return ResponseClassifier.classify(response);
	}

	/**
	 * @return the repaired SQL; may be empty if the model returned nothing usable
	 */
	public String regenerate(SessionState state, String critique, SchemaCatalog catalog) {
		String userPrompt = PromptTemplates.repairUser(
				state.workingQuestion(),
				state.candidateSql(),
				problem(state),
				critique != null ? critique : "",
				CatalogPromptFormatter.format(catalog),
				joinHint(state));
		String response = completionClient.complete(
				new CompletionRequest("repair", PromptTemplates.REPAIR_SYSTEM, userPrompt));
		return ResponseClassifier.extractSql(response);
	}

	/**
	 * The last failure as the model should see it, collaborator detail included.
	 */
	static String problem(SessionState state) {
		String text = state.lastErrorDetail() != null ? state.lastErrorDetail() : state.lastDiagnostic();
		if (state.lastErrorCode() == null) {
			return text != null ? text : "";
		}
		return state.lastErrorCode() + ": " + text;
	}

	/**
	 * The tables on the join path (waypoints included), else the matched tables, else
	 * the whole catalog.
	 */
	private static String catalogFor(SessionState state, SchemaCatalog catalog) {
		if (state.joinPath() != null && state.joinPath().isFound() && !state.joinPath().isEmpty()) {
			return CatalogPromptFormatter.format(catalog, state.joinPath().tables());
		}
		return CatalogPromptFormatter.format(catalog, state.matchedTables());
	}

	private static String joinHint(SessionState state) {
		return state.joinPath() != null ? state.joinPath().toPromptHint() : "";
	}

	static String describeIntent(Intent intent) {
		if (intent == null || intent.defaulted()) {
			return "";
		}
		StringJoiner joiner = new StringJoiner(", ");
		joiner.add("type=" + intent.questionType());
		if (intent.rowLimit() != null) {
			joiner.add("row limit=" + intent.rowLimit());
		}
		if (intent.hasTimeRange()) {
			joiner.add("time range=" + intent.timeRange());
		}
		return joiner.toString();
	}
}

package org.javai.nl2sql.workflow;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;
import org.javai.nl2sql.execute.QueryResult;
import org.javai.nl2sql.llm.CompletionException;
import org.javai.nl2sql.llm.CompletionRequest;
import org.javai.nl2sql.llm.PromptTemplates;
import org.javai.nl2sql.llm.TextCompletionClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Phrases a query result as an answer. When the model is unavailable a plain
 * summary is produced from the rows themselves.
 */
public class AnswerBuilder {

	private static final Logger logger = LoggerFactory.getLogger(AnswerBuilder.class);

	static final int PREVIEW_ROWS = 20;
	static final int LISTED_ROWS = 10;
	private static final int SAMPLE_ROWS = 5;

	private final TextCompletionClient completionClient;

	public AnswerBuilder(TextCompletionClient completionClient) {
		this.completionClient = Objects.requireNonNull(completionClient, "completionClient must not be null");
	}

	public String build(String question, String sql, QueryResult result) {
		Objects.requireNonNull(result, "result must not be null");
		try {
			String response = completionClient.complete(new CompletionRequest("answer", PromptTemplates.ANSWER_SYSTEM,
					PromptTemplates.answerUser(question, sql, preview(result, PREVIEW_ROWS))));
			if (response != null && !response.isBlank()) {
				return response.trim();
			}
			logger.warn("Answer generation returned an empty response; using a summary");
		}
		catch (CompletionException e) {
			logger.warn("Answer generation failed; using a summary", e);
		}
		return summarize(result);
	}

	/**
	 * Deterministic answer: every row for small results, otherwise a sample and
	 * statistics of the numeric columns.
	 */
	static String summarize(QueryResult result) {
		if (result.isEmpty()) {
			return "The query returned no rows.";
		}
		StringBuilder sb = new StringBuilder();
		if (result.rowCount() <= LISTED_ROWS) {
			sb.append("The query returned ").append(result.rowCount()).append(result.rowCount() == 1 ? " row" : " rows")
					.append(":\n");
			sb.append(preview(result, LISTED_ROWS));
			return sb.toString().trim();
		}
		sb.append("The query returned ").append(result.rowCount()).append(" rows");
		if (result.truncated()) {
			sb.append(" (more were available)");
		}
		sb.append(". First ").append(SAMPLE_ROWS).append(":\n");
		sb.append(preview(result, SAMPLE_ROWS));
		List<String> stats = numericStatistics(result);
		if (!stats.isEmpty()) {
			sb.append("\n").append(String.join("\n", stats));
		}
		return sb.toString().trim();
	}

	static String preview(QueryResult result, int maxRows) {
		StringBuilder sb = new StringBuilder(String.join(" | ", result.columns())).append('\n');
		result.rows().stream().limit(maxRows).forEach(row -> sb.append(
				row.stream().map(v -> v == null ? "NULL" : v.toString()).collect(Collectors.joining(" | ")))
				.append('\n'));
		if (result.rowCount() > maxRows) {
			sb.append("... ").append(result.rowCount() - maxRows).append(" more rows\n");
		}
		return sb.toString();
	}

	private static List<String> numericStatistics(QueryResult result) {
		List<String> stats = new ArrayList<>();
		for (String column : result.columns()) {
			List<Object> values = result.column(column);
			List<Double> numbers = values.stream()
					.filter(Number.class::isInstance)
					.map(v -> ((Number) v).doubleValue())
					.toList();
			long nonNull = values.stream().filter(Objects::nonNull).count();
			if (numbers.isEmpty() || numbers.size() != nonNull) {
				continue;
			}
			double min = numbers.stream().mapToDouble(Double::doubleValue).min().orElse(0);
			double max = numbers.stream().mapToDouble(Double::doubleValue).max().orElse(0);
			double avg = numbers.stream().mapToDouble(Double::doubleValue).average().orElse(0);
			stats.add(String.format(Locale.ROOT, "%s: min %.2f, max %.2f, avg %.2f", column, min, max, avg));
		}
		return stats;
	}
}

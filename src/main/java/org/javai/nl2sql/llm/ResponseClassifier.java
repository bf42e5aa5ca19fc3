package org.javai.nl2sql.llm;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts SQL from a model response, or recognises the response as a chat reply.
 *
 * <p>SQL is taken from the first fenced code block when present, otherwise from the
 * whole response. It counts as SQL only if it starts with SELECT or WITH; anything
 * else is a conversational reply. A leading {@code CHAT:} marker forces a chat reply.</p>
 */
public final class ResponseClassifier {

	private static final Pattern CODE_BLOCK_PATTERN = Pattern.compile("```(?:sql|SQL)?\\s*\\n?(.*?)```", Pattern.DOTALL);
	private static final Pattern SQL_START = Pattern.compile("^(?i)(select|with)\\b");
	private static final String CHAT_MARKER = "CHAT:";

	private ResponseClassifier() {
	}

	public static ModelReply classify(String response) {
		String trimmed = response == null ? "" : response.trim();
		if (trimmed.toUpperCase(Locale.ROOT).startsWith(CHAT_MARKER)) {
			return ModelReply.chat(trimmed.substring(CHAT_MARKER.length()).trim());
		}
		String candidate = extractCodeBlock(trimmed);
		if (SQL_START.matcher(candidate).find()) {
			return ModelReply.sql(stripTrailingSemicolon(candidate));
		}
		return ModelReply.chat(trimmed);
	}

	/**
	 * Extracts SQL text for repair responses, which are expected to be SQL in any case.
	 */
	public static String extractSql(String response) {
		String trimmed = response == null ? "" : response.trim();
		return stripTrailingSemicolon(extractCodeBlock(trimmed));
	}

	private static String extractCodeBlock(String text) {
		Matcher matcher = CODE_BLOCK_PATTERN.matcher(text);
		if (matcher.find()) {
			return matcher.group(1).trim();
		}
		return text;
	}

	private static String stripTrailingSemicolon(String sql) {
		String result = sql.trim();
		while (result.endsWith(";")) {
			result = result.substring(0, result.length() - 1).trim();
		}
		return result;
	}
}

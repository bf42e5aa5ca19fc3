package org.javai.nl2sql.validate;

import java.util.ArrayList;
import java.util.List;

/**
 * Lexical helpers that understand SQL string literals and quoted identifiers well
 * enough to find comments and statement separators.
 */
public final class SqlText {

	private SqlText() {
	}

	/**
	 * A statement found by {@link #splitStatements}, with its offset in the input.
	 */
	public record Segment(String text, int offset) {
	}

	/**
	 * Replaces the characters of every {@code --} and {@code /* *}{@code /} comment
	 * with spaces, keeping line breaks, so offsets into the result match the input.
	 * Comment markers inside literals and quoted identifiers are left alone.
	 */
	public static String maskComments(String sql) {
		StringBuilder out = new StringBuilder(sql);
		int i = 0;
		int n = sql.length();
		while (i < n) {
			char c = sql.charAt(i);
			if (c == '\'' || c == '"' || c == '`') {
				i = skipQuoted(sql, i, c);
			}
			else if (c == '-' && i + 1 < n && sql.charAt(i + 1) == '-') {
				while (i < n && sql.charAt(i) != '\n') {
					out.setCharAt(i, ' ');
					i++;
				}
			}
			else if (c == '/' && i + 1 < n && sql.charAt(i + 1) == '*') {
				int end = sql.indexOf("*/", i + 2);
				int stop = end < 0 ? n : end + 2;
				for (int j = i; j < stop; j++) {
					if (sql.charAt(j) != '\n') {
						out.setCharAt(j, ' ');
					}
				}
				i = stop;
			}
			else {
				i++;
			}
		}
		return out.toString();
	}

	/**
	 * @return the input with comments removed and surrounding whitespace trimmed
	 */
	public static String stripComments(String sql) {
		return maskComments(sql).trim();
	}

	/**
	 * Splits on semicolons outside literals and quoted identifiers. Blank statements
	 * are dropped. Comments must already be masked.
	 */
	public static List<Segment> splitStatements(String sql) {
		List<Segment> segments = new ArrayList<>();
		int start = 0;
		int i = 0;
		int n = sql.length();
		while (i < n) {
			char c = sql.charAt(i);
			if (c == '\'' || c == '"' || c == '`') {
				i = skipQuoted(sql, i, c);
				continue;
			}
			if (c == ';') {
				addSegment(segments, sql, start, i);
				start = i + 1;
			}
			i++;
		}
		addSegment(segments, sql, start, n);
		return segments;
	}

	private static void addSegment(List<Segment> segments, String sql, int start, int end) {
		String raw = sql.substring(start, end);
		if (raw.isBlank()) {
			return;
		}
		int lead = 0;
		while (Character.isWhitespace(raw.charAt(lead))) {
			lead++;
		}
		segments.add(new Segment(raw.strip(), start + lead));
	}

	/**
	 * @return index just past the closing quote, or the input length if unterminated
	 */
	private static int skipQuoted(String sql, int openIndex, char quote) {
		int i = openIndex + 1;
		int n = sql.length();
		while (i < n) {
			if (sql.charAt(i) == quote) {
				if (i + 1 < n && sql.charAt(i + 1) == quote) {
					i += 2;
					continue;
				}
				return i + 1;
			}
			i++;
		}
		return n;
	}

	/**
	 * 1-based line and column of an offset.
	 */
	public static int[] lineAndColumn(String text, int offset) {
		int line = 1;
		int column = 1;
		for (int i = 0; i < offset && i < text.length(); i++) {
			if (text.charAt(i) == '\n') {
				line++;
				column = 1;
			}
			else {
				column++;
			}
		}
		return new int[] { line, column };
	}
}

package org.javai.nl2sql.intent;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Bilingual (English and Chinese) vocabulary used by the intent parser and the
 * ambiguity rules. English terms match on word boundaries, Chinese terms as
 * substrings.
 */
public final class QuestionPatterns {

	private QuestionPatterns() {
	}

	static final String CN_NUMBER = "[一二两三四五六七八九十百]+";

	public static final Pattern TOP_N = Pattern.compile(
			word("(?:top|first|limit)\\s+(\\d+)")
					+ "|前\\s*(\\d+|" + CN_NUMBER + ")\\s*(?:个|名|条|位|项|家|首|张|种)?");

	/** "最" is excluded when it starts "最近" (recently). */
	public static final Pattern SUPERLATIVE = Pattern.compile(
			word("most|least|best|worst|highest|lowest|largest|smallest|biggest|greatest|top")
					+ "|最(?!近)|排名|排行");

	public static final Pattern AGGREGATE = Pattern.compile(
			word("count|how many|how much|total|sum|average|avg|number of")
					+ "|多少|总数|总计|总和|平均|统计|数量|合计");

	public static final Pattern LIST = Pattern.compile(
			word("list|show|all|display|find|get") + "|列出|查询|所有|显示|查找|哪些");

	public static final Pattern LOOKUP = Pattern.compile(
			word("who|which|when|what is|what's") + "|谁|哪个|哪位|什么时候");

	public static final Pattern PRONOUN = Pattern.compile(
			word("it|they|them|those|these|their|its|that one|the same")
					+ "|它们|它|他们|她们|这些|那些|上述|刚才");

	public static final Pattern RELATIVE_TIME = Pattern.compile(
			word("recently|recent|lately|nowadays|these days") + "|最近|近期|前段时间|这段时间|近来");

	public static final Pattern METRIC = Pattern.compile(
			word("sales|sale|revenue|count|number|amount|total|price|popular|popularity|sold|purchases?"
					+ "|spent|spending|orders?|duration|length|bytes|size|quantity|invoices?|by")
					+ "|销量|销售额|销售|数量|金额|热门|受欢迎|价格|收入|次数|总额|时长|按");

	public static final Pattern VAGUE_AGGREGATION = Pattern.compile(
			word("statistics|stats|summary|overview|breakdown") + "|汇总|情况|概况|分析");

	public static final Pattern SPECIFIC_AGGREGATION = Pattern.compile(
			word("count|sum|average|avg|total|how many|max|min") + "|多少|总数|总和|平均|数量|最大|最小");

	/**
	 * Case-insensitive alternation bounded by non-ASCII-word characters, so that English
	 * terms still match when written directly next to Chinese text.
	 */
	static String word(String alternatives) {
		return "(?i:(?<![A-Za-z0-9_])(?:" + alternatives + ")(?![A-Za-z0-9_]))";
	}

	/**
	 * Text with every "top N" phrase removed, so that an explicit row limit is not
	 * mistaken for an unbounded superlative.
	 */
	public static String withoutTopN(String question) {
		return TOP_N.matcher(question).replaceAll(" ");
	}

	public static boolean mentions(Pattern pattern, String text) {
		return text != null && pattern.matcher(text).find();
	}

	public static String firstMatch(Pattern pattern, String text) {
		if (text == null) {
			return null;
		}
		Matcher m = pattern.matcher(text);
		return m.find() ? m.group() : null;
	}

	/**
	 * Parses an Arabic or simple Chinese numeral ("5", "十五", "二十").
	 *
	 * @return the value, or -1 if not a number
	 */
	public static int parseNumber(String text) {
		if (text == null || text.isBlank()) {
			return -1;
		}
		String t = text.trim();
		if (t.chars().allMatch(Character::isDigit)) {
			try {
				return Integer.parseInt(t);
			} catch (NumberFormatException e) {
				return -1;
			}
		}
		int total = 0;
		int current = 0;
		for (char c : t.toCharArray()) {
			int digit = "零一二三四五六七八九".indexOf(c);
			if (c == '两') {
				digit = 2;
			}
			if (digit >= 0) {
				current = digit;
			} else if (c == '十') {
				total += (current == 0 ? 1 : current) * 10;
				current = 0;
			} else if (c == '百') {
				total += (current == 0 ? 1 : current) * 100;
				current = 0;
			} else {
				return -1;
			}
		}
		return total + current;
	}
}

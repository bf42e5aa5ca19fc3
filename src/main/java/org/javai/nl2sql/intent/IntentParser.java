package org.javai.nl2sql.intent;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.javai.nl2sql.catalog.SchemaCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rule-based reading of a question into an {@link Intent} and the catalog tables it
 * mentions.
 *
 * <p>Parsing never fails: a question that yields nothing specific produces the
 * default intent with {@code defaulted = true}, and the workflow carries on.</p>
 */
public class IntentParser {

	private static final Logger logger = LoggerFactory.getLogger(IntentParser.class);

	private static final Pattern THIS_YEAR = Pattern.compile(QuestionPatterns.word("this year") + "|今年|本年");
	private static final Pattern LAST_YEAR = Pattern.compile(QuestionPatterns.word("last year") + "|去年|上一年");
	private static final Pattern THIS_MONTH = Pattern.compile(QuestionPatterns.word("this month") + "|本月|这个月");
	private static final Pattern LAST_MONTH = Pattern.compile(QuestionPatterns.word("last month") + "|上个?月");
	private static final Pattern THIS_WEEK = Pattern.compile(QuestionPatterns.word("this week") + "|本周|这周|这个星期");
	private static final Pattern LAST_WEEK = Pattern.compile(QuestionPatterns.word("last week") + "|上周|上个星期");
	private static final Pattern TODAY = Pattern.compile(QuestionPatterns.word("today") + "|今天|今日");
	private static final Pattern YESTERDAY = Pattern.compile(QuestionPatterns.word("yesterday") + "|昨天|昨日");
	private static final Pattern LAST_N_EN = Pattern.compile(
			QuestionPatterns.word("(?:last|past|recent|previous)\\s+(\\d+)\\s+(day|week|month|year)s?"));
	private static final Pattern LAST_N_CN = Pattern.compile(
			"(?:最近|过去|近)\\s*(\\d+|" + QuestionPatterns.CN_NUMBER + ")\\s*个?\\s*(天|日|周|星期|月|年)");
	private static final Pattern EXPLICIT_YEAR = Pattern.compile("(?<!\\d)((?:19|20)\\d{2})(?!\\d)");

	private final Clock clock;

	public IntentParser() {
		this(Clock.systemDefaultZone());
	}

	public IntentParser(Clock clock) {
		this.clock = Objects.requireNonNull(clock, "clock must not be null");
	}

	public ParsedQuestion parse(String question, SchemaCatalog catalog) {
		String text = question != null ? question.trim() : "";
		Integer rowLimit = parseRowLimit(text);
		TimeRange timeRange = parseTimeRange(text);
		QuestionType type = parseType(text);
		List<String> tables = matchTables(text, catalog);

		boolean defaulted = type == QuestionType.QUERY && rowLimit == null && timeRange == null;
		Intent intent = new Intent(type, rowLimit, timeRange, defaulted);
		if (defaulted) {
			logger.debug("No specific intent found in question; using default intent");
		}
		logger.debug("Parsed intent {} with tables {}", intent, tables);
		return new ParsedQuestion(intent, tables);
	}

	QuestionType parseType(String text) {
		if (QuestionPatterns.mentions(QuestionPatterns.AGGREGATE, text)) {
			return QuestionType.AGGREGATE;
		}
		if (QuestionPatterns.mentions(QuestionPatterns.SUPERLATIVE, QuestionPatterns.withoutTopN(text))) {
			return QuestionType.RANK;
		}
		if (QuestionPatterns.mentions(QuestionPatterns.LIST, text)
				|| QuestionPatterns.mentions(QuestionPatterns.TOP_N, text)) {
			return QuestionType.LIST;
		}
		if (QuestionPatterns.mentions(QuestionPatterns.LOOKUP, text)) {
			return QuestionType.LOOKUP;
		}
		return QuestionType.QUERY;
	}

	Integer parseRowLimit(String text) {
		Matcher m = QuestionPatterns.TOP_N.matcher(text);
		if (!m.find()) {
			return null;
		}
		String number = m.group(1) != null ? m.group(1) : m.group(2);
		int value = QuestionPatterns.parseNumber(number);
		return value > 0 ? value : null;
	}

	TimeRange parseTimeRange(String text) {
		LocalDate today = LocalDate.now(clock);
		String label = QuestionPatterns.firstMatch(LAST_N_EN, text);
		if (label != null) {
			Matcher m = LAST_N_EN.matcher(text);
			m.find();
			TimeRange range = lastN(label, today, QuestionPatterns.parseNumber(m.group(1)),
					m.group(2).toLowerCase(Locale.ROOT));
			if (range != null) {
				return range;
			}
		}
		label = QuestionPatterns.firstMatch(LAST_N_CN, text);
		if (label != null) {
			Matcher m = LAST_N_CN.matcher(text);
			m.find();
			int n = QuestionPatterns.parseNumber(m.group(1));
			String unit = switch (m.group(2)) {
				case "天", "日" -> "day";
				case "周", "星期" -> "week";
				case "月" -> "month";
				default -> "year";
			};
			TimeRange range = lastN(label, today, n, unit);
			if (range != null) {
				return range;
			}
		}
		if ((label = QuestionPatterns.firstMatch(THIS_YEAR, text)) != null) {
			LocalDate start = today.withDayOfYear(1);
			return new TimeRange(label, start, start.plusYears(1));
		}
		if ((label = QuestionPatterns.firstMatch(LAST_YEAR, text)) != null) {
			LocalDate start = today.withDayOfYear(1).minusYears(1);
			return new TimeRange(label, start, start.plusYears(1));
		}
		if ((label = QuestionPatterns.firstMatch(THIS_MONTH, text)) != null) {
			LocalDate start = today.withDayOfMonth(1);
			return new TimeRange(label, start, start.plusMonths(1));
		}
		if ((label = QuestionPatterns.firstMatch(LAST_MONTH, text)) != null) {
			LocalDate start = today.withDayOfMonth(1).minusMonths(1);
			return new TimeRange(label, start, start.plusMonths(1));
		}
		if ((label = QuestionPatterns.firstMatch(THIS_WEEK, text)) != null) {
			LocalDate start = today.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
			return new TimeRange(label, start, start.plusWeeks(1));
		}
		if ((label = QuestionPatterns.firstMatch(LAST_WEEK, text)) != null) {
			LocalDate start = today.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY)).minusWeeks(1);
			return new TimeRange(label, start, start.plusWeeks(1));
		}
		if ((label = QuestionPatterns.firstMatch(TODAY, text)) != null) {
			return new TimeRange(label, today, today.plusDays(1));
		}
		if ((label = QuestionPatterns.firstMatch(YESTERDAY, text)) != null) {
			return new TimeRange(label, today.minusDays(1), today);
		}
		Matcher year = EXPLICIT_YEAR.matcher(text);
		if (year.find()) {
			LocalDate start = LocalDate.of(Integer.parseInt(year.group(1)), 1, 1);
			return new TimeRange(year.group(1), start, start.plusYears(1));
		}
		return null;
	}

	/**
	 * @return the range, or null when {@code n} is not a usable count or reaches past
	 *         the supported calendar
	 */
	private static TimeRange lastN(String label, LocalDate today, int n, String unit) {
		if (n <= 0) {
			return null;
		}
		LocalDate end = today.plusDays(1);
		try {
			LocalDate start = switch (unit) {
				case "day" -> end.minusDays(n);
				case "week" -> end.minusWeeks(n);
				case "month" -> end.minusMonths(n);
				default -> end.minusYears(n);
			};
			return new TimeRange(label, start, end);
		}
		catch (DateTimeException e) {
			return null;
		}
	}

	/**
	 * Tables whose name, spaced name, singular/plural form or synonym occurs in the
	 * question, in catalog order.
	 */
	List<String> matchTables(String text, SchemaCatalog catalog) {
		if (catalog == null || text.isEmpty()) {
			return List.of();
		}
		String lower = text.toLowerCase(Locale.ROOT);
		Set<String> matched = new LinkedHashSet<>();
		for (SchemaCatalog.TableSchema table : catalog.tables().values()) {
			for (String term : termsFor(table)) {
				if (containsTerm(lower, term)) {
					matched.add(table.name());
					break;
				}
			}
		}
		return new ArrayList<>(matched);
	}

	private static List<String> termsFor(SchemaCatalog.TableSchema table) {
		List<String> terms = new ArrayList<>();
		String name = table.name().toLowerCase(Locale.ROOT);
		terms.add(name);
		String spaced = name.replace('_', ' ');
		terms.add(spaced);
		terms.add(spaced.endsWith("s") ? spaced.substring(0, spaced.length() - 1) : spaced + "s");
		table.synonyms().forEach(s -> terms.add(s.toLowerCase(Locale.ROOT)));
		return terms;
	}

	private static boolean containsTerm(String text, String term) {
		if (term.isBlank()) {
			return false;
		}
		boolean ascii = term.chars().allMatch(c -> c < 128);
		if (!ascii) {
			return text.contains(term);
		}
		return Pattern.compile(QuestionPatterns.word(Pattern.quote(term))).matcher(text).find();
	}
}

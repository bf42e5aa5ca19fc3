package org.javai.nl2sql.clarify;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.apache.commons.lang3.StringUtils;
import org.javai.nl2sql.intent.QuestionPatterns;
import org.javai.nl2sql.llm.CompletionRequest;
import org.javai.nl2sql.llm.PromptTemplates;
import org.javai.nl2sql.llm.TextCompletionClient;
import org.javai.nl2sql.memory.MemoryEntry;
import org.javai.nl2sql.memory.MemoryFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Produces closed clarification questions and merges the user's answer back into
 * the working question.
 */
public class Clarifier {

	private static final Logger logger = LoggerFactory.getLogger(Clarifier.class);

	private static final Pattern QUESTION_LINE = Pattern.compile("^\\s*(?:QUESTION|问题)\\s*[:：]\\s*(.+)$",
			Pattern.CASE_INSENSITIVE);
	private static final Pattern OPTION_LINE = Pattern.compile("^\\s*(?:\\d+\\s*[.)、．]|[-*•])\\s*(.+)$");
	private static final Pattern CJK = Pattern.compile("[\\u4e00-\\u9fff]");

	private static final Map<AmbiguityKind, List<String>> DEFAULT_OPTIONS_EN = Map.of(
			AmbiguityKind.REFERENCE, List.of("The results of my previous question", "All records"),
			AmbiguityKind.TIME_RANGE, List.of("this year", "last year", "last 30 days", "all time"),
			AmbiguityKind.ORDERING, List.of("by number of sales", "by revenue", "by quantity"),
			AmbiguityKind.AGGREGATION, List.of("count", "total", "average"));

	private static final Map<AmbiguityKind, List<String>> DEFAULT_OPTIONS_CN = Map.of(
			AmbiguityKind.REFERENCE, List.of("上一个问题的结果", "全部记录"),
			AmbiguityKind.TIME_RANGE, List.of("今年", "去年", "最近30天", "全部时间"),
			AmbiguityKind.ORDERING, List.of("按销量", "按销售额", "按数量"),
			AmbiguityKind.AGGREGATION, List.of("数量", "总额", "平均值"));

	private final TextCompletionClient completionClient;

	public Clarifier(TextCompletionClient completionClient) {
		this.completionClient = Objects.requireNonNull(completionClient, "completionClient must not be null");
	}

	/**
	 * Asks the model for a closed question about {@code finding}.
	 *
	 * @throws org.javai.nl2sql.llm.CompletionException if the model cannot be reached
	 */
	public ClarificationRequest prepare(String workingQuestion, AmbiguityFinding finding, List<MemoryEntry> history) {
		Objects.requireNonNull(workingQuestion, "workingQuestion must not be null");
		Objects.requireNonNull(finding, "finding must not be null");
		String userPrompt = PromptTemplates.clarificationUser(workingQuestion, finding.describe(),
				MemoryFormatter.forClarification(history != null ? history : List.of()));
		String response = completionClient.complete(
				new CompletionRequest("clarify", PromptTemplates.CLARIFY_SYSTEM, userPrompt));
		ClarificationRequest request = parse(response, finding.kind(), isCjk(workingQuestion));
		logger.debug("Clarification for {}: {}", finding.kind(), StringUtils.abbreviate(request.render(), 200));
		return request;
	}

	/**
	 * Reads "QUESTION: ..." and a numbered list from a model response. Missing parts
	 * are filled with defaults for the ambiguity kind.
	 */
	static ClarificationRequest parse(String response, AmbiguityKind kind, boolean cjk) {
		String question = null;
		List<String> options = new ArrayList<>();
		List<String> unlabelled = new ArrayList<>();
		for (String line : (response == null ? "" : response).split("\\R")) {
			if (line.isBlank()) {
				continue;
			}
			Matcher q = QUESTION_LINE.matcher(line);
			if (q.matches() && question == null) {
				question = q.group(1).trim();
				continue;
			}
			Matcher o = OPTION_LINE.matcher(line);
			if (o.matches()) {
				if (options.size() < ClarificationRequest.MAX_OPTIONS) {
					options.add(o.group(1).trim());
				}
			}
			else {
				unlabelled.add(line.trim());
			}
		}
		if (question == null && !unlabelled.isEmpty()) {
			question = unlabelled.get(0);
		}
		if (question == null) {
			question = defaultQuestion(kind, cjk);
		}
		if (options.isEmpty()) {
			options.addAll((cjk ? DEFAULT_OPTIONS_CN : DEFAULT_OPTIONS_EN).get(kind));
		}
		return new ClarificationRequest(question, options, kind);
	}

	static String defaultQuestion(AmbiguityKind kind, boolean cjk) {
		if (cjk) {
			return switch (kind) {
				case REFERENCE -> "您指的是哪些数据？";
				case TIME_RANGE -> "您想查询哪个时间范围？";
				case ORDERING -> "您希望按什么指标排序？";
				case AGGREGATION -> "您希望统计什么数值？";
			};
		}
		return "Could you tell me " + kind.description() + "?";
	}

	/**
	 * Appends the user's answer to the working question. A number that matches an
	 * option index selects that option. Questions containing Chinese get full-width
	 * parentheses.
	 *
	 * @return the merged question; the working question unchanged for a blank answer
	 */
	public static String merge(String workingQuestion, String answer, List<String> options) {
		Objects.requireNonNull(workingQuestion, "workingQuestion must not be null");
		String text = resolveAnswer(answer, options);
		if (text.isEmpty()) {
			return workingQuestion;
		}
		if (isCjk(workingQuestion)) {
			return workingQuestion + "（" + text + "）";
		}
		return workingQuestion + " (" + text + ")";
	}

	/**
	 * @return the selected option for a numeric answer, otherwise the trimmed answer
	 */
	public static String resolveAnswer(String answer, List<String> options) {
		String text = answer == null ? "" : answer.trim();
		if (options != null && !text.isEmpty() && text.chars().allMatch(Character::isDigit)) {
			int choice = QuestionPatterns.parseNumber(text);
			if (choice >= 1 && choice <= options.size()) {
				return options.get(choice - 1);
			}
		}
		return text;
	}

	static boolean isCjk(String text) {
		return text != null && CJK.matcher(text).find();
	}
}

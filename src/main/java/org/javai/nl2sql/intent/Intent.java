package org.javai.nl2sql.intent;

import java.util.Objects;

/**
 * Structured reading of a question.
 *
 * @param questionType what kind of answer is expected
 * @param rowLimit explicit row limit requested by the user, or null
 * @param timeRange resolved time bound, or null
 * @param defaulted true when nothing specific could be read from the question
 */
public record Intent(
		QuestionType questionType,
		Integer rowLimit,
		TimeRange timeRange,
		boolean defaulted
) {

	public Intent {
		Objects.requireNonNull(questionType, "questionType must not be null");
		if (rowLimit != null && rowLimit < 1) {
			throw new IllegalArgumentException("rowLimit must be >= 1");
		}
	}

	public static Intent defaultIntent() {
		return new Intent(QuestionType.QUERY, null, null, true);
	}

	public boolean hasTimeRange() {
		return timeRange != null;
	}
}

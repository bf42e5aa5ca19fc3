package org.javai.nl2sql.intent;

import java.time.LocalDate;
import java.util.Objects;

/**
 * A resolved, half-open date interval {@code [start, end)}.
 *
 * @param label the phrase it was resolved from, e.g. "this year"
 * @param start first day included
 * @param end first day excluded
 */
public record TimeRange(String label, LocalDate start, LocalDate end) {

	public TimeRange {
		Objects.requireNonNull(label, "label must not be null");
		Objects.requireNonNull(start, "start must not be null");
		Objects.requireNonNull(end, "end must not be null");
		if (!end.isAfter(start)) {
			throw new IllegalArgumentException("end must be after start");
		}
	}

	@Override
	public String toString() {
		return label + " [" + start + ", " + end + ")";
	}
}

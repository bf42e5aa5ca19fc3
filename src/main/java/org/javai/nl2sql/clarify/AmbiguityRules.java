package org.javai.nl2sql.clarify;

import static org.javai.nl2sql.intent.QuestionPatterns.AGGREGATE;
import static org.javai.nl2sql.intent.QuestionPatterns.METRIC;
import static org.javai.nl2sql.intent.QuestionPatterns.PRONOUN;
import static org.javai.nl2sql.intent.QuestionPatterns.RELATIVE_TIME;
import static org.javai.nl2sql.intent.QuestionPatterns.SPECIFIC_AGGREGATION;
import static org.javai.nl2sql.intent.QuestionPatterns.SUPERLATIVE;
import static org.javai.nl2sql.intent.QuestionPatterns.VAGUE_AGGREGATION;

import java.util.List;
import java.util.Optional;
import org.javai.nl2sql.intent.QuestionPatterns;

/**
 * The built-in ambiguity rules. {@link #defaults()} lists them most specific first.
 */
public final class AmbiguityRules {

	private AmbiguityRules() {
	}

	public static List<AmbiguityRule> defaults() {
		return List.of(
				pronounWithoutAntecedent(),
				unresolvedRelativeTime(),
				superlativeWithoutTimeBound(),
				superlativeWithoutMetric(),
				vagueAggregation());
	}

	/**
	 * "show their invoices" as the first question of a session.
	 */
	public static AmbiguityRule pronounWithoutAntecedent() {
		return context -> {
			if (context.hasAntecedent()) {
				return Optional.empty();
			}
			return finding(AmbiguityKind.REFERENCE, QuestionPatterns.firstMatch(PRONOUN, context.question()),
					"pronoun-without-antecedent");
		};
	}

	/**
	 * "recent invoices": a relative time word the parser could not resolve to dates.
	 */
	public static AmbiguityRule unresolvedRelativeTime() {
		return context -> {
			if (context.intent().hasTimeRange()) {
				return Optional.empty();
			}
			return finding(AmbiguityKind.TIME_RANGE, QuestionPatterns.firstMatch(RELATIVE_TIME, context.question()),
					"unresolved-relative-time");
		};
	}

	/**
	 * "most popular genre": a ranking with no period to rank over. An explicit
	 * "top N" is a row limit, not a superlative.
	 */
	public static AmbiguityRule superlativeWithoutTimeBound() {
		return context -> {
			if (context.intent().hasTimeRange()) {
				return Optional.empty();
			}
			return finding(AmbiguityKind.TIME_RANGE, superlative(context), "superlative-without-time-bound");
		};
	}

	/**
	 * "the best artist": a ranking with no measure to rank by.
	 */
	public static AmbiguityRule superlativeWithoutMetric() {
		return context -> {
			if (QuestionPatterns.mentions(METRIC, context.question())) {
				return Optional.empty();
			}
			return finding(AmbiguityKind.ORDERING, superlative(context), "superlative-without-metric");
		};
	}

	/**
	 * "sales overview": a summary request that names no aggregation.
	 */
	public static AmbiguityRule vagueAggregation() {
		return context -> {
			String question = context.question();
			if (QuestionPatterns.mentions(SPECIFIC_AGGREGATION, question) || QuestionPatterns.mentions(AGGREGATE, question)) {
				return Optional.empty();
			}
			return finding(AmbiguityKind.AGGREGATION, QuestionPatterns.firstMatch(VAGUE_AGGREGATION, question),
					"vague-aggregation");
		};
	}

	private static String superlative(AmbiguityContext context) {
		return QuestionPatterns.firstMatch(SUPERLATIVE, QuestionPatterns.withoutTopN(context.question()));
	}

	private static Optional<AmbiguityFinding> finding(AmbiguityKind kind, String trigger, String rule) {
		if (trigger == null) {
			return Optional.empty();
		}
		return Optional.of(new AmbiguityFinding(kind, trigger.trim(), rule));
	}
}

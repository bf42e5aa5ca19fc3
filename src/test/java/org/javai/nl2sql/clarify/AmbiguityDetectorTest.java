package org.javai.nl2sql.clarify;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import org.javai.nl2sql.catalog.SchemaCatalog;
import org.javai.nl2sql.intent.IntentParser;
import org.javai.nl2sql.memory.MemoryEntry;
import org.javai.nl2sql.testsupport.ChinookCatalog;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

class AmbiguityDetectorTest {

	private static final Instant NOW = Instant.parse("2024-06-15T12:00:00Z");

	private final SchemaCatalog catalog = ChinookCatalog.load();
	private final IntentParser parser = new IntentParser(Clock.fixed(NOW, ZoneOffset.UTC));
	private final AmbiguityDetector detector = new AmbiguityDetector();

	private Optional<AmbiguityFinding> detect(String question, List<MemoryEntry> history) {
		return detector.detect(new AmbiguityContext(question, parser.parse(question, catalog).intent(), history));
	}

	@ParameterizedTest
	@CsvSource({
			"most popular genre, TIME_RANGE, most, superlative-without-time-bound",
			"the best artist this year, ORDERING, best, superlative-without-metric",
			"show their invoices, REFERENCE, their, pronoun-without-antecedent",
			"recent invoices by country, TIME_RANGE, recent, unresolved-relative-time",
			"sales overview, AGGREGATION, overview, vague-aggregation",
			"最受欢迎的流派, TIME_RANGE, 最, superlative-without-time-bound",
			"最近的订单, TIME_RANGE, 最近, unresolved-relative-time"
	})
	void flagsAmbiguousQuestions(String question, AmbiguityKind kind, String trigger, String rule) {
		AmbiguityFinding finding = detect(question, List.of()).orElseThrow();

		assertThat(finding.kind()).isEqualTo(kind);
		assertThat(finding.trigger()).isEqualTo(trigger);
		assertThat(finding.rule()).isEqualTo(rule);
	}

	@ParameterizedTest
	@ValueSource(strings = {
			"查询前5个客户的名字和邮箱",
			"top 5 customers by total spent",
			"most popular genre this year",
			"total sales overview",
			"how many tracks are there"
	})
	void acceptsSpecificQuestions(String question) {
		assertThat(detect(question, List.of())).isEmpty();
	}

	@Test
	void pronounIsFineOnceTheSessionHasHistory() {
		List<MemoryEntry> history = List.of(MemoryEntry.query(1, "top 5 customers", NOW));

		assertThat(detect("show their invoices", history)).isEmpty();
	}

	@Test
	void clarificationsAloneAreNoAntecedent() {
		List<MemoryEntry> history = List.of(MemoryEntry.clarification(1, "Q: which period? A: this year", NOW));

		assertThat(detect("show their invoices", history)).map(AmbiguityFinding::kind).contains(AmbiguityKind.REFERENCE);
	}

	@Test
	void firstMatchingRuleWins() {
		AmbiguityRule always = context -> Optional.of(new AmbiguityFinding(AmbiguityKind.AGGREGATION, "x", "custom"));
		AmbiguityDetector custom = new AmbiguityDetector(List.of(context -> Optional.empty(), always,
				AmbiguityRules.superlativeWithoutTimeBound()));

		AmbiguityFinding finding = custom.detect(new AmbiguityContext("most popular genre",
				parser.parse("most popular genre", catalog).intent(), List.of())).orElseThrow();

		assertThat(finding.rule()).isEqualTo("custom");
	}

	@Test
	void findingDescribesItsTrigger() {
		assertThat(new AmbiguityFinding(AmbiguityKind.TIME_RANGE, "most", "r").describe())
				.isEqualTo("\"most\": it is unclear which time period the question is about.");
		assertThat(new AmbiguityFinding(AmbiguityKind.ORDERING, null, null).describe())
				.isEqualTo("It is unclear which measure the ranking should use.");
	}
}

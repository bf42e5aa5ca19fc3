package org.javai.nl2sql.memory;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class MemoryFormatterTest {

	private static final Instant AT = Instant.parse("2024-06-15T09:30:00Z");

	private final List<MemoryEntry> history = List.of(
			MemoryEntry.query(1, "top 5 customers", AT),
			MemoryEntry.clarification(1, "Q: which period? A: this year", AT),
			MemoryEntry.answer(1, "Here are 5 customers", "SELECT * FROM customer LIMIT 5", 5, AT),
			MemoryEntry.chat(2, "Hello!", AT));

	@Test
	void generationHistoryLeavesOutClarifications() {
		String text = MemoryFormatter.forGeneration(history);

		assertThat(text)
				.contains("[09:30:00] User: top 5 customers")
				.contains("Executed SQL: SELECT * FROM customer LIMIT 5")
				.contains("Returned 5 rows")
				.contains("Assistant (chat): Hello!")
				.doesNotContain("which period");
	}

	@Test
	void clarificationHistoryKeepsEverything() {
		String text = MemoryFormatter.forClarification(history);

		assertThat(text).contains("Clarified: Q: which period? A: this year", "SQL: SELECT * FROM customer LIMIT 5");
	}

	@Test
	void emptyHistoryRendersNothing() {
		assertThat(MemoryFormatter.forGeneration(List.of())).isEmpty();
		assertThat(MemoryFormatter.forGeneration(List.of(history.get(1)))).isEmpty();
		assertThat(MemoryFormatter.forClarification(List.of())).isEmpty();
	}
}

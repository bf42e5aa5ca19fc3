package org.javai.nl2sql.workflow;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.apache.logging.log4j.Level;
import org.javai.nl2sql.catalog.CatalogRegistry;
import org.javai.nl2sql.catalog.InMemorySchemaCatalog;
import org.javai.nl2sql.execute.QueryResult;
import org.javai.nl2sql.llm.CompletionRequest;
import org.javai.nl2sql.llm.TextCompletionClient;
import org.javai.nl2sql.memory.ContextMemory;
import org.javai.nl2sql.memory.ContextMemoryConfig;
import org.javai.nl2sql.memory.MemoryEntry;
import org.javai.nl2sql.testsupport.ChinookCatalog;
import org.javai.nl2sql.testsupport.LogCaptorAppender;
import org.javai.nl2sql.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class Nl2SqlServiceTest {

	private static final String GENRE_SQL = "SELECT g.name, COUNT(*) AS plays FROM genre g "
			+ "JOIN track t ON t.genre_id = g.genre_id GROUP BY g.name ORDER BY plays DESC LIMIT 1";

	private final TextCompletionClient client = mock(TextCompletionClient.class);
	private final ContextMemory memory = new ContextMemory();
	private Nl2SqlService service;

	@BeforeEach
	void setUp() {
		when(client.complete(any())).thenAnswer(invocation -> {
			CompletionRequest request = invocation.getArgument(0);
			switch (request.purpose()) {
				case "generate":
					return request.userPrompt().contains("genre") ? GENRE_SQL : "SELECT first_name FROM customer LIMIT 5";
				case "clarify":
					return "QUESTION: Which period?\n1. this year\n2. all time";
				default:
					return "Done.";
			}
		});
		Orchestrator orchestrator = Orchestrator.builder()
				.completionClient(client)
				.executor(decision -> new QueryResult(List.of("value"), List.of(List.of("x"))))
				.memory(memory)
				.build();
		service = new Nl2SqlService(orchestrator, new CatalogRegistry(ChinookCatalog.load()));
	}

	@Test
	void numbersTurnsPerSession() {
		service.runQuery("top 5 customers", "a");
		service.runQuery("top 5 customers", "a");
		service.runQuery("top 5 customers", "b");

		assertThat(service.catalog().catalog().tables()).isNotEmpty();
		try (LogCaptorAppender turns = LogCaptorAppender.forLogger(Slf4jTurnLog.LOGGER_NAME, Level.INFO)) {
			QueryResponse response = service.runQuery("top 5 customers", "a");

			assertThat(response.isDone()).isTrue();
			assertThat(turns.messages()).singleElement().asString()
					.contains("\"sessionId\":\"a\"", "\"turnIndex\":3", "\"status\":\"DONE\"",
							"\"normalizedSql\":\"SELECT first_name FROM customer LIMIT 5\"",
							"\"timings\":{\"steps\":[{\"state\":\"START\",\"elapsedMillis\":",
							"\"perState\":{\"START\":", "\"EXECUTING\":", "\"totalMillis\":");
		}
	}

	@Test
	void rejectsBlankInput() {
		assertThatThrownBy(() -> service.runQuery(" ", "a")).isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> service.runQuery("top 5 customers", "")).isInstanceOf(IllegalArgumentException.class);
	}

	@Nested
	@DisplayName("Clarification round trip")
	class Clarification {

		@Test
		void answerCompletesParkedRun() {
			QueryResponse asked = service.runQuery("most popular genre", "s1");
			assertThat(asked.needsClarification()).isTrue();
			assertThat(asked.clarificationOptions()).containsExactly("this year", "all time");
			assertThat(service.isAwaitingClarification("s1")).isTrue();

			QueryResponse answered = service.answerClarification("s1", "1");

			assertThat(answered.isDone()).isTrue();
			assertThat(answered.clarificationRoundCount()).isEqualTo(1);
			assertThat(service.isAwaitingClarification("s1")).isFalse();
		}

		@Test
		void answerWithoutParkedRunIsRejected() {
			assertThatThrownBy(() -> service.answerClarification("nobody", "1"))
					.isInstanceOf(IllegalStateException.class)
					.hasMessageContaining("Unknown session");

			service.runQuery("top 5 customers", "s1");
			assertThatThrownBy(() -> service.answerClarification("s1", "1"))
					.isInstanceOf(IllegalStateException.class)
					.hasMessageContaining("not awaiting");
		}

		@Test
		void cancelDiscardsParkedRun() {
			service.runQuery("most popular genre", "s1");

			assertThat(service.cancel("s1")).isTrue();
			assertThat(service.cancel("s1")).isFalse();
			assertThat(service.isAwaitingClarification("s1")).isFalse();
		}

		@Test
		void newQuestionAbandonsParkedRun() {
			service.runQuery("most popular genre", "s1");

			QueryResponse next = service.runQuery("top 5 customers", "s1");

			assertThat(next.isDone()).isTrue();
			assertThat(service.isAwaitingClarification("s1")).isFalse();
		}
	}

	@Test
	void endSessionForgetsMemory() {
		service.runQuery("top 5 customers", "s1");

		service.endSession("s1");

		QueryResponse again = service.runQuery("show their invoices", "s1");
		assertThat(again.needsClarification()).as("no antecedent after the session ended").isTrue();
	}

	@Nested
	@DisplayName("Idle sessions")
	class IdleSessions {

		private final MutableClock clock = new MutableClock(Instant.parse("2024-06-15T10:00:00Z"));
		private final ContextMemory timedMemory = new ContextMemory(
				ContextMemoryConfig.builder().ttl(Duration.ofMinutes(30)).build(), clock);
		private Nl2SqlService timed;

		@BeforeEach
		void setUp() {
			timed = new Nl2SqlService(Orchestrator.builder()
					.completionClient(client)
					.executor(decision -> new QueryResult(List.of("value"), List.of(List.of("x"))))
					.memory(timedMemory)
					.clock(clock)
					.build(), new CatalogRegistry(ChinookCatalog.load()));
		}

		@Test
		void idleSessionIsForgottenAfterTtl() {
			timed.runQuery("top 5 customers", "idle");
			timed.runQuery("top 5 customers", "idle");
			clock.advance(Duration.ofMinutes(31));

			assertThat(timed.evictIdleSessions()).isEqualTo(1);
			assertThat(timed.sessionCount()).isZero();
			assertThat(timedMemory.entries("idle")).isEmpty();

			timed.runQuery("top 5 customers", "idle");
			assertThat(timedMemory.entries("idle")).extracting(MemoryEntry::turnIndex).containsOnly(1);
		}

		@Test
		void recentlyUsedSessionIsKept() {
			timed.runQuery("top 5 customers", "busy");
			clock.advance(Duration.ofMinutes(20));
			timed.runQuery("top 5 customers", "busy");
			clock.advance(Duration.ofMinutes(20));

			assertThat(timed.evictIdleSessions()).isZero();
			assertThat(timed.sessionCount()).isEqualTo(1);
		}

		@Test
		void parkedSessionSurvivesTheSweep() {
			timed.runQuery("most popular genre", "parked");
			timed.runQuery("top 5 customers", "idle");
			clock.advance(Duration.ofHours(2));

			timed.runQuery("top 5 customers", "fresh");

			assertThat(timed.sessionCount()).isEqualTo(2);
			assertThat(timed.isAwaitingClarification("parked")).isTrue();
			assertThat(timed.answerClarification("parked", "2").isDone()).isTrue();
		}
	}

	@Test
	void reloadedCatalogAppliesToNewRuns() {
		service.reloadCatalog(new InMemorySchemaCatalog()
				.addTable("customer")
				.addColumn("customer", "first_name", "TEXT", false, false));

		QueryResponse response = service.runQuery("top 5 customers", "s1");

		assertThat(response.isDone()).isTrue();
		assertThat(service.catalog().version()).isEqualTo(2);
		assertThat(service.catalog().catalog().tables()).containsOnlyKeys("customer");
	}

	@Test
	void sessionsRunConcurrently() throws Exception {
		ExecutorService pool = Executors.newFixedThreadPool(4);
		try {
			List<Future<QueryResponse>> futures = new ArrayList<>();
			for (int i = 0; i < 8; i++) {
				String session = "session-" + (i % 4);
				futures.add(pool.submit(() -> service.runQuery("top 5 customers", session)));
			}
			for (Future<QueryResponse> future : futures) {
				assertThat(future.get(10, TimeUnit.SECONDS).isDone()).isTrue();
			}
		}
		finally {
			pool.shutdownNow();
		}

		for (int s = 0; s < 4; s++) {
			assertThat(memory.entries("session-" + s))
					.extracting(MemoryEntry::turnIndex)
					.containsExactly(1, 1, 2, 2);
		}
	}
}

package org.javai.nl2sql.workflow;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.time.Duration;
import org.javai.nl2sql.catalog.SchemaCatalog;
import org.javai.nl2sql.llm.CompletionTimeoutException;
import org.javai.nl2sql.llm.TextCompletionClient;
import org.javai.nl2sql.testsupport.ChinookCatalog;
import org.junit.jupiter.api.Test;

class SqlCriticTest {

	private final SchemaCatalog catalog = ChinookCatalog.load();
	private final TextCompletionClient client = mock(TextCompletionClient.class);
	private final SqlCritic critic = new SqlCritic(client);

	@Test
	void returnsModelRationale() {
		when(client.complete(argThat(r -> r.purpose().equals("critique")
				&& r.userPrompt().contains("no such column: signup_date"))))
				.thenReturn("customer has no signup_date column; order by customer_id instead.\n");

		String critique = critic.critique("list customers", "SELECT * FROM customer ORDER BY signup_date",
				"EXECUTION_ERROR: no such column: signup_date", catalog);

		assertThat(critique).isEqualTo("customer has no signup_date column; order by customer_id instead.");
	}

	@Test
	void fallsBackToDiagnosticWhenModelTimesOut() {
		when(client.complete(argThat(r -> true)))
				.thenThrow(new CompletionTimeoutException("critique", Duration.ofSeconds(1)));

		String critique = critic.critique("list customers", null, "SANDBOX_DENIED: MULTI_STATEMENT", catalog);

		assertThat(critique)
				.startsWith("The previous SQL failed with:\nSANDBOX_DENIED: MULTI_STATEMENT\n")
				.isEqualTo(SqlCritic.fallback("SANDBOX_DENIED: MULTI_STATEMENT"));
	}
}

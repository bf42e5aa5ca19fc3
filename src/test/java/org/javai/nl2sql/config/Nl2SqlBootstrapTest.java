package org.javai.nl2sql.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

import javax.sql.DataSource;
import org.javai.nl2sql.execute.QueryExecutor;
import org.javai.nl2sql.llm.TextCompletionClient;
import org.javai.nl2sql.testsupport.ChinookCatalog;
import org.javai.nl2sql.workflow.Nl2SqlService;
import org.junit.jupiter.api.Test;

class Nl2SqlBootstrapTest {

	@Test
	void requiresCatalogPath() {
		assertThatThrownBy(() -> Nl2SqlBootstrap.create(Nl2SqlProperties.defaults(), mock(DataSource.class)))
				.isInstanceOf(IllegalStateException.class)
				.hasMessageContaining("catalog.path");
	}

	@Test
	void wiresServiceAroundCatalog() {
		Nl2SqlService service = Nl2SqlBootstrap.create(Nl2SqlProperties.defaults(), ChinookCatalog.load(),
				mock(TextCompletionClient.class), mock(QueryExecutor.class));

		assertThat(service.catalog().version()).isEqualTo(1);
		assertThat(service.catalog().joinGraph().contains("invoice_line")).isTrue();
		assertThat(service.isAwaitingClarification("s1")).isFalse();
	}
}

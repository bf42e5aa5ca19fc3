package org.javai.nl2sql.config;

import java.nio.file.Path;
import java.time.Clock;
import java.util.Objects;
import javax.sql.DataSource;
import org.javai.nl2sql.catalog.CatalogRegistry;
import org.javai.nl2sql.catalog.SchemaCatalog;
import org.javai.nl2sql.catalog.SchemaCatalogLoader;
import org.javai.nl2sql.execute.JdbcQueryExecutor;
import org.javai.nl2sql.execute.QueryExecutor;
import org.javai.nl2sql.llm.ChatClientFactory;
import org.javai.nl2sql.llm.TextCompletionClient;
import org.javai.nl2sql.memory.ContextMemory;
import org.javai.nl2sql.sandbox.SqlSandbox;
import org.javai.nl2sql.workflow.Nl2SqlService;
import org.javai.nl2sql.workflow.Orchestrator;
import org.javai.nl2sql.workflow.Slf4jTurnLog;

/**
 * Wires a {@link Nl2SqlService} from {@link Nl2SqlProperties}.
 */
public final class Nl2SqlBootstrap {

	private Nl2SqlBootstrap() {
	}

	/**
	 * Loads the catalog named by {@code catalog.path} and connects to the configured
	 * language model.
	 *
	 * @throws IllegalStateException if no catalog path or API key is configured
	 */
	public static Nl2SqlService create(Nl2SqlProperties properties, DataSource dataSource) {
		Objects.requireNonNull(properties, "properties must not be null");
		if (properties.catalogPath() == null) {
			throw new IllegalStateException("No schema catalog configured; set catalog.path");
		}
		SchemaCatalog catalog = new SchemaCatalogLoader().load(Path.of(properties.catalogPath()));
		return create(properties, catalog, ChatClientFactory.createCompletionClient(properties.completion()),
				new JdbcQueryExecutor(dataSource));
	}

	public static Nl2SqlService create(Nl2SqlProperties properties, SchemaCatalog catalog,
			TextCompletionClient completionClient, QueryExecutor executor) {
		Clock clock = Clock.systemUTC();
		Orchestrator orchestrator = Orchestrator.builder()
				.completionClient(completionClient)
				.executor(executor)
				.sandbox(new SqlSandbox(properties.sandbox()))
				.memory(new ContextMemory(properties.memory(), clock))
				.turnLog(new Slf4jTurnLog())
				.config(properties.workflow())
				.clock(clock)
				.build();
		return new Nl2SqlService(orchestrator, new CatalogRegistry(catalog));
	}
}

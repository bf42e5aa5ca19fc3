package org.javai.nl2sql.execute;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.Statement;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import org.javai.nl2sql.sandbox.DenyReason;
import org.javai.nl2sql.sandbox.SandboxDecision;
import org.javai.nl2sql.sandbox.SandboxPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;

class JdbcQueryExecutorTest {

	@TempDir
	Path dir;

	private JdbcQueryExecutor executor;

	@BeforeEach
	void createDatabase() throws Exception {
		String url = "jdbc:sqlite:" + dir.resolve("chinook.db");
		try (Connection conn = DriverManager.getConnection(url); Statement stmt = conn.createStatement()) {
			stmt.execute("CREATE TABLE artist (artist_id INTEGER PRIMARY KEY, name TEXT)");
			for (int i = 1; i <= 12; i++) {
				stmt.execute("INSERT INTO artist (artist_id, name) VALUES (" + i + ", 'Artist " + i + "')");
			}
			stmt.execute("INSERT INTO artist (artist_id, name) VALUES (13, NULL)");
		}
		SQLiteConfig config = new SQLiteConfig();
		config.setReadOnly(true);
		SQLiteDataSource dataSource = new SQLiteDataSource(config);
		dataSource.setUrl(url);
		executor = new JdbcQueryExecutor(dataSource, false);
	}

	private static SandboxDecision allowed(String sql, int maxRows) {
		SandboxPolicy policy = SandboxPolicy.builder().maxRows(maxRows).statementTimeout(Duration.ofSeconds(5)).build();
		return SandboxDecision.allow(sql, List.of("artist"), policy);
	}

	@Test
	void readsColumnsAndRows() {
		QueryResult result = executor.execute(allowed("SELECT artist_id, name AS artist_name FROM artist WHERE artist_id <= 2 ORDER BY artist_id", 10));

		assertThat(result.columns()).containsExactly("artist_id", "artist_name");
		assertThat(result.rows()).containsExactly(
				Arrays.asList(1, "Artist 1"),
				Arrays.asList(2, "Artist 2"));
		assertThat(result.truncated()).isFalse();
		assertThat(result.column("ARTIST_NAME")).containsExactly("Artist 1", "Artist 2");
	}

	@Test
	void keepsNullValues() {
		QueryResult result = executor.execute(allowed("SELECT name FROM artist WHERE artist_id = 13", 10));

		assertThat(result.rows()).singleElement().satisfies(row -> assertThat(row).containsExactly((Object) null));
	}

	@Test
	void truncatesAtMaxRows() {
		QueryResult result = executor.execute(allowed("SELECT artist_id FROM artist", 5));

		assertThat(result.rowCount()).isEqualTo(5);
		assertThat(result.truncated()).isTrue();
	}

	@Test
	void databaseErrorsAreWrapped() {
		assertThatThrownBy(() -> executor.execute(allowed("SELECT missing_column FROM artist", 10)))
				.isInstanceOf(QueryExecutionException.class)
				.hasMessageStartingWith("Query failed: ");
	}

	@Test
	void readOnlyConnectionRefusesWrites() {
		assertThatThrownBy(() -> executor.execute(allowed("DELETE FROM artist", 10)))
				.isInstanceOf(QueryExecutionException.class);
	}

	@Test
	void deniedDecisionIsNotExecuted() {
		SandboxDecision denied = SandboxDecision.deny(DenyReason.NOT_SELECT, "no", List.of(), SandboxPolicy.defaults());

		assertThatThrownBy(() -> executor.execute(denied)).isInstanceOf(IllegalArgumentException.class);
	}
}

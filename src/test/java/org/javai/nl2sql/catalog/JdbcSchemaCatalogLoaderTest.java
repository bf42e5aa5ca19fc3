package org.javai.nl2sql.catalog;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import javax.sql.DataSource;
import org.javai.nl2sql.catalog.SchemaCatalog.ColumnSchema;
import org.javai.nl2sql.catalog.SchemaCatalog.ForeignKey;
import org.javai.nl2sql.catalog.SchemaCatalogLoader.CatalogLoadException;
import org.javai.nl2sql.sandbox.SqlSandbox;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.sqlite.SQLiteDataSource;

class JdbcSchemaCatalogLoaderTest {

	@TempDir
	Path dir;

	private SQLiteDataSource dataSource;

	@BeforeEach
	void createDatabase() throws Exception {
		dataSource = new SQLiteDataSource();
		dataSource.setUrl("jdbc:sqlite:" + dir.resolve("music.db"));
		try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
			stmt.execute("CREATE TABLE artist (artist_id INTEGER PRIMARY KEY, name TEXT NOT NULL)");
			stmt.execute("CREATE TABLE album (album_id INTEGER PRIMARY KEY, title TEXT NOT NULL, "
					+ "artist_id INTEGER NOT NULL REFERENCES artist (artist_id))");
			stmt.execute("CREATE TABLE track (track_id INTEGER PRIMARY KEY, name TEXT, album_id INTEGER, "
					+ "composer_id INTEGER)");
		}
	}

	@Test
	void readsTablesColumnsAndKeys() {
		SchemaCatalog catalog = new JdbcSchemaCatalogLoader(dataSource).load();

		assertThat(catalog.tables()).containsOnlyKeys("artist", "album", "track");
		assertThat(catalog.findTable("artist")).get().satisfies(artist -> {
			assertThat(artist.columns()).containsExactly(
					new ColumnSchema("artist_id", "INTEGER", false, true),
					new ColumnSchema("name", "TEXT", false, false));
			assertThat(artist.synonyms()).isEmpty();
		});
		assertThat(catalog.findTable("album").orElseThrow().foreignKeys())
				.containsExactly(new ForeignKey("artist_id", "artist", "artist_id", false));
		assertThat(catalog.findTable("track").orElseThrow().foreignKeys()).isEmpty();
	}

	@Test
	void infersUndeclaredReferencesByColumnName() {
		SchemaCatalog catalog = new JdbcSchemaCatalogLoader(dataSource, true).load();

		assertThat(catalog.findTable("track").orElseThrow().foreignKeys())
				.containsExactly(new ForeignKey("album_id", "album", "album_id", true));
		assertThat(catalog.findTable("album").orElseThrow().foreignKeys())
				.as("declared keys are kept as they are")
				.containsExactly(new ForeignKey("artist_id", "artist", "artist_id", false));
	}

	@Test
	void loadedCatalogDrivesTheSandbox() {
		SchemaCatalog catalog = new JdbcSchemaCatalogLoader(dataSource).load();
		SqlSandbox sandbox = new SqlSandbox();

		assertThat(sandbox.check("SELECT a.name, al.title FROM album al JOIN artist a ON a.artist_id = al.artist_id",
				catalog).allowed()).isTrue();
		assertThat(sandbox.check("SELECT genre FROM track", catalog).allowed()).isFalse();
	}

	@Test
	void connectionFailureIsReported() throws Exception {
		DataSource broken = mock(DataSource.class);
		when(broken.getConnection()).thenThrow(new SQLException("connection refused"));

		assertThatThrownBy(() -> new JdbcSchemaCatalogLoader(broken).load())
				.isInstanceOf(CatalogLoadException.class)
				.hasMessageContaining("connection refused");
	}

	@Test
	void recognisesReferenceColumnNames() {
		assertThat(JdbcSchemaCatalogLoader.referencedBase("invoice_line_id")).isEqualTo("invoiceline");
		assertThat(JdbcSchemaCatalogLoader.referencedBase("CustomerId")).isEqualTo("customer");
		assertThat(JdbcSchemaCatalogLoader.referencedBase("id")).isNull();
		assertThat(JdbcSchemaCatalogLoader.referencedBase("title")).isNull();
	}
}

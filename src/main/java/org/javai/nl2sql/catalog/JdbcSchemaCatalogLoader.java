package org.javai.nl2sql.catalog;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import javax.sql.DataSource;
import org.apache.commons.lang3.StringUtils;
import org.javai.nl2sql.catalog.SchemaCatalog.ColumnSchema;
import org.javai.nl2sql.catalog.SchemaCatalog.ForeignKey;
import org.javai.nl2sql.catalog.SchemaCatalogLoader.CatalogLoadException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds a {@link SchemaCatalog} from the live database through {@link DatabaseMetaData}.
 *
 * <p>Tables, columns, primary keys and declared foreign keys are read as the driver
 * reports them. Engine tables ({@code sqlite_*}) are skipped. Synonyms are not stored
 * in the database, so the result carries none; merge them in from a catalog document
 * if the intent parser needs them.</p>
 *
 * <p>When {@code inferForeignKeys} is set, a table that declares no foreign keys gets
 * one for every non-key column named {@code <table>_id} or {@code <Table>Id} whose
 * target table has a single-column primary key.</p>
 */
public class JdbcSchemaCatalogLoader {

	private static final Logger logger = LoggerFactory.getLogger(JdbcSchemaCatalogLoader.class);

	private static final String[] TABLE_TYPES = { "TABLE" };

	private final DataSource dataSource;
	private final boolean inferForeignKeys;

	public JdbcSchemaCatalogLoader(DataSource dataSource) {
		this(dataSource, false);
	}

	public JdbcSchemaCatalogLoader(DataSource dataSource, boolean inferForeignKeys) {
		this.dataSource = Objects.requireNonNull(dataSource, "dataSource must not be null");
		this.inferForeignKeys = inferForeignKeys;
	}

	/**
	 * @throws CatalogLoadException if the metadata cannot be read
	 */
	public SchemaCatalog load() {
		try (Connection connection = dataSource.getConnection()) {
			DatabaseMetaData metaData = connection.getMetaData();
			Map<String, TableMeta> tables = readTables(metaData);
			InMemorySchemaCatalog catalog = new InMemorySchemaCatalog();
			int inferred = 0;
			for (TableMeta table : tables.values()) {
				catalog.addTable(table.name);
				for (ColumnSchema column : table.columns) {
					catalog.addColumn(table.name, column.name(), column.type(), column.nullable(), column.primaryKey());
				}
				List<ForeignKey> foreignKeys = readForeignKeys(metaData, table, tables);
				if (foreignKeys.isEmpty() && inferForeignKeys) {
					foreignKeys = inferForeignKeys(table, tables);
					inferred += foreignKeys.size();
				}
				foreignKeys.forEach(fk -> catalog.addForeignKey(table.name, fk));
			}
			logger.info("Read schema catalog from {} {} ({} tables, {} inferred foreign keys)",
					metaData.getDatabaseProductName(), metaData.getDatabaseProductVersion(), tables.size(), inferred);
			return catalog;
		}
		catch (SQLException e) {
			throw new CatalogLoadException("Failed to read database metadata: " + e.getMessage(), e);
		}
	}

	private static Map<String, TableMeta> readTables(DatabaseMetaData metaData) throws SQLException {
		Map<String, TableMeta> tables = new LinkedHashMap<>();
		try (ResultSet rs = metaData.getTables(null, null, "%", TABLE_TYPES)) {
			while (rs.next()) {
				String name = rs.getString("TABLE_NAME");
				if (name != null && !name.toLowerCase(Locale.ROOT).startsWith("sqlite_")) {
					tables.put(name, new TableMeta(name));
				}
			}
		}
		for (TableMeta table : tables.values()) {
			try (ResultSet rs = metaData.getPrimaryKeys(null, null, table.name)) {
				while (rs.next()) {
					table.primaryKeys.add(rs.getString("COLUMN_NAME"));
				}
			}
			try (ResultSet rs = metaData.getColumns(null, null, table.name, "%")) {
				while (rs.next()) {
					String column = rs.getString("COLUMN_NAME");
					boolean primaryKey = table.isPrimaryKey(column);
					boolean nullable = !primaryKey && rs.getInt("NULLABLE") != DatabaseMetaData.columnNoNulls;
					table.columns.add(new ColumnSchema(column, StringUtils.defaultString(rs.getString("TYPE_NAME")),
							nullable, primaryKey));
				}
			}
		}
		return tables;
	}

	private static List<ForeignKey> readForeignKeys(DatabaseMetaData metaData, TableMeta table,
			Map<String, TableMeta> tables) throws SQLException {
		List<ForeignKey> foreignKeys = new ArrayList<>();
		try (ResultSet rs = metaData.getImportedKeys(null, null, table.name)) {
			while (rs.next()) {
				String column = rs.getString("FKCOLUMN_NAME");
				String refTable = rs.getString("PKTABLE_NAME");
				String refColumn = rs.getString("PKCOLUMN_NAME");
				if (StringUtils.isBlank(refColumn)) {
					TableMeta target = tables.get(refTable);
					refColumn = target != null ? target.singlePrimaryKey() : null;
				}
				if (column == null || refTable == null || refColumn == null) {
					logger.debug("Skipping incomplete foreign key on {}.{}", table.name, column);
					continue;
				}
				foreignKeys.add(new ForeignKey(column, refTable, refColumn, table.isNullable(column)));
			}
		}
		return foreignKeys;
	}

	private static List<ForeignKey> inferForeignKeys(TableMeta table, Map<String, TableMeta> tables) {
		List<ForeignKey> foreignKeys = new ArrayList<>();
		for (ColumnSchema column : table.columns) {
			if (column.primaryKey()) {
				continue;
			}
			String base = referencedBase(column.name());
			if (base == null) {
				continue;
			}
			for (TableMeta target : tables.values()) {
				String targetKey = target.singlePrimaryKey();
				if (target != table && targetKey != null && squash(target.name).equals(base)) {
					foreignKeys.add(new ForeignKey(column.name(), target.name, targetKey, column.nullable()));
					logger.debug("Inferred foreign key {}.{} -> {}.{}", table.name, column.name(), target.name, targetKey);
					break;
				}
			}
		}
		return foreignKeys;
	}

	/**
	 * @return the squashed table name a column like {@code album_id} or {@code AlbumId}
	 *         points at, or null if the column does not look like a reference
	 */
	static String referencedBase(String columnName) {
		String base;
		if (columnName.length() > 3 && columnName.toLowerCase(Locale.ROOT).endsWith("_id")) {
			base = columnName.substring(0, columnName.length() - 3);
		}
		else if (columnName.length() > 2 && columnName.endsWith("Id")) {
			base = columnName.substring(0, columnName.length() - 2);
		}
		else {
			return null;
		}
		return squash(base);
	}

	private static String squash(String name) {
		return name.replace("_", "").toLowerCase(Locale.ROOT);
	}

	private static final class TableMeta {
		private final String name;
		private final List<ColumnSchema> columns = new ArrayList<>();
		private final List<String> primaryKeys = new ArrayList<>();

		private TableMeta(String name) {
			this.name = name;
		}

		private boolean isPrimaryKey(String column) {
			return primaryKeys.stream().anyMatch(pk -> pk.equalsIgnoreCase(column));
		}

		private boolean isNullable(String column) {
			return columns.stream()
					.filter(c -> c.name().equalsIgnoreCase(column))
					.findFirst()
					.map(ColumnSchema::nullable)
					.orElse(false);
		}

		private String singlePrimaryKey() {
			return primaryKeys.size() == 1 ? primaryKeys.get(0) : null;
		}
	}
}

package org.javai.nl2sql.catalog;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory {@link SchemaCatalog} for tests or programmatic configuration.
 *
 * <pre>{@code
 * SchemaCatalog catalog = new InMemorySchemaCatalog()
 *     .addTable("Customer")
 *     .withSynonyms("Customer", "customers", "客户")
 *     .addColumn("Customer", "CustomerId", "INTEGER", false, true)
 *     .addColumn("Customer", "SupportRepId", "INTEGER", true, false)
 *     .addForeignKey("Customer", "SupportRepId", "Employee", "EmployeeId");
 * }</pre>
 *
 * <p>Foreign keys take their nullability from the referencing column, so declare the
 * column before the key.</p>
 */
public final class InMemorySchemaCatalog implements SchemaCatalog {

	private final Map<String, TableBuilder> tables = new LinkedHashMap<>();

	public InMemorySchemaCatalog addTable(String name) {
		tables.computeIfAbsent(name, TableBuilder::new);
		return this;
	}

	public InMemorySchemaCatalog withSynonyms(String table, String... synonyms) {
		TableBuilder builder = require(table);
		if (synonyms != null) {
			Collections.addAll(builder.synonyms, synonyms);
		}
		return this;
	}

	public InMemorySchemaCatalog addColumn(String table, String column, String type, boolean nullable,
			boolean primaryKey) {
		require(table).columns.add(new ColumnSchema(column, type, nullable, primaryKey));
		return this;
	}

	/**
	 * Declares a foreign key whose nullability follows the referencing column.
	 */
	public InMemorySchemaCatalog addForeignKey(String table, String column, String refTable, String refColumn) {
		TableBuilder builder = require(table);
		boolean nullable = builder.columns.stream()
				.filter(c -> c.name().equalsIgnoreCase(column))
				.findFirst()
				.map(ColumnSchema::nullable)
				.orElse(false);
		builder.foreignKeys.add(new ForeignKey(column, refTable, refColumn, nullable));
		return this;
	}

	public InMemorySchemaCatalog addForeignKey(String table, ForeignKey foreignKey) {
		require(table).foreignKeys.add(foreignKey);
		return this;
	}

	@Override
	public Map<String, TableSchema> tables() {
		Map<String, TableSchema> result = new LinkedHashMap<>();
		tables.forEach((name, builder) -> result.put(name, builder.build()));
		return Collections.unmodifiableMap(result);
	}

	private TableBuilder require(String table) {
		TableBuilder builder = tables.get(table);
		if (builder == null) {
			throw new IllegalArgumentException("Unknown table: " + table + ". Call addTable first.");
		}
		return builder;
	}

	private static final class TableBuilder {
		private final String name;
		private final List<ColumnSchema> columns = new ArrayList<>();
		private final List<ForeignKey> foreignKeys = new ArrayList<>();
		private final List<String> synonyms = new ArrayList<>();

		private TableBuilder(String name) {
			this.name = name;
		}

		private TableSchema build() {
			return new TableSchema(name, columns, foreignKeys, synonyms);
		}
	}
}

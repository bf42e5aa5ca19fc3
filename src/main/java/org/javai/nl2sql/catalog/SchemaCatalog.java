package org.javai.nl2sql.catalog;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Read-only description of the queryable schema: tables, their columns and the
 * foreign keys between them.
 *
 * <p>The catalog is the single source of truth for identifier checks in the sandbox
 * and for the foreign-key graph used by join synthesis. Name lookups are
 * case-insensitive; synonyms only participate in natural-language matching, never in
 * SQL identifier checks.</p>
 */
public interface SchemaCatalog {

	/**
	 * @return map of canonical table name to table metadata, in declaration order
	 */
	Map<String, TableSchema> tables();

	/**
	 * Finds a table by its canonical name, ignoring case.
	 */
	default Optional<TableSchema> findTable(String tableName) {
		if (tableName == null || tableName.isBlank()) {
			return Optional.empty();
		}
		TableSchema exact = tables().get(tableName);
		if (exact != null) {
			return Optional.of(exact);
		}
		return tables().values().stream()
				.filter(t -> t.name().equalsIgnoreCase(tableName))
				.findFirst();
	}

	/**
	 * Resolves a table name or synonym to the canonical table name.
	 *
	 * @param candidate the table name to resolve (may be canonical or a synonym)
	 * @return the canonical table name, or empty if no match found
	 */
	default Optional<String> resolveTableName(String candidate) {
		if (candidate == null || candidate.isBlank()) {
			return Optional.empty();
		}
		return tables().values().stream()
				.filter(t -> t.matchesName(candidate))
				.map(TableSchema::name)
				.findFirst();
	}

	/**
	 * @return true if any table declares a column with this name
	 */
	default boolean hasColumnAnywhere(String columnName) {
		return tables().values().stream().anyMatch(t -> t.findColumn(columnName).isPresent());
	}

	record TableSchema(String name,
			List<ColumnSchema> columns,
			List<ForeignKey> foreignKeys,
			List<String> synonyms) {

		public TableSchema {
			Objects.requireNonNull(name, "name must not be null");
			columns = columns != null ? List.copyOf(columns) : List.of();
			foreignKeys = foreignKeys != null ? List.copyOf(foreignKeys) : List.of();
			synonyms = synonyms != null ? List.copyOf(synonyms) : List.of();
		}

		/**
		 * Returns true if the given name matches this table's name or any of its synonyms.
		 * Comparison is case-insensitive.
		 */
		public boolean matchesName(String candidate) {
			if (candidate == null) return false;
			if (name.equalsIgnoreCase(candidate)) return true;
			return synonyms.stream().anyMatch(s -> s.equalsIgnoreCase(candidate));
		}

		public Optional<ColumnSchema> findColumn(String columnName) {
			if (columnName == null || columnName.isBlank()) {
				return Optional.empty();
			}
			return columns.stream()
					.filter(c -> c.name().equalsIgnoreCase(columnName))
					.findFirst();
		}

		public List<String> columnNames() {
			return columns.stream().map(ColumnSchema::name).toList();
		}
	}

	record ColumnSchema(String name, String type, boolean nullable, boolean primaryKey) {

		public ColumnSchema {
			Objects.requireNonNull(name, "name must not be null");
			type = type != null ? type : "";
		}
	}

	/**
	 * A foreign key from a column of the owning table to a column of {@code refTable}.
	 * {@code nullable} mirrors the nullability of the referencing column and decides
	 * between INNER and LEFT joins.
	 */
	record ForeignKey(String column, String refTable, String refColumn, boolean nullable) {

		public ForeignKey {
			Objects.requireNonNull(column, "column must not be null");
			Objects.requireNonNull(refTable, "refTable must not be null");
			Objects.requireNonNull(refColumn, "refColumn must not be null");
		}
	}
}

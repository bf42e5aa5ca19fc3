package org.javai.nl2sql.catalog;

import java.util.Collection;
import java.util.StringJoiner;

/**
 * Renders a catalog as a schema block for model prompts.
 */
public final class CatalogPromptFormatter {

	private static final String CATALOG_FOOTER = """

			SQL table and column names MUST be taken from this catalog exactly as shown.
			- Use the table NAME shown before the colon, not the user's informal terms
			- For JOINs, follow the foreign keys shown as fk=table.column
			- If a name does not appear in this catalog, do not use it in SQL
			""";

	private CatalogPromptFormatter() {
	}

	public static String format(SchemaCatalog catalog) {
		return format(catalog, catalog.tables().keySet());
	}

	/**
	 * Renders only the given tables; unknown names are ignored. An empty selection
	 * renders the whole catalog.
	 */
	public static String format(SchemaCatalog catalog, Collection<String> tableNames) {
		if (catalog.tables().isEmpty()) {
			return "";
		}
		StringBuilder sb = new StringBuilder("SQL CATALOG:\n");
		catalog.tables().forEach((tableName, table) -> {
			if (!tableNames.isEmpty() && tableNames.stream().noneMatch(tableName::equalsIgnoreCase)) {
				return;
			}
			sb.append("- ").append(tableName);
			if (!table.synonyms().isEmpty()) {
				sb.append(" (aka: ").append(String.join(", ", table.synonyms())).append(")");
			}
			sb.append(":\n");
			for (SchemaCatalog.ColumnSchema col : table.columns()) {
				sb.append("  • ").append(col.name());
				StringJoiner details = new StringJoiner("; ");
				if (!col.type().isBlank()) {
					details.add("type=" + col.type());
				}
				if (col.primaryKey()) {
					details.add("pk");
				}
				if (!col.nullable()) {
					details.add("not null");
				}
				table.foreignKeys().stream()
						.filter(fk -> fk.column().equalsIgnoreCase(col.name()))
						.forEach(fk -> details.add("fk=" + fk.refTable() + "." + fk.refColumn()));
				if (details.length() > 0) {
					sb.append(" (").append(details).append(")");
				}
				sb.append("\n");
			}
		});
		sb.append(CATALOG_FOOTER);
		return sb.toString().trim();
	}
}

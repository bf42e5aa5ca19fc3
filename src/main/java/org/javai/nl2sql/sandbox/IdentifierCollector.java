package org.javai.nl2sql.sandbox;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import net.sf.jsqlparser.schema.Column;
import net.sf.jsqlparser.schema.Table;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.select.PlainSelect;
import net.sf.jsqlparser.statement.select.SelectItem;
import net.sf.jsqlparser.util.TablesNamesFinder;

/**
 * Walks a parsed statement once and collects what the sandbox needs to check:
 * referenced tables (CTE names excluded), every column reference, table aliases,
 * select-list aliases and the targets of any {@code SELECT ... INTO}.
 */
class IdentifierCollector extends TablesNamesFinder {

	/**
	 * A column reference as written; {@code qualifier} is null when unqualified.
	 */
	record ColumnRef(String qualifier, String name) {
	}

	private final List<ColumnRef> columns = new ArrayList<>();
	private final Map<String, String> tableAliases = new HashMap<>();
	private final Set<String> selectAliases = new HashSet<>();
	private final List<String> intoTables = new ArrayList<>();
	private Set<String> tables = Set.of();

	static IdentifierCollector collect(Statement statement) {
		IdentifierCollector collector = new IdentifierCollector();
		// Cast to Statement to resolve method ambiguity in JSqlParser
		collector.tables = collector.getTables((Statement) statement);
		return collector;
	}

	@Override
	public void visit(Column tableColumn) {
		Table table = tableColumn.getTable();
		String qualifier = table != null && table.getName() != null ? unquote(table.getName()) : null;
		columns.add(new ColumnRef(qualifier, unquote(tableColumn.getColumnName())));
		super.visit(tableColumn);
	}

	@Override
	public void visit(Table tableName) {
		if (tableName.getAlias() != null && tableName.getName() != null) {
			tableAliases.put(lower(unquote(tableName.getAlias().getName())), unquote(tableName.getName()));
		}
		super.visit(tableName);
	}

	@Override
	public void visit(PlainSelect plainSelect) {
		if (plainSelect.getSelectItems() != null) {
			for (SelectItem<?> item : plainSelect.getSelectItems()) {
				if (item.getAlias() != null) {
					selectAliases.add(lower(unquote(item.getAlias().getName())));
				}
			}
		}
		if (plainSelect.getIntoTables() != null) {
			plainSelect.getIntoTables().forEach(t -> intoTables.add(unquote(t.getFullyQualifiedName())));
		}
		super.visit(plainSelect);
	}

	/**
	 * @return referenced table names as written, possibly schema-qualified, unquoted
	 */
	Set<String> tables() {
		Set<String> result = new HashSet<>();
		tables.forEach(t -> result.add(unquoteQualified(t)));
		return result;
	}

	List<ColumnRef> columns() {
		return columns;
	}

	/**
	 * @return lower-cased alias to table name as written
	 */
	Map<String, String> tableAliases() {
		return tableAliases;
	}

	Set<String> selectAliases() {
		return selectAliases;
	}

	/**
	 * @return tables a {@code SELECT ... INTO} would create or fill, in visit order
	 */
	List<String> intoTables() {
		return intoTables;
	}

	static String lower(String s) {
		return s.toLowerCase(Locale.ROOT);
	}

	static String unquote(String identifier) {
		if (identifier == null || identifier.length() < 2) {
			return identifier;
		}
		char first = identifier.charAt(0);
		char last = identifier.charAt(identifier.length() - 1);
		if ((first == '"' && last == '"') || (first == '`' && last == '`') || (first == '[' && last == ']')) {
			return identifier.substring(1, identifier.length() - 1);
		}
		return identifier;
	}

	private static String unquoteQualified(String name) {
		String[] parts = name.split("\\.");
		StringBuilder sb = new StringBuilder();
		for (String part : parts) {
			if (sb.length() > 0) {
				sb.append('.');
			}
			sb.append(unquote(part));
		}
		return sb.toString();
	}
}

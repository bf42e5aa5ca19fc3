package org.javai.nl2sql.sandbox;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.expression.LongValue;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.select.Limit;
import net.sf.jsqlparser.statement.select.PlainSelect;
import net.sf.jsqlparser.statement.select.Select;
import org.apache.commons.lang3.StringUtils;
import org.javai.nl2sql.catalog.SchemaCatalog;
import org.javai.nl2sql.validate.SqlText;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The read-only boundary in front of the database.
 *
 * <p>Checks run in a fixed order and the first failure decides the deny reason:</p>
 * <ol>
 *   <li>comments removed; empty text, more than one statement, any forbidden keyword
 *       anywhere in the raw text (comments included), or a statement that is not a
 *       plain read (a SELECT without INTO) are refused;</li>
 *   <li>every table and column must exist in the catalog (case-insensitive);</li>
 *   <li>no reserved schema or system table may be referenced;</li>
 *   <li>a statement without LIMIT, FETCH or TOP gets {@code LIMIT n} appended;</li>
 *   <li>the execution budget (timeout, max rows) is attached.</li>
 * </ol>
 *
 * <p>The check is a pure function of (SQL, catalog, policy).</p>
 */
public class SqlSandbox {

	private static final Logger logger = LoggerFactory.getLogger(SqlSandbox.class);
	private static final int LOGGED_SQL_LENGTH = 100;
	private static final Set<String> NON_IDENTIFIER_WORDS = Set.of(
			"true", "false", "null", "unknown", "current_date", "current_time", "current_timestamp",
			"localtime", "localtimestamp", "sysdate", "rownum");

	private final SandboxPolicy policy;
	private final Map<String, Pattern> keywordPatterns;

	public SqlSandbox() {
		this(SandboxPolicy.defaults());
	}

	public SqlSandbox(SandboxPolicy policy) {
		this.policy = Objects.requireNonNull(policy, "policy must not be null");
		this.keywordPatterns = new LinkedHashMap<>();
		for (String keyword : new TreeSet<>(policy.forbiddenKeywords())) {
			String body = Pattern.quote(keyword).replace(" ", "\\E\\s+\\Q");
			keywordPatterns.put(keyword, Pattern.compile("(?i)(?<![A-Za-z0-9_])" + body + "(?![A-Za-z0-9_])"));
		}
	}

	public SandboxPolicy policy() {
		return policy;
	}

	public SandboxDecision check(String sql, SchemaCatalog catalog) {
		Objects.requireNonNull(catalog, "catalog must not be null");
		String raw = sql != null ? sql : "";

		// 1. shape
		String masked = SqlText.maskComments(raw);
		List<SqlText.Segment> statements = SqlText.splitStatements(masked);
		if (statements.isEmpty()) {
			return deny(raw, DenyReason.EMPTY_STATEMENT, "No statement after removing comments", List.of());
		}
		if (statements.size() > 1) {
			return deny(raw, DenyReason.MULTI_STATEMENT,
					"Found " + statements.size() + " statements; only one is allowed", List.of());
		}
		Optional<String> keyword = findForbiddenKeyword(raw);
		if (keyword.isPresent()) {
			return deny(raw, DenyReason.FORBIDDEN_KEYWORD, "Forbidden keyword: " + keyword.get().toUpperCase(Locale.ROOT), List.of());
		}
		String statementSql = statements.get(0).text();
		Statement statement;
		try {
			statement = CCJSqlParserUtil.parse(statementSql);
		}
		catch (JSQLParserException e) {
			return deny(raw, DenyReason.NOT_SELECT, "Statement could not be parsed as a SELECT", List.of());
		}
		if (!(statement instanceof Select select)) {
			return deny(raw, DenyReason.NOT_SELECT,
					"Only SELECT statements are allowed, got: " + statement.getClass().getSimpleName(), List.of());
		}

		IdentifierCollector collected;
		try {
			collected = IdentifierCollector.collect(select);
		}
		catch (UnsupportedOperationException e) {
			return deny(raw, DenyReason.NOT_SELECT, "Unsupported statement construct: " + e.getMessage(), List.of());
		}
		if (!collected.intoTables().isEmpty()) {
			return deny(raw, DenyReason.NOT_SELECT,
					"SELECT INTO writes to a table: " + String.join(", ", collected.intoTables()), List.of());
		}

		// 2. identifiers, 3. reserved schemas
		IdentifierCheck identifiers = checkIdentifiers(collected, catalog);
		if (!identifiers.unknown().isEmpty()) {
			return deny(raw, DenyReason.UNKNOWN_IDENTIFIER,
					"Unknown identifiers: " + String.join(", ", identifiers.unknown()), identifiers.referenced());
		}
		if (!identifiers.forbidden().isEmpty()) {
			return deny(raw, DenyReason.FORBIDDEN_SCHEMA,
					"Reserved schema or system table: " + String.join(", ", identifiers.forbidden()), identifiers.referenced());
		}

		// 4. limit, 5. budget
		String normalized = hasRowLimit(select) ? statementSql : injectLimit(statementSql, select);
		logger.debug("Sandbox allowed statement: {}", StringUtils.abbreviate(normalized, LOGGED_SQL_LENGTH));
		return SandboxDecision.allow(normalized, identifiers.referenced(), policy);
	}

	private Optional<String> findForbiddenKeyword(String raw) {
		for (Map.Entry<String, Pattern> entry : keywordPatterns.entrySet()) {
			Matcher m = entry.getValue().matcher(raw);
			if (m.find()) {
				return Optional.of(entry.getKey());
			}
		}
		return Optional.empty();
	}

	private record IdentifierCheck(List<String> unknown, List<String> forbidden, List<String> referenced) {
	}

	private IdentifierCheck checkIdentifiers(IdentifierCollector collected, SchemaCatalog catalog) {
		Set<String> unknown = new TreeSet<>();
		Set<String> forbidden = new TreeSet<>();
		Set<String> referenced = new TreeSet<>();
		List<SchemaCatalog.TableSchema> queryTables = new ArrayList<>();

		for (String name : collected.tables()) {
			String[] parts = name.split("\\.");
			String table = parts[parts.length - 1];
			String schema = parts.length > 1 ? parts[parts.length - 2] : null;
			if (isReserved(schema, table)) {
				forbidden.add(IdentifierCollector.lower(name));
				continue;
			}
			Optional<SchemaCatalog.TableSchema> match = catalog.findTable(table);
			if (match.isPresent()) {
				queryTables.add(match.get());
				referenced.add(IdentifierCollector.lower(match.get().name()));
			}
			else {
				unknown.add(name);
			}
		}

		// columns of reserved tables cannot be judged against the catalog
		if (forbidden.isEmpty()) {
			for (IdentifierCollector.ColumnRef column : collected.columns()) {
				checkColumn(column, collected, catalog, queryTables, unknown, referenced);
			}
		}
		return new IdentifierCheck(new ArrayList<>(unknown), new ArrayList<>(forbidden), new ArrayList<>(referenced));
	}

	private void checkColumn(IdentifierCollector.ColumnRef column, IdentifierCollector collected, SchemaCatalog catalog,
			List<SchemaCatalog.TableSchema> queryTables, Set<String> unknown, Set<String> referenced) {
		String name = column.name();
		String lowerName = IdentifierCollector.lower(name);
		if (column.qualifier() == null) {
			if (NON_IDENTIFIER_WORDS.contains(lowerName) || collected.selectAliases().contains(lowerName)) {
				return;
			}
			List<SchemaCatalog.TableSchema> candidates = queryTables.isEmpty()
					? new ArrayList<>(catalog.tables().values())
					: queryTables;
			Optional<SchemaCatalog.TableSchema> owner = candidates.stream()
					.filter(t -> t.findColumn(name).isPresent())
					.findFirst();
			if (owner.isPresent()) {
				referenced.add(IdentifierCollector.lower(owner.get().name() + "." + name));
			}
			else {
				unknown.add(name);
			}
			return;
		}

		String qualifier = IdentifierCollector.lower(column.qualifier());
		String tableName = collected.tableAliases().getOrDefault(qualifier, column.qualifier());
		Optional<SchemaCatalog.TableSchema> table = catalog.findTable(tableName);
		if (table.isEmpty()) {
			// derived table or CTE; its columns are checked where they are defined
			return;
		}
		if (table.get().findColumn(name).isPresent()) {
			referenced.add(IdentifierCollector.lower(table.get().name() + "." + name));
		}
		else {
			unknown.add(column.qualifier() + "." + name);
		}
	}

	private boolean isReserved(String schema, String table) {
		String lowerTable = IdentifierCollector.lower(table);
		if (policy.systemTables().contains(lowerTable) || policy.reservedSchemas().contains(lowerTable)) {
			return true;
		}
		return schema != null && policy.reservedSchemas().contains(IdentifierCollector.lower(schema));
	}

	private static boolean hasRowLimit(Select select) {
		if (select.getLimit() != null || select.getFetch() != null) {
			return true;
		}
		return select instanceof PlainSelect plain && plain.getTop() != null;
	}

	private String injectLimit(String statementSql, Select select) {
		int limit = policy.effectiveLimit();
		if (select.getOffset() != null) {
			// OFFSET must follow LIMIT, so rewrite through the AST
			select.setLimit(new Limit().withRowCount(new LongValue(limit)));
			return select.toString();
		}
		return statementSql + " LIMIT " + limit;
	}

	private SandboxDecision deny(String sql, DenyReason reason, String message, List<String> identifiers) {
		logger.warn("Sandbox denied statement ({}): {} | sql: {}", reason, message,
				StringUtils.abbreviate(sql.replaceAll("\\s+", " ").trim(), LOGGED_SQL_LENGTH));
		return SandboxDecision.deny(reason, message, identifiers, policy);
	}
}

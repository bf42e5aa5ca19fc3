package org.javai.nl2sql.sandbox;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Rules applied by {@link SqlSandbox}.
 *
 * <pre>{@code
 * SandboxPolicy policy = SandboxPolicy.builder()
 *         .defaultLimit(100)
 *         .statementTimeout(Duration.ofSeconds(10))
 *         .build();
 * }</pre>
 *
 * @param forbiddenKeywords words (or space-separated phrases) that deny a statement wherever they appear
 * @param reservedSchemas schema names that may not be referenced
 * @param systemTables table names that may not be referenced, with or without schema
 * @param defaultLimit LIMIT injected when the statement has none
 * @param maxRows hard cap on rows fetched at execution; also caps the injected limit
 * @param statementTimeout execution-time budget attached to allowed statements
 */
public record SandboxPolicy(
		Set<String> forbiddenKeywords,
		Set<String> reservedSchemas,
		Set<String> systemTables,
		int defaultLimit,
		int maxRows,
		Duration statementTimeout
) {

	public static final List<String> DEFAULT_FORBIDDEN_KEYWORDS = List.of(
			"insert", "update", "delete", "drop", "alter", "truncate", "create", "grant", "revoke",
			"rename", "replace", "merge", "exec", "execute", "call", "lock", "unlock", "flush", "kill",
			"shutdown", "attach", "detach", "pragma", "sleep", "benchmark", "into outfile", "load data",
			"load_file");

	public static final List<String> DEFAULT_RESERVED_SCHEMAS = List.of(
			"information_schema", "pg_catalog", "mysql", "sys", "performance_schema");

	public static final List<String> DEFAULT_SYSTEM_TABLES = List.of(
			"sqlite_master", "sqlite_schema", "sqlite_temp_master", "sqlite_sequence");

	public static final int DEFAULT_LIMIT = 200;
	public static final int DEFAULT_MAX_ROWS = 200;
	public static final Duration DEFAULT_STATEMENT_TIMEOUT = Duration.ofSeconds(30);

	public SandboxPolicy {
		forbiddenKeywords = normalize(forbiddenKeywords);
		reservedSchemas = normalize(reservedSchemas);
		systemTables = normalize(systemTables);
		Objects.requireNonNull(statementTimeout, "statementTimeout must not be null");
		if (defaultLimit < 1) {
			throw new IllegalArgumentException("defaultLimit must be >= 1");
		}
		if (maxRows < 1) {
			throw new IllegalArgumentException("maxRows must be >= 1");
		}
		if (statementTimeout.isNegative() || statementTimeout.isZero()) {
			throw new IllegalArgumentException("statementTimeout must be positive");
		}
	}

	private static Set<String> normalize(Set<String> values) {
		Set<String> result = new LinkedHashSet<>();
		if (values != null) {
			values.forEach(v -> result.add(v.trim().toLowerCase(Locale.ROOT)));
		}
		return Set.copyOf(result);
	}

	public static SandboxPolicy defaults() {
		return builder().build();
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * @return the limit to inject: the default limit capped by {@link #maxRows()}
	 */
	public int effectiveLimit() {
		return Math.min(defaultLimit, maxRows);
	}

	public static class Builder {
		private Set<String> forbiddenKeywords = new LinkedHashSet<>(DEFAULT_FORBIDDEN_KEYWORDS);
		private Set<String> reservedSchemas = new LinkedHashSet<>(DEFAULT_RESERVED_SCHEMAS);
		private Set<String> systemTables = new LinkedHashSet<>(DEFAULT_SYSTEM_TABLES);
		private int defaultLimit = DEFAULT_LIMIT;
		private int maxRows = DEFAULT_MAX_ROWS;
		private Duration statementTimeout = DEFAULT_STATEMENT_TIMEOUT;

		private Builder() {}

		public Builder forbiddenKeywords(Set<String> forbiddenKeywords) {
			this.forbiddenKeywords = new LinkedHashSet<>(forbiddenKeywords);
			return this;
		}

		public Builder addForbiddenKeyword(String keyword) {
			this.forbiddenKeywords.add(keyword);
			return this;
		}

		public Builder reservedSchemas(Set<String> reservedSchemas) {
			this.reservedSchemas = new LinkedHashSet<>(reservedSchemas);
			return this;
		}

		public Builder systemTables(Set<String> systemTables) {
			this.systemTables = new LinkedHashSet<>(systemTables);
			return this;
		}

		public Builder defaultLimit(int defaultLimit) {
			this.defaultLimit = defaultLimit;
			return this;
		}

		public Builder maxRows(int maxRows) {
			this.maxRows = maxRows;
			return this;
		}

		public Builder statementTimeout(Duration statementTimeout) {
			this.statementTimeout = statementTimeout;
			return this;
		}

		public SandboxPolicy build() {
			return new SandboxPolicy(forbiddenKeywords, reservedSchemas, systemTables, defaultLimit, maxRows,
					statementTimeout);
		}
	}
}

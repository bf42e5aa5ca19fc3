package org.javai.nl2sql.execute;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.apache.commons.lang3.StringUtils;
import org.javai.nl2sql.sandbox.SandboxDecision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link QueryExecutor} over a JDBC {@link javax.sql.DataSource}.
 *
 * <p>The statement timeout and row cap of the sandbox decision are applied with
 * {@link Statement#setQueryTimeout} and {@link Statement#setMaxRows}. When
 * {@code markReadOnly} is set, each connection is switched to read-only before use;
 * drivers that fix the flag at connect time (SQLite) should instead be given a data
 * source configured read-only.</p>
 */
public class JdbcQueryExecutor implements QueryExecutor {

	private static final Logger logger = LoggerFactory.getLogger(JdbcQueryExecutor.class);

	private final javax.sql.DataSource dataSource;
	private final boolean markReadOnly;

	public JdbcQueryExecutor(javax.sql.DataSource dataSource) {
		this(dataSource, true);
	}

	public JdbcQueryExecutor(javax.sql.DataSource dataSource, boolean markReadOnly) {
		this.dataSource = Objects.requireNonNull(dataSource, "dataSource must not be null");
		this.markReadOnly = markReadOnly;
	}

	@Override
	public QueryResult execute(SandboxDecision decision) {
		Objects.requireNonNull(decision, "decision must not be null");
		if (!decision.allowed() || decision.normalizedSql() == null) {
			throw new IllegalArgumentException("Only allowed sandbox decisions can be executed");
		}
		String sql = decision.normalizedSql();
		long start = System.currentTimeMillis();
		try (Connection conn = dataSource.getConnection()) {
			if (markReadOnly) {
				conn.setReadOnly(true);
			}
			try (Statement stmt = conn.createStatement()) {
				int timeoutSeconds = (int) Math.max(1, decision.timeout().toSeconds());
				stmt.setQueryTimeout(timeoutSeconds);
				stmt.setMaxRows(decision.maxRows() + 1);
				try (ResultSet rs = stmt.executeQuery(sql)) {
					QueryResult result = readResult(rs, decision.maxRows());
					logger.debug("Executed query in {} ms, {} rows{}: {}", System.currentTimeMillis() - start,
							result.rowCount(), result.truncated() ? " (truncated)" : "", StringUtils.abbreviate(sql, 100));
					return result;
				}
			}
		}
		catch (SQLTimeoutException e) {
			throw new QueryExecutionException("Query timed out after " + decision.timeout().toSeconds() + " s", e);
		}
		catch (SQLException e) {
			throw new QueryExecutionException("Query failed: " + e.getMessage(), e);
		}
	}

	private static QueryResult readResult(ResultSet rs, int maxRows) throws SQLException {
		ResultSetMetaData rsmd = rs.getMetaData();
		int columnCount = rsmd.getColumnCount();
		List<String> columns = new ArrayList<>(columnCount);
		for (int i = 1; i <= columnCount; i++) {
			columns.add(rsmd.getColumnLabel(i));
		}
		List<List<Object>> rows = new ArrayList<>();
		boolean truncated = false;
		while (rs.next()) {
			if (rows.size() >= maxRows) {
				truncated = true;
				break;
			}
			List<Object> row = new ArrayList<>(columnCount);
			for (int i = 1; i <= columnCount; i++) {
				row.add(rs.getObject(i));
			}
			rows.add(row);
		}
		return new QueryResult(columns, rows, truncated);
	}
}

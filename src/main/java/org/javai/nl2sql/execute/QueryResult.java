package org.javai.nl2sql.execute;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Tabular result of an executed query.
 *
 * @param columns column labels in select order
 * @param rows row values in column order; values may be null
 * @param truncated true if more rows were available than were fetched
 */
public record QueryResult(List<String> columns, List<List<Object>> rows, boolean truncated) {

	public QueryResult {
		Objects.requireNonNull(columns, "columns must not be null");
		Objects.requireNonNull(rows, "rows must not be null");
		columns = List.copyOf(columns);
		List<List<Object>> copy = new ArrayList<>(rows.size());
		// row values may be null, so List.copyOf is not an option
		rows.forEach(row -> copy.add(Collections.unmodifiableList(new ArrayList<>(row))));
		rows = Collections.unmodifiableList(copy);
	}

	public QueryResult(List<String> columns, List<List<Object>> rows) {
		this(columns, rows, false);
	}

	public int rowCount() {
		return rows.size();
	}

	public boolean isEmpty() {
		return rows.isEmpty();
	}

	/**
	 * @return the values of one column, or an empty list if there is no such column
	 */
	public List<Object> column(String label) {
		int index = -1;
		for (int i = 0; i < columns.size(); i++) {
			if (columns.get(i).equalsIgnoreCase(label)) {
				index = i;
				break;
			}
		}
		if (index < 0) {
			return List.of();
		}
		final int col = index;
		List<Object> values = new ArrayList<>(rows.size());
		rows.forEach(row -> values.add(row.get(col)));
		return values;
	}
}

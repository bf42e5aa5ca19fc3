package org.javai.nl2sql.join;

import java.util.Objects;

/**
 * One join in a synthesized path: {@code table} is brought in and linked to the
 * already-joined {@code joinedFrom} table through a foreign key.
 *
 * @param type INNER, or LEFT when the foreign key column is nullable
 * @param table the table added by this step
 * @param tableColumn the column of {@code table} used in the ON condition
 * @param joinedFrom a table already present earlier in the path
 * @param joinedFromColumn the column of {@code joinedFrom} used in the ON condition
 */
public record JoinStep(
		JoinType type,
		String table,
		String tableColumn,
		String joinedFrom,
		String joinedFromColumn
) {

	public JoinStep {
		Objects.requireNonNull(type, "type must not be null");
		Objects.requireNonNull(table, "table must not be null");
		Objects.requireNonNull(joinedFrom, "joinedFrom must not be null");
	}

	static JoinStep along(JoinGraph.JoinEdge edge, String newTable) {
		boolean newIsChild = edge.childTable().equalsIgnoreCase(newTable);
		return newIsChild
				? new JoinStep(edge.joinType(), edge.childTable(), edge.childColumn(), edge.parentTable(), edge.parentColumn())
				: new JoinStep(edge.joinType(), edge.parentTable(), edge.parentColumn(), edge.childTable(), edge.childColumn());
	}

	/**
	 * @return a clause like "INNER JOIN Album ON Album.ArtistId = Artist.ArtistId"
	 */
	public String toSql() {
		return "%s JOIN %s ON %s.%s = %s.%s".formatted(
				type, table, table, tableColumn, joinedFrom, joinedFromColumn);
	}
}

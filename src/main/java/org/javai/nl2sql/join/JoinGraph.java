package org.javai.nl2sql.join;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import org.javai.nl2sql.catalog.SchemaCatalog;

/**
 * Undirected graph over catalog tables, one edge per foreign key.
 *
 * <p>Nodes are keyed by lower-cased table name. Adjacency lists are sorted by
 * neighbour key so that every traversal visits neighbours in lexicographic order.
 * When two tables are linked by several foreign keys, the edge whose referencing
 * column sorts first is kept.</p>
 */
public final class JoinGraph {

	private final Map<String, String> canonicalNames;
	private final Map<String, List<JoinEdge>> adjacency;

	private JoinGraph(Map<String, String> canonicalNames, Map<String, List<JoinEdge>> adjacency) {
		this.canonicalNames = canonicalNames;
		this.adjacency = adjacency;
	}

	public static JoinGraph from(SchemaCatalog catalog) {
		Map<String, String> names = new TreeMap<>();
		Map<String, Map<String, JoinEdge>> edges = new TreeMap<>();
		for (SchemaCatalog.TableSchema table : catalog.tables().values()) {
			String key = key(table.name());
			names.put(key, table.name());
			edges.computeIfAbsent(key, k -> new TreeMap<>());
		}
		for (SchemaCatalog.TableSchema table : catalog.tables().values()) {
			for (SchemaCatalog.ForeignKey fk : table.foreignKeys()) {
				String child = key(table.name());
				String parent = key(fk.refTable());
				if (!names.containsKey(parent) || child.equals(parent)) {
					continue;
				}
				JoinEdge edge = new JoinEdge(table.name(), fk.column(), names.get(parent), fk.refColumn(),
						fk.nullable());
				putPreferred(edges.get(child), parent, edge);
				putPreferred(edges.get(parent), child, edge);
			}
		}
		Map<String, List<JoinEdge>> adjacency = new TreeMap<>();
		edges.forEach((node, byNeighbour) -> adjacency.put(node, List.copyOf(byNeighbour.values())));
		return new JoinGraph(Collections.unmodifiableMap(names), Collections.unmodifiableMap(adjacency));
	}

	private static void putPreferred(Map<String, JoinEdge> byNeighbour, String neighbour, JoinEdge edge) {
		byNeighbour.merge(neighbour, edge, (existing, candidate) ->
				Comparator.comparing((JoinEdge e) -> e.childColumn().toLowerCase(Locale.ROOT))
						.compare(existing, candidate) <= 0 ? existing : candidate);
	}

	static String key(String tableName) {
		return tableName.toLowerCase(Locale.ROOT);
	}

	public boolean contains(String tableName) {
		return tableName != null && canonicalNames.containsKey(key(tableName));
	}

	public Optional<String> canonicalName(String tableName) {
		return tableName == null ? Optional.empty() : Optional.ofNullable(canonicalNames.get(key(tableName)));
	}

	/**
	 * @return lower-cased table keys in lexicographic order
	 */
	public Set<String> nodes() {
		return canonicalNames.keySet();
	}

	/**
	 * Edges touching the given table, ordered by the key of the table on the other side.
	 */
	public List<JoinEdge> edgesOf(String tableName) {
		return adjacency.getOrDefault(key(tableName), List.of());
	}

	public int edgeCount() {
		List<JoinEdge> all = new ArrayList<>();
		adjacency.values().forEach(list -> list.stream().filter(e -> !all.contains(e)).forEach(all::add));
		return all.size();
	}

	/**
	 * One foreign key seen as an undirected edge. {@code child} owns the foreign key
	 * column; {@code parent} is the referenced table.
	 */
	public record JoinEdge(String childTable, String childColumn, String parentTable, String parentColumn,
			boolean nullable) {

		public String other(String tableName) {
			return childTable.equalsIgnoreCase(tableName) ? parentTable : childTable;
		}

		public JoinType joinType() {
			return nullable ? JoinType.LEFT : JoinType.INNER;
		}
	}
}

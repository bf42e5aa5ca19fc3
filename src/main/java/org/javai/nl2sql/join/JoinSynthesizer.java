package org.javai.nl2sql.join;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes a join path connecting a set of required tables over a {@link JoinGraph}.
 *
 * <p>The lexicographically smallest required table is the anchor. A breadth-first
 * search from the anchor, visiting neighbours in lexicographic order, yields one
 * shortest path to every other required table; the union of those paths is returned
 * as join steps. Intermediate tables on a path (waypoints) are joined even though
 * they were not required. The same graph and the same set always produce the same
 * path.</p>
 */
public class JoinSynthesizer {

	private static final Logger logger = LoggerFactory.getLogger(JoinSynthesizer.class);

	private final JoinGraph graph;

	public JoinSynthesizer(JoinGraph graph) {
		this.graph = Objects.requireNonNull(graph, "graph must not be null");
	}

	public JoinPath synthesize(Collection<String> requiredTables) {
		TreeSet<String> required = new TreeSet<>();
		List<String> unknown = new ArrayList<>();
		for (String table : requiredTables) {
			if (graph.contains(table)) {
				required.add(JoinGraph.key(table));
			} else if (table != null && !table.isBlank()) {
				unknown.add(table);
			}
		}

		if (required.size() + unknown.size() < 2) {
			return JoinPath.empty();
		}
		if (required.isEmpty()) {
			return noPath(unknown);
		}

		String anchor = required.first();
		Map<String, JoinGraph.JoinEdge> reachedVia = breadthFirst(anchor);

		List<String> unreachable = new ArrayList<>(unknown);
		for (String table : required) {
			if (!table.equals(anchor) && !reachedVia.containsKey(table)) {
				unreachable.add(graph.canonicalName(table).orElse(table));
			}
		}
		if (!unreachable.isEmpty()) {
			return noPath(unreachable);
		}

		List<JoinStep> steps = new ArrayList<>();
		Set<String> joined = new HashSet<>();
		joined.add(anchor);
		for (String target : required) {
			if (target.equals(anchor)) {
				continue;
			}
			for (String node : pathFromAnchor(anchor, target, reachedVia)) {
				if (joined.add(node)) {
					String canonical = graph.canonicalName(node).orElse(node);
					steps.add(JoinStep.along(reachedVia.get(node), canonical));
				}
			}
		}

		JoinPath path = JoinPath.found(graph.canonicalName(anchor).orElse(anchor), steps);
		logger.debug("Join path for {}: {}", required, path.tables());
		return path;
	}

	private JoinPath noPath(List<String> unreachable) {
		List<String> sorted = new ArrayList<>(new TreeSet<>(unreachable));
		logger.debug("No join path; unreachable tables {}", sorted);
		return JoinPath.noPath(sorted);
	}

	private Map<String, JoinGraph.JoinEdge> breadthFirst(String anchor) {
		Map<String, JoinGraph.JoinEdge> reachedVia = new HashMap<>();
		Set<String> visited = new HashSet<>();
		Deque<String> queue = new ArrayDeque<>();
		visited.add(anchor);
		queue.add(anchor);
		while (!queue.isEmpty()) {
			String current = queue.poll();
			for (JoinGraph.JoinEdge edge : graph.edgesOf(current)) {
				String neighbour = JoinGraph.key(edge.other(graph.canonicalName(current).orElse(current)));
				if (visited.add(neighbour)) {
					reachedVia.put(neighbour, edge);
					queue.add(neighbour);
				}
			}
		}
		return reachedVia;
	}

	/**
	 * Nodes on the BFS-tree path from the anchor (exclusive) to the target (inclusive).
	 */
	private List<String> pathFromAnchor(String anchor, String target, Map<String, JoinGraph.JoinEdge> reachedVia) {
		LinkedList<String> path = new LinkedList<>();
		String node = target;
		while (!node.equals(anchor)) {
			path.addFirst(node);
			JoinGraph.JoinEdge edge = reachedVia.get(node);
			node = JoinGraph.key(edge.other(graph.canonicalName(node).orElse(node)));
		}
		return path;
	}
}

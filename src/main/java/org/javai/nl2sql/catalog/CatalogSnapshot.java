package org.javai.nl2sql.catalog;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.javai.nl2sql.join.JoinGraph;
import org.javai.nl2sql.join.JoinSynthesizer;

/**
 * Immutable pairing of a frozen catalog with the join graph derived from it.
 * A workflow run captures one snapshot and uses it for every step.
 *
 * @param catalog frozen copy of the catalog
 * @param joinGraph graph built from {@code catalog}
 * @param version monotonically increasing snapshot number
 */
public record CatalogSnapshot(SchemaCatalog catalog, JoinGraph joinGraph, long version) {

	public CatalogSnapshot {
		Objects.requireNonNull(catalog, "catalog must not be null");
		Objects.requireNonNull(joinGraph, "joinGraph must not be null");
	}

	public static CatalogSnapshot of(SchemaCatalog source, long version) {
		Map<String, SchemaCatalog.TableSchema> tables =
				Collections.unmodifiableMap(new LinkedHashMap<>(source.tables()));
		SchemaCatalog frozen = () -> tables;
		return new CatalogSnapshot(frozen, JoinGraph.from(frozen), version);
	}

	public JoinSynthesizer joinSynthesizer() {
		return new JoinSynthesizer(joinGraph);
	}
}

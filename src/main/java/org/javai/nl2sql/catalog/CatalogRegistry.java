package org.javai.nl2sql.catalog;

import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds the current {@link CatalogSnapshot}. Readers never block; a reload builds a
 * complete new snapshot and swaps it in one step, so a run sees either the old
 * catalog and graph or the new ones, never a mix.
 */
public class CatalogRegistry {

	private static final Logger logger = LoggerFactory.getLogger(CatalogRegistry.class);

	private final AtomicReference<CatalogSnapshot> current;

	public CatalogRegistry(SchemaCatalog initial) {
		this.current = new AtomicReference<>(CatalogSnapshot.of(initial, 1));
	}

	public CatalogSnapshot current() {
		return current.get();
	}

	public CatalogSnapshot reload(SchemaCatalog catalog) {
		CatalogSnapshot next = current.updateAndGet(previous -> CatalogSnapshot.of(catalog, previous.version() + 1));
		logger.info("Schema catalog reloaded: version {} with {} tables", next.version(), next.catalog().tables().size());
		return next;
	}
}

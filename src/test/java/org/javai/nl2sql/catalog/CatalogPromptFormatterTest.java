package org.javai.nl2sql.catalog;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.javai.nl2sql.testsupport.ChinookCatalog;
import org.junit.jupiter.api.Test;

class CatalogPromptFormatterTest {

	private final SchemaCatalog catalog = ChinookCatalog.load();

	@Test
	void rendersColumnsWithKeysAndSynonyms() {
		String text = CatalogPromptFormatter.format(catalog, List.of("invoice_line", "customer"));

		assertThat(text).startsWith("SQL CATALOG:");
		assertThat(text).contains("- customer (aka: customers, 客户):");
		assertThat(text).contains("invoice_id (type=INTEGER; not null; fk=invoice.invoice_id)");
		assertThat(text).doesNotContain("- track (");
	}

	@Test
	void emptySelectionRendersEverything() {
		String text = CatalogPromptFormatter.format(catalog, List.of());

		assertThat(text).contains("- track", "- playlist_track", "- media_type");
	}
}

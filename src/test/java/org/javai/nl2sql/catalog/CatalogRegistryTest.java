package org.javai.nl2sql.catalog;

import static org.assertj.core.api.Assertions.assertThat;

import org.javai.nl2sql.testsupport.ChinookCatalog;
import org.junit.jupiter.api.Test;

class CatalogRegistryTest {

	@Test
	void reloadSwapsCatalogAndGraphTogether() {
		CatalogRegistry registry = new CatalogRegistry(ChinookCatalog.load());
		CatalogSnapshot before = registry.current();

		CatalogSnapshot after = registry.reload(new InMemorySchemaCatalog()
				.addTable("a").addColumn("a", "id", "INTEGER", false, true)
				.addTable("b").addColumn("b", "a_id", "INTEGER", false, false)
				.addForeignKey("b", "a_id", "a", "id"));

		assertThat(after.version()).isEqualTo(before.version() + 1);
		assertThat(registry.current()).isSameAs(after);
		assertThat(after.catalog().tables()).containsOnlyKeys("a", "b");
		assertThat(after.joinGraph().contains("a")).isTrue();
		assertThat(before.catalog().tables()).containsKey("invoice_line");
		assertThat(before.joinGraph().contains("invoice_line")).isTrue();
	}

	@Test
	void snapshotIsFrozenAgainstLaterChangesToTheSource() {
		InMemorySchemaCatalog source = new InMemorySchemaCatalog().addTable("a");
		CatalogSnapshot snapshot = CatalogSnapshot.of(source, 1);

		source.addTable("late");

		assertThat(snapshot.catalog().tables()).containsOnlyKeys("a");
	}
}

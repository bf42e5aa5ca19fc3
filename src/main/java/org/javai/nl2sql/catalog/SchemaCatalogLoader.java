package org.javai.nl2sql.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

/**
 * Loads a {@link SchemaCatalog} from a JSON or YAML document.
 *
 * <p>Document shape (identical for both formats):</p>
 * <pre>
 * tables:
 *   - name: Customer
 *     synonyms: [customers, 客户]
 *     columns:
 *       - { name: CustomerId, type: INTEGER, nullable: false, primary_key: true }
 *       - { name: SupportRepId, type: INTEGER, nullable: true }
 *     foreign_keys:
 *       - { column: SupportRepId, ref_table: Employee, ref_column: EmployeeId }
 * </pre>
 *
 * <p>Columns are nullable unless stated otherwise. A foreign key without an explicit
 * {@code nullable} flag inherits the nullability of its column.</p>
 */
public class SchemaCatalogLoader {

	private static final Logger logger = LoggerFactory.getLogger(SchemaCatalogLoader.class);

	public enum Format {
		JSON,
		YAML
	}

	private final ObjectMapper objectMapper;

	public SchemaCatalogLoader() {
		this(new ObjectMapper());
	}

	public SchemaCatalogLoader(ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
	}

	/**
	 * Loads a catalog file, choosing the format from the file extension.
	 */
	public SchemaCatalog load(Path path) {
		String fileName = path.getFileName().toString().toLowerCase(Locale.ROOT);
		Format format = fileName.endsWith(".yaml") || fileName.endsWith(".yml") ? Format.YAML : Format.JSON;
		try (InputStream in = Files.newInputStream(path)) {
			SchemaCatalog catalog = load(in, format);
			logger.info("Loaded schema catalog from {} ({} tables)", path, catalog.tables().size());
			return catalog;
		} catch (IOException e) {
			throw new CatalogLoadException("Failed to read catalog file " + path, e);
		}
	}

	public SchemaCatalog load(InputStream in, Format format) {
		JsonNode root;
		try {
			root = switch (format) {
				case JSON -> objectMapper.readTree(in);
				case YAML -> objectMapper.valueToTree(new Yaml().load(in));
			};
		} catch (IOException | RuntimeException e) {
			throw new CatalogLoadException("Malformed " + format + " catalog document: " + e.getMessage(), e);
		}
		return fromTree(root);
	}

	private SchemaCatalog fromTree(JsonNode root) {
		if (root == null || !root.path("tables").isArray()) {
			throw new CatalogLoadException("Catalog document must contain a 'tables' array");
		}
		InMemorySchemaCatalog catalog = new InMemorySchemaCatalog();
		for (JsonNode tableNode : root.path("tables")) {
			String tableName = requiredText(tableNode, "name", "table");
			catalog.addTable(tableName);
			catalog.withSynonyms(tableName, textList(tableNode.path("synonyms")).toArray(String[]::new));

			List<SchemaCatalog.ColumnSchema> columns = new ArrayList<>();
			for (JsonNode columnNode : tableNode.path("columns")) {
				SchemaCatalog.ColumnSchema column = new SchemaCatalog.ColumnSchema(
						requiredText(columnNode, "name", "column of " + tableName),
						columnNode.path("type").asText(""),
						columnNode.path("nullable").asBoolean(true),
						columnNode.path("primary_key").asBoolean(false));
				columns.add(column);
				catalog.addColumn(tableName, column.name(), column.type(), column.nullable(), column.primaryKey());
			}

			for (JsonNode fkNode : tableNode.path("foreign_keys")) {
				String column = requiredText(fkNode, "column", "foreign key of " + tableName);
				boolean columnNullable = columns.stream()
						.filter(c -> c.name().equalsIgnoreCase(column))
						.findFirst()
						.map(SchemaCatalog.ColumnSchema::nullable)
						.orElse(false);
				boolean nullable = fkNode.has("nullable") ? fkNode.get("nullable").asBoolean() : columnNullable;
				catalog.addForeignKey(tableName, new SchemaCatalog.ForeignKey(
						column,
						requiredText(fkNode, "ref_table", "foreign key of " + tableName),
						requiredText(fkNode, "ref_column", "foreign key of " + tableName),
						nullable));
			}
		}
		return catalog;
	}

	private static String requiredText(JsonNode node, String field, String owner) {
		JsonNode value = node.get(field);
		if (value == null || !value.isValueNode() || value.asText().isBlank()) {
			throw new CatalogLoadException("Missing '" + field + "' in " + owner);
		}
		return value.asText();
	}

	private static List<String> textList(JsonNode node) {
		List<String> values = new ArrayList<>();
		if (node.isArray()) {
			node.forEach(v -> values.add(v.asText()));
		}
		return values;
	}

	/**
	 * Thrown when a catalog document cannot be read or has the wrong shape.
	 */
	public static class CatalogLoadException extends RuntimeException {
		public CatalogLoadException(String message) {
			super(message);
		}

		public CatalogLoadException(String message, Throwable cause) {
			super(message, cause);
		}
	}
}

package org.javai.nl2sql.memory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON form of a session's memory, used for export and import.
 *
 * <pre>
 * {
 *   "version": 1,
 *   "sessionId": "s-1",
 *   "entries": [
 *     { "turnIndex": 1, "kind": "QUERY", "content": "...", "timestamp": "2024-05-01T10:00:00Z" }
 *   ]
 * }
 * </pre>
 */
class JsonMemorySerializer {

	static final int CURRENT_VERSION = 1;

	private final ObjectMapper mapper;

	JsonMemorySerializer() {
		this.mapper = new ObjectMapper()
				.registerModule(new JavaTimeModule())
				.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
				.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
	}

	String toJson(String sessionId, List<MemoryEntry> entries) {
		ObjectNode root = mapper.createObjectNode();
		root.put("version", CURRENT_VERSION);
		root.put("sessionId", sessionId);
		ArrayNode array = root.putArray("entries");
		entries.forEach(entry -> array.add(mapper.valueToTree(entry)));
		try {
			return mapper.writeValueAsString(root);
		} catch (JsonProcessingException e) {
			throw new MemoryExportException("Failed to export memory of session " + sessionId, e);
		}
	}

	List<MemoryEntry> fromJson(String json) {
		if (json == null || json.isBlank()) {
			throw new MemoryExportException("Memory document is empty");
		}
		JsonNode root;
		try {
			root = mapper.readTree(json);
		} catch (JsonProcessingException e) {
			throw new MemoryExportException("Malformed memory document: " + e.getOriginalMessage(), e);
		}
		int version = root.path("version").asInt(-1);
		if (version != CURRENT_VERSION) {
			throw new MemoryExportException("Unsupported memory document version: " + version);
		}
		List<MemoryEntry> entries = new ArrayList<>();
		for (JsonNode node : root.path("entries")) {
			try {
				entries.add(mapper.treeToValue(node, MemoryEntry.class));
			} catch (JsonProcessingException | IllegalArgumentException e) {
				throw new MemoryExportException("Invalid memory entry: " + node, e);
			}
		}
		return entries;
	}
}

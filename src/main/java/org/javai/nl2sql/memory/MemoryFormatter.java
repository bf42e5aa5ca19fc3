package org.javai.nl2sql.memory;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Renders memory entries as prompt context. Formatting is positional only: the
 * entries are never interpreted.
 */
public final class MemoryFormatter {

	private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm:ss").withZone(ZoneOffset.UTC);

	private MemoryFormatter() {
	}

	/**
	 * History block for SQL generation. Clarification exchanges are left out; the
	 * merged question already carries them.
	 */
	public static String forGeneration(List<MemoryEntry> entries) {
		List<MemoryEntry> relevant = entries.stream()
				.filter(e -> e.kind() != MemoryEntry.Kind.CLARIFICATION)
				.toList();
		if (relevant.isEmpty()) {
			return "";
		}
		StringBuilder sb = new StringBuilder("## Conversation history\n\n");
		for (MemoryEntry entry : relevant) {
			String time = TIME.format(entry.timestamp());
			switch (entry.kind()) {
				case QUERY -> sb.append("[").append(time).append("] User: ").append(entry.content()).append('\n');
				case ANSWER -> {
					sb.append("[").append(time).append("] Assistant: ").append(entry.content()).append('\n');
					if (entry.sql() != null) {
						sb.append("Executed SQL: ").append(entry.sql()).append('\n');
					}
					if (entry.rowCount() != null && entry.rowCount() > 0) {
						sb.append("Returned ").append(entry.rowCount()).append(" rows\n");
					}
				}
				case CHAT -> sb.append("[").append(time).append("] Assistant (chat): ").append(entry.content()).append('\n');
				default -> {
				}
			}
		}
		sb.append("\nIf the question refers to earlier results (\"them\", \"those\", \"it\"), resolve the ")
				.append("reference using the history above.\n");
		return sb.toString();
	}

	/**
	 * Compact history block for clarification prompts.
	 */
	public static String forClarification(List<MemoryEntry> entries) {
		if (entries.isEmpty()) {
			return "";
		}
		StringBuilder sb = new StringBuilder("## Conversation history\n\n");
		for (MemoryEntry entry : entries) {
			switch (entry.kind()) {
				case QUERY -> sb.append("User: ").append(entry.content()).append('\n');
				case CLARIFICATION -> sb.append("Clarified: ").append(entry.content()).append('\n');
				case ANSWER -> {
					sb.append("Assistant: ").append(entry.content()).append('\n');
					if (entry.sql() != null) {
						sb.append("SQL: ").append(entry.sql()).append('\n');
					}
				}
				case CHAT -> sb.append("Assistant: ").append(entry.content()).append('\n');
			}
		}
		return sb.toString();
	}
}

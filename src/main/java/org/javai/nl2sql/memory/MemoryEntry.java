package org.javai.nl2sql.memory;

import java.time.Instant;
import java.util.Objects;

/**
 * One remembered item of a session's conversation.
 *
 * @param turnIndex the turn that produced the entry
 * @param kind what the content is
 * @param content the question, clarification exchange, answer or chat reply
 * @param timestamp when the entry was recorded
 * @param sql the executed SQL for answers (may be null)
 * @param rowCount number of result rows for answers (may be null)
 */
public record MemoryEntry(
		int turnIndex,
		Kind kind,
		String content,
		Instant timestamp,
		String sql,
		Integer rowCount
) {

	public enum Kind {
		QUERY,
		CLARIFICATION,
		ANSWER,
		CHAT
	}

	public MemoryEntry {
		Objects.requireNonNull(kind, "kind must not be null");
		Objects.requireNonNull(timestamp, "timestamp must not be null");
		content = content != null ? content : "";
	}

	public static MemoryEntry query(int turnIndex, String question, Instant at) {
		return new MemoryEntry(turnIndex, Kind.QUERY, question, at, null, null);
	}

	public static MemoryEntry clarification(int turnIndex, String exchange, Instant at) {
		return new MemoryEntry(turnIndex, Kind.CLARIFICATION, exchange, at, null, null);
	}

	public static MemoryEntry answer(int turnIndex, String answer, String sql, Integer rowCount, Instant at) {
		return new MemoryEntry(turnIndex, Kind.ANSWER, answer, at, sql, rowCount);
	}

	public static MemoryEntry chat(int turnIndex, String reply, Instant at) {
		return new MemoryEntry(turnIndex, Kind.CHAT, reply, at, null, null);
	}
}

package org.javai.nl2sql.llm;

import java.util.Objects;

/**
 * A generation response classified as either SQL or a conversational reply.
 */
public record ModelReply(Kind kind, String text) {

	public enum Kind {
		SQL,
		CHAT
	}

	public ModelReply {
		Objects.requireNonNull(kind, "kind must not be null");
		Objects.requireNonNull(text, "text must not be null");
	}

	public static ModelReply sql(String sql) {
		return new ModelReply(Kind.SQL, sql);
	}

	public static ModelReply chat(String text) {
		return new ModelReply(Kind.CHAT, text);
	}

	public boolean isSql() {
		return kind == Kind.SQL;
	}
}

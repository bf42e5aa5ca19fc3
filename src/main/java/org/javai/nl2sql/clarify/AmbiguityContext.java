package org.javai.nl2sql.clarify;

import java.util.List;
import java.util.Objects;
import org.javai.nl2sql.intent.Intent;
import org.javai.nl2sql.memory.MemoryEntry;

/**
 * What an ambiguity rule may look at.
 *
 * @param question the working question
 * @param intent the intent parsed from it
 * @param history recent memory entries of the session, oldest first
 */
public record AmbiguityContext(String question, Intent intent, List<MemoryEntry> history) {

	public AmbiguityContext {
		Objects.requireNonNull(question, "question must not be null");
		Objects.requireNonNull(intent, "intent must not be null");
		history = history != null ? List.copyOf(history) : List.of();
	}

	/**
	 * @return true if the session already has a question or answer a pronoun could point at
	 */
	public boolean hasAntecedent() {
		return history.stream().anyMatch(e -> e.kind() != MemoryEntry.Kind.CLARIFICATION);
	}
}

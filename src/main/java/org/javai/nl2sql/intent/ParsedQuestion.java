package org.javai.nl2sql.intent;

import java.util.List;
import java.util.Objects;

/**
 * @param intent the structured intent
 * @param matchedTables canonical names of catalog tables the question mentions, in catalog order
 */
public record ParsedQuestion(Intent intent, List<String> matchedTables) {

	public ParsedQuestion {
		Objects.requireNonNull(intent, "intent must not be null");
		matchedTables = matchedTables != null ? List.copyOf(matchedTables) : List.of();
	}
}

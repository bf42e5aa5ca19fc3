package org.javai.nl2sql.sandbox;

import java.time.Duration;
import java.util.List;

/**
 * Outcome of a sandbox check.
 *
 * @param allowed whether the statement may be executed
 * @param denyReason why it was refused; null when allowed
 * @param reasonMessage human-readable detail; null when allowed
 * @param normalizedSql the statement to execute (comments removed, LIMIT injected if missing); null when denied
 * @param referencedIdentifiers tables and columns the statement references, lower-cased and sorted
 * @param timeout execution-time budget
 * @param maxRows maximum rows to fetch
 */
public record SandboxDecision(
		boolean allowed,
		DenyReason denyReason,
		String reasonMessage,
		String normalizedSql,
		List<String> referencedIdentifiers,
		Duration timeout,
		int maxRows
) {

	public SandboxDecision {
		referencedIdentifiers = referencedIdentifiers != null ? List.copyOf(referencedIdentifiers) : List.of();
		if (allowed && denyReason != null) {
			throw new IllegalArgumentException("an allowed decision has no deny reason");
		}
		if (!allowed && denyReason == null) {
			throw new IllegalArgumentException("a denied decision needs a deny reason");
		}
	}

	public static SandboxDecision allow(String normalizedSql, List<String> identifiers, SandboxPolicy policy) {
		return new SandboxDecision(true, null, null, normalizedSql, identifiers, policy.statementTimeout(),
				policy.maxRows());
	}

	public static SandboxDecision deny(DenyReason reason, String message, List<String> identifiers,
			SandboxPolicy policy) {
		return new SandboxDecision(false, reason, message, null, identifiers, policy.statementTimeout(),
				policy.maxRows());
	}
}

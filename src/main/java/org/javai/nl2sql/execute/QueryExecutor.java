package org.javai.nl2sql.execute;

import org.javai.nl2sql.sandbox.SandboxDecision;

/**
 * Runs a statement the sandbox allowed. Implementations must honour the decision's
 * timeout and row cap and throw {@link QueryExecutionException} on any failure.
 */
public interface QueryExecutor {

	QueryResult execute(SandboxDecision decision);
}

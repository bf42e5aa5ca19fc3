package org.javai.nl2sql.workflow;

/**
 * Append-only record of completed turns.
 */
public interface TurnLog {

	void record(TurnRecord turn);
}

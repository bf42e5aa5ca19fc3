package org.javai.nl2sql.intent;

/**
 * Coarse shape of the answer the user expects.
 */
public enum QuestionType {
	/** Rows of entities, possibly limited ("list customers", "前5个客户"). */
	LIST,
	/** A count, sum or average. */
	AGGREGATE,
	/** An ordering by some metric ("most popular", "highest"). */
	RANK,
	/** A single fact ("who is", "which"). */
	LOOKUP,
	/** Nothing more specific could be determined. */
	QUERY
}

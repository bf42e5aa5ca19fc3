package org.javai.nl2sql.execute;

/**
 * Thrown when an allowed statement fails or times out in the database.
 */
public class QueryExecutionException extends RuntimeException {

	public QueryExecutionException(String message) {
		super(message);
	}

	public QueryExecutionException(String message, Throwable cause) {
		super(message, cause);
	}
}

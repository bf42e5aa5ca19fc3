package org.javai.nl2sql.memory;

/**
 * Thrown when session memory cannot be exported or an exported document cannot be
 * imported.
 */
public class MemoryExportException extends RuntimeException {

	public MemoryExportException(String message) {
		super(message);
	}

	public MemoryExportException(String message, Throwable cause) {
		super(message, cause);
	}
}

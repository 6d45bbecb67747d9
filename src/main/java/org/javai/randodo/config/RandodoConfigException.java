package org.javai.randodo.config;

/**
 * Exception thrown when settings cannot be read or hold invalid values.
 */
public class RandodoConfigException extends RuntimeException {

	public RandodoConfigException(String message) {
		super(message);
	}

	public RandodoConfigException(String message, Throwable cause) {
		super(message, cause);
	}
}

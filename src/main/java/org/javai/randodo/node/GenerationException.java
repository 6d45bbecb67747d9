package org.javai.randodo.node;

/**
 * Thrown when evaluating a generator tree exceeds a configured ceiling.
 */
public class GenerationException extends RuntimeException {

	public GenerationException(String message) {
		super(message);
	}
}

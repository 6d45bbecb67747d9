package org.javai.randodo.pattern;

/**
 * Exception thrown when a pattern cannot be compiled.
 * <p>
 * Carries the offending pattern and the zero-based position of the character that triggered the
 * error; problems detected at the end of the pattern report {@code pattern.length()}.
 */
public class PatternCompileException extends RuntimeException {

	private final String pattern;
	private final int position;

	public PatternCompileException(String message, String pattern, int position) {
		super(message);
		this.pattern = pattern;
		this.position = position;
	}

	public String pattern() {
		return pattern;
	}

	public int position() {
		return position;
	}
}

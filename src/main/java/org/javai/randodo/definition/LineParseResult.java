package org.javai.randodo.definition;

/**
 * Outcome of parsing one line of a definitions source.
 */
public sealed interface LineParseResult {

	/**
	 * A blank line or a comment.
	 */
	record Skipped() implements LineParseResult {
	}

	record Parsed(Definition definition) implements LineParseResult {
	}

	/**
	 * A line that is neither blank, a comment, nor a well formed definition.
	 *
	 * @param column the 1-based column where the problem was found
	 * @param message what is wrong with the line
	 */
	record Malformed(int column, String message) implements LineParseResult {
	}

	static LineParseResult skipped() {
		return new Skipped();
	}

	static LineParseResult parsed(Definition definition) {
		return new Parsed(definition);
	}

	static LineParseResult malformed(int column, String message) {
		return new Malformed(column, message);
	}
}

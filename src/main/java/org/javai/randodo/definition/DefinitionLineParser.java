package org.javai.randodo.definition;

/**
 * Splits a definitions line into name and pattern.
 * <p>
 * Accepted forms: blank lines, comments whose first non-blank character is {@code #}, and
 * {@code name = pattern} with any amount of spaces or tabs around the name and the {@code =}.
 * Everything after the whitespace following {@code =} is the pattern, kept verbatim.
 */
public final class DefinitionLineParser {

	private enum State {
		LEADING_WHITESPACE,
		NAME,
		WHITESPACE_AFTER_NAME,
		WHITESPACE_BEFORE_PATTERN
	}

	private DefinitionLineParser() {
		// Utility class - no instantiation
	}

	/**
	 * Parses a line.
	 *
	 * @param line the line without its terminator
	 * @param lineNumber the 1-based line number recorded in the resulting {@link Definition}
	 */
	public static LineParseResult parse(String line, int lineNumber) {
		if (line == null) {
			return LineParseResult.skipped();
		}

		State state = State.LEADING_WHITESPACE;
		StringBuilder name = new StringBuilder();

		for (int i = 0; i < line.length(); i++) {
			char c = line.charAt(i);
			switch (state) {
				case LEADING_WHITESPACE -> {
					if (c == '#') {
						return LineParseResult.skipped();
					}
					if (c == '=') {
						return LineParseResult.malformed(i + 1, "missing definition name before '='");
					}
					if (!isWhitespace(c)) {
						name.append(c);
						state = State.NAME;
					}
				}
				case NAME -> {
					if (c == '=') {
						state = State.WHITESPACE_BEFORE_PATTERN;
					} else if (isWhitespace(c)) {
						state = State.WHITESPACE_AFTER_NAME;
					} else {
						name.append(c);
					}
				}
				case WHITESPACE_AFTER_NAME -> {
					if (c == '=') {
						state = State.WHITESPACE_BEFORE_PATTERN;
					} else if (!isWhitespace(c)) {
						return LineParseResult.malformed(i + 1, "unexpected characters after definition name");
					}
				}
				case WHITESPACE_BEFORE_PATTERN -> {
					if (!isWhitespace(c)) {
						return LineParseResult.parsed(new Definition(name.toString(), line.substring(i), lineNumber));
					}
				}
			}
		}

		return switch (state) {
			case LEADING_WHITESPACE -> LineParseResult.skipped();
			case NAME, WHITESPACE_AFTER_NAME -> LineParseResult.malformed(line.length() + 1,
					"missing '=' after definition name");
			case WHITESPACE_BEFORE_PATTERN -> LineParseResult.malformed(line.length() + 1, "missing pattern after '='");
		};
	}

	private static boolean isWhitespace(char c) {
		return c == ' ' || c == '\t';
	}
}

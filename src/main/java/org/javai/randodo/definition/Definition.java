package org.javai.randodo.definition;

import java.util.Objects;

/**
 * One {@code name = pattern} line of a definitions source.
 *
 * @param name the variable name the compiled pattern is registered under
 * @param pattern the pattern text, verbatim
 * @param lineNumber the 1-based line the definition came from
 */
public record Definition(String name, String pattern, int lineNumber) {

	public Definition {
		Objects.requireNonNull(name, "name must not be null");
		Objects.requireNonNull(pattern, "pattern must not be null");
	}
}

package org.javai.randodo.definition;

import java.util.List;

/**
 * Outcome of loading a definitions source.
 */
public sealed interface LoadResult {

	/**
	 * Every line was well formed. Definitions whose patterns failed to compile are listed in
	 * {@code compileFailures} and were skipped; all others are registered.
	 *
	 * @param definitions every definition read, in source order, including those that failed to compile
	 * @param compileFailures the definitions that were not registered
	 */
	record Loaded(List<Definition> definitions, List<CompileFailure> compileFailures) implements LoadResult {
		public Loaded {
			definitions = List.copyOf(definitions);
			compileFailures = List.copyOf(compileFailures);
		}

		public int registeredCount() {
			return definitions.size() - compileFailures.size();
		}
	}

	/**
	 * Loading stopped at a malformed line. Definitions on earlier lines remain registered.
	 *
	 * @param lineNumber the 1-based number of the malformed line
	 * @param line the line as read
	 * @param column the 1-based column where the problem was found
	 * @param message what is wrong with the line
	 */
	record Failed(int lineNumber, String line, int column, String message) implements LoadResult {
		@Override
		public String toString() {
			return "line " + lineNumber + ", column " + column + ": " + message;
		}
	}

	default boolean isSuccess() {
		return this instanceof Loaded;
	}
}

package org.javai.randodo.definition;

/**
 * A definition whose pattern did not compile and was therefore not registered.
 *
 * @param definition the offending definition
 * @param position the 0-based position in the pattern
 * @param message the compiler's message
 */
public record CompileFailure(Definition definition, int position, String message) {

	@Override
	public String toString() {
		return "line " + definition.lineNumber() + " (" + definition.name() + "): " + message;
	}
}

package org.javai.randodo.registry;

import java.util.Optional;
import java.util.Set;
import org.javai.randodo.node.GeneratorNode;

/**
 * Read-only view of the named generator trees that {@link GeneratorNode.Variable} nodes refer to.
 * <p>
 * Lookups happen on every evaluation, never at compile time, so a redefinition is visible to every
 * existing reference.
 */
public interface VariableRegistry {

	/**
	 * Gets the tree registered under a name.
	 *
	 * @param name the variable name
	 * @return the tree, or empty if nothing is registered under {@code name}
	 */
	Optional<GeneratorNode> lookup(String name);

	/**
	 * Checks if a name is registered.
	 */
	boolean isDefined(String name);

	/**
	 * Snapshot of the registered names.
	 */
	Set<String> names();

	int size();

	/**
	 * A registry with no entries.
	 */
	static VariableRegistry empty() {
		return new DefaultVariableRegistry();
	}
}

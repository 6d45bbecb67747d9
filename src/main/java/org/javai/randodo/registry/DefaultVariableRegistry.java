package org.javai.randodo.registry;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.javai.randodo.node.GeneratorNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default implementation of {@link VariableRegistry}.
 * <p>
 * Definitions are added while a definitions source is loaded, usually from a single thread. Reads are
 * safe from any thread, so evaluations may run concurrently with each other. Entries are never removed.
 */
public class DefaultVariableRegistry implements VariableRegistry {

	private static final Logger logger = LoggerFactory.getLogger(DefaultVariableRegistry.class);

	private final Map<String, GeneratorNode> trees = new ConcurrentHashMap<>();

	/**
	 * Registers a tree under a name, replacing any previous definition.
	 *
	 * @param name the variable name
	 * @param tree the (normally optimized) tree to register
	 * @throws IllegalArgumentException if name is null or blank, or if tree is null
	 */
	public void define(String name, GeneratorNode tree) {
		if (name == null || name.isBlank()) {
			throw new IllegalArgumentException("Variable name cannot be null or empty");
		}
		if (tree == null) {
			throw new IllegalArgumentException("Tree cannot be null");
		}
		GeneratorNode previous = trees.put(name, tree);
		if (previous != null) {
			logger.debug("Variable '{}' redefined; existing references now resolve to the new definition", name);
		}
	}

	@Override
	public Optional<GeneratorNode> lookup(String name) {
		Objects.requireNonNull(name, "name must not be null");
		return Optional.ofNullable(trees.get(name));
	}

	@Override
	public boolean isDefined(String name) {
		return name != null && trees.containsKey(name);
	}

	@Override
	public Set<String> names() {
		return Set.copyOf(trees.keySet());
	}

	@Override
	public int size() {
		return trees.size();
	}
}

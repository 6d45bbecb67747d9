package org.javai.randodo.node;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.Optional;
import org.javai.randodo.random.RandomStreams;
import org.javai.randodo.registry.VariableRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * State of a single evaluation: where variables resolve, where random values come from, and how deep
 * the current chain of variable references is.
 * <p>
 * A context is used by one evaluation at a time and is not thread safe.
 */
public final class GenerationContext {

	private static final Logger logger = LoggerFactory.getLogger(GenerationContext.class);

	private final VariableRegistry registry;
	private final RandomStreams streams;
	private final int maxVariableDepth;
	private final Deque<String> variableChain = new ArrayDeque<>();

	/**
	 * @param registry where {@link GeneratorNode.Variable} nodes resolve
	 * @param streams supplies the random values consumed by the tree
	 * @param maxVariableDepth how many variable references may be nested before evaluation is aborted
	 */
	public GenerationContext(VariableRegistry registry, RandomStreams streams, int maxVariableDepth) {
		this.registry = Objects.requireNonNull(registry, "registry must not be null");
		this.streams = Objects.requireNonNull(streams, "streams must not be null");
		if (maxVariableDepth < 1) {
			throw new IllegalArgumentException("maxVariableDepth must be positive: " + maxVariableDepth);
		}
		this.maxVariableDepth = maxVariableDepth;
	}

	/**
	 * Draws the next value for {@code consumer}.
	 *
	 * @throws IllegalStateException if the underlying source breaks its contract with a negative value
	 */
	public int nextRandom(GeneratorNode consumer) {
		int value = streams.streamFor(consumer).next();
		if (value < 0) {
			throw new IllegalStateException("Random source returned a negative value: " + value);
		}
		return value;
	}

	/**
	 * Looks up the tree currently registered under {@code name}.
	 */
	public Optional<GeneratorNode> resolve(String name) {
		Optional<GeneratorNode> target = registry.lookup(name);
		if (target.isEmpty() && logger.isTraceEnabled()) {
			logger.trace("Variable '{}' is not defined; emitting nothing", name);
		}
		return target;
	}

	void enterVariable(String name) {
		if (variableChain.size() >= maxVariableDepth) {
			throw new GenerationException("Variable references nested deeper than " + maxVariableDepth
					+ " while expanding '" + name + "' (chain: " + String.join(" -> ", variableChain)
					+ "); check for a reference cycle");
		}
		variableChain.addLast(name);
	}

	void exitVariable() {
		variableChain.removeLast();
	}
}

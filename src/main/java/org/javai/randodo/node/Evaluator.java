package org.javai.randodo.node;

import java.util.Objects;
import org.javai.randodo.random.RandomSource;
import org.javai.randodo.random.RandomStreams;
import org.javai.randodo.registry.VariableRegistry;

/**
 * Walks generator trees and returns the text they produce.
 * <p>
 * The evaluator itself holds no per-evaluation state and can be shared; every call builds a fresh
 * {@link GenerationContext}.
 */
public final class Evaluator {

	public static final int DEFAULT_MAX_VARIABLE_DEPTH = 64;

	private final VariableRegistry registry;
	private final int maxVariableDepth;

	public Evaluator(VariableRegistry registry) {
		this(registry, DEFAULT_MAX_VARIABLE_DEPTH);
	}

	public Evaluator(VariableRegistry registry, int maxVariableDepth) {
		this.registry = Objects.requireNonNull(registry, "registry must not be null");
		if (maxVariableDepth < 1) {
			throw new IllegalArgumentException("maxVariableDepth must be positive: " + maxVariableDepth);
		}
		this.maxVariableDepth = maxVariableDepth;
	}

	/**
	 * Evaluates {@code tree} with every node drawing from the same {@code randomSource}.
	 */
	public String evaluate(GeneratorNode tree, RandomSource randomSource) {
		return evaluate(tree, RandomStreams.shared(randomSource));
	}

	/**
	 * Evaluates {@code tree}, letting {@code streams} decide which source each node draws from.
	 *
	 * @throws GenerationException if variable references nest deeper than the configured ceiling
	 */
	public String evaluate(GeneratorNode tree, RandomStreams streams) {
		Objects.requireNonNull(tree, "tree must not be null");
		StringBuilder output = new StringBuilder();
		tree.generate(output, new GenerationContext(registry, streams, maxVariableDepth));
		return output.toString();
	}
}

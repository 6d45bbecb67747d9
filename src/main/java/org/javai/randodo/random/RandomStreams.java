package org.javai.randodo.random;

import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Decides which {@link RandomSource} a consuming node draws from during one evaluation.
 * <p>
 * Two strategies are provided:
 * <ul>
 *   <li>{@link #shared(RandomSource)} - every node draws from the same source, in evaluation order</li>
 *   <li>{@link #perNode(Supplier)} - each node gets its own source, created on its first draw and keyed
 *   by node identity, so two structurally equal nodes still advance independently</li>
 * </ul>
 * Per-node streams keep the values a node sees independent of how many draws its siblings made,
 * which makes the output of one node easy to predict with a sequential source.
 * <p>
 * Instances hold mutable state and are meant for one caller at a time. Use one per call or per thread.
 */
@FunctionalInterface
public interface RandomStreams {

	/**
	 * Returns the source the given consumer draws its next value from.
	 *
	 * @param consumer the node about to draw; compared by identity
	 */
	RandomSource streamFor(Object consumer);

	/**
	 * All consumers draw from {@code source}.
	 */
	static RandomStreams shared(RandomSource source) {
		Objects.requireNonNull(source, "source must not be null");
		return consumer -> source;
	}

	/**
	 * Each consumer draws from its own source obtained from {@code factory} on first use.
	 */
	static RandomStreams perNode(Supplier<? extends RandomSource> factory) {
		Objects.requireNonNull(factory, "factory must not be null");
		Map<Object, RandomSource> streams = new IdentityHashMap<>();
		return consumer -> streams.computeIfAbsent(consumer, ignored -> factory.get());
	}

	/**
	 * Per-node streams split deterministically from a single seeded parent.
	 */
	static RandomStreams seededPerNode(long seed) {
		SeededRandomSource parent = new SeededRandomSource(seed);
		return perNode(parent::split);
	}
}

package org.javai.randodo.random;

import java.util.SplittableRandom;

/**
 * A reproducible source backed by a seeded {@link SplittableRandom}.
 * <p>
 * {@link #split()} derives an independent child whose sequence is fully determined by the parent's
 * seed and by how many children were split off before it, so per-node streams stay reproducible.
 * Instances are not thread safe.
 */
public final class SeededRandomSource implements RandomSource {

	private final long seed;
	private final SplittableRandom random;

	public SeededRandomSource(long seed) {
		this(seed, new SplittableRandom(seed));
	}

	private SeededRandomSource(long seed, SplittableRandom random) {
		this.seed = seed;
		this.random = random;
	}

	@Override
	public int next() {
		return random.nextInt() >>> 1;
	}

	/**
	 * Creates a child source with its own independent sequence.
	 */
	public SeededRandomSource split() {
		return new SeededRandomSource(seed, random.split());
	}

	public long seed() {
		return seed;
	}

	@Override
	public String toString() {
		return "SeededRandomSource{seed=" + seed + "}";
	}
}

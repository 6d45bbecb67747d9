package org.javai.randodo.random;

/**
 * Supplies the integers a generator tree consumes while it is evaluated.
 * <p>
 * The only contract is that {@link #next()} never returns a negative number. Deterministic
 * implementations make generation reproducible, which is what tests rely on.
 */
@FunctionalInterface
public interface RandomSource {

	/**
	 * Produces the next non-negative integer of this source's sequence.
	 *
	 * @return a value in {@code [0, Integer.MAX_VALUE]}
	 */
	int next();
}

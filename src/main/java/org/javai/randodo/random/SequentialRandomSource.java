package org.javai.randodo.random;

/**
 * Yields {@code 0, 1, 2, ...}, wrapping back to zero after {@link Integer#MAX_VALUE}.
 * Not thread safe.
 */
public final class SequentialRandomSource implements RandomSource {

	private int current;

	public SequentialRandomSource() {
		this(0);
	}

	/**
	 * @param start the first value to yield
	 * @throws IllegalArgumentException if {@code start} is negative
	 */
	public SequentialRandomSource(int start) {
		if (start < 0) {
			throw new IllegalArgumentException("start must not be negative: " + start);
		}
		this.current = start;
	}

	@Override
	public int next() {
		int value = current;
		current = value == Integer.MAX_VALUE ? 0 : value + 1;
		return value;
	}

	@Override
	public String toString() {
		return "SequentialRandomSource{next=" + current + "}";
	}
}

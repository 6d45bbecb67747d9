package org.javai.randodo.random;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Non-reproducible randomness drawn from the calling thread's {@link ThreadLocalRandom}.
 * Safe to share between threads.
 */
public final class SystemRandomSource implements RandomSource {

	public static final SystemRandomSource INSTANCE = new SystemRandomSource();

	private SystemRandomSource() {
	}

	@Override
	public int next() {
		return ThreadLocalRandom.current().nextInt(Integer.MAX_VALUE);
	}

	@Override
	public String toString() {
		return "SystemRandomSource";
	}
}

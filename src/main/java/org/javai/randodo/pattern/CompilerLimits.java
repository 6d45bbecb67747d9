package org.javai.randodo.pattern;

/**
 * Ceilings the compiler enforces on untrusted patterns.
 *
 * @param maxNestingDepth how many groups may be open at once
 * @param maxRepetitions the largest bound accepted inside {@code {...}}, and the largest product of the
 *     upper bounds of nested repetitions within one pattern; trees reached through variables are not
 *     counted
 * @param openEndedRepetitionMax the upper bound used for {@code {n,}} when {@code n} is smaller
 */
public record CompilerLimits(int maxNestingDepth, int maxRepetitions, int openEndedRepetitionMax) {

	public static final int DEFAULT_MAX_NESTING_DEPTH = 64;
	public static final int DEFAULT_MAX_REPETITIONS = 10_000;
	public static final int DEFAULT_OPEN_ENDED_REPETITION_MAX = 8;

	public CompilerLimits {
		if (maxNestingDepth < 1) {
			throw new IllegalArgumentException("maxNestingDepth must be positive: " + maxNestingDepth);
		}
		if (maxRepetitions < 0) {
			throw new IllegalArgumentException("maxRepetitions must not be negative: " + maxRepetitions);
		}
		if (openEndedRepetitionMax < 0 || openEndedRepetitionMax > maxRepetitions) {
			throw new IllegalArgumentException("openEndedRepetitionMax must be between 0 and maxRepetitions ("
					+ maxRepetitions + "): " + openEndedRepetitionMax);
		}
	}

	public static CompilerLimits defaults() {
		return new CompilerLimits(DEFAULT_MAX_NESTING_DEPTH, DEFAULT_MAX_REPETITIONS, DEFAULT_OPEN_ENDED_REPETITION_MAX);
	}
}

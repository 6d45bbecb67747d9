package org.javai.randodo.config;

import java.util.Objects;
import org.javai.randodo.node.Evaluator;
import org.javai.randodo.pattern.CompilerLimits;

/**
 * Settings for compiling and generating.
 *
 * @param compilerLimits ceilings enforced while compiling patterns
 * @param maxVariableDepth how deeply variable references may nest during generation
 * @param randomMode how nodes draw random values
 * @param seed seed for reproducible output, or {@code null} for system randomness
 */
public record RandodoSettings(CompilerLimits compilerLimits, int maxVariableDepth, RandomMode randomMode, Long seed) {

	public RandodoSettings {
		Objects.requireNonNull(compilerLimits, "compilerLimits must not be null");
		Objects.requireNonNull(randomMode, "randomMode must not be null");
		if (maxVariableDepth < 1) {
			throw new IllegalArgumentException("maxVariableDepth must be positive: " + maxVariableDepth);
		}
	}

	public static RandodoSettings defaults() {
		return new RandodoSettings(CompilerLimits.defaults(), Evaluator.DEFAULT_MAX_VARIABLE_DEPTH,
				RandomMode.PER_NODE, null);
	}

	public boolean isSeeded() {
		return seed != null;
	}

	public RandodoSettings withSeed(long newSeed) {
		return new RandodoSettings(compilerLimits, maxVariableDepth, randomMode, newSeed);
	}

	public RandodoSettings withRandomMode(RandomMode mode) {
		return new RandodoSettings(compilerLimits, maxVariableDepth, mode, seed);
	}
}

package org.javai.randodo.config;

import java.util.Locale;

/**
 * How the nodes of a tree draw their random values.
 */
public enum RandomMode {
	/**
	 * Every node has its own stream; what a node emits does not depend on its siblings.
	 */
	PER_NODE,
	/**
	 * All nodes draw from one stream in evaluation order.
	 */
	SHARED;

	/**
	 * Parses the configuration spelling ({@code per_node}, {@code shared}), ignoring case.
	 *
	 * @throws RandodoConfigException for any other value
	 */
	public static RandomMode fromConfig(String value) {
		if (value == null) {
			throw new RandodoConfigException("random_mode must not be empty");
		}
		return switch (value.trim().toLowerCase(Locale.ROOT)) {
			case "per_node", "per-node" -> PER_NODE;
			case "shared" -> SHARED;
			default -> throw new RandodoConfigException(
					"Unknown random_mode '" + value + "': expected 'per_node' or 'shared'");
		};
	}
}

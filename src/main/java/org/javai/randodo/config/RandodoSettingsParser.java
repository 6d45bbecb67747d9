package org.javai.randodo.config;

import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.javai.randodo.pattern.CompilerLimits;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

/**
 * Parser for settings YAML files.
 * <p>
 * Every key is optional; missing keys keep the value of the base settings, which are
 * {@link RandodoSettings#defaults()} unless stated otherwise.
 * <pre>
 * compiler:
 *   max_nesting_depth: 64
 *   max_repetitions: 10000
 *   open_ended_repetition_max: 8
 * generation:
 *   max_variable_depth: 64
 *   random_mode: per_node
 *   seed: 42
 * </pre>
 */
public class RandodoSettingsParser {

	private static final Logger logger = LoggerFactory.getLogger(RandodoSettingsParser.class);

	public static final String DEFAULTS_RESOURCE = "META-INF/randodo-defaults.yml";

	private final Yaml yaml = new Yaml();

	/**
	 * Parse settings from a file.
	 */
	public RandodoSettings parse(Path path) {
		try (var reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
			return parse(reader);
		} catch (RandodoConfigException e) {
			throw e;
		} catch (Exception e) {
			throw new RandodoConfigException("Failed to read settings from path: " + path, e);
		}
	}

	/**
	 * Parse settings from an input stream.
	 */
	public RandodoSettings parse(InputStream inputStream) {
		try {
			return build(yaml.load(inputStream), RandodoSettings.defaults());
		} catch (RandodoConfigException e) {
			throw e;
		} catch (Exception e) {
			throw new RandodoConfigException("Failed to parse settings from input stream", e);
		}
	}

	/**
	 * Parse settings from a reader.
	 */
	public RandodoSettings parse(Reader reader) {
		try {
			return build(yaml.load(reader), RandodoSettings.defaults());
		} catch (RandodoConfigException e) {
			throw e;
		} catch (Exception e) {
			throw new RandodoConfigException("Failed to parse settings from reader", e);
		}
	}

	/**
	 * Parse settings from a string.
	 */
	public RandodoSettings parseString(String yamlContent) {
		try {
			return build(yaml.load(yamlContent), RandodoSettings.defaults());
		} catch (RandodoConfigException e) {
			throw e;
		} catch (Exception e) {
			throw new RandodoConfigException("Failed to parse settings from string", e);
		}
	}

	/**
	 * Load the defaults shipped in {@value #DEFAULTS_RESOURCE}, or the built-in defaults if the
	 * resource is not on the class path.
	 */
	public RandodoSettings loadDefaults() {
		return loadDefaults(RandodoSettingsParser.class.getClassLoader());
	}

	public RandodoSettings loadDefaults(ClassLoader loader) {
		try (InputStream is = loader.getResourceAsStream(DEFAULTS_RESOURCE)) {
			if (is == null) {
				logger.debug("{} not found; using built-in defaults", DEFAULTS_RESOURCE);
				return RandodoSettings.defaults();
			}
			return parse(is);
		} catch (RandodoConfigException e) {
			throw e;
		} catch (Exception e) {
			throw new RandodoConfigException("Failed to load settings from resource: " + DEFAULTS_RESOURCE, e);
		}
	}

	private RandodoSettings build(Object loaded, RandodoSettings base) {
		if (loaded == null) {
			return base;
		}
		Map<String, Object> data = asMap(loaded, "settings document");

		Map<String, Object> compiler = asMap(data.get("compiler"), "compiler");
		CompilerLimits baseLimits = base.compilerLimits();
		int maxNestingDepth = intValue(compiler, "compiler", "max_nesting_depth", baseLimits.maxNestingDepth());
		int maxRepetitions = intValue(compiler, "compiler", "max_repetitions", baseLimits.maxRepetitions());
		int openEndedMax = intValue(compiler, "compiler", "open_ended_repetition_max",
				baseLimits.openEndedRepetitionMax());

		Map<String, Object> generation = asMap(data.get("generation"), "generation");
		int maxVariableDepth = intValue(generation, "generation", "max_variable_depth", base.maxVariableDepth());
		Object modeValue = generation.get("random_mode");
		RandomMode mode = modeValue != null ? RandomMode.fromConfig(String.valueOf(modeValue)) : base.randomMode();
		Long seed = generation.containsKey("seed")
				? longValue(generation.get("seed"), "generation.seed")
				: base.seed();

		try {
			return new RandodoSettings(new CompilerLimits(maxNestingDepth, maxRepetitions, openEndedMax),
					maxVariableDepth, mode, seed);
		} catch (IllegalArgumentException e) {
			throw new RandodoConfigException("Invalid settings: " + e.getMessage(), e);
		}
	}

	@SuppressWarnings("unchecked")
	private static Map<String, Object> asMap(Object value, String section) {
		if (value == null) {
			return Map.of();
		}
		if (!(value instanceof Map)) {
			throw new RandodoConfigException("'" + section + "' must be a mapping but was: " + value);
		}
		return (Map<String, Object>) value;
	}

	private static int intValue(Map<String, Object> section, String sectionName, String key, int fallback) {
		Object value = section.get(key);
		if (value == null) {
			return fallback;
		}
		if (!(value instanceof Integer)) {
			throw new RandodoConfigException(
					"'" + sectionName + "." + key + "' must be an integer but was: " + value);
		}
		return (Integer) value;
	}

	private static Long longValue(Object value, String key) {
		if (value == null) {
			return null;
		}
		if (value instanceof Integer || value instanceof Long) {
			return ((Number) value).longValue();
		}
		throw new RandodoConfigException("'" + key + "' must be an integer but was: " + value);
	}
}

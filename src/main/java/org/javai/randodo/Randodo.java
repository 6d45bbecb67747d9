package org.javai.randodo;

import java.io.Reader;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import org.javai.randodo.config.RandodoSettings;
import org.javai.randodo.config.RandodoSettingsParser;
import org.javai.randodo.config.RandomMode;
import org.javai.randodo.definition.DefinitionLoader;
import org.javai.randodo.definition.LoadResult;
import org.javai.randodo.node.Evaluator;
import org.javai.randodo.node.GeneratorNode;
import org.javai.randodo.pattern.PatternCompiler;
import org.javai.randodo.random.RandomStreams;
import org.javai.randodo.random.SeededRandomSource;
import org.javai.randodo.random.SystemRandomSource;
import org.javai.randodo.registry.DefaultVariableRegistry;
import org.javai.randodo.registry.VariableRegistry;

/**
 * Entry point tying definitions, compilation and generation together.
 * <p>
 * Example usage:
 *
 * <pre>
 * Randodo randodo = Randodo.create();
 * randodo.load(Path.of("fixtures.conf"));
 * randodo.define("user", "$first_name\\.$last_name[0-9]{2}");
 * String line = randodo.generate("user");
 * </pre>
 *
 * Definitions are expected to be loaded up front from one thread; {@link #generate(String)} may
 * then be called concurrently. With a seed configured, each call draws a fresh child of the seeded
 * source, so a sequence of calls is reproducible while no two calls repeat each other.
 */
public final class Randodo {

	private final RandodoSettings settings;
	private final DefaultVariableRegistry registry = new DefaultVariableRegistry();
	private final PatternCompiler compiler;
	private final DefinitionLoader loader;
	private final Evaluator evaluator;
	private final SeededRandomSource seedSource;

	private Randodo(RandodoSettings settings) {
		this.settings = settings;
		this.compiler = new PatternCompiler(settings.compilerLimits());
		this.loader = new DefinitionLoader(compiler, registry);
		this.evaluator = new Evaluator(registry, settings.maxVariableDepth());
		this.seedSource = settings.isSeeded() ? new SeededRandomSource(settings.seed()) : null;
	}

	/**
	 * Create an instance configured from the bundled default settings.
	 */
	public static Randodo create() {
		return create(new RandodoSettingsParser().loadDefaults());
	}

	public static Randodo create(RandodoSettings settings) {
		Objects.requireNonNull(settings, "settings must not be null");
		return new Randodo(settings);
	}

	public LoadResult load(Path path) {
		return loader.load(path);
	}

	public LoadResult load(Reader reader) {
		return loader.load(reader);
	}

	public LoadResult loadLines(List<String> lines) {
		return loader.loadLines(lines);
	}

	/**
	 * Compile, optimize and register a pattern under {@code name}, replacing any earlier definition.
	 *
	 * @return the registered tree
	 * @throws org.javai.randodo.pattern.PatternCompileException if the pattern is malformed
	 */
	public GeneratorNode define(String name, String pattern) {
		return loader.define(name, pattern);
	}

	/**
	 * Compile and optimize a pattern without registering it. Variables in it resolve against this
	 * instance's definitions when it is evaluated.
	 */
	public GeneratorNode compile(String pattern) {
		return compiler.compile(pattern, registry).optimize();
	}

	/**
	 * Generate text from the definition registered under {@code name}.
	 *
	 * @throws IllegalArgumentException if nothing is registered under {@code name}
	 */
	public String generate(String name) {
		return generate(name, newStreams());
	}

	public String generate(String name, RandomStreams streams) {
		GeneratorNode tree = registry.lookup(name)
				.orElseThrow(() -> new IllegalArgumentException("No definition named '" + name + "'"));
		return evaluator.evaluate(tree, streams);
	}

	public String evaluate(GeneratorNode tree) {
		return evaluate(tree, newStreams());
	}

	public String evaluate(GeneratorNode tree, RandomStreams streams) {
		return evaluator.evaluate(tree, streams);
	}

	/**
	 * Random streams for one evaluation, following the configured seed and {@link RandomMode}.
	 * Without a seed, per-node streams are freshly seeded from {@link ThreadLocalRandom} and the shared
	 * stream is {@link SystemRandomSource}.
	 */
	public RandomStreams newStreams() {
		if (seedSource == null) {
			return settings.randomMode() == RandomMode.PER_NODE
					? RandomStreams.perNode(() -> new SeededRandomSource(ThreadLocalRandom.current().nextLong()))
					: RandomStreams.shared(SystemRandomSource.INSTANCE);
		}
		SeededRandomSource callSource;
		synchronized (seedSource) {
			callSource = seedSource.split();
		}
		return settings.randomMode() == RandomMode.PER_NODE
				? RandomStreams.perNode(callSource::split)
				: RandomStreams.shared(callSource);
	}

	public VariableRegistry registry() {
		return registry;
	}

	public RandodoSettings settings() {
		return settings;
	}
}

package org.javai.randodo.definition;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.javai.randodo.node.GeneratorNode;
import org.javai.randodo.pattern.PatternCompileException;
import org.javai.randodo.pattern.PatternCompiler;
import org.javai.randodo.registry.DefaultVariableRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads {@code name = pattern} definitions, compiles and optimizes each pattern, and registers the
 * result.
 * <p>
 * Each pattern is compiled against the registry as it stands at that line, so a definition may use
 * names defined above it. Names defined further down are legal too; they resolve once defined.
 * <p>
 * A malformed line stops loading. A pattern that fails to compile only skips its own definition.
 */
public class DefinitionLoader {

	private static final Logger logger = LoggerFactory.getLogger(DefinitionLoader.class);

	private final PatternCompiler compiler;
	private final DefaultVariableRegistry registry;

	public DefinitionLoader(PatternCompiler compiler, DefaultVariableRegistry registry) {
		this.compiler = Objects.requireNonNull(compiler, "compiler must not be null");
		this.registry = Objects.requireNonNull(registry, "registry must not be null");
	}

	/**
	 * Load definitions from a UTF-8 file.
	 *
	 * @throws UncheckedIOException if the file cannot be read
	 */
	public LoadResult load(Path path) {
		Objects.requireNonNull(path, "path must not be null");
		try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
			return load(reader, path.toString());
		} catch (IOException e) {
			throw new UncheckedIOException("Failed to read definitions from " + path, e);
		}
	}

	/**
	 * Load definitions from a reader. The reader is not closed.
	 *
	 * @throws UncheckedIOException if reading fails
	 */
	public LoadResult load(Reader reader) {
		Objects.requireNonNull(reader, "reader must not be null");
		BufferedReader buffered = reader instanceof BufferedReader b ? b : new BufferedReader(reader);
		return load(buffered, "reader");
	}

	/**
	 * Load definitions from lines already in memory.
	 */
	public LoadResult loadLines(List<String> lines) {
		Objects.requireNonNull(lines, "lines must not be null");
		return loadLines(lines, "lines");
	}

	/**
	 * Compile, optimize and register a single definition.
	 *
	 * @return the registered tree
	 * @throws PatternCompileException if the pattern is malformed; nothing is registered in that case
	 */
	public GeneratorNode define(String name, String pattern) {
		GeneratorNode tree = compiler.compile(pattern, registry).optimize();
		registry.define(name, tree);
		return tree;
	}

	private LoadResult load(BufferedReader reader, String source) {
		List<String> lines = new ArrayList<>();
		try {
			String line;
			while ((line = reader.readLine()) != null) {
				lines.add(line);
			}
		} catch (IOException e) {
			throw new UncheckedIOException("Failed to read definitions from " + source, e);
		}
		return loadLines(lines, source);
	}

	private LoadResult loadLines(List<String> lines, String source) {
		List<Definition> definitions = new ArrayList<>();
		List<CompileFailure> failures = new ArrayList<>();

		int lineNumber = 0;
		for (String line : lines) {
			lineNumber++;
			LineParseResult result = DefinitionLineParser.parse(line, lineNumber);

			if (result instanceof LineParseResult.Malformed malformed) {
				logger.warn("Stopped loading definitions from {} at line {}, column {}: {}",
						source, lineNumber, malformed.column(), malformed.message());
				return new LoadResult.Failed(lineNumber, line, malformed.column(), malformed.message());
			}

			if (result instanceof LineParseResult.Parsed parsed) {
				Definition definition = parsed.definition();
				definitions.add(definition);
				try {
					define(definition.name(), definition.pattern());
				} catch (PatternCompileException e) {
					failures.add(new CompileFailure(definition, e.position(), e.getMessage()));
					logger.warn("Skipping definition '{}' on line {} of {}: {}",
							definition.name(), lineNumber, source, e.getMessage());
				}
			}
		}

		logger.info("Loaded {} definitions from {} ({} failed to compile)",
				definitions.size() - failures.size(), source, failures.size());
		return new LoadResult.Loaded(definitions, failures);
	}
}

package org.javai.randodo.pattern;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import org.javai.randodo.node.GeneratorNode;
import org.javai.randodo.node.GeneratorNode.Alternation;
import org.javai.randodo.node.GeneratorNode.CharClass;
import org.javai.randodo.node.GeneratorNode.Constant;
import org.javai.randodo.node.GeneratorNode.Repetition;
import org.javai.randodo.node.GeneratorNode.Sequence;
import org.javai.randodo.node.GeneratorNode.Variable;
import org.javai.randodo.registry.VariableRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiles a pattern into a generator tree.
 * <p>
 * The pattern is scanned one character at a time by a state machine with a stack of saved states.
 * Groups are tracked with an explicit stack of scope frames instead of recursion, so nesting depth
 * never depends on the Java call stack. A virtual end-of-input character is fed after the last real
 * one and closes the implicit top-level group the same way {@code )} closes an explicit one.
 * <p>
 * Syntax:
 * <pre>
 * abc        literal text
 * \x         the character x taken literally
 * [a-z_]     one character out of a set; ranges are inclusive
 * $name      the tree registered under name, looked up when generating
 * (a|b)      a group; exactly one alternative is emitted
 * x{n}       the previous element n times; also {n,m}, {,m} and {n,}
 * </pre>
 * The result is always an {@link Alternation} of one {@link Sequence} per top-level alternative.
 * Instances are stateless apart from their limits and can be shared; each call to
 * {@link #compile(String, VariableRegistry)} runs on its own parse state.
 */
public class PatternCompiler {

	private static final Logger logger = LoggerFactory.getLogger(PatternCompiler.class);

	private static final int END_OF_INPUT = -1;

	private final CompilerLimits limits;

	public PatternCompiler() {
		this(CompilerLimits.defaults());
	}

	public PatternCompiler(CompilerLimits limits) {
		this.limits = Objects.requireNonNull(limits, "limits must not be null");
	}

	/**
	 * Compiles a pattern that is not expected to reference any variables.
	 *
	 * @throws PatternCompileException if the pattern is malformed
	 */
	public GeneratorNode compile(String pattern) {
		return compile(pattern, VariableRegistry.empty());
	}

	/**
	 * Compiles a pattern. The registry is only read, to report references to names that are not
	 * defined yet; such references are legal and resolve when the tree is evaluated.
	 *
	 * @param pattern the pattern text
	 * @param registry the definitions known so far
	 * @return the root of the unoptimized tree
	 * @throws PatternCompileException if the pattern is malformed
	 */
	public GeneratorNode compile(String pattern, VariableRegistry registry) {
		Objects.requireNonNull(pattern, "pattern must not be null");
		Objects.requireNonNull(registry, "registry must not be null");
		return new Compilation(pattern, registry, limits).run();
	}

	public CompilerLimits limits() {
		return limits;
	}

	private enum State {
		DEFAULT,
		CHAR_CLASS,      // [abc]
		VARIABLE_NAME,   // $foo
		REPETITION_SPEC, // {1,10}, {10}, {,10}, {1,}
		ESCAPE           // \x
	}

	/**
	 * One open group: the alternatives finished so far and the sequence being built.
	 */
	private static final class ScopeFrame {

		private final int openedAt;
		private final List<GeneratorNode> alternatives = new ArrayList<>();
		private List<GeneratorNode> sequence = new ArrayList<>();

		private ScopeFrame(int openedAt) {
			this.openedAt = openedAt;
		}

		private void closeAlternative() {
			alternatives.add(new Sequence(sequence));
			sequence = new ArrayList<>();
		}

		private Alternation close() {
			closeAlternative();
			return new Alternation(alternatives);
		}
	}

	private static final class Compilation {

		private final String pattern;
		private final VariableRegistry registry;
		private final CompilerLimits limits;

		private final Deque<State> savedStates = new ArrayDeque<>();
		private final Deque<ScopeFrame> scopes = new ArrayDeque<>();
		private final StringBuilder text = new StringBuilder();
		private final List<Integer> bounds = new ArrayList<>();

		private State state = State.DEFAULT;
		private int position;
		private int markPosition;
		private long pendingBound;
		private boolean boundHasDigits;
		private boolean pendingRange;
		private GeneratorNode result;

		private Compilation(String pattern, VariableRegistry registry, CompilerLimits limits) {
			this.pattern = pattern;
			this.registry = registry;
			this.limits = limits;
		}

		private GeneratorNode run() {
			scopes.push(new ScopeFrame(-1));
			for (position = 0; position < pattern.length(); position++) {
				process(pattern.charAt(position));
			}
			position = pattern.length();
			process(END_OF_INPUT);
			return result;
		}

		private void process(int c) {
			boolean reprocess;
			do {
				reprocess = switch (state) {
					case DEFAULT -> processDefault(c);
					case CHAR_CLASS -> processCharClass(c);
					case VARIABLE_NAME -> processVariableName(c);
					case REPETITION_SPEC -> processRepetitionSpec(c);
					case ESCAPE -> processEscape(c);
				};
			} while (reprocess);
		}

		private boolean processDefault(int c) {
			switch (c) {
				case '\\' -> enter(State.ESCAPE);
				case '$' -> {
					flushLiteral();
					markPosition = position;
					enter(State.VARIABLE_NAME);
				}
				case '(' -> openGroup();
				case ')' -> closeGroup();
				case '{' -> {
					flushLiteral();
					markPosition = position;
					bounds.clear();
					resetBound();
					enter(State.REPETITION_SPEC);
				}
				case '[' -> {
					flushLiteral();
					pendingRange = false;
					enter(State.CHAR_CLASS);
				}
				case '|' -> {
					flushLiteral();
					scopes.peek().closeAlternative();
				}
				case END_OF_INPUT -> finish();
				default -> text.append((char) c);
			}
			return false;
		}

		private boolean processRepetitionSpec(int c) {
			if (isDigit(c)) {
				pendingBound = pendingBound * 10 + (c - '0');
				boundHasDigits = true;
				if (pendingBound > limits.maxRepetitions()) {
					throw error("Repetition bound at position " + position + " exceeds the limit of "
							+ limits.maxRepetitions(), position);
				}
				return false;
			}
			switch (c) {
				case ',' -> {
					if (!bounds.isEmpty()) {
						throw error("Unexpected ',' at position " + position
								+ ": a repetition takes at most two bounds", position);
					}
					bounds.add((int) pendingBound);
					resetBound();
				}
				case '}' -> closeRepetition();
				case END_OF_INPUT -> throw error("Unterminated repetition starting at position " + markPosition
						+ ": expected '}'", position);
				default -> throw error("Unexpected character '" + (char) c + "' at position " + position
						+ " in repetition: expected a digit, ',' or '}'", position);
			}
			return false;
		}

		private boolean processVariableName(int c) {
			if (isNameChar(c)) {
				text.append((char) c);
				return false;
			}
			if (text.length() == 0) {
				throw error("Expected a variable name after '$' at position " + markPosition, markPosition);
			}
			String name = text.toString();
			text.setLength(0);
			if (!registry.isDefined(name)) {
				logger.debug("Pattern '{}' references '{}', which is not defined yet", pattern, name);
			}
			scopes.peek().sequence.add(new Variable(name));
			restoreState();
			// the terminating character belongs to the restored state
			return true;
		}

		private boolean processCharClass(int c) {
			switch (c) {
				case '\\' -> enter(State.ESCAPE);
				case '-' -> {
					if (text.length() == 0 || pendingRange) {
						addClassChar('-');
					} else {
						pendingRange = true;
					}
				}
				case ']' -> {
					closeCharClass();
					restoreState();
				}
				case END_OF_INPUT -> {
					logger.debug("Character class in pattern '{}' is not closed; closing it at end of pattern", pattern);
					closeCharClass();
					restoreState();
					return true;
				}
				default -> addClassChar((char) c);
			}
			return false;
		}

		private boolean processEscape(int c) {
			if (c == END_OF_INPUT) {
				throw error("Dangling '\\' at end of pattern", position);
			}
			restoreState();
			// taken literally; inside a class it never completes a pending range
			text.append((char) c);
			return false;
		}

		private void openGroup() {
			flushLiteral();
			if (scopes.size() > limits.maxNestingDepth()) {
				throw error("Group at position " + position + " exceeds the nesting limit of "
						+ limits.maxNestingDepth(), position);
			}
			enter(State.DEFAULT);
			scopes.push(new ScopeFrame(position));
		}

		private void closeGroup() {
			flushLiteral();
			if (scopes.size() < 2) {
				throw error("Unexpected ')' at position " + position + ": no matching '('", position);
			}
			Alternation group = scopes.pop().close();
			scopes.peek().sequence.add(group);
			restoreState();
		}

		private void finish() {
			flushLiteral();
			if (scopes.size() != 1) {
				int openedAt = scopes.peek().openedAt;
				throw error("Unmatched '(' at position " + openedAt + ": reached end of pattern", openedAt);
			}
			result = scopes.pop().close();
		}

		private void closeRepetition() {
			int min;
			int max;
			if (bounds.isEmpty()) {
				min = (int) pendingBound;
				max = min;
			} else {
				min = bounds.get(0);
				max = boundHasDigits ? (int) pendingBound : Math.max(min, limits.openEndedRepetitionMax());
			}
			if (max < min) {
				throw error("Invalid repetition {" + min + "," + max + "} at position " + position
						+ ": lower bound exceeds upper bound", position);
			}
			List<GeneratorNode> sequence = scopes.peek().sequence;
			if (sequence.isEmpty()) {
				throw error("Repetition at position " + markPosition + " has nothing to repeat", markPosition);
			}
			int last = sequence.size() - 1;
			GeneratorNode child = sequence.get(last);
			long expansion = max * maxExpansion(child);
			if (expansion > limits.maxRepetitions()) {
				throw error("Nested repetitions at position " + position + " may repeat " + expansion
						+ " times, exceeding the limit of " + limits.maxRepetitions(), position);
			}
			sequence.set(last, new Repetition(min, max, child));
			bounds.clear();
			resetBound();
			restoreState();
		}

		/**
		 * The largest number of times any part of {@code node} can be emitted per evaluation of
		 * {@code node}, i.e. the largest product of nested repetition upper bounds. Variables count
		 * as 1 since their trees are not known until evaluation.
		 */
		private static long maxExpansion(GeneratorNode node) {
			if (node instanceof Repetition repetition) {
				return repetition.max() * maxExpansion(repetition.child());
			}
			List<GeneratorNode> children;
			if (node instanceof Sequence sequence) {
				children = sequence.children();
			} else if (node instanceof Alternation alternation) {
				children = alternation.children();
			} else {
				return 1;
			}
			long largest = 1;
			for (GeneratorNode child : children) {
				largest = Math.max(largest, maxExpansion(child));
			}
			return largest;
		}

		private void addClassChar(char c) {
			if (!pendingRange) {
				text.append(c);
				return;
			}
			pendingRange = false;
			char from = text.charAt(text.length() - 1);
			if (from >= c) {
				logger.debug("Ignoring inverted range '{}-{}' at position {} in pattern '{}'", from, c, position, pattern);
				return;
			}
			for (int ch = from + 1; ch <= c; ch++) {
				text.append((char) ch);
			}
		}

		private void closeCharClass() {
			// a range left open by a trailing '-' contributes nothing
			pendingRange = false;
			scopes.peek().sequence.add(new CharClass(text.toString()));
			text.setLength(0);
		}

		private void flushLiteral() {
			if (text.length() > 0) {
				scopes.peek().sequence.add(new Constant(text.toString()));
				text.setLength(0);
			}
		}

		private void resetBound() {
			pendingBound = 0;
			boundHasDigits = false;
		}

		private void enter(State next) {
			savedStates.push(state);
			state = next;
		}

		private void restoreState() {
			if (savedStates.isEmpty()) {
				throw error("Unbalanced pattern structure at position " + position, position);
			}
			state = savedStates.pop();
		}

		private PatternCompileException error(String message, int at) {
			return new PatternCompileException(message, pattern, at);
		}

		private static boolean isDigit(int c) {
			return c >= '0' && c <= '9';
		}

		private static boolean isNameChar(int c) {
			return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_' || isDigit(c);
		}
	}
}

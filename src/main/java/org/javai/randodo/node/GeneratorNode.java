package org.javai.randodo.node;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One compiled unit of a pattern. Sealed so that every variant is known to the optimizer and to
 * every {@link GeneratorNodeVisitor}.
 * <p>
 * Variants:
 * <ul>
 *   <li>{@link Constant} - literal text</li>
 *   <li>{@link CharClass} - one character picked from an explicit set</li>
 *   <li>{@link Variable} - a by-name reference into the variable registry</li>
 *   <li>{@link Repetition} - its child emitted a random number of times</li>
 *   <li>{@link Sequence} - its children emitted in order</li>
 *   <li>{@link Alternation} - exactly one of its children emitted</li>
 * </ul>
 * Nodes are immutable. Evaluating a tree never changes it, so a tree can be shared between threads
 * as long as each evaluation has its own {@link GenerationContext}.
 */
public sealed interface GeneratorNode {

	/**
	 * Appends this node's output to {@code output}, drawing random values from {@code context}.
	 */
	void generate(StringBuilder output, GenerationContext context);

	/**
	 * Whether this node can be dropped from a sequence without changing the generated text.
	 */
	boolean isEmpty();

	<R> R accept(GeneratorNodeVisitor<R> visitor);

	/**
	 * Returns the pruned form of this subtree. See {@link TreeOptimizer}.
	 */
	default GeneratorNode optimize() {
		return TreeOptimizer.optimize(this);
	}

	/**
	 * Literal text.
	 *
	 * @param text the text to emit
	 */
	record Constant(String text) implements GeneratorNode {
		public Constant {
			Objects.requireNonNull(text, "text must not be null");
		}

		@Override
		public void generate(StringBuilder output, GenerationContext context) {
			output.append(text);
		}

		@Override
		public boolean isEmpty() {
			return text.isEmpty();
		}

		@Override
		public <R> R accept(GeneratorNodeVisitor<R> visitor) {
			return visitor.visitConstant(this);
		}
	}

	/**
	 * One character chosen from {@code chars}, duplicates included as written.
	 *
	 * @param chars the candidate characters, in the order they were collected
	 */
	record CharClass(String chars) implements GeneratorNode {
		public CharClass {
			Objects.requireNonNull(chars, "chars must not be null");
		}

		@Override
		public void generate(StringBuilder output, GenerationContext context) {
			if (chars.isEmpty()) {
				return;
			}
			output.append(chars.charAt(context.nextRandom(this) % chars.length()));
		}

		@Override
		public boolean isEmpty() {
			return chars.isEmpty();
		}

		@Override
		public <R> R accept(GeneratorNodeVisitor<R> visitor) {
			return visitor.visitCharClass(this);
		}
	}

	/**
	 * Reference to a named tree, looked up on every evaluation. An unknown name produces no output.
	 *
	 * @param name the registry key
	 */
	record Variable(String name) implements GeneratorNode {
		public Variable {
			Objects.requireNonNull(name, "name must not be null");
		}

		@Override
		public void generate(StringBuilder output, GenerationContext context) {
			Optional<GeneratorNode> target = context.resolve(name);
			if (target.isEmpty()) {
				return;
			}
			context.enterVariable(name);
			try {
				target.get().generate(output, context);
			} finally {
				context.exitVariable();
			}
		}

		/**
		 * Always {@code false}: the referenced tree is not known until evaluation.
		 */
		@Override
		public boolean isEmpty() {
			return false;
		}

		@Override
		public <R> R accept(GeneratorNodeVisitor<R> visitor) {
			return visitor.visitVariable(this);
		}
	}

	/**
	 * Emits {@code child} between {@code min} and {@code max} times, both inclusive.
	 */
	record Repetition(int min, int max, GeneratorNode child) implements GeneratorNode {
		public Repetition {
			Objects.requireNonNull(child, "child must not be null");
			if (min < 0) {
				throw new IllegalArgumentException("min must not be negative: " + min);
			}
			if (max < min) {
				throw new IllegalArgumentException("max (" + max + ") must not be less than min (" + min + ")");
			}
		}

		@Override
		public void generate(StringBuilder output, GenerationContext context) {
			int count = min;
			if (max > min) {
				count += context.nextRandom(this) % (max - min + 1);
			}
			for (int i = 0; i < count; i++) {
				child.generate(output, context);
			}
		}

		@Override
		public boolean isEmpty() {
			return min == 0 && max == 0;
		}

		@Override
		public <R> R accept(GeneratorNodeVisitor<R> visitor) {
			return visitor.visitRepetition(this);
		}
	}

	/**
	 * Emits every child in order.
	 */
	record Sequence(List<GeneratorNode> children) implements GeneratorNode {
		public Sequence {
			children = List.copyOf(children);
		}

		@Override
		public void generate(StringBuilder output, GenerationContext context) {
			for (GeneratorNode child : children) {
				child.generate(output, context);
			}
		}

		@Override
		public boolean isEmpty() {
			return children.isEmpty();
		}

		@Override
		public <R> R accept(GeneratorNodeVisitor<R> visitor) {
			return visitor.visitSequence(this);
		}
	}

	/**
	 * Emits one child, chosen uniformly.
	 */
	record Alternation(List<GeneratorNode> children) implements GeneratorNode {
		public Alternation {
			children = List.copyOf(children);
		}

		@Override
		public void generate(StringBuilder output, GenerationContext context) {
			if (children.isEmpty()) {
				return;
			}
			children.get(context.nextRandom(this) % children.size()).generate(output, context);
		}

		@Override
		public boolean isEmpty() {
			return children.isEmpty();
		}

		@Override
		public <R> R accept(GeneratorNodeVisitor<R> visitor) {
			return visitor.visitAlternation(this);
		}
	}
}

package org.javai.randodo.node;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.javai.randodo.node.GeneratorNode.Alternation;
import org.javai.randodo.node.GeneratorNode.CharClass;
import org.javai.randodo.node.GeneratorNode.Constant;
import org.javai.randodo.node.GeneratorNode.Repetition;
import org.javai.randodo.node.GeneratorNode.Sequence;
import org.javai.randodo.node.GeneratorNode.Variable;

/**
 * Post-order rewrite that prunes a freshly compiled tree.
 * <p>
 * Children are optimized before their parent. A {@link Sequence} then drops children that report
 * {@link GeneratorNode#isEmpty()} (keeping the order of the survivors) and merges adjacent
 * {@link Constant} siblings. Other variants only rebuild themselves from their optimized children;
 * alternations are kept even with a single child since removing one would change which random values
 * the rest of the tree sees.
 * <p>
 * The rewrite is idempotent and never changes generated output.
 */
public final class TreeOptimizer implements GeneratorNodeVisitor<GeneratorNode> {

	private static final TreeOptimizer INSTANCE = new TreeOptimizer();

	private TreeOptimizer() {
	}

	/**
	 * Optimizes the tree rooted at {@code root}.
	 *
	 * @return the optimized tree; equal to {@code root} when there was nothing to prune
	 */
	public static GeneratorNode optimize(GeneratorNode root) {
		Objects.requireNonNull(root, "root must not be null");
		return root.accept(INSTANCE);
	}

	@Override
	public GeneratorNode visitConstant(Constant constant) {
		return constant;
	}

	@Override
	public GeneratorNode visitCharClass(CharClass charClass) {
		return charClass;
	}

	@Override
	public GeneratorNode visitVariable(Variable variable) {
		return variable;
	}

	@Override
	public GeneratorNode visitRepetition(Repetition repetition) {
		GeneratorNode child = repetition.child().accept(this);
		if (child == repetition.child()) {
			return repetition;
		}
		return new Repetition(repetition.min(), repetition.max(), child);
	}

	@Override
	public GeneratorNode visitSequence(Sequence sequence) {
		List<GeneratorNode> kept = new ArrayList<>(sequence.children().size());
		for (GeneratorNode child : sequence.children()) {
			GeneratorNode optimized = child.accept(this);
			if (optimized.isEmpty()) {
				continue;
			}
			int last = kept.size() - 1;
			if (optimized instanceof Constant next && last >= 0 && kept.get(last) instanceof Constant previous) {
				kept.set(last, new Constant(previous.text() + next.text()));
			} else {
				kept.add(optimized);
			}
		}
		return new Sequence(kept);
	}

	@Override
	public GeneratorNode visitAlternation(Alternation alternation) {
		List<GeneratorNode> children = new ArrayList<>(alternation.children().size());
		for (GeneratorNode child : alternation.children()) {
			children.add(child.accept(this));
		}
		return new Alternation(children);
	}
}

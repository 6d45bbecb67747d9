package org.javai.randodo.node;

/**
 * Visitor over the sealed set of {@link GeneratorNode} variants.
 * <p>
 * Used for tree rewrites ({@link TreeOptimizer}) and for rendering ({@link GeneratorTreeJsonEmitter}).
 *
 * @param <R> the return type of the visitor operations
 */
public interface GeneratorNodeVisitor<R> {

	R visitConstant(GeneratorNode.Constant constant);

	R visitCharClass(GeneratorNode.CharClass charClass);

	R visitVariable(GeneratorNode.Variable variable);

	R visitRepetition(GeneratorNode.Repetition repetition);

	R visitSequence(GeneratorNode.Sequence sequence);

	R visitAlternation(GeneratorNode.Alternation alternation);
}

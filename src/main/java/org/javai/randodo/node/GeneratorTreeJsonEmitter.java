package org.javai.randodo.node;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.javai.randodo.node.GeneratorNode.Alternation;
import org.javai.randodo.node.GeneratorNode.CharClass;
import org.javai.randodo.node.GeneratorNode.Constant;
import org.javai.randodo.node.GeneratorNode.Repetition;
import org.javai.randodo.node.GeneratorNode.Sequence;
import org.javai.randodo.node.GeneratorNode.Variable;

/**
 * Renders a generator tree as JSON, mainly for debugging compiled patterns.
 * <pre>
 * {"type":"sequence","children":[{"type":"constant","text":"id-"},{"type":"repetition","min":3,"max":3,
 *   "child":{"type":"charClass","chars":"0123456789"}}]}
 * </pre>
 */
public final class GeneratorTreeJsonEmitter implements GeneratorNodeVisitor<ObjectNode> {

	private static final ObjectMapper mapper = new ObjectMapper();
	private static final GeneratorTreeJsonEmitter INSTANCE = new GeneratorTreeJsonEmitter();

	private GeneratorTreeJsonEmitter() {}

	public static ObjectNode emit(GeneratorNode tree) {
		return tree.accept(INSTANCE);
	}

	public static String emitString(GeneratorNode tree) {
		return emit(tree).toString();
	}

	@Override
	public ObjectNode visitConstant(Constant constant) {
		ObjectNode node = typed("constant");
		node.put("text", constant.text());
		return node;
	}

	@Override
	public ObjectNode visitCharClass(CharClass charClass) {
		ObjectNode node = typed("charClass");
		node.put("chars", charClass.chars());
		return node;
	}

	@Override
	public ObjectNode visitVariable(Variable variable) {
		ObjectNode node = typed("variable");
		node.put("name", variable.name());
		return node;
	}

	@Override
	public ObjectNode visitRepetition(Repetition repetition) {
		ObjectNode node = typed("repetition");
		node.put("min", repetition.min());
		node.put("max", repetition.max());
		node.set("child", repetition.child().accept(this));
		return node;
	}

	@Override
	public ObjectNode visitSequence(Sequence sequence) {
		ObjectNode node = typed("sequence");
		ArrayNode children = node.putArray("children");
		sequence.children().forEach(child -> children.add(child.accept(this)));
		return node;
	}

	@Override
	public ObjectNode visitAlternation(Alternation alternation) {
		ObjectNode node = typed("alternation");
		ArrayNode children = node.putArray("children");
		alternation.children().forEach(child -> children.add(child.accept(this)));
		return node;
	}

	private static ObjectNode typed(String type) {
		ObjectNode node = mapper.createObjectNode();
		node.put("type", type);
		return node;
	}
}

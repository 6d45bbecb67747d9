package org.javai.randodo.registry;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.apache.logging.log4j.Level;
import org.javai.randodo.node.GeneratorNode;
import org.javai.randodo.node.GeneratorNode.Constant;
import org.javai.randodo.testsupport.LogCaptorAppender;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DefaultVariableRegistryTest {

	private DefaultVariableRegistry registry;

	@BeforeEach
	void setUp() {
		registry = new DefaultVariableRegistry();
	}

	@Test
	void lookupReturnsRegisteredTree() {
		GeneratorNode tree = new Constant("x");
		registry.define("name", tree);

		assertThat(registry.lookup("name")).containsSame(tree);
		assertThat(registry.isDefined("name")).isTrue();
		assertThat(registry.size()).isEqualTo(1);
	}

	@Test
	void unknownNameIsEmpty() {
		assertThat(registry.lookup("missing")).isEmpty();
		assertThat(registry.isDefined("missing")).isFalse();
		assertThat(registry.isDefined(null)).isFalse();
	}

	@Test
	void redefinitionReplacesAndIsLogged() {
		registry.define("name", new Constant("old"));

		try (LogCaptorAppender captor = LogCaptorAppender.capture(DefaultVariableRegistry.class, Level.DEBUG)) {
			registry.define("name", new Constant("new"));

			assertThat(captor.messagesAt(Level.DEBUG))
					.anyMatch(message -> message.contains("Variable 'name' redefined"));
		}
		assertThat(registry.lookup("name")).contains(new Constant("new"));
		assertThat(registry.size()).isEqualTo(1);
	}

	@Test
	void firstDefinitionIsNotLoggedAsRedefinition() {
		try (LogCaptorAppender captor = LogCaptorAppender.capture(DefaultVariableRegistry.class, Level.DEBUG)) {
			registry.define("fresh", new Constant("x"));

			assertThat(captor.messages()).isEmpty();
		}
	}

	@Test
	void rejectsBlankNameAndNullTree() {
		assertThatThrownBy(() -> registry.define(" ", new Constant("x")))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessage("Variable name cannot be null or empty");
		assertThatThrownBy(() -> registry.define(null, new Constant("x")))
				.isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> registry.define("name", null))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessage("Tree cannot be null");
	}

	@Test
	void namesIsASnapshot() {
		registry.define("a", new Constant("1"));
		var names = registry.names();
		registry.define("b", new Constant("2"));

		assertThat(names).containsExactly("a");
		assertThat(registry.names()).containsExactlyInAnyOrder("a", "b");
		assertThatThrownBy(() -> names.add("c")).isInstanceOf(UnsupportedOperationException.class);
	}

	@Test
	void emptyRegistryHasNoEntries() {
		assertThat(VariableRegistry.empty().size()).isZero();
		assertThat(VariableRegistry.empty().names()).isEmpty();
	}
}

package org.javai.randodo;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import org.javai.randodo.config.RandodoSettings;
import org.javai.randodo.config.RandomMode;
import org.javai.randodo.node.GenerationException;
import org.javai.randodo.node.GeneratorNode;
import org.javai.randodo.pattern.CompilerLimits;
import org.javai.randodo.pattern.PatternCompileException;
import org.javai.randodo.random.RandomStreams;
import org.javai.randodo.random.SequentialRandomSource;
import org.javai.randodo.random.SystemRandomSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Randodo")
class RandodoTest {

	@Nested
	@DisplayName("definitions")
	class Definitions {

		@Test
		void generatesRegisteredDefinition() {
			Randodo randodo = Randodo.create();
			randodo.define("greeting", "(hello|hi), [a-z]{3,6}!");

			for (int i = 0; i < 50; i++) {
				assertThat(randodo.generate("greeting")).matches("(hello|hi), [a-z]{3,6}!");
			}
		}

		@Test
		void forwardReferenceResolvesOnceDefined() {
			Randodo randodo = Randodo.create();
			randodo.define("wrapped", "<$inner>");

			assertThat(randodo.generate("wrapped")).isEqualTo("<>");

			randodo.define("inner", "x");
			assertThat(randodo.generate("wrapped")).isEqualTo("<x>");

			randodo.define("inner", "y");
			assertThat(randodo.generate("wrapped")).isEqualTo("<y>");
		}

		@Test
		void unknownNameIsRejected() {
			Randodo randodo = Randodo.create();

			assertThatThrownBy(() -> randodo.generate("nobody"))
					.isInstanceOf(IllegalArgumentException.class)
					.hasMessage("No definition named 'nobody'");
		}

		@Test
		void compiledPatternsAreNotRegistered() {
			Randodo randodo = Randodo.create();
			randodo.define("n", "7");

			GeneratorNode tree = randodo.compile("n=$n");

			assertThat(randodo.evaluate(tree)).isEqualTo("n=7");
			assertThat(randodo.registry().names()).containsExactly("n");
		}

		@Test
		void loadsDefinitionsFromAReader() {
			Randodo randodo = Randodo.create();

			assertThat(randodo.load(new StringReader("a = [x]\nb = $a-$a\n")).isSuccess()).isTrue();
			assertThat(randodo.generate("b")).isEqualTo("x-x");
		}

		@Test
		void loadsDefinitionsFromLines() {
			Randodo randodo = Randodo.create();

			assertThat(randodo.loadLines(List.of("a = 1", "b = 2$a")).isSuccess()).isTrue();
			assertThat(randodo.generate("b")).isEqualTo("21");
		}
	}

	@Nested
	@DisplayName("sequential per-node streams")
	class SequentialStreams {

		private final Randodo randodo = Randodo.create();

		private List<String> generate(String pattern, int times) {
			randodo.define("p", pattern);
			RandomStreams streams = RandomStreams.perNode(SequentialRandomSource::new);
			List<String> outputs = new ArrayList<>();
			for (int i = 0; i < times; i++) {
				outputs.add(randodo.generate("p", streams));
			}
			return outputs;
		}

		@Test
		void charClassesAdvanceIndependently() {
			assertThat(generate("abc[d-f][g-i]", 2)).containsExactly("abcdg", "abceh");
		}

		@Test
		void alternationsCycle() {
			assertThat(generate("(a|b|c)", 4)).containsExactly("a", "b", "c", "a");
		}

		@Test
		void fixedRepetitionRepeatsTheClass() {
			assertThat(generate("[ab]{3}", 1)).containsExactly("aba");
		}
	}

	@Nested
	@DisplayName("settings")
	class Settings {

		@Test
		void seededInstancesAreReproducible() {
			RandodoSettings seeded = RandodoSettings.defaults().withSeed(99L);

			assertThat(outputs(Randodo.create(seeded))).isEqualTo(outputs(Randodo.create(seeded)));
		}

		@Test
		void seededSharedModeIsReproducible() {
			RandodoSettings seeded = RandodoSettings.defaults().withSeed(5L).withRandomMode(RandomMode.SHARED);

			assertThat(outputs(Randodo.create(seeded))).isEqualTo(outputs(Randodo.create(seeded)));
		}

		@Test
		void callsOfOneSeededInstanceDiffer() {
			Randodo randodo = Randodo.create(RandodoSettings.defaults().withSeed(1L));
			randodo.define("token", "[a-z]{16}");

			assertThat(randodo.generate("token")).isNotEqualTo(randodo.generate("token"));
		}

		@Test
		void compilerLimitsApply() {
			RandodoSettings settings = new RandodoSettings(new CompilerLimits(64, 10, 8), 64, RandomMode.PER_NODE, null);
			Randodo randodo = Randodo.create(settings);

			assertThatThrownBy(() -> randodo.define("big", "a{11}"))
					.isInstanceOf(PatternCompileException.class);
			assertThat(randodo.registry().isDefined("big")).isFalse();
		}

		@Test
		void variableDepthApplies() {
			RandodoSettings settings = new RandodoSettings(CompilerLimits.defaults(), 4, RandomMode.PER_NODE, null);
			Randodo randodo = Randodo.create(settings);
			randodo.define("loop", "x$loop");

			assertThatThrownBy(() -> randodo.generate("loop"))
					.isInstanceOf(GenerationException.class)
					.hasMessageContaining("deeper than 4");
		}

		@Test
		void unseededStreamsFollowTheRandomMode() {
			RandomStreams perNode = Randodo.create(RandodoSettings.defaults()).newStreams();
			Object first = new Object();
			Object second = new Object();
			assertThat(perNode.streamFor(first)).isSameAs(perNode.streamFor(first));
			assertThat(perNode.streamFor(first)).isNotSameAs(perNode.streamFor(second));

			RandomStreams shared = Randodo.create(RandodoSettings.defaults().withRandomMode(RandomMode.SHARED))
					.newStreams();
			assertThat(shared.streamFor(first)).isSameAs(SystemRandomSource.INSTANCE);
			assertThat(shared.streamFor(second)).isSameAs(SystemRandomSource.INSTANCE);
		}

		@Test
		void createUsesBundledDefaults() {
			assertThat(Randodo.create().settings()).isEqualTo(RandodoSettings.defaults());
		}

		private List<String> outputs(Randodo randodo) {
			randodo.define("id", "[A-F0-9]{8}-(x|y|z)[0-9]{1,4}");
			List<String> outputs = new ArrayList<>();
			for (int i = 0; i < 10; i++) {
				outputs.add(randodo.generate("id"));
			}
			return outputs;
		}
	}
}

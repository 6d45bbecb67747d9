package org.javai.randodo.definition;

import static org.assertj.core.api.Assertions.assertThat;

import org.javai.randodo.definition.LineParseResult.Malformed;
import org.javai.randodo.definition.LineParseResult.Parsed;
import org.javai.randodo.definition.LineParseResult.Skipped;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("DefinitionLineParser")
class DefinitionLineParserTest {

	@Nested
	@DisplayName("skipped lines")
	class SkippedLines {

		@ParameterizedTest
		@ValueSource(strings = {"", "   ", "\t \t", "# comment", "   # indented comment", "\t#x = y"})
		void blankAndCommentLinesAreSkipped(String line) {
			assertThat(DefinitionLineParser.parse(line, 1)).isInstanceOf(Skipped.class);
		}

		@Test
		void nullLineIsSkipped() {
			assertThat(DefinitionLineParser.parse(null, 1)).isInstanceOf(Skipped.class);
		}
	}

	@Nested
	@DisplayName("definitions")
	class Definitions {

		@Test
		void simpleDefinition() {
			LineParseResult result = DefinitionLineParser.parse("digit = [0-9]", 3);

			assertThat(result).isEqualTo(new Parsed(new Definition("digit", "[0-9]", 3)));
		}

		@Test
		void whitespaceAroundNameAndEqualsIsOptional() {
			assertThat(definitionOf(" \thex=[0-9a-f]").name()).isEqualTo("hex");
			assertThat(definitionOf("hex\t=\t[0-9a-f]").pattern()).isEqualTo("[0-9a-f]");
			assertThat(definitionOf("hex    =    x").pattern()).isEqualTo("x");
		}

		@Test
		void patternIsKeptVerbatim() {
			Definition definition = definitionOf("line = a = b # not a comment  ");

			assertThat(definition.pattern()).isEqualTo("a = b # not a comment  ");
		}

		@Test
		void nameMayContainAnyNonBlankCharacters() {
			assertThat(definitionOf("user-id.v2 = x").name()).isEqualTo("user-id.v2");
		}
	}

	@Nested
	@DisplayName("malformed lines")
	class MalformedLines {

		@ParameterizedTest(name = "''{0}'' -> column {1}")
		@CsvSource(delimiter = '|', quoteCharacter = '"', value = {
				"= x          | 1 | missing definition name before '='",
				"bad name = y | 5 | unexpected characters after definition name",
				"name         | 5 | missing '=' after definition name",
				"name=        | 6 | missing pattern after '='"
		})
		void reportsColumnAndMessage(String line, int column, String message) {
			assertThat(DefinitionLineParser.parse(line, 7)).isEqualTo(new Malformed(column, message));
		}

		@Test
		void trailingWhitespaceAfterNameStillMissesEquals() {
			assertThat(DefinitionLineParser.parse("name  ", 1))
					.isEqualTo(new Malformed(7, "missing '=' after definition name"));
		}

		@Test
		void onlyWhitespaceAfterEqualsMissesPattern() {
			assertThat(DefinitionLineParser.parse("  name = \t", 1))
					.isEqualTo(new Malformed(11, "missing pattern after '='"));
		}
	}

	private static Definition definitionOf(String line) {
		LineParseResult result = DefinitionLineParser.parse(line, 1);
		assertThat(result).isInstanceOf(Parsed.class);
		return ((Parsed) result).definition();
	}
}

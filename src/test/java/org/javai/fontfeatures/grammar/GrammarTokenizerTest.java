package org.javai.fontfeatures.grammar;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.javai.fontfeatures.grammar.GrammarToken.TokenType;
import org.junit.jupiter.api.Test;

class GrammarTokenizerTest {

	@Test
	void tokenizesRuleDefinition() {
		List<GrammarToken> tokens = new GrammarTokenizer("action: CLASSNAME \"=\" primary*").tokenize();

		assertThat(tokens).extracting(GrammarToken::type).containsExactly(
				TokenType.RULE_NAME, TokenType.COLON, TokenType.TERMINAL_NAME, TokenType.STRING,
				TokenType.RULE_NAME, TokenType.STAR, TokenType.EOF);
		assertThat(tokens.get(3).value()).isEqualTo("=");
	}

	@Test
	void keepsEscapesInRegexButNotTheClosingSlash() {
		List<GrammarToken> tokens = new GrammarTokenizer("REGEX: /\\/\\S*\\//").tokenize();

		assertThat(tokens.get(2).type()).isEqualTo(TokenType.REGEX);
		assertThat(tokens.get(2).value()).isEqualTo("\\/\\S*\\/");
	}

	@Test
	void caseInsensitiveRegexFlag() {
		List<GrammarToken> tokens = new GrammarTokenizer("KEYWORD: /not/i").tokenize();

		assertThat(tokens.get(2).value()).isEqualTo("(?i)not");
	}

	@Test
	void skipsLineComments() {
		List<GrammarToken> tokens = new GrammarTokenizer("// leading comment\nstart: a // trailing\n").tokenize();

		assertThat(tokens).extracting(GrammarToken::value).containsExactly("start", ":", "a", "");
	}

	@Test
	void marksFirstTokenOfEachLine() {
		List<GrammarToken> tokens = new GrammarTokenizer("a: b\n  | c\nd: e").tokenize();

		assertThat(tokens).filteredOn(GrammarToken::lineStart)
				.extracting(GrammarToken::value)
				.containsExactly("a", "|", "d", "");
	}

	@Test
	void directive() {
		List<GrammarToken> tokens = new GrammarTokenizer("%ignore WS").tokenize();

		assertThat(tokens.get(0).type()).isEqualTo(TokenType.DIRECTIVE);
		assertThat(tokens.get(0).value()).isEqualTo("ignore");
	}

	@Test
	void rejectsUnterminatedString() {
		assertThatThrownBy(() -> new GrammarTokenizer("a: \"open").tokenize())
				.isInstanceOf(GrammarException.class)
				.hasMessageContaining("Unterminated string");
	}

	@Test
	void rejectsUnknownCharacter() {
		assertThatThrownBy(() -> new GrammarTokenizer("a: b ! c").tokenize())
				.isInstanceOf(GrammarException.class)
				.hasMessageContaining("'!'");
	}
}

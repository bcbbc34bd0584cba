package org.javai.fontfeatures.grammar;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Parser for grammar notation text.
 * Tokenizes the text and creates an immutable {@link GrammarDefinition}.
 *
 * <pre>
 * ?start: action
 * action: CLASSNAME "=" primary
 * CONJUNCTOR: "&amp;" | "|" | "-"
 * %ignore WS
 * </pre>
 *
 * A definition must begin a line. Its body runs until the next line that begins
 * a definition or directive.
 */
public class GrammarNotationParser {

	private static final String IGNORE_DIRECTIVE = "ignore";

	/**
	 * Parse grammar notation from an input stream (UTF-8).
	 */
	public GrammarDefinition parse(InputStream inputStream) {
		try {
			return parseString(new String(inputStream.readAllBytes(), StandardCharsets.UTF_8));
		} catch (IOException e) {
			throw new GrammarException("Failed to read grammar from input stream", e);
		}
	}

	/**
	 * Parse grammar notation from a string. {@code null} or blank text yields an empty definition.
	 */
	public GrammarDefinition parseString(String grammarText) {
		if (grammarText == null || grammarText.isBlank()) {
			return GrammarDefinition.EMPTY;
		}
		List<GrammarToken> tokens = new GrammarTokenizer(grammarText).tokenize();
		return parseTokens(tokens);
	}

	private GrammarDefinition parseTokens(List<GrammarToken> tokens) {
		ParserState state = new ParserState(tokens);
		Map<String, RuleDefinition> rules = new LinkedHashMap<>();
		Map<String, TerminalDefinition> terminals = new LinkedHashMap<>();
		Set<String> ignored = new LinkedHashSet<>();

		while (!state.isAtEnd()) {
			GrammarToken token = state.peek();
			if (token.isType(GrammarToken.TokenType.DIRECTIVE)) {
				parseDirective(state, ignored);
				continue;
			}

			boolean inline = false;
			if (token.isType(GrammarToken.TokenType.QUESTION)) {
				inline = true;
				state.advance();
				token = state.peek();
			}
			if (!token.isName()) {
				throw new GrammarException("Expected a rule or terminal definition on line " + token.line()
						+ ", found " + token);
			}
			state.advance();
			state.expect(GrammarToken.TokenType.COLON, "after '" + token.value() + "'");
			GrammarExpression body = parseAlternatives(state);

			if (token.isType(GrammarToken.TokenType.TERMINAL_NAME)) {
				if (inline) {
					throw new GrammarException("Terminal '" + token.value() + "' cannot be declared with '?'");
				}
				if (terminals.put(token.value(), new TerminalDefinition(token.value(), body)) != null) {
					throw new GrammarException("Terminal '" + token.value() + "' is defined more than once");
				}
			} else if (rules.put(token.value(), new RuleDefinition(token.value(), body, inline)) != null) {
				throw new GrammarException("Rule '" + token.value() + "' is defined more than once");
			}
		}

		return new GrammarDefinition(rules, terminals, ignored);
	}

	private void parseDirective(ParserState state, Set<String> ignored) {
		GrammarToken directive = state.advance();
		if (!IGNORE_DIRECTIVE.equals(directive.value())) {
			throw new GrammarException("Unknown directive '%" + directive.value() + "' on line " + directive.line());
		}
		int named = 0;
		while (!state.isAtEnd() && state.check(GrammarToken.TokenType.TERMINAL_NAME) && !state.atDefinitionStart()) {
			ignored.add(state.advance().value());
			named++;
		}
		if (named == 0) {
			throw new GrammarException("'%ignore' on line " + directive.line() + " names no terminal");
		}
	}

	private GrammarExpression parseAlternatives(ParserState state) {
		List<GrammarExpression> alternatives = new ArrayList<>();
		alternatives.add(parseSequence(state));
		while (state.check(GrammarToken.TokenType.PIPE)) {
			state.advance();
			alternatives.add(parseSequence(state));
		}
		return alternatives.size() == 1 ? alternatives.get(0) : new GrammarExpression.Choice(alternatives);
	}

	private GrammarExpression parseSequence(ParserState state) {
		List<GrammarExpression> items = new ArrayList<>();
		while (!state.isAtEnd() && !state.atDefinitionStart() && !state.atSequenceEnd()) {
			items.add(parseItem(state));
		}
		return items.size() == 1 ? items.get(0) : new GrammarExpression.Sequence(items);
	}

	private GrammarExpression parseItem(ParserState state) {
		GrammarExpression atom = parseAtom(state);
		if (state.check(GrammarToken.TokenType.STAR)) {
			state.advance();
			return GrammarExpression.Repeat.zeroOrMore(atom);
		}
		if (state.check(GrammarToken.TokenType.PLUS)) {
			state.advance();
			return GrammarExpression.Repeat.oneOrMore(atom);
		}
		if (state.check(GrammarToken.TokenType.QUESTION) && !state.atDefinitionStart()) {
			state.advance();
			return GrammarExpression.Repeat.optional(atom);
		}
		return atom;
	}

	private GrammarExpression parseAtom(ParserState state) {
		GrammarToken token = state.advance();
		return switch (token.type()) {
			case STRING -> new GrammarExpression.Literal(token.value());
			case REGEX -> new GrammarExpression.Regex(token.value());
			case RULE_NAME -> new GrammarExpression.RuleRef(token.value());
			case TERMINAL_NAME -> new GrammarExpression.TerminalRef(token.value());
			case LPAREN -> {
				GrammarExpression group = parseAlternatives(state);
				state.expect(GrammarToken.TokenType.RPAREN, "to close '(' on line " + token.line());
				yield group;
			}
			case LBRACKET -> {
				GrammarExpression group = parseAlternatives(state);
				state.expect(GrammarToken.TokenType.RBRACKET, "to close '[' on line " + token.line());
				yield GrammarExpression.Repeat.optional(group);
			}
			default -> throw new GrammarException("Unexpected " + token + " on line " + token.line());
		};
	}

	/**
	 * Cursor over grammar tokens.
	 */
	static class ParserState {
		private final List<GrammarToken> tokens;
		private int current = 0;

		ParserState(List<GrammarToken> tokens) {
			this.tokens = tokens;
		}

		GrammarToken peek() {
			return tokens.get(current);
		}

		GrammarToken peekAhead(int distance) {
			int index = Math.min(current + distance, tokens.size() - 1);
			return tokens.get(index);
		}

		GrammarToken advance() {
			if (!isAtEnd()) {
				current++;
			}
			return tokens.get(current - 1);
		}

		boolean check(GrammarToken.TokenType type) {
			if (isAtEnd()) return false;
			return peek().type() == type;
		}

		boolean isAtEnd() {
			return peek().type() == GrammarToken.TokenType.EOF;
		}

		void expect(GrammarToken.TokenType type, String context) {
			if (!check(type)) {
				GrammarToken found = peek();
				throw new GrammarException("Expected " + type + " " + context + " on line " + found.line()
						+ ", found " + found);
			}
			advance();
		}

		/**
		 * True when the current token opens a new definition or directive.
		 */
		boolean atDefinitionStart() {
			GrammarToken token = peek();
			if (!token.lineStart()) {
				return false;
			}
			if (token.isType(GrammarToken.TokenType.DIRECTIVE)) {
				return true;
			}
			if (token.isName()) {
				return peekAhead(1).isType(GrammarToken.TokenType.COLON);
			}
			if (token.isType(GrammarToken.TokenType.QUESTION)) {
				return peekAhead(1).isType(GrammarToken.TokenType.RULE_NAME)
						&& peekAhead(2).isType(GrammarToken.TokenType.COLON);
			}
			return false;
		}

		boolean atSequenceEnd() {
			return check(GrammarToken.TokenType.PIPE)
					|| check(GrammarToken.TokenType.RPAREN)
					|| check(GrammarToken.TokenType.RBRACKET);
		}
	}
}

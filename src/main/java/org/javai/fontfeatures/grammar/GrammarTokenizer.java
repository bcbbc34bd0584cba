package org.javai.fontfeatures.grammar;

import java.util.ArrayList;
import java.util.List;

/**
 * Tokenizer for the grammar notation used by the base grammar and plugin fragments.
 * Converts grammar text into a stream of tokens.
 */
public class GrammarTokenizer {

	private final String input;
	private int pos = 0;
	private int line = 1;
	private int lastTokenLine = 0;

	public GrammarTokenizer(String input) {
		this.input = input != null ? input : "";
	}

	/**
	 * Tokenizes the entire grammar text.
	 *
	 * @return list of tokens (includes EOF token at end)
	 * @throws GrammarException if invalid notation is encountered
	 */
	public List<GrammarToken> tokenize() {
		List<GrammarToken> tokens = new ArrayList<>();

		while (!isAtEnd()) {
			skipWhitespaceAndComments();
			if (isAtEnd()) break;

			tokens.add(nextToken());
		}

		tokens.add(new GrammarToken(GrammarToken.TokenType.EOF, "", line, true));
		return tokens;
	}

	private GrammarToken nextToken() {
		char c = peek();

		return switch (c) {
			case ':' -> single(GrammarToken.TokenType.COLON);
			case '|' -> single(GrammarToken.TokenType.PIPE);
			case '(' -> single(GrammarToken.TokenType.LPAREN);
			case ')' -> single(GrammarToken.TokenType.RPAREN);
			case '[' -> single(GrammarToken.TokenType.LBRACKET);
			case ']' -> single(GrammarToken.TokenType.RBRACKET);
			case '*' -> single(GrammarToken.TokenType.STAR);
			case '+' -> single(GrammarToken.TokenType.PLUS);
			case '?' -> single(GrammarToken.TokenType.QUESTION);
			case '"' -> scanString();
			case '/' -> scanRegex();
			case '%' -> scanDirective();
			default -> {
				if (isNameStart(c)) {
					yield scanName();
				}
				throw new GrammarException("Unexpected character '" + c + "' on line " + line + " of grammar");
			}
		};
	}

	private GrammarToken single(GrammarToken.TokenType type) {
		char c = advance();
		return token(type, String.valueOf(c));
	}

	private GrammarToken scanString() {
		int startLine = line;
		advance(); // consume opening "

		StringBuilder sb = new StringBuilder();
		while (!isAtEnd() && peek() != '"') {
			char c = advance();
			if (c == '\\' && !isAtEnd()) {
				char next = advance();
				sb.append(switch (next) {
					case 'n' -> '\n';
					case 't' -> '\t';
					default -> next;
				});
			} else {
				sb.append(c);
			}
		}

		if (isAtEnd()) {
			throw new GrammarException("Unterminated string literal starting on line " + startLine);
		}

		advance(); // consume closing "
		if (sb.length() == 0) {
			throw new GrammarException("Empty string literal on line " + startLine);
		}
		return token(GrammarToken.TokenType.STRING, sb.toString());
	}

	private GrammarToken scanRegex() {
		int startLine = line;
		advance(); // consume opening /

		StringBuilder sb = new StringBuilder();
		while (!isAtEnd() && peek() != '/') {
			char c = advance();
			if (c == '\n') {
				throw new GrammarException("Unterminated regular expression on line " + startLine);
			}
			sb.append(c);
			if (c == '\\' && !isAtEnd()) {
				// escapes stay in the pattern; this only keeps \/ from ending it
				sb.append(advance());
			}
		}

		if (isAtEnd()) {
			throw new GrammarException("Unterminated regular expression on line " + startLine);
		}
		advance(); // consume closing /

		String pattern = sb.toString();
		if (!isAtEnd() && peek() == 'i' && !isNameChar(peekNext())) {
			advance();
			pattern = "(?i)" + pattern;
		}
		return token(GrammarToken.TokenType.REGEX, pattern);
	}

	private GrammarToken scanDirective() {
		advance(); // consume %
		int start = pos;
		while (!isAtEnd() && isNameChar(peek())) {
			advance();
		}
		return token(GrammarToken.TokenType.DIRECTIVE, input.substring(start, pos));
	}

	private GrammarToken scanName() {
		int start = pos;
		while (!isAtEnd() && isNameChar(peek())) {
			advance();
		}
		String value = input.substring(start, pos);
		char first = value.charAt(0);
		GrammarToken.TokenType type = Character.isUpperCase(first)
				? GrammarToken.TokenType.TERMINAL_NAME
				: GrammarToken.TokenType.RULE_NAME;
		return token(type, value);
	}

	private GrammarToken token(GrammarToken.TokenType type, String value) {
		boolean lineStart = line != lastTokenLine;
		lastTokenLine = line;
		return new GrammarToken(type, value, line, lineStart);
	}

	private void skipWhitespaceAndComments() {
		while (!isAtEnd()) {
			char c = peek();
			if (c == '\n') {
				line++;
				advance();
			} else if (Character.isWhitespace(c)) {
				advance();
			} else if (c == '/' && peekNext() == '/') {
				while (!isAtEnd() && peek() != '\n') {
					advance();
				}
			} else {
				return;
			}
		}
	}

	private char peek() {
		return isAtEnd() ? '\0' : input.charAt(pos);
	}

	private char peekNext() {
		return pos + 1 < input.length() ? input.charAt(pos + 1) : '\0';
	}

	private char advance() {
		return input.charAt(pos++);
	}

	private boolean isAtEnd() {
		return pos >= input.length();
	}

	private boolean isNameStart(char c) {
		return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
	}

	private boolean isNameChar(char c) {
		return isNameStart(c) || (c >= '0' && c <= '9');
	}
}

package org.javai.fontfeatures.grammar;

/**
 * Represents a token of the grammar notation.
 *
 * @param type the token type
 * @param value the token value (text content, unquoted for strings and regexes)
 * @param line the 1-based line of the token
 * @param lineStart whether this is the first token on its line
 */
public record GrammarToken(TokenType type, String value, int line, boolean lineStart) {

	public enum TokenType {
		RULE_NAME,     // lower-case or '_' prefixed names
		TERMINAL_NAME, // upper-case names
		STRING,        // "literal"
		REGEX,         // /pattern/ with optional i flag
		COLON,
		PIPE,
		LPAREN,
		RPAREN,
		LBRACKET,
		RBRACKET,
		STAR,
		PLUS,
		QUESTION,
		DIRECTIVE,     // %ignore
		EOF
	}

	@Override
	public String toString() {
		return switch (type) {
			case STRING -> "STRING(\"" + value + "\")";
			case REGEX -> "REGEX(/" + value + "/)";
			case RULE_NAME, TERMINAL_NAME, DIRECTIVE -> type + "(" + value + ")";
			default -> type.toString();
		};
	}

	public boolean isType(TokenType expectedType) {
		return this.type == expectedType;
	}

	public boolean isName() {
		return type == TokenType.RULE_NAME || type == TokenType.TERMINAL_NAME;
	}
}

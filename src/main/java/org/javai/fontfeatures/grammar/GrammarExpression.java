package org.javai.fontfeatures.grammar;

import java.util.List;

/**
 * Expression types of the grammar notation - the right-hand sides of rules and terminals.
 */
public sealed interface GrammarExpression {

	/**
	 * Literal string match: "text". Anonymous in rules, so it never reaches the parse tree.
	 */
	record Literal(String text) implements GrammarExpression {}

	/**
	 * Inline regular expression: /pattern/.
	 */
	record Regex(String pattern) implements GrammarExpression {}

	/**
	 * Reference to a rule by name.
	 */
	record RuleRef(String name) implements GrammarExpression {}

	/**
	 * Reference to a named terminal.
	 */
	record TerminalRef(String name) implements GrammarExpression {}

	/**
	 * Sequence: e1 e2 e3. An empty sequence matches the empty string.
	 */
	record Sequence(List<GrammarExpression> elements) implements GrammarExpression {
		public Sequence {
			elements = List.copyOf(elements);
		}
	}

	/**
	 * Ordered choice: e1 | e2 | e3.
	 */
	record Choice(List<GrammarExpression> alternatives) implements GrammarExpression {
		public Choice {
			alternatives = List.copyOf(alternatives);
		}
	}

	/**
	 * Repetition: e? (0..1), e* (0..n), e+ (1..n).
	 */
	record Repeat(GrammarExpression expression, int min, boolean unbounded) implements GrammarExpression {

		public static Repeat optional(GrammarExpression expression) {
			return new Repeat(expression, 0, false);
		}

		public static Repeat zeroOrMore(GrammarExpression expression) {
			return new Repeat(expression, 0, true);
		}

		public static Repeat oneOrMore(GrammarExpression expression) {
			return new Repeat(expression, 1, true);
		}

		public int max() {
			return unbounded ? Integer.MAX_VALUE : 1;
		}
	}
}

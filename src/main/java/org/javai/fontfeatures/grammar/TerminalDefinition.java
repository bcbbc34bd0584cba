package org.javai.fontfeatures.grammar;

/**
 * A named terminal of a grammar. The expression may only contain literals,
 * regular expressions and references to other terminals.
 */
public record TerminalDefinition(String name, GrammarExpression expression) {
}

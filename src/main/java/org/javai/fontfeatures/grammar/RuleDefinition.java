package org.javai.fontfeatures.grammar;

/**
 * A named rule of a grammar.
 *
 * @param name the rule name
 * @param expression the rule body
 * @param inlineSingleChild declared with a '?' prefix: a node with exactly one child is replaced by that child
 */
public record RuleDefinition(String name, GrammarExpression expression, boolean inlineSingleChild) {

	/**
	 * Rules whose name starts with an underscore never produce a node of their own.
	 */
	public boolean spliced() {
		return name.startsWith("_");
	}
}

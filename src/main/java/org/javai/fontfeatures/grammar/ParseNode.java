package org.javai.fontfeatures.grammar;

import java.util.List;

/**
 * A rule match in the parse tree.
 *
 * @param rule the name of the rule that produced this node
 * @param children child nodes and tokens, in source order
 * @param line the 1-based line where the match starts
 * @param column the 1-based column where the match starts
 */
public record ParseNode(String rule, List<ParseElement> children, int line, int column) implements ParseElement {

	public ParseNode {
		children = List.copyOf(children);
	}

	public boolean isRule(String expectedRule) {
		return rule.equals(expectedRule);
	}

	/**
	 * Direct children that are nodes of the given rule.
	 */
	public List<ParseNode> childNodes(String childRule) {
		return children.stream()
				.filter(ParseNode.class::isInstance)
				.map(ParseNode.class::cast)
				.filter(n -> n.isRule(childRule))
				.toList();
	}

	/**
	 * Direct children that are tokens of the given terminal type.
	 */
	public List<ParseToken> childTokens(String type) {
		return children.stream()
				.filter(ParseToken.class::isInstance)
				.map(ParseToken.class::cast)
				.filter(t -> t.isType(type))
				.toList();
	}

	@Override
	public <R> R accept(ParseTreeVisitor<R> visitor, List<R> reducedChildren) {
		return visitor.visitNode(this, reducedChildren);
	}
}

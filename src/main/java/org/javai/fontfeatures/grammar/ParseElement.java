package org.javai.fontfeatures.grammar;

import java.util.List;

/**
 * An element of a parse tree: either a {@link ParseNode} or a {@link ParseToken}.
 */
public sealed interface ParseElement permits ParseNode, ParseToken {

	/**
	 * 1-based line of the first character covered by this element.
	 */
	int line();

	/**
	 * 1-based column of the first character covered by this element.
	 */
	int column();

	/**
	 * Accepts a visitor and dispatches to the appropriate visitor method.
	 */
	<R> R accept(ParseTreeVisitor<R> visitor, List<R> reducedChildren);
}

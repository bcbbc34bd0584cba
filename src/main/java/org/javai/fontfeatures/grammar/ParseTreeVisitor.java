package org.javai.fontfeatures.grammar;

import java.util.List;

/**
 * Visitor interface for reducing parse trees bottom-up.
 *
 * @param <R> the return type of the visitor operations
 */
public interface ParseTreeVisitor<R> {

	/**
	 * Visits a rule node after all of its children have been visited.
	 *
	 * @param node the node
	 * @param children the results of visiting the node's children, in order
	 * @return the result of visiting this node
	 */
	R visitNode(ParseNode node, List<R> children);

	/**
	 * Visits a token.
	 *
	 * @param token the token
	 * @return the result of visiting this token
	 */
	R visitToken(ParseToken token);
}

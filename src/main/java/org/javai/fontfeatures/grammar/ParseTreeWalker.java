package org.javai.fontfeatures.grammar;

import java.util.ArrayList;
import java.util.List;

/**
 * Utility class for walking parse trees with visitors.
 */
public final class ParseTreeWalker {

	private ParseTreeWalker() {
		// Utility class - no instantiation
	}

	/**
	 * Walks a parse tree in post-order (children before parent), handing each node
	 * the results of its children.
	 *
	 * @param <R> the return type of the visitor
	 * @param element the root element to start traversal from
	 * @param visitor the visitor to apply to each element
	 * @return the result of visiting the root element
	 */
	public static <R> R reduce(ParseElement element, ParseTreeVisitor<R> visitor) {
		if (element == null) {
			return null;
		}
		List<R> reduced = new ArrayList<>();
		if (element instanceof ParseNode node) {
			for (ParseElement child : node.children()) {
				reduced.add(reduce(child, visitor));
			}
		}
		return element.accept(visitor, reduced);
	}

	/**
	 * Collects every token below the given element in source order.
	 */
	public static List<ParseToken> tokens(ParseElement element) {
		List<ParseToken> tokens = new ArrayList<>();
		collectTokens(element, tokens);
		return tokens;
	}

	private static void collectTokens(ParseElement element, List<ParseToken> tokens) {
		if (element instanceof ParseToken token) {
			tokens.add(token);
		} else if (element instanceof ParseNode node) {
			for (ParseElement child : node.children()) {
				collectTokens(child, tokens);
			}
		}
	}
}

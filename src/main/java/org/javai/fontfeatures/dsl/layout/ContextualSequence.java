package org.javai.fontfeatures.dsl.layout;

import java.util.List;

/**
 * The reduced input of a contextual rule: what comes before the parentheses, the
 * items inside them and what comes after. Rules written without parentheses have no context.
 */
record ContextualSequence<T>(List<List<String>> precontext, List<T> items, List<List<String>> postcontext) {

	ContextualSequence {
		precontext = List.copyOf(precontext);
		items = List.copyOf(items);
		postcontext = List.copyOf(postcontext);
	}

	static <T> ContextualSequence<T> withoutContext(List<T> items) {
		return new ContextualSequence<>(List.of(), items, List.of());
	}
}

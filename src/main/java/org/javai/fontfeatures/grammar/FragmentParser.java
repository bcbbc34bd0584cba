package org.javai.fontfeatures.grammar;

import java.util.Optional;

/**
 * Parses one argument fragment into a tree.
 * An empty result means the fragment has no grammar and produced nothing.
 */
@FunctionalInterface
public interface FragmentParser {

	Optional<ParseNode> parse(String input);

	/**
	 * A parser for a fragment with no grammar. It ignores its input.
	 */
	static FragmentParser none() {
		return input -> Optional.empty();
	}

	/**
	 * A parser that rejects every input with the given message.
	 */
	static FragmentParser rejecting(String message) {
		return input -> {
			throw new RuleSyntaxException(message);
		};
	}
}

package org.javai.fontfeatures.dsl;

import java.util.List;

/**
 * Arguments of a statement with one or more brace bodies.
 *
 * @param before the reduced arguments before the first body, or {@code null}
 * @param groups everything from the first body to the last: {@link StatementBlock}s and the words between them
 * @param after the reduced arguments after the last body, or {@code null}
 */
public record BraceArguments(Object before, List<Object> groups, Object after) {

	public BraceArguments {
		groups = List.copyOf(groups);
	}

	public List<StatementBlock> blocks() {
		return groups.stream()
				.filter(StatementBlock.class::isInstance)
				.map(StatementBlock.class::cast)
				.toList();
	}

	/**
	 * The words that appear between bodies, e.g. {@code Else}.
	 */
	public List<String> words() {
		return groups.stream()
				.filter(String.class::isInstance)
				.map(String.class::cast)
				.toList();
	}
}

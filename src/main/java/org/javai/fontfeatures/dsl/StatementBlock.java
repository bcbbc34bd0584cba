package org.javai.fontfeatures.dsl;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * The dispatched statements of one brace body, in source order.
 */
public record StatementBlock(List<StatementResult> statements) {

	public StatementBlock {
		statements = List.copyOf(statements);
	}

	/**
	 * Values of the resolved statements. Collections returned by a statement, such as
	 * the chosen branch of a conditional, are flattened into the result.
	 */
	public List<Object> values() {
		List<Object> values = new ArrayList<>();
		for (StatementResult statement : statements) {
			if (statement.resolved()) {
				flatten(statement.value(), values);
			}
		}
		return values;
	}

	private static void flatten(Object value, List<Object> into) {
		if (value instanceof Collection<?> collection) {
			for (Object element : collection) {
				flatten(element, into);
			}
		} else if (value != null) {
			into.add(value);
		}
	}
}

package org.javai.fontfeatures.dsl.classes;

import java.util.Optional;

/**
 * Operators combining class operands. {@code and} is a synonym of {@code &}.
 */
public enum ConjunctionOperator {

	UNION("|"),
	INTERSECTION("&"),
	DIFFERENCE("-");

	private final String symbol;

	ConjunctionOperator(String symbol) {
		this.symbol = symbol;
	}

	public String symbol() {
		return symbol;
	}

	public static Optional<ConjunctionOperator> forSymbol(String text) {
		if ("and".equals(text)) {
			return Optional.of(INTERSECTION);
		}
		for (ConjunctionOperator operator : values()) {
			if (operator.symbol.equals(text)) {
				return Optional.of(operator);
			}
		}
		return Optional.empty();
	}
}

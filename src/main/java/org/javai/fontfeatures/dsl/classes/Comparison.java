package org.javai.fontfeatures.dsl.classes;

import java.util.List;
import java.util.Optional;

/**
 * Comparison operators of metric predicates and conditionals.
 * {@code =} and {@code ==} both test equality.
 */
public enum Comparison {

	GREATER_OR_EQUAL(">="),
	LESS_OR_EQUAL("<="),
	EQUAL("==", "="),
	LESS("<"),
	GREATER(">");

	private final List<String> symbols;

	Comparison(String... symbols) {
		this.symbols = List.of(symbols);
	}

	public String symbol() {
		return symbols.get(0);
	}

	public boolean test(int left, int right) {
		return switch (this) {
			case GREATER_OR_EQUAL -> left >= right;
			case LESS_OR_EQUAL -> left <= right;
			case EQUAL -> left == right;
			case LESS -> left < right;
			case GREATER -> left > right;
		};
	}

	public static Optional<Comparison> forSymbol(String symbol) {
		for (Comparison comparison : values()) {
			if (comparison.symbols.contains(symbol)) {
				return Optional.of(comparison);
			}
		}
		return Optional.empty();
	}
}

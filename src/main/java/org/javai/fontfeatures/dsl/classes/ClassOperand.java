package org.javai.fontfeatures.dsl.classes;

import org.javai.fontfeatures.dsl.selector.GlyphSelector;

/**
 * An unevaluated class expression: a selector, a predicate or a conjunction of two operands.
 * Chains such as {@code a | b - c} fold to the left.
 */
public sealed interface ClassOperand {

	static ClassOperand of(GlyphSelector selector) {
		return new Selection(selector);
	}

	static ClassOperand of(GlyphPredicate predicate) {
		return new Filter(predicate);
	}

	record Selection(GlyphSelector selector) implements ClassOperand {
	}

	record Filter(GlyphPredicate predicate) implements ClassOperand {
	}

	record Conjunction(ClassOperand left, ConjunctionOperator operator, ClassOperand right) implements ClassOperand {
	}
}

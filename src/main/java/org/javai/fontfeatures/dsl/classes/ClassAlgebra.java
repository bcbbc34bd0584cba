package org.javai.fontfeatures.dsl.classes;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.javai.fontfeatures.dsl.selector.ResolutionContext;

/**
 * Evaluates class expressions to glyph lists.
 * <p>
 * A conjunction whose left side evaluates to glyphs and whose right side is a
 * predicate filters the left glyphs by the predicate, whatever the operator. This is a
 * known asymmetry: {@code @a - (width > 100)} keeps the wide glyphs of {@code @a}.
 * Every other conjunction evaluates both sides to glyphs, applying a bare predicate
 * to the whole glyph order, and combines them as sets: {@code |} union, {@code &}
 * intersection, {@code -} difference. Set results keep first-seen order, left before right.
 * <p>
 * An expression that is a predicate alone selects the matching glyphs of the whole font.
 */
public final class ClassAlgebra {

	private final ResolutionContext context;
	private final boolean mustExist;

	public ClassAlgebra(ResolutionContext context, boolean mustExist) {
		this.context = context;
		this.mustExist = mustExist;
	}

	public List<String> evaluate(ClassOperand operand) {
		Value value = reduce(operand);
		return value.isPredicate() ? applyToAll(value.predicate()) : value.glyphs();
	}

	/**
	 * True if the glyph is in the font and satisfies the predicate.
	 */
	public boolean matches(String glyph, GlyphPredicate predicate) {
		return context.font().metrics(glyph)
				.map(metrics -> predicate.test(metrics, glyph))
				.orElse(false);
	}

	public List<String> filter(List<String> glyphs, GlyphPredicate predicate) {
		return glyphs.stream().filter(glyph -> matches(glyph, predicate)).toList();
	}

	public List<String> applyToAll(GlyphPredicate predicate) {
		return filter(context.font().glyphOrder(), predicate);
	}

	public static List<String> union(List<String> left, List<String> right) {
		Set<String> result = new LinkedHashSet<>(left);
		result.addAll(right);
		return new ArrayList<>(result);
	}

	public static List<String> intersection(List<String> left, List<String> right) {
		Set<String> keep = new HashSet<>(right);
		Set<String> result = new LinkedHashSet<>();
		for (String glyph : left) {
			if (keep.contains(glyph)) {
				result.add(glyph);
			}
		}
		return new ArrayList<>(result);
	}

	public static List<String> difference(List<String> left, List<String> right) {
		Set<String> result = new LinkedHashSet<>(left);
		result.removeAll(new HashSet<>(right));
		return new ArrayList<>(result);
	}

	private Value reduce(ClassOperand operand) {
		if (operand instanceof ClassOperand.Selection selection) {
			return Value.ofGlyphs(selection.selector().resolve(context, mustExist));
		}
		if (operand instanceof ClassOperand.Filter filter) {
			return Value.ofPredicate(filter.predicate());
		}
		ClassOperand.Conjunction conjunction = (ClassOperand.Conjunction) operand;
		Value left = reduce(conjunction.left());
		Value right = reduce(conjunction.right());
		if (!left.isPredicate() && right.isPredicate()) {
			return Value.ofGlyphs(filter(left.glyphs(), right.predicate()));
		}
		List<String> leftGlyphs = materialize(left);
		List<String> rightGlyphs = materialize(right);
		return Value.ofGlyphs(switch (conjunction.operator()) {
			case UNION -> union(leftGlyphs, rightGlyphs);
			case INTERSECTION -> intersection(leftGlyphs, rightGlyphs);
			case DIFFERENCE -> difference(leftGlyphs, rightGlyphs);
		});
	}

	private List<String> materialize(Value value) {
		return value.isPredicate() ? applyToAll(value.predicate()) : value.glyphs();
	}

	private record Value(List<String> glyphs, GlyphPredicate predicate) {

		static Value ofGlyphs(List<String> glyphs) {
			return new Value(glyphs, null);
		}

		static Value ofPredicate(GlyphPredicate predicate) {
			return new Value(null, predicate);
		}

		boolean isPredicate() {
			return predicate != null;
		}
	}
}

package org.javai.fontfeatures.dsl.classes;

import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.javai.fontfeatures.font.FontModel;
import org.javai.fontfeatures.font.GlyphMetrics;
import org.javai.fontfeatures.ir.FontFeatures;

/**
 * A test over one glyph of the font. Predicates have no side effects.
 * <p>
 * Callers only test glyphs the font contains; see {@link ClassAlgebra#matches}.
 */
@FunctionalInterface
public interface GlyphPredicate {

	boolean test(GlyphMetrics metrics, String glyphName);

	default GlyphPredicate negate() {
		return (metrics, glyphName) -> !test(metrics, glyphName);
	}

	/**
	 * Compares a metric of the glyph with a value, e.g. {@code width < 200}.
	 */
	static GlyphPredicate metric(Metric metric, Comparison comparison, int value) {
		return (metrics, glyphName) -> comparison.test(metric.valueOf(metrics), value);
	}

	/**
	 * True if replacing every match of the pattern in the glyph name yields a glyph of the font.
	 */
	static GlyphPredicate hasGlyph(FontModel font, Pattern pattern, String replacement) {
		String quoted = Matcher.quoteReplacement(replacement != null ? replacement : "");
		return (metrics, glyphName) -> font.hasGlyph(pattern.matcher(glyphName).replaceAll(quoted));
	}

	/**
	 * True if the glyph has the anchor, either defined by the rules or by the font.
	 */
	static GlyphPredicate hasAnchor(FontModel font, FontFeatures features, String anchor) {
		return (metrics, glyphName) -> features.anchors(glyphName).containsKey(anchor)
				|| font.anchors(glyphName).contains(anchor);
	}

	static GlyphPredicate category(FontModel font, String category) {
		return (metrics, glyphName) -> font.category(glyphName).map(category::equals).orElse(false);
	}
}

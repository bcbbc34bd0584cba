package org.javai.fontfeatures.font;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only view of the font being compiled against.
 */
public interface FontModel {

	/**
	 * Names of the exported glyphs in font order.
	 */
	List<String> glyphOrder();

	boolean hasGlyph(String glyphName);

	Optional<String> glyphForCodepoint(int codepoint);

	/**
	 * Metrics of a glyph, empty when the glyph is not in the font.
	 */
	Optional<GlyphMetrics> metrics(String glyphName);

	Optional<String> category(String glyphName);

	/**
	 * Names of the anchors the font defines on a glyph.
	 */
	Set<String> anchors(String glyphName);
}

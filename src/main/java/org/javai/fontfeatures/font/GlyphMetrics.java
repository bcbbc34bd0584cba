package org.javai.fontfeatures.font;

/**
 * Metrics of one glyph in font units.
 *
 * @param width advance width
 * @param lsb left side bearing
 * @param rsb right side bearing
 * @param xMin minimum x of the outline
 * @param xMax maximum x of the outline
 * @param yMin minimum y of the outline
 * @param yMax maximum y of the outline
 * @param rise vertical distance between the cursive entry and exit anchors
 * @param run horizontal distance between the cursive entry and exit anchors
 */
public record GlyphMetrics(int width, int lsb, int rsb, int xMin, int xMax, int yMin, int yMax, int rise, int run) {

	public static final GlyphMetrics ZERO = new GlyphMetrics(0, 0, 0, 0, 0, 0, 0, 0, 0);

	/**
	 * Metrics of an advance-only glyph whose outline spans the advance.
	 */
	public static GlyphMetrics ofWidth(int width) {
		return new GlyphMetrics(width, 0, 0, 0, width, 0, 0, 0, 0);
	}

	public int fullwidth() {
		return xMax - xMin;
	}
}

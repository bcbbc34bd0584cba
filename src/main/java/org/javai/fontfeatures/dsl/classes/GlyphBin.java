package org.javai.fontfeatures.dsl.classes;

import java.util.List;

/**
 * One bin of a binning: its glyphs in input order and their mean metric value.
 * The mean of an empty bin is {@code NaN}.
 */
public record GlyphBin(List<String> glyphs, double mean) {

	public GlyphBin {
		glyphs = List.copyOf(glyphs);
	}

	public boolean isEmpty() {
		return glyphs.isEmpty();
	}
}

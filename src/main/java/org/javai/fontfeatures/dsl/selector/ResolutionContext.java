package org.javai.fontfeatures.dsl.selector;

import java.util.List;
import java.util.Optional;
import org.javai.fontfeatures.font.FontModel;

/**
 * What a selector needs to resolve: the font, the named classes defined so far and
 * somewhere to report glyphs that are not in the font.
 */
public interface ResolutionContext {

	FontModel font();

	Optional<List<String>> namedClass(String className);

	void reportMissingGlyphs(GlyphSelector selector, List<String> missing);
}

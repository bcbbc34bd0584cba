package org.javai.fontfeatures.ir;

import java.util.List;

/**
 * Adjusts the position of each glyph in the sequence by the matching value record.
 */
public final class Positioning extends Rule {

	private final List<List<String>> glyphs;
	private final List<ValueRecord> valueRecords;

	public Positioning(List<List<String>> glyphs, List<ValueRecord> valueRecords,
			List<List<String>> precontext, List<List<String>> postcontext,
			List<LanguageSystem> languages, String address) {
		super(precontext, postcontext, languages, address);
		if (glyphs.size() != valueRecords.size()) {
			throw new IllegalArgumentException("Each positioned glyph needs exactly one value record");
		}
		this.glyphs = copyPositions(glyphs);
		this.valueRecords = List.copyOf(valueRecords);
	}

	public List<List<String>> glyphs() {
		return glyphs;
	}

	public List<ValueRecord> valueRecords() {
		return valueRecords;
	}

	@Override
	public String toString() {
		return "Positioning" + glyphs + " " + valueRecords;
	}
}

package org.javai.fontfeatures.ir;

/**
 * Positioning adjustment applied to one glyph, in font units.
 */
public record ValueRecord(int xPlacement, int yPlacement, int xAdvance, int yAdvance) {

	public static final ValueRecord EMPTY = new ValueRecord(0, 0, 0, 0);

	/**
	 * A record that only changes the horizontal advance.
	 */
	public static ValueRecord advance(int xAdvance) {
		return new ValueRecord(0, 0, xAdvance, 0);
	}

	public boolean isEmpty() {
		return equals(EMPTY);
	}

	@Override
	public String toString() {
		return "<" + xPlacement + " " + yPlacement + " " + xAdvance + " " + yAdvance + ">";
	}
}

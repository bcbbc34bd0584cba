package org.javai.fontfeatures.ir;

import java.util.Collection;
import java.util.EnumSet;
import java.util.Set;

/**
 * Lookup flags of a routine. A routine's flag value is the bitwise OR of its flags.
 */
public enum LookupFlag {

	RIGHT_TO_LEFT(1),
	IGNORE_BASE_GLYPHS(2),
	IGNORE_LIGATURES(4),
	IGNORE_MARKS(8);

	private final int bit;

	LookupFlag(int bit) {
		this.bit = bit;
	}

	public int bit() {
		return bit;
	}

	public static int mask(Collection<LookupFlag> flags) {
		int mask = 0;
		for (LookupFlag flag : flags) {
			mask |= flag.bit;
		}
		return mask;
	}

	public static Set<LookupFlag> fromMask(int mask) {
		Set<LookupFlag> flags = EnumSet.noneOf(LookupFlag.class);
		for (LookupFlag flag : values()) {
			if ((mask & flag.bit) != 0) {
				flags.add(flag);
			}
		}
		return flags;
	}
}

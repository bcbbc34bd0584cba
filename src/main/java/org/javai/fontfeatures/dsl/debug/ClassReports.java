package org.javai.fontfeatures.dsl.debug;

import java.util.List;

final class ClassReports {

	static final String NO_CLASSES = "No classes defined";

	private ClassReports() {
	}

	/**
	 * {@code @name = a b c}
	 */
	static String describe(String label, List<String> glyphs) {
		return label + " = " + String.join(" ", glyphs);
	}
}

package org.javai.fontfeatures.dsl.selector;

/**
 * A suffix applied to every glyph a selector resolves to.
 * {@code .alt} appends {@code .alt}; {@code ~alt} removes a trailing {@code .alt} if present.
 */
public record SuffixOperation(Kind kind, String suffix) {

	public enum Kind {
		APPEND('.'),
		STRIP('~');

		private final char sigil;

		Kind(char sigil) {
			this.sigil = sigil;
		}

		public char sigil() {
			return sigil;
		}
	}

	public static SuffixOperation append(String suffix) {
		return new SuffixOperation(Kind.APPEND, suffix);
	}

	public static SuffixOperation strip(String suffix) {
		return new SuffixOperation(Kind.STRIP, suffix);
	}

	/**
	 * Parses source text such as {@code .sc} or {@code ~alt}.
	 */
	public static SuffixOperation parse(String text) {
		if (text == null || text.length() < 2) {
			throw new IllegalArgumentException("Invalid glyph suffix: " + text);
		}
		return switch (text.charAt(0)) {
			case '.' -> append(text.substring(1));
			case '~' -> strip(text.substring(1));
			default -> throw new IllegalArgumentException("Invalid glyph suffix: " + text);
		};
	}

	public String apply(String glyphName) {
		if (kind == Kind.APPEND) {
			return glyphName + "." + suffix;
		}
		String dotted = "." + suffix;
		return glyphName.endsWith(dotted)
				? glyphName.substring(0, glyphName.length() - dotted.length())
				: glyphName;
	}

	public String asText() {
		return kind.sigil() + suffix;
	}
}

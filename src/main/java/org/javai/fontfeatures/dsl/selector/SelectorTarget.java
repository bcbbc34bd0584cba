package org.javai.fontfeatures.dsl.selector;

import java.util.List;
import java.util.stream.Collectors;

/**
 * What a glyph selector refers to. Exactly one kind per selector.
 */
public sealed interface SelectorTarget {

	/**
	 * Canonical source form.
	 */
	String asText();

	/**
	 * A literal glyph name.
	 */
	record BareName(String name) implements SelectorTarget {
		@Override
		public String asText() {
			return name;
		}
	}

	/**
	 * A named class, without the {@code @} sigil.
	 */
	record ClassName(String name) implements SelectorTarget {
		@Override
		public String asText() {
			return "@" + name;
		}
	}

	/**
	 * A regular expression searched for in every glyph name.
	 */
	record RegexPattern(String pattern) implements SelectorTarget {
		@Override
		public String asText() {
			return "/" + pattern + "/";
		}
	}

	record Codepoint(int codepoint) implements SelectorTarget {
		@Override
		public String asText() {
			return format(codepoint);
		}
	}

	/**
	 * An inclusive range of codepoints.
	 */
	record CodepointRange(int start, int end) implements SelectorTarget {
		@Override
		public String asText() {
			return format(start) + "=>" + format(end);
		}
	}

	/**
	 * A bracketed list of members, e.g. {@code [A @vowels U+0063]}.
	 */
	record InlineClass(List<SelectorTarget> members) implements SelectorTarget {
		public InlineClass {
			members = List.copyOf(members);
		}

		@Override
		public String asText() {
			return members.stream().map(SelectorTarget::asText).collect(Collectors.joining(" ", "[", "]"));
		}
	}

	static String format(int codepoint) {
		return String.format("U+%04X", codepoint);
	}
}

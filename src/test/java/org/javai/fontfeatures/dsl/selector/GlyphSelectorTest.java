package org.javai.fontfeatures.dsl.selector;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Optional;
import org.javai.fontfeatures.dsl.UndefinedReferenceException;
import org.javai.fontfeatures.font.InMemoryFont;
import org.javai.fontfeatures.grammar.RuleSyntaxException;
import org.javai.fontfeatures.grammar.SourceLocation;
import org.javai.fontfeatures.testsupport.TestFonts;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class GlyphSelectorTest {

	private static final SourceLocation HERE = SourceLocation.of(3, 5);

	@Mock
	private ResolutionContext context;

	private final InMemoryFont font = TestFonts.latin();

	@BeforeEach
	void setUp() {
		when(context.font()).thenReturn(font);
		when(context.namedClass(any())).thenReturn(Optional.empty());
	}

	private static GlyphSelector selector(SelectorTarget target, SuffixOperation... suffixes) {
		return new GlyphSelector(target, List.of(suffixes), HERE);
	}

	@Nested
	@DisplayName("Targets")
	class Targets {

		@Test
		void bareName() {
			assertThat(selector(new SelectorTarget.BareName("a")).resolve(context)).containsExactly("a");
		}

		@Test
		void namedClass() {
			when(context.namedClass("vowels")).thenReturn(Optional.of(List.of("A", "E")));

			assertThat(selector(new SelectorTarget.ClassName("vowels")).resolve(context)).containsExactly("A", "E");
		}

		@Test
		void regexFollowsFontOrder() {
			assertThat(selector(new SelectorTarget.RegexPattern("sc$")).resolve(context)).containsExactly("A.sc", "B.sc");
		}

		@Test
		void codepointRangeAscends() {
			assertThat(selector(new SelectorTarget.CodepointRange(0x41, 0x44)).resolve(context))
					.containsExactly("A", "B", "C", "D");
		}

		@Test
		void reversedRangeIsEmpty() {
			assertThat(selector(new SelectorTarget.CodepointRange(0x44, 0x41)).resolve(context)).isEmpty();
		}

		@Test
		void inlineClassKeepsDeclarationOrderAndDuplicates() {
			when(context.namedClass("ab")).thenReturn(Optional.of(List.of("a", "b")));
			SelectorTarget inline = new SelectorTarget.InlineClass(List.of(
					new SelectorTarget.BareName("f"),
					new SelectorTarget.ClassName("ab"),
					new SelectorTarget.Codepoint(0x61)));

			assertThat(selector(inline).resolve(context)).containsExactly("f", "a", "b", "a");
		}
	}

	@Nested
	@DisplayName("Suffixes")
	class Suffixes {

		@Test
		void appliedInOrderToEveryGlyph() {
			GlyphSelector selector = selector(new SelectorTarget.InlineClass(List.of(
					new SelectorTarget.BareName("A"), new SelectorTarget.BareName("B"))), SuffixOperation.append("sc"));

			assertThat(selector.resolve(context)).containsExactly("A.sc", "B.sc");
		}

		@Test
		void stripThenAppend() {
			GlyphSelector selector = selector(new SelectorTarget.RegexPattern("\\.sc$"),
					SuffixOperation.strip("sc"), SuffixOperation.append("sc"));

			assertThat(selector.resolve(context)).containsExactly("A.sc", "B.sc");
		}
	}

	@Nested
	@DisplayName("Existence check")
	class Existence {

		@Test
		void missingGlyphsAreDroppedAndReportedOnce() {
			GlyphSelector selector = selector(new SelectorTarget.InlineClass(List.of(
					new SelectorTarget.BareName("A"), new SelectorTarget.BareName("C"))), SuffixOperation.append("sc"));

			assertThat(selector.resolve(context, true)).containsExactly("A.sc");
			verify(context).reportMissingGlyphs(selector, List.of("C.sc"));
		}

		@Test
		void missingInlineMemberIsDroppedBeforeSuffixing() {
			InMemoryFont alternates = InMemoryFont.builder()
					.glyph("a").glyph("a.sc").glyph("b").glyph("b.sc").glyph("c.sc")
					.build();
			when(context.font()).thenReturn(alternates);
			GlyphSelector selector = selector(new SelectorTarget.InlineClass(List.of(
					new SelectorTarget.BareName("a"), new SelectorTarget.BareName("c"))), SuffixOperation.append("sc"));

			assertThat(selector.resolve(context, true)).containsExactly("a.sc");
			verify(context).reportMissingGlyphs(selector, List.of("c"));
		}

		@Test
		void uncheckedInlineMembersAreKept() {
			InMemoryFont alternates = InMemoryFont.builder().glyph("a").glyph("a.sc").glyph("c.sc").build();
			when(context.font()).thenReturn(alternates);
			GlyphSelector selector = selector(new SelectorTarget.InlineClass(List.of(
					new SelectorTarget.BareName("a"), new SelectorTarget.BareName("c"))), SuffixOperation.append("sc"));

			assertThat(selector.resolve(context, false)).containsExactly("a.sc", "c.sc");
		}

		@Test
		void uncheckedResolutionKeepsEverything() {
			GlyphSelector selector = selector(new SelectorTarget.BareName("missing"));

			assertThat(selector.resolve(context, false)).containsExactly("missing");
			verify(context, never()).reportMissingGlyphs(any(), anyList());
		}
	}

	@Nested
	@DisplayName("Idempotence")
	class Idempotence {

		@Test
		void resolvingARegexTwiceIsIdentical() {
			GlyphSelector selector = selector(new SelectorTarget.RegexPattern("^[A-C]"), SuffixOperation.append("sc"));

			List<String> first = selector.resolve(context);

			assertThat(selector.resolve(context)).containsExactlyElementsOf(first);
		}

		@Test
		void resolvingAnInlineClassTwiceIsIdentical() {
			when(context.namedClass("ab")).thenReturn(Optional.of(List.of("a", "b")));
			GlyphSelector selector = selector(new SelectorTarget.InlineClass(List.of(
					new SelectorTarget.ClassName("ab"),
					new SelectorTarget.CodepointRange(0x41, 0x43),
					new SelectorTarget.BareName("a"))));

			List<String> first = selector.resolve(context);

			assertThat(first).containsExactly("a", "b", "A", "B", "C", "a");
			assertThat(selector.resolve(context)).containsExactlyElementsOf(first);
		}
	}

	@Nested
	@DisplayName("Errors")
	class Errors {

		@Test
		void undefinedClass() {
			assertThatThrownBy(() -> selector(new SelectorTarget.ClassName("nope")).resolve(context))
					.isInstanceOfSatisfying(UndefinedReferenceException.class, e -> {
						assertThat(e.kind()).isEqualTo(UndefinedReferenceException.Kind.CLASS);
						assertThat(e.identifier()).isEqualTo("nope");
						assertThat(e.location()).isEqualTo(HERE);
					});
		}

		@Test
		void unmappedCodepoint() {
			assertThatThrownBy(() -> selector(new SelectorTarget.Codepoint(0x263A)).resolve(context))
					.isInstanceOf(UndefinedReferenceException.class)
					.hasMessage("Font does not contain glyph for U+263A (at 3:5)");
		}

		@Test
		void invalidRegex() {
			assertThatThrownBy(() -> selector(new SelectorTarget.RegexPattern("[a-")).resolve(context))
					.isInstanceOf(RuleSyntaxException.class)
					.hasMessage("Couldn't parse regular expression '[a-'");
		}

		@Test
		void selectorNeedsATarget() {
			assertThatThrownBy(() -> new GlyphSelector(null, List.of(), HERE))
					.isInstanceOf(IllegalArgumentException.class);
		}
	}

	@Test
	void canonicalText() {
		GlyphSelector selector = selector(new SelectorTarget.InlineClass(List.of(
				new SelectorTarget.ClassName("upper"),
				new SelectorTarget.CodepointRange(0x41, 0x5A),
				new SelectorTarget.RegexPattern("^a"))), SuffixOperation.append("sc"), SuffixOperation.strip("alt"));

		assertThat(selector.asText()).isEqualTo("[@upper U+0041=>U+005A /^a/].sc~alt");
		assertThat(selector).hasToString("GlyphSelector<[@upper U+0041=>U+005A /^a/].sc~alt>");
	}
}

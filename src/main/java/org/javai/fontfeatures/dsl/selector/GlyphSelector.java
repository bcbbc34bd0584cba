package org.javai.fontfeatures.dsl.selector;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.javai.fontfeatures.dsl.UndefinedReferenceException;
import org.javai.fontfeatures.grammar.RuleSyntaxException;
import org.javai.fontfeatures.grammar.SourceLocation;

/**
 * A syntactic reference to one or more glyphs, with the suffixes to apply to them.
 * <p>
 * Resolution returns glyph names in a deterministic order: regular expressions
 * follow font order, ranges ascend by codepoint and inline classes keep their
 * declaration order (duplicates included).
 */
public record GlyphSelector(SelectorTarget target, List<SuffixOperation> suffixes, SourceLocation location) {

	public GlyphSelector {
		if (target == null) {
			throw new IllegalArgumentException("A glyph selector needs a target");
		}
		suffixes = suffixes != null ? List.copyOf(suffixes) : List.of();
		location = location != null ? location : SourceLocation.UNKNOWN;
	}

	public static GlyphSelector of(SelectorTarget target) {
		return new GlyphSelector(target, List.of(), SourceLocation.UNKNOWN);
	}

	public static GlyphSelector className(String name, SourceLocation location) {
		return new GlyphSelector(new SelectorTarget.ClassName(name), List.of(), location);
	}

	public List<String> resolve(ResolutionContext context) {
		return resolve(context, true);
	}

	/**
	 * Resolves this selector to glyph names.
	 *
	 * @param mustExist drop names the font does not have, reporting them once for this selector
	 * @throws UndefinedReferenceException for an undefined class or an unmapped codepoint
	 * @throws RuleSyntaxException for an invalid regular expression
	 */
	public List<String> resolve(ResolutionContext context, boolean mustExist) {
		List<String> missing = new ArrayList<>();
		List<String> resolved = new ArrayList<>();
		for (String glyph : resolveTarget(target, context, mustExist, missing)) {
			String name = glyph;
			for (SuffixOperation suffix : suffixes) {
				name = suffix.apply(name);
			}
			resolved.add(name);
		}
		if (!mustExist) {
			return resolved;
		}
		List<String> found = new ArrayList<>();
		for (String name : resolved) {
			if (context.font().hasGlyph(name)) {
				found.add(name);
			} else {
				missing.add(name);
			}
		}
		if (!missing.isEmpty()) {
			context.reportMissingGlyphs(this, missing);
		}
		return found;
	}

	private List<String> resolveTarget(SelectorTarget selectorTarget, ResolutionContext context, boolean mustExist,
			List<String> missing) {
		if (selectorTarget instanceof SelectorTarget.BareName bare) {
			return List.of(bare.name());
		}
		if (selectorTarget instanceof SelectorTarget.Codepoint codepoint) {
			return List.of(glyphFor(codepoint.codepoint(), context));
		}
		if (selectorTarget instanceof SelectorTarget.CodepointRange range) {
			List<String> glyphs = new ArrayList<>();
			for (int cp = range.start(); cp <= range.end(); cp++) {
				glyphs.add(glyphFor(cp, context));
			}
			return glyphs;
		}
		if (selectorTarget instanceof SelectorTarget.InlineClass inline) {
			// members are checked before suffixes apply
			List<String> glyphs = new ArrayList<>();
			for (SelectorTarget member : inline.members()) {
				for (String glyph : resolveTarget(member, context, mustExist, missing)) {
					if (!mustExist || context.font().hasGlyph(glyph)) {
						glyphs.add(glyph);
					} else {
						missing.add(glyph);
					}
				}
			}
			return glyphs;
		}
		if (selectorTarget instanceof SelectorTarget.ClassName className) {
			return context.namedClass(className.name())
					.orElseThrow(() -> UndefinedReferenceException.undefinedClass(className.name(), location));
		}
		SelectorTarget.RegexPattern regex = (SelectorTarget.RegexPattern) selectorTarget;
		Pattern pattern = compile(regex.pattern());
		return context.font().glyphOrder().stream()
				.filter(name -> pattern.matcher(name).find())
				.toList();
	}

	private String glyphFor(int codepoint, ResolutionContext context) {
		return context.font().glyphForCodepoint(codepoint)
				.orElseThrow(() -> UndefinedReferenceException.missingGlyph(SelectorTarget.format(codepoint),
						"Font does not contain glyph for " + SelectorTarget.format(codepoint), location));
	}

	private Pattern compile(String regex) {
		try {
			return Pattern.compile(regex);
		} catch (PatternSyntaxException e) {
			throw new RuleSyntaxException("Couldn't parse regular expression '" + regex + "'", location, e);
		}
	}

	/**
	 * Canonical source form, e.g. {@code @upper.sc} or {@code U+0041=>U+005A}.
	 */
	public String asText() {
		StringBuilder sb = new StringBuilder(target.asText());
		for (SuffixOperation suffix : suffixes) {
			sb.append(suffix.asText());
		}
		return sb.toString();
	}

	@Override
	public String toString() {
		return "GlyphSelector<" + asText() + ">";
	}
}

package org.javai.fontfeatures.font;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A {@link FontModel} held in memory. Built with {@link #builder()}.
 */
public final class InMemoryFont implements FontModel {

	private final Map<String, GlyphMetrics> metrics;
	private final List<String> glyphOrder;
	private final Map<Integer, String> cmap;
	private final Map<String, String> categories;
	private final Map<String, Set<String>> anchors;

	private InMemoryFont(Builder builder) {
		this.metrics = Collections.unmodifiableMap(new LinkedHashMap<>(builder.metrics));
		this.glyphOrder = List.copyOf(builder.metrics.keySet());
		this.cmap = Map.copyOf(builder.cmap);
		this.categories = Map.copyOf(builder.categories);
		Map<String, Set<String>> anchorCopy = new HashMap<>();
		builder.anchors.forEach((glyph, names) -> anchorCopy.put(glyph, Collections.unmodifiableSet(new LinkedHashSet<>(names))));
		this.anchors = Collections.unmodifiableMap(anchorCopy);
	}

	public static Builder builder() {
		return new Builder();
	}

	@Override
	public List<String> glyphOrder() {
		return glyphOrder;
	}

	@Override
	public boolean hasGlyph(String glyphName) {
		return metrics.containsKey(glyphName);
	}

	@Override
	public Optional<String> glyphForCodepoint(int codepoint) {
		return Optional.ofNullable(cmap.get(codepoint));
	}

	@Override
	public Optional<GlyphMetrics> metrics(String glyphName) {
		return Optional.ofNullable(metrics.get(glyphName));
	}

	@Override
	public Optional<String> category(String glyphName) {
		return Optional.ofNullable(categories.get(glyphName));
	}

	@Override
	public Set<String> anchors(String glyphName) {
		return anchors.getOrDefault(glyphName, Set.of());
	}

	/**
	 * Builder for in-memory fonts. Glyph order is the order glyphs are added.
	 */
	public static final class Builder {
		private final Map<String, GlyphMetrics> metrics = new LinkedHashMap<>();
		private final Map<Integer, String> cmap = new HashMap<>();
		private final Map<String, String> categories = new HashMap<>();
		private final Map<String, List<String>> anchors = new HashMap<>();

		private Builder() {
		}

		public Builder glyph(String name) {
			return glyph(name, GlyphMetrics.ZERO);
		}

		public Builder glyph(String name, int width) {
			return glyph(name, GlyphMetrics.ofWidth(width));
		}

		public Builder glyph(String name, GlyphMetrics glyphMetrics) {
			metrics.put(name, glyphMetrics);
			return this;
		}

		/**
		 * Adds glyphs with zero metrics.
		 */
		public Builder glyphs(String... names) {
			for (String name : names) {
				glyph(name);
			}
			return this;
		}

		public Builder codepoint(int codepoint, String glyphName) {
			cmap.put(codepoint, glyphName);
			return this;
		}

		public Builder category(String glyphName, String category) {
			categories.put(glyphName, category);
			return this;
		}

		public Builder anchor(String glyphName, String anchorName) {
			anchors.computeIfAbsent(glyphName, g -> new ArrayList<>()).add(anchorName);
			return this;
		}

		public InMemoryFont build() {
			return new InMemoryFont(this);
		}
	}
}

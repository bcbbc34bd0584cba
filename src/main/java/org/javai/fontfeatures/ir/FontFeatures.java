package org.javai.fontfeatures.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The intermediate representation built by a compilation: named glyph classes,
 * routines, features and glyph anchors.
 * <p>
 * Features hold routines by identity. Appending the same routine to two features
 * shares it rather than copying it.
 */
public final class FontFeatures {

	private final Map<String, List<String>> namedClasses = new LinkedHashMap<>();
	private final List<Routine> routines = new ArrayList<>();
	private final Map<String, List<Routine>> features = new LinkedHashMap<>();
	private final Map<String, Map<String, Anchor>> anchors = new LinkedHashMap<>();

	// Named classes

	public void defineClass(String name, List<String> glyphs) {
		namedClasses.put(name, List.copyOf(glyphs));
	}

	public Optional<List<String>> namedClass(String name) {
		return Optional.ofNullable(namedClasses.get(name));
	}

	public Map<String, List<String>> namedClasses() {
		return Collections.unmodifiableMap(namedClasses);
	}

	// Routines and features

	/**
	 * Registers a routine unless this exact routine is already registered.
	 */
	public void addRoutine(Routine routine) {
		if (routines.stream().noneMatch(r -> r == routine)) {
			routines.add(routine);
		}
	}

	/**
	 * Finds the most recently added routine with the given name.
	 */
	public Optional<Routine> findRoutine(String name) {
		for (int i = routines.size() - 1; i >= 0; i--) {
			Routine routine = routines.get(i);
			if (name.equals(routine.name())) {
				return Optional.of(routine);
			}
		}
		return Optional.empty();
	}

	public List<Routine> routines() {
		return Collections.unmodifiableList(routines);
	}

	/**
	 * Appends routines to a feature. They are also registered as routines.
	 */
	public void addFeature(String tag, List<Routine> featureRoutines) {
		List<Routine> existing = features.computeIfAbsent(tag, t -> new ArrayList<>());
		for (Routine routine : featureRoutines) {
			addRoutine(routine);
			existing.add(routine);
		}
	}

	public List<Routine> feature(String tag) {
		List<Routine> routinesForTag = features.get(tag);
		return routinesForTag != null ? Collections.unmodifiableList(routinesForTag) : List.of();
	}

	public Map<String, List<Routine>> features() {
		return Collections.unmodifiableMap(features);
	}

	// Anchors

	public void addAnchor(String glyph, String anchorName, Anchor anchor) {
		anchors.computeIfAbsent(glyph, g -> new LinkedHashMap<>()).put(anchorName, anchor);
	}

	public Map<String, Anchor> anchors(String glyph) {
		Map<String, Anchor> glyphAnchors = anchors.get(glyph);
		return glyphAnchors != null ? Collections.unmodifiableMap(glyphAnchors) : Map.of();
	}

	public Map<String, Map<String, Anchor>> anchors() {
		return Collections.unmodifiableMap(anchors);
	}
}

package org.javai.fontfeatures.ir;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Attaches marks to bases by matching the base anchor of one glyph with the mark anchor of another.
 */
public final class Attachment extends Rule {

	private final String baseAnchor;
	private final String markAnchor;
	private final Map<String, Anchor> bases;
	private final Map<String, Anchor> marks;

	public Attachment(String baseAnchor, String markAnchor, Map<String, Anchor> bases,
			Map<String, Anchor> marks, String address) {
		super(List.of(), List.of(), List.of(), address);
		this.baseAnchor = baseAnchor;
		this.markAnchor = markAnchor;
		this.bases = Collections.unmodifiableMap(new LinkedHashMap<>(bases));
		this.marks = Collections.unmodifiableMap(new LinkedHashMap<>(marks));
	}

	public String baseAnchor() {
		return baseAnchor;
	}

	public String markAnchor() {
		return markAnchor;
	}

	public Map<String, Anchor> bases() {
		return bases;
	}

	public Map<String, Anchor> marks() {
		return marks;
	}

	@Override
	public String toString() {
		return "Attachment(" + baseAnchor + ", " + markAnchor + ")";
	}
}

package org.javai.fontfeatures.ir;

import java.util.List;

/**
 * Replaces the input glyph sequence by the replacement sequence.
 * An empty replacement deletes the input.
 */
public final class Substitution extends Rule {

	private final List<List<String>> input;
	private final List<List<String>> replacement;

	public Substitution(List<List<String>> input, List<List<String>> replacement,
			List<List<String>> precontext, List<List<String>> postcontext,
			List<LanguageSystem> languages, String address) {
		super(precontext, postcontext, languages, address);
		this.input = copyPositions(input);
		this.replacement = copyPositions(replacement);
	}

	public List<List<String>> input() {
		return input;
	}

	public List<List<String>> replacement() {
		return replacement;
	}

	public boolean isDeletion() {
		return replacement.isEmpty();
	}

	@Override
	public String toString() {
		return "Substitution" + input + " -> " + replacement;
	}
}

package org.javai.fontfeatures.ir;

import java.util.List;

/**
 * Applies routines at positions of a matched sequence. Routines are referenced by identity.
 */
public final class Chaining extends Rule {

	private final List<List<String>> input;
	private final List<List<Routine>> lookups;

	public Chaining(List<List<String>> input, List<List<Routine>> lookups,
			List<List<String>> precontext, List<List<String>> postcontext,
			List<LanguageSystem> languages, String address) {
		super(precontext, postcontext, languages, address);
		if (input.size() != lookups.size()) {
			throw new IllegalArgumentException("Each chained position needs a routine list");
		}
		this.input = copyPositions(input);
		this.lookups = lookups.stream().map(List::copyOf).toList();
	}

	public List<List<String>> input() {
		return input;
	}

	public List<List<Routine>> lookups() {
		return lookups;
	}

	@Override
	public String toString() {
		return "Chaining" + input;
	}
}

package org.javai.fontfeatures.ir;

import java.util.List;

/**
 * A layout rule. Every rule carries its glyph context, the language systems it
 * applies to, a source address and the lookup flags inherited from its routine.
 * Glyph positions are lists of glyph names, one list per position.
 */
public abstract sealed class Rule permits Substitution, Positioning, Chaining, Attachment {

	private final List<List<String>> precontext;
	private final List<List<String>> postcontext;
	private final List<LanguageSystem> languages;
	private final String address;
	private int flags;

	protected Rule(List<List<String>> precontext, List<List<String>> postcontext,
			List<LanguageSystem> languages, String address) {
		this.precontext = copyPositions(precontext);
		this.postcontext = copyPositions(postcontext);
		this.languages = languages != null ? List.copyOf(languages) : List.of();
		this.address = address;
	}

	public List<List<String>> precontext() {
		return precontext;
	}

	public List<List<String>> postcontext() {
		return postcontext;
	}

	public List<LanguageSystem> languages() {
		return languages;
	}

	/**
	 * Where the rule was defined, or {@code null}.
	 */
	public String address() {
		return address;
	}

	public int flags() {
		return flags;
	}

	void setFlags(int flags) {
		this.flags = flags;
	}

	public boolean hasContext() {
		return !precontext.isEmpty() || !postcontext.isEmpty();
	}

	static List<List<String>> copyPositions(List<List<String>> positions) {
		if (positions == null) {
			return List.of();
		}
		return positions.stream().map(List::copyOf).toList();
	}
}

package org.javai.fontfeatures.ir;

/**
 * A script/language pair a rule applies to. {@code *} stands for any.
 */
public record LanguageSystem(String script, String language) {

	@Override
	public String toString() {
		return script + "/" + language;
	}
}

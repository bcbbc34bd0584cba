package org.javai.fontfeatures.dsl;

/**
 * Parsing options of a plugin.
 *
 * @param useHelpers merge the shared base grammar (selectors, value records, integers) into the plugin's grammars
 */
public record ParseOptions(boolean useHelpers) {

	public static ParseOptions defaults() {
		return new ParseOptions(true);
	}
}

package org.javai.fontfeatures.dsl;

import java.util.Optional;

/**
 * A unit contributing verbs to the rule language.
 * Built-in plugins are listed in {@link BuiltinPlugin}; other implementations can be
 * registered with {@link CompilationSession#registerPlugin(VerbPlugin)}.
 */
public interface VerbPlugin {

	PluginDescriptor descriptor();

	/**
	 * The transformer factory of a declared verb, empty if the plugin has none.
	 */
	Optional<TransformerFactory> transformer(String verb);
}

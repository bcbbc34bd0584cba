package org.javai.fontfeatures.dsl;

import java.util.List;
import java.util.Map;

/**
 * Declares what a plugin contributes: its parse options, a grammar shared by all its
 * verbs, the verbs and the grammar fragments of each verb.
 * <p>
 * Fields may be {@code null} here; the registry rejects incomplete descriptors.
 */
public record PluginDescriptor(String name, ParseOptions options, String grammar, List<String> verbs,
		Map<String, VerbGrammars> verbGrammars) {

	public PluginDescriptor {
		verbs = verbs != null ? List.copyOf(verbs) : null;
		verbGrammars = verbGrammars != null ? Map.copyOf(verbGrammars) : Map.of();
	}

	public VerbGrammars grammarsFor(String verb) {
		return verbGrammars.getOrDefault(verb, VerbGrammars.NONE);
	}
}

package org.javai.fontfeatures.dsl;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.javai.fontfeatures.grammar.ComposedGrammar;
import org.javai.fontfeatures.grammar.FragmentParser;
import org.javai.fontfeatures.grammar.GrammarComposer;
import org.javai.fontfeatures.grammar.GrammarDefinition;
import org.javai.fontfeatures.grammar.GrammarException;
import org.javai.fontfeatures.grammar.PegFragmentParser;
import org.javai.fontfeatures.grammar.SourceLocation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registry of the verbs known to a session.
 * <p>
 * Registering a plugin composes three parsers per verb. Each composition is
 * independent, so verbs of different plugins may reuse auxiliary rule names.
 * Registrations are idempotent per plugin name. A verb registered again by a later
 * plugin replaces the earlier one.
 */
public final class VerbRegistry {

	private static final Logger logger = LoggerFactory.getLogger(VerbRegistry.class);

	private static final String START_RULE = "start";

	private final GrammarComposer composer;
	private final DiagnosticSink diagnostics;
	private final Map<String, RegisteredVerb> verbs = new LinkedHashMap<>();
	private final Set<String> plugins = new LinkedHashSet<>();

	public VerbRegistry(GrammarComposer composer, DiagnosticSink diagnostics) {
		this.composer = Objects.requireNonNull(composer, "composer must not be null");
		this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics must not be null");
	}

	/**
	 * Registers the verbs of a plugin.
	 *
	 * @return {@code false} if the plugin was rejected as incomplete
	 * @throws GrammarException if a verb grammar does not compose
	 */
	public boolean register(VerbPlugin plugin) {
		Objects.requireNonNull(plugin, "plugin must not be null");
		PluginDescriptor descriptor = plugin.descriptor();
		String problem = validate(plugin, descriptor);
		if (problem != null) {
			String name = descriptor != null && descriptor.name() != null ? descriptor.name() : plugin.toString();
			diagnostics.report(DiagnosticKind.PLUGIN_REJECTED,
					"Module " + name + " is not a verb plugin: " + problem, SourceLocation.UNKNOWN);
			return false;
		}
		if (plugins.contains(descriptor.name())) {
			logger.debug("Plugin '{}' already registered; skipping", descriptor.name());
			return true;
		}

		GrammarDefinition pluginGrammar = read(descriptor.name(), "grammar", descriptor.grammar());
		boolean useHelpers = descriptor.options().useHelpers();
		Map<String, RegisteredVerb> composed = new LinkedHashMap<>();
		for (String verb : descriptor.verbs()) {
			VerbGrammars grammars = descriptor.grammarsFor(verb);
			try {
				composed.put(verb, new RegisteredVerb(verb, descriptor.name(),
						mainParser(verb, useHelpers, pluginGrammar, grammars.main()),
						optionalParser(useHelpers, pluginGrammar, grammars.beforeBrace()),
						optionalParser(useHelpers, pluginGrammar, grammars.afterBrace()),
						plugin.transformer(verb).orElseThrow()));
			} catch (GrammarException e) {
				throw new GrammarException("Failed to compose grammar of verb '" + verb + "' in plugin '"
						+ descriptor.name() + "': " + e.getMessage(), e);
			}
		}

		composed.forEach((verb, registered) -> {
			RegisteredVerb previous = verbs.put(verb, registered);
			if (previous != null) {
				logger.debug("Verb '{}' of plugin '{}' replaced by plugin '{}'", verb, previous.plugin(), registered.plugin());
			}
		});
		plugins.add(descriptor.name());
		logger.debug("Registered plugin '{}' with verbs {}", descriptor.name(), descriptor.verbs());
		return true;
	}

	public Optional<RegisteredVerb> verb(String name) {
		return Optional.ofNullable(verbs.get(name));
	}

	public boolean isRegistered(String verb) {
		return verbs.containsKey(verb);
	}

	/**
	 * Registered verb names in registration order.
	 */
	public List<String> verbNames() {
		return List.copyOf(verbs.keySet());
	}

	public List<String> pluginNames() {
		return List.copyOf(plugins);
	}

	private String validate(VerbPlugin plugin, PluginDescriptor descriptor) {
		if (descriptor == null) {
			return "no descriptor";
		}
		if (descriptor.name() == null || descriptor.name().isBlank()) {
			return "missing name";
		}
		if (descriptor.options() == null) {
			return "missing parse options";
		}
		if (descriptor.grammar() == null) {
			return "missing grammar";
		}
		if (descriptor.verbs() == null || descriptor.verbs().isEmpty()) {
			return "missing verb list";
		}
		for (String verb : descriptor.verbs()) {
			if (plugin.transformer(verb).isEmpty()) {
				return "no transformer for verb '" + verb + "'";
			}
		}
		return null;
	}

	private FragmentParser mainParser(String verb, boolean useHelpers, GrammarDefinition pluginGrammar, String fragment) {
		if (fragment != null) {
			return composer.parser(useHelpers, pluginGrammar, composer.read(fragment));
		}
		ComposedGrammar grammar = composer.compose(useHelpers, pluginGrammar);
		if (grammar.hasRule(START_RULE)) {
			return new PegFragmentParser(grammar, START_RULE);
		}
		return FragmentParser.rejecting("Verb " + verb + " requires a block");
	}

	private FragmentParser optionalParser(boolean useHelpers, GrammarDefinition pluginGrammar, String fragment) {
		if (fragment == null) {
			return FragmentParser.none();
		}
		return composer.parser(useHelpers, pluginGrammar, composer.read(fragment));
	}

	private GrammarDefinition read(String plugin, String what, String text) {
		try {
			return composer.read(text);
		} catch (GrammarException e) {
			throw new GrammarException("Invalid " + what + " in plugin '" + plugin + "': " + e.getMessage(), e);
		}
	}
}

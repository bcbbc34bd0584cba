package org.javai.fontfeatures.grammar;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * An immutable set of rule and terminal definitions, as read from one grammar text
 * or produced by merging several of them.
 */
public final class GrammarDefinition {

	public static final GrammarDefinition EMPTY = new GrammarDefinition(Map.of(), Map.of(), Set.of());

	private final Map<String, RuleDefinition> rules;
	private final Map<String, TerminalDefinition> terminals;
	private final Set<String> ignored;

	public GrammarDefinition(Map<String, RuleDefinition> rules, Map<String, TerminalDefinition> terminals,
			Set<String> ignored) {
		this.rules = Collections.unmodifiableMap(new LinkedHashMap<>(rules));
		this.terminals = Collections.unmodifiableMap(new LinkedHashMap<>(terminals));
		this.ignored = Collections.unmodifiableSet(new LinkedHashSet<>(ignored));
	}

	public Map<String, RuleDefinition> rules() {
		return rules;
	}

	public Map<String, TerminalDefinition> terminals() {
		return terminals;
	}

	/**
	 * Names of the terminals skipped between tokens.
	 */
	public Set<String> ignored() {
		return ignored;
	}

	public Optional<RuleDefinition> rule(String name) {
		return Optional.ofNullable(rules.get(name));
	}

	public Optional<TerminalDefinition> terminal(String name) {
		return Optional.ofNullable(terminals.get(name));
	}

	/**
	 * Returns a new definition holding the definitions of this one followed by those of {@code other}.
	 * Neither input is modified.
	 *
	 * @throws GrammarException if a rule or terminal is defined in both
	 */
	public GrammarDefinition merge(GrammarDefinition other) {
		Map<String, RuleDefinition> mergedRules = new LinkedHashMap<>(rules);
		for (RuleDefinition rule : other.rules.values()) {
			if (mergedRules.putIfAbsent(rule.name(), rule) != null) {
				throw new GrammarException("Rule '" + rule.name() + "' is defined more than once");
			}
		}
		Map<String, TerminalDefinition> mergedTerminals = new LinkedHashMap<>(terminals);
		for (TerminalDefinition terminal : other.terminals.values()) {
			if (mergedTerminals.putIfAbsent(terminal.name(), terminal) != null) {
				throw new GrammarException("Terminal '" + terminal.name() + "' is defined more than once");
			}
		}
		Set<String> mergedIgnored = new LinkedHashSet<>(ignored);
		mergedIgnored.addAll(other.ignored);
		return new GrammarDefinition(mergedRules, mergedTerminals, mergedIgnored);
	}

	/**
	 * Merges definitions left to right.
	 */
	public static GrammarDefinition mergeAll(List<GrammarDefinition> definitions) {
		GrammarDefinition merged = EMPTY;
		for (GrammarDefinition definition : definitions) {
			merged = merged.merge(definition);
		}
		return merged;
	}
}

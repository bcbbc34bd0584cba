package org.javai.fontfeatures.grammar;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * A validated grammar ready to drive a {@link PegFragmentParser}.
 * <p>
 * Validation checks that every referenced rule and terminal is defined, that
 * terminals refer to terminals only and do not form cycles, and that every regular
 * expression compiles. Terminals are compiled into a single {@link Pattern} each.
 */
public final class ComposedGrammar {

	private static final String WORD_BOUNDARY = "(?![A-Za-z0-9_])";

	private final GrammarDefinition definition;
	private final Map<String, Pattern> terminalPatterns = new LinkedHashMap<>();
	private final Map<String, Pattern> inlinePatterns = new HashMap<>();
	private final List<Pattern> ignoredPatterns = new ArrayList<>();

	public ComposedGrammar(GrammarDefinition definition) {
		this.definition = definition;
		for (String terminal : definition.terminals().keySet()) {
			terminalPatterns.put(terminal, compile(terminal, terminalRegex(terminal, new HashSet<>())));
		}
		for (RuleDefinition rule : definition.rules().values()) {
			validateRuleExpression(rule.name(), rule.expression());
		}
		for (String ignored : definition.ignored()) {
			Pattern pattern = terminalPatterns.get(ignored);
			if (pattern == null) {
				throw new GrammarException("Ignored terminal '" + ignored + "' is not defined");
			}
			ignoredPatterns.add(pattern);
		}
	}

	/**
	 * Checks a definition without keeping its compiled terminals.
	 *
	 * @throws GrammarException if the definition is not valid on its own
	 */
	public static void validate(GrammarDefinition definition) {
		new ComposedGrammar(definition);
	}

	public GrammarDefinition definition() {
		return definition;
	}

	public boolean hasRule(String name) {
		return definition.rules().containsKey(name);
	}

	public RuleDefinition rule(String name) {
		RuleDefinition rule = definition.rules().get(name);
		if (rule == null) {
			throw new GrammarException("Rule '" + name + "' is not defined");
		}
		return rule;
	}

	public Pattern terminalPattern(String name) {
		return terminalPatterns.get(name);
	}

	public Pattern inlinePattern(String regex) {
		return inlinePatterns.get(regex);
	}

	public List<Pattern> ignoredPatterns() {
		return Collections.unmodifiableList(ignoredPatterns);
	}

	private void validateRuleExpression(String ruleName, GrammarExpression expression) {
		if (expression instanceof GrammarExpression.RuleRef ref) {
			if (!definition.rules().containsKey(ref.name())) {
				throw new GrammarException("Rule '" + ruleName + "' refers to undefined rule '" + ref.name() + "'");
			}
		} else if (expression instanceof GrammarExpression.TerminalRef ref) {
			if (!terminalPatterns.containsKey(ref.name())) {
				throw new GrammarException("Rule '" + ruleName + "' refers to undefined terminal '" + ref.name() + "'");
			}
		} else if (expression instanceof GrammarExpression.Regex regex) {
			inlinePatterns.computeIfAbsent(regex.pattern(), p -> compile(ruleName, p));
		} else if (expression instanceof GrammarExpression.Sequence sequence) {
			sequence.elements().forEach(e -> validateRuleExpression(ruleName, e));
		} else if (expression instanceof GrammarExpression.Choice choice) {
			choice.alternatives().forEach(e -> validateRuleExpression(ruleName, e));
		} else if (expression instanceof GrammarExpression.Repeat repeat) {
			validateRuleExpression(ruleName, repeat.expression());
		}
	}

	private String terminalRegex(String name, Set<String> visiting) {
		TerminalDefinition terminal = definition.terminals().get(name);
		if (terminal == null) {
			throw new GrammarException("Undefined terminal '" + name + "'");
		}
		if (!visiting.add(name)) {
			throw new GrammarException("Terminal '" + name + "' refers to itself");
		}
		String regex = toRegex(name, terminal.expression(), true, visiting);
		visiting.remove(name);
		return regex;
	}

	private String toRegex(String terminal, GrammarExpression expression, boolean topLevel, Set<String> visiting) {
		if (expression instanceof GrammarExpression.Literal literal) {
			String quoted = Pattern.quote(literal.text());
			return topLevel && endsWithWordCharacter(literal.text()) ? quoted + WORD_BOUNDARY : quoted;
		}
		if (expression instanceof GrammarExpression.Regex regex) {
			return "(?:" + regex.pattern() + ")";
		}
		if (expression instanceof GrammarExpression.TerminalRef ref) {
			return "(?:" + terminalRegex(ref.name(), visiting) + ")";
		}
		if (expression instanceof GrammarExpression.RuleRef ref) {
			throw new GrammarException("Terminal '" + terminal + "' cannot refer to rule '" + ref.name() + "'");
		}
		if (expression instanceof GrammarExpression.Sequence sequence) {
			StringBuilder sb = new StringBuilder();
			for (GrammarExpression element : sequence.elements()) {
				sb.append(toRegex(terminal, element, false, visiting));
			}
			return sb.toString();
		}
		if (expression instanceof GrammarExpression.Choice choice) {
			List<String> alternatives = new ArrayList<>();
			for (GrammarExpression alternative : choice.alternatives()) {
				alternatives.add(toRegex(terminal, alternative, topLevel, visiting));
			}
			return "(?:" + String.join("|", alternatives) + ")";
		}
		GrammarExpression.Repeat repeat = (GrammarExpression.Repeat) expression;
		String inner = "(?:" + toRegex(terminal, repeat.expression(), false, visiting) + ")";
		if (repeat.min() == 0 && !repeat.unbounded()) {
			return inner + "?";
		}
		return inner + (repeat.min() == 0 ? "*" : "+");
	}

	static boolean endsWithWordCharacter(String text) {
		char last = text.charAt(text.length() - 1);
		return Character.isLetterOrDigit(last) || last == '_';
	}

	private static Pattern compile(String owner, String regex) {
		try {
			return Pattern.compile(regex);
		} catch (PatternSyntaxException e) {
			throw new GrammarException("Invalid regular expression in '" + owner + "': " + e.getDescription(), e);
		}
	}
}

package org.javai.fontfeatures.grammar;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Interprets a {@link ComposedGrammar} as a parsing expression grammar.
 * <p>
 * Choices are ordered and repetition is greedy. Rule results are memoized per input
 * position, so backtracking costs linear time. Ignored terminals are skipped before
 * every literal and terminal. The whole input must be consumed.
 * <p>
 * Instances are immutable and may be shared; each call to {@link #parse} uses its own state.
 */
public final class PegFragmentParser implements FragmentParser {

	static final String ANONYMOUS_TOKEN = "ANON";

	private final ComposedGrammar grammar;
	private final String startRule;

	public PegFragmentParser(ComposedGrammar grammar, String startRule) {
		this.grammar = grammar;
		this.startRule = startRule;
		grammar.rule(startRule);
	}

	public String startRule() {
		return startRule;
	}

	@Override
	public Optional<ParseNode> parse(String input) {
		Run run = new Run(input == null ? "" : input);
		Match match = run.matchRule(startRule, 0);
		if (match != null) {
			int end = run.skipIgnored(match.end());
			if (end == run.input.length()) {
				return Optional.of(run.root(match));
			}
			run.fail(end, "end of input");
		}
		throw run.syntaxError();
	}

	private record Match(int end, List<ParseElement> elements) {
	}

	private record MemoKey(String rule, int position) {
	}

	/**
	 * State of a single parse.
	 */
	private final class Run {
		private final String input;
		private final int[] lineStarts;
		private final Map<MemoKey, Optional<Match>> memo = new HashMap<>();
		private final Set<MemoKey> active = new HashSet<>();
		private final Map<Pattern, Matcher> matchers = new HashMap<>();
		private int furthest = -1;
		private final Set<String> expected = new LinkedHashSet<>();

		Run(String input) {
			this.input = input;
			this.lineStarts = computeLineStarts(input);
		}

		ParseNode root(Match match) {
			List<ParseElement> elements = match.elements();
			if (elements.size() == 1 && elements.get(0) instanceof ParseNode node) {
				return node;
			}
			int[] position = position(0);
			return new ParseNode(startRule, elements, position[0], position[1]);
		}

		Match matchRule(String name, int position) {
			MemoKey key = new MemoKey(name, position);
			Optional<Match> memoized = memo.get(key);
			if (memoized != null) {
				return memoized.orElse(null);
			}
			if (!active.add(key)) {
				throw new GrammarException("Rule '" + name + "' is left-recursive");
			}
			RuleDefinition rule = grammar.rule(name);
			Match body;
			try {
				body = match(rule.expression(), position);
			} finally {
				active.remove(key);
			}
			Match result = body == null ? null : shape(rule, position, body);
			memo.put(key, Optional.ofNullable(result));
			return result;
		}

		private Match shape(RuleDefinition rule, int position, Match body) {
			List<ParseElement> children = body.elements();
			if (rule.spliced() || (rule.inlineSingleChild() && children.size() == 1)) {
				return body;
			}
			int[] start = children.isEmpty()
					? position(skipIgnored(position))
					: new int[] {children.get(0).line(), children.get(0).column()};
			ParseNode node = new ParseNode(rule.name(), children, start[0], start[1]);
			return new Match(body.end(), List.of(node));
		}

		private Match match(GrammarExpression expression, int position) {
			if (expression instanceof GrammarExpression.Literal literal) {
				return matchLiteral(literal.text(), position);
			}
			if (expression instanceof GrammarExpression.TerminalRef ref) {
				return matchPattern(grammar.terminalPattern(ref.name()), ref.name(), ref.name(), position);
			}
			if (expression instanceof GrammarExpression.Regex regex) {
				return matchPattern(grammar.inlinePattern(regex.pattern()), ANONYMOUS_TOKEN,
						"/" + regex.pattern() + "/", position);
			}
			if (expression instanceof GrammarExpression.RuleRef ref) {
				return matchRule(ref.name(), position);
			}
			if (expression instanceof GrammarExpression.Sequence sequence) {
				return matchSequence(sequence, position);
			}
			if (expression instanceof GrammarExpression.Choice choice) {
				for (GrammarExpression alternative : choice.alternatives()) {
					Match match = match(alternative, position);
					if (match != null) {
						return match;
					}
				}
				return null;
			}
			return matchRepeat((GrammarExpression.Repeat) expression, position);
		}

		private Match matchSequence(GrammarExpression.Sequence sequence, int position) {
			List<ParseElement> elements = new ArrayList<>();
			int current = position;
			for (GrammarExpression element : sequence.elements()) {
				Match match = match(element, current);
				if (match == null) {
					return null;
				}
				elements.addAll(match.elements());
				current = match.end();
			}
			return new Match(current, elements);
		}

		private Match matchRepeat(GrammarExpression.Repeat repeat, int position) {
			List<ParseElement> elements = new ArrayList<>();
			int current = position;
			int count = 0;
			while (count < repeat.max()) {
				Match match = match(repeat.expression(), current);
				if (match == null) {
					break;
				}
				elements.addAll(match.elements());
				count++;
				if (match.end() == current) {
					break;
				}
				current = match.end();
			}
			if (count < repeat.min()) {
				return null;
			}
			return new Match(current, elements);
		}

		private Match matchLiteral(String text, int position) {
			int start = skipIgnored(position);
			int end = start + text.length();
			if (input.startsWith(text, start)
					&& !(ComposedGrammar.endsWithWordCharacter(text) && end < input.length() && isWordChar(input.charAt(end)))) {
				return new Match(end, List.of());
			}
			fail(start, "\"" + text + "\"");
			return null;
		}

		private Match matchPattern(Pattern pattern, String tokenType, String description, int position) {
			int start = skipIgnored(position);
			Matcher matcher = matcher(pattern, start);
			if (matcher.lookingAt() && matcher.end() > start) {
				int[] at = position(start);
				ParseToken token = new ParseToken(tokenType, matcher.group(), at[0], at[1]);
				return new Match(matcher.end(), List.of(token));
			}
			fail(start, description);
			return null;
		}

		int skipIgnored(int position) {
			int current = position;
			boolean progressed = true;
			while (progressed && current < input.length()) {
				progressed = false;
				for (Pattern pattern : grammar.ignoredPatterns()) {
					Matcher matcher = matcher(pattern, current);
					if (matcher.lookingAt() && matcher.end() > current) {
						current = matcher.end();
						progressed = true;
					}
				}
			}
			return current;
		}

		private Matcher matcher(Pattern pattern, int start) {
			Matcher matcher = matchers.computeIfAbsent(pattern, p -> p.matcher(input)
					.useTransparentBounds(true)
					.useAnchoringBounds(false));
			matcher.region(start, input.length());
			return matcher;
		}

		void fail(int position, String description) {
			if (position > furthest) {
				furthest = position;
				expected.clear();
			}
			if (position == furthest) {
				expected.add(description);
			}
		}

		RuleSyntaxException syntaxError() {
			int at = Math.max(furthest, 0);
			int[] position = position(at);
			StringBuilder message = new StringBuilder("Unexpected ").append(describe(at));
			if (!expected.isEmpty()) {
				message.append(", expected ");
				message.append(expected.size() == 1 ? "" : "one of ");
				message.append(String.join(", ", expected));
			}
			return new RuleSyntaxException(message.toString(), SourceLocation.of(position[0], position[1]));
		}

		private String describe(int at) {
			if (at >= input.length()) {
				return "end of input";
			}
			int end = at;
			while (end < input.length() && end - at < 20 && !Character.isWhitespace(input.charAt(end))) {
				end++;
			}
			if (end == at) {
				end = at + 1;
			}
			return "'" + input.substring(at, end) + "'";
		}

		private int[] position(int offset) {
			int index = Arrays.binarySearch(lineStarts, offset);
			int line = index >= 0 ? index : -index - 2;
			return new int[] {line + 1, offset - lineStarts[line] + 1};
		}
	}

	private static boolean isWordChar(char c) {
		return Character.isLetterOrDigit(c) || c == '_';
	}

	private static int[] computeLineStarts(String input) {
		List<Integer> starts = new ArrayList<>();
		starts.add(0);
		for (int i = 0; i < input.length(); i++) {
			if (input.charAt(i) == '\n') {
				starts.add(i + 1);
			}
		}
		return starts.stream().mapToInt(Integer::intValue).toArray();
	}
}

package org.javai.fontfeatures.dsl;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import org.javai.fontfeatures.dsl.classes.Comparison;
import org.javai.fontfeatures.dsl.classes.GlyphPredicate;
import org.javai.fontfeatures.dsl.classes.Metric;
import org.javai.fontfeatures.dsl.selector.GlyphSelector;
import org.javai.fontfeatures.dsl.selector.SelectorTarget;
import org.javai.fontfeatures.dsl.selector.SuffixOperation;
import org.javai.fontfeatures.font.GlyphMetrics;
import org.javai.fontfeatures.grammar.ParseNode;
import org.javai.fontfeatures.grammar.ParseToken;
import org.javai.fontfeatures.grammar.ParseTreeVisitor;
import org.javai.fontfeatures.grammar.ParseTreeWalker;
import org.javai.fontfeatures.grammar.RuleSyntaxException;
import org.javai.fontfeatures.grammar.SourceLocation;
import org.javai.fontfeatures.ir.LanguageSystem;
import org.javai.fontfeatures.ir.ValueRecord;

/**
 * Reduces the parse tree of a statement's arguments to typed values, bottom-up.
 * <p>
 * Subclasses register a handler per rule or terminal with {@link #onRule} and
 * {@link #onToken}. The rules of the shared base grammar are handled here: selectors,
 * integers and variables, glyph metrics, metric comparisons, value records and
 * language systems. A rule without a handler reduces to the list of its children;
 * a terminal without a handler stays a {@link ParseToken}.
 * <p>
 * A transformer is created for a single statement.
 */
public abstract class VerbTransformer implements ParseTreeVisitor<Object> {

	protected final CompilationSession session;

	private final Map<String, Function<ReducedArgs, Object>> ruleHandlers = new HashMap<>();
	private final Map<String, Function<ParseToken, Object>> tokenHandlers = new HashMap<>();
	private SourceLocation location = SourceLocation.UNKNOWN;

	protected VerbTransformer(CompilationSession session) {
		this.session = session;

		onToken("SIGNED_NUMBER", this::number);
		onToken("NUMBER", this::number);
		onToken("NAMEDINTEGER", this::variable);

		onRule("glyphselector", this::glyphSelector);
		onRule("glyphsuffix", args -> SuffixOperation.parse(args.text(0)));
		onRule("unicoderange", args -> new SelectorTarget.CodepointRange(codepoint(args.text(0)), codepoint(args.text(1))));
		onRule("inlineclass", args -> new SelectorTarget.InlineClass(
				args.all(ParseToken.class).stream().map(this::selectorTarget).toList()));

		onRule("integer_container", args -> integer(args.get(0)));
		onRule("glyph_value", args -> glyphMetric(args.text(0), args.text(1)));
		onRule("metric_comparison", args -> GlyphPredicate.metric(
				metric(args.text(0)), comparison(args.text(1)), args.get(2, Integer.class)));

		onRule("valuerecord", args -> valueRecord(args.get(0)));
		onRule("fee_value_record", this::feeValueRecord);
		onRule("fea_value_record", args -> new ValueRecord(
				args.get(0, Integer.class), args.get(1, Integer.class), args.get(2, Integer.class), args.get(3, Integer.class)));

		onRule("language_system", args -> new LanguageSystem(args.text(0), args.text(1)));
		onRule("languages", args -> args.all(LanguageSystem.class));
	}

	/**
	 * Registers the reduction of a rule, replacing any earlier one.
	 */
	protected final void onRule(String rule, Function<ReducedArgs, Object> handler) {
		ruleHandlers.put(rule, handler);
	}

	/**
	 * Registers the reduction of a terminal, replacing any earlier one.
	 */
	protected final void onToken(String terminal, Function<ParseToken, Object> handler) {
		tokenHandlers.put(terminal, handler);
	}

	/**
	 * Reduces a parse tree of the statement's arguments.
	 */
	public Object transform(ParseNode tree) {
		return ParseTreeWalker.reduce(tree, this);
	}

	/**
	 * Called for a statement with brace bodies. Verbs that take a body override this.
	 */
	public Object action(BraceArguments arguments) {
		throw new RuleSyntaxException("Verb does not take a block", location);
	}

	@Override
	public Object visitNode(ParseNode node, List<Object> children) {
		Function<ReducedArgs, Object> handler = ruleHandlers.get(node.rule());
		if (handler == null) {
			return new ArrayList<>(children);
		}
		return handler.apply(new ReducedArgs(node, children));
	}

	@Override
	public Object visitToken(ParseToken token) {
		Function<ParseToken, Object> handler = tokenHandlers.get(token.type());
		return handler != null ? handler.apply(token) : token;
	}

	void bind(SourceLocation statementLocation) {
		this.location = statementLocation != null ? statementLocation : SourceLocation.UNKNOWN;
	}

	/**
	 * Location of the statement being transformed.
	 */
	protected SourceLocation location() {
		return location;
	}

	/**
	 * Resolves a selector against the session font, honouring the session's existence check.
	 */
	protected List<String> resolve(GlyphSelector selector) {
		return selector.resolve(session, session.options().mustExist());
	}

	protected Metric metric(String name) {
		return Metric.forName(name).orElseThrow(() -> new UnknownMetricException(name, location));
	}

	protected int integer(Object value) {
		if (value instanceof Integer integer) {
			return integer;
		}
		throw new CompilationException("Expected an integer but found " + value, location);
	}

	private int number(ParseToken token) {
		try {
			return Integer.parseInt(token.value());
		} catch (NumberFormatException e) {
			throw new RuleSyntaxException("Integer out of range '" + token.value() + "'", location, e);
		}
	}

	private Comparison comparison(String symbol) {
		return Comparison.forSymbol(symbol)
				.orElseThrow(() -> new RuleSyntaxException("Unknown comparison '" + symbol + "'", location));
	}

	private Object variable(ParseToken token) {
		String name = token.value().substring(1);
		return session.variable(name)
				.orElseThrow(() -> UndefinedReferenceException.undefinedVariable(name, location));
	}

	private int glyphMetric(String metricName, String glyph) {
		Metric metric = metric(metricName);
		GlyphMetrics metrics = session.font().metrics(glyph)
				.orElseThrow(() -> UndefinedReferenceException.missingGlyph(glyph,
						"Glyph '" + glyph + "' used in " + metricName + "(" + glyph + ") is not in the font", location));
		return metric.valueOf(metrics);
	}

	private GlyphSelector glyphSelector(ReducedArgs args) {
		Object first = args.get(0);
		SelectorTarget target = first instanceof SelectorTarget selectorTarget
				? selectorTarget
				: selectorTarget((ParseToken) first);
		return new GlyphSelector(target, args.all(SuffixOperation.class), location);
	}

	private SelectorTarget selectorTarget(ParseToken token) {
		String value = token.value();
		return switch (token.type()) {
			case "CLASSNAME" -> new SelectorTarget.ClassName(value.substring(1));
			case "REGEX" -> new SelectorTarget.RegexPattern(value.substring(1, value.length() - 1));
			case "UNICODEGLYPH" -> new SelectorTarget.Codepoint(codepoint(value));
			default -> new SelectorTarget.BareName(value);
		};
	}

	private static int codepoint(String text) {
		return Integer.parseInt(text.substring(2), 16);
	}

	private ValueRecord valueRecord(Object value) {
		if (value instanceof ValueRecord valueRecord) {
			return valueRecord;
		}
		return ValueRecord.advance(integer(value));
	}

	private ValueRecord feeValueRecord(ReducedArgs args) {
		int xPlacement = 0;
		int yPlacement = 0;
		int xAdvance = 0;
		int yAdvance = 0;
		for (int i = 0; i + 1 < args.size(); i += 2) {
			int value = args.get(i + 1, Integer.class);
			switch (args.text(i)) {
				case "xPlacement" -> xPlacement = value;
				case "yPlacement" -> yPlacement = value;
				case "xAdvance" -> xAdvance = value;
				case "yAdvance" -> yAdvance = value;
				default -> throw new RuleSyntaxException("Unknown value record field '" + args.text(i) + "'", location);
			}
		}
		return new ValueRecord(xPlacement, yPlacement, xAdvance, yAdvance);
	}
}

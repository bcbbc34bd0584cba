package org.javai.fontfeatures.dsl.classes;

import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.javai.fontfeatures.dsl.CompilationSession;
import org.javai.fontfeatures.dsl.ReducedArgs;
import org.javai.fontfeatures.dsl.VerbTransformer;
import org.javai.fontfeatures.dsl.selector.GlyphSelector;
import org.javai.fontfeatures.grammar.ParseToken;
import org.javai.fontfeatures.grammar.RuleSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code DefineClass @name = <class expression>;}
 * <p>
 * Reduces the class expression to a {@link ClassOperand} tree, evaluates it with a
 * {@link ClassAlgebra} and stores the glyphs as a named class. The statement's value
 * is the list of glyphs.
 */
public class DefineClassVerb extends VerbTransformer {

	private static final Logger logger = LoggerFactory.getLogger(DefineClassVerb.class);

	public DefineClassVerb(CompilationSession session) {
		super(session);

		onRule("has_glyph_predicate", this::hasGlyph);
		onRule("has_anchor_predicate", args -> GlyphPredicate.hasAnchor(session.font(), session.features(), args.text(0)));
		onRule("category_predicate", args -> GlyphPredicate.category(session.font(), args.text(0)));
		onRule("predicate", args -> args.get(0, GlyphPredicate.class));
		onRule("negated_predicate", args -> args.get(0, GlyphPredicate.class).negate());
		onRule("operand", args -> operand(args.get(0)));
		onRule("primary", this::primary);
		onRule("action", args -> define(args.text(0), args.get(1, ClassOperand.class)));
	}

	protected List<String> evaluate(ClassOperand operand) {
		return new ClassAlgebra(session, session.options().mustExist()).evaluate(operand);
	}

	protected static String className(String token) {
		return token.startsWith("@") ? token.substring(1) : token;
	}

	private List<String> define(String classToken, ClassOperand operand) {
		String name = className(classToken);
		List<String> glyphs = evaluate(operand);
		session.features().defineClass(name, glyphs);
		logger.debug("Defined class @{} with {} glyphs", name, glyphs.size());
		return glyphs;
	}

	private GlyphPredicate hasGlyph(ReducedArgs args) {
		String regex = args.text(0);
		String body = regex.substring(1, regex.length() - 1);
		String replacement = args.tokens("REPLACEMENT").stream().findFirst().map(ParseToken::value).orElse("");
		try {
			return GlyphPredicate.hasGlyph(session.font(), Pattern.compile(body), replacement);
		} catch (PatternSyntaxException e) {
			throw new RuleSyntaxException("Invalid regular expression " + regex + ": " + e.getDescription(), location(), e);
		}
	}

	private ClassOperand operand(Object value) {
		if (value instanceof ClassOperand operand) {
			return operand;
		}
		if (value instanceof GlyphPredicate predicate) {
			return ClassOperand.of(predicate);
		}
		return ClassOperand.of((GlyphSelector) value);
	}

	private ClassOperand primary(ReducedArgs args) {
		ClassOperand result = args.get(0, ClassOperand.class);
		for (int i = 1; i + 1 < args.size(); i += 2) {
			String symbol = args.text(i);
			ConjunctionOperator operator = ConjunctionOperator.forSymbol(symbol)
					.orElseThrow(() -> new RuleSyntaxException("Unknown class operator '" + symbol + "'", location()));
			result = new ClassOperand.Conjunction(result, operator, args.get(i + 1, ClassOperand.class));
		}
		return result;
	}
}

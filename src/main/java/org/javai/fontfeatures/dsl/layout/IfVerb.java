package org.javai.fontfeatures.dsl.layout;

import java.util.List;
import org.javai.fontfeatures.dsl.BraceArguments;
import org.javai.fontfeatures.dsl.CompilationSession;
import org.javai.fontfeatures.dsl.StatementBlock;
import org.javai.fontfeatures.dsl.VerbTransformer;
import org.javai.fontfeatures.dsl.classes.Comparison;
import org.javai.fontfeatures.grammar.RuleSyntaxException;

/**
 * {@code If <a> <op> <b> { ... } [Else { ... }];}
 * <p>
 * The value is the values of the chosen body. Bodies are compiled before the condition
 * is known, so the statements of both bodies take effect on classes, variables and
 * routines; only the rules of the chosen body reach an enclosing feature.
 */
public class IfVerb extends VerbTransformer {

	static final String ELSE = "Else";

	public IfVerb(CompilationSession session) {
		super(session);
		onRule("beforebrace", args -> {
			String symbol = args.text(1);
			Comparison comparison = Comparison.forSymbol(symbol)
					.orElseThrow(() -> new RuleSyntaxException("Unknown comparison '" + symbol + "'", location()));
			return comparison.test(integer(args.get(0)), integer(args.get(2)));
		});
	}

	@Override
	public Object action(BraceArguments arguments) {
		if (!(arguments.before() instanceof Boolean condition)) {
			throw new RuleSyntaxException("If needs a condition before its body", location());
		}
		List<Object> groups = arguments.groups();
		boolean plain = groups.size() == 1;
		boolean withElse = groups.size() == 3 && ELSE.equals(groups.get(1));
		if (!plain && !withElse || arguments.after() != null) {
			throw new RuleSyntaxException("Expected If <condition> { ... } [Else { ... }]", location());
		}
		if (condition) {
			return ((StatementBlock) groups.get(0)).values();
		}
		return withElse ? ((StatementBlock) groups.get(2)).values() : List.of();
	}
}

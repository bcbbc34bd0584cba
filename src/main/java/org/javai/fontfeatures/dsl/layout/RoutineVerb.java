package org.javai.fontfeatures.dsl.layout;

import java.util.List;
import java.util.Map;
import org.javai.fontfeatures.dsl.BraceArguments;
import org.javai.fontfeatures.dsl.CompilationSession;
import org.javai.fontfeatures.dsl.StatementBlock;
import org.javai.fontfeatures.dsl.VerbTransformer;
import org.javai.fontfeatures.grammar.ParseToken;
import org.javai.fontfeatures.ir.LookupFlag;
import org.javai.fontfeatures.ir.Routine;
import org.javai.fontfeatures.ir.Rule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code Routine [name] { ... } [RightToLeft] [IgnoreBases] [IgnoreLigatures] [IgnoreMarks];}
 * <p>
 * Collects the rules of its body into a routine and registers it. The flags apply to
 * every rule of the routine.
 */
public class RoutineVerb extends VerbTransformer {

	private static final Logger logger = LoggerFactory.getLogger(RoutineVerb.class);

	private static final Map<String, LookupFlag> FLAGS = Map.of(
			"RightToLeft", LookupFlag.RIGHT_TO_LEFT,
			"IgnoreBases", LookupFlag.IGNORE_BASE_GLYPHS,
			"IgnoreLigatures", LookupFlag.IGNORE_LIGATURES,
			"IgnoreMarks", LookupFlag.IGNORE_MARKS);

	public RoutineVerb(CompilationSession session) {
		super(session);
		onRule("beforebrace", args -> args.isEmpty() ? null : args.text(0));
		onRule("afterbrace", args -> args.all(ParseToken.class).stream()
				.map(token -> FLAGS.get(token.value()))
				.toList());
	}

	@Override
	@SuppressWarnings("unchecked")
	public Object action(BraceArguments arguments) {
		Routine routine = new Routine((String) arguments.before());
		routine.addAddress(location().toString());
		for (StatementBlock block : arguments.blocks()) {
			for (Object value : block.values()) {
				if (value instanceof Rule rule) {
					routine.addRule(rule);
				} else {
					logger.debug("Routine {} ignores {}", routine.name(), value);
				}
			}
		}
		if (arguments.after() != null) {
			routine.setFlags(LookupFlag.mask((List<LookupFlag>) arguments.after()));
		}
		session.features().addRoutine(routine);
		logger.debug("Defined {}", routine);
		return routine;
	}
}

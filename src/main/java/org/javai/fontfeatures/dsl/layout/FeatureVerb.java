package org.javai.fontfeatures.dsl.layout;

import java.util.ArrayList;
import java.util.List;
import org.javai.fontfeatures.dsl.BraceArguments;
import org.javai.fontfeatures.dsl.CompilationSession;
import org.javai.fontfeatures.dsl.StatementBlock;
import org.javai.fontfeatures.dsl.UndefinedReferenceException;
import org.javai.fontfeatures.dsl.VerbTransformer;
import org.javai.fontfeatures.grammar.ParseToken;
import org.javai.fontfeatures.grammar.RuleSyntaxException;
import org.javai.fontfeatures.ir.Routine;
import org.javai.fontfeatures.ir.Rule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Appends routines to a feature.
 * <ul>
 * <li>{@code Feature <tag> <routine>+;} references routines defined earlier.</li>
 * <li>{@code Feature <tag> { ... };} takes the rules and routines of its body. Consecutive
 * rules are gathered into anonymous routines.</li>
 * </ul>
 */
public class FeatureVerb extends VerbTransformer {

	private static final Logger logger = LoggerFactory.getLogger(FeatureVerb.class);

	public FeatureVerb(CompilationSession session) {
		super(session);
		onRule("action", args -> {
			List<ParseToken> names = args.all(ParseToken.class);
			List<Routine> routines = new ArrayList<>();
			for (ParseToken name : names.subList(1, names.size())) {
				routines.add(session.features().findRoutine(name.value())
						.orElseThrow(() -> UndefinedReferenceException.undefinedRoutine(name.value(), location())));
			}
			addToFeature(names.get(0).value(), routines);
			return null;
		});
		onRule("beforebrace", args -> args.text(0));
	}

	@Override
	public Object action(BraceArguments arguments) {
		if (!(arguments.before() instanceof String tag)) {
			throw new RuleSyntaxException("Feature needs a tag before its body", location());
		}
		List<Routine> routines = new ArrayList<>();
		Routine pending = null;
		for (StatementBlock block : arguments.blocks()) {
			for (Object value : block.values()) {
				if (value instanceof Rule rule) {
					if (pending == null) {
						pending = new Routine();
						pending.addAddress(location().toString());
					}
					pending.addRule(rule);
				} else if (value instanceof Routine routine) {
					pending = flush(pending, routines);
					routines.add(routine);
				} else {
					logger.debug("Feature {} ignores {}", tag, value);
				}
			}
		}
		flush(pending, routines);
		addToFeature(tag, routines);
		return null;
	}

	private static Routine flush(Routine pending, List<Routine> routines) {
		if (pending != null) {
			routines.add(pending);
		}
		return null;
	}

	private void addToFeature(String tag, List<Routine> routines) {
		session.features().addFeature(tag, routines);
		logger.debug("Added {} routines to feature {}", routines.size(), tag);
	}
}

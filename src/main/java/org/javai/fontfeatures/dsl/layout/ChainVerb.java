package org.javai.fontfeatures.dsl.layout;

import java.util.List;
import org.javai.fontfeatures.dsl.CompilationSession;
import org.javai.fontfeatures.dsl.ReducedArgs;
import org.javai.fontfeatures.dsl.UndefinedReferenceException;
import org.javai.fontfeatures.dsl.selector.GlyphSelector;
import org.javai.fontfeatures.grammar.ParseToken;
import org.javai.fontfeatures.ir.Chaining;
import org.javai.fontfeatures.ir.Routine;

/**
 * {@code Chain pre* ( (selector ^routine*)+ ) post*;}
 * <p>
 * Each {@code ^name} refers to the most recent routine of that name.
 */
public class ChainVerb extends ContextualRuleVerb {

	public ChainVerb(CompilationSession session) {
		super(session);
		onRule("chain_item", args -> new ChainItem(
				resolve(args.get(0, GlyphSelector.class)),
				args.tokens("ROUTINEREF").stream().map(this::routine).toList()));
		onRule("action", this::chaining);
	}

	@SuppressWarnings("unchecked")
	private Chaining chaining(ReducedArgs args) {
		List<ChainItem> items = args.all(ChainItem.class);
		return new Chaining(
				items.stream().map(ChainItem::glyphs).toList(),
				items.stream().map(ChainItem::routines).toList(),
				(List<List<String>>) args.get(0, List.class),
				(List<List<String>>) args.get(args.size() - 1, List.class),
				List.of(), address());
	}

	private Routine routine(ParseToken reference) {
		String name = reference.value().substring(1);
		return session.features().findRoutine(name)
				.orElseThrow(() -> UndefinedReferenceException.undefinedRoutine(name, location()));
	}

	private record ChainItem(List<String> glyphs, List<Routine> routines) {
	}
}

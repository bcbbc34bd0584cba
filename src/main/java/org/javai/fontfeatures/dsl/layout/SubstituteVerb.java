package org.javai.fontfeatures.dsl.layout;

import java.util.List;
import org.javai.fontfeatures.dsl.CompilationSession;
import org.javai.fontfeatures.dsl.ReducedArgs;
import org.javai.fontfeatures.ir.Substitution;

/**
 * {@code Substitute [pre* (] input+ [) post*] -> output* [<<script/lang>>];}
 * <p>
 * An empty output deletes the input.
 */
public class SubstituteVerb extends ContextualRuleVerb {

	public SubstituteVerb(CompilationSession session) {
		super(session);
		onGlyphSequence("input");
		onGlyphSequence("output");
		onRule("contextual_input", args -> new ContextualSequence<>(
				glyphs(args, 0), glyphs(args, 1), glyphs(args, 2)));
		onRule("plain_input", args -> ContextualSequence.withoutContext(glyphs(args, 0)));
		onRule("action", this::substitution);
	}

	@SuppressWarnings("unchecked")
	private Substitution substitution(ReducedArgs args) {
		ContextualSequence<List<String>> input = args.get(0, ContextualSequence.class);
		return new Substitution(input.items(), glyphs(args, 1), input.precontext(), input.postcontext(),
				languages(args, 2), address());
	}

	@SuppressWarnings("unchecked")
	private static List<List<String>> glyphs(ReducedArgs args, int index) {
		return (List<List<String>>) args.get(index, List.class);
	}
}

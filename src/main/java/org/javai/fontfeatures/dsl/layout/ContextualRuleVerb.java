package org.javai.fontfeatures.dsl.layout;

import java.util.List;
import org.javai.fontfeatures.dsl.CompilationSession;
import org.javai.fontfeatures.dsl.ReducedArgs;
import org.javai.fontfeatures.dsl.VerbTransformer;
import org.javai.fontfeatures.dsl.selector.GlyphSelector;
import org.javai.fontfeatures.ir.LanguageSystem;

/**
 * Base of the verbs that build one layout rule with optional glyph context,
 * written {@code pre* ( input ) post*}.
 * <p>
 * {@code prefix}, {@code suffix} and any other glyph sequence registered with
 * {@link #onGlyphSequence} reduce to one resolved glyph list per position.
 */
abstract class ContextualRuleVerb extends VerbTransformer {

	protected ContextualRuleVerb(CompilationSession session) {
		super(session);
		onGlyphSequence("prefix");
		onGlyphSequence("suffix");
	}

	protected final void onGlyphSequence(String rule) {
		onRule(rule, this::positions);
	}

	protected List<List<String>> positions(ReducedArgs args) {
		return args.all(GlyphSelector.class).stream().map(this::resolve).toList();
	}

	/**
	 * Language systems among the reduced arguments, or an empty list.
	 */
	@SuppressWarnings("unchecked")
	protected static List<LanguageSystem> languages(ReducedArgs args, int index) {
		if (index < args.size() && args.get(index) instanceof List<?> list) {
			return (List<LanguageSystem>) list;
		}
		return List.of();
	}

	protected String address() {
		return location().toString();
	}
}

package org.javai.fontfeatures.dsl.layout;

import java.util.List;
import org.javai.fontfeatures.dsl.BraceArguments;
import org.javai.fontfeatures.dsl.CompilationSession;
import org.javai.fontfeatures.dsl.VerbTransformer;
import org.javai.fontfeatures.dsl.selector.GlyphSelector;
import org.javai.fontfeatures.grammar.RuleSyntaxException;
import org.javai.fontfeatures.ir.Anchor;

/**
 * {@code Anchors <glyph> { name <x y> ... };} records anchors of every glyph the selector
 * resolves to.
 * <p>
 * Anchor lists are not statements, so the document reads the braces as plain words and
 * the main grammar parses them. Only an empty body arrives as a block.
 */
public class AnchorsVerb extends VerbTransformer {

	public AnchorsVerb(CompilationSession session) {
		super(session);
		onRule("anchor", args -> new NamedAnchor(args.text(0),
				new Anchor(args.get(1, Integer.class), args.get(2, Integer.class))));
		onRule("action", args -> {
			define(args.get(0, GlyphSelector.class), args.all(NamedAnchor.class));
			return null;
		});
		onRule("beforebrace", args -> args.get(0, GlyphSelector.class));
	}

	@Override
	public Object action(BraceArguments arguments) {
		if (!arguments.blocks().stream().allMatch(block -> block.statements().isEmpty())) {
			throw new RuleSyntaxException("Anchors body must contain anchors, not statements", location());
		}
		return null;
	}

	private void define(GlyphSelector selector, List<NamedAnchor> anchors) {
		for (String glyph : resolve(selector)) {
			for (NamedAnchor anchor : anchors) {
				session.features().addAnchor(glyph, anchor.name(), anchor.anchor());
			}
		}
	}

	private record NamedAnchor(String name, Anchor anchor) {
	}
}

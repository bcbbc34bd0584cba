package org.javai.fontfeatures.dsl.layout;

import java.util.List;
import org.javai.fontfeatures.dsl.CompilationSession;
import org.javai.fontfeatures.dsl.ReducedArgs;
import org.javai.fontfeatures.dsl.selector.GlyphSelector;
import org.javai.fontfeatures.ir.Positioning;
import org.javai.fontfeatures.ir.ValueRecord;

/**
 * {@code Position [pre* (] (selector valuerecord?)+ [) post*] [<<script/lang>>];}
 * <p>
 * A position without a value record is matched but not moved.
 */
public class PositionVerb extends ContextualRuleVerb {

	public PositionVerb(CompilationSession session) {
		super(session);
		onRule("position_item", args -> new PositionItem(
				resolve(args.get(0, GlyphSelector.class)),
				args.first(ValueRecord.class).orElse(ValueRecord.EMPTY)));
		onRule("positions", args -> args.all(PositionItem.class));
		onRule("contextual_positions", this::contextual);
		onRule("action", this::positioning);
	}

	@SuppressWarnings("unchecked")
	private ContextualSequence<PositionItem> contextual(ReducedArgs args) {
		return new ContextualSequence<>((List<List<String>>) args.get(0, List.class),
				(List<PositionItem>) args.get(1, List.class),
				(List<List<String>>) args.get(2, List.class));
	}

	@SuppressWarnings("unchecked")
	private Positioning positioning(ReducedArgs args) {
		Object first = args.get(0);
		ContextualSequence<PositionItem> sequence = first instanceof ContextualSequence<?> contextual
				? (ContextualSequence<PositionItem>) contextual
				: ContextualSequence.withoutContext((List<PositionItem>) first);
		List<List<String>> glyphs = sequence.items().stream().map(PositionItem::glyphs).toList();
		List<ValueRecord> records = sequence.items().stream().map(PositionItem::valueRecord).toList();
		return new Positioning(glyphs, records, sequence.precontext(), sequence.postcontext(),
				languages(args, 1), address());
	}

	private record PositionItem(List<String> glyphs, ValueRecord valueRecord) {
	}
}

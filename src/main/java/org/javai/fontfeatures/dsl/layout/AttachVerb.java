package org.javai.fontfeatures.dsl.layout;

import java.util.LinkedHashMap;
import java.util.Map;
import org.javai.fontfeatures.dsl.CompilationException;
import org.javai.fontfeatures.dsl.CompilationSession;
import org.javai.fontfeatures.dsl.VerbTransformer;
import org.javai.fontfeatures.ir.Anchor;
import org.javai.fontfeatures.ir.Attachment;

/**
 * {@code Attach &baseAnchor &markAnchor [bases|marks];}
 * <p>
 * Builds an attachment from the anchors recorded so far. With {@code bases}, the default,
 * glyphs the font categorizes as marks are left out of the base side. With {@code marks}
 * only marks are kept there, attaching marks to marks.
 */
public class AttachVerb extends VerbTransformer {

	static final String MARK_CATEGORY = "mark";

	public AttachVerb(CompilationSession session) {
		super(session);
		onRule("action", args -> {
			String baseAnchor = args.text(0).substring(1);
			String markAnchor = args.text(1).substring(1);
			boolean markToMark = args.tokens("ATTACHTYPE").stream().anyMatch(t -> t.value().equals("marks"));
			return attachment(baseAnchor, markAnchor, markToMark);
		});
	}

	private Attachment attachment(String baseAnchor, String markAnchor, boolean markToMark) {
		Map<String, Anchor> bases = new LinkedHashMap<>();
		Map<String, Anchor> marks = new LinkedHashMap<>();
		session.features().anchors().forEach((glyph, anchors) -> {
			if (anchors.containsKey(baseAnchor) && isMark(glyph) == markToMark) {
				bases.put(glyph, anchors.get(baseAnchor));
			}
			if (anchors.containsKey(markAnchor)) {
				marks.put(glyph, anchors.get(markAnchor));
			}
		});
		if (bases.isEmpty() || marks.isEmpty()) {
			throw new CompilationException("No glyphs carry anchors &" + baseAnchor + " and &" + markAnchor, location());
		}
		return new Attachment(baseAnchor, markAnchor, bases, marks, location().toString());
	}

	private boolean isMark(String glyph) {
		return session.font().category(glyph).map(MARK_CATEGORY::equals).orElse(false);
	}
}

package org.javai.fontfeatures.dsl.debug;

import java.util.List;
import org.javai.fontfeatures.dsl.CompilationSession;
import org.javai.fontfeatures.dsl.DiagnosticKind;
import org.javai.fontfeatures.dsl.VerbTransformer;
import org.javai.fontfeatures.dsl.selector.GlyphSelector;

/**
 * {@code ShowClass <selector>;} reports the selector and the glyphs it resolves to.
 */
public class ShowClassVerb extends VerbTransformer {

	public ShowClassVerb(CompilationSession session) {
		super(session);
		onRule("action", args -> show(args.get(0, GlyphSelector.class)));
	}

	private List<String> show(GlyphSelector selector) {
		List<String> glyphs = resolve(selector);
		session.report(DiagnosticKind.CLASS_REPORT, ClassReports.describe(selector.asText(), glyphs), location());
		return glyphs;
	}
}

package org.javai.fontfeatures.dsl.debug;

import java.util.List;
import java.util.Map;
import org.javai.fontfeatures.dsl.CompilationSession;
import org.javai.fontfeatures.dsl.DiagnosticKind;
import org.javai.fontfeatures.dsl.VerbTransformer;

/**
 * {@code DumpClasses;} reports every defined class with its glyphs, one report per class.
 */
public class DumpClassesVerb extends VerbTransformer {

	public DumpClassesVerb(CompilationSession session) {
		super(session);
		onRule("action", args -> dump());
	}

	private Object dump() {
		Map<String, List<String>> classes = session.features().namedClasses();
		if (classes.isEmpty()) {
			session.report(DiagnosticKind.CLASS_REPORT, ClassReports.NO_CLASSES, location());
		}
		classes.forEach((name, glyphs) ->
				session.report(DiagnosticKind.CLASS_REPORT, ClassReports.describe("@" + name, glyphs), location()));
		return null;
	}
}

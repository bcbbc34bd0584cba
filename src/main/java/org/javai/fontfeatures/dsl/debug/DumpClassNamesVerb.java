package org.javai.fontfeatures.dsl.debug;

import java.util.Set;
import java.util.stream.Collectors;
import org.javai.fontfeatures.dsl.CompilationSession;
import org.javai.fontfeatures.dsl.DiagnosticKind;
import org.javai.fontfeatures.dsl.VerbTransformer;

/**
 * {@code DumpClassNames;} reports the names of all defined classes in one line.
 */
public class DumpClassNamesVerb extends VerbTransformer {

	public DumpClassNamesVerb(CompilationSession session) {
		super(session);
		onRule("action", args -> dump());
	}

	private Object dump() {
		Set<String> names = session.features().namedClasses().keySet();
		String message = names.isEmpty()
				? ClassReports.NO_CLASSES
				: names.stream().map(name -> "@" + name).collect(Collectors.joining(" "));
		session.report(DiagnosticKind.CLASS_REPORT, message, location());
		return null;
	}
}

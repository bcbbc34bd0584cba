package org.javai.fontfeatures.dsl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.javai.fontfeatures.grammar.SourceLocation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collects the diagnostics of one session in the order they are reported and logs each one.
 */
public final class DiagnosticSink {

	private static final Logger logger = LoggerFactory.getLogger(DiagnosticSink.class);

	private final List<Diagnostic> diagnostics = new ArrayList<>();

	public Diagnostic report(DiagnosticKind kind, String message, SourceLocation location) {
		Diagnostic diagnostic = new Diagnostic(kind, message, location);
		diagnostics.add(diagnostic);
		if (diagnostic.isWarning()) {
			logger.warn("{}", diagnostic);
		} else {
			logger.info("{}", diagnostic);
		}
		return diagnostic;
	}

	public List<Diagnostic> diagnostics() {
		return Collections.unmodifiableList(diagnostics);
	}

	public List<Diagnostic> ofKind(DiagnosticKind kind) {
		return diagnostics.stream().filter(d -> d.kind() == kind).toList();
	}

	public List<Diagnostic> warnings() {
		return diagnostics.stream().filter(Diagnostic::isWarning).toList();
	}

	public List<Diagnostic> since(int mark) {
		return List.copyOf(diagnostics.subList(mark, diagnostics.size()));
	}

	public int size() {
		return diagnostics.size();
	}
}

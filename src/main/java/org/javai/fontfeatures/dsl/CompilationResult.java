package org.javai.fontfeatures.dsl;

import java.util.List;
import org.javai.fontfeatures.ir.FontFeatures;

/**
 * Result of compiling one source.
 *
 * @param features the session's IR after the compilation
 * @param statements the dispatched top-level statements in source order
 * @param diagnostics diagnostics reported while compiling this source
 */
public record CompilationResult(FontFeatures features, List<StatementResult> statements, List<Diagnostic> diagnostics) {

	public CompilationResult {
		statements = List.copyOf(statements);
		diagnostics = List.copyOf(diagnostics);
	}

	public List<Diagnostic> warnings() {
		return diagnostics.stream().filter(Diagnostic::isWarning).toList();
	}

	public List<Diagnostic> diagnostics(DiagnosticKind kind) {
		return diagnostics.stream().filter(d -> d.kind() == kind).toList();
	}
}

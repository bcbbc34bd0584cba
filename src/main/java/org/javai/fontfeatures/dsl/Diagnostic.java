package org.javai.fontfeatures.dsl;

import org.javai.fontfeatures.grammar.SourceLocation;

/**
 * A warning or informational report produced during compilation.
 */
public record Diagnostic(DiagnosticKind kind, String message, SourceLocation location) {

	public DiagnosticKind.Severity severity() {
		return kind.severity();
	}

	public boolean isWarning() {
		return severity() == DiagnosticKind.Severity.WARNING;
	}

	@Override
	public String toString() {
		String where = location == null || location.equals(SourceLocation.UNKNOWN) ? "" : " (at " + location + ")";
		return kind + ": " + message + where;
	}
}

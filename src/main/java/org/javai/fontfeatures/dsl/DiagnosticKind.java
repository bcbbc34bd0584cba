package org.javai.fontfeatures.dsl;

/**
 * Non-fatal conditions reported during a compilation.
 */
public enum DiagnosticKind {

	MISSING_GLYPH(Severity.WARNING),
	UNKNOWN_VERB(Severity.WARNING),
	BINNING(Severity.WARNING),
	PLUGIN_REJECTED(Severity.WARNING),
	CLASS_REPORT(Severity.INFO);

	public enum Severity {
		INFO,
		WARNING
	}

	private final Severity severity;

	DiagnosticKind(Severity severity) {
		this.severity = severity;
	}

	public Severity severity() {
		return severity;
	}
}

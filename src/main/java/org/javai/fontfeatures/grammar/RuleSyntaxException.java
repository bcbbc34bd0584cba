package org.javai.fontfeatures.grammar;

/**
 * Exception thrown when rule text does not match a composed grammar.
 */
public class RuleSyntaxException extends RuntimeException {

	private final SourceLocation location;

	public RuleSyntaxException(String message) {
		this(message, SourceLocation.UNKNOWN);
	}

	public RuleSyntaxException(String message, SourceLocation location) {
		super(message);
		this.location = location != null ? location : SourceLocation.UNKNOWN;
	}

	public RuleSyntaxException(String message, SourceLocation location, Throwable cause) {
		super(message, cause);
		this.location = location != null ? location : SourceLocation.UNKNOWN;
	}

	public SourceLocation location() {
		return location;
	}

	/**
	 * Re-anchors this error at a statement location, prefixing the given context.
	 */
	public RuleSyntaxException at(SourceLocation statementLocation, String context) {
		return new RuleSyntaxException(context + ": " + getMessage() + " (at " + statementLocation + ")",
				statementLocation, this);
	}
}

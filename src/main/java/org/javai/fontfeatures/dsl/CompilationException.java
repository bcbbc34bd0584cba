package org.javai.fontfeatures.dsl;

import org.javai.fontfeatures.grammar.SourceLocation;

/**
 * Base exception for errors that abort a compilation. The message ends with the
 * location of the offending statement when it is known.
 */
public class CompilationException extends RuntimeException {

	private final SourceLocation location;

	public CompilationException(String message, SourceLocation location) {
		super(withLocation(message, location));
		this.location = location != null ? location : SourceLocation.UNKNOWN;
	}

	public CompilationException(String message, SourceLocation location, Throwable cause) {
		super(withLocation(message, location), cause);
		this.location = location != null ? location : SourceLocation.UNKNOWN;
	}

	public SourceLocation location() {
		return location;
	}

	private static String withLocation(String message, SourceLocation location) {
		if (location == null || location.equals(SourceLocation.UNKNOWN)) {
			return message;
		}
		return message + " (at " + location + ")";
	}
}

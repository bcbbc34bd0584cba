package org.javai.fontfeatures.grammar;

/**
 * Exception thrown when a grammar fragment cannot be read or composed.
 */
public class GrammarException extends RuntimeException {

	public GrammarException(String message) {
		super(message);
	}

	public GrammarException(String message, Throwable cause) {
		super(message, cause);
	}
}

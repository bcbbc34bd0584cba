package org.javai.fontfeatures.dsl;

import org.javai.fontfeatures.grammar.SourceLocation;

/**
 * Thrown when a statement refers to a class, routine, variable or glyph that does not exist.
 */
public class UndefinedReferenceException extends CompilationException {

	/**
	 * What kind of name could not be resolved.
	 */
	public enum Kind {
		CLASS,
		ROUTINE,
		VARIABLE,
		GLYPH
	}

	private final Kind kind;
	private final String identifier;

	public UndefinedReferenceException(Kind kind, String identifier, String message, SourceLocation location) {
		super(message, location);
		this.kind = kind;
		this.identifier = identifier;
	}

	public static UndefinedReferenceException undefinedClass(String className, SourceLocation location) {
		return new UndefinedReferenceException(Kind.CLASS, className,
				"Tried to expand glyph class '@" + className + "' but @" + className + " was not defined", location);
	}

	public static UndefinedReferenceException undefinedRoutine(String routineName, SourceLocation location) {
		return new UndefinedReferenceException(Kind.ROUTINE, routineName,
				"Routine '" + routineName + "' was not defined", location);
	}

	public static UndefinedReferenceException undefinedVariable(String variableName, SourceLocation location) {
		return new UndefinedReferenceException(Kind.VARIABLE, variableName,
				"Undefined variable: $" + variableName, location);
	}

	public static UndefinedReferenceException missingGlyph(String glyph, String message, SourceLocation location) {
		return new UndefinedReferenceException(Kind.GLYPH, glyph, message, location);
	}

	public Kind kind() {
		return kind;
	}

	public String identifier() {
		return identifier;
	}
}

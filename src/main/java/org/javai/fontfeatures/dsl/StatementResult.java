package org.javai.fontfeatures.dsl;

import java.util.List;
import org.javai.fontfeatures.grammar.SourceLocation;

/**
 * The outcome of dispatching one statement.
 * <p>
 * A resolved result holds whatever the verb returned. An unresolved result is a
 * statement whose verb is not registered; its value is the raw argument list.
 */
public record StatementResult(String verb, Object value, SourceLocation location, boolean resolved) {

	public static StatementResult resolved(String verb, Object value, SourceLocation location) {
		return new StatementResult(verb, value, location, true);
	}

	public static StatementResult unresolved(String verb, List<Object> rawArguments, SourceLocation location) {
		return new StatementResult(verb, List.copyOf(rawArguments), location, false);
	}
}

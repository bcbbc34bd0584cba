package org.javai.fontfeatures.dsl;

/**
 * Creates the transformer of a verb for one statement.
 */
@FunctionalInterface
public interface TransformerFactory {

	VerbTransformer create(CompilationSession session);
}

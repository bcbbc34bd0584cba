package org.javai.fontfeatures.grammar;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Builds parsers from grammar fragments.
 * <p>
 * The base grammar is read once. Each composition merges the base (when asked for)
 * with the given fragments into a fresh definition, so no composition can see
 * another's rules.
 */
public final class GrammarComposer {

	private final GrammarNotationParser notationParser = new GrammarNotationParser();
	private final GrammarDefinition base;

	/**
	 * Creates a composer over a base grammar.
	 *
	 * @throws GrammarException if the base on its own has undefined references or invalid terminals
	 */
	public GrammarComposer(GrammarDefinition base) {
		this.base = base != null ? base : GrammarDefinition.EMPTY;
		ComposedGrammar.validate(this.base);
	}

	/**
	 * Creates a composer whose base grammar is read from a classpath resource.
	 *
	 * @throws GrammarException if the resource is missing or is not valid grammar notation
	 */
	public static GrammarComposer fromResource(String resourcePath) {
		return new GrammarComposer(readResource(resourcePath));
	}

	public static GrammarDefinition readResource(String resourcePath) {
		ClassLoader loader = GrammarComposer.class.getClassLoader();
		try (InputStream is = loader.getResourceAsStream(resourcePath)) {
			if (is == null) {
				throw new GrammarException("Grammar resource not found: " + resourcePath);
			}
			return new GrammarNotationParser().parse(is);
		} catch (IOException e) {
			throw new GrammarException("Failed to read grammar resource " + resourcePath, e);
		}
	}

	public GrammarDefinition base() {
		return base;
	}

	/**
	 * Reads grammar notation text. Blank text yields an empty definition.
	 */
	public GrammarDefinition read(String grammarText) {
		return notationParser.parseString(grammarText);
	}

	/**
	 * Merges the base grammar (optionally) and the given fragments, then validates the result.
	 *
	 * @throws GrammarException on duplicate definitions, undefined references or invalid terminals
	 */
	public ComposedGrammar compose(boolean includeBase, GrammarDefinition... fragments) {
		List<GrammarDefinition> parts = new ArrayList<>();
		if (includeBase) {
			parts.add(base);
		}
		parts.addAll(Arrays.asList(fragments));
		return new ComposedGrammar(GrammarDefinition.mergeAll(parts));
	}

	/**
	 * Composes a grammar and returns a parser for its {@code start} rule.
	 */
	public FragmentParser parser(boolean includeBase, GrammarDefinition... fragments) {
		return new PegFragmentParser(compose(includeBase, fragments), "start");
	}
}

package org.javai.fontfeatures.dsl;

import org.javai.fontfeatures.grammar.FragmentParser;

/**
 * A verb ready for dispatch: its three composed parsers and its transformer factory.
 */
public record RegisteredVerb(String name, String plugin, FragmentParser mainParser,
		FragmentParser beforeBraceParser, FragmentParser afterBraceParser, TransformerFactory transformerFactory) {
}

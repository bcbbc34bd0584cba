package org.javai.fontfeatures.grammar;

import java.util.List;

/**
 * A named terminal matched by the parser.
 *
 * @param type the terminal name, e.g. {@code CLASSNAME}
 * @param value the matched text
 * @param line the 1-based line of the match
 * @param column the 1-based column of the match
 */
public record ParseToken(String type, String value, int line, int column) implements ParseElement {

	public boolean isType(String expectedType) {
		return type.equals(expectedType);
	}

	@Override
	public <R> R accept(ParseTreeVisitor<R> visitor, List<R> reducedChildren) {
		return visitor.visitToken(this);
	}

	@Override
	public String toString() {
		return type + "(" + value + ")";
	}
}

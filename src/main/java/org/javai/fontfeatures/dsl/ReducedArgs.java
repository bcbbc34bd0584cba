package org.javai.fontfeatures.dsl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import org.javai.fontfeatures.grammar.ParseNode;
import org.javai.fontfeatures.grammar.ParseToken;

/**
 * The reduced children of a parse node, handed to a rule handler of a {@link VerbTransformer}.
 * Anonymous literals never appear here.
 */
public record ReducedArgs(ParseNode node, List<Object> values) {

	public ReducedArgs {
		values = Collections.unmodifiableList(new ArrayList<>(values));
	}

	public int size() {
		return values.size();
	}

	public boolean isEmpty() {
		return values.isEmpty();
	}

	public Object get(int index) {
		return values.get(index);
	}

	public <T> T get(int index, Class<T> type) {
		Object value = values.get(index);
		if (!type.isInstance(value)) {
			throw new IllegalStateException("Expected " + type.getSimpleName() + " at position " + index
					+ " of '" + node.rule() + "', found " + value);
		}
		return type.cast(value);
	}

	/**
	 * Text of the token at the given position.
	 */
	public String text(int index) {
		return get(index, ParseToken.class).value();
	}

	public <T> List<T> all(Class<T> type) {
		return values.stream().filter(type::isInstance).map(type::cast).toList();
	}

	public <T> Optional<T> first(Class<T> type) {
		return values.stream().filter(type::isInstance).map(type::cast).findFirst();
	}

	/**
	 * Tokens of the given terminal among the values.
	 */
	public List<ParseToken> tokens(String type) {
		return all(ParseToken.class).stream().filter(t -> t.isType(type)).toList();
	}
}

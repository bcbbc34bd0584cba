package org.javai.fontfeatures.dsl;

/**
 * Grammar fragments of one verb. Any of them may be {@code null}.
 *
 * @param main grammar of the arguments of a statement without a brace body
 * @param beforeBrace grammar of the arguments before the first brace body
 * @param afterBrace grammar of the arguments after the last brace body
 */
public record VerbGrammars(String main, String beforeBrace, String afterBrace) {

	public static final VerbGrammars NONE = new VerbGrammars(null, null, null);

	public static VerbGrammars main(String main) {
		return new VerbGrammars(main, null, null);
	}
}

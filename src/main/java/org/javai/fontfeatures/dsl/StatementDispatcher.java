package org.javai.fontfeatures.dsl;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import org.javai.fontfeatures.grammar.FragmentParser;
import org.javai.fontfeatures.grammar.ParseElement;
import org.javai.fontfeatures.grammar.ParseNode;
import org.javai.fontfeatures.grammar.ParseToken;
import org.javai.fontfeatures.grammar.RuleSyntaxException;
import org.javai.fontfeatures.grammar.SourceLocation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Routes parsed statements to the transformer of their verb.
 * <p>
 * Nested brace bodies are dispatched first. A statement with bodies is split at its
 * first and last body: the words before and after are re-parsed with the verb's
 * before-brace and after-brace parsers and handed to
 * {@link VerbTransformer#action(BraceArguments)} together with the bodies. A statement
 * without bodies is re-parsed with the verb's main parser and reduced by its transformer.
 * Words are joined with single spaces before re-parsing.
 */
final class StatementDispatcher {

	private static final Logger logger = LoggerFactory.getLogger(StatementDispatcher.class);

	static final String STATEMENT = "statement";
	static final String ARGS = "args";
	static final String BLOCK = "block";
	static final String VERB = "VERB";

	private final CompilationSession session;
	private final VerbRegistry registry;
	private final DiagnosticSink diagnostics;

	StatementDispatcher(CompilationSession session, VerbRegistry registry, DiagnosticSink diagnostics) {
		this.session = session;
		this.registry = registry;
		this.diagnostics = diagnostics;
	}

	List<StatementResult> dispatchAll(List<ParseNode> statements) {
		List<StatementResult> results = new ArrayList<>();
		for (ParseNode statement : statements) {
			results.add(dispatch(statement));
		}
		return results;
	}

	StatementResult dispatch(ParseNode statement) {
		ParseToken verbToken = statement.childTokens(VERB).get(0);
		String verb = verbToken.value();
		SourceLocation location = session.locate(verbToken.line(), verbToken.column());
		List<Object> arguments = arguments(statement);

		Optional<RegisteredVerb> registered = registry.verb(verb);
		if (registered.isEmpty()) {
			diagnostics.report(DiagnosticKind.UNKNOWN_VERB, "Unknown verb: " + verb, location);
			return StatementResult.unresolved(verb, arguments, location);
		}
		RegisteredVerb target = registered.get();
		VerbTransformer transformer = target.transformerFactory().create(session);
		transformer.bind(location);
		logger.debug("Dispatching {} at {}", verb, location);

		int first = -1;
		int last = -1;
		for (int i = 0; i < arguments.size(); i++) {
			if (arguments.get(i) instanceof StatementBlock) {
				if (first < 0) {
					first = i;
				}
				last = i;
			}
		}

		if (first < 0) {
			String text = join(arguments);
			Object value = parse(target.mainParser(), text, verb, location)
					.map(transformer::transform)
					.orElse(null);
			return StatementResult.resolved(verb, value, location);
		}

		Object before = reduce(target.beforeBraceParser(), join(arguments.subList(0, first)), transformer, verb, location);
		Object after = reduce(target.afterBraceParser(), join(arguments.subList(last + 1, arguments.size())),
				transformer, verb, location);
		List<Object> groups = new ArrayList<>(arguments.subList(first, last + 1));
		Object value = transformer.action(new BraceArguments(before, groups, after));
		return StatementResult.resolved(verb, value, location);
	}

	private List<Object> arguments(ParseNode statement) {
		List<Object> arguments = new ArrayList<>();
		for (ParseNode args : statement.childNodes(ARGS)) {
			for (ParseElement element : args.children()) {
				if (element instanceof ParseToken token) {
					arguments.add(token.value());
				} else if (element instanceof ParseNode block && block.isRule(BLOCK)) {
					arguments.add(new StatementBlock(dispatchAll(block.childNodes(STATEMENT))));
				}
			}
		}
		return arguments;
	}

	private Object reduce(FragmentParser parser, String text, VerbTransformer transformer, String verb,
			SourceLocation location) {
		Object reduced = parse(parser, text, verb, location).map(transformer::transform).orElse(null);
		if (reduced instanceof Collection<?> collection && collection.isEmpty()) {
			return null;
		}
		return reduced;
	}

	private Optional<ParseNode> parse(FragmentParser parser, String text, String verb, SourceLocation location) {
		try {
			return parser.parse(text);
		} catch (RuleSyntaxException e) {
			throw e.at(location, "Invalid arguments to " + verb + " '" + text + "'");
		}
	}

	private static String join(List<Object> words) {
		List<String> parts = new ArrayList<>();
		for (Object word : words) {
			parts.add(String.valueOf(word));
		}
		return String.join(" ", parts);
	}
}

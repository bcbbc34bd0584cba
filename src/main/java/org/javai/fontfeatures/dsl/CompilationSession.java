package org.javai.fontfeatures.dsl;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.javai.fontfeatures.dsl.selector.GlyphSelector;
import org.javai.fontfeatures.dsl.selector.ResolutionContext;
import org.javai.fontfeatures.font.FontModel;
import org.javai.fontfeatures.grammar.ComposedGrammar;
import org.javai.fontfeatures.grammar.GrammarComposer;
import org.javai.fontfeatures.grammar.ParseNode;
import org.javai.fontfeatures.grammar.PegFragmentParser;
import org.javai.fontfeatures.grammar.RuleSyntaxException;
import org.javai.fontfeatures.grammar.SourceLocation;
import org.javai.fontfeatures.ir.FontFeatures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiles rule sources against one font into one {@link FontFeatures}.
 * <p>
 * The session owns its verb registry, the IR, the variable table and the diagnostics.
 * Successive compilations (and included files) add to the same IR. Sessions are
 * single-threaded.
 *
 * <pre>{@code
 * CompilationSession session = new CompilationSession(font);
 * CompilationResult result = session.compile("DefineClass @upper = /^[A-Z]$/;");
 * List<String> upper = result.features().namedClass("upper").orElseThrow();
 * }</pre>
 */
public final class CompilationSession implements ResolutionContext {

	private static final Logger logger = LoggerFactory.getLogger(CompilationSession.class);

	static final String BASE_GRAMMAR = "org/javai/fontfeatures/dsl/base.grammar";
	static final String DOCUMENT_GRAMMAR = "org/javai/fontfeatures/dsl/document.grammar";

	private final FontModel font;
	private final CompilerOptions options;
	private final DiagnosticSink diagnostics = new DiagnosticSink();
	private final FontFeatures features = new FontFeatures();
	private final Map<String, Object> variables = new HashMap<>();
	private final VerbRegistry registry;
	private final PegFragmentParser documentParser;
	private final StatementDispatcher dispatcher;
	private Path currentFile;

	public CompilationSession(FontModel font) {
		this(font, CompilerOptions.defaults());
	}

	public CompilationSession(FontModel font, CompilerOptions options) {
		this.font = Objects.requireNonNull(font, "font must not be null");
		this.options = Objects.requireNonNull(options, "options must not be null");
		this.registry = new VerbRegistry(GrammarComposer.fromResource(BASE_GRAMMAR), diagnostics);
		this.documentParser = new PegFragmentParser(
				new ComposedGrammar(GrammarComposer.readResource(DOCUMENT_GRAMMAR)), "start");
		this.dispatcher = new StatementDispatcher(this, registry, diagnostics);
		for (String pluginName : options.plugins()) {
			Optional<BuiltinPlugin> plugin = BuiltinPlugin.named(pluginName);
			if (plugin.isPresent()) {
				registry.register(plugin.get());
			} else {
				diagnostics.report(DiagnosticKind.PLUGIN_REJECTED, "Unknown plugin " + pluginName, SourceLocation.UNKNOWN);
			}
		}
	}

	/**
	 * Registers an additional plugin.
	 *
	 * @return {@code false} if the plugin was rejected
	 */
	public boolean registerPlugin(VerbPlugin plugin) {
		return registry.register(plugin);
	}

	/**
	 * Compiles rule text that does not come from a file.
	 */
	public CompilationResult compile(String source) {
		int mark = diagnostics.size();
		List<StatementResult> statements = compileSource(source);
		return new CompilationResult(features, statements, diagnostics.since(mark));
	}

	/**
	 * Compiles a rule file. {@code Include} paths in it are relative to its directory.
	 */
	public CompilationResult compileFile(Path path) {
		int mark = diagnostics.size();
		List<StatementResult> statements = include(path);
		return new CompilationResult(features, statements, diagnostics.since(mark));
	}

	/**
	 * Compiles a file within the current compilation, restoring the current file afterwards.
	 */
	public List<StatementResult> include(Path path) {
		Path previous = currentFile;
		currentFile = path;
		try {
			logger.debug("Compiling {}", path);
			return compileSource(Files.readString(path, StandardCharsets.UTF_8));
		} catch (IOException e) {
			throw new UncheckedIOException("Failed to read rule file " + path, e);
		} finally {
			currentFile = previous;
		}
	}

	/**
	 * Resolves an include path against the current file's directory, or else the
	 * configured include root.
	 */
	public Path resolveInclude(String path) {
		Path included = Path.of(path);
		if (included.isAbsolute()) {
			return included;
		}
		if (currentFile != null && currentFile.getParent() != null) {
			return currentFile.getParent().resolve(included);
		}
		if (options.includeRoot() != null) {
			return options.includeRoot().resolve(included);
		}
		return included;
	}

	private List<StatementResult> compileSource(String source) {
		ParseNode document;
		try {
			document = documentParser.parse(source).orElseThrow();
		} catch (RuleSyntaxException e) {
			SourceLocation location = locate(e.location().line(), e.location().column());
			throw new RuleSyntaxException(e.getMessage() + " (at " + location + ")", location, e);
		}
		return dispatcher.dispatchAll(document.childNodes(StatementDispatcher.STATEMENT));
	}

	SourceLocation locate(int line, int column) {
		SourceLocation location = SourceLocation.of(line, column);
		return currentFile != null ? location.inFile(currentFile.toString()) : location;
	}

	// Variables

	public Optional<Object> variable(String name) {
		return Optional.ofNullable(variables.get(name));
	}

	/**
	 * Binds a variable. A later binding of the same name shadows the earlier one.
	 */
	public void setVariable(String name, Object value) {
		variables.put(name, value);
	}

	// Resolution context

	@Override
	public FontModel font() {
		return font;
	}

	@Override
	public Optional<List<String>> namedClass(String className) {
		return features.namedClass(className);
	}

	@Override
	public void reportMissingGlyphs(GlyphSelector selector, List<String> missing) {
		String plural = missing.size() > 1 ? "s" : "";
		diagnostics.report(DiagnosticKind.MISSING_GLYPH,
				"Couldn't find glyph" + plural + " '" + String.join(", ", missing) + "' in font (" + selector.asText() + ")",
				selector.location());
	}

	// Accessors

	public FontFeatures features() {
		return features;
	}

	public CompilerOptions options() {
		return options;
	}

	public DiagnosticSink diagnostics() {
		return diagnostics;
	}

	public VerbRegistry registry() {
		return registry;
	}

	public Optional<Path> currentFile() {
		return Optional.ofNullable(currentFile);
	}

	public void report(DiagnosticKind kind, String message, SourceLocation location) {
		diagnostics.report(kind, message, location);
	}
}

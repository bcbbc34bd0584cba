package org.javai.fontfeatures.dsl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.javai.fontfeatures.grammar.GrammarComposer;
import org.javai.fontfeatures.grammar.GrammarException;
import org.javai.fontfeatures.grammar.RuleSyntaxException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class VerbRegistryTest {

	private DiagnosticSink diagnostics;
	private VerbRegistry registry;

	@BeforeEach
	void setUp() {
		diagnostics = new DiagnosticSink();
		registry = new VerbRegistry(GrammarComposer.fromResource(CompilationSession.BASE_GRAMMAR), diagnostics);
	}

	private static VerbPlugin plugin(PluginDescriptor descriptor) {
		VerbPlugin plugin = mock(VerbPlugin.class);
		when(plugin.descriptor()).thenReturn(descriptor);
		when(plugin.transformer("Echo")).thenReturn(Optional.of(RecordingPlugin.Recorder::new));
		return plugin;
	}

	@Nested
	@DisplayName("Registration")
	class Registration {

		@Test
		void registersEveryVerbOfThePlugin() {
			assertThat(registry.register(new RecordingPlugin())).isTrue();

			assertThat(registry.verbNames()).containsExactly("Echo", "Wrap", "Bare");
			assertThat(registry.pluginNames()).containsExactly(RecordingPlugin.NAME);
			assertThat(registry.verb("Echo").orElseThrow().plugin()).isEqualTo(RecordingPlugin.NAME);
		}

		@Test
		void registeringTheSamePluginTwiceIsHarmless() {
			registry.register(new RecordingPlugin());
			RegisteredVerb first = registry.verb("Echo").orElseThrow();

			assertThat(registry.register(new RecordingPlugin())).isTrue();
			assertThat(registry.verb("Echo").orElseThrow()).isSameAs(first);
		}

		@Test
		void laterPluginReplacesAVerb() {
			registry.register(new RecordingPlugin());
			registry.register(new RecordingPlugin("Other"));

			assertThat(registry.verb("Echo").orElseThrow().plugin()).isEqualTo("Other");
			assertThat(registry.verbNames()).hasSize(3);
		}

		@Test
		void builtinPlugins() {
			for (BuiltinPlugin plugin : BuiltinPlugin.values()) {
				assertThat(registry.register(plugin)).as(plugin.pluginName()).isTrue();
			}

			assertThat(registry.verbNames()).contains("DefineClass", "DefineClassBinned", "ShowClass", "Set",
					"Feature", "Routine", "Substitute", "Position", "Chain", "Anchors", "Attach", "Include", "If");
		}
	}

	@Nested
	@DisplayName("Parsers")
	class Parsers {

		@Test
		void missingBraceGrammarsGiveParsersThatReturnNothing() {
			registry.register(new RecordingPlugin());
			RegisteredVerb bare = registry.verb("Bare").orElseThrow();

			assertThat(bare.beforeBraceParser().parse("anything at all")).isEmpty();
			assertThat(bare.afterBraceParser().parse("")).isEmpty();
		}

		@Test
		void missingMainGrammarRejectsUseWithoutBlock() {
			registry.register(new RecordingPlugin());

			assertThatThrownBy(() -> registry.verb("Wrap").orElseThrow().mainParser().parse("x"))
					.isInstanceOf(RuleSyntaxException.class)
					.hasMessage("Verb Wrap requires a block");
		}

		@Test
		void pluginGrammarWithStartRuleServesAsMainGrammar() {
			registry.register(plugin(new PluginDescriptor("Starting", ParseOptions.defaults(),
					"start: NUMBER+", List.of("Echo"), Map.of())));

			assertThat(registry.verb("Echo").orElseThrow().mainParser().parse("1 2 3").orElseThrow()
					.childTokens("NUMBER")).hasSize(3);
		}
	}

	@Nested
	@DisplayName("Rejection")
	class Rejection {

		@Test
		void missingOptions() {
			boolean registered = registry.register(plugin(new PluginDescriptor("NoOptions", null, "", List.of("Echo"), null)));

			assertThat(registered).isFalse();
			assertThat(diagnostics.ofKind(DiagnosticKind.PLUGIN_REJECTED)).singleElement()
					.extracting(Diagnostic::message)
					.isEqualTo("Module NoOptions is not a verb plugin: missing parse options");
			assertThat(registry.verbNames()).isEmpty();
		}

		@Test
		void missingGrammar() {
			assertThat(registry.register(plugin(new PluginDescriptor("NoGrammar", ParseOptions.defaults(), null,
					List.of("Echo"), null)))).isFalse();
		}

		@Test
		void emptyVerbList() {
			assertThat(registry.register(plugin(new PluginDescriptor("NoVerbs", ParseOptions.defaults(), "",
					List.of(), null)))).isFalse();
		}

		@Test
		void verbWithoutTransformer() {
			boolean registered = registry.register(plugin(new PluginDescriptor("Partial", ParseOptions.defaults(), "",
					List.of("Echo", "Missing"), null)));

			assertThat(registered).isFalse();
			assertThat(diagnostics.warnings()).singleElement()
					.extracting(Diagnostic::message).asString()
					.contains("no transformer for verb 'Missing'");
			assertThat(registry.isRegistered("Echo")).isFalse();
		}
	}

	@Test
	void brokenVerbGrammarIsFatal() {
		VerbPlugin broken = plugin(new PluginDescriptor("Broken", ParseOptions.defaults(), "",
				List.of("Echo"), Map.of("Echo", VerbGrammars.main("start: undefined_rule"))));

		assertThatThrownBy(() -> registry.register(broken))
				.isInstanceOf(GrammarException.class)
				.hasMessageContaining("verb 'Echo' in plugin 'Broken'")
				.hasMessageContaining("undefined_rule");
	}
}

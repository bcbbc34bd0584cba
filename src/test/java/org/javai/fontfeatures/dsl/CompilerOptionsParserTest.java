package org.javai.fontfeatures.dsl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Path;
import org.junit.jupiter.api.Test;

class CompilerOptionsParserTest {

	private final CompilerOptionsParser parser = new CompilerOptionsParser();

	@Test
	void emptyDocumentGivesDefaults() {
		CompilerOptions options = parser.parseString("");

		assertThat(options).isEqualTo(CompilerOptions.defaults());
		assertThat(options.plugins()).hasSize(BuiltinPlugin.values().length).startsWith("ClassDefinition");
		assertThat(options.mustExist()).isTrue();
		assertThat(options.includeRoot()).isNull();
	}

	@Test
	void readsEveryKey() {
		CompilerOptions options = parser.parseString("""
				plugins: [ClassDefinition, Debug]
				include_root: rules/shared
				must_exist: false
				""");

		assertThat(options.plugins()).containsExactly("ClassDefinition", "Debug");
		assertThat(options.includeRoot()).isEqualTo(Path.of("rules/shared"));
		assertThat(options.mustExist()).isFalse();
	}

	@Test
	void absentKeysKeepTheirDefault() {
		CompilerOptions options = parser.parseString("must_exist: false");

		assertThat(options.plugins()).isEqualTo(CompilerOptions.defaults().plugins());
		assertThat(options.mustExist()).isFalse();
	}

	@Test
	void pluginsMustBeAList() {
		assertThatThrownBy(() -> parser.parseString("plugins: Debug"))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("'plugins' must be a list");
	}

	@Test
	void documentMustBeAMapping() {
		assertThatThrownBy(() -> parser.parseString("just text"))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessage("Compiler options must be a YAML mapping");
	}
}

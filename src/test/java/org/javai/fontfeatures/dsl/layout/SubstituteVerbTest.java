package org.javai.fontfeatures.dsl.layout;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.javai.fontfeatures.dsl.CompilationSession;
import org.javai.fontfeatures.dsl.StatementResult;
import org.javai.fontfeatures.dsl.UndefinedReferenceException;
import org.javai.fontfeatures.ir.LanguageSystem;
import org.javai.fontfeatures.ir.Substitution;
import org.javai.fontfeatures.testsupport.TestFonts;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SubstituteVerbTest {

	private CompilationSession session;

	@BeforeEach
	void setUp() {
		session = new CompilationSession(TestFonts.latin());
	}

	private Substitution substitution(String source) {
		List<Object> values = session.compile(source).statements().stream().map(StatementResult::value).toList();
		return (Substitution) values.get(values.size() - 1);
	}

	@Test
	void singleSubstitution() {
		Substitution rule = substitution("Substitute A -> A.sc;");

		assertThat(rule.input()).containsExactly(List.of("A"));
		assertThat(rule.replacement()).containsExactly(List.of("A.sc"));
		assertThat(rule.hasContext()).isFalse();
		assertThat(rule.languages()).isEmpty();
		assertThat(rule.address()).isEqualTo("1:1");
	}

	@Test
	void eachSelectorIsOnePosition() {
		Substitution rule = substitution("DefineClass @ab = [A B];\nSubstitute @ab f -> @ab.sc;");

		assertThat(rule.input()).containsExactly(List.of("A", "B"), List.of("f"));
		assertThat(rule.replacement()).containsExactly(List.of("A.sc", "B.sc"));
		assertThat(rule.address()).isEqualTo("2:1");
	}

	@Test
	void contextInParentheses() {
		Substitution rule = substitution("Substitute a b ( A ) f -> A.sc;");

		assertThat(rule.precontext()).containsExactly(List.of("a"), List.of("b"));
		assertThat(rule.input()).containsExactly(List.of("A"));
		assertThat(rule.postcontext()).containsExactly(List.of("f"));
		assertThat(rule.hasContext()).isTrue();
	}

	@Test
	void emptyOutputDeletes() {
		Substitution rule = substitution("Substitute a b -> ;");

		assertThat(rule.input()).hasSize(2);
		assertThat(rule.isDeletion()).isTrue();
	}

	@Test
	void languageSystems() {
		Substitution rule = substitution("Substitute a -> b <<latn/dflt latn/TRK>>;");

		assertThat(rule.languages()).containsExactly(new LanguageSystem("latn", "dflt"), new LanguageSystem("latn", "TRK"));
	}

	@Test
	void undefinedClass() {
		assertThatThrownBy(() -> session.compile("Substitute @nope -> A;"))
				.isInstanceOfSatisfying(UndefinedReferenceException.class,
						e -> assertThat(e.identifier()).isEqualTo("nope"));
	}
}

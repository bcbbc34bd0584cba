package org.javai.fontfeatures.dsl.layout;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.javai.fontfeatures.dsl.CompilationSession;
import org.javai.fontfeatures.grammar.RuleSyntaxException;
import org.javai.fontfeatures.ir.Substitution;
import org.javai.fontfeatures.testsupport.TestFonts;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class IfVerbTest {

	private CompilationSession session;

	@BeforeEach
	void setUp() {
		session = new CompilationSession(TestFonts.latin());
	}

	@SuppressWarnings("unchecked")
	private List<Object> values(String source) {
		return (List<Object>) session.compile(source).statements().get(0).value();
	}

	private static String firstInput(List<Object> values) {
		return ((Substitution) values.get(0)).input().get(0).get(0);
	}

	@ParameterizedTest
	@CsvSource({
			"5 > 3, A",
			"3 > 5, B",
			"5 >= 5, A",
			"5 <= 4, B",
			"4 == 4, A",
			"4 = 5, B",
			"-1 < 0, A"
	})
	void choosesTheBranchByTheCondition(String condition, String expected) {
		List<Object> values = values("If " + condition + " { Substitute A -> A.sc; } Else { Substitute B -> B.sc; };");

		assertThat(values).hasSize(1);
		assertThat(firstInput(values)).isEqualTo(expected);
	}

	@Test
	void conditionOnVariablesAndMetrics() {
		session.compile("Set $limit = 550;");

		List<Object> values = values("If width(A) > $limit { Substitute A -> A.sc; };");

		assertThat(firstInput(values)).isEqualTo("A");
	}

	@Test
	void falseConditionWithoutElseGivesNothing() {
		assertThat(values("If 1 > 2 { Substitute A -> A.sc; };")).isEmpty();
	}

	@Test
	void bothBodiesAreCompiled() {
		session.compile("If 1 > 2 { DefineClass @never = A; } Else { DefineClass @always = B; };");

		assertThat(session.features().namedClass("never")).contains(List.of("A"));
		assertThat(session.features().namedClass("always")).contains(List.of("B"));
	}

	@Test
	void onlyElseMayJoinTheBodies() {
		assertThatThrownBy(() -> session.compile("If 1 > 2 { } Otherwise { };"))
				.isInstanceOf(RuleSyntaxException.class)
				.hasMessageStartingWith("Expected If <condition> { ... } [Else { ... }]");
	}

	@Test
	void conditionIsRequired() {
		assertThatThrownBy(() -> session.compile("If { };"))
				.isInstanceOf(RuleSyntaxException.class)
				.hasMessageStartingWith("Invalid arguments to If ''");
	}
}

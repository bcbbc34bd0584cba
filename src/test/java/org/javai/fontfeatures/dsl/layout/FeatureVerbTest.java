package org.javai.fontfeatures.dsl.layout;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.javai.fontfeatures.dsl.CompilationSession;
import org.javai.fontfeatures.dsl.UndefinedReferenceException;
import org.javai.fontfeatures.grammar.RuleSyntaxException;
import org.javai.fontfeatures.ir.FontFeatures;
import org.javai.fontfeatures.ir.Routine;
import org.javai.fontfeatures.ir.Substitution;
import org.javai.fontfeatures.testsupport.TestFonts;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class FeatureVerbTest {

	private CompilationSession session;
	private FontFeatures features;

	@BeforeEach
	void setUp() {
		session = new CompilationSession(TestFonts.latin());
		features = session.features();
	}

	@Nested
	@DisplayName("Referencing routines")
	class ByName {

		@Test
		void appendsNamedRoutinesInOrder() {
			session.compile("""
					Routine one { Substitute A -> A.sc; };
					Routine two { Substitute B -> B.sc; };
					Feature smcp two one;
					""");

			assertThat(features.feature("smcp")).extracting(Routine::name).containsExactly("two", "one");
		}

		@Test
		void repeatedFeatureAppends() {
			session.compile("""
					Routine one { Substitute A -> A.sc; };
					Routine two { Substitute B -> B.sc; };
					Feature smcp one;
					Feature smcp two;
					""");

			assertThat(features.feature("smcp")).extracting(Routine::name).containsExactly("one", "two");
		}

		@Test
		void routinesAreSharedBetweenFeatures() {
			session.compile("""
					Routine shared { Substitute A -> A.sc; };
					Feature smcp shared;
					Feature c2sc shared;
					""");

			assertThat(features.feature("smcp").get(0)).isSameAs(features.feature("c2sc").get(0));
			assertThat(features.routines()).hasSize(1);
		}

		@Test
		void undefinedRoutine() {
			assertThatThrownBy(() -> session.compile("Feature smcp ghost;"))
					.isInstanceOfSatisfying(UndefinedReferenceException.class,
							e -> assertThat(e.kind()).isEqualTo(UndefinedReferenceException.Kind.ROUTINE));
			assertThat(features.features()).isEmpty();
		}
	}

	@Nested
	@DisplayName("With a body")
	class WithBody {

		@Test
		void consecutiveRulesShareAnAnonymousRoutine() {
			session.compile("""
					Feature liga {
					    Substitute A -> A.sc;
					    Substitute B -> B.sc;
					    Routine named { Substitute a -> b; };
					    Position f 10;
					};
					""");

			List<Routine> routines = features.feature("liga");
			assertThat(routines).extracting(Routine::name).containsExactly(null, "named", null);
			assertThat(routines.get(0).rules()).hasSize(2).allMatch(Substitution.class::isInstance);
			assertThat(routines.get(0).address()).containsExactly("1:1");
			assertThat(routines.get(2).rules()).hasSize(1);
			assertThat(features.routines()).containsExactlyInAnyOrderElementsOf(routines);
		}

		@Test
		void otherValuesAreIgnored() {
			session.compile("Feature liga { DefineClass @x = A; Set $y = 2; Substitute @x -> A.sc; };");

			assertThat(features.feature("liga")).singleElement()
					.satisfies(routine -> assertThat(routine.rules()).hasSize(1));
		}

		@Test
		void rulesOfAConditionalJoinTheFeature() {
			session.compile("Feature liga { If 1 < 2 { Substitute A -> A.sc; }; };");

			assertThat(features.feature("liga")).singleElement()
					.satisfies(routine -> assertThat(routine.rules()).hasSize(1));
		}

		@Test
		void emptyBodyStillCreatesTheFeature() {
			session.compile("Feature liga { };");

			assertThat(features.features()).containsKey("liga");
			assertThat(features.feature("liga")).isEmpty();
		}

		@Test
		void tagIsRequired() {
			assertThatThrownBy(() -> session.compile("Feature { Substitute A -> A.sc; };"))
					.isInstanceOf(RuleSyntaxException.class)
					.hasMessageStartingWith("Invalid arguments to Feature ''");
		}
	}
}

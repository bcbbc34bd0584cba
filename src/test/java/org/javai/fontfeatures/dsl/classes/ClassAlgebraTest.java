package org.javai.fontfeatures.dsl.classes;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.javai.fontfeatures.dsl.selector.GlyphSelector;
import org.javai.fontfeatures.dsl.selector.ResolutionContext;
import org.javai.fontfeatures.dsl.selector.SelectorTarget;
import org.javai.fontfeatures.testsupport.TestFonts;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ClassAlgebraTest {

	private static final Map<String, List<String>> CLASSES = Map.of(
			"abc", List.of("A", "B", "C"),
			"bcd", List.of("B", "C", "D"),
			"cde", List.of("C", "D", "E"),
			"narrow", List.of("f", "space"));

	private ClassAlgebra algebra;

	@BeforeEach
	void setUp() {
		ResolutionContext context = mock(ResolutionContext.class);
		when(context.font()).thenReturn(TestFonts.latin());
		CLASSES.forEach((name, glyphs) -> when(context.namedClass(name)).thenReturn(Optional.of(glyphs)));
		algebra = new ClassAlgebra(context, true);
	}

	private static ClassOperand cls(String name) {
		return ClassOperand.of(GlyphSelector.of(new SelectorTarget.ClassName(name)));
	}

	private static ClassOperand wider(int width) {
		return ClassOperand.of(GlyphPredicate.metric(Metric.WIDTH, Comparison.GREATER, width));
	}

	private static ClassOperand op(ClassOperand left, ConjunctionOperator operator, ClassOperand right) {
		return new ClassOperand.Conjunction(left, operator, right);
	}

	@Nested
	@DisplayName("Set operators")
	class SetOperators {

		@Test
		void unionKeepsFirstSeenOrder() {
			assertThat(algebra.evaluate(op(cls("bcd"), ConjunctionOperator.UNION, cls("abc"))))
					.containsExactly("B", "C", "D", "A");
		}

		@Test
		void intersectionFollowsTheLeftOrder() {
			assertThat(algebra.evaluate(op(cls("bcd"), ConjunctionOperator.INTERSECTION, cls("abc"))))
					.containsExactly("B", "C");
		}

		@Test
		void difference() {
			assertThat(algebra.evaluate(op(cls("abc"), ConjunctionOperator.DIFFERENCE, cls("bcd"))))
					.containsExactly("A");
		}

		@Test
		void differenceDoesNotCommute() {
			List<String> abcMinusBcd = algebra.evaluate(op(cls("abc"), ConjunctionOperator.DIFFERENCE, cls("bcd")));
			List<String> bcdMinusAbc = algebra.evaluate(op(cls("bcd"), ConjunctionOperator.DIFFERENCE, cls("abc")));

			assertThat(abcMinusBcd).containsExactly("A");
			assertThat(bcdMinusAbc).containsExactly("D");
			assertThat(abcMinusBcd).isNotEqualTo(bcdMinusAbc);
		}

		@Test
		void unionAndIntersectionCommuteAsSets() {
			for (ConjunctionOperator operator : List.of(ConjunctionOperator.UNION, ConjunctionOperator.INTERSECTION)) {
				assertThat(algebra.evaluate(op(cls("abc"), operator, cls("cde"))))
						.containsExactlyInAnyOrderElementsOf(algebra.evaluate(op(cls("cde"), operator, cls("abc"))));
			}
		}

		@Test
		void chainsFoldLeft() {
			// (abc | cde) - bcd
			ClassOperand expression = op(op(cls("abc"), ConjunctionOperator.UNION, cls("cde")),
					ConjunctionOperator.DIFFERENCE, cls("bcd"));

			assertThat(algebra.evaluate(expression)).containsExactly("A", "E");
		}

		@Test
		void absorption() {
			ClassOperand a = cls("abc");
			ClassOperand b = cls("bcd");

			assertThat(algebra.evaluate(op(a, ConjunctionOperator.UNION, op(a, ConjunctionOperator.INTERSECTION, b))))
					.containsExactlyElementsOf(algebra.evaluate(a));
		}
	}

	@Nested
	@DisplayName("Predicates")
	class Predicates {

		@Test
		void predicateAloneSelectsFromTheWholeFont() {
			assertThat(algebra.evaluate(ClassOperand.of(GlyphPredicate.metric(Metric.WIDTH, Comparison.LESS, 201))))
					.containsExactly("f", "space", "acute", "grave");
		}

		@Test
		void rightPredicateFiltersTheLeftClassWhateverTheOperator() {
			ClassOperand narrowOrWide = cls("narrow");

			for (ConjunctionOperator operator : ConjunctionOperator.values()) {
				assertThat(algebra.evaluate(op(narrowOrWide, operator, wider(160))))
						.as(operator.symbol())
						.containsExactly("space");
			}
		}

		@Test
		void leftPredicateIsAppliedToTheWholeFont() {
			// a predicate on the left is materialized: width > 590 is A to Z
			assertThat(algebra.evaluate(op(wider(590), ConjunctionOperator.DIFFERENCE, cls("abc"))))
					.hasSize(23)
					.doesNotContain("A", "B", "C")
					.startsWith("D");
		}

		@Test
		void twoPredicatesCombineAsSets() {
			ClassOperand narrow = ClassOperand.of(GlyphPredicate.metric(Metric.WIDTH, Comparison.LESS, 160));

			assertThat(algebra.evaluate(op(narrow, ConjunctionOperator.UNION, wider(590)))).hasSize(29);
		}

		@Test
		void glyphsOutsideTheFontNeverMatch() {
			assertThat(algebra.matches("nothere", (metrics, name) -> true)).isFalse();
			assertThat(algebra.filter(List.of("a", "nothere"), (metrics, name) -> true)).containsExactly("a");
		}
	}
}

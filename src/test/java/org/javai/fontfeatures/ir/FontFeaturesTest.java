package org.javai.fontfeatures.ir;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class FontFeaturesTest {

	private final FontFeatures features = new FontFeatures();

	private static Substitution substitution(String from, String to) {
		return new Substitution(List.of(List.of(from)), List.of(List.of(to)), List.of(), List.of(), List.of(), null);
	}

	@Test
	void classesAreCopiedOnDefinition() {
		List<String> glyphs = new ArrayList<>(List.of("A", "B"));
		features.defineClass("ab", glyphs);
		glyphs.add("C");

		assertThat(features.namedClass("ab")).contains(List.of("A", "B"));
		assertThat(features.namedClass("missing")).isEmpty();
	}

	@Test
	void routinesAreRegisteredOnceByIdentity() {
		Routine first = new Routine("same");
		Routine second = new Routine("same");

		features.addRoutine(first);
		features.addRoutine(first);
		features.addRoutine(second);

		assertThat(features.routines()).containsExactly(first, second);
		assertThat(features.findRoutine("same")).containsSame(second);
		assertThat(features.findRoutine("other")).isEmpty();
	}

	@Test
	void featuresRegisterTheirRoutines() {
		Routine routine = new Routine();

		features.addFeature("liga", List.of(routine));
		features.addFeature("dlig", List.of(routine));

		assertThat(features.routines()).containsExactly(routine);
		assertThat(features.feature("liga")).containsExactly(routine);
		assertThat(features.feature("dlig").get(0)).isSameAs(routine);
		assertThat(features.feature("kern")).isEmpty();
		assertThat(features.features()).containsOnlyKeys("liga", "dlig");
	}

	@Test
	void anchorsPerGlyph() {
		features.addAnchor("A", "top", new Anchor(300, 700));
		features.addAnchor("A", "top", new Anchor(310, 700));

		assertThat(features.anchors("A")).containsExactly(Map.entry("top", new Anchor(310, 700)));
		assertThat(features.anchors("B")).isEmpty();
	}

	@Test
	void viewsAreReadOnly() {
		features.defineClass("a", List.of("a"));

		assertThatThrownBy(() -> features.namedClasses().clear()).isInstanceOf(UnsupportedOperationException.class);
		assertThatThrownBy(() -> features.routines().add(new Routine())).isInstanceOf(UnsupportedOperationException.class);
	}

	@Test
	void routineFlagsReachCurrentAndLaterRules() {
		Routine routine = new Routine("r");
		Substitution before = substitution("a", "b");
		routine.addRule(before);

		routine.setFlags(LookupFlag.mask(List.of(LookupFlag.IGNORE_MARKS)));
		Substitution after = substitution("b", "c");
		routine.addRule(after);

		assertThat(before.flags()).isEqualTo(8);
		assertThat(after.flags()).isEqualTo(8);
		assertThat(routine.toString()).isEqualTo("Routine(r, 2 rules, flags=8)");
	}

	@Test
	void rulesCheckTheirShape() {
		assertThatThrownBy(() -> new Positioning(List.of(List.of("A")), List.of(), List.of(), List.of(), List.of(), null))
				.isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> new Chaining(List.of(List.of("A")), List.of(), List.of(), List.of(), List.of(), null))
				.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void lookupFlagMaskRoundTrip() {
		assertThat(LookupFlag.fromMask(LookupFlag.mask(List.of(LookupFlag.RIGHT_TO_LEFT, LookupFlag.IGNORE_LIGATURES))))
				.containsExactlyInAnyOrder(LookupFlag.RIGHT_TO_LEFT, LookupFlag.IGNORE_LIGATURES);
		assertThat(LookupFlag.mask(List.of())).isZero();
	}
}

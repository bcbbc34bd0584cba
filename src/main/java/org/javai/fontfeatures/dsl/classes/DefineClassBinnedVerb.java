package org.javai.fontfeatures.dsl.classes;

import java.util.ArrayList;
import java.util.List;
import java.util.function.ToIntFunction;
import org.javai.fontfeatures.dsl.CompilationException;
import org.javai.fontfeatures.dsl.CompilationSession;
import org.javai.fontfeatures.dsl.DiagnosticKind;
import org.javai.fontfeatures.dsl.ReducedArgs;
import org.javai.fontfeatures.dsl.UndefinedReferenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code DefineClassBinned @base[metric,count] = <class expression>;}
 * <p>
 * Bins the glyphs of the expression by the metric and defines one class per bin,
 * {@code base_<metric><index>} with a 1-based index. The statement's value is the list
 * of defined class names.
 */
public class DefineClassBinnedVerb extends DefineClassVerb {

	private static final Logger logger = LoggerFactory.getLogger(DefineClassBinnedVerb.class);

	private final GlyphBinner binner = new GlyphBinner();

	public DefineClassBinnedVerb(CompilationSession session) {
		super(session);
		onRule("action", this::defineBinned);
	}

	private List<String> defineBinned(ReducedArgs args) {
		String base = className(args.text(0));
		Metric metric = metric(args.text(1));
		int binCount = args.get(2, Integer.class);
		if (binCount < 1) {
			throw new CompilationException("Bin count of @" + base + " must be at least 1", location());
		}
		List<String> glyphs = evaluate(args.get(3, ClassOperand.class));

		ToIntFunction<String> metricOf = glyph -> metric.valueOf(session.font().metrics(glyph)
				.orElseThrow(() -> UndefinedReferenceException.missingGlyph(glyph,
						"Cannot bin glyph '" + glyph + "' by " + metric.metricName() + ": not in the font", location())));
		int distinct = GlyphBinner.distinctValues(glyphs, metricOf);
		if (distinct < binCount) {
			session.report(DiagnosticKind.BINNING, "Only " + distinct + " distinct " + metric.metricName()
					+ " values for " + binCount + " bins of @" + base + "; trailing bins are empty", location());
		}

		List<String> defined = new ArrayList<>();
		List<GlyphBin> bins = binner.bin(glyphs, metricOf, binCount);
		for (int i = 0; i < bins.size(); i++) {
			String name = base + "_" + metric.metricName() + (i + 1);
			session.features().defineClass(name, bins.get(i).glyphs());
			defined.add(name);
		}
		logger.debug("Binned {} glyphs of @{} into {}", glyphs.size(), base, defined);
		return defined;
	}
}

package org.javai.fontfeatures.dsl.classes;

import java.util.Optional;
import java.util.function.ToIntFunction;
import org.javai.fontfeatures.font.GlyphMetrics;

/**
 * The glyph metrics that predicates, comparisons and binning can refer to.
 */
public enum Metric {

	WIDTH("width", GlyphMetrics::width),
	LSB("lsb", GlyphMetrics::lsb),
	RSB("rsb", GlyphMetrics::rsb),
	X_MIN("xMin", GlyphMetrics::xMin),
	X_MAX("xMax", GlyphMetrics::xMax),
	Y_MIN("yMin", GlyphMetrics::yMin),
	Y_MAX("yMax", GlyphMetrics::yMax),
	RISE("rise", GlyphMetrics::rise),
	RUN("run", GlyphMetrics::run),
	FULLWIDTH("fullwidth", GlyphMetrics::fullwidth);

	private final String metricName;
	private final ToIntFunction<GlyphMetrics> accessor;

	Metric(String metricName, ToIntFunction<GlyphMetrics> accessor) {
		this.metricName = metricName;
		this.accessor = accessor;
	}

	/**
	 * The name used in rule sources, e.g. {@code xMin}.
	 */
	public String metricName() {
		return metricName;
	}

	public int valueOf(GlyphMetrics metrics) {
		return accessor.applyAsInt(metrics);
	}

	public static Optional<Metric> forName(String name) {
		for (Metric metric : values()) {
			if (metric.metricName.equals(name)) {
				return Optional.of(metric);
			}
		}
		return Optional.empty();
	}
}

package org.javai.fontfeatures.dsl;

import org.javai.fontfeatures.grammar.SourceLocation;

/**
 * Thrown while reducing a statement that names a metric outside the metric vocabulary.
 */
public class UnknownMetricException extends CompilationException {

	private final String metricName;

	public UnknownMetricException(String metricName, SourceLocation location) {
		super("Unknown metric '" + metricName + "'", location);
		this.metricName = metricName;
	}

	public String metricName() {
		return metricName;
	}
}

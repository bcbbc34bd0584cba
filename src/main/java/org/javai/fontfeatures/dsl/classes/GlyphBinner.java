package org.javai.fontfeatures.dsl.classes;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.ToIntFunction;

/**
 * Splits glyphs into bins of similar metric values.
 * <p>
 * Bins are the optimal one-dimensional k-means clustering of the values, computed by
 * dynamic programming over the distinct values weighted by how many glyphs share them.
 * Glyphs with equal values always share a bin. Bins ascend by value. When there are
 * fewer distinct values than bins, the trailing bins are empty.
 */
public final class GlyphBinner {

	/**
	 * @param glyphs the glyphs to bin
	 * @param metricOf the metric value of a glyph
	 * @param binCount the number of bins, at least 1
	 * @return exactly {@code binCount} bins; glyphs keep their input order within a bin
	 */
	public List<GlyphBin> bin(List<String> glyphs, ToIntFunction<String> metricOf, int binCount) {
		if (binCount < 1) {
			throw new IllegalArgumentException("Bin count must be at least 1, was " + binCount);
		}
		Map<String, Integer> valueOf = new HashMap<>();
		TreeMap<Integer, Integer> weights = new TreeMap<>();
		for (String glyph : glyphs) {
			int value = valueOf.computeIfAbsent(glyph, metricOf::applyAsInt);
			weights.merge(value, 1, Integer::sum);
		}

		int[] values = weights.keySet().stream().mapToInt(Integer::intValue).toArray();
		int[] counts = weights.values().stream().mapToInt(Integer::intValue).toArray();
		int[] clusterOfValue = cluster(values, counts, Math.min(binCount, values.length));
		Map<Integer, Integer> clusterOf = new HashMap<>();
		for (int i = 0; i < values.length; i++) {
			clusterOf.put(values[i], clusterOfValue[i]);
		}

		List<List<String>> members = new ArrayList<>();
		long[] sums = new long[binCount];
		for (int b = 0; b < binCount; b++) {
			members.add(new ArrayList<>());
		}
		for (String glyph : glyphs) {
			int value = valueOf.get(glyph);
			int cluster = clusterOf.get(value);
			members.get(cluster).add(glyph);
			sums[cluster] += value;
		}

		List<GlyphBin> bins = new ArrayList<>();
		for (int b = 0; b < binCount; b++) {
			List<String> binGlyphs = members.get(b);
			double mean = binGlyphs.isEmpty() ? Double.NaN : (double) sums[b] / binGlyphs.size();
			bins.add(new GlyphBin(binGlyphs, mean));
		}
		return bins;
	}

	/**
	 * Number of distinct metric values among the glyphs.
	 */
	public static int distinctValues(List<String> glyphs, ToIntFunction<String> metricOf) {
		return (int) glyphs.stream().mapToInt(metricOf).distinct().count();
	}

	// Ckmeans: cost[m][i] is the least within-cluster sum of squares of values[0..i] in m + 1 clusters.
	private static int[] cluster(int[] values, int[] counts, int k) {
		int n = values.length;
		int[] assignment = new int[n];
		if (n == 0) {
			return assignment;
		}
		double[] weight = new double[n + 1];
		double[] sum = new double[n + 1];
		double[] squares = new double[n + 1];
		for (int i = 0; i < n; i++) {
			double w = counts[i];
			double x = values[i];
			weight[i + 1] = weight[i] + w;
			sum[i + 1] = sum[i] + w * x;
			squares[i + 1] = squares[i] + w * x * x;
		}

		double[][] cost = new double[k][n];
		int[][] start = new int[k][n];
		for (int i = 0; i < n; i++) {
			cost[0][i] = withinCost(weight, sum, squares, 0, i);
		}
		for (int m = 1; m < k; m++) {
			for (int i = m; i < n; i++) {
				double best = Double.POSITIVE_INFINITY;
				int bestStart = m;
				for (int j = m; j <= i; j++) {
					double candidate = cost[m - 1][j - 1] + withinCost(weight, sum, squares, j, i);
					if (candidate < best) {
						best = candidate;
						bestStart = j;
					}
				}
				cost[m][i] = best;
				start[m][i] = bestStart;
			}
		}

		int end = n - 1;
		for (int m = k - 1; m >= 0; m--) {
			int first = m == 0 ? 0 : start[m][end];
			for (int i = first; i <= end; i++) {
				assignment[i] = m;
			}
			end = first - 1;
		}
		return assignment;
	}

	private static double withinCost(double[] weight, double[] sum, double[] squares, int from, int to) {
		double w = weight[to + 1] - weight[from];
		double s = sum[to + 1] - sum[from];
		double q = squares[to + 1] - squares[from];
		return Math.max(0.0, q - s * s / w);
	}
}

package com.elphel.spatialstats.stats;

import java.util.Map;

import com.elphel.spatialstats.fft.BoundaryConvolver;

/**
 * Entry point: two-point statistics of one or two fields on a regular 1D, 2D or 3D grid.
 * <p>
 * The result tensor holds, for every lag vector r (|r_i| up to the cutoff of axis i), the mean of
 * A1[x + r] * A2[x] over the sampled pairs (or the raw sum when not normalized), with the lags of each axis
 * stored in FFT order as reported by {@link StatisticsResult#getLags(int)}.
 */
public class SpatialStatistics {

	public static StatisticsResult compute(
			DoubleGrid     field1,
			DoubleGrid     field2,
			Map<String, ?> options) {
		return compute(field1, field2, StatisticsParameters.fromOptions(options));
	}

	public static StatisticsResult compute(
			DoubleGrid           field1,
			DoubleGrid           field2,
			StatisticsParameters sp) {
		StatisticsEngine engine = new StatisticsEngine(new BoundaryConvolver(sp.threads_max));
		DoubleGrid tensor = engine.compute(field1, field2, sp);
		return LagIndexer.indexAndTruncate(tensor, sp.resolveCutoff(field1.getShape()));
	}

	public static StatisticsResult autoCorrelation(
			DoubleGrid           field,
			StatisticsParameters sp) {
		return compute(field, null, sp);
	}

	public static StatisticsResult crossCorrelation(
			DoubleGrid           field1,
			DoubleGrid           field2,
			StatisticsParameters sp) {
		return compute(field1, field2, sp);
	}
}

package bsts.forecast;

import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;

/**
 * Reductions of {@code positions × draws} sample matrices along the draws. Percentiles interpolate linearly between the order statistics
 * (the R-7 definition).
 */
final class Percentiles {
	private Percentiles() {}

	/** @param p the percentile, in {@code (0, 100]}. */
	static double[] alongDraws(final double[][] samples, final double p) {
		final var estimator = new Percentile().withEstimationType(Percentile.EstimationType.R_7);
		final var result = new double[samples.length];
		for (var x = 0; x < samples.length; ++x) {
			result[x] = estimator.evaluate(samples[x], p);
		}
		return result;
	}

	static double[] meanAlongDraws(final double[][] samples) {
		final var mean = new Mean();
		final var result = new double[samples.length];
		for (var x = 0; x < samples.length; ++x) {
			result[x] = mean.evaluate(samples[x]);
		}
		return result;
	}

	/** The pair of percentiles that bound a {@code 1 - alpha} interval, as {@code [low, high]}. */
	static double[] intervalPercentiles(final double alpha) {
		return new double[]{100 * alpha / 2, 100 - 100 * alpha / 2};
	}
}

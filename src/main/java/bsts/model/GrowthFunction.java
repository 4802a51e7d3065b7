package bsts.model;

import bsts.global.ModelException;
import bsts.global.ModelException.Reason;

/**
 * Contains the pure functions that evaluate the piecewise-linear trend over the positions {@code x = 0..length-1} of an axis.
 * <p>
 * Given the anchors {@code s_0 < ... < s_{M-1}} of the changepoints, a base rate {@code g} and the rate offsets {@code d_0..d_{M-1}}:
 * <pre>
 *   trend(x) = g·x + Σ_{i=1..M} (g + d_0 + ... + d_{i-1}) · (x - s_{i-1}) · [x > s_{i-1}]
 * </pre>
 * Segment zero is the global line {@code g·x}; the segment opened by each changepoint adds a line that starts at its anchor and grows at
 * the base rate plus the offsets accumulated so far. Every term vanishes at its own anchor, so the trend is continuous. Without
 * changepoints the trend is exactly {@code g·x}.
 */
public final class GrowthFunction {
	private GrowthFunction() {}

	/**
	 * Evaluates the trend for a single assignment of the growth parameters.
	 * @param offsets one rate offset per anchor.
	 * @return the trend value at each position.
	 */
	public static double[] evaluate(final int length, final int[] anchors, final double rate, final double[] offsets) {
		final var samples = evaluateSamples(length, anchors, new double[]{rate}, new double[][]{offsets});
		final var trend = new double[length];
		for (var x = 0; x < length; ++x) {
			trend[x] = samples[x][0];
		}
		return trend;
	}

	/**
	 * Evaluates the trend of each posterior draw independently.
	 * @param rateDraws the base rate of each draw.
	 * @param offsetDraws the {@code draws × anchors} rate offsets.
	 * @return the {@code length × draws} matrix of trend values.
	 */
	public static double[][] evaluateSamples(final int length, final int[] anchors, final double[] rateDraws, final double[][] offsetDraws) {
		final var draws = rateDraws.length;
		if (offsetDraws.length != draws && anchors.length > 0) {
			throw new ModelException(
					Reason.INVALID_ARGUMENT,
					"there are " + draws + " growth rate draws but " + offsetDraws.length + " changepoint offset draws"
			);
		}
		final var segmentRates = segmentRates(anchors.length, rateDraws, offsetDraws);
		final var trend = new double[length][draws];
		for (var x = 0; x < length; ++x) {
			for (var d = 0; d < draws; ++d) {
				trend[x][d] = segmentRates[0][d] * x;
			}
		}
		for (var i = 1; i <= anchors.length; ++i) {
			final var anchor = anchors[i - 1];
			for (var x = anchor + 1; x < length; ++x) {
				for (var d = 0; d < draws; ++d) {
					trend[x][d] += segmentRates[i][d] * (x - anchor);
				}
			}
		}
		return trend;
	}

	/** The rate of each segment and draw: the base rate for segment zero and base plus the cumulative offsets after it. */
	private static double[][] segmentRates(final int anchors, final double[] rateDraws, final double[][] offsetDraws) {
		final var rates = new double[anchors + 1][];
		rates[0] = rateDraws.clone();
		final var accumulatedOffsets = new double[rateDraws.length];
		for (var i = 1; i <= anchors; ++i) {
			rates[i] = new double[rateDraws.length];
			for (var d = 0; d < rateDraws.length; ++d) {
				if (offsetDraws[d].length != anchors) {
					throw new ModelException(
							Reason.INVALID_ARGUMENT,
							"draw " + d + " has " + offsetDraws[d].length + " changepoint offsets but there are " + anchors + " changepoints"
					);
				}
				accumulatedOffsets[d] += offsetDraws[d][i - 1];
				rates[i][d] = rateDraws[d] + accumulatedOffsets[d];
			}
		}
		return rates;
	}
}

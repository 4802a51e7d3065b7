package bsts.model;

import bsts.global.ModelException;
import bsts.global.ModelException.Reason;

import java.time.Instant;

/** Contains the pure function that builds the Fourier seasonality features of a sequence of instants. */
public final class FourierFeatures {
	static final double SECONDS_PER_DAY = 24 * 3600d;

	private FourierFeatures() {}

	/**
	 * Builds the {@code timestamps.length × 2·order} feature matrix of a periodic effect. For each harmonic {@code i} in
	 * {@code [0, order)} column {@code 2i} holds {@code sin(2π(i+1)t/period)} and column {@code 2i+1} holds {@code cos(2π(i+1)t/period)},
	 * where {@code t} is the number of days elapsed since the unix epoch.
	 * <p>
	 * The epoch is fixed, so evaluating the same instants always yields the same features no matter which window they belong to.
	 * @param period length of the period in days.
	 * @param order number of sine/cosine pairs.
	 */
	public static double[][] generate(final Instant[] timestamps, final double period, final int order) {
		if (!(period > 0) || Double.isInfinite(period)) {
			throw new ModelException(Reason.INVALID_ARGUMENT, "the seasonality period should be a positive number of days but was " + period);
		}
		if (order < 1) {
			throw new ModelException(Reason.INVALID_ARGUMENT, "the Fourier order should be at least 1 but was " + order);
		}
		final var features = new double[timestamps.length][2 * order];
		for (var row = 0; row < timestamps.length; ++row) {
			final var t = elapsedDays(timestamps[row]);
			for (var i = 0; i < order; ++i) {
				final var angle = 2.0 * (i + 1) * Math.PI * t / period;
				features[row][2 * i] = Math.sin(angle);
				features[row][2 * i + 1] = Math.cos(angle);
			}
		}
		return features;
	}

	/** Days elapsed since 1970-01-01T00:00Z. Sub-second precision is dropped. */
	public static double elapsedDays(final Instant instant) {
		return instant.getEpochSecond() / SECONDS_PER_DAY;
	}
}

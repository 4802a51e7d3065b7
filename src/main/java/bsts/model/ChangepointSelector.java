package bsts.model;

import bsts.global.ModelException;
import bsts.global.ModelException.Reason;

import fj.data.List;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;

/** Contains the pure functions that place changepoints and anchor them to the positions of a time axis. */
public final class ChangepointSelector {
	private static final BigInteger NANOS_PER_SECOND = BigInteger.valueOf(1_000_000_000L);

	private ChangepointSelector() {}

	/**
	 * Anchors each changepoint to the position of the nearest instant of {@code axis}. When two positions are equally near, the earlier
	 * one wins.
	 * @param axis ascending instants.
	 * @return one index into {@code axis} per changepoint, in changepoint order.
	 */
	public static int[] select(final List<Instant> changepoints, final Instant[] axis) {
		if (changepoints.isNotEmpty() && axis.length == 0) {
			throw new ModelException(Reason.INVALID_ARGUMENT, "changepoints cannot be anchored to an empty axis");
		}
		return changepoints.map(changepoint -> nearest(changepoint, axis)).toJavaList().stream().mapToInt(Integer::intValue).toArray();
	}

	private static int nearest(final Instant target, final Instant[] axis) {
		var best = 0;
		var bestDistance = Duration.between(axis[0], target).abs();
		for (var i = 1; i < axis.length; ++i) {
			final var distance = Duration.between(axis[i], target).abs();
			if (distance.compareTo(bestDistance) < 0) {
				best = i;
				bestDistance = distance;
			}
		}
		return best;
	}

	/**
	 * Places {@code count} changepoints evenly in time strictly between {@code first} and {@code last}: the interior points of
	 * {@code count + 2} equally spaced instants spanning the range.
	 */
	public static List<Instant> evenlySpaced(final Instant first, final Instant last, final int count) {
		if (count < 0) {
			throw new ModelException(Reason.INVALID_ARGUMENT, "the number of changepoints cannot be negative but was " + count);
		}
		final var span = toNanos(Duration.between(first, last));
		final var intervals = BigInteger.valueOf(count + 1L);
		return List.range(1, count + 1).map(k -> {
			final var offset = span.multiply(BigInteger.valueOf(k)).divide(intervals);
			final var seconds = offset.divideAndRemainder(NANOS_PER_SECOND);
			return first.plusSeconds(seconds[0].longValueExact()).plusNanos(seconds[1].longValueExact());
		});
	}

	private static BigInteger toNanos(final Duration duration) {
		return BigInteger.valueOf(duration.getSeconds()).multiply(NANOS_PER_SECOND).add(BigInteger.valueOf(duration.getNano()));
	}
}

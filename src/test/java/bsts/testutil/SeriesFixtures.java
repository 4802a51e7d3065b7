package bsts.testutil;

import bsts.model.ObservationSeries;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.function.IntToDoubleFunction;

public final class SeriesFixtures {
	public static final Instant START = Instant.parse("2020-01-01T00:00:00Z");

	private SeriesFixtures() {}

	public static Instant[] days(final Instant start, final int count) {
		final var timestamps = new Instant[count];
		for (var i = 0; i < count; ++i) {
			timestamps[i] = start.plus(i, ChronoUnit.DAYS);
		}
		return timestamps;
	}

	public static ObservationSeries daily(final int count, final IntToDoubleFunction value) {
		final var values = new double[count];
		for (var i = 0; i < count; ++i) {
			values[i] = value.applyAsDouble(i);
		}
		return ObservationSeries.of(days(START, count), values);
	}

	/** A noisy line with a weekly wave, never constant. */
	public static ObservationSeries dailyWithWeeklyWave(final int count) {
		return daily(count, i -> 10 + 0.3 * i + 2 * Math.sin(2 * Math.PI * i / 7) + ((i * 7919) % 13) / 13d);
	}
}

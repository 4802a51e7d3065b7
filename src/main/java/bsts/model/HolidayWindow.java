package bsts.model;

import bsts.global.ModelException;
import bsts.global.ModelException.Reason;

import java.time.Instant;

/**
 * A holiday effect active strictly between {@code start} and {@code end}. Its feature is an indicator scaled by {@code scale}, which the
 * model sets to the mean of the target it was added to so the coefficient is expressed relative to the series level.
 */
public record HolidayWindow(String name, Instant start, Instant end, double scale) {
	public HolidayWindow {
		if (name == null || name.isBlank()) {
			throw new ModelException(Reason.INVALID_ARGUMENT, "holidays must be named");
		}
		if (start == null || end == null || end.isBefore(start)) {
			throw new ModelException(Reason.INVALID_ARGUMENT, "the holiday " + name + " needs a start that precedes its end");
		}
	}

	public double[] feature(final Instant[] axis) {
		final var feature = new double[axis.length];
		for (var i = 0; i < axis.length; ++i) {
			feature[i] = axis[i].isAfter(start) && axis[i].isBefore(end) ? scale : 0d;
		}
		return feature;
	}
}

package bsts.model;

import bsts.global.ModelException;
import bsts.global.ModelException.Reason;

import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * An ordered sequence of (timestamp, value) observations together with the feature columns derived from, or supplied alongside, it.
 * Every column has one element per observation. Instances are immutable: {@link #withColumn} returns a new series.
 */
public final class ObservationSeries {
	private final Instant[] timestamps;
	private final double[] values;
	private final Map<String, double[]> columns;

	private ObservationSeries(final Instant[] timestamps, final double[] values, final Map<String, double[]> columns) {
		this.timestamps = timestamps;
		this.values = values;
		this.columns = columns;
	}

	/**
	 * @param timestamps strictly ascending observation instants.
	 * @param values the target value observed at each instant.
	 */
	public static ObservationSeries of(final Instant[] timestamps, final double[] values) {
		return of(timestamps, values, Map.of());
	}

	/**
	 * @param columns already populated fields (typically regressors), each aligned with {@code timestamps}.
	 */
	public static ObservationSeries of(final Instant[] timestamps, final double[] values, final Map<String, double[]> columns) {
		if (timestamps == null) {
			throw new ModelException(Reason.MISSING_FIELD, "the series has no timestamp field");
		}
		if (values == null) {
			throw new ModelException(Reason.MISSING_FIELD, "the series has no target field");
		}
		if (timestamps.length != values.length) {
			throw new ModelException(
					Reason.MISSING_FIELD,
					"the series has " + timestamps.length + " timestamps but " + values.length + " target values"
			);
		}
		for (var i = 0; i < timestamps.length; ++i) {
			if (timestamps[i] == null) {
				throw new ModelException(Reason.MISSING_FIELD, "the timestamp at position " + i + " is missing");
			}
			if (i > 0 && !timestamps[i].isAfter(timestamps[i - 1])) {
				throw new ModelException(
						Reason.INVALID_ARGUMENT,
						"timestamps must be strictly ascending but " + timestamps[i] + " follows " + timestamps[i - 1]
				);
			}
		}
		var series = new ObservationSeries(timestamps.clone(), values.clone(), Map.of());
		for (var column : columns.entrySet()) {
			series = series.withColumn(column.getKey(), column.getValue());
		}
		return series;
	}

	public int size() {
		return timestamps.length;
	}

	public Instant timestamp(final int index) {
		return timestamps[index];
	}

	public Instant[] timestamps() {
		return timestamps.clone();
	}

	public double[] values() {
		return values.clone();
	}

	public Instant first() {
		return timestamps[0];
	}

	public Instant last() {
		return timestamps[timestamps.length - 1];
	}

	public boolean hasColumn(final String name) {
		return columns.containsKey(name);
	}

	public Optional<double[]> column(final String name) {
		return Optional.ofNullable(columns.get(name)).map(double[]::clone);
	}

	public Set<String> columnNames() {
		return columns.keySet();
	}

	/** Returns a series that also has the specified column, replacing any previous column with the same name. */
	public ObservationSeries withColumn(final String name, final double[] column) {
		if (name == null || name.isBlank()) {
			throw new ModelException(Reason.INVALID_ARGUMENT, "feature columns must be named");
		}
		if (column.length != timestamps.length) {
			throw new ModelException(
					Reason.INVALID_ARGUMENT,
					"column " + name + " has " + column.length + " elements but the series has " + timestamps.length
			);
		}
		final var newColumns = new LinkedHashMap<>(columns);
		newColumns.put(name, column.clone());
		return new ObservationSeries(timestamps, values, Collections.unmodifiableMap(newColumns));
	}

	public double targetMean() {
		return Arrays.stream(values).average().orElse(Double.NaN);
	}

	/** Sample standard deviation (n - 1 denominator) of the target values. */
	public double targetStandardDeviation() {
		if (values.length < 2) {
			return Double.NaN;
		}
		final var mean = targetMean();
		var sumOfSquares = 0d;
		for (double value : values) {
			sumOfSquares += (value - mean) * (value - mean);
		}
		return Math.sqrt(sumOfSquares / (values.length - 1));
	}

	@Override
	public String toString() {
		return "ObservationSeries(size=" + size() + ", columns=" + columns.keySet() + ")";
	}
}

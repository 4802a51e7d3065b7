package bsts.model;

import bsts.global.ModelException;
import bsts.global.ModelException.Reason;

import fj.data.List;

import java.util.LinkedHashMap;

/**
 * A periodic effect approximated by {@code order} sine/cosine pairs. The {@code 2·order} feature columns of a seasonality are stored in the
 * series under names of the form {@code f_<period>_<term>}, where {@code term} is the zero based column index within the seasonality
 * ({@code 2i} for the sine and {@code 2i+1} for the cosine of harmonic {@code i}). The name alone is enough to rebuild the column on any
 * other axis, which is what the forecast relies on.
 */
public record Seasonality(double period, int order) {
	static final String COLUMN_PREFIX = "f_";

	public Seasonality {
		if (!(period > 0) || Double.isInfinite(period)) {
			throw new ModelException(Reason.INVALID_ARGUMENT, "the seasonality period should be a positive number of days but was " + period);
		}
		if (order < 1) {
			throw new ModelException(Reason.INVALID_ARGUMENT, "the Fourier order should be at least 1 but was " + order);
		}
	}

	/** A single feature column of a seasonality. */
	public record Term(double period, int index) {
		public String columnName() {
			return COLUMN_PREFIX + period + "_" + index;
		}

		int harmonic() {
			return index / 2;
		}
	}

	public int width() {
		return 2 * order;
	}

	public List<Term> terms() {
		return List.range(0, width()).map(index -> new Term(period, index));
	}

	public List<String> columnNames() {
		return terms().map(Term::columnName);
	}

	public static boolean isSeasonalityColumn(final String name) {
		return name.startsWith(COLUMN_PREFIX);
	}

	/** Inverse of {@link Term#columnName()}. */
	public static Term parseColumnName(final String name) {
		final var separator = name.lastIndexOf('_');
		if (!isSeasonalityColumn(name) || separator < COLUMN_PREFIX.length()) {
			throw unparseable(name, null);
		}
		try {
			final var period = Double.parseDouble(name.substring(COLUMN_PREFIX.length(), separator));
			final var index = Integer.parseInt(name.substring(separator + 1));
			if (!(period > 0) || Double.isInfinite(period) || index < 0) {
				throw unparseable(name, null);
			}
			return new Term(period, index);
		} catch (NumberFormatException e) {
			throw unparseable(name, e);
		}
	}

	/**
	 * Rebuilds the seasonalities whose columns are named in {@code columnNames}, in order of first appearance. For each period the order
	 * is the smallest one that covers the highest term index found.
	 */
	public static List<Seasonality> fromColumnNames(final Iterable<String> columnNames) {
		final var highestTermByPeriod = new LinkedHashMap<Double, Integer>();
		for (var name : columnNames) {
			final var term = parseColumnName(name);
			highestTermByPeriod.merge(term.period(), term.index(), Math::max);
		}
		return List.iterableList(highestTermByPeriod.entrySet())
				.map(entry -> new Seasonality(entry.getKey(), entry.getValue() / 2 + 1));
	}

	private static ModelException unparseable(final String name, final Throwable cause) {
		final var message = "cannot recover the period and term of the seasonality column `" + name + "`";
		return cause == null
				? new ModelException(Reason.UNPARSEABLE_FEATURE_NAME, message)
				: new ModelException(Reason.UNPARSEABLE_FEATURE_NAME, message, cause);
	}
}

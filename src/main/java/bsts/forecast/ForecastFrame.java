package bsts.forecast;

import fj.data.List;

import java.time.Instant;

/**
 * The result of a forecast: one row per timestamp in ascending order, the fitted historical rows (if requested) first.
 */
public record ForecastFrame(List<Row> rows) {

	/**
	 * @param estimate the median of the noiseless posterior mean.
	 * @param lower the lower bound of the credible interval of the posterior predictive.
	 * @param upper the upper bound of the credible interval of the posterior predictive.
	 * @param historical whether the timestamp belongs to the observed series.
	 */
	public record Row(Instant timestamp, double estimate, double lower, double upper, boolean historical) {}

	public int size() {
		return rows.length();
	}

	public Row row(final int index) {
		return rows.index(index);
	}

	public List<Row> history() {
		return rows.filter(Row::historical);
	}

	public List<Row> future() {
		return rows.filter(row -> !row.historical());
	}
}

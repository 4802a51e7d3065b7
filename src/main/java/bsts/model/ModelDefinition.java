package bsts.model;

import bsts.global.ModelException;
import bsts.global.ModelException.Reason;

import fj.data.List;

import java.time.Instant;

/**
 * A snapshot of everything that determines the latent mean of a model: its configuration, the observed series with its feature columns
 * and the names of the columns each component group reads.
 * @param anchors the series position each changepoint is anchored to.
 * @param seasonalityColumns the stored seasonality feature column names, in coefficient order.
 */
public record ModelDefinition(
		ModelConfiguration configuration,
		ObservationSeries series,
		List<Instant> changepoints,
		int[] anchors,
		List<String> seasonalityColumns,
		List<HolidayWindow> holidays,
		List<String> regressors
) {

	public String name() {
		return configuration.name();
	}

	/** The design over the observed timestamps, read from the series' feature columns. */
	public LatentDesign fittingDesign() {
		return new LatentDesign(
				series.timestamps(),
				configuration.intercept(),
				configuration.growth(),
				anchors.clone(),
				Seasonality.fromColumnNames(seasonalityColumns),
				columns(seasonalityColumns),
				columns(holidays.map(HolidayWindow::name)),
				columns(regressors)
		);
	}

	private double[][] columns(final List<String> names) {
		final var matrix = new double[series.size()][names.length()];
		var j = 0;
		for (var name : names) {
			final var column = series.column(name)
					.orElseThrow(() -> new ModelException(Reason.MISSING_FIELD, "the series has no column named " + name));
			for (var x = 0; x < column.length; ++x) {
				matrix[x][j] = column[x];
			}
			++j;
		}
		return matrix;
	}
}

package bsts.forecast;

import bsts.global.ModelException;
import bsts.global.ModelException.Reason;
import lombok.With;

import java.time.Period;
import java.time.temporal.TemporalAmount;
import java.util.Map;

/**
 * What to forecast.
 * @param horizon number of future steps.
 * @param step the distance between consecutive future timestamps, either a {@link java.time.Duration} or a calendar
 * {@link Period} (evaluated in UTC).
 * @param includeHistory prefix the forecast with the fitted values of the observed timestamps.
 * @param covariates future values of the regressors by name, one per future step.
 * @param alpha the credible intervals cover {@code 1 - alpha} of the posterior predictive mass.
 */
@With
public record ForecastRequest(
		int horizon,
		TemporalAmount step,
		boolean includeHistory,
		Map<String, double[]> covariates,
		double alpha
) {
	public static final double DEFAULT_ALPHA = 0.05;

	public ForecastRequest {
		if (horizon < 1) {
			throw new ModelException(Reason.INVALID_ARGUMENT, "the forecast horizon should be positive but was " + horizon);
		}
		if (step == null) {
			throw new ModelException(Reason.INVALID_ARGUMENT, "a forecast step is required");
		}
		if (!(alpha > 0 && alpha < 1)) {
			throw new ModelException(Reason.INVALID_ARGUMENT, "alpha should be inside (0, 1) but was " + alpha);
		}
		covariates = covariates == null ? Map.of() : Map.copyOf(covariates);
		for (var covariate : covariates.entrySet()) {
			if (covariate.getValue().length != horizon) {
				throw new ModelException(
						Reason.INVALID_ARGUMENT,
						"the covariate " + covariate.getKey() + " has " + covariate.getValue().length + " values but the horizon is " + horizon
				);
			}
		}
	}

	/** Daily steps, history included, 95% intervals. */
	public static ForecastRequest days(final int horizon) {
		return new ForecastRequest(horizon, Period.ofDays(1), true, Map.of(), DEFAULT_ALPHA);
	}
}

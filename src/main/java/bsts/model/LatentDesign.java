package bsts.model;

import bsts.global.ModelComponent;
import bsts.global.ModelException;
import bsts.global.ModelException.Reason;
import bsts.global.SampleEnsemble;
import bsts.inference.ParameterValues;
import bsts.inference.PosteriorSampleSet;

import fj.data.List;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The feature matrices of every enabled component evaluated over one time axis. The same design evaluates the latent mean for a single
 * parameter assignment (what the inference engine scores) and for a whole posterior sample set (what the forecast aggregates), so the
 * fitted and the forecast means are computed by the same arithmetic.
 * @param seasonalities the seasonalities whose columns, in this order, form {@code seasonality}.
 * @param seasonality {@code axis × seasonality columns}.
 * @param holidays {@code axis × holidays}.
 * @param regressors {@code axis × regressors}.
 */
public record LatentDesign(
		Instant[] axis,
		boolean intercept,
		boolean growth,
		int[] anchors,
		List<Seasonality> seasonalities,
		double[][] seasonality,
		double[][] holidays,
		double[][] regressors
) {

	public int length() {
		return axis.length;
	}

	// single assignment

	public double[] trend(final ParameterValues parameters) {
		if (!growth) {
			return new double[length()];
		}
		final var offsets = anchors.length == 0 ? new double[0] : parameters.vector(ModelComponent.CHANGEPOINT_OFFSET);
		return GrowthFunction.evaluate(length(), anchors, parameters.scalar(ModelComponent.GROWTH), offsets);
	}

	public double[] seasonality(final ParameterValues parameters) {
		return combine(seasonality, ModelComponent.SEASONALITY, parameters);
	}

	public double[] holidays(final ParameterValues parameters) {
		return combine(holidays, ModelComponent.HOLIDAY, parameters);
	}

	public double[] regressors(final ParameterValues parameters) {
		return combine(regressors, ModelComponent.REGRESSOR, parameters);
	}

	/** The additive latent mean: intercept + trend + seasonality + holidays + regressors. */
	public double[] mean(final ParameterValues parameters) {
		final var mean = trend(parameters);
		final var intercept = this.intercept ? parameters.scalar(ModelComponent.INTERCEPT) : 0d;
		final var seasonality = seasonality(parameters);
		final var holidays = holidays(parameters);
		final var regressors = regressors(parameters);
		for (var x = 0; x < mean.length; ++x) {
			mean[x] += intercept + seasonality[x] + holidays[x] + regressors[x];
		}
		return mean;
	}

	private static double[] combine(final double[][] features, final ModelComponent component, final ParameterValues parameters) {
		final var combined = new double[features.length];
		if (width(features) == 0) {
			return combined;
		}
		final var coefficients = parameters.vector(component);
		requireWidth(component, width(features), coefficients.length);
		for (var x = 0; x < features.length; ++x) {
			for (var j = 0; j < coefficients.length; ++j) {
				combined[x] += coefficients[j] * features[x][j];
			}
		}
		return combined;
	}

	// posterior samples, all of them `axis × draws`

	public double[][] trendSamples(final PosteriorSampleSet posterior) {
		if (!growth) {
			return new double[length()][posterior.draws()];
		}
		final var offsets = anchors.length == 0
				? new double[posterior.draws()][0]
				: posterior.require(ModelComponent.CHANGEPOINT_OFFSET).toMatrix();
		return GrowthFunction.evaluateSamples(length(), anchors, posterior.require(ModelComponent.GROWTH).scalars(), offsets);
	}

	public double[][] seasonalitySamples(final PosteriorSampleSet posterior) {
		return combineSamples(seasonality, 0, width(seasonality), ModelComponent.SEASONALITY, posterior);
	}

	/** The contribution of each seasonality separately, keyed by period. */
	public Map<Double, double[][]> seasonalitySamplesByPeriod(final PosteriorSampleSet posterior) {
		final var byPeriod = new LinkedHashMap<Double, double[][]>();
		var firstColumn = 0;
		for (var seasonality : seasonalities) {
			byPeriod.put(
					seasonality.period(),
					combineSamples(this.seasonality, firstColumn, seasonality.width(), ModelComponent.SEASONALITY, posterior)
			);
			firstColumn += seasonality.width();
		}
		return byPeriod;
	}

	public double[][] holidaySamples(final PosteriorSampleSet posterior) {
		return combineSamples(holidays, 0, width(holidays), ModelComponent.HOLIDAY, posterior);
	}

	public double[][] regressorSamples(final PosteriorSampleSet posterior) {
		return combineSamples(regressors, 0, width(regressors), ModelComponent.REGRESSOR, posterior);
	}

	/** The noiseless latent mean of each draw. */
	public double[][] meanSamples(final PosteriorSampleSet posterior) {
		final var mean = trendSamples(posterior);
		final var intercept = this.intercept ? posterior.require(ModelComponent.INTERCEPT).scalars() : new double[posterior.draws()];
		for (var group : new double[][][]{seasonalitySamples(posterior), holidaySamples(posterior), regressorSamples(posterior)}) {
			for (var x = 0; x < mean.length; ++x) {
				for (var d = 0; d < intercept.length; ++d) {
					mean[x][d] += group[x][d];
				}
			}
		}
		for (var x = 0; x < mean.length; ++x) {
			for (var d = 0; d < intercept.length; ++d) {
				mean[x][d] += intercept[d];
			}
		}
		return mean;
	}

	private static double[][] combineSamples(
			final double[][] features,
			final int firstColumn,
			final int columns,
			final ModelComponent component,
			final PosteriorSampleSet posterior
	) {
		final var combined = new double[features.length][posterior.draws()];
		if (columns == 0) {
			return combined;
		}
		final SampleEnsemble coefficients = posterior.require(component);
		requireWidth(component, width(features), coefficients.width());
		for (var x = 0; x < features.length; ++x) {
			for (var d = 0; d < coefficients.draws(); ++d) {
				var accum = 0d;
				for (var j = firstColumn; j < firstColumn + columns; ++j) {
					accum += coefficients.get(d, j) * features[x][j];
				}
				combined[x][d] = accum;
			}
		}
		return combined;
	}

	private static int width(final double[][] features) {
		return features.length == 0 ? 0 : features[0].length;
	}

	private static void requireWidth(final ModelComponent component, final int features, final int coefficients) {
		if (features != coefficients) {
			throw new ModelException(
					Reason.INVALID_ARGUMENT,
					component + " has " + features + " feature columns but " + coefficients + " coefficients"
			);
		}
	}
}

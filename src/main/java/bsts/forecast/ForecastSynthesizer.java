package bsts.forecast;

import bsts.global.ModelComponent;
import bsts.global.ModelException;
import bsts.global.ModelException.Reason;
import bsts.inference.PosteriorSampleSet;
import bsts.model.ChangepointSelector;
import bsts.model.FourierFeatures;
import bsts.model.HolidayWindow;
import bsts.model.LatentDesign;
import bsts.model.ModelDefinition;
import bsts.model.Seasonality;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.random.RandomGenerator;

import fj.data.List;

import java.time.Duration;
import java.time.Instant;
import java.time.Period;
import java.time.ZoneOffset;
import java.time.temporal.TemporalAmount;
import java.util.Arrays;

/**
 * Contains the pure functions that turn the posterior of a fitted model into a forecast. The fitted model is never modified: the
 * components are re-evaluated over a fresh axis that spans the history and the requested horizon.
 */
@Slf4j
public final class ForecastSynthesizer {
	private ForecastSynthesizer() {}

	/**
	 * The posterior samples of a forecast, all of them {@code axis × draws}.
	 * @param historyLength how many of the first axis positions are observed timestamps.
	 * @param mean the noiseless latent mean of each draw.
	 * @param noised {@code mean} plus the observation noise of each draw, normal with the draw's noise scale as standard deviation.
	 */
	public record ForecastSamples(Instant[] axis, int historyLength, double[][] mean, double[][] noised) {}

	/**
	 * Forecasts the model described by {@code definition} from its posterior.
	 * @param random the source of the observation noise; seed it to make the interval bounds reproducible. The point estimates do not
	 * depend on it.
	 */
	public static ForecastFrame synthesize(
			final ModelDefinition definition,
			final PosteriorSampleSet posterior,
			final ForecastRequest request,
			final RandomGenerator random
	) {
		return reduce(sample(definition, posterior, request, random), request.alpha());
	}

	/**
	 * Simulates the posterior predictive over the axis of the request. The components are always evaluated over the observed timestamps
	 * followed by the future ones, so growth positions and changepoint anchors line up with the fit; the observed part is dropped
	 * afterwards when the request excludes history.
	 */
	public static ForecastSamples sample(
			final ModelDefinition definition,
			final PosteriorSampleSet posterior,
			final ForecastRequest request,
			final RandomGenerator random
	) {
		if (posterior.isEmpty()) {
			throw new ModelException(Reason.NOT_FITTED, "model " + definition.name() + " has no posterior samples to forecast from");
		}
		final var series = definition.series();
		final var future = futureTimestamps(series.last(), request.step(), request.horizon());
		final var fullAxis = new Instant[series.size() + future.length];
		System.arraycopy(series.timestamps(), 0, fullAxis, 0, series.size());
		System.arraycopy(future, 0, fullAxis, series.size(), future.length);

		final var fullMean = designOver(definition, fullAxis, series.size(), request).meanSamples(posterior);
		final var firstKept = request.includeHistory() ? 0 : series.size();
		final var axis = Arrays.copyOfRange(fullAxis, firstKept, fullAxis.length);
		final var mean = Arrays.copyOfRange(fullMean, firstKept, fullMean.length);

		final var noiseScale = posterior.require(ModelComponent.NOISE_SCALE).scalars();
		final var noised = new double[mean.length][];
		for (var x = 0; x < mean.length; ++x) {
			noised[x] = new double[mean[x].length];
			for (var d = 0; d < mean[x].length; ++d) {
				noised[x][d] = mean[x][d] + random.nextGaussian() * noiseScale[d];
			}
		}
		log.debug("sampled {} draws over {} positions for model {}", posterior.draws(), axis.length, definition.name());
		return new ForecastSamples(axis, series.size() - firstKept, mean, noised);
	}

	/**
	 * Reduces the samples to the frame: the median of the noiseless mean as point estimate and the {@code 100·alpha/2} and
	 * {@code 100 - 100·alpha/2} percentiles of the noised samples as bounds, the smaller one being the lower bound.
	 * <p>
	 * Beyond that plain min/max ordering, each bound is widened to the estimate where sampling noise leaves it outside, so
	 * {@code lower <= estimate <= upper} holds for every row.
	 */
	public static ForecastFrame reduce(final ForecastSamples samples, final double alpha) {
		final var estimates = Percentiles.alongDraws(samples.mean(), 50);
		final var percentiles = Percentiles.intervalPercentiles(alpha);
		final var first = Percentiles.alongDraws(samples.noised(), percentiles[0]);
		final var second = Percentiles.alongDraws(samples.noised(), percentiles[1]);
		final var rows = new ForecastFrame.Row[samples.axis().length];
		for (var x = 0; x < rows.length; ++x) {
			rows[x] = new ForecastFrame.Row(
					samples.axis()[x],
					estimates[x],
					Math.min(estimates[x], Math.min(first[x], second[x])),
					Math.max(estimates[x], Math.max(first[x], second[x])),
					x < samples.historyLength()
			);
		}
		return new ForecastFrame(List.arrayList(rows));
	}

	/** The {@code horizon} instants that follow {@code last} at {@code step} intervals, calendar steps being evaluated in UTC. */
	static Instant[] futureTimestamps(final Instant last, final TemporalAmount step, final int horizon) {
		final var origin = last.atOffset(ZoneOffset.UTC);
		final var timestamps = new Instant[horizon];
		var previous = last;
		for (var k = 1; k <= horizon; ++k) {
			final Instant next;
			if (step instanceof Period period) {
				next = origin.plus(period.multipliedBy(k)).toInstant();
			} else if (step instanceof Duration duration) {
				next = last.plus(duration.multipliedBy(k));
			} else {
				next = previous.atOffset(ZoneOffset.UTC).plus(step).toInstant();
			}
			if (!next.isAfter(previous)) {
				throw new ModelException(Reason.INVALID_ARGUMENT, "the forecast step " + step + " does not move forward from " + previous);
			}
			timestamps[k - 1] = next;
			previous = next;
		}
		return timestamps;
	}

	/**
	 * Re-evaluates every component of the model over {@code axis}. Seasonalities are rebuilt from the stored feature column names,
	 * holidays from their windows, and regressors take the observed values over the history and the request's covariates over the
	 * horizon.
	 */
	static LatentDesign designOver(
			final ModelDefinition definition,
			final Instant[] axis,
			final int historyLength,
			final ForecastRequest request
	) {
		final var seasonalities = Seasonality.fromColumnNames(definition.seasonalityColumns());
		return new LatentDesign(
				axis,
				definition.configuration().intercept(),
				definition.configuration().growth(),
				ChangepointSelector.select(definition.changepoints(), axis),
				seasonalities,
				seasonalityFeatures(seasonalities, axis),
				holidayFeatures(definition.holidays(), axis),
				regressorFeatures(definition, axis.length, historyLength, request)
		);
	}

	private static double[][] seasonalityFeatures(final List<Seasonality> seasonalities, final Instant[] axis) {
		final var blocks = seasonalities.map(seasonality -> FourierFeatures.generate(axis, seasonality.period(), seasonality.order()));
		final var width = seasonalities.foldLeft((accum, seasonality) -> accum + seasonality.width(), 0);
		final var features = new double[axis.length][width];
		var firstColumn = 0;
		for (var block : blocks) {
			for (var x = 0; x < axis.length; ++x) {
				System.arraycopy(block[x], 0, features[x], firstColumn, block[x].length);
			}
			firstColumn += block.length == 0 ? 0 : block[0].length;
		}
		return features;
	}

	private static double[][] holidayFeatures(final List<HolidayWindow> holidays, final Instant[] axis) {
		final var features = new double[axis.length][holidays.length()];
		var j = 0;
		for (var holiday : holidays) {
			final var feature = holiday.feature(axis);
			for (var x = 0; x < axis.length; ++x) {
				features[x][j] = feature[x];
			}
			++j;
		}
		return features;
	}

	private static double[][] regressorFeatures(
			final ModelDefinition definition,
			final int length,
			final int historyLength,
			final ForecastRequest request
	) {
		final var features = new double[length][definition.regressors().length()];
		var j = 0;
		for (var name : definition.regressors()) {
			final var observed = definition.series().column(name)
					.orElseThrow(() -> new ModelException(Reason.MISSING_FIELD, "the series has no column for the regressor " + name));
			final var future = request.covariates().get(name);
			if (future == null) {
				throw new ModelException(
						Reason.INVALID_ARGUMENT,
						"the forecast needs the future values of the regressor " + name + " but the request has covariates for "
								+ Arrays.toString(request.covariates().keySet().toArray())
				);
			}
			for (var x = 0; x < historyLength; ++x) {
				features[x][j] = observed[x];
			}
			for (var x = historyLength; x < length; ++x) {
				features[x][j] = future[x - historyLength];
			}
			++j;
		}
		return features;
	}
}

package bsts.forecast;

import bsts.global.ModelException;
import bsts.global.ModelException.Reason;
import bsts.inference.PosteriorSampleSet;
import bsts.model.ModelDefinition;

import fj.data.List;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Summaries of the fitted components over the observed timestamps: the data a presentation layer needs to draw the trend and the
 * seasonalities of a model.
 */
public final class ComponentDecomposition {
	private ComponentDecomposition() {}

	/**
	 * The trend fitted at an observed timestamp.
	 * @param mean the mean of the trend draws.
	 * @param lower the {@code 100·alpha/2} percentile of the trend draws.
	 * @param upper the {@code 100 - 100·alpha/2} percentile of the trend draws.
	 */
	public record TrendPoint(Instant timestamp, double observed, double mean, double lower, double upper) {}

	/** The median and the credible band of a component at one timestamp. */
	public record Band(Instant timestamp, double median, double lower, double upper) {}

	public static List<TrendPoint> trend(final ModelDefinition definition, final PosteriorSampleSet posterior, final double alpha) {
		requireFitted(definition, posterior);
		final var samples = definition.fittingDesign().trendSamples(posterior);
		final var means = Percentiles.meanAlongDraws(samples);
		final var percentiles = Percentiles.intervalPercentiles(requireAlpha(alpha));
		final var lower = Percentiles.alongDraws(samples, percentiles[0]);
		final var upper = Percentiles.alongDraws(samples, percentiles[1]);
		final var observed = definition.series().values();
		final var points = new TrendPoint[samples.length];
		for (var x = 0; x < points.length; ++x) {
			points[x] = new TrendPoint(definition.series().timestamp(x), observed[x], means[x], lower[x], upper[x]);
		}
		return List.arrayList(points);
	}

	/** The contribution of each seasonality, keyed by period. */
	public static Map<Double, List<Band>> seasonalities(
			final ModelDefinition definition,
			final PosteriorSampleSet posterior,
			final double alpha
	) {
		requireFitted(definition, posterior);
		final var percentiles = Percentiles.intervalPercentiles(requireAlpha(alpha));
		final var bands = new LinkedHashMap<Double, List<Band>>();
		definition.fittingDesign().seasonalitySamplesByPeriod(posterior).forEach((period, samples) -> {
			final var medians = Percentiles.alongDraws(samples, 50);
			final var lower = Percentiles.alongDraws(samples, percentiles[0]);
			final var upper = Percentiles.alongDraws(samples, percentiles[1]);
			final var periodBands = new Band[samples.length];
			for (var x = 0; x < samples.length; ++x) {
				periodBands[x] = new Band(definition.series().timestamp(x), medians[x], lower[x], upper[x]);
			}
			bands.put(period, List.arrayList(periodBands));
		});
		return bands;
	}

	private static void requireFitted(final ModelDefinition definition, final PosteriorSampleSet posterior) {
		if (posterior.isEmpty()) {
			throw new ModelException(Reason.NOT_FITTED, "model " + definition.name() + " has no posterior samples to summarize");
		}
	}

	private static double requireAlpha(final double alpha) {
		if (!(alpha > 0 && alpha < 1)) {
			throw new ModelException(Reason.INVALID_ARGUMENT, "alpha should be inside (0, 1) but was " + alpha);
		}
		return alpha;
	}
}

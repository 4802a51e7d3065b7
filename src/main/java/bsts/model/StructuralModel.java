package bsts.model;

import bsts.global.ImmutableEnumMap;
import bsts.global.ModelComponent;
import bsts.global.ModelException;
import bsts.global.ModelException.Reason;
import bsts.inference.InferenceConfig;
import bsts.inference.InferenceEngine;
import bsts.inference.PosteriorSampleSet;
import bsts.inference.PriorHandle;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import fj.data.List;

import java.time.Instant;
import java.util.Objects;

/**
 * A Bayesian structural time-series model of one observed series: intercept, piecewise-linear growth, Fourier seasonalities, holidays
 * and regressors, added up into one latent mean.
 * <p>
 * Usage: configure the feature groups ({@link #addSeasonality}, {@link #addHoliday}, {@link #addRegressor}), then {@link #fit} it, which
 * assembles the model on first use and runs the inference engine once. The resulting {@link #getPosterior() posterior} feeds the forecast.
 * Instances are not thread safe.
 */
@Slf4j
public class StructuralModel {
	@Getter
	private final ModelConfiguration configuration;
	private final InferenceEngine engine;
	private final ModelAssembler assembler;
	@Getter
	private final List<Instant> changepoints;

	@Getter
	private ObservationSeries series;
	private List<String> seasonalityColumns = List.nil();
	private List<HolidayWindow> holidays = List.nil();
	private List<String> regressors = List.nil();

	private ImmutableEnumMap<ModelComponent, PriorHandle> priors = ImmutableEnumMap.of();
	@Getter
	private ModelAssembler.LatentMean latentMean;
	private boolean likelihoodBound = false;
	@Getter
	private PosteriorSampleSet posterior = PosteriorSampleSet.EMPTY;

	public StructuralModel(final ObservationSeries series, final ModelConfiguration configuration, final InferenceEngine engine) {
		if (series == null) {
			throw new ModelException(Reason.MISSING_FIELD, "a model needs an observation series");
		}
		if (series.size() == 0) {
			throw new ModelException(Reason.MISSING_FIELD, "the observation series is empty");
		}
		this.series = series;
		this.configuration = Objects.requireNonNull(configuration, "configuration");
		this.engine = Objects.requireNonNull(engine, "engine");
		this.assembler = new ModelAssembler(engine);
		this.changepoints = configuration.changepointCount() > 0
				? ChangepointSelector.evenlySpaced(series.first(), series.last(), configuration.changepointCount())
				: requireInsideRange(configuration.changepoints(), series);
		log.debug("created model {} over {} observations with {} changepoints", configuration.name(), series.size(), changepoints.length());
	}

	private static List<Instant> requireInsideRange(final List<Instant> changepoints, final ObservationSeries series) {
		Instant previous = null;
		for (var changepoint : changepoints) {
			if (!changepoint.isAfter(series.first()) || !changepoint.isBefore(series.last())) {
				throw new ModelException(
						Reason.INVALID_ARGUMENT,
						"the changepoint " + changepoint + " is not strictly inside [" + series.first() + ", " + series.last() + "]"
				);
			}
			if (previous != null && !changepoint.isAfter(previous)) {
				throw new ModelException(Reason.INVALID_ARGUMENT, "changepoints must be strictly increasing but " + changepoint + " follows " + previous);
			}
			previous = changepoint;
		}
		return changepoints;
	}

	public String getName() {
		return configuration.name();
	}

	/**
	 * Adds a periodic effect approximated by {@code fourierOrder} sine/cosine pairs, storing its feature columns in the series.
	 * @param period length of the period in days.
	 */
	public StructuralModel addSeasonality(final double period, final int fourierOrder) {
		requireOpen();
		final var seasonality = new Seasonality(period, fourierOrder);
		if (Seasonality.fromColumnNames(seasonalityColumns).exists(existing -> existing.period() == period)) {
			throw new ModelException(Reason.INVALID_ARGUMENT, "a seasonality with period " + period + " was already added");
		}
		final var features = FourierFeatures.generate(series.timestamps(), period, fourierOrder);
		for (var term : seasonality.terms()) {
			final var column = new double[features.length];
			for (var x = 0; x < features.length; ++x) {
				column[x] = features[x][term.index()];
			}
			series = series.withColumn(term.columnName(), column);
		}
		seasonalityColumns = seasonalityColumns.append(seasonality.columnNames());
		return this;
	}

	/**
	 * Adds an effect active strictly between {@code start} and {@code end}. The indicator is scaled by the target mean.
	 */
	public StructuralModel addHoliday(final String name, final Instant start, final Instant end) {
		requireOpen();
		requireNewColumn(name);
		final var holiday = new HolidayWindow(name, start, end, series.targetMean());
		series = series.withColumn(name, holiday.feature(series.timestamps()));
		holidays = holidays.snoc(holiday);
		return this;
	}

	/** Adds a regressor read from the series column of the same name. */
	public StructuralModel addRegressor(final String name) {
		requireOpen();
		if (!series.hasColumn(name)) {
			throw new ModelException(Reason.MISSING_FIELD, "the series has no column for the regressor " + name);
		}
		if (regressors.exists(name::equals)) {
			throw new ModelException(Reason.INVALID_ARGUMENT, "the regressor " + name + " was already added");
		}
		regressors = regressors.snoc(name);
		return this;
	}

	/** Adds a regressor with the specified values, one per observation. */
	public StructuralModel addRegressor(final String name, final double[] values) {
		requireOpen();
		requireNewColumn(name);
		series = series.withColumn(name, values);
		return addRegressor(name);
	}

	public ModelDefinition definition() {
		return new ModelDefinition(
				configuration,
				series,
				changepoints,
				ChangepointSelector.select(changepoints, series.timestamps()),
				seasonalityColumns,
				holidays,
				regressors
		);
	}

	/**
	 * Declares the priors that are missing, builds the latent mean and binds the likelihood. The likelihood can only be bound once.
	 */
	public StructuralModel finalizeModel() {
		if (likelihoodBound) {
			throw new ModelException(Reason.ALREADY_FINALIZED, "the likelihood of model " + getName() + " is already bound");
		}
		ModelAssembler.requireSpread(series);
		final var definition = definition();
		priors = assembler.declarePriors(definition, priors);
		latentMean = assembler.assemble(definition);
		assembler.bindLikelihood(definition, latentMean, priors.get(ModelComponent.NOISE_SCALE));
		likelihoodBound = true;
		return this;
	}

	/**
	 * Samples the posterior, finalizing the model first if needed. Engine failures propagate unchanged.
	 */
	public StructuralModel fit(final InferenceConfig config) {
		if (!likelihoodBound) {
			finalizeModel();
		}
		log.info("fitting model {} with {} {} draws", getName(), config.draws(), config.method());
		final var result = engine.runInference(config);
		if (result == null || result.isEmpty()) {
			throw new ModelException(Reason.NOT_FITTED, "the inference engine returned no samples for model " + getName());
		}
		posterior = result;
		log.info("model {} fitted: {}", getName(), posterior);
		return this;
	}

	/** Replaces the posterior with externally obtained samples, e.g. a trace sampled by another process. */
	public StructuralModel withPosterior(final PosteriorSampleSet posterior) {
		this.posterior = Objects.requireNonNull(posterior, "posterior");
		return this;
	}

	public boolean isFitted() {
		return !posterior.isEmpty();
	}

	/** The posterior, rejecting models that were not fitted yet. */
	public PosteriorSampleSet requirePosterior() {
		if (!isFitted()) {
			throw new ModelException(Reason.NOT_FITTED, "model " + getName() + " has no posterior samples; fit it first");
		}
		return posterior;
	}

	public ImmutableEnumMap<ModelComponent, PriorHandle> getPriors() {
		return priors;
	}

	public List<String> getSeasonalityColumns() {
		return seasonalityColumns;
	}

	public List<HolidayWindow> getHolidays() {
		return holidays;
	}

	public List<String> getRegressors() {
		return regressors;
	}

	private void requireOpen() {
		if (likelihoodBound) {
			throw new ModelException(Reason.ALREADY_FINALIZED, "features cannot be added to model " + getName() + " after binding its likelihood");
		}
	}

	private void requireNewColumn(final String name) {
		if (series.hasColumn(name)) {
			throw new ModelException(Reason.INVALID_ARGUMENT, "the series already has a column named " + name);
		}
	}
}

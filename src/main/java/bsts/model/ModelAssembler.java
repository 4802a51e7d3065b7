package bsts.model;

import bsts.global.ImmutableEnumMap;
import bsts.global.ModelComponent;
import bsts.global.ModelException;
import bsts.global.ModelException.Reason;
import bsts.inference.InferenceEngine;
import bsts.inference.LatentExpression;
import bsts.inference.Prior;
import bsts.inference.PriorDeclaration;
import bsts.inference.PriorHandle;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import fj.data.List;

/**
 * Turns a {@link ModelDefinition} into the declarations an {@link InferenceEngine} needs: one prior per enabled component group, the
 * named deterministic aggregates and the observation likelihood.
 */
@Slf4j
@RequiredArgsConstructor
public class ModelAssembler {
	static final String SEASONALITY_AGGREGATE = "seasonality_hat";
	static final String HOLIDAYS_AGGREGATE = "holidays_hat";
	static final String REGRESSORS_AGGREGATE = "regressors_hat";
	static final String MEAN_AGGREGATE = "y_hat";

	private final InferenceEngine engine;

	/**
	 * The latent mean of a model and its observable parts, each evaluated over the observed timestamps.
	 */
	public record LatentMean(
			LatentExpression total,
			LatentExpression seasonality,
			LatentExpression holidays,
			LatentExpression regressors
	) {}

	/** What a prior declaration depends on, before knowing whether it is enabled. */
	private record PriorRequirement(ModelComponent component, boolean enabled, int width, Prior prior) {}

	/**
	 * Declares the prior of every enabled component group that is not declared yet.
	 * @param declared the handles of the priors declared by previous calls.
	 * @return {@code declared} plus the handles of the newly declared priors.
	 */
	public ImmutableEnumMap<ModelComponent, PriorHandle> declarePriors(
			final ModelDefinition definition,
			final ImmutableEnumMap<ModelComponent, PriorHandle> declared
	) {
		var handles = declared;
		for (var requirement : priorRequirements(definition)) {
			if (requirement.enabled && !handles.containsKey(requirement.component)) {
				final var declaration = new PriorDeclaration(
						requirement.component,
						requirement.component.parameterName(definition.name()),
						requirement.prior,
						requirement.width
				);
				log.debug("declaring {} with {} elements for model {}", declaration.parameterName(), declaration.width(), definition.name());
				handles = handles.put(requirement.component, engine.declarePrior(declaration));
			}
		}
		return handles;
	}

	private static List<PriorRequirement> priorRequirements(final ModelDefinition definition) {
		final var configuration = definition.configuration();
		final var scales = configuration.priorScales();
		final var series = definition.series();
		return List.arrayList(
				new PriorRequirement(ModelComponent.NOISE_SCALE, true, 1, Prior.halfCauchy(scales.noise())),
				new PriorRequirement(
						ModelComponent.SEASONALITY,
						definition.seasonalityColumns().isNotEmpty(),
						definition.seasonalityColumns().length(),
						Prior.laplace(0, scales.seasonality())
				),
				new PriorRequirement(
						ModelComponent.HOLIDAY,
						definition.holidays().isNotEmpty(),
						definition.holidays().length(),
						Prior.laplace(0, scales.holidays())
				),
				new PriorRequirement(
						ModelComponent.REGRESSOR,
						definition.regressors().isNotEmpty(),
						definition.regressors().length(),
						Prior.normal(0, scales.regressors())
				),
				new PriorRequirement(ModelComponent.GROWTH, configuration.growth(), 1, Prior.normal(0, scales.growth())),
				new PriorRequirement(
						ModelComponent.CHANGEPOINT_OFFSET,
						configuration.growth() && definition.anchors().length > 0,
						definition.anchors().length,
						Prior.laplace(0, scales.changepoints())
				),
				new PriorRequirement(
						ModelComponent.INTERCEPT,
						configuration.intercept(),
						1,
						configuration.intercept()
								? Prior.normal(series.targetMean(), series.targetStandardDeviation() * scales.interceptSpread())
								: null
				)
		);
	}

	/**
	 * Builds the latent mean over the observed timestamps and registers its aggregates with the engine. Only the aggregates of
	 * non-empty groups are registered.
	 */
	public LatentMean assemble(final ModelDefinition definition) {
		final var design = definition.fittingDesign();
		final var latentMean = new LatentMean(design::mean, design::seasonality, design::holidays, design::regressors);
		if (definition.seasonalityColumns().isNotEmpty()) {
			engine.declareDeterministic(aggregateName(SEASONALITY_AGGREGATE, definition), latentMean.seasonality());
		}
		if (definition.regressors().isNotEmpty()) {
			engine.declareDeterministic(aggregateName(REGRESSORS_AGGREGATE, definition), latentMean.regressors());
		}
		if (definition.holidays().isNotEmpty()) {
			engine.declareDeterministic(aggregateName(HOLIDAYS_AGGREGATE, definition), latentMean.holidays());
		}
		return latentMean;
	}

	/**
	 * Binds {@code (y - ȳ)/s ~ Normal((mean - ȳ)/s, σ)}, where ȳ and s are the mean and sample standard deviation of the observed target
	 * and σ is the noise-scale prior, and registers the unstandardized mean.
	 */
	public void bindLikelihood(final ModelDefinition definition, final LatentMean latentMean, final PriorHandle noise) {
		final var series = definition.series();
		final var location = series.targetMean();
		final var spread = requireSpread(series);
		final var observed = series.values();
		for (var x = 0; x < observed.length; ++x) {
			observed[x] = (observed[x] - location) / spread;
		}
		final LatentExpression standardizedMean = parameters -> {
			final var mean = latentMean.total().evaluate(parameters);
			for (var x = 0; x < mean.length; ++x) {
				mean[x] = (mean[x] - location) / spread;
			}
			return mean;
		};
		engine.bindLikelihood(standardizedMean, noise, observed);
		engine.declareDeterministic(aggregateName(MEAN_AGGREGATE, definition), latentMean.total());
		log.info("bound the likelihood of model {} to {} observations (mean {}, sd {})", definition.name(), observed.length, location, spread);
	}

	/** The sample standard deviation of the target, rejecting series it cannot standardize. */
	public static double requireSpread(final ObservationSeries series) {
		if (series.size() < 2) {
			throw new ModelException(
					Reason.DEGENERATE_SERIES,
					"at least two observations are needed to standardize the target but there are " + series.size()
			);
		}
		final var spread = series.targetStandardDeviation();
		if (!(spread > 0) || Double.isInfinite(spread)) {
			throw new ModelException(Reason.DEGENERATE_SERIES, "the target has standard deviation " + spread + " and cannot be standardized");
		}
		return spread;
	}

	private static String aggregateName(final String aggregate, final ModelDefinition definition) {
		return aggregate + "_" + definition.name();
	}
}

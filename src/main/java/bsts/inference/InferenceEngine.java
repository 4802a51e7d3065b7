package bsts.inference;

/**
 * Specifies what a structural model needs from the probabilistic back end that samples its posterior. The model declares its priors and
 * deterministic aggregates, binds one likelihood and then issues a single blocking {@link #runInference} call. Implementations own the
 * sampling state of exactly one model.
 */
public interface InferenceEngine {

	/** Creates the random variable described by the declaration. */
	PriorHandle declarePrior(PriorDeclaration declaration);

	/**
	 * Registers a named deterministic series so the engine can report it alongside the parameters (e.g. the seasonality contribution of
	 * the fitted model).
	 */
	void declareDeterministic(String name, LatentExpression expression);

	/**
	 * Binds the observation likelihood {@code observed ~ Normal(mean, noise)}.
	 * @param mean the latent mean, already on the same scale as {@code observed}.
	 * @param noise the handle of the noise-scale prior.
	 */
	void bindLikelihood(LatentExpression mean, PriorHandle noise, double[] observed);

	/**
	 * Samples the posterior of every declared prior. Failures propagate to the caller unchanged.
	 */
	PosteriorSampleSet runInference(InferenceConfig config);
}

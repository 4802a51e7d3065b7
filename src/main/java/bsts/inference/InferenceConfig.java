package bsts.inference;

import bsts.global.ModelException;
import lombok.With;

import java.util.Map;

/**
 * How an {@link InferenceEngine} should produce the posterior samples. The model passes it through untouched.
 * @param draws number of posterior samples to keep.
 * @param method the sampling or approximation algorithm.
 * @param mapInitialization start the chains at the maximum a posteriori estimate.
 * @param engineOptions free-form, engine specific settings (step sizes, tuning draws, chains...).
 */
@With
public record InferenceConfig(int draws, Method method, boolean mapInitialization, Map<String, Object> engineOptions) {

	public enum Method {
		NUTS,
		METROPOLIS,
		/** Variational approximation; the engine draws the samples from the fitted approximation. */
		ADVI
	}

	public static final InferenceConfig DEFAULT = new InferenceConfig(500, Method.NUTS, false, Map.of());

	public InferenceConfig {
		if (draws < 1) {
			throw new ModelException(ModelException.Reason.INVALID_ARGUMENT, "the number of draws should be positive but was " + draws);
		}
		if (method == null) {
			throw new ModelException(ModelException.Reason.INVALID_ARGUMENT, "an inference method is required");
		}
		engineOptions = engineOptions == null ? Map.of() : Map.copyOf(engineOptions);
	}
}

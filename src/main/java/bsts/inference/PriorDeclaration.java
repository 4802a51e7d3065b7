package bsts.inference;

import bsts.global.ModelComponent;
import bsts.global.ModelException;

/**
 * What a model asks an {@link InferenceEngine} to create for one parameter group: {@code width} independent elements sharing the same
 * {@link Prior}. The width is one for scalar components and the size of the feature group for vector components.
 */
public record PriorDeclaration(ModelComponent component, String parameterName, Prior prior, int width) {
	public PriorDeclaration {
		if (width < 1 || (!component.isVector() && width != 1)) {
			throw new ModelException(ModelException.Reason.INVALID_ARGUMENT, "invalid width " + width + " for " + component);
		}
	}

	/** Log density of one assignment of all the elements. */
	public double logDensity(double[] elements) {
		if (elements.length != width) {
			throw new ModelException(
					ModelException.Reason.INVALID_ARGUMENT,
					parameterName + " has " + width + " elements but " + elements.length + " values were given"
			);
		}
		var accum = 0d;
		for (double element : elements) {
			accum += prior.logDensity(element);
		}
		return accum;
	}
}

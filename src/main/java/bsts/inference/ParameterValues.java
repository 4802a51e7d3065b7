package bsts.inference;

import bsts.global.ImmutableEnumMap;
import bsts.global.ModelComponent;
import bsts.global.ModelException;

/** One assignment of values to the declared parameter groups, e.g. a single posterior draw or a sampler proposal. */
public record ParameterValues(ImmutableEnumMap<ModelComponent, double[]> values) {

	public static ParameterValues of(ModelComponent component, double... elements) {
		return new ParameterValues(ImmutableEnumMap.of(component, elements));
	}

	public ParameterValues with(ModelComponent component, double... elements) {
		return new ParameterValues(values.put(component, elements));
	}

	public double scalar(ModelComponent component) {
		return vector(component)[0];
	}

	public double[] vector(ModelComponent component) {
		return values.getSome(component)
				.orElseThrow(() -> new ModelException(ModelException.Reason.MISSING_FIELD, "no value assigned to " + component));
	}
}

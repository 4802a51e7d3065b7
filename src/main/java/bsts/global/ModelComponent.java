package bsts.global;

import java.util.Arrays;
import java.util.Optional;

/**
 * The closed set of parameter groups a structural model may declare. Each constant knows the prefix of the parameter name that an
 * inference engine sees, so the external {@code <prefix>_<modelName>} naming survives while the model itself works with typed keys.
 */
public enum ModelComponent {
	INTERCEPT("intercept", false),
	GROWTH("growth", false),
	CHANGEPOINT_OFFSET("changepoints", true),
	SEASONALITY("seasonality", true),
	HOLIDAY("holidays", true),
	REGRESSOR("regressors", true),
	NOISE_SCALE("sigma", false);

	private final String parameterPrefix;
	private final boolean isVector;

	ModelComponent(String parameterPrefix, boolean isVector) {
		this.parameterPrefix = parameterPrefix;
		this.isVector = isVector;
	}

	public String parameterPrefix() {
		return this.parameterPrefix;
	}

	public boolean isVector() {
		return this.isVector;
	}

	public String parameterName(final String modelName) {
		return parameterPrefix + "_" + modelName;
	}

	/** Inverse of {@link #parameterName(String)}. */
	public static Optional<ModelComponent> fromParameterName(final String parameterName, final String modelName) {
		return Arrays.stream(values())
				.filter(component -> component.parameterName(modelName).equals(parameterName))
				.findFirst();
	}
}

package bsts.model;

import bsts.global.ModelException;
import bsts.global.ModelException.Reason;
import lombok.With;

import fj.data.List;

import java.time.Instant;

/**
 * The structural choices of a model that do not depend on its data.
 * @param name identifies the model; it suffixes every parameter name the inference engine sees.
 * @param growth include the piecewise-linear trend.
 * @param intercept include the intercept.
 * @param changepoints explicit changepoint instants. Mutually exclusive with {@code changepointCount}.
 * @param changepointCount number of changepoints to spread evenly over the observed range. Mutually exclusive with {@code changepoints}.
 */
@With
public record ModelConfiguration(
		String name,
		boolean growth,
		boolean intercept,
		List<Instant> changepoints,
		int changepointCount,
		PriorScales priorScales
) {
	public ModelConfiguration {
		if (name == null || name.isBlank()) {
			throw new ModelException(Reason.MISSING_NAME, "specify a model name");
		}
		if (changepoints == null) {
			changepoints = List.nil();
		}
		if (changepointCount < 0) {
			throw new ModelException(Reason.INVALID_ARGUMENT, "the number of changepoints cannot be negative but was " + changepointCount);
		}
		if (changepoints.isNotEmpty() && changepointCount > 0) {
			throw new ModelException(
					Reason.CHANGEPOINT_CONFLICT,
					"either specify a list of changepoint dates or a number of them, not both"
			);
		}
		if (priorScales == null) {
			priorScales = PriorScales.DEFAULT;
		}
	}

	/** A configuration with an intercept, no growth and no changepoints. */
	public static ModelConfiguration named(final String name) {
		return new ModelConfiguration(name, false, true, List.nil(), 0, PriorScales.DEFAULT);
	}

	/** A copy with the specified explicit changepoints. Lombok generates no list-typed wither next to this one. */
	public ModelConfiguration withChangepoints(final Instant... changepoints) {
		return new ModelConfiguration(name, growth, intercept, List.arrayList(changepoints), changepointCount, priorScales);
	}
}

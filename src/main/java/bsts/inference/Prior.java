package bsts.inference;

import bsts.global.ModelException;
import org.apache.commons.math3.distribution.AbstractRealDistribution;
import org.apache.commons.math3.distribution.CauchyDistribution;
import org.apache.commons.math3.distribution.LaplaceDistribution;
import org.apache.commons.math3.distribution.NormalDistribution;

/**
 * A prior distribution of a single parameter element.
 * @param location the mean (normal), the median (laplace); ignored by the half-cauchy, which is anchored at zero.
 * @param scale the standard deviation (normal), the diversity (laplace) or the scale (half-cauchy).
 */
public record Prior(Family family, double location, double scale) {

	public enum Family {
		NORMAL,
		LAPLACE,
		HALF_CAUCHY
	}

	public Prior {
		if (!(scale > 0) || Double.isInfinite(scale)) {
			throw new ModelException(ModelException.Reason.INVALID_ARGUMENT, family + " prior needs a positive finite scale but got " + scale);
		}
	}

	public static Prior normal(double mean, double standardDeviation) {
		return new Prior(Family.NORMAL, mean, standardDeviation);
	}

	public static Prior laplace(double median, double diversity) {
		return new Prior(Family.LAPLACE, median, diversity);
	}

	public static Prior halfCauchy(double scale) {
		return new Prior(Family.HALF_CAUCHY, 0, scale);
	}

	/** Log of the prior density at {@code x}; {@code -Infinity} outside the support. */
	public double logDensity(double x) {
		return switch (family) {
			case NORMAL, LAPLACE -> distribution().logDensity(x);
			case HALF_CAUCHY -> x < 0 ? Double.NEGATIVE_INFINITY : Math.log(2) + distribution().logDensity(x);
		};
	}

	private AbstractRealDistribution distribution() {
		return switch (family) {
			case NORMAL -> new NormalDistribution(null, location, scale);
			case LAPLACE -> new LaplaceDistribution(null, location, scale);
			case HALF_CAUCHY -> new CauchyDistribution(null, 0, scale);
		};
	}
}

package bsts.inference;

/**
 * A deterministic, parameter dependent series: evaluated at one assignment of the declared parameters it yields one value per position
 * of the axis it was built on.
 */
@FunctionalInterface
public interface LatentExpression {
	double[] evaluate(ParameterValues parameters);
}

package bsts.model;

import bsts.global.ModelException;
import bsts.global.ModelException.Reason;
import lombok.With;

/**
 * Scale of the prior of each parameter group.
 * @param interceptSpread the intercept prior is a normal centered on the target mean whose standard deviation is this many target
 * standard deviations.
 */
@With
public record PriorScales(
		double noise,
		double seasonality,
		double holidays,
		double regressors,
		double growth,
		double changepoints,
		double interceptSpread
) {
	public static final PriorScales DEFAULT = new PriorScales(10, 10, 10, 10, 0.5, 0.5, 2);

	public PriorScales {
		for (double scale : new double[]{noise, seasonality, holidays, regressors, growth, changepoints, interceptSpread}) {
			if (!(scale > 0) || Double.isInfinite(scale)) {
				throw new ModelException(Reason.INVALID_ARGUMENT, "prior scales should be positive and finite but got " + scale);
			}
		}
	}
}

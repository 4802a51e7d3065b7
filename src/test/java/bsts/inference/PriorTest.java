package bsts.inference;

import bsts.global.ModelComponent;
import bsts.global.ModelException;
import net.jqwik.api.Example;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.DoubleRange;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class PriorTest {

	@Example
	void aNormalPriorShouldPeakAtItsMean() {
		var prior = Prior.normal(3, 2);
		assertEquals(-0.5 * Math.log(2 * Math.PI * 4), prior.logDensity(3), 1e-12);
	}

	@Example
	void aLaplacePriorShouldPeakAtItsMedian() {
		assertEquals(-Math.log(2 * 0.5), Prior.laplace(0, 0.5).logDensity(0), 1e-12);
	}

	@Example
	void aHalfCauchyPriorShouldHaveNoMassBelowZero() {
		var prior = Prior.halfCauchy(10);
		assertEquals(Double.NEGATIVE_INFINITY, prior.logDensity(-1e-9));
		assertEquals(Math.log(2 / (Math.PI * 10)), prior.logDensity(0), 1e-12);
	}

	@Property
	boolean theHalfCauchyDensityShouldDoubleTheCauchyDensity(@ForAll @DoubleRange(min = 0, max = 1e3) double x) {
		var halfCauchy = Math.exp(Prior.halfCauchy(10).logDensity(x));
		var cauchy = 1 / (Math.PI * 10 * (1 + (x / 10) * (x / 10)));
		return Math.abs(halfCauchy - 2 * cauchy) <= 1e-12;
	}

	@Example
	void nonPositiveScalesShouldBeRejected() {
		assertThrows(ModelException.class, () -> Prior.normal(0, 0));
		assertThrows(ModelException.class, () -> Prior.laplace(0, Double.NaN));
	}

	@Example
	void aDeclarationShouldAddTheDensityOfItsElements() {
		var declaration = new PriorDeclaration(ModelComponent.SEASONALITY, "seasonality_m", Prior.laplace(0, 10), 2);
		var prior = Prior.laplace(0, 10);
		assertEquals(prior.logDensity(1) + prior.logDensity(-2), declaration.logDensity(new double[]{1, -2}), 1e-12);
		assertThrows(ModelException.class, () -> declaration.logDensity(new double[]{1}));
	}

	@Example
	void scalarComponentsShouldOnlyBeDeclaredWithWidthOne() {
		var exception = assertThrows(
				ModelException.class,
				() -> new PriorDeclaration(ModelComponent.GROWTH, "growth_m", Prior.normal(0, 0.5), 2)
		);
		assertEquals(ModelException.Reason.INVALID_ARGUMENT, exception.reason());
	}
}

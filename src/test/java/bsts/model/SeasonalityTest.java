package bsts.model;

import bsts.global.ModelException;
import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.Example;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;
import net.jqwik.api.constraints.DoubleRange;
import net.jqwik.api.constraints.IntRange;

import fj.data.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SeasonalityTest {

	@Example
	void theColumnsShouldBeNamedAfterThePeriodAndTheTerm() {
		assertEquals(
				List.arrayList("f_7.0_0", "f_7.0_1", "f_7.0_2", "f_7.0_3"),
				new Seasonality(7, 2).columnNames()
		);
	}

	@Property
	void theColumnNamesShouldRecoverThePeriodAndTheOrder(
			@ForAll @DoubleRange(min = 0.01, max = 1e4) double period,
			@ForAll @IntRange(min = 1, max = 30) int order
	) {
		var recovered = Seasonality.fromColumnNames(new Seasonality(period, order).columnNames());
		assertEquals(1, recovered.length());
		assertEquals(period, recovered.head().period());
		assertTrue(recovered.head().order() >= order);
		assertEquals(order, recovered.head().order());
	}

	@Example
	void severalSeasonalitiesShouldBeRecoveredInOrderOfAppearance() {
		var names = new Seasonality(365.25, 3).columnNames().append(new Seasonality(7, 1).columnNames());
		assertEquals(List.arrayList(new Seasonality(365.25, 3), new Seasonality(7, 1)), Seasonality.fromColumnNames(names));
	}

	@Property
	void unparseableNamesShouldBeRejected(@ForAll("unparseableNames") String name) {
		var exception = assertThrows(ModelException.class, () -> Seasonality.parseColumnName(name));
		assertEquals(ModelException.Reason.UNPARSEABLE_FEATURE_NAME, exception.reason());
	}

	@Provide
	Arbitrary<String> unparseableNames() {
		return Arbitraries.of("f_", "f_7", "f_x_1", "f_7.0_", "f_7.0_-1", "f_-7.0_1", "g_7.0_1", "f_7.0_a", "f_NaN_0");
	}
}

package bsts.model;

import bsts.global.ModelException;
import bsts.global.ModelException.Reason;
import bsts.testutil.SeriesFixtures;
import net.jqwik.api.Example;

import fj.data.List;

import java.time.temporal.ChronoUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ModelConfigurationTest {

	@Example
	void explicitChangepointsShouldKeepTheOtherSettings() {
		var first = SeriesFixtures.START.plus(10, ChronoUnit.DAYS);
		var second = SeriesFixtures.START.plus(20, ChronoUnit.DAYS);
		var scales = PriorScales.DEFAULT.withGrowth(2);

		var configuration = ModelConfiguration.named("sales")
				.withGrowth(true)
				.withIntercept(false)
				.withPriorScales(scales)
				.withChangepoints(first, second);

		assertEquals(new ModelConfiguration("sales", true, false, List.arrayList(first, second), 0, scales), configuration);
	}

	@Example
	void noChangepointsShouldClearTheList() {
		var configuration = ModelConfiguration.named("sales").withChangepoints(SeriesFixtures.START).withChangepoints();
		assertEquals(List.nil(), configuration.changepoints());
	}

	@Example
	void explicitChangepointsShouldNotBeCombinedWithACount() {
		var counted = ModelConfiguration.named("sales").withChangepointCount(4);
		var exception = assertThrows(ModelException.class, () -> counted.withChangepoints(SeriesFixtures.START));
		assertEquals(Reason.CHANGEPOINT_CONFLICT, exception.reason());
	}
}

package bsts.global;

import net.jqwik.api.Example;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ImmutableEnumMapTest {

	@Example
	void putShouldLeaveTheReceiverUntouched() {
		var empty = ImmutableEnumMap.<ModelComponent, String>of();
		var withGrowth = empty.put(ModelComponent.GROWTH, "g");
		var withBoth = withGrowth.put(ModelComponent.NOISE_SCALE, "s");

		assertTrue(empty.isEmpty());
		assertEquals(1, withGrowth.size());
		assertNull(withGrowth.get(ModelComponent.NOISE_SCALE));
		assertEquals(2, withBoth.size());
		assertEquals("s", withBoth.get(ModelComponent.NOISE_SCALE));
	}

	@Example
	void replacingAnEntryShouldKeepTheSize() {
		var map = ImmutableEnumMap.of(ModelComponent.SEASONALITY, 1).put(ModelComponent.SEASONALITY, 2);
		assertEquals(1, map.size());
		assertEquals(2, map.get(ModelComponent.SEASONALITY));
	}

	@Example
	void toStreamShouldFollowTheOrdinalOrderAndSkipAbsentKeys() {
		var map = ImmutableEnumMap.<ModelComponent, Integer>of()
				.put(ModelComponent.REGRESSOR, 3)
				.put(ModelComponent.INTERCEPT, 1)
				.mapValues(v -> v * 10);
		var entries = map.toStream(ModelComponent.values()).toList();
		assertEquals(2, entries.size());
		assertEquals(ModelComponent.INTERCEPT, entries.get(0).key());
		assertEquals(10, entries.get(0).value());
		assertEquals(ModelComponent.REGRESSOR, entries.get(1).key());
		assertEquals(30, entries.get(1).value());
	}

	@Property
	boolean aBuiltMapShouldContainExactlyTheAddedKeys(@ForAll ModelComponent first, @ForAll ModelComponent second) {
		var map = ImmutableEnumMap.<ModelComponent, String>builder(ModelComponent.values())
				.add(first, first.name())
				.add(second, second.name())
				.build();
		return map.size() == (first == second ? 1 : 2)
				&& map.containsKey(first)
				&& map.containsKey(second)
				&& map.getSome(first).orElseThrow().equals(first.name());
	}

	@Property
	void parameterNamesShouldMapBackToTheirComponent(@ForAll ModelComponent component) {
		assertEquals(component, ModelComponent.fromParameterName(component.parameterName("sales"), "sales").orElseThrow());
		assertFalse(ModelComponent.fromParameterName(component.parameterName("sales"), "visits").isPresent());
	}
}

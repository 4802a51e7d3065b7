package bsts.global;

import java.util.Optional;
import java.util.function.Function;

public interface ImmutableMap<K, V> {
	int size();

	V get(K k);

	ImmutableMap<K, V> put(K k, V v);

	<W> ImmutableMap<K, W> mapValues(final Function<V, W> f);

	default boolean isEmpty() {
		return size() == 0;
	}

	default Optional<V> getSome(final K k) {
		return Optional.ofNullable(get(k));
	}

	default boolean containsKey(final K k) {
		return get(k) != null;
	}

	interface Entry<K, V> {
		K key();

		V value();
	}

	record EntryImpl<K extends Enum<K>, V>(K key, V value) implements ImmutableMap.Entry<K, V> {}
}

package bsts.global;

import java.util.Arrays;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Stream;

/**
 * Persistent map keyed by an enum. Entries are stored by ordinal in an array that only grows as far as the highest key put, and every
 * update returns a new instance leaving the receiver untouched.
 */
public class ImmutableEnumMap<K extends Enum<K>, V> implements ImmutableMap<K, V> {

	private final int size;
	private final V[] entries;

	private ImmutableEnumMap(final int size, final V[] entries) {
		this.size = size;
		this.entries = entries;
	}

	@Override
	public int size() {
		return this.size;
	}

	@Override
	public V get(final K k) {
		return k.ordinal() < entries.length ? entries[k.ordinal()] : null;
	}

	@Override
	public ImmutableEnumMap<K, V> put(K k, V v) {
		final int newSize;
		final int newLength;
		if (k.ordinal() >= this.entries.length) {
			newSize = this.size + 1;
			newLength = 1 + k.ordinal();
		} else {
			newSize = this.entries[k.ordinal()] == null ? this.size + 1 : this.size;
			newLength = this.entries.length;
		}
		var newEntries = Arrays.copyOf(this.entries, newLength);
		newEntries[k.ordinal()] = v;
		return new ImmutableEnumMap<>(newSize, newEntries);
	}

	@Override
	public <W> ImmutableEnumMap<K, W> mapValues(final Function<V, W> f) {
		final W[] newEntries = createEntries(this.entries.length);
		for (var i = 0; i < newEntries.length; ++i) {
			if (this.entries[i] != null) {
				newEntries[i] = f.apply(this.entries[i]);
			}
		}
		return new ImmutableEnumMap<>(this.size, newEntries);
	}

	/** The present entries in key ordinal order. */
	public Stream<ImmutableMap.Entry<K, V>> toStream(final K[] enumValues) {
		var builder = Stream.<ImmutableMap.Entry<K, V>>builder();
		for (var i = 0; i < this.entries.length; ++i) {
			if (this.entries[i] != null) {
				builder.accept(new EntryImpl<>(enumValues[i], this.entries[i]));
			}
		}
		return builder.build();
	}

	public static <K extends Enum<K>, V> ImmutableEnumMap<K, V> of() {
		return new ImmutableEnumMap<>(0, createEntries(0));
	}

	public static <K extends Enum<K>, V> ImmutableEnumMap<K, V> of(final K k1, final V v1) {
		V[] entries = createEntries(1 + k1.ordinal());
		entries[k1.ordinal()] = v1;
		return new ImmutableEnumMap<>(1, entries);
	}

	public static <K extends Enum<K>, V> Builder<K, V> builder(final K[] enumValues) {
		return new Builder<>(enumValues);
	}

	private static <W> W[] createEntries(final int length) {
		return (W[]) new Object[length];
	}

	public static class Builder<K extends Enum<K>, V> {
		final V[] entries;

		private Builder(final K[] enumValues) {
			this.entries = createEntries(enumValues.length);
		}

		public Builder<K, V> add(final K k, final V v) {
			this.entries[k.ordinal()] = v;
			return this;
		}

		public Optional<V> getSome(final K k) {
			return Optional.ofNullable(this.entries[k.ordinal()]);
		}

		public ImmutableEnumMap<K, V> build() {
			var size = 0;
			for (V entry : entries) {
				if (entry != null) {
					size += 1;
				}
			}
			return new ImmutableEnumMap<>(size, Arrays.copyOf(entries, entries.length));
		}
	}
}

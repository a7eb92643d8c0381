package works.trellis;

import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.TreeMap;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.pcollections.HashTreePMap;
import org.pcollections.PMap;

import static java.util.Objects.requireNonNull;

/**
 * Values extracted from a path segment by the {@link works.trellis.conditions.Condition Condition}
 * that matched it, keyed by metaname.
 * <p>
 * Immutable. A {@link Resource} reached through a static mount edge usually has empty metadata.
 */
public final class Metadata {
	@NotNull
	private final PMap<String, Object> values;

	private Metadata(@NotNull PMap<String, Object> values) {
		this.values = values;
	}

	public static Metadata empty() {
		return EMPTY;
	}

	public static Metadata of(String key, Object value) {
		return EMPTY.plus(key, value);
	}

	public Metadata plus(String key, Object value) {
		return new Metadata(values.plus(requireNonNull(key), requireNonNull(value)));
	}

	/**
	 * @return metadata containing the entries of both; where a key appears in both,
	 * the value from {@code later} wins
	 */
	public Metadata merge(Metadata later) {
		if (later.isEmpty()) {
			return this;
		} else if (this.isEmpty()) {
			return later;
		}
		return new Metadata(values.plusAll(later.values));
	}

	public @Nullable Object get(String key) {
		return values.get(key);
	}

	/**
	 * @throws NoSuchElementException if there is no value for {@code key}
	 * @throws ClassCastException if the value is not a {@code type}
	 */
	public <T> T get(String key, Class<T> type) {
		Object value = values.get(key);
		if (value == null) {
			throw new NoSuchElementException("No metadata named \"" + key + "\"");
		}
		return type.cast(value);
	}

	public boolean containsKey(String key) {
		return values.containsKey(key);
	}

	public boolean isEmpty() {
		return values.isEmpty();
	}

	public Set<String> keys() {
		return values.keySet();
	}

	public Map<String, Object> asMap() {
		return values;
	}

	@Override
	public boolean equals(Object o) {
		if (o == null || getClass() != o.getClass()) {
			return false;
		}
		return values.equals(((Metadata) o).values);
	}

	@Override
	public int hashCode() {
		return values.hashCode();
	}

	@Override
	public String toString() {
		// Sorted so log lines are stable
		return new TreeMap<>(values).toString();
	}

	private static final Metadata EMPTY = new Metadata(HashTreePMap.empty());
}

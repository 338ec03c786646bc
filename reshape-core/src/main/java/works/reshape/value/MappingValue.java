package works.reshape.value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;
import static java.util.stream.Collectors.joining;

/**
 * An ordered collection of uniquely-keyed members.
 * <p>
 * Iteration follows insertion order.
 * Equality ignores order, as JSON object equality does;
 * compare {@link #toString()} results if order matters.
 */
public record MappingValue(Map<String, Value> members) implements Value {
	public static final MappingValue EMPTY = new MappingValue(Map.of());

	public MappingValue {
		LinkedHashMap<String, Value> copy = new LinkedHashMap<>(members.size());
		members.forEach((k, v) -> copy.put(requireNonNull(k), requireNonNull(v, () -> "Member \"" + k + "\" can't be null")));
		members = Collections.unmodifiableMap(copy);
	}

	public static Builder builder() {
		return new Builder();
	}

	public @Nullable Value get(String key) {
		return members.get(key);
	}

	public boolean containsKey(String key) {
		return members.containsKey(key);
	}

	public Set<String> keySet() {
		return members.keySet();
	}

	public int size() {
		return members.size();
	}

	public boolean isEmpty() {
		return members.isEmpty();
	}

	@Override
	public String typeName() {
		return "object";
	}

	@Override
	public String toString() {
		return members.entrySet().stream()
			.map(e -> StringValue.quote(e.getKey()) + ":" + e.getValue())
			.collect(joining(",", "{", "}"));
	}

	public static final class Builder {
		private final LinkedHashMap<String, Value> members = new LinkedHashMap<>();

		Builder() { }

		/**
		 * @throws IllegalArgumentException if {@code key} is already present
		 */
		public Builder put(String key, Value value) {
			Value old = members.putIfAbsent(requireNonNull(key), requireNonNull(value));
			if (old != null) {
				throw new IllegalArgumentException("Duplicate key \"" + key + "\"");
			}
			return this;
		}

		public Builder put(String key, String value) {
			return put(key, Value.of(value));
		}

		public Builder put(String key, long value) {
			return put(key, Value.of(value));
		}

		public MappingValue build() {
			return new MappingValue(members);
		}

		@Override
		public String toString() {
			return "MappingValue.Builder(" + members.keySet() + ")";
		}
	}
}

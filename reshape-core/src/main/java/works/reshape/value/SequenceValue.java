package works.reshape.value;

import java.util.List;
import org.pcollections.PVector;
import org.pcollections.TreePVector;

import static java.util.Objects.requireNonNull;
import static java.util.stream.Collectors.joining;

/**
 * An ordered list of values. Elements are never null; use {@link Value#NULL}.
 */
public record SequenceValue(PVector<Value> elements) implements Value {
	public static final SequenceValue EMPTY = new SequenceValue(TreePVector.empty());

	public SequenceValue {
		requireNonNull(elements);
		elements.forEach(e -> requireNonNull(e, "Sequence elements can't be null"));
	}

	public static SequenceValue of(List<? extends Value> elements) {
		if (elements.isEmpty()) {
			return EMPTY;
		}
		return new SequenceValue(TreePVector.from(elements));
	}

	public int size() {
		return elements.size();
	}

	public boolean isEmpty() {
		return elements.isEmpty();
	}

	public Value get(int index) {
		return elements.get(index);
	}

	@Override
	public String typeName() {
		return "array";
	}

	@Override
	public String toString() {
		return elements.stream()
			.map(Value::toString)
			.collect(joining(",", "[", "]"));
	}
}

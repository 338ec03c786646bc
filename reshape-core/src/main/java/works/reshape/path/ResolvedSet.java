package works.reshape.path;

import java.util.List;
import works.reshape.value.SequenceValue;
import works.reshape.value.Value;

import static java.util.Objects.requireNonNull;

/**
 * The outcome of resolving a {@link PathExpression}.
 */
public sealed interface ResolvedSet permits ResolvedSet.Scalar, ResolvedSet.Flat {
	/**
	 * @return the value to place in the output document
	 */
	Value toValue();

	/**
	 * The path never passed through an array, so it designates exactly one node.
	 * That node may itself be an array, returned whole.
	 */
	record Scalar(Value value) implements ResolvedSet {
		public Scalar {
			requireNonNull(value);
		}

		@Override
		public Value toValue() {
			return value;
		}
	}

	/**
	 * The path fanned out over at least one array;
	 * these are the collected results in document order.
	 */
	record Flat(List<Value> values) implements ResolvedSet {
		public Flat {
			values = List.copyOf(values);
		}

		@Override
		public SequenceValue toValue() {
			return SequenceValue.of(values);
		}
	}
}

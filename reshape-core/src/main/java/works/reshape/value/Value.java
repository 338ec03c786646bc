package works.reshape.value;

import java.math.BigDecimal;
import java.util.List;

/**
 * A node in a document tree.
 * <p>
 * Values are immutable, and equality is structural.
 * The {@link Object#toString() toString} method of every variant
 * returns compact JSON text, suitable for log messages and error reports.
 */
public sealed interface Value permits
	NullValue,
	BooleanValue,
	NumberValue,
	StringValue,
	SequenceValue,
	MappingValue
{
	NullValue NULL = new NullValue();
	BooleanValue TRUE = new BooleanValue(true);
	BooleanValue FALSE = new BooleanValue(false);

	/**
	 * @return the JSON name of this value's type, such as {@code "array"} or {@code "object"}.
	 * Used in error messages.
	 */
	String typeName();

	static StringValue of(String value) {
		return new StringValue(value);
	}

	static BooleanValue of(boolean value) {
		return value ? TRUE : FALSE;
	}

	static NumberValue of(long value) {
		return new NumberValue(BigDecimal.valueOf(value));
	}

	static NumberValue of(BigDecimal value) {
		return new NumberValue(value);
	}

	static SequenceValue sequence(Value... elements) {
		return SequenceValue.of(List.of(elements));
	}

	static SequenceValue sequence(List<? extends Value> elements) {
		return SequenceValue.of(elements);
	}

	static MappingValue.Builder mapping() {
		return MappingValue.builder();
	}
}

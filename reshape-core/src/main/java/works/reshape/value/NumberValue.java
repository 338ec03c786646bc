package works.reshape.value;

import java.math.BigDecimal;

import static java.util.Objects.requireNonNull;

/**
 * A number, held exactly.
 * <p>
 * Two numbers are equal if they are numerically equal, regardless of scale,
 * so {@code 3} equals {@code 3.0}.
 * The original text form is otherwise preserved: the engine never converts numbers.
 */
public record NumberValue(BigDecimal value) implements Value {
	public NumberValue {
		requireNonNull(value);
	}

	@Override
	public String typeName() {
		return "number";
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof NumberValue other
			&& value.compareTo(other.value) == 0;
	}

	@Override
	public int hashCode() {
		return value.stripTrailingZeros().hashCode();
	}

	@Override
	public String toString() {
		return value.toString();
	}
}

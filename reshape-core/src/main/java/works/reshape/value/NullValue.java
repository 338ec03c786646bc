package works.reshape.value;

/**
 * Use {@link Value#NULL} rather than creating new instances.
 */
public record NullValue() implements Value {
	@Override
	public String typeName() {
		return "null";
	}

	@Override
	public String toString() {
		return "null";
	}
}

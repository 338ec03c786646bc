package works.reshape.value;

public record BooleanValue(boolean value) implements Value {
	@Override
	public String typeName() {
		return "boolean";
	}

	@Override
	public String toString() {
		return Boolean.toString(value);
	}
}

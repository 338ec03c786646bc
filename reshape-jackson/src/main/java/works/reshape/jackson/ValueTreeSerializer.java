package works.reshape.jackson;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Map.Entry;
import tools.jackson.core.JsonGenerator;
import tools.jackson.databind.SerializationContext;
import tools.jackson.databind.ValueSerializer;
import works.reshape.value.BooleanValue;
import works.reshape.value.MappingValue;
import works.reshape.value.NullValue;
import works.reshape.value.NumberValue;
import works.reshape.value.SequenceValue;
import works.reshape.value.StringValue;
import works.reshape.value.Value;

/**
 * Writes a {@link Value} tree token by token.
 * <p>
 * Numbers with scale zero are written as integers, using the narrowest Java type that holds them.
 * Numbers with a modest positive scale are written in plain decimal form, so {@code 0.0000001} stays as it was.
 * Anything else, such as {@code 1e400}, keeps {@link BigDecimal}'s exponent form,
 * so output length stays proportional to the digits actually held.
 */
final class ValueTreeSerializer extends ValueSerializer<Value> {
	/**
	 * Beyond this many fractional digits, plain form would be mostly leading zeros.
	 */
	static final int MAX_PLAIN_SCALE = 100;

	@Override
	public void serialize(Value value, JsonGenerator gen, SerializationContext serializers) {
		write(value, gen);
	}

	private static void write(Value value, JsonGenerator gen) {
		if (value instanceof NullValue) {
			gen.writeNull();
		} else if (value instanceof BooleanValue b) {
			gen.writeBoolean(b.value());
		} else if (value instanceof NumberValue n) {
			BigDecimal number = n.value();
			if (number.scale() == 0) {
				BigInteger integer = number.toBigIntegerExact();
				if (integer.bitLength() < 32) {
					gen.writeNumber(integer.intValue());
				} else if (integer.bitLength() < 64) {
					gen.writeNumber(integer.longValue());
				} else {
					gen.writeNumber(integer);
				}
			} else if (number.scale() > 0 && number.scale() <= MAX_PLAIN_SCALE) {
				// BigDecimal.toString switches to exponent form below 1E-6
				gen.writeNumber(number.toPlainString());
			} else {
				gen.writeNumber(number);
			}
		} else if (value instanceof StringValue s) {
			gen.writeString(s.value());
		} else if (value instanceof SequenceValue sequence) {
			gen.writeStartArray();
			for (Value element: sequence.elements()) {
				write(element, gen);
			}
			gen.writeEndArray();
		} else if (value instanceof MappingValue mapping) {
			gen.writeStartObject();
			for (Entry<String, Value> member: mapping.members().entrySet()) {
				gen.writeName(member.getKey());
				write(member.getValue(), gen);
			}
			gen.writeEndObject();
		} else {
			throw new AssertionError("Unexpected value type: " + value.getClass());
		}
	}
}

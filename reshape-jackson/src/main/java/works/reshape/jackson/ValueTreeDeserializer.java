package works.reshape.jackson;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import tools.jackson.core.JsonParser;
import tools.jackson.core.JsonToken;
import tools.jackson.core.exc.StreamReadException;
import tools.jackson.databind.DeserializationContext;
import tools.jackson.databind.ValueDeserializer;
import works.reshape.value.MappingValue;
import works.reshape.value.SequenceValue;
import works.reshape.value.Value;

import static tools.jackson.core.JsonToken.END_ARRAY;
import static tools.jackson.core.JsonToken.END_OBJECT;

/**
 * Reads any JSON value into a {@link Value} tree.
 * Numbers are read exactly: integers via {@link java.math.BigInteger}, others via {@link BigDecimal}.
 *
 * @param <V> the variant requested by the caller
 */
final class ValueTreeDeserializer<V extends Value> extends ValueDeserializer<V> {
	private final Class<V> valueClass;

	ValueTreeDeserializer(Class<V> valueClass) {
		this.valueClass = valueClass;
	}

	@Override
	public V deserialize(JsonParser p, DeserializationContext ctxt) {
		return cast(read(p), p);
	}

	@Override
	public V getNullValue(DeserializationContext ctxt) {
		return valueClass.isInstance(Value.NULL) ? valueClass.cast(Value.NULL) : null;
	}

	@Override
	public boolean isCachable() {
		return true;
	}

	/**
	 * Reads the value starting at the parser's current token,
	 * leaving the parser on that value's last token.
	 */
	private static Value read(JsonParser p) {
		JsonToken token = p.currentToken();
		if (token == null) {
			throw new StreamReadException(p, "Expected a JSON value; found end of input");
		}
		switch (token) {
			case START_OBJECT: {
				MappingValue.Builder builder = MappingValue.builder();
				while (p.nextToken() != END_OBJECT) {
					p.nextValue();
					String name = p.currentName();
					Value value = read(p);
					try {
						builder.put(name, value);
					} catch (IllegalArgumentException e) {
						throw new StreamReadException(p, "Object key appears twice: \"" + name + "\"");
					}
				}
				return builder.build();
			}
			case START_ARRAY: {
				List<Value> elements = new ArrayList<>();
				while (p.nextToken() != END_ARRAY) {
					elements.add(read(p));
				}
				return SequenceValue.of(elements);
			}
			case VALUE_STRING:
				return Value.of(p.getString());
			case VALUE_NUMBER_INT:
				return Value.of(new BigDecimal(p.getBigIntegerValue()));
			case VALUE_NUMBER_FLOAT:
				return Value.of(p.getDecimalValue());
			case VALUE_TRUE:
				return Value.TRUE;
			case VALUE_FALSE:
				return Value.FALSE;
			case VALUE_NULL:
				return Value.NULL;
			default:
				throw new StreamReadException(p, "Unexpected token " + token);
		}
	}

	private V cast(Value value, JsonParser p) {
		if (valueClass.isInstance(value)) {
			return valueClass.cast(value);
		}
		throw new StreamReadException(p, "Expected JSON " + expectedTypeName() + "; found " + value.typeName());
	}

	private String expectedTypeName() {
		if (valueClass == MappingValue.class) {
			return "object";
		} else if (valueClass == SequenceValue.class) {
			return "array";
		} else {
			return valueClass.getSimpleName();
		}
	}
}

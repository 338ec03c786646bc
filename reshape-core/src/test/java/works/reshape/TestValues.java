package works.reshape;

import java.math.BigDecimal;
import java.util.Arrays;
import works.reshape.value.MappingValue;
import works.reshape.value.SequenceValue;
import works.reshape.value.StringValue;
import works.reshape.value.Value;

/**
 * Shorthand for building documents in tests.
 */
public final class TestValues {
	private TestValues() { }

	/**
	 * @param keysAndValues alternating keys and values; values are converted by {@link #v}
	 */
	public static MappingValue obj(Object... keysAndValues) {
		if (keysAndValues.length % 2 != 0) {
			throw new IllegalArgumentException("Expected alternating keys and values");
		}
		MappingValue.Builder builder = MappingValue.builder();
		for (int i = 0; i < keysAndValues.length; i += 2) {
			builder.put((String) keysAndValues[i], v(keysAndValues[i + 1]));
		}
		return builder.build();
	}

	public static SequenceValue arr(Object... elements) {
		return SequenceValue.of(Arrays.stream(elements).map(TestValues::v).toList());
	}

	public static StringValue str(String s) {
		return Value.of(s);
	}

	public static Value v(Object o) {
		if (o == null) {
			return Value.NULL;
		} else if (o instanceof Value value) {
			return value;
		} else if (o instanceof String s) {
			return Value.of(s);
		} else if (o instanceof Boolean b) {
			return Value.of(b);
		} else if (o instanceof Integer || o instanceof Long) {
			return Value.of(((Number) o).longValue());
		} else if (o instanceof Double d) {
			return Value.of(BigDecimal.valueOf(d));
		} else if (o instanceof BigDecimal d) {
			return Value.of(d);
		} else {
			throw new IllegalArgumentException("Unsupported test value: " + o.getClass());
		}
	}

	/**
	 * The source document from the retailer example.
	 */
	public static final MappingValue RETAILER_SOURCE = obj(
		"retailer", obj("id", "12342"),
		"order", obj(
			"po_number", "573832",
			"shipments", arr(
				obj(
					"tracking_number", "1234567",
					"items", arr(obj("quantity", 4), obj("quantity", 3))),
				obj(
					"tracking_number", "98776",
					"items", arr(obj("quantity", 1), obj("quantity", 1))))),
		"ids", arr("34554543", "7643534", "512342"));
}

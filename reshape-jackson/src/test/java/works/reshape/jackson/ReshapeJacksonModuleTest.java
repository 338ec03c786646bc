package works.reshape.jackson;

import java.math.BigDecimal;
import org.junit.jupiter.api.Test;
import tools.jackson.core.exc.StreamReadException;
import tools.jackson.databind.ObjectMapper;
import works.reshape.value.MappingValue;
import works.reshape.value.NumberValue;
import works.reshape.value.SequenceValue;
import works.reshape.value.Value;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class ReshapeJacksonModuleTest {
	final ObjectMapper mapper = JacksonReshaper.mapperBuilder().build();

	@Test
	void readsEveryKind() {
		Value value = mapper.readValue("{\"n\":null,\"t\":true,\"f\":false,\"i\":12,\"d\":1.50,\"s\":\"x\",\"a\":[1,[]],\"o\":{}}", Value.class);
		assertEquals(Value.mapping()
			.put("n", Value.NULL)
			.put("t", Value.TRUE)
			.put("f", Value.FALSE)
			.put("i", 12)
			.put("d", Value.of(new BigDecimal("1.5")))
			.put("s", "x")
			.put("a", Value.sequence(Value.of(1), SequenceValue.EMPTY))
			.put("o", MappingValue.EMPTY)
			.build(), value);
	}

	@Test
	void numbersKeepTheirText() {
		String json = "[12345678901234567890123,0.1,1.50,-7,1E+3]";
		Value value = mapper.readValue(json, Value.class);
		assertEquals(new BigDecimal("12345678901234567890123"), ((NumberValue) ((SequenceValue) value).get(0)).value());
		assertEquals("[12345678901234567890123,0.1,1.50,-7,1E+3]", mapper.writeValueAsString(value));
	}

	@Test
	void exponentsStayCompact() {
		Value value = mapper.readValue("[1e400,0.0000001,1e-400,-2.5E+10]", Value.class);
		assertEquals("[1E+400,0.0000001,1E-400,-2.5E+10]", mapper.writeValueAsString(value));
	}

	@Test
	void hugeExponentIsNotExpanded() {
		String output = JacksonReshaper.create().transform("{\"n\":1e2000000,\"small\":0.0000001}", "{\"n\":\"/n\",\"s\":\"/small\"}");
		assertEquals("{\"n\":1E+2000000,\"s\":0.0000001}", output);
	}

	@Test
	void stringsAreEscaped() {
		Value value = Value.of("line\n\"quoted\"");
		assertEquals("\"line\\n\\\"quoted\\\"\"", mapper.writeValueAsString(value));
		assertEquals(value, mapper.readValue(mapper.writeValueAsString(value), Value.class));
	}

	@Test
	void rootNull() {
		assertEquals(Value.NULL, mapper.readValue("null", Value.class));
	}

	@Test
	void specificVariants() {
		assertThat(mapper.readValue("{\"a\":1}", MappingValue.class), instanceOf(MappingValue.class));
		assertThat(mapper.readValue("[1]", SequenceValue.class), instanceOf(SequenceValue.class));
		StreamReadException e = assertThrows(StreamReadException.class, () -> mapper.readValue("[1]", MappingValue.class));
		assertThat(e.getMessage(), containsString("Expected JSON object; found array"));
	}

	@Test
	void duplicateKeys() {
		StreamReadException e = assertThrows(StreamReadException.class, () -> mapper.readValue("{\"a\":1,\"a\":2}", Value.class));
		assertThat(e.getMessage(), containsString("\"a\""));
	}

	@Test
	void preservesKeyOrder() {
		String json = "{\"z\":1,\"a\":{\"y\":2,\"b\":3}}";
		assertEquals(json, mapper.writeValueAsString(mapper.readValue(json, Value.class)));
	}
}

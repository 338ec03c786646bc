package works.reshape.jackson;

import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;
import works.reshape.CompiledTemplate;
import works.reshape.ReshapeSettings;
import works.reshape.Reshaper;
import works.reshape.value.Value;

import static java.util.Objects.requireNonNull;

/**
 * Runs a {@link Reshaper} on JSON text, Jackson trees, or arbitrary objects
 * that the underlying {@link ObjectMapper} can convert.
 * <p>
 * Malformed JSON surfaces as Jackson's own exceptions;
 * transformation failures surface as {@link works.reshape.exceptions.TransformException}s.
 */
public final class JacksonReshaper {
	private final Reshaper reshaper;
	private final ObjectMapper mapper;

	/**
	 * @param mapper must have a {@link ReshapeJacksonModule} registered
	 */
	public JacksonReshaper(Reshaper reshaper, ObjectMapper mapper) {
		this.reshaper = requireNonNull(reshaper);
		this.mapper = requireNonNull(mapper);
	}

	public static JacksonReshaper create() {
		return create(ReshapeSettings.defaults());
	}

	public static JacksonReshaper create(ReshapeSettings settings) {
		return new JacksonReshaper(Reshaper.create(settings), mapperBuilder().build());
	}

	/**
	 * A starting point for callers who want to configure their own mapper.
	 */
	public static JsonMapper.Builder mapperBuilder() {
		return JsonMapper.builder().addModule(new ReshapeJacksonModule());
	}

	public Reshaper reshaper() {
		return reshaper;
	}

	public ObjectMapper mapper() {
		return mapper;
	}

	public Value readValue(String json) {
		return nonNull(mapper.readValue(json, Value.class));
	}

	public String writeValueAsString(Value value) {
		return mapper.writeValueAsString(value);
	}

	/**
	 * Converts any object the mapper can serialize; a {@link Value} is returned as-is.
	 */
	public Value toValue(@Nullable Object object) {
		if (object instanceof Value value) {
			return value;
		}
		return nonNull(mapper.convertValue(object, Value.class));
	}

	public CompiledTemplate compile(String templateJson) {
		return reshaper.compile(readValue(templateJson));
	}

	public String transform(String sourceJson, String templateJson) {
		if (LOGGER.isTraceEnabled()) {
			LOGGER.trace("Transforming {} characters of source with template {}", sourceJson.length(), templateJson);
		}
		return writeValueAsString(reshaper.transform(readValue(sourceJson), readValue(templateJson)));
	}

	public JsonNode transform(JsonNode source, JsonNode template) {
		return mapper.convertValue(reshaper.transform(toValue(source), toValue(template)), JsonNode.class);
	}

	/**
	 * @param source anything the mapper can serialize
	 * @param template anything the mapper can serialize
	 * @param resultType what to convert the output into
	 */
	public <T> T transform(@Nullable Object source, Object template, Class<T> resultType) {
		return mapper.convertValue(reshaper.transform(toValue(source), toValue(template)), resultType);
	}

	/**
	 * @param templatesJson a JSON array of non-empty objects
	 * @return a JSON array with one output per template
	 */
	public String transformEach(String sourceJson, String templatesJson) {
		return writeValueAsString(reshaper.transformEach(readValue(sourceJson), readValue(templatesJson)));
	}

	public JsonNode transformEach(JsonNode source, JsonNode templates) {
		return mapper.convertValue(reshaper.transformEach(toValue(source), toValue(templates)), JsonNode.class);
	}

	private static Value nonNull(@Nullable Value value) {
		return value == null ? Value.NULL : value;
	}

	@Override
	public String toString() {
		return "JacksonReshaper(" + reshaper + ")";
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(JacksonReshaper.class);
}

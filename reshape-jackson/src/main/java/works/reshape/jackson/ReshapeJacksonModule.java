package works.reshape.jackson;

import tools.jackson.core.Version;
import tools.jackson.databind.JacksonModule;
import tools.jackson.databind.module.SimpleDeserializers;
import tools.jackson.databind.module.SimpleSerializers;
import works.reshape.value.MappingValue;
import works.reshape.value.SequenceValue;
import works.reshape.value.Value;

/**
 * Teaches an {@link tools.jackson.databind.ObjectMapper ObjectMapper}
 * to read and write {@link Value} trees.
 * <p>
 * Besides {@link Value} itself, {@link MappingValue} and {@link SequenceValue}
 * can be requested directly; reading anything else into them is an error.
 */
public final class ReshapeJacksonModule extends JacksonModule {

	@Override
	public String getModuleName() {
		return getClass().getSimpleName();
	}

	@Override
	public Version version() {
		return Version.unknownVersion();
	}

	@Override
	public void setupModule(SetupContext context) {
		SimpleSerializers serializers = new SimpleSerializers();
		serializers.addSerializer(Value.class, new ValueTreeSerializer());
		context.addSerializers(serializers);

		SimpleDeserializers deserializers = new SimpleDeserializers();
		deserializers.addDeserializer(Value.class, new ValueTreeDeserializer<>(Value.class));
		deserializers.addDeserializer(MappingValue.class, new ValueTreeDeserializer<>(MappingValue.class));
		deserializers.addDeserializer(SequenceValue.class, new ValueTreeDeserializer<>(SequenceValue.class));
		context.addDeserializers(deserializers);
	}
}

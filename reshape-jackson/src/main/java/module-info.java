/**
 * Jackson binding for the reshape engine.
 * <p>
 * See {@link works.reshape.jackson.JacksonReshaper} for the main entry point.
 */
module works.reshape.jackson {
	requires transitive tools.jackson.core;
	requires transitive tools.jackson.databind;
	requires org.slf4j;
	requires transitive works.reshape.core;

	exports works.reshape.jackson;
}

/**
 * Reads and writes {@link works.reshape.value.Value} trees with Jackson,
 * and offers {@link works.reshape.jackson.JacksonReshaper} for transforming JSON text and trees directly.
 */
package works.reshape.jackson;

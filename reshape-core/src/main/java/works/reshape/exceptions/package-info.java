/**
 * Errors reported by the reshape engine.
 * <p>
 * Every failure is a subclass of the sealed, unchecked
 * {@link works.reshape.exceptions.TransformException}, which carries the
 * {@link works.reshape.template.TemplateLocation location} in the template
 * where the problem was detected.
 * A single failure aborts the whole transformation; there are no partial results.
 */
package works.reshape.exceptions;

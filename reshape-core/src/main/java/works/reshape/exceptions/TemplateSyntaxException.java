package works.reshape.exceptions;

import works.reshape.template.TemplateLocation;

/**
 * The template is malformed: a decoration can't be parsed,
 * is applied to the wrong kind of value,
 * or produces a key that collides with another.
 */
public final class TemplateSyntaxException extends TransformException {
	public TemplateSyntaxException(TemplateLocation location, String message) {
		super(location, message);
	}
}

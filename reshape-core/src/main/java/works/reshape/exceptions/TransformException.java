package works.reshape.exceptions;

import works.reshape.template.TemplateLocation;

import static java.util.Objects.requireNonNull;

public sealed abstract class TransformException extends RuntimeException permits
	PathException,
	ArrayConversionException,
	TemplateSyntaxException,
	DepthExceededException
{
	private final TemplateLocation location;

	protected TransformException(TemplateLocation location, String message) {
		super(fullMessage(location, message));
		this.location = location;
	}

	/**
	 * @return where in the template the problem was detected
	 */
	public TemplateLocation location() {
		return location;
	}

	private static String fullMessage(TemplateLocation location, String message) {
		return "Template " + requireNonNull(location) + ": " + message;
	}
}

package works.reshape.exceptions;

import works.reshape.template.TemplateLocation;

/**
 * An object marked for array conversion can't be turned into an array.
 */
public sealed abstract class ArrayConversionException extends TransformException permits
	NoSpreadTargetException,
	SpreadLengthMismatchException,
	SpreadTypeMismatchException
{
	protected ArrayConversionException(TemplateLocation location, String message) {
		super(location, message);
	}
}

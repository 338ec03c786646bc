package works.reshape.exceptions;

import works.reshape.template.TemplateLocation;

/**
 * A spread entry produced something other than an array.
 */
public final class SpreadTypeMismatchException extends ArrayConversionException {
	private final String actualType;

	public SpreadTypeMismatchException(TemplateLocation location, String actualType) {
		super(location, "spread entry must resolve to an array; got " + actualType);
		this.actualType = actualType;
	}

	public String actualType() {
		return actualType;
	}
}

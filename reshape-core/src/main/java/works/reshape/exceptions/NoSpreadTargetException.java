package works.reshape.exceptions;

import works.reshape.template.TemplateLocation;

public final class NoSpreadTargetException extends ArrayConversionException {
	public NoSpreadTargetException(TemplateLocation location) {
		super(location, "object is marked for array conversion but contains no spread entry");
	}
}

package works.reshape.exceptions;

import works.reshape.template.TemplateLocation;

/**
 * Two spread entries in the same array conversion produced arrays of different lengths.
 * The location is that of the conversion; the two entries are reported separately.
 */
public final class SpreadLengthMismatchException extends ArrayConversionException {
	private final TemplateLocation firstEntry;
	private final int firstLength;
	private final TemplateLocation secondEntry;
	private final int secondLength;

	public SpreadLengthMismatchException(TemplateLocation location, TemplateLocation firstEntry, int firstLength, TemplateLocation secondEntry, int secondLength) {
		super(location, "spread entries disagree on length: "
			+ firstEntry + " has " + firstLength + " element(s) but "
			+ secondEntry + " has " + secondLength);
		this.firstEntry = firstEntry;
		this.firstLength = firstLength;
		this.secondEntry = secondEntry;
		this.secondLength = secondLength;
	}

	public TemplateLocation firstEntry() {
		return firstEntry;
	}

	public int firstLength() {
		return firstLength;
	}

	public TemplateLocation secondEntry() {
		return secondEntry;
	}

	public int secondLength() {
		return secondLength;
	}
}

package works.reshape.exceptions;

import works.reshape.path.PathExpression;
import works.reshape.template.TemplateLocation;

/**
 * A path segment names a field that the source does not have,
 * and the segment is not under an array, where absence would simply contribute nothing.
 */
public final class MissingFieldException extends PathException {
	private final String segment;
	private final int segmentIndex;

	public MissingFieldException(TemplateLocation location, PathExpression path, int segmentIndex, String actualType) {
		super(location, path, "no field \"" + path.segments().get(segmentIndex) + "\" in " + actualType + " at segment " + (segmentIndex + 1));
		this.segment = path.segments().get(segmentIndex);
		this.segmentIndex = segmentIndex;
	}

	/**
	 * @return the name of the field that was not found
	 */
	public String segment() {
		return segment;
	}

	/**
	 * @return zero-based position of {@link #segment()} within the path
	 */
	public int segmentIndex() {
		return segmentIndex;
	}
}

package works.reshape.exceptions;

import works.reshape.path.PathExpression;
import works.reshape.template.TemplateLocation;

/**
 * A {@link PathExpression} could not be resolved against the source document.
 */
public sealed abstract class PathException extends TransformException permits MissingFieldException {
	private final PathExpression path;

	protected PathException(TemplateLocation location, PathExpression path, String message) {
		super(location, "Path \"" + path + "\": " + message);
		this.path = path;
	}

	public PathExpression path() {
		return path;
	}
}

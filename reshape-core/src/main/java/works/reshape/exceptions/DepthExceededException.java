package works.reshape.exceptions;

import works.reshape.template.TemplateLocation;

/**
 * Nesting went deeper than {@link works.reshape.ReshapeSettings#maxDepth() maxDepth},
 * either in the template or in the part of the source a path traverses.
 */
public final class DepthExceededException extends TransformException {
	private final int maxDepth;

	public DepthExceededException(TemplateLocation location, int maxDepth) {
		super(location, "nesting exceeds the maximum depth of " + maxDepth);
		this.maxDepth = maxDepth;
	}

	public int maxDepth() {
		return maxDepth;
	}
}

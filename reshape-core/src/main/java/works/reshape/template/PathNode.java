package works.reshape.template;

import works.reshape.path.PathExpression;

import static java.util.Objects.requireNonNull;

/**
 * Evaluates to whatever {@link #path} resolves to in the source.
 */
public record PathNode(TemplateLocation location, PathExpression path) implements TemplateNode {
	public PathNode {
		requireNonNull(location);
		requireNonNull(path);
	}

	@Override
	public String toString() {
		return "Path(" + path + ")";
	}
}

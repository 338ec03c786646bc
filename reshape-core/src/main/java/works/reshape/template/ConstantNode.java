package works.reshape.template;

import works.reshape.value.Value;

import static java.util.Objects.requireNonNull;

/**
 * A scalar that is copied to the output unchanged:
 * a number, boolean, null, or a string that is neither a path nor a literal.
 */
public record ConstantNode(TemplateLocation location, Value value) implements TemplateNode {
	public ConstantNode {
		requireNonNull(location);
		requireNonNull(value);
	}

	@Override
	public String toString() {
		return "Constant(" + value + ")";
	}
}

package works.reshape.template;

import static java.util.Objects.requireNonNull;

/**
 * Evaluates to the string {@link #text}, which came from a quoted leaf like {@code 'text'}.
 */
public record LiteralNode(TemplateLocation location, String text) implements TemplateNode {
	public LiteralNode {
		requireNonNull(location);
		requireNonNull(text);
	}

	@Override
	public String toString() {
		return "Literal('" + text + "')";
	}
}

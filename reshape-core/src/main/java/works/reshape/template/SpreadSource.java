package works.reshape.template;

import static java.util.Objects.requireNonNull;

/**
 * A spread entry gathered into its enclosing {@link ConversionNode}.
 *
 * @param location the location of the spread entry itself
 * @param node evaluates to the array whose elements are distributed across the copies
 */
public record SpreadSource(TemplateLocation location, TemplateNode node) {
	public SpreadSource {
		requireNonNull(location);
		requireNonNull(node);
	}
}

package works.reshape.template;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * An object marked with {@link Decoration#ARRAY_CONVERSION}.
 * <p>
 * Evaluates to an array of copies of {@link #body}, one per element of the spread sources.
 * Members of {@code body} (at any depth) that are {@link Member#isBound() bound}
 * take their value from {@link #spreadSources} rather than evaluating themselves.
 * Nested conversions have their own sources and are not included here.
 */
public record ConversionNode(TemplateLocation location, MappingNode body, List<SpreadSource> spreadSources) implements TemplateNode {
	public ConversionNode {
		requireNonNull(location);
		requireNonNull(body);
		spreadSources = List.copyOf(spreadSources);
		if (spreadSources.isEmpty()) {
			throw new IllegalArgumentException("Array conversion requires at least one spread source");
		}
	}

	@Override
	public String toString() {
		return "Conversion(" + spreadSources.size() + " source(s))" + body;
	}
}

package works.reshape.template;

import java.util.List;

import static java.util.Objects.requireNonNull;
import static java.util.stream.Collectors.joining;

public record SequenceNode(TemplateLocation location, List<TemplateNode> elements) implements TemplateNode {
	public SequenceNode {
		requireNonNull(location);
		elements = List.copyOf(elements);
	}

	@Override
	public String toString() {
		return elements.stream()
			.map(Object::toString)
			.collect(joining(", ", "[", "]"));
	}
}

package works.reshape.template;

import java.util.List;

import static java.util.Objects.requireNonNull;
import static java.util.stream.Collectors.joining;

/**
 * Evaluates to a mapping with one member per {@link Member}, in declaration order.
 */
public record MappingNode(TemplateLocation location, List<Member> members) implements TemplateNode {
	public MappingNode {
		requireNonNull(location);
		members = List.copyOf(members);
	}

	@Override
	public String toString() {
		return members.stream()
			.map(Object::toString)
			.collect(joining(", ", "{", "}"));
	}
}

package works.reshape.engine;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import works.reshape.exceptions.DepthExceededException;
import works.reshape.path.PathResolver;
import works.reshape.template.ConstantNode;
import works.reshape.template.ConversionNode;
import works.reshape.template.LiteralNode;
import works.reshape.template.MappingNode;
import works.reshape.template.Member;
import works.reshape.template.PathNode;
import works.reshape.template.SequenceNode;
import works.reshape.template.TemplateNode;
import works.reshape.value.MappingValue;
import works.reshape.value.SequenceValue;
import works.reshape.value.Value;

import static java.util.Objects.requireNonNull;

/**
 * Evaluates a compiled template against a source document.
 * <p>
 * Stateless apart from its configuration; safe to share between threads.
 */
public final class TemplateWalker {
	private final PathResolver resolver;
	private final ArrayConverter converter;
	private final int maxDepth;

	public TemplateWalker(PathResolver resolver, int maxDepth) {
		this.resolver = requireNonNull(resolver);
		this.converter = new ArrayConverter(this);
		this.maxDepth = maxDepth;
	}

	public Value render(Value source, TemplateNode template) {
		return render(requireNonNull(source), template, Bindings.NONE, 0);
	}

	Value render(Value source, TemplateNode node, Bindings bindings, int depth) {
		if (depth > maxDepth) {
			throw new DepthExceededException(node.location(), maxDepth);
		}
		if (node instanceof PathNode path) {
			return resolver.resolve(source, path.path(), path.location()).toValue();
		} else if (node instanceof LiteralNode literal) {
			return Value.of(literal.text());
		} else if (node instanceof ConstantNode constant) {
			return constant.value();
		} else if (node instanceof MappingNode mapping) {
			return renderMapping(source, mapping, bindings, depth);
		} else if (node instanceof SequenceNode sequence) {
			List<Value> elements = new ArrayList<>(sequence.elements().size());
			for (TemplateNode element: sequence.elements()) {
				elements.add(render(source, element, bindings, depth + 1));
			}
			return SequenceValue.of(elements);
		} else if (node instanceof ConversionNode conversion) {
			// A conversion establishes its own bindings; the enclosing ones don't reach inside
			return converter.convert(source, conversion, depth);
		} else {
			throw new AssertionError("Unexpected template node: " + node.getClass());
		}
	}

	private MappingValue renderMapping(Value source, MappingNode mapping, Bindings bindings, int depth) {
		Map<String, Value> members = new LinkedHashMap<>();
		for (Member member: mapping.members()) {
			Value value = bindings.binds(member)
				? bindings.valueOf(member)
				: render(source, member.value(), bindings, depth + 1);
			members.put(member.name(), value);
		}
		return new MappingValue(members);
	}
}

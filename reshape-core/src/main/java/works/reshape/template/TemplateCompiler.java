package works.reshape.template;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.reshape.exceptions.DepthExceededException;
import works.reshape.exceptions.NoSpreadTargetException;
import works.reshape.exceptions.TemplateSyntaxException;
import works.reshape.path.PathExpression;
import works.reshape.value.MappingValue;
import works.reshape.value.SequenceValue;
import works.reshape.value.StringValue;
import works.reshape.value.Value;

/**
 * Turns a template document into a tree of {@link TemplateNode}s.
 * <p>
 * Besides parsing decorations, the compiler assigns every spread entry
 * to the nearest enclosing {@link ConversionNode}. The search for spread entries
 * descends through mappings and sequences but stops at nested conversions,
 * which gather their own.
 * <p>
 * A key carrying both markers ({@code ...[name]}) compiles into a conversion that is
 * itself a spread source of the enclosing one.
 * Spread entries outside any conversion are compiled as plain members.
 */
public final class TemplateCompiler {
	private final int maxDepth;

	public TemplateCompiler(int maxDepth) {
		if (maxDepth < 1) {
			throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
		}
		this.maxDepth = maxDepth;
	}

	/**
	 * @throws TemplateSyntaxException if a decoration is malformed or misplaced
	 * @throws NoSpreadTargetException if an array conversion has no spread entry
	 * @throws DepthExceededException if the template nests deeper than the configured limit
	 */
	public TemplateNode compile(Value template) {
		TemplateNode result = compile(template, TemplateLocation.ROOT, null, 0);
		LOGGER.debug("Compiled template: {}", result);
		return result;
	}

	/**
	 * @param scope collects spread sources for the nearest enclosing conversion,
	 *              or null if there is none
	 */
	private TemplateNode compile(Value template, TemplateLocation location, @Nullable Scope scope, int depth) {
		if (depth > maxDepth) {
			throw new DepthExceededException(location, maxDepth);
		}
		if (template instanceof MappingValue mapping) {
			return compileMapping(mapping, location, scope, depth);
		} else if (template instanceof SequenceValue sequence) {
			List<TemplateNode> elements = new ArrayList<>(sequence.size());
			for (int i = 0; i < sequence.size(); i++) {
				elements.add(compile(sequence.get(i), location.element(i), scope, depth + 1));
			}
			return new SequenceNode(location, elements);
		} else if (template instanceof StringValue string) {
			return compileLeaf(string, location);
		} else {
			return new ConstantNode(location, template);
		}
	}

	private static TemplateNode compileLeaf(StringValue leaf, TemplateLocation location) {
		Optional<String> literal = DecorationParser.literalText(leaf.value());
		if (literal.isPresent()) {
			return new LiteralNode(location, literal.get());
		} else if (PathExpression.isPathExpression(leaf.value())) {
			return new PathNode(location, PathExpression.parse(leaf.value()));
		} else {
			return new ConstantNode(location, leaf);
		}
	}

	private MappingNode compileMapping(MappingValue mapping, TemplateLocation location, @Nullable Scope scope, int depth) {
		List<Member> members = new ArrayList<>(mapping.size());
		Map<String, String> rawKeysByName = new HashMap<>();
		for (var entry: mapping.members().entrySet()) {
			TemplateLocation memberLocation = location.member(entry.getKey());
			DecoratedKey key = DecorationParser.parseKey(entry.getKey(), memberLocation);
			String clash = rawKeysByName.put(key.name(), key.rawKey());
			if (clash != null) {
				throw new TemplateSyntaxException(memberLocation, "key \"" + key.rawKey() + "\" produces output key \"" + key.name() + "\", which is already produced by \"" + clash + "\"");
			}
			members.add(compileMember(key, entry.getValue(), memberLocation, scope, depth + 1));
		}
		return new MappingNode(location, members);
	}

	private Member compileMember(DecoratedKey key, Value value, TemplateLocation location, @Nullable Scope scope, int depth) {
		if (key.isArrayConversion()) {
			if (!(value instanceof MappingValue body)) {
				throw new TemplateSyntaxException(location, "array conversion requires an object; got " + value.typeName());
			}
			ConversionNode conversion = compileConversion(body, location, depth);
			if (key.isSpread() && scope != null) {
				return new Member(key, conversion, scope.add(new SpreadSource(location, conversion)));
			} else {
				return new Member(key, conversion);
			}
		} else if (key.isSpread()) {
			if (scope == null) {
				LOGGER.debug("Spread entry {} is not inside an array conversion; treating it as a plain entry", location);
				return new Member(key, compile(value, location, null, depth));
			}
			// The spread value is evaluated once, outside the copies,
			// so spread markers inside it don't belong to this scope.
			TemplateNode source = compile(value, location, null, depth);
			return new Member(key, source, scope.add(new SpreadSource(location, source)));
		} else {
			return new Member(key, compile(value, location, scope, depth));
		}
	}

	private ConversionNode compileConversion(MappingValue body, TemplateLocation location, int depth) {
		Scope inner = new Scope();
		MappingNode bodyNode = compileMapping(body, location, inner, depth);
		if (inner.sources.isEmpty()) {
			throw new NoSpreadTargetException(location);
		}
		return new ConversionNode(location, bodyNode, inner.sources);
	}

	/**
	 * The spread sources discovered so far for one conversion, in document order.
	 */
	private static final class Scope {
		final List<SpreadSource> sources = new ArrayList<>();

		int add(SpreadSource source) {
			sources.add(source);
			return sources.size() - 1;
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(TemplateCompiler.class);
}

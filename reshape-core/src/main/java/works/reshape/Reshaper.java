package works.reshape;

import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.reshape.engine.TemplateWalker;
import works.reshape.exceptions.TemplateSyntaxException;
import works.reshape.exceptions.TransformException;
import works.reshape.path.PathResolver;
import works.reshape.template.TemplateCompiler;
import works.reshape.template.TemplateLocation;
import works.reshape.value.MappingValue;
import works.reshape.value.SequenceValue;
import works.reshape.value.Value;

import static java.util.Objects.requireNonNull;

/**
 * The entry point for reshaping documents.
 * <p>
 * A {@code Reshaper} holds only its {@link ReshapeSettings};
 * it is immutable and can be shared freely.
 */
public final class Reshaper {
	private final ReshapeSettings settings;
	private final TemplateCompiler compiler;
	private final TemplateWalker walker;

	private Reshaper(ReshapeSettings settings) {
		this.settings = settings;
		this.compiler = new TemplateCompiler(settings.maxDepth());
		this.walker = new TemplateWalker(new PathResolver(settings), settings.maxDepth());
	}

	public static Reshaper create() {
		return new Reshaper(ReshapeSettings.defaults());
	}

	public static Reshaper create(ReshapeSettings settings) {
		settings.validate();
		return new Reshaper(settings);
	}

	public ReshapeSettings settings() {
		return settings;
	}

	/**
	 * Parses and checks {@code template} so it can be applied to many sources.
	 *
	 * @throws TransformException if the template is malformed
	 */
	public CompiledTemplate compile(Value template) {
		return new CompiledTemplate(compiler.compile(requireNonNull(template)), walker);
	}

	/**
	 * @return a new document shaped like {@code template}, with values drawn from {@code source}
	 * @throws TransformException if the template is malformed or can't be evaluated against {@code source}
	 */
	public Value transform(Value source, Value template) {
		return compile(template).apply(source);
	}

	/**
	 * Applies each of several templates to the same source.
	 *
	 * @param templates an array of non-empty objects, each of which is a template
	 * @return an array holding the output of each template, in order
	 * @throws TemplateSyntaxException if {@code templates} is not an array of non-empty objects
	 * @throws TransformException if any one template fails
	 */
	public SequenceValue transformEach(Value source, Value templates) {
		if (!(templates instanceof SequenceValue sequence)) {
			throw new TemplateSyntaxException(TemplateLocation.ROOT, "templates must be an array of objects; got " + templates.typeName());
		}
		List<Value> results = new ArrayList<>(sequence.size());
		for (int i = 0; i < sequence.size(); i++) {
			Value template = sequence.get(i);
			TemplateLocation location = TemplateLocation.ROOT.element(i);
			if (!(template instanceof MappingValue mapping)) {
				throw new TemplateSyntaxException(location, "each template must be an object; got " + template.typeName());
			} else if (mapping.isEmpty()) {
				throw new TemplateSyntaxException(location, "template is an empty object");
			}
			LOGGER.debug("Transforming with template {} of {}", i + 1, sequence.size());
			results.add(transform(source, template));
		}
		return SequenceValue.of(results);
	}

	@Override
	public String toString() {
		return "Reshaper(" + settings + ")";
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(Reshaper.class);
}

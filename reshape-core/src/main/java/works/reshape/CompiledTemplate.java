package works.reshape;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.reshape.engine.TemplateWalker;
import works.reshape.exceptions.TransformException;
import works.reshape.template.TemplateNode;
import works.reshape.value.Value;

import static java.util.Objects.requireNonNull;

/**
 * A template whose decorations have already been parsed and checked.
 * Immutable and thread-safe.
 *
 * @see Reshaper#compile
 */
public final class CompiledTemplate {
	private final TemplateNode root;
	private final TemplateWalker walker;

	CompiledTemplate(TemplateNode root, TemplateWalker walker) {
		this.root = root;
		this.walker = walker;
	}

	/**
	 * @return the document this template produces from {@code source}
	 * @throws TransformException if any part of the template can't be evaluated;
	 * there are no partial results
	 */
	public Value apply(Value source) {
		requireNonNull(source);
		LOGGER.debug("Applying template {}", root.location());
		Value result = walker.render(source, root);
		if (LOGGER.isTraceEnabled()) {
			LOGGER.trace("Result: {}", result);
		}
		return result;
	}

	public TemplateNode root() {
		return root;
	}

	@Override
	public String toString() {
		return "CompiledTemplate(" + root + ")";
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(CompiledTemplate.class);
}

package works.reshape.path;

import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.reshape.ReshapeSettings;
import works.reshape.ReshapeSettings.MissingFieldMode;
import works.reshape.exceptions.DepthExceededException;
import works.reshape.exceptions.MissingFieldException;
import works.reshape.path.ResolvedSet.Flat;
import works.reshape.path.ResolvedSet.Scalar;
import works.reshape.template.TemplateLocation;
import works.reshape.value.MappingValue;
import works.reshape.value.SequenceValue;
import works.reshape.value.Value;

import static java.util.Objects.requireNonNull;

/**
 * Resolves {@link PathExpression}s against a source document.
 * <p>
 * The rules, applied segment by segment from the root:
 *
 * <ol>
 *     <li>
 *         When no segments remain, the current node is the result, even if it's an array.
 *     </li>
 *     <li>
 *         On a mapping, the next segment selects a member.
 *         A missing member is an error (or {@code null}, per {@link MissingFieldMode}).
 *     </li>
 *     <li>
 *         On an array, the remaining segments are applied to every element,
 *         and the results are concatenated in element order into a {@link Flat} result.
 *         Inside this fan-out, anything that lacks the next field contributes nothing,
 *         nested arrays fan out again,
 *         and a branch that ends on an array contributes that array's elements.
 *     </li>
 * </ol>
 *
 * A path that never reaches an array with segments left over yields a {@link Scalar}.
 */
public final class PathResolver {
	private final MissingFieldMode missingFieldMode;
	private final int maxDepth;

	public PathResolver(ReshapeSettings settings) {
		this.missingFieldMode = settings.missingFieldMode();
		this.maxDepth = settings.maxDepth();
	}

	public ResolvedSet resolve(Value source, PathExpression path) {
		return resolve(source, path, TemplateLocation.ROOT);
	}

	/**
	 * @param location the template node that contains {@code path}, for error reporting
	 */
	public ResolvedSet resolve(Value source, PathExpression path, TemplateLocation location) {
		requireNonNull(source);
		List<String> segments = path.segments();
		Value node = source;
		for (int i = 0; i < segments.size(); i++) {
			if (node instanceof SequenceValue sequence) {
				List<Value> results = new ArrayList<>();
				collect(sequence, segments, i, results, location, 1);
				if (LOGGER.isTraceEnabled()) {
					LOGGER.trace("{} fanned out at segment {} and collected {} value(s)", path, i + 1, results.size());
				}
				return new Flat(results);
			}
			Value child = (node instanceof MappingValue mapping) ? mapping.get(segments.get(i)) : null;
			if (child == null) {
				if (missingFieldMode == MissingFieldMode.NULL) {
					LOGGER.trace("{} has no field at segment {}; using null", path, i + 1);
					return new Scalar(Value.NULL);
				}
				throw new MissingFieldException(location, path, i, node.typeName());
			}
			node = child;
		}
		LOGGER.trace("{} resolved to a single {}", path, node.typeName());
		return new Scalar(node);
	}

	/**
	 * Applies {@code segments[index...]} to {@code node}, appending whatever it finds to {@code results}.
	 */
	private void collect(Value node, List<String> segments, int index, List<Value> results, TemplateLocation location, int depth) {
		if (depth > maxDepth) {
			throw new DepthExceededException(location, maxDepth);
		}
		if (index == segments.size()) {
			if (node instanceof SequenceValue sequence) {
				results.addAll(sequence.elements());
			} else {
				results.add(node);
			}
		} else if (node instanceof SequenceValue sequence) {
			for (Value element: sequence.elements()) {
				collect(element, segments, index, results, location, depth + 1);
			}
		} else if (node instanceof MappingValue mapping) {
			Value child = mapping.get(segments.get(index));
			if (child != null) {
				collect(child, segments, index + 1, results, location, depth + 1);
			}
		}
		// Scalars have no fields, so they contribute nothing
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(PathResolver.class);
}

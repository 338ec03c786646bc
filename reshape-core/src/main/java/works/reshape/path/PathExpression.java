package works.reshape.path;

import java.util.Arrays;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * A {@code /}-delimited location in a source document.
 * <p>
 * The path {@code /} has no segments and denotes the source root.
 * Segments are taken verbatim; there is no escaping,
 * so a path can't name a field whose key contains {@code /}.
 */
public final class PathExpression {
	public static final String SEPARATOR = "/";

	private final String text;
	private final List<String> segments;

	private PathExpression(String text, List<String> segments) {
		this.text = text;
		this.segments = segments;
	}

	/**
	 * @throws IllegalArgumentException if {@code text} does not start with {@code /}
	 */
	public static PathExpression parse(String text) {
		if (!isPathExpression(text)) {
			throw new IllegalArgumentException("Path expression must start with \"" + SEPARATOR + "\": " + text);
		}
		if (text.equals(SEPARATOR)) {
			return new PathExpression(text, List.of());
		}
		String[] parts = text.substring(1).split(SEPARATOR, -1);
		return new PathExpression(text, List.copyOf(Arrays.asList(parts)));
	}

	public static boolean isPathExpression(String text) {
		return requireNonNull(text).startsWith(SEPARATOR);
	}

	public List<String> segments() {
		return segments;
	}

	public int length() {
		return segments.size();
	}

	@Override
	public String toString() {
		return text;
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof PathExpression other && text.equals(other.text);
	}

	@Override
	public int hashCode() {
		return text.hashCode();
	}
}

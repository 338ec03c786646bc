package works.reshape.template;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * Identifies a node of a template document by the raw keys and indexes leading to it,
 * decorations included, like {@code /[order]/...item_ids}.
 * <p>
 * Used to report errors; equality is structural.
 */
public final class TemplateLocation {
	public static final TemplateLocation ROOT = new TemplateLocation(null, null);

	private final @Nullable TemplateLocation parent;
	private final @Nullable Object segment; // String for members, Integer for elements

	private TemplateLocation(@Nullable TemplateLocation parent, @Nullable Object segment) {
		this.parent = parent;
		this.segment = segment;
	}

	public TemplateLocation member(String rawKey) {
		return new TemplateLocation(this, requireNonNull(rawKey));
	}

	public TemplateLocation element(int index) {
		if (index < 0) {
			throw new IllegalArgumentException("Negative index " + index);
		}
		return new TemplateLocation(this, index);
	}

	public boolean isRoot() {
		return parent == null;
	}

	public int depth() {
		int result = 0;
		for (TemplateLocation l = this; l.parent != null; l = l.parent) {
			result++;
		}
		return result;
	}

	@Override
	public String toString() {
		if (isRoot()) {
			return "/";
		}
		Deque<Object> segments = new ArrayDeque<>();
		for (TemplateLocation l = this; l.parent != null; l = l.parent) {
			segments.addFirst(l.segment);
		}
		StringBuilder sb = new StringBuilder();
		segments.forEach(s -> sb.append('/').append(s));
		return sb.toString();
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (o == null || getClass() != o.getClass()) {
			return false;
		}
		TemplateLocation that = (TemplateLocation) o;
		return Objects.equals(segment, that.segment) && Objects.equals(parent, that.parent);
	}

	@Override
	public int hashCode() {
		return Objects.hash(parent, segment);
	}
}

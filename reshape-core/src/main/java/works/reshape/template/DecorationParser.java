package works.reshape.template;

import java.util.EnumSet;
import java.util.Optional;
import works.reshape.exceptions.TemplateSyntaxException;

import static works.reshape.template.Decoration.ARRAY_CONVERSION;
import static works.reshape.template.Decoration.SPREAD;

/**
 * Pure functions that recognize {@link Decoration}s.
 * <p>
 * A key may carry both markers, as {@code ...[name]}; the spread prefix comes first.
 */
public final class DecorationParser {
	public static final String SPREAD_PREFIX = "...";
	public static final char CONVERSION_OPEN = '[';
	public static final char CONVERSION_CLOSE = ']';
	public static final char LITERAL_QUOTE = '\'';

	private DecorationParser() { }

	/**
	 * @param location where {@code rawKey} appears, for error reporting
	 * @throws TemplateSyntaxException if a marker is malformed, or leaves a name that is empty
	 * or still starts or ends with a marker
	 */
	public static DecoratedKey parseKey(String rawKey, TemplateLocation location) {
		EnumSet<Decoration> decorations = EnumSet.noneOf(Decoration.class);
		String name = rawKey;
		if (name.startsWith(SPREAD_PREFIX)) {
			decorations.add(SPREAD);
			name = name.substring(SPREAD_PREFIX.length());
			if (name.isEmpty()) {
				throw new TemplateSyntaxException(location, "spread marker \"" + SPREAD_PREFIX + "\" needs a name");
			}
		}
		if (!name.isEmpty() && name.charAt(0) == CONVERSION_OPEN) {
			if (name.length() < 2 || name.charAt(name.length() - 1) != CONVERSION_CLOSE) {
				throw new TemplateSyntaxException(location, "unterminated bracket in key \"" + rawKey + "\"");
			}
			decorations.add(ARRAY_CONVERSION);
			name = name.substring(1, name.length() - 1);
			if (name.isEmpty()) {
				throw new TemplateSyntaxException(location, "array conversion marker \"[]\" needs a name");
			}
		}
		if (decorations.isEmpty()) {
			return DecoratedKey.plain(rawKey);
		}
		if (name.startsWith(SPREAD_PREFIX)
			|| name.charAt(0) == CONVERSION_OPEN
			|| name.charAt(name.length() - 1) == CONVERSION_CLOSE) {
			// Markers only combine as "...[name]"
			throw new TemplateSyntaxException(location, "key \"" + rawKey + "\" leaves a marker in its output name \"" + name + "\"");
		}
		return new DecoratedKey(rawKey, name, decorations);
	}

	/**
	 * @return the text between the quotes if {@code leaf} is quoted like {@code 'text'}
	 */
	public static Optional<String> literalText(String leaf) {
		if (leaf.length() >= 2
			&& leaf.charAt(0) == LITERAL_QUOTE
			&& leaf.charAt(leaf.length() - 1) == LITERAL_QUOTE) {
			return Optional.of(leaf.substring(1, leaf.length() - 1));
		} else {
			return Optional.empty();
		}
	}
}

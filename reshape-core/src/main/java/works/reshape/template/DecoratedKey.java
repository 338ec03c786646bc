package works.reshape.template;

import java.util.EnumSet;
import java.util.Set;

import static java.util.Collections.unmodifiableSet;
import static java.util.Objects.requireNonNull;
import static works.reshape.template.Decoration.ARRAY_CONVERSION;
import static works.reshape.template.Decoration.SPREAD;

/**
 * A template key split into the output key {@code name} and the decorations that were stripped from it.
 */
public record DecoratedKey(String rawKey, String name, Set<Decoration> decorations) {
	public DecoratedKey {
		requireNonNull(rawKey);
		requireNonNull(name);
		decorations = decorations.isEmpty()
			? Set.of()
			: unmodifiableSet(EnumSet.copyOf(decorations));
	}

	public static DecoratedKey plain(String key) {
		return new DecoratedKey(key, key, Set.of());
	}

	public boolean isArrayConversion() {
		return decorations.contains(ARRAY_CONVERSION);
	}

	public boolean isSpread() {
		return decorations.contains(SPREAD);
	}

	@Override
	public String toString() {
		return rawKey;
	}
}

package works.reshape.template;

import static java.util.Objects.requireNonNull;

/**
 * One entry of a {@link MappingNode}.
 *
 * @param spreadSlot if this is a spread entry inside an array conversion,
 *                   the index of its {@link SpreadSource} in that conversion's
 *                   {@link ConversionNode#spreadSources() spreadSources};
 *                   otherwise {@link #NO_SLOT}.
 */
public record Member(DecoratedKey key, TemplateNode value, int spreadSlot) {
	public static final int NO_SLOT = -1;

	public Member {
		requireNonNull(key);
		requireNonNull(value);
		if (spreadSlot < NO_SLOT) {
			throw new IllegalArgumentException("Invalid spread slot " + spreadSlot);
		}
	}

	public Member(DecoratedKey key, TemplateNode value) {
		this(key, value, NO_SLOT);
	}

	/**
	 * @return the output key, with decorations stripped
	 */
	public String name() {
		return key.name();
	}

	/**
	 * @return true if an enclosing {@link ConversionNode} supplies this member's value
	 */
	public boolean isBound() {
		return spreadSlot != NO_SLOT;
	}

	@Override
	public String toString() {
		return key.rawKey() + (isBound() ? "#" + spreadSlot : "") + ": " + value;
	}
}

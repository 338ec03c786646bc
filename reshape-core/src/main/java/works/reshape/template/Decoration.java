package works.reshape.template;

/**
 * Template markers embedded in keys.
 * Quoted string leaves are recognized separately by {@link DecorationParser#literalText}.
 */
public enum Decoration {
	/**
	 * Key written {@code [name]}: the object value becomes an array under {@code name}.
	 */
	ARRAY_CONVERSION,

	/**
	 * Key written {@code ...name}: the entry supplies one element per generated copy
	 * of the nearest enclosing {@link #ARRAY_CONVERSION}.
	 */
	SPREAD,
}

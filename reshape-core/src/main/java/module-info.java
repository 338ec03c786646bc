/**
 * The reshape engine, independent of any document format.
 * <p>
 * Start with {@link works.reshape the root package}.
 * The document tree lives in {@link works.reshape.value},
 * template parsing in {@link works.reshape.template},
 * path resolution in {@link works.reshape.path},
 * and errors in {@link works.reshape.exceptions}.
 */
module works.reshape.core {
	requires transitive org.jetbrains.annotations;
	requires transitive org.pcollections;
	requires org.slf4j;

	requires static lombok;

	exports works.reshape;
	exports works.reshape.exceptions;
	exports works.reshape.path;
	exports works.reshape.template;
	exports works.reshape.value;
}

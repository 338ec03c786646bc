/**
 * The generic document tree shared by sources, templates and results.
 * <p>
 * A {@link works.reshape.value.Value} is one of six immutable variants:
 * {@link works.reshape.value.NullValue null},
 * {@link works.reshape.value.BooleanValue boolean},
 * {@link works.reshape.value.NumberValue number},
 * {@link works.reshape.value.StringValue string},
 * {@link works.reshape.value.SequenceValue sequence} and
 * {@link works.reshape.value.MappingValue mapping}.
 * The set is closed, so every traversal can be exhaustive.
 * <p>
 * Nothing in this package knows about any particular document format.
 * Converting to and from JSON text is the job of a separate binding module.
 */
package works.reshape.value;

/**
 * Path expressions and their resolution against a source document.
 * <p>
 * A path like {@code /order/shipments/items/quantity} walks mapping members by name.
 * Whenever it reaches an array with segments still to go, the rest of the path is applied
 * to every element and the results are concatenated in document order,
 * so arrays nested at any depth are flattened into one list.
 * See {@link works.reshape.path.PathResolver} for the exact rules.
 */
package works.reshape.path;

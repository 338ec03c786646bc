/**
 * Templates, compiled.
 * <p>
 * A template is an ordinary document whose leaves and keys carry a small micro-syntax:
 *
 * <ul>
 *     <li>
 *         a string leaf starting with {@code /} is a {@link works.reshape.path.PathExpression path}
 *         into the source;
 *     </li>
 *     <li>
 *         a string leaf wrapped in single quotes, like {@code 'USD'}, is a literal;
 *     </li>
 *     <li>
 *         a key wrapped in brackets, like {@code [order]}, turns its object into an array; and
 *     </li>
 *     <li>
 *         a key prefixed with {@code ...}, like {@code ...item_ids}, supplies one element
 *         per array entry to the nearest enclosing bracketed object.
 *     </li>
 * </ul>
 *
 * {@link works.reshape.template.TemplateCompiler} parses all of this once,
 * producing a tree of {@link works.reshape.template.TemplateNode}s
 * in which every decoration has been resolved into structure.
 * Evaluating that tree against a source document is the engine's job.
 */
package works.reshape.template;

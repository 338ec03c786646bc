/**
 * Evaluation of compiled templates.
 * <p>
 * {@link works.reshape.engine.TemplateWalker} evaluates each
 * {@link works.reshape.template.TemplateNode} recursively,
 * handing {@link works.reshape.template.ConversionNode}s to the array converter,
 * which evaluates the spread sources, checks that they agree on a length,
 * and evaluates one copy of the object per index.
 * Everything is evaluated against the original source document;
 * no evaluation ever sees the output of another.
 */
package works.reshape.engine;

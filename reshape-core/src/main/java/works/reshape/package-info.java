/**
 * Reshapes a source document into the structure declared by a template document.
 * <p>
 * Start with {@link works.reshape.Reshaper}:
 *
 * <pre>{@code
 * Reshaper reshaper = Reshaper.create();
 * Value output = reshaper.transform(source, template);
 * }</pre>
 *
 * or compile a template once and apply it repeatedly with {@link works.reshape.CompiledTemplate}.
 * Behaviour is tuned with {@link works.reshape.ReshapeSettings}.
 */
package works.reshape;

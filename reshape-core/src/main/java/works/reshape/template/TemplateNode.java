package works.reshape.template;

/**
 * A compiled template node. Each node "returns" one output value when evaluated.
 * <p>
 * Nodes are immutable and hold no per-source state,
 * so one compiled tree can be evaluated against any number of sources concurrently.
 * The {@link Object#toString() toString} method returns a compact description
 * suitable for log messages.
 */
public sealed interface TemplateNode permits
	PathNode,
	LiteralNode,
	ConstantNode,
	MappingNode,
	SequenceNode,
	ConversionNode
{
	/**
	 * @return where this node came from in the template document
	 */
	TemplateLocation location();
}

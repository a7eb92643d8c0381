package works.trellis;

import lombok.Builder;
import lombok.Builder.Default;
import lombok.Value;

/**
 * Knobs for a {@link ResourceTree}, supplied to {@link TreeBuilder#build(NodeType, TreeSettings)}.
 */
@Value
@Builder(toBuilder = true)
public class TreeSettings {
	/**
	 * The order in which {@link ResourceTree#routes()} visits each node type's static edges.
	 * Dynamic edges always follow, in declaration order.
	 * Lookup is unaffected: static names are matched exactly, so their order can't matter.
	 */
	@Default StaticRouteOrder staticRouteOrder = StaticRouteOrder.ALPHABETICAL;

	public static TreeSettings defaults() {
		return DEFAULTS;
	}

	public enum StaticRouteOrder {
		/**
		 * Sorted by name, so that route listings don't depend on the order
		 * in which a codebase happens to declare its mounts.
		 */
		ALPHABETICAL,

		DECLARATION,
	}

	private static final TreeSettings DEFAULTS = TreeSettings.builder().build();
}

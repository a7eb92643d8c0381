package works.trellis;

import org.pcollections.PVector;
import org.pcollections.TreePVector;

import static java.util.Objects.requireNonNull;

/**
 * A canonical path template derived from the declared tree,
 * such as {@code /users/{user_id}/posts/}.
 * Independent of any {@link Resource}.
 *
 * @param segments the steps from the root, not including the root itself
 * @param nodeTypes the node types along the route, starting with the root type;
 * one more than there are {@code segments}
 */
public record Route(
	PVector<RouteSegment> segments,
	PVector<NodeType<?>> nodeTypes
) {
	public Route {
		requireNonNull(segments);
		requireNonNull(nodeTypes);
		if (nodeTypes.size() != segments.size() + 1) {
			throw new IllegalArgumentException("Route with " + segments.size() + " segments needs "
				+ (segments.size() + 1) + " node types; got " + nodeTypes.size());
		}
	}

	static Route root(NodeType<?> rootType) {
		return new Route(TreePVector.empty(), TreePVector.<NodeType<?>>singleton(rootType));
	}

	Route then(MountEdge edge) {
		return new Route(segments.plus(edge.segment()), nodeTypes.plus(edge.child()));
	}

	/**
	 * @return the node type a path following this route resolves to
	 */
	public NodeType<?> target() {
		return nodeTypes.get(nodeTypes.size() - 1);
	}

	public String uri() {
		StringBuilder sb = new StringBuilder("/");
		for (RouteSegment segment : segments) {
			sb.append(segment).append('/');
		}
		return sb.toString();
	}

	@Override
	public String toString() {
		return uri();
	}
}

package works.trellis.conditions;

import java.util.List;
import java.util.Set;
import org.jetbrains.annotations.Nullable;
import works.trellis.NodeType;
import works.trellis.Route;
import works.trellis.RouteSegment;

import static java.util.Objects.requireNonNull;
import static java.util.stream.Collectors.toSet;

/**
 * What a {@link Condition} may know about a mount edge while routes are being listed,
 * when there are no resources yet.
 *
 * @param parent the route leading to the edge's parent
 * @param target the node type the edge leads to
 * @param metaname the edge's metaname
 * @param segment the segment the edge accepts if it is static; null if it is dynamic
 */
public record RouteContext(
	Route parent,
	NodeType<?> target,
	String metaname,
	@Nullable String segment
) {
	public RouteContext {
		requireNonNull(parent);
		requireNonNull(target);
		requireNonNull(metaname);
	}

	/**
	 * @return the node types along {@link #parent}, root first
	 */
	public List<NodeType<?>> ancestorTypes() {
		return parent.nodeTypes();
	}

	/**
	 * @return the names of the static segments along {@link #parent}
	 */
	public Set<String> staticNames() {
		return parent.segments().stream()
			.filter(s -> s instanceof RouteSegment.Fixed)
			.map(s -> ((RouteSegment.Fixed) s).name())
			.collect(toSet());
	}
}

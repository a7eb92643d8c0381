package works.trellis;

import java.util.List;
import java.util.Map;

import static java.util.stream.Collectors.toUnmodifiableMap;

/**
 * An immutable, declared tree of {@link NodeType}s, built by a {@link TreeBuilder}.
 * <p>
 * A tree is safe to share among threads: {@link #root()}, resolution from the
 * resources it returns, and {@link #routes()} touch no shared mutable state.
 * Any thread-safety requirements of {@link Resource#onInit()} implementations
 * are up to those implementations.
 *
 * @param <R> the class of the root resource
 */
public final class ResourceTree<R extends Resource> {
	private final String name;
	private final NodeType<R> rootType;
	private final TreeSettings settings;
	private final Map<NodeType<?>, MountTable> mountTables;
	private final Map<NodeType<?>, List<MountEdge>> mountPoints;

	ResourceTree(
		String name,
		NodeType<R> rootType,
		TreeSettings settings,
		Map<NodeType<?>, MountTable> mountTables,
		Map<NodeType<?>, List<MountEdge>> mountPoints
	) {
		this.name = name;
		this.rootType = rootType;
		this.settings = settings;
		this.mountTables = Map.copyOf(mountTables);
		this.mountPoints = mountPoints.entrySet().stream()
			.collect(toUnmodifiableMap(Map.Entry::getKey, e -> List.copyOf(e.getValue())));
	}

	public String name() {
		return name;
	}

	public NodeType<R> rootType() {
		return rootType;
	}

	public TreeSettings settings() {
		return settings;
	}

	/**
	 * @return a new root resource, from which paths can be resolved
	 */
	public R root() {
		return Traversal.instantiateRoot(this);
	}

	/**
	 * @return the edges declared under {@code type}; empty if it has none
	 */
	public MountTable mountTable(NodeType<?> type) {
		return mountTables.getOrDefault(type, MountTable.EMPTY);
	}

	/**
	 * @return the edges that mount {@code type} under some parent;
	 * more than one when the type is shared among several positions,
	 * and empty for the root
	 */
	public List<MountEdge> mountPoints(NodeType<?> type) {
		return mountPoints.getOrDefault(type, List.of());
	}

	/**
	 * @return every route of this tree, starting with the root's {@code /}.
	 * The result depends only on the declarations, so repeated calls return equal lists.
	 * Routes that a guard or condition rules out from the route alone,
	 * like comments under {@code not(underNamed("drafts"))} beneath {@code /drafts/}, are not listed.
	 * @see RouteEnumerator
	 */
	public List<Route> routes() {
		return RouteEnumerator.routes(this);
	}

	@Override
	public String toString() {
		return "ResourceTree(" + name + ", root=" + rootType + ")";
	}
}

package works.trellis;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.Nullable;
import works.trellis.MountEdge.DynamicEdge;
import works.trellis.MountEdge.StaticEdge;
import works.trellis.TreeSettings.StaticRouteOrder;

import static java.util.Collections.unmodifiableMap;

/**
 * The edges declared under one {@link NodeType}, in declaration order.
 * Immutable.
 */
public final class MountTable {
	private final List<MountEdge> edges;
	private final Map<String, StaticEdge> staticEdges;
	private final List<DynamicEdge> dynamicEdges;

	MountTable(List<MountEdge> edges) {
		this.edges = List.copyOf(edges);
		Map<String, StaticEdge> statics = new LinkedHashMap<>();
		List<DynamicEdge> dynamics = new ArrayList<>();
		for (MountEdge edge : this.edges) {
			if (edge instanceof StaticEdge s) {
				statics.put(s.name(), s);
			} else {
				dynamics.add((DynamicEdge) edge);
			}
		}
		this.staticEdges = unmodifiableMap(statics);
		this.dynamicEdges = List.copyOf(dynamics);
	}

	/**
	 * @return all edges, static and dynamic, in the order they were declared
	 */
	public List<MountEdge> edges() {
		return edges;
	}

	public @Nullable StaticEdge staticEdge(String name) {
		return staticEdges.get(name);
	}

	/**
	 * @return the static edge named {@code metaname} if there is one,
	 * otherwise the first dynamic edge with that metaname, otherwise null
	 */
	public @Nullable MountEdge edgeNamed(String metaname) {
		StaticEdge s = staticEdges.get(metaname);
		if (s != null) {
			return s;
		}
		for (DynamicEdge d : dynamicEdges) {
			if (d.metaname().equals(metaname)) {
				return d;
			}
		}
		return null;
	}

	public Collection<StaticEdge> staticEdges() {
		return staticEdges.values();
	}

	public List<DynamicEdge> dynamicEdges() {
		return dynamicEdges;
	}

	public boolean isEmpty() {
		return edges.isEmpty();
	}

	/**
	 * @return the edges in the order {@link ResourceTree#routes()} expands them:
	 * static ones first, ordered as {@code order} says, then dynamic ones as declared.
	 * This is the same precedence lookup uses.
	 */
	List<MountEdge> routeOrder(StaticRouteOrder order) {
		List<MountEdge> result = new ArrayList<>(edges.size());
		List<StaticEdge> statics = new ArrayList<>(staticEdges.values());
		if (order == StaticRouteOrder.ALPHABETICAL) {
			statics.sort(Comparator.comparing(StaticEdge::name));
		}
		result.addAll(statics);
		result.addAll(dynamicEdges);
		return result;
	}

	static final MountTable EMPTY = new MountTable(List.of());
}

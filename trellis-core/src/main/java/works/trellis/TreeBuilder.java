package works.trellis;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.trellis.MountEdge.DynamicEdge;
import works.trellis.MountEdge.StaticEdge;
import works.trellis.conditions.Condition;
import works.trellis.exceptions.InvalidTreeException;

import static java.util.Objects.requireNonNull;

/**
 * Declares the shape of a {@link ResourceTree}.
 * <p>
 * Typical usage, once at startup:
 *
 * <pre>
 * TreeBuilder builder = TreeBuilder.named("site");
 * builder.mountStatic(ROOT, "users", USERS);
 * builder.mountDynamic(USERS, Conditions.DEC_ID, USER, "user_id");
 * ResourceTree&lt;Root&gt; tree = builder.build(ROOT);
 * </pre>
 *
 * Edge order is significant: it is the order in which dynamic edges are tried during lookup,
 * and the order in which routes are listed.
 * <p>
 * Once {@link #build} has been called, the builder is frozen and rejects further mounts,
 * so a tree can't change under a caller that is resolving against it.
 * Not thread-safe; a tree is meant to be declared by one thread.
 */
public final class TreeBuilder {
	private final String name;
	private final Map<NodeType<?>, List<MountEdge>> edgesByParent = new LinkedHashMap<>();
	private boolean frozen = false;

	private TreeBuilder(String name) {
		this.name = requireNonNull(name);
	}

	/**
	 * @param name identifies the tree in log messages
	 */
	public static TreeBuilder named(String name) {
		return new TreeBuilder(name);
	}

	/**
	 * Mounts {@code child} under {@code parent} at the segment {@code name}.
	 *
	 * @throws InvalidTreeException if {@code parent} already has a static child with that name
	 */
	public TreeBuilder mountStatic(NodeType<?> parent, String name, NodeType<?> child) throws InvalidTreeException {
		return addStatic(new StaticEdge(parent, name, child, null));
	}

	/**
	 * Like {@link #mountStatic(NodeType, String, NodeType)}, but resolution also requires
	 * {@code guard} to match. A guard is how a static mount is limited to
	 * certain contexts (see {@link works.trellis.conditions.Under Under}) or permitted
	 * to recurse (see {@link works.trellis.conditions.Recursion Recursion}).
	 */
	public TreeBuilder mountStatic(NodeType<?> parent, String name, NodeType<?> child, Condition guard) throws InvalidTreeException {
		return addStatic(new StaticEdge(parent, name, child, requireNonNull(guard)));
	}

	/**
	 * Mounts {@code child} under {@code parent} at every segment matching {@code condition},
	 * using the condition's {@link Condition#defaultMetaname() default metaname}.
	 */
	public TreeBuilder mountDynamic(NodeType<?> parent, Condition condition, NodeType<?> child) {
		return mountDynamic(parent, condition, child, condition.defaultMetaname());
	}

	/**
	 * Mounts {@code child} under {@code parent} at every segment matching {@code condition}.
	 *
	 * @param metaname the key for values the condition extracts, and the placeholder name in routes
	 */
	public TreeBuilder mountDynamic(NodeType<?> parent, Condition condition, NodeType<?> child, String metaname) {
		return add(new DynamicEdge(parent, condition, child, metaname));
	}

	private TreeBuilder addStatic(StaticEdge edge) throws InvalidTreeException {
		checkNotFrozen();
		for (MountEdge existing : edgesByParent.getOrDefault(edge.parent(), List.of())) {
			if (existing instanceof StaticEdge s && s.name().equals(edge.name())) {
				throw new InvalidTreeException("Duplicate static child \"" + edge.name() + "\" under " + edge.parent()
					+ ": already mounted as " + s.child() + ", cannot also mount " + edge.child());
			}
		}
		return add(edge);
	}

	private TreeBuilder add(MountEdge edge) {
		checkNotFrozen();
		edgesByParent.computeIfAbsent(edge.parent(), k -> new ArrayList<>()).add(edge);
		LOGGER.debug("Tree \"{}\": mounted {} under {} at {}", name, edge.child(), edge.parent(), edge.segment());
		return this;
	}

	public <R extends Resource> ResourceTree<R> build(NodeType<R> rootType) throws InvalidTreeException {
		return build(rootType, TreeSettings.defaults());
	}

	/**
	 * Validates the declarations and freezes this builder.
	 *
	 * @throws InvalidTreeException if some node type can reach itself through edges none of which
	 * {@link MountEdge#isBounded() is bounded}
	 */
	public <R extends Resource> ResourceTree<R> build(NodeType<R> rootType, TreeSettings settings) throws InvalidTreeException {
		requireNonNull(rootType);
		requireNonNull(settings);
		checkNotFrozen();
		checkForUnboundedCycles();

		Map<NodeType<?>, MountTable> mountTables = new HashMap<>();
		Map<NodeType<?>, List<MountEdge>> mountPoints = new HashMap<>();
		int edgeCount = 0;
		for (var entry : edgesByParent.entrySet()) {
			mountTables.put(entry.getKey(), new MountTable(entry.getValue()));
			for (MountEdge edge : entry.getValue()) {
				mountPoints.computeIfAbsent(edge.child(), k -> new ArrayList<>()).add(edge);
				edgeCount++;
			}
		}

		Set<NodeType<?>> reachable = reachableFrom(rootType);
		Set<NodeType<?>> declared = new LinkedHashSet<>(edgesByParent.keySet());
		mountPoints.keySet().forEach(declared::add);
		declared.removeAll(reachable);
		if (!declared.isEmpty()) {
			LOGGER.warn("Tree \"{}\": node types not reachable from root {}: {}; may be misconfigured", name, rootType, declared);
		}

		frozen = true;
		LOGGER.info("Built tree \"{}\" rooted at {}: {} node type{}, {} edge{}",
			name, rootType,
			reachable.size(), (reachable.size() == 1) ? "" : "s",
			edgeCount, (edgeCount == 1) ? "" : "s");
		return new ResourceTree<>(name, rootType, settings, mountTables, mountPoints);
	}

	/**
	 * A cycle is fine as long as at least one of its edges is bounded,
	 * so we look for cycles in the graph of unbounded edges only.
	 */
	private void checkForUnboundedCycles() throws InvalidTreeException {
		Map<NodeType<?>, Visit> visits = new HashMap<>();
		for (NodeType<?> start : edgesByParent.keySet()) {
			if (visits.containsKey(start)) {
				continue;
			}
			// Iterative depth-first search; each frame is a node and the index of its next edge
			List<NodeType<?>> path = new ArrayList<>();
			List<Integer> nextEdge = new ArrayList<>();
			path.add(start);
			nextEdge.add(0);
			visits.put(start, Visit.IN_PROGRESS);
			while (!path.isEmpty()) {
				int top = path.size() - 1;
				NodeType<?> node = path.get(top);
				List<MountEdge> edges = edgesByParent.getOrDefault(node, List.of());
				int i = nextEdge.get(top);
				if (i >= edges.size()) {
					visits.put(node, Visit.DONE);
					path.remove(top);
					nextEdge.remove(top);
					continue;
				}
				nextEdge.set(top, i + 1);
				MountEdge edge = edges.get(i);
				if (edge.isBounded()) {
					continue;
				}
				NodeType<?> child = edge.child();
				Visit visit = visits.get(child);
				if (visit == Visit.IN_PROGRESS) {
					List<NodeType<?>> cycle = new ArrayList<>(path.subList(path.indexOf(child), path.size()));
					cycle.add(child);
					throw new InvalidTreeException("Tree \"" + name + "\" has a cycle with no bounded edge: " + cycle
						+ "; use a Recursion condition to permit it");
				} else if (visit == null) {
					visits.put(child, Visit.IN_PROGRESS);
					path.add(child);
					nextEdge.add(0);
				}
			}
		}
	}

	private Set<NodeType<?>> reachableFrom(NodeType<?> rootType) {
		Set<NodeType<?>> result = new LinkedHashSet<>();
		List<NodeType<?>> pending = new ArrayList<>();
		pending.add(rootType);
		while (!pending.isEmpty()) {
			NodeType<?> node = pending.remove(pending.size() - 1);
			if (result.add(node)) {
				for (MountEdge edge : edgesByParent.getOrDefault(node, List.of())) {
					pending.add(edge.child());
				}
			}
		}
		return result;
	}

	private void checkNotFrozen() {
		if (frozen) {
			throw new IllegalStateException("Tree \"" + name + "\" has already been built; its declaration can't change");
		}
	}

	private enum Visit { IN_PROGRESS, DONE }

	private static final Logger LOGGER = LoggerFactory.getLogger(TreeBuilder.class);
}

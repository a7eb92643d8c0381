package works.trellis;

import java.util.List;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.trellis.MountEdge.DynamicEdge;
import works.trellis.MountEdge.StaticEdge;
import works.trellis.conditions.Condition;
import works.trellis.conditions.MatchContext;
import works.trellis.conditions.MatchResult;
import works.trellis.exceptions.ChildNotFoundException;
import works.trellis.exceptions.NonexistentResourceException;

/**
 * Resolves segments into child resources using the parent's {@link MountTable}.
 * <p>
 * A static edge named exactly like the segment always wins, even if a dynamic edge
 * would also match; otherwise the dynamic edges are tried in declaration order.
 */
final class Traversal {
	private Traversal() { }

	static <R extends Resource> R instantiateRoot(ResourceTree<R> tree) {
		NodeType<R> rootType = tree.rootType();
		R root = rootType.newInstance();
		root.attach(tree, rootType, null, "", null, Metadata.empty(), null);
		try {
			root.onInit();
		} catch (NonexistentResourceException e) {
			throw new IllegalStateException("Root resource of tree \"" + tree.name() + "\" reports itself nonexistent", e);
		}
		return root;
	}

	static Resource resolve(Resource parent, String segment, @Nullable Object payload) throws ChildNotFoundException {
		MountTable table = parent.tree().mountTable(parent.nodeType());

		StaticEdge staticEdge = table.staticEdge(segment);
		if (staticEdge != null) {
			return resolveThrough(parent, staticEdge, segment, payload);
		}

		for (DynamicEdge edge : table.dynamicEdges()) {
			MatchResult result = admit(parent, edge, segment);
			if (result.matched()) {
				return instantiate(parent, edge, segment, result.metadata(), payload);
			}
		}

		LOGGER.debug("No edge under {} accepts \"{}\"", parent, segment);
		throw new ChildNotFoundException(segment, parent.uri());
	}

	/**
	 * Resolves {@code segment} using only the given {@code edge},
	 * ignoring any other edge that might have taken precedence.
	 */
	static Resource resolveThrough(Resource parent, MountEdge edge, String segment, @Nullable Object payload) throws ChildNotFoundException {
		MatchResult result = admit(parent, edge, segment);
		if (!result.matched()) {
			LOGGER.debug("Edge {} under {} rejected \"{}\"", edge.segment(), parent, segment);
			throw new ChildNotFoundException(segment, parent.uri());
		}
		return instantiate(parent, edge, segment, result.metadata(), payload);
	}

	private static MatchResult admit(Resource parent, MountEdge edge, String segment) {
		Condition condition;
		if (edge instanceof StaticEdge s) {
			if (!s.name().equals(segment)) {
				return MatchResult.notMatched();
			}
			condition = s.guard();
		} else {
			condition = ((DynamicEdge) edge).condition();
		}
		if (condition == null) {
			return MatchResult.matchedEmpty();
		}
		return condition.match(segment, new MatchContext(parent, edge.child(), edge.metaname()));
	}

	static Resource resolvePath(Resource start, List<String> segments) throws ChildNotFoundException {
		Resource current = start;
		int consumed = 0;
		for (String segment : segments) {
			try {
				current = resolve(current, segment, null);
			} catch (ChildNotFoundException e) {
				throw e.afterConsuming(consumed);
			}
			consumed++;
		}
		return current;
	}

	private static Resource instantiate(Resource parent, MountEdge edge, String segment, Metadata metadata, @Nullable Object payload) throws ChildNotFoundException {
		Resource child = edge.child().newInstance();
		child.attach(parent.tree(), edge.child(), edge, segment, parent, metadata, payload);
		try {
			child.onInit();
		} catch (NonexistentResourceException e) {
			LOGGER.debug("{} does not exist: {}", child, e.getMessage());
			throw new ChildNotFoundException(segment, parent.uri(), e);
		}
		LOGGER.trace("Resolved {}", child);
		return child;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(Traversal.class);
}

package works.trellis;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import works.trellis.exceptions.ChildNotFoundException;

/**
 * Creates children of one {@link Resource} through one particular {@link MountEdge}.
 * Obtained from {@link Resource#childFactory(String)}.
 * <p>
 * Each child is checked exactly as {@link Resource#get} would check it,
 * except that other edges are not consulted: a segment that an earlier edge would have claimed
 * is still resolved through this one.
 */
public final class ChildFactory {
	private final Resource parent;
	private final MountEdge edge;

	ChildFactory(Resource parent, MountEdge edge) {
		this.parent = parent;
		this.edge = edge;
	}

	public Resource parent() {
		return parent;
	}

	public MountEdge edge() {
		return edge;
	}

	public @NotNull Resource create(String segment) throws ChildNotFoundException {
		return create(segment, null);
	}

	/**
	 * @param payload made available to the child's {@link Resource#onInit()}
	 * @throws ChildNotFoundException if the edge's name, guard or condition rejects {@code segment},
	 * or the child reports itself nonexistent
	 */
	public @NotNull Resource create(String segment, @Nullable Object payload) throws ChildNotFoundException {
		return Traversal.resolveThrough(parent, edge, segment, payload);
	}

	@Override
	public String toString() {
		return "ChildFactory(" + parent + " " + edge.segment() + ")";
	}
}

package works.trellis.conditions;

import works.trellis.NodeType;
import works.trellis.Resource;

import static java.util.Objects.requireNonNull;

/**
 * What a {@link Condition} may know about the position at which a segment is being resolved.
 *
 * @param parent the resource whose child is being resolved
 * @param target the node type that will be instantiated if the condition matches
 * @param metaname the key under which extracted values are to be stored
 */
public record MatchContext(
	Resource parent,
	NodeType<?> target,
	String metaname
) {
	public MatchContext {
		requireNonNull(parent);
		requireNonNull(target);
		requireNonNull(metaname);
	}

	/**
	 * @return the parent and its ancestors, nearest first
	 */
	public Iterable<Resource> ancestors() {
		return parent.lineage();
	}
}

package works.trellis;

import org.jetbrains.annotations.Nullable;
import works.trellis.conditions.Condition;

import static java.util.Objects.requireNonNull;

/**
 * A declared parent-to-child relationship between two {@link NodeType}s.
 */
public sealed interface MountEdge permits MountEdge.StaticEdge, MountEdge.DynamicEdge {
	NodeType<?> parent();
	NodeType<?> child();

	/**
	 * @return the key under which values extracted on this edge are stored
	 */
	String metaname();

	RouteSegment segment();

	/**
	 * @see Condition#isBounded()
	 */
	boolean isBounded();

	/**
	 * Mounts {@code child} under {@code parent} at exactly one segment, {@code name}.
	 *
	 * @param guard if not null, must also match for the child to resolve
	 */
	record StaticEdge(
		NodeType<?> parent,
		String name,
		NodeType<?> child,
		@Nullable Condition guard
	) implements MountEdge {
		public StaticEdge {
			requireNonNull(parent);
			requireNonNull(name);
			requireNonNull(child);
		}

		@Override
		public String metaname() {
			return name;
		}

		@Override
		public RouteSegment segment() {
			return new RouteSegment.Fixed(name);
		}

		@Override
		public boolean isBounded() {
			return guard != null && guard.isBounded();
		}
	}

	/**
	 * Mounts {@code child} under {@code parent} at every segment matching {@code condition}.
	 */
	record DynamicEdge(
		NodeType<?> parent,
		Condition condition,
		NodeType<?> child,
		String metaname
	) implements MountEdge {
		public DynamicEdge {
			requireNonNull(parent);
			requireNonNull(condition);
			requireNonNull(child);
			requireNonNull(metaname);
		}

		@Override
		public RouteSegment segment() {
			return new RouteSegment.Variable(metaname);
		}

		@Override
		public boolean isBounded() {
			return condition.isBounded();
		}
	}
}

package works.trellis;

import java.util.function.Supplier;
import org.jetbrains.annotations.NotNull;

import static java.util.Objects.requireNonNull;

/**
 * A declared kind of {@link Resource}.
 * <p>
 * Node types are positioned in a tree by a {@link TreeBuilder};
 * the same node type may be mounted in several places, and even in several trees.
 * Equality is identity: two node types with the same name and class are still different node types.
 *
 * @param <R> the class of the resources this node type creates
 */
public final class NodeType<R extends Resource> {
	@NotNull private final String name;
	@NotNull private final Class<R> resourceClass;
	@NotNull private final Supplier<? extends R> factory;

	private NodeType(String name, Class<R> resourceClass, Supplier<? extends R> factory) {
		this.name = requireNonNull(name);
		this.resourceClass = requireNonNull(resourceClass);
		this.factory = requireNonNull(factory);
	}

	/**
	 * @param factory creates a fresh, unattached resource each time it is called;
	 *                usually a constructor reference
	 */
	public static <R extends Resource> NodeType<R> of(Class<R> resourceClass, Supplier<? extends R> factory) {
		return new NodeType<>(resourceClass.getSimpleName(), resourceClass, factory);
	}

	public static <R extends Resource> NodeType<R> of(String name, Class<R> resourceClass, Supplier<? extends R> factory) {
		return new NodeType<>(name, resourceClass, factory);
	}

	public String name() {
		return name;
	}

	public Class<R> resourceClass() {
		return resourceClass;
	}

	R newInstance() {
		R result = factory.get();
		if (!resourceClass.isInstance(result)) {
			throw new IllegalStateException("Factory for " + name + " returned " + result);
		}
		return result;
	}

	@Override
	public String toString() {
		return name;
	}
}

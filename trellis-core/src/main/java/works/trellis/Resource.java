package works.trellis;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import works.trellis.exceptions.ChildNotFoundException;
import works.trellis.exceptions.NonexistentResourceException;

import static java.util.Arrays.asList;

/**
 * A location-aware node produced by resolving path segments against a {@link ResourceTree}.
 * <p>
 * Subclass this for each kind of resource, declare a {@link NodeType} for the subclass,
 * and mount the node type with a {@link TreeBuilder}.
 * Resources are created only by the tree: {@link ResourceTree#root()} for the root,
 * and {@link #get} or {@link #resolvePath} for everything beneath it.
 * Each lookup creates new resources; nothing is cached.
 * <p>
 * A resource holds a reference to its parent, never to its children,
 * so a resource keeps its ancestors alive but nothing else.
 * <p>
 * Subclasses that need to do work on creation, like loading the entity
 * the resource represents, should override {@link #onInit()}.
 * Resources are not thread-safe; they belong to whichever call produced them.
 */
public abstract class Resource {
	private ResourceTree<?> tree;
	private NodeType<?> nodeType;
	private @Nullable MountEdge mountEdge;
	private String name;
	private @Nullable Resource parent;
	private Metadata metadata;
	private String uri;
	private @Nullable Object payload;

	final void attach(ResourceTree<?> tree, NodeType<?> nodeType, @Nullable MountEdge mountEdge, String name, @Nullable Resource parent, Metadata metadata, @Nullable Object payload) {
		if (this.tree != null) {
			throw new IllegalStateException("Resource is already attached: " + this);
		}
		this.tree = tree;
		this.nodeType = nodeType;
		this.mountEdge = mountEdge;
		this.name = name;
		this.parent = parent;
		this.metadata = metadata;
		this.uri = (parent == null) ? "/" : parent.uri() + name + "/";
		this.payload = payload;
	}

	/**
	 * Called once, after the resource's name, parent, metadata and {@link #payload()} are set,
	 * and before the resource is returned to whoever asked for it.
	 * <p>
	 * Throw {@link NonexistentResourceException} if the segment names an entity
	 * that doesn't exist; the caller will see a {@link ChildNotFoundException}.
	 * Any other exception propagates to the caller unchanged.
	 * <p>
	 * This may be called concurrently on different resources from different threads.
	 */
	protected void onInit() throws NonexistentResourceException {
	}

	public final ResourceTree<?> tree() {
		return attached().tree;
	}

	public final NodeType<?> nodeType() {
		return attached().nodeType;
	}

	/**
	 * @return the edge this resource was resolved through, or null for the root
	 */
	public final @Nullable MountEdge mountEdge() {
		return attached().mountEdge;
	}

	/**
	 * @return the segment this resource was resolved from; empty for the root
	 */
	public final String name() {
		return attached().name;
	}

	/**
	 * @return the resource under which this one was resolved, or null for the root
	 */
	public final @Nullable Resource parent() {
		return attached().parent;
	}

	/**
	 * @return values extracted from {@link #name()} by the condition that matched it
	 */
	public final Metadata metadata() {
		return attached().metadata;
	}

	/**
	 * @return the path from the root to this resource, like {@code /users/1/}
	 */
	public final String uri() {
		return attached().uri;
	}

	/**
	 * Whatever the caller passed to {@link #get(String, Object)} or {@link ChildFactory#create(String, Object)}
	 * when creating this resource; null if nothing was passed,
	 * as is always the case for resources resolved by {@link #resolvePath}.
	 * Typically something the caller already loaded, so {@link #onInit()} needn't load it again.
	 */
	protected final @Nullable Object payload() {
		return attached().payload;
	}

	/**
	 * @throws ChildNotFoundException if no mount edge accepts {@code segment},
	 * or the resulting resource reports itself nonexistent
	 */
	public final @NotNull Resource get(String segment) throws ChildNotFoundException {
		return get(segment, null);
	}

	/**
	 * Like {@link #get(String)}, but makes {@code payload} available to the child's {@link #onInit()}.
	 */
	public final @NotNull Resource get(String segment, @Nullable Object payload) throws ChildNotFoundException {
		return Traversal.resolve(attached(), segment, payload);
	}

	/**
	 * For creating children through one particular edge: the static edge named {@code metaname},
	 * or otherwise the first dynamic edge declared with that metaname.
	 * Useful when the caller already knows what kind of child it wants,
	 * such as when listing the children of a collection.
	 *
	 * @throws ChildNotFoundException if this resource's node type has no such edge
	 */
	public final ChildFactory childFactory(String metaname) throws ChildNotFoundException {
		MountEdge edge = tree().mountTable(nodeType()).edgeNamed(metaname);
		if (edge == null) {
			throw new ChildNotFoundException(metaname, uri());
		}
		return new ChildFactory(this, edge);
	}

	/**
	 * Like {@link #get} but returns {@code defaultValue} instead of throwing {@link ChildNotFoundException}.
	 */
	public final @Nullable Resource tryGet(String segment, @Nullable Resource defaultValue) {
		try {
			return get(segment);
		} catch (ChildNotFoundException e) {
			return defaultValue;
		}
	}

	/**
	 * Resolves each of {@code segments} in turn, starting from this resource.
	 * Stops at the first one that can't be resolved.
	 *
	 * @throws ChildNotFoundException whose {@link ChildNotFoundException#consumed() consumed}
	 * count says how many segments were resolved before the failure
	 */
	public final @NotNull Resource resolvePath(List<String> segments) throws ChildNotFoundException {
		return Traversal.resolvePath(attached(), segments);
	}

	public final @NotNull Resource resolvePath(String... segments) throws ChildNotFoundException {
		return resolvePath(asList(segments));
	}

	/**
	 * @return this resource followed by each of its ancestors up to and including the root.
	 * Each call to {@link Iterable#iterator()} starts a new, independent walk.
	 */
	public final Iterable<Resource> lineage() {
		Resource start = attached();
		return () -> new Iterator<>() {
			@Nullable Resource next = start;

			@Override
			public boolean hasNext() {
				return next != null;
			}

			@Override
			public Resource next() {
				if (next == null) {
					throw new NoSuchElementException();
				}
				Resource result = next;
				next = result.parent;
				return result;
			}
		};
	}

	/**
	 * @return the nearest resource in the {@link #lineage()} having the given {@code type}
	 */
	public final <T extends Resource> Optional<T> ancestor(NodeType<T> type) {
		for (Resource r : lineage()) {
			if (r.nodeType == type) {
				return Optional.of(type.resourceClass().cast(r));
			}
		}
		return Optional.empty();
	}

	/**
	 * @return the nearest resource in the {@link #lineage()} resolved from the segment {@code name}
	 */
	public final Optional<Resource> ancestorNamed(String name) {
		for (Resource r : lineage()) {
			if (r.name.equals(name)) {
				return Optional.of(r);
			}
		}
		return Optional.empty();
	}

	private Resource attached() {
		if (tree == null) {
			throw new IllegalStateException("Resource " + getClass().getSimpleName() + " was not created by a ResourceTree");
		}
		return this;
	}

	/**
	 * Resources are equal if they have the same node type and the same path.
	 */
	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (o == null || getClass() != o.getClass()) {
			return false;
		}
		Resource that = (Resource) o;
		return this.nodeType == that.nodeType && Objects.equals(this.uri, that.uri);
	}

	@Override
	public int hashCode() {
		return Objects.hash(nodeType, uri);
	}

	@Override
	public String toString() {
		if (tree == null) {
			return "<" + getClass().getSimpleName() + ": (unattached)>";
		}
		return "<" + nodeType.name() + ": " + uri + ">";
	}
}

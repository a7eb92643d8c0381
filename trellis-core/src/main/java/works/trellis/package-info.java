/**
 * Declares trees of location-aware resources and resolves path segments against them.
 * <p>
 * Declare each kind of resource as a {@link works.trellis.NodeType NodeType},
 * arrange them with a {@link works.trellis.TreeBuilder TreeBuilder},
 * and {@link works.trellis.TreeBuilder#build build} a
 * {@link works.trellis.ResourceTree ResourceTree}.
 * From the tree's {@link works.trellis.ResourceTree#root() root},
 * {@link works.trellis.Resource#get get} and
 * {@link works.trellis.Resource#resolvePath resolvePath}
 * produce {@link works.trellis.Resource Resource}s that know their name, parent and path,
 * while {@link works.trellis.ResourceTree#routes() routes} lists the
 * path templates the tree can resolve.
 * <p>
 * Conditions for dynamic mounts are in {@link works.trellis.conditions},
 * and exceptions in {@link works.trellis.exceptions}.
 */
package works.trellis;

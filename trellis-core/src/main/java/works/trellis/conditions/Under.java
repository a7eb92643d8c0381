package works.trellis.conditions;

import java.util.Set;
import org.jetbrains.annotations.Nullable;
import works.trellis.MountEdge;
import works.trellis.NodeType;
import works.trellis.Resource;

/**
 * Matches only beneath particular ancestors:
 * some resource on the ancestor chain must either have one of the given {@code types}
 * or have been resolved through a static edge named one of the given {@code names}.
 * A resource resolved through a dynamic edge never counts by name,
 * even if its segment happens to be one of the {@code names}.
 * <p>
 * Only strict ancestors count: the resource being created is not on the chain,
 * so {@code under(T)} on an edge leading to {@code T} does not match by virtue of that edge.
 * <p>
 * The segment itself is ignored unless a {@code subcondition} is given,
 * in which case the segment must also satisfy it, and its metadata is the result's.
 * <p>
 * {@code new Under(Set.of(), Set.of("drafts"), null).not()} is the usual way
 * to keep a child out of one branch of a shared subtree.
 */
public record Under(
	Set<NodeType<?>> types,
	Set<String> names,
	@Nullable Condition subcondition
) implements Condition {
	public Under {
		types = Set.copyOf(types);
		names = Set.copyOf(names);
		if (types.isEmpty() && names.isEmpty()) {
			throw new IllegalArgumentException("Under requires at least one ancestor type or name");
		}
	}

	@Override
	public MatchResult match(String segment, MatchContext context) {
		for (Resource ancestor : context.ancestors()) {
			if (types.contains(ancestor.nodeType()) || isNamed(ancestor)) {
				return (subcondition == null) ? MatchResult.matchedEmpty() : subcondition.match(segment, context);
			}
		}
		return MatchResult.notMatched();
	}

	private boolean isNamed(Resource ancestor) {
		return ancestor.mountEdge() instanceof MountEdge.StaticEdge && names.contains(ancestor.name());
	}

	@Override
	public Verdict decide(RouteContext context) {
		boolean found = context.ancestorTypes().stream().anyMatch(types::contains)
			|| context.staticNames().stream().anyMatch(names::contains);
		if (!found) {
			return Verdict.FAILS;
		}
		return (subcondition == null) ? Verdict.MATCHES : subcondition.decide(context);
	}

	@Override
	public String defaultMetaname() {
		return (subcondition == null) ? "name" : subcondition.defaultMetaname();
	}

	@Override
	public boolean isBounded() {
		return subcondition != null && subcondition.isBounded();
	}
}

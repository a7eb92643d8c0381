package works.trellis.conditions;

import java.util.List;
import org.pcollections.PVector;
import org.pcollections.TreePVector;
import works.trellis.NodeType;
import works.trellis.Resource;

import static java.util.Objects.requireNonNull;

/**
 * Permits a node type to appear repeatedly along one path,
 * which is how variable-depth trees (folders in folders, categories in categories) are declared.
 * <p>
 * The <em>depth</em> of a match is the number of resources of the target node type
 * on the ancestor chain, plus one for the resource being created.
 * The condition matches when {@code subcondition} matches the segment
 * and the depth does not exceed {@code maxDepth}.
 * <p>
 * The extracted value is a list: the list extracted by the nearest ancestor of the target type
 * (if it has one under the same metaname) followed by the value for this segment,
 * which is what {@code subcondition} extracted under the metaname,
 * or otherwise the segment itself.
 * So for {@code /docs/a/b}, a self-mounted folder type sees {@code [docs, a, b]}.
 * <p>
 * Recursion is {@link #isBounded() bounded}, so its edges may close cycles in the declared tree.
 */
public record Recursion(Condition subcondition, int maxDepth) implements Condition {
	public Recursion {
		requireNonNull(subcondition);
		if (maxDepth < 1) {
			throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
		}
	}

	@Override
	public MatchResult match(String segment, MatchContext context) {
		MatchResult sub = subcondition.match(segment, context);
		if (!sub.matched()) {
			return MatchResult.notMatched();
		}

		int depth = 1;
		List<?> previous = null;
		for (Resource ancestor : context.ancestors()) {
			if (ancestor.nodeType() == context.target()) {
				if (++depth > maxDepth) {
					return MatchResult.notMatched();
				}
				if (depth == 2 && ancestor.metadata().get(context.metaname()) instanceof List<?> list) {
					// Only the nearest one counts
					previous = list;
				}
			}
		}

		Object value = sub.metadata().get(context.metaname());
		if (value == null) {
			value = segment;
		}
		PVector<Object> captured = (previous == null)
			? TreePVector.singleton(value)
			: TreePVector.<Object>from(previous).plus(value);
		return MatchResult.matched(sub.metadata().plus(context.metaname(), captured));
	}

	@Override
	public Verdict decide(RouteContext context) {
		int depth = 1;
		for (NodeType<?> type : context.ancestorTypes()) {
			if (type == context.target()) {
				depth++;
			}
		}
		return (depth > maxDepth) ? Verdict.FAILS : subcondition.decide(context);
	}

	@Override
	public String defaultMetaname() {
		return subcondition.defaultMetaname();
	}

	@Override
	public boolean isBounded() {
		return true;
	}
}

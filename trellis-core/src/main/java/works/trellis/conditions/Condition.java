package works.trellis.conditions;

import java.util.List;

/**
 * Decides whether a path segment, in the context of the resource it is being
 * resolved under, may be resolved through some mount edge.
 * <p>
 * Conditions are immutable and must not have side effects,
 * so a single condition can be shared by any number of edges and threads.
 */
public sealed interface Condition permits
	Literal,
	DecimalId,
	Matches,
	And,
	Or,
	Not,
	Under,
	Recursion
{
	MatchResult match(String segment, MatchContext context);

	/**
	 * Used when listing routes, to leave out edges that can never be resolved
	 * where they are declared.
	 * Must agree with {@link #match} whenever it doesn't return {@link Verdict#UNDECIDED UNDECIDED}.
	 */
	Verdict decide(RouteContext context);

	/**
	 * @return the metaname used for an edge mounted with this condition
	 * when the declaration doesn't supply one
	 */
	String defaultMetaname();

	/**
	 * A bounded condition limits how many times its edge can appear along one path.
	 * Only edges with a bounded condition may close a cycle in the declared tree.
	 */
	default boolean isBounded() {
		return false;
	}

	default Condition and(Condition other) {
		return new And(List.of(this, other));
	}

	default Condition or(Condition other) {
		return new Or(List.of(this, other));
	}

	default Condition not() {
		return new Not(this);
	}
}

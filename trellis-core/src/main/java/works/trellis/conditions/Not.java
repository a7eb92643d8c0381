package works.trellis.conditions;

import static java.util.Objects.requireNonNull;

/**
 * Matches when {@code condition} doesn't. Never extracts metadata.
 */
public record Not(Condition condition) implements Condition {
	public Not {
		requireNonNull(condition);
	}

	@Override
	public MatchResult match(String segment, MatchContext context) {
		return condition.match(segment, context).matched() ? MatchResult.notMatched() : MatchResult.matchedEmpty();
	}

	@Override
	public Verdict decide(RouteContext context) {
		return condition.decide(context).negate();
	}

	@Override
	public String defaultMetaname() {
		return condition.defaultMetaname();
	}
}

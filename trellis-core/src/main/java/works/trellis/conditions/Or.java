package works.trellis.conditions;

import java.util.List;

/**
 * Matches when any of {@code conditions} matches, trying them in declaration order.
 * The metadata comes from the first one that matches.
 */
public record Or(List<Condition> conditions) implements Condition {
	public Or {
		conditions = List.copyOf(conditions);
		if (conditions.isEmpty()) {
			throw new IllegalArgumentException("Or requires at least one condition");
		}
	}

	@Override
	public MatchResult match(String segment, MatchContext context) {
		for (Condition c : conditions) {
			MatchResult result = c.match(segment, context);
			if (result.matched()) {
				return result;
			}
		}
		return MatchResult.notMatched();
	}

	@Override
	public Verdict decide(RouteContext context) {
		Verdict result = Verdict.FAILS;
		for (Condition c : conditions) {
			Verdict v = c.decide(context);
			if (v == Verdict.MATCHES) {
				return Verdict.MATCHES;
			} else if (v == Verdict.UNDECIDED) {
				result = Verdict.UNDECIDED;
			}
		}
		return result;
	}

	@Override
	public String defaultMetaname() {
		return conditions.get(0).defaultMetaname();
	}

	@Override
	public boolean isBounded() {
		return conditions.stream().allMatch(Condition::isBounded);
	}
}

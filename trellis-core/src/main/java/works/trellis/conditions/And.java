package works.trellis.conditions;

import java.util.List;
import works.trellis.Metadata;

/**
 * Matches when every one of {@code conditions} matches.
 * <p>
 * Metadata from all of them is merged in declaration order;
 * when two extract the same key, the later one wins.
 * Evaluation stops at the first condition that doesn't match.
 */
public record And(List<Condition> conditions) implements Condition {
	public And {
		conditions = List.copyOf(conditions);
		if (conditions.isEmpty()) {
			throw new IllegalArgumentException("And requires at least one condition");
		}
	}

	@Override
	public MatchResult match(String segment, MatchContext context) {
		Metadata merged = Metadata.empty();
		for (Condition c : conditions) {
			MatchResult result = c.match(segment, context);
			if (!result.matched()) {
				return MatchResult.notMatched();
			}
			merged = merged.merge(result.metadata());
		}
		return MatchResult.matched(merged);
	}

	@Override
	public Verdict decide(RouteContext context) {
		Verdict result = Verdict.MATCHES;
		for (Condition c : conditions) {
			Verdict v = c.decide(context);
			if (v == Verdict.FAILS) {
				return Verdict.FAILS;
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

	/**
	 * Bounding any one conjunct bounds the whole.
	 */
	@Override
	public boolean isBounded() {
		return conditions.stream().anyMatch(Condition::isBounded);
	}
}

package works.trellis.conditions;

import static java.util.Objects.requireNonNull;

/**
 * Matches exactly one segment string. Extracts nothing.
 */
public record Literal(String value) implements Condition {
	public Literal {
		requireNonNull(value);
	}

	@Override
	public MatchResult match(String segment, MatchContext context) {
		return value.equals(segment) ? MatchResult.matchedEmpty() : MatchResult.notMatched();
	}

	@Override
	public Verdict decide(RouteContext context) {
		return (context.segment() == null) ? Verdict.UNDECIDED : Verdict.of(value.equals(context.segment()));
	}

	@Override
	public String defaultMetaname() {
		return value;
	}
}

package works.trellis.conditions;

import java.util.regex.Pattern;
import works.trellis.Metadata;

import static java.util.Objects.requireNonNull;

/**
 * Matches a segment that the whole of {@code pattern} matches,
 * extracting the segment itself.
 */
public record Matches(Pattern pattern, String defaultMetaname) implements Condition {
	public Matches {
		requireNonNull(pattern);
		requireNonNull(defaultMetaname);
	}

	@Override
	public MatchResult match(String segment, MatchContext context) {
		if (pattern.matcher(segment).matches()) {
			return MatchResult.matched(Metadata.of(context.metaname(), segment));
		} else {
			return MatchResult.notMatched();
		}
	}

	@Override
	public Verdict decide(RouteContext context) {
		return (context.segment() == null) ? Verdict.UNDECIDED : Verdict.of(pattern.matcher(context.segment()).matches());
	}

	@Override
	public String toString() {
		return "Matches(" + pattern.pattern() + ")";
	}
}

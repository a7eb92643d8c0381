package works.trellis.conditions;

import org.jetbrains.annotations.Nullable;
import works.trellis.Metadata;

/**
 * Matches a non-empty segment made only of the ASCII digits {@code 0}-{@code 9},
 * extracting its value as a {@link Long}.
 * Digit strings too large for a {@code long} do not match.
 */
public record DecimalId() implements Condition {
	@Override
	public MatchResult match(String segment, MatchContext context) {
		Long value = parse(segment);
		if (value == null) {
			return MatchResult.notMatched();
		}
		return MatchResult.matched(Metadata.of(context.metaname(), value));
	}

	@Override
	public Verdict decide(RouteContext context) {
		return (context.segment() == null) ? Verdict.UNDECIDED : Verdict.of(parse(context.segment()) != null);
	}

	private static @Nullable Long parse(String segment) {
		if (segment.isEmpty()) {
			return null;
		}
		for (int i = 0; i < segment.length(); i++) {
			char c = segment.charAt(i);
			if (c < '0' || c > '9') {
				return null;
			}
		}
		try {
			return Long.parseLong(segment);
		} catch (NumberFormatException e) {
			return null;
		}
	}

	@Override
	public String defaultMetaname() {
		return "id";
	}

	@Override
	public String toString() {
		return "DecimalId";
	}
}

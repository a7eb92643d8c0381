package works.trellis.conditions;

import works.trellis.Metadata;

import static java.util.Objects.requireNonNull;

public sealed interface MatchResult permits MatchResult.Matched, MatchResult.NotMatched {
	boolean matched();

	/**
	 * @return the extracted values; always empty when not {@link #matched()}
	 */
	Metadata metadata();

	static MatchResult matched(Metadata metadata) {
		return new Matched(metadata);
	}

	static MatchResult matchedEmpty() {
		return MATCHED_EMPTY;
	}

	static MatchResult notMatched() {
		return NOT_MATCHED;
	}

	record Matched(Metadata metadata) implements MatchResult {
		public Matched {
			requireNonNull(metadata);
		}

		@Override
		public boolean matched() {
			return true;
		}
	}

	record NotMatched() implements MatchResult {
		@Override
		public boolean matched() {
			return false;
		}

		@Override
		public Metadata metadata() {
			return Metadata.empty();
		}
	}

	MatchResult MATCHED_EMPTY = new Matched(Metadata.empty());
	MatchResult NOT_MATCHED = new NotMatched();
}

package works.trellis.conditions;

/**
 * What a {@link Condition} can tell from a {@link RouteContext} alone.
 */
public enum Verdict {
	MATCHES,
	FAILS,

	/**
	 * The answer depends on the segment or on the resources themselves.
	 */
	UNDECIDED;

	public static Verdict of(boolean matches) {
		return matches ? MATCHES : FAILS;
	}

	public Verdict negate() {
		switch (this) {
			case MATCHES:
				return FAILS;
			case FAILS:
				return MATCHES;
			default:
				return UNDECIDED;
		}
	}
}

package works.trellis;

import static java.util.Objects.requireNonNull;

/**
 * One step of a {@link Route}.
 */
public sealed interface RouteSegment permits RouteSegment.Fixed, RouteSegment.Variable {
	/**
	 * A segment contributed by a static mount: always the same literal name.
	 */
	record Fixed(String name) implements RouteSegment {
		public Fixed {
			requireNonNull(name);
		}

		@Override
		public String toString() {
			return name;
		}
	}

	/**
	 * A segment contributed by a dynamic mount, rendered as {@code {metaname}}.
	 */
	record Variable(String metaname) implements RouteSegment {
		public Variable {
			requireNonNull(metaname);
		}

		@Override
		public String toString() {
			return "{" + metaname + "}";
		}
	}
}

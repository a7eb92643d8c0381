package works.trellis.conditions;

import java.util.Set;
import java.util.regex.Pattern;
import works.trellis.NodeType;

import static java.util.Arrays.asList;

/**
 * Commonly used conditions, and factory methods for the rest.
 */
public final class Conditions {
	private Conditions() { }

	/**
	 * Matches any segment at all, including the empty one.
	 */
	public static final Condition ANY_ID = new Matches(Pattern.compile(".*", Pattern.DOTALL), "name");

	/**
	 * Matches decimal numbers; see {@link DecimalId}.
	 */
	public static final Condition DEC_ID = new DecimalId();

	/**
	 * Matches hexadecimal numbers in either case.
	 */
	public static final Condition HEX_ID = new Matches(Pattern.compile("[a-f\\d]+", Pattern.CASE_INSENSITIVE), "id");

	/**
	 * Matches a single word, possibly hyphenated.
	 */
	public static final Condition TEXT_ID = new Matches(Pattern.compile("[\\w\\-]+", Pattern.UNICODE_CHARACTER_CLASS), "name");

	public static Condition literal(String value) {
		return new Literal(value);
	}

	public static Condition matching(String regex) {
		return matching(regex, "name");
	}

	public static Condition matching(String regex, String defaultMetaname) {
		return new Matches(Pattern.compile(regex), defaultMetaname);
	}

	public static Condition allOf(Condition... conditions) {
		return new And(asList(conditions));
	}

	public static Condition anyOf(Condition... conditions) {
		return new Or(asList(conditions));
	}

	public static Condition not(Condition condition) {
		return new Not(condition);
	}

	/**
	 * Matches beneath any resource of one of the given {@code types}.
	 */
	public static Condition under(NodeType<?>... types) {
		return new Under(Set.of(types), Set.of(), null);
	}

	/**
	 * Matches beneath any resource resolved from one of the given segment {@code names}.
	 */
	public static Condition underNamed(String... names) {
		return new Under(Set.of(), Set.of(names), null);
	}

	/**
	 * Matches segments satisfying {@code subcondition}, but only beneath a resource of the given {@code type}.
	 */
	public static Condition under(NodeType<?> type, Condition subcondition) {
		return new Under(Set.of(type), Set.of(), subcondition);
	}

	/**
	 * Matches segments satisfying {@code subcondition} at any depth.
	 */
	public static Condition recursion(Condition subcondition) {
		return new Recursion(subcondition, Integer.MAX_VALUE);
	}

	public static Condition recursion(Condition subcondition, int maxDepth) {
		return new Recursion(subcondition, maxDepth);
	}

	/**
	 * A guard for static mounts that close a cycle: any segment, at most {@code maxDepth} deep.
	 */
	public static Condition recursion(int maxDepth) {
		return new Recursion(ANY_ID, maxDepth);
	}
}

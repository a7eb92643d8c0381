package works.trellis.exceptions;

/**
 * A path segment could not be resolved to a child resource.
 * <p>
 * This is an expected outcome rather than a fault: the segment matched no
 * mount edge, matched an edge whose guard rejected it, or matched an edge
 * whose resource reported itself {@link NonexistentResourceException nonexistent}.
 * Hosts usually translate it into a "not found" response.
 */
public class ChildNotFoundException extends Exception {
	private final String segment;
	private final String path;
	private final int consumed;

	public String segment() {
		return this.segment;
	}

	/**
	 * @return the path of the resource that was asked for the child,
	 * in the form {@code /a/b/}
	 */
	public String path() {
		return this.path;
	}

	/**
	 * @return how many segments were successfully resolved before this one,
	 * when resolving a multi-segment path; zero for a single lookup
	 */
	public int consumed() {
		return this.consumed;
	}

	public ChildNotFoundException(String segment, String path) {
		this(segment, path, 0, null);
	}

	public ChildNotFoundException(String segment, String path, Throwable cause) {
		this(segment, path, 0, cause);
	}

	private ChildNotFoundException(String segment, String path, int consumed, Throwable cause) {
		super(fullMessage(segment, path), cause);
		this.segment = segment;
		this.path = path;
		this.consumed = consumed;
	}

	/**
	 * @return a copy of this exception recording that {@code consumed} segments
	 * had been resolved before the failure
	 */
	public ChildNotFoundException afterConsuming(int consumed) {
		return new ChildNotFoundException(segment, path, consumed, this.getCause());
	}

	private static String fullMessage(String segment, String path) {
		return "No child \"" + segment + "\" under " + path;
	}
}

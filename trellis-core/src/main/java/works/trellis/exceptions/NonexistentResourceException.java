package works.trellis.exceptions;

/**
 * Thrown by {@link works.trellis.Resource#onInit() onInit} to indicate that the
 * entity a segment names does not actually exist,
 * even though the segment matched a mount edge.
 * The resolver reports this to its caller as a {@link ChildNotFoundException}.
 */
public class NonexistentResourceException extends Exception {
	public NonexistentResourceException(String message) {
		super(message);
	}

	public NonexistentResourceException(String message, Throwable cause) {
		super(message, cause);
	}
}

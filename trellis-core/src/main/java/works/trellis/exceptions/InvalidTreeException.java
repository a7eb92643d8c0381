package works.trellis.exceptions;

/**
 * The declared tree is malformed.
 * Only ever thrown while the tree is being declared, never during resolution.
 */
public class InvalidTreeException extends Exception {
	public InvalidTreeException(String message) {
		super(message);
	}

	public InvalidTreeException(String message, Throwable cause) {
		super(message, cause);
	}
}

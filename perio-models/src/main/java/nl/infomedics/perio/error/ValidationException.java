package nl.infomedics.perio.error;

/**
 * Raised when a record or argument carries a value that cannot be accepted:
 * a date that is not {@code yyyyMMdd}, a missing required field, an unknown sex
 * or a blank patient key.
 */
public class ValidationException extends RuntimeException {
	private static final long serialVersionUID = -3270149823517626051L;

	private final String field;

	public ValidationException(String field, String message) {
		super(message);
		this.field = field;
	}

	public ValidationException(String field, String message, Throwable cause) {
		super(message, cause);
		this.field = field;
	}

	/** Name of the offending record field, or the argument name. */
	public String getField() {
		return field;
	}
}

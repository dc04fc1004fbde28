package works.bosk.pvl.exceptions;

/**
 * A value has no representation in the target dialect,
 * or it would not decode back to the same value.
 */
public final class PvlEncodeException extends PvlException {
	public PvlEncodeException(String message) {
		super(message);
	}

	public PvlEncodeException(String message, Throwable cause) {
		super(message, cause);
	}
}

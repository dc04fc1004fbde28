package works.bosk.pvl.exceptions;

/**
 * A token's text could not be converted to the kind of value
 * the caller asked for.
 */
public final class PvlDecodeException extends PvlException {
	public PvlDecodeException(String message) {
		super(message);
	}

	public PvlDecodeException(String message, Throwable cause) {
		super(message, cause);
	}
}

package works.bosk.pvl.exceptions;

/**
 * The tokens of the input text do not form a valid module
 * under the parser's rules.
 */
public final class PvlParseException extends PvlException {
	public PvlParseException(String message) {
		super(message);
	}

	public PvlParseException(Throwable cause) {
		super(cause);
	}

	public PvlParseException(String message, Throwable cause) {
		super(message, cause);
	}
}

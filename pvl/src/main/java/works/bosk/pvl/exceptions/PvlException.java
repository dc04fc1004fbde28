package works.bosk.pvl.exceptions;

public sealed abstract class PvlException extends RuntimeException
	permits PvlLexerException, PvlParseException, PvlDecodeException, PvlEncodeException {
	protected PvlException(String message) {
		super(message);
	}

	protected PvlException(Throwable cause) {
		super(cause);
	}

	protected PvlException(String message, Throwable cause) {
		super(message, cause);
	}

	/**
	 * @return an exception of the same kind as <code>exception</code>
	 * whose message is prefixed with <code>context</code>.
	 * Lexer exceptions keep their source location.
	 */
	@SuppressWarnings("unchecked")
	public static <T extends PvlException> T wrap(T exception, String context) {
		String newMessage = context + ": " + exception.getMessage();
		if (exception instanceof PvlLexerException e) {
			return (T) new PvlLexerException(newMessage, e.offset(), e.line(), e.column(), e.context(), e);
		} else if (exception instanceof PvlParseException e) {
			return (T) new PvlParseException(newMessage, e);
		} else if (exception instanceof PvlDecodeException e) {
			return (T) new PvlDecodeException(newMessage, e);
		} else {
			return (T) new PvlEncodeException(newMessage, exception);
		}
	}
}

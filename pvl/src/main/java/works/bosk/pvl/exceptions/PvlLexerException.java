package works.bosk.pvl.exceptions;

/**
 * The input text contains a character the grammar does not allow,
 * or ends inside a comment, quoted string, units expression or non-decimal literal.
 */
public final class PvlLexerException extends PvlException {
	private final int offset;
	private final int line;
	private final int column;
	private final String context;

	PvlLexerException(String message, int offset, int line, int column, String context, Throwable cause) {
		super(message, cause);
		this.offset = offset;
		this.line = line;
		this.column = column;
		this.context = context;
	}

	/**
	 * @param text the complete input
	 * @param offset position in <code>text</code> of the offending character
	 */
	public static PvlLexerException at(String problem, CharSequence text, int offset) {
		int line = 1;
		int lineStart = 0;
		for (int i = 0; i < offset && i < text.length(); i++) {
			if (text.charAt(i) == '\n') {
				line++;
				lineStart = i + 1;
			}
		}
		int column = offset - lineStart + 1;
		String context = text.subSequence(
			Math.max(0, offset - CONTEXT_RADIUS),
			Math.min(text.length(), offset + CONTEXT_RADIUS)).toString();
		String message = problem + ": line " + line + " column " + column + " (char " + offset + ") near |" + context + "|";
		return new PvlLexerException(message, offset, line, column, context, null);
	}

	public int offset() {
		return offset;
	}

	/**
	 * 1-based
	 */
	public int line() {
		return line;
	}

	/**
	 * 1-based
	 */
	public int column() {
		return column;
	}

	public String context() {
		return context;
	}

	private static final int CONTEXT_RADIUS = 20;
}

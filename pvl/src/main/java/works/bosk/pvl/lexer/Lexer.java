package works.bosk.pvl.lexer;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.NoSuchElementException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.bosk.pvl.decoder.Decoder;
import works.bosk.pvl.exceptions.PvlLexerException;
import works.bosk.pvl.grammar.Delimiters;
import works.bosk.pvl.grammar.Grammar;

import static java.util.Objects.requireNonNull;

/**
 * Splits text into {@link Token}s on demand.
 * <p>
 * Whitespace between tokens is discarded;
 * comments, quoted strings, units expressions and non-decimal literals
 * are each returned as a single token, verbatim, including their delimiters.
 * <p>
 * A consumer can look ahead with {@link #peek()}, or return a token it has already
 * taken with {@link #pushBack}; pushed-back tokens are returned again in last-in-first-out order.
 * <p>
 * Characters are examined only as tokens are requested, so a consumer that stops early
 * never sees errors in the rest of the text.
 * Not thread-safe.
 */
public final class Lexer {
	private final String text;
	private final Grammar grammar;
	private final Decoder decoder;
	private final Deque<Token> pushedBack = new ArrayDeque<>();

	private int position = 0;
	private final StringBuilder lexeme = new StringBuilder();
	private int lexemeStart = 0;
	private Preserve preserve = Preserve.NONE;
	private String preserveEnd = null;

	public Lexer(CharSequence text, Decoder decoder) {
		this.text = text.toString();
		this.decoder = requireNonNull(decoder);
		this.grammar = decoder.grammar();
	}

	public boolean hasNext() {
		if (!pushedBack.isEmpty()) {
			return true;
		}
		Token t = scan();
		if (t == null) {
			return false;
		}
		pushedBack.push(t);
		return true;
	}

	/**
	 * @throws NoSuchElementException if there are no more tokens
	 * @throws PvlLexerException if the text is invalid
	 */
	public Token next() {
		Token result = pushedBack.isEmpty() ? scan() : pushedBack.pop();
		if (result == null) {
			throw new NoSuchElementException("No more tokens");
		}
		return result;
	}

	/**
	 * @return the token that {@link #next()} would return, without consuming it
	 */
	public Token peek() {
		Token result = next();
		pushBack(result);
		return result;
	}

	public void pushBack(Token token) {
		pushedBack.push(requireNonNull(token));
	}

	/**
	 * @return the complete text being lexed
	 */
	public String text() {
		return text;
	}

	/**
	 * @return the next token from the text, or null at the end
	 */
	private Token scan() {
		int length = text.length();
		while (position < length) {
			int i = position;
			char c = text.charAt(i);
			if (!grammar.isCharAllowed(c)) {
				if (lexeme.length() != 0 && preserve == Preserve.NONE) {
					// The bad character is reported when the next token is requested
					return emit();
				}
				throw PvlLexerException.at("Character not allowed by " + grammar.name() + " grammar: " + describe(c), text, i);
			}
			int prev = (i == 0) ? -1 : text.charAt(i - 1);
			int next = (i + 1 < length) ? text.charAt(i + 1) : -1;
			if (lexeme.length() == 0) {
				lexemeStart = i;
			}
			lexChar(c, prev, next);
			position++;

			if (lexeme.length() == 0) {
				continue;
			}
			if (next == -1) {
				break;
			} else if (shouldContinue(c, next, i)) {
				continue;
			} else if (shouldEmit(next, i + 1)) {
				return emit();
			}
		}
		if (lexeme.length() == 0) {
			return null;
		}
		switch (preserve) {
			case NONE -> { }
			case COMMENT -> {
				if (!"\n".equals(preserveEnd)) {
					throw PvlLexerException.at("Unterminated comment", text, lexemeStart);
				}
			}
			case QUOTE -> throw PvlLexerException.at("Unterminated quoted string", text, lexemeStart);
			case UNITS -> throw PvlLexerException.at("Unterminated units expression", text, lexemeStart);
			case NON_DECIMAL -> throw PvlLexerException.at("Unterminated non-decimal literal", text, lexemeStart);
		}
		return emit();
	}

	private Token emit() {
		Token result = new Token(lexeme.toString(), lexemeStart);
		lexeme.setLength(0);
		preserve = Preserve.NONE;
		preserveEnd = null;
		LOGGER.trace("Token {}", result);
		return result;
	}

	private void lexChar(char c, int prev, int next) {
		switch (preserve) {
			case COMMENT -> lexComment(c, prev, next);
			case QUOTE -> {
				lexeme.append(c);
				if (grammar.allowMismatchedQuotes() ? grammar.isQuote(c) : preserveEnd.charAt(0) == c) {
					endPreserve();
				}
			}
			case UNITS, NON_DECIMAL -> {
				lexeme.append(c);
				if (preserveEnd.charAt(0) == c) {
					endPreserve();
				}
			}
			case NONE -> {
				Optional<Delimiters> lineComment = grammar.lineCommentStartingWith(c);
				if (c == RADIX_MARK && grammar.nonDecimalPrefixPattern().matcher(lexeme + String.valueOf(c)).matches()) {
					lexeme.append(c);
					startPreserve(Preserve.NON_DECIMAL, String.valueOf(RADIX_MARK));
				} else if (grammar.isBlockCommentChar(c)) {
					lexComment(c, prev, next);
				} else if (lineComment.isPresent()) {
					lexeme.append(c);
					startPreserve(Preserve.COMMENT, lineComment.get().close());
				} else if (c == grammar.unitsDelimiters().openChar()) {
					lexeme.append(c);
					startPreserve(Preserve.UNITS, grammar.unitsDelimiters().close());
				} else if (grammar.isQuote(c)) {
					lexeme.append(c);
					startPreserve(Preserve.QUOTE, String.valueOf(c));
				} else if (!grammar.isWhitespace(c)) {
					lexeme.append(c);
				}
			}
		}
	}

	/**
	 * Block comment markers are two characters long, so deciding what
	 * a <code>*</code> or <code>/</code> means takes a look at its neighbours.
	 * Line comments are handled like any other preserved run.
	 */
	private void lexComment(char c, int prev, int next) {
		if (preserve == Preserve.COMMENT && !BLOCK_CLOSE.equals(preserveEnd)) {
			lexeme.append(c);
			if (preserveEnd.charAt(0) == c) {
				endPreserve();
			}
			return;
		}
		if (c == '*') {
			if (prev == '/' && preserve == Preserve.NONE) {
				if (lexeme.length() == 0) {
					lexemeStart = position - 1;
				}
				lexeme.append(BLOCK_OPEN);
				startPreserve(Preserve.COMMENT, BLOCK_CLOSE);
			} else if (next == '/' && preserve == Preserve.COMMENT) {
				lexeme.append(BLOCK_CLOSE);
				endPreserve();
			} else if (next == '/') {
				// A stray close marker stays in the lexeme so the decoder can reject it
				lexeme.append(BLOCK_CLOSE);
			} else {
				lexeme.append(c);
			}
		} else if (c == '/') {
			// Outside a comment, a slash next to a star is part of a marker and was or will be appended with it
			if (preserve == Preserve.COMMENT || (prev != '*' && next != '*')) {
				lexeme.append(c);
			}
		} else {
			lexeme.append(c);
		}
	}

	private void startPreserve(Preserve state, String end) {
		preserve = state;
		preserveEnd = end;
	}

	private void endPreserve() {
		preserve = Preserve.NONE;
		preserveEnd = null;
	}

	/**
	 * @param i index of <code>c</code> in the text
	 */
	private boolean shouldContinue(char c, int next, int i) {
		if (preserve != Preserve.NONE) {
			return true;
		}
		char n = (char) next;
		if (grammar.isNumericStart(c) && (Character.isDigit(n) || n == '.')) {
			return true;
		}
		if (grammar.nonDecimalPrefixPattern().matcher(lexeme + String.valueOf(n)).matches()) {
			return true;
		}
		if ((c == 'e' || c == 'E')
			&& grammar.isNumericStart(n)
			&& i + 2 < text.length() && Character.isDigit(text.charAt(i + 2))
			&& decoder.isDecimal(lexeme.substring(0, lexeme.length() - 1))) {
			return true;
		}
		return decoder.allowsNumericTimezoneOffsets()
			&& grammar.isNumericStart(n)
			&& decoder.isDatetime(lexeme.toString());
	}

	/**
	 * @param nextIndex index of <code>next</code> in the text
	 */
	private boolean shouldEmit(int next, int nextIndex) {
		char n = (char) next;
		if (grammar.isWhitespace(n) || grammar.isReserved(n)) {
			return true;
		}
		if (grammar.commentStartingAt(text, nextIndex).isPresent()) {
			return true;
		}
		String s = lexeme.toString();
		if (grammar.isEndStatement(s) && !Character.isLetterOrDigit(n) && n != '_') {
			return true;
		}
		for (Delimiters comment : grammar.comments()) {
			if (s.endsWith(comment.close()) && s.startsWith(comment.open())) {
				return true;
			}
		}
		if (s.length() == 1 && grammar.isReserved(s.charAt(0))) {
			return true;
		}
		return decoder.isQuotedString(s);
	}

	private static String describe(char c) {
		return String.format("U+%04X", (int) c) + (Character.isISOControl(c) ? "" : " '" + c + "'");
	}

	/**
	 * Separates the radix from the digits of a non-decimal literal, and terminates the literal.
	 */
	private static final char RADIX_MARK = '#';
	private static final String BLOCK_OPEN = "/*";
	private static final String BLOCK_CLOSE = "*/";

	private static final Logger LOGGER = LoggerFactory.getLogger(Lexer.class);
}

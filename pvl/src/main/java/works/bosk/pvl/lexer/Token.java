package works.bosk.pvl.lexer;

import static java.util.Objects.requireNonNull;

/**
 * A lexeme and where it started in the source text.
 * Use {@link TokenClassifier} to find out what kind of lexeme it is.
 *
 * @param offset index in the source text of the token's first character
 */
public record Token(String text, int offset) {
	public Token {
		requireNonNull(text);
	}

	public boolean is(String s) {
		return text.equals(s);
	}

	public boolean is(char c) {
		return text.length() == 1 && text.charAt(0) == c;
	}

	@Override
	public String toString() {
		return "\"" + text + "\"@" + offset;
	}
}

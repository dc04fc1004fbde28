package works.bosk.pvl.lexer;

import works.bosk.pvl.decoder.Decoder;
import works.bosk.pvl.exceptions.PvlDecodeException;
import works.bosk.pvl.grammar.Delimiters;
import works.bosk.pvl.grammar.Grammar;

import static java.util.Objects.requireNonNull;

/**
 * Answers questions about what role a {@link Token} could play.
 */
public final class TokenClassifier {
	private final Grammar grammar;
	private final Decoder decoder;

	public TokenClassifier(Decoder decoder) {
		this.decoder = requireNonNull(decoder);
		this.grammar = decoder.grammar();
	}

	public Grammar grammar() {
		return grammar;
	}

	public Decoder decoder() {
		return decoder;
	}

	public boolean isComment(Token t) {
		String s = t.text();
		for (Delimiters c : grammar.comments()) {
			if (!s.startsWith(c.open())) {
				continue;
			}
			if (c.open().length() == 1) {
				// A line comment may be cut off by the end of the input
				int close = s.indexOf(c.close());
				if (close == -1 || close == s.length() - c.close().length()) {
					return true;
				}
			} else if (s.length() >= c.open().length() + c.close().length() && s.endsWith(c.close())) {
				return true;
			}
		}
		return false;
	}

	public boolean isSpace(Token t) {
		String s = t.text();
		if (s.isEmpty()) {
			return false;
		}
		for (int i = 0; i < s.length(); i++) {
			if (!grammar.isWhitespace(s.charAt(i))) {
				return false;
			}
		}
		return true;
	}

	/**
	 * Whitespace or comment: tokens with no meaning.
	 */
	public boolean isWSC(Token t) {
		return isComment(t) || isSpace(t);
	}

	public boolean isQuotedString(Token t) {
		return decoder.isQuotedString(t.text());
	}

	public boolean isDelimiter(Token t) {
		return t.is(grammar.statementDelimiter());
	}

	public boolean isBeginAggregation(Token t) {
		return grammar.isBeginAggregation(t.text());
	}

	public boolean isEndAggregation(Token t) {
		return grammar.isEndAggregation(t.text());
	}

	public boolean isEndStatement(Token t) {
		return grammar.isEndStatement(t.text());
	}

	public boolean isReservedKeyword(Token t) {
		return grammar.isReservedKeyword(t.text());
	}

	public boolean isNumeric(Token t) {
		return decoder.isNumeric(t.text());
	}

	public boolean isDatetime(Token t) {
		return decoder.isDatetime(t.text());
	}

	/**
	 * Could this token be a string without quotes around it?
	 * Keywords are not excluded here; see {@link #isParameterName}.
	 */
	public boolean isUnquotedString(Token t) {
		return isUnquotedString(t.text());
	}

	public boolean isUnquotedString(String s) {
		if (s.isEmpty()) {
			return false;
		}
		for (int i = 0; i < s.length(); i++) {
			char c = s.charAt(i);
			if (grammar.isReserved(c) || grammar.isWhitespace(c)) {
				return false;
			}
		}
		for (Delimiters c : grammar.comments()) {
			if (s.contains(c.open()) || s.contains(c.close())) {
				return false;
			}
		}
		return !decoder.isNumeric(s) && !decoder.isDatetime(s);
	}

	public boolean isParameterName(Token t) {
		return !isReservedKeyword(t) && isUnquotedString(t);
	}

	public boolean isSimpleValue(Token t) {
		try {
			decoder.decode(t.text());
			return true;
		} catch (PvlDecodeException e) {
			return false;
		}
	}
}

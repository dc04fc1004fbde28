package works.bosk.pvl.grammar;

import static java.util.Objects.requireNonNull;

/**
 * An opening and closing marker, like <code>(</code> and <code>)</code>,
 * or <code>/*</code> and <code>*&#47;</code>.
 */
public record Delimiters(String open, String close) {
	public Delimiters {
		requireNonNull(open);
		requireNonNull(close);
		if (open.isEmpty() || close.isEmpty()) {
			throw new IllegalArgumentException("Delimiters cannot be empty");
		}
		if (open.equals(close)) {
			throw new IllegalArgumentException("Opening and closing delimiters must differ: \"" + open + "\"");
		}
	}

	public static Delimiters of(char open, char close) {
		return new Delimiters(String.valueOf(open), String.valueOf(close));
	}

	/**
	 * @return true if this is a pair of one-character delimiters
	 */
	public boolean isSingleChar() {
		return open.length() == 1 && close.length() == 1;
	}

	public char openChar() {
		return open.charAt(0);
	}

	public char closeChar() {
		return close.charAt(0);
	}
}

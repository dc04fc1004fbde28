package works.bosk.pvl.grammar;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.IntPredicate;
import java.util.regex.Pattern;

import static java.util.Objects.requireNonNull;

/**
 * The lexical and syntactic tables that distinguish one dialect from another.
 * <p>
 * Immutable. Build new ones with {@link #builder()} or {@link #toBuilder()},
 * or use one of the presets: {@link #pvl()}, {@link #odl()}, {@link #isis()}, {@link #omni()}.
 * <p>
 * Keywords are matched case-insensitively everywhere.
 */
public final class Grammar {
	private final String name;
	private final String spacingCharacters;
	private final String formatEffectors;
	private final String reservedCharacters;
	private final String numericStartCharacters;
	private final char statementDelimiter;
	private final List<Delimiters> comments;
	private final Map<String, String> groupKeywords;
	private final Map<String, String> objectKeywords;
	private final Keywords preferredGroupKeywords;
	private final Keywords preferredObjectKeywords;
	private final String endStatement;
	private final String nullKeyword;
	private final String trueKeyword;
	private final String falseKeyword;
	private final String quotes;
	private final boolean allowMismatchedQuotes;
	private final Delimiters setDelimiters;
	private final Delimiters sequenceDelimiters;
	private final Delimiters unitsDelimiters;
	private final Pattern nonDecimalPattern;
	private final Pattern nonDecimalPrefixPattern;
	private final List<Pattern> leapSecondPatterns;
	private final IntPredicate charAllowed;
	private final Set<String> reservedKeywords;

	private Grammar(Builder b) {
		this.name = b.name;
		this.spacingCharacters = b.spacingCharacters;
		this.formatEffectors = b.formatEffectors;
		this.reservedCharacters = b.reservedCharacters;
		this.numericStartCharacters = b.numericStartCharacters;
		this.statementDelimiter = b.statementDelimiter;
		this.comments = List.copyOf(b.comments);
		this.groupKeywords = upperCaseKeys(b.groupKeywords);
		this.objectKeywords = upperCaseKeys(b.objectKeywords);
		this.preferredGroupKeywords = b.preferredGroupKeywords;
		this.preferredObjectKeywords = b.preferredObjectKeywords;
		this.endStatement = b.endStatement;
		this.nullKeyword = b.nullKeyword;
		this.trueKeyword = b.trueKeyword;
		this.falseKeyword = b.falseKeyword;
		this.quotes = b.quotes;
		this.allowMismatchedQuotes = b.allowMismatchedQuotes;
		this.setDelimiters = b.setDelimiters;
		this.sequenceDelimiters = b.sequenceDelimiters;
		this.unitsDelimiters = b.unitsDelimiters;
		this.nonDecimalPattern = b.nonDecimalPattern;
		this.nonDecimalPrefixPattern = b.nonDecimalPrefixPattern;
		this.leapSecondPatterns = List.copyOf(b.leapSecondPatterns);
		this.charAllowed = b.charAllowed;

		Set<String> reserved = new TreeSet<>();
		reserved.add(endStatement.toUpperCase(Locale.ROOT));
		groupKeywords.forEach((k, v) -> { reserved.add(k); reserved.add(v); });
		objectKeywords.forEach((k, v) -> { reserved.add(k); reserved.add(v); });
		this.reservedKeywords = Collections.unmodifiableSet(reserved);

		for (Delimiters d : List.of(setDelimiters, sequenceDelimiters, unitsDelimiters)) {
			if (!d.isSingleChar() || isWhitespace(d.openChar()) || isWhitespace(d.closeChar())) {
				throw new IllegalArgumentException("Invalid delimiters for grammar " + name + ": " + d);
			}
		}
	}

	private static Map<String, String> upperCaseKeys(Map<String, String> keywords) {
		Map<String, String> result = new LinkedHashMap<>();
		keywords.forEach((k, v) -> result.put(k.toUpperCase(Locale.ROOT), v.toUpperCase(Locale.ROOT)));
		return Collections.unmodifiableMap(result);
	}

	public static Builder builder() {
		return new Builder();
	}

	public Builder toBuilder() {
		return new Builder(this);
	}

	public String name() { return name; }
	public String spacingCharacters() { return spacingCharacters; }
	public String formatEffectors() { return formatEffectors; }
	public String whitespace() { return spacingCharacters + formatEffectors; }
	public String reservedCharacters() { return reservedCharacters; }
	public String numericStartCharacters() { return numericStartCharacters; }
	public char statementDelimiter() { return statementDelimiter; }
	public List<Delimiters> comments() { return comments; }
	public Keywords preferredGroupKeywords() { return preferredGroupKeywords; }
	public Keywords preferredObjectKeywords() { return preferredObjectKeywords; }
	public String endStatement() { return endStatement; }
	public String nullKeyword() { return nullKeyword; }
	public String trueKeyword() { return trueKeyword; }
	public String falseKeyword() { return falseKeyword; }
	public String quotes() { return quotes; }
	public boolean allowMismatchedQuotes() { return allowMismatchedQuotes; }
	public Delimiters setDelimiters() { return setDelimiters; }
	public Delimiters sequenceDelimiters() { return sequenceDelimiters; }
	public Delimiters unitsDelimiters() { return unitsDelimiters; }
	public Pattern nonDecimalPattern() { return nonDecimalPattern; }
	public Pattern nonDecimalPrefixPattern() { return nonDecimalPrefixPattern; }
	public List<Pattern> leapSecondPatterns() { return leapSecondPatterns; }

	/**
	 * Begin and end keywords of every aggregation, plus the end statement, in upper case.
	 */
	public Set<String> reservedKeywords() { return reservedKeywords; }

	public boolean isWhitespace(char c) {
		return spacingCharacters.indexOf(c) >= 0 || formatEffectors.indexOf(c) >= 0;
	}

	public boolean isFormatEffector(char c) {
		return formatEffectors.indexOf(c) >= 0;
	}

	public boolean isReserved(char c) {
		return reservedCharacters.indexOf(c) >= 0;
	}

	public boolean isNumericStart(char c) {
		return numericStartCharacters.indexOf(c) >= 0;
	}

	public boolean isQuote(char c) {
		return quotes.indexOf(c) >= 0;
	}

	public boolean isCharAllowed(int codePoint) {
		return charAllowed.test(codePoint);
	}

	public boolean isReservedKeyword(String s) {
		return reservedKeywords.contains(s.toUpperCase(Locale.ROOT));
	}

	public boolean isEndStatement(String s) {
		return endStatement.equalsIgnoreCase(s);
	}

	public boolean isGroupBegin(String s) {
		return groupKeywords.containsKey(s.toUpperCase(Locale.ROOT));
	}

	public boolean isObjectBegin(String s) {
		return objectKeywords.containsKey(s.toUpperCase(Locale.ROOT));
	}

	public boolean isBeginAggregation(String s) {
		return isGroupBegin(s) || isObjectBegin(s);
	}

	public boolean isEndAggregation(String s) {
		String upper = s.toUpperCase(Locale.ROOT);
		return groupKeywords.containsValue(upper) || objectKeywords.containsValue(upper);
	}

	/**
	 * @return the keyword that closes an aggregation opened with <code>begin</code>
	 */
	public Optional<String> endKeywordFor(String begin) {
		String upper = begin.toUpperCase(Locale.ROOT);
		String end = groupKeywords.get(upper);
		if (end == null) {
			end = objectKeywords.get(upper);
		}
		return Optional.ofNullable(end);
	}

	/**
	 * @return the comment whose opening marker appears in <code>text</code> at <code>index</code>
	 */
	public Optional<Delimiters> commentStartingAt(CharSequence text, int index) {
		for (Delimiters c : comments) {
			if (regionMatches(text, index, c.open())) {
				return Optional.of(c);
			}
		}
		return Optional.empty();
	}

	/**
	 * @return the one-character line comment that starts with <code>c</code>
	 */
	public Optional<Delimiters> lineCommentStartingWith(char c) {
		for (Delimiters d : comments) {
			if (d.open().length() == 1 && d.openChar() == c) {
				return Optional.of(d);
			}
		}
		return Optional.empty();
	}

	/**
	 * @return true if <code>c</code> is any character of a multi-character comment marker
	 */
	public boolean isBlockCommentChar(char c) {
		for (Delimiters d : comments) {
			if (d.open().length() > 1 && (d.open().indexOf(c) >= 0 || d.close().indexOf(c) >= 0)) {
				return true;
			}
		}
		return false;
	}

	public boolean isLeapSecond(String text) {
		for (Pattern p : leapSecondPatterns) {
			if (p.matcher(text).matches()) {
				return true;
			}
		}
		return false;
	}

	static boolean regionMatches(CharSequence text, int index, String marker) {
		if (index < 0 || index + marker.length() > text.length()) {
			return false;
		}
		for (int i = 0; i < marker.length(); i++) {
			if (text.charAt(index + i) != marker.charAt(i)) {
				return false;
			}
		}
		return true;
	}

	@Override
	public String toString() {
		return "Grammar(" + name + ")";
	}

	public static final class Builder {
		private String name = "custom";
		private String spacingCharacters = " \t";
		private String formatEffectors = "\n\r\u000B\f";
		private String reservedCharacters = PVL_RESERVED;
		private String numericStartCharacters = "+-";
		private char statementDelimiter = ';';
		private List<Delimiters> comments = List.of(BLOCK_COMMENT);
		private Map<String, String> groupKeywords = Map.of("GROUP", "END_GROUP", "BEGIN_GROUP", "END_GROUP");
		private Map<String, String> objectKeywords = Map.of("OBJECT", "END_OBJECT", "BEGIN_OBJECT", "END_OBJECT");
		private Keywords preferredGroupKeywords = new Keywords("BEGIN_GROUP", "END_GROUP");
		private Keywords preferredObjectKeywords = new Keywords("BEGIN_OBJECT", "END_OBJECT");
		private String endStatement = "END";
		private String nullKeyword = "NULL";
		private String trueKeyword = "TRUE";
		private String falseKeyword = "FALSE";
		private String quotes = "\"'";
		private boolean allowMismatchedQuotes = false;
		private Delimiters setDelimiters = Delimiters.of('{', '}');
		private Delimiters sequenceDelimiters = Delimiters.of('(', ')');
		private Delimiters unitsDelimiters = Delimiters.of('<', '>');
		private Pattern nonDecimalPattern = PVL_NON_DECIMAL;
		private Pattern nonDecimalPrefixPattern = PVL_NON_DECIMAL_PREFIX;
		private List<Pattern> leapSecondPatterns = LEAP_SECONDS;
		private IntPredicate charAllowed = Grammar::isPvlChar;

		Builder() { }

		Builder(Grammar g) {
			name = g.name;
			spacingCharacters = g.spacingCharacters;
			formatEffectors = g.formatEffectors;
			reservedCharacters = g.reservedCharacters;
			numericStartCharacters = g.numericStartCharacters;
			statementDelimiter = g.statementDelimiter;
			comments = g.comments;
			groupKeywords = g.groupKeywords;
			objectKeywords = g.objectKeywords;
			preferredGroupKeywords = g.preferredGroupKeywords;
			preferredObjectKeywords = g.preferredObjectKeywords;
			endStatement = g.endStatement;
			nullKeyword = g.nullKeyword;
			trueKeyword = g.trueKeyword;
			falseKeyword = g.falseKeyword;
			quotes = g.quotes;
			allowMismatchedQuotes = g.allowMismatchedQuotes;
			setDelimiters = g.setDelimiters;
			sequenceDelimiters = g.sequenceDelimiters;
			unitsDelimiters = g.unitsDelimiters;
			nonDecimalPattern = g.nonDecimalPattern;
			nonDecimalPrefixPattern = g.nonDecimalPrefixPattern;
			leapSecondPatterns = g.leapSecondPatterns;
			charAllowed = g.charAllowed;
		}

		public Builder name(String name) {
			this.name = requireNonNull(name);
			return this;
		}

		public Builder spacingCharacters(String spacingCharacters) {
			this.spacingCharacters = requireNonNull(spacingCharacters);
			return this;
		}

		public Builder formatEffectors(String formatEffectors) {
			this.formatEffectors = requireNonNull(formatEffectors);
			return this;
		}

		public Builder reservedCharacters(String reservedCharacters) {
			this.reservedCharacters = requireNonNull(reservedCharacters);
			return this;
		}

		public Builder numericStartCharacters(String numericStartCharacters) {
			this.numericStartCharacters = requireNonNull(numericStartCharacters);
			return this;
		}

		public Builder statementDelimiter(char statementDelimiter) {
			this.statementDelimiter = statementDelimiter;
			return this;
		}

		public Builder comments(List<Delimiters> comments) {
			this.comments = requireNonNull(comments);
			return this;
		}

		/**
		 * @param groupKeywords maps each keyword that may begin a group to the keyword that ends it
		 */
		public Builder groupKeywords(Map<String, String> groupKeywords) {
			this.groupKeywords = requireNonNull(groupKeywords);
			return this;
		}

		public Builder objectKeywords(Map<String, String> objectKeywords) {
			this.objectKeywords = requireNonNull(objectKeywords);
			return this;
		}

		public Builder preferredGroupKeywords(Keywords preferredGroupKeywords) {
			this.preferredGroupKeywords = requireNonNull(preferredGroupKeywords);
			return this;
		}

		public Builder preferredObjectKeywords(Keywords preferredObjectKeywords) {
			this.preferredObjectKeywords = requireNonNull(preferredObjectKeywords);
			return this;
		}

		public Builder endStatement(String endStatement) {
			this.endStatement = requireNonNull(endStatement);
			return this;
		}

		public Builder nullKeyword(String nullKeyword) {
			this.nullKeyword = requireNonNull(nullKeyword);
			return this;
		}

		public Builder trueKeyword(String trueKeyword) {
			this.trueKeyword = requireNonNull(trueKeyword);
			return this;
		}

		public Builder falseKeyword(String falseKeyword) {
			this.falseKeyword = requireNonNull(falseKeyword);
			return this;
		}

		public Builder quotes(String quotes) {
			this.quotes = requireNonNull(quotes);
			return this;
		}

		public Builder allowMismatchedQuotes(boolean allowMismatchedQuotes) {
			this.allowMismatchedQuotes = allowMismatchedQuotes;
			return this;
		}

		public Builder setDelimiters(Delimiters setDelimiters) {
			this.setDelimiters = requireNonNull(setDelimiters);
			return this;
		}

		public Builder sequenceDelimiters(Delimiters sequenceDelimiters) {
			this.sequenceDelimiters = requireNonNull(sequenceDelimiters);
			return this;
		}

		public Builder unitsDelimiters(Delimiters unitsDelimiters) {
			this.unitsDelimiters = requireNonNull(unitsDelimiters);
			return this;
		}

		/**
		 * @param pattern must have named groups <code>radix</code> and <code>digits</code>,
		 *                and may have <code>sign</code> and <code>sign2</code>
		 * @param prefixPattern matches everything in a literal up to and including the radix mark
		 */
		public Builder nonDecimal(Pattern pattern, Pattern prefixPattern) {
			this.nonDecimalPattern = requireNonNull(pattern);
			this.nonDecimalPrefixPattern = requireNonNull(prefixPattern);
			return this;
		}

		/**
		 * An empty list means leap seconds are not allowed.
		 */
		public Builder leapSecondPatterns(List<Pattern> leapSecondPatterns) {
			this.leapSecondPatterns = requireNonNull(leapSecondPatterns);
			return this;
		}

		public Builder charAllowed(IntPredicate charAllowed) {
			this.charAllowed = requireNonNull(charAllowed);
			return this;
		}

		public Grammar build() {
			return new Grammar(this);
		}

		@Override
		public String toString() {
			return "Grammar.Builder(" + name + ")";
		}
	}

	/**
	 * CCSDS 641.0-B-2 PVL.
	 */
	public static Grammar pvl() {
		return PVL;
	}

	/**
	 * PDS3 Object Description Language.
	 */
	public static Grammar odl() {
		return ODL;
	}

	/**
	 * The flavour written and read by ISIS, including cube labels.
	 */
	public static Grammar isis() {
		return ISIS;
	}

	/**
	 * Accepts the widest range of PVL-like text. Not meant for writing.
	 */
	public static Grammar omni() {
		return OMNI;
	}

	/**
	 * Latin-1 minus most control characters.
	 */
	public static boolean isPvlChar(int c) {
		return !(c > 255
			|| (0 <= c && c <= 8)
			|| (14 <= c && c <= 31)
			|| (127 <= c && c <= 159));
	}

	public static boolean isAsciiChar(int c) {
		return 0 <= c && c <= 127;
	}

	private static final String PVL_RESERVED = "&<>'{},[]=!#()%+\";~|";
	private static final Delimiters BLOCK_COMMENT = new Delimiters("/*", "*/");
	private static final Delimiters LINE_COMMENT = new Delimiters("#", "\n");

	private static final String SIGN = "(?<sign>[+-]?)";
	private static final String DIGITS = "(?<digits>[0-9A-Fa-f]+)";

	private static final Pattern PVL_NON_DECIMAL_PREFIX = Pattern.compile(SIGN + "(?<radix>2|8|16)#");
	private static final Pattern PVL_NON_DECIMAL = Pattern.compile(PVL_NON_DECIMAL_PREFIX.pattern() + DIGITS + "#");
	private static final Pattern ODL_NON_DECIMAL_PREFIX = Pattern.compile("(?<radix>[2-9]|1[0-6])#" + SIGN);
	private static final Pattern ODL_NON_DECIMAL = Pattern.compile(ODL_NON_DECIMAL_PREFIX.pattern() + DIGITS + "#");
	private static final Pattern OMNI_NON_DECIMAL_PREFIX = Pattern.compile(SIGN + "(?<radix>[2-9]|1[0-6])#(?<sign2>[+-]?)");
	private static final Pattern OMNI_NON_DECIMAL = Pattern.compile(OMNI_NON_DECIMAL_PREFIX.pattern() + DIGITS + "#");

	private static final String YMD = "\\d{4}-(0[1-9]|1[0-2])-(0[1-9]|[12]\\d|3[01])";
	private static final String YJ = "\\d{4}-(00[1-9]|0[1-9]\\d|[12]\\d{2}|3[0-5]\\d|36[0-6])";
	private static final String LEAP_TIME = "(0\\d|1\\d|2[0-3]):[0-5]\\d:60(\\.\\d+)?[Zz]?";
	private static final List<Pattern> LEAP_SECONDS = List.of(
		Pattern.compile("(" + YMD + "T)?" + LEAP_TIME),
		Pattern.compile("(" + YJ + "T)?" + LEAP_TIME));

	private static final Grammar PVL = new Builder().name("PVL").build();

	private static final Grammar ODL = new Builder()
		.name("ODL")
		.preferredGroupKeywords(new Keywords("GROUP", "END_GROUP"))
		.preferredObjectKeywords(new Keywords("OBJECT", "END_OBJECT"))
		.nonDecimal(ODL_NON_DECIMAL, ODL_NON_DECIMAL_PREFIX)
		.leapSecondPatterns(List.of())
		.charAllowed(Grammar::isAsciiChar)
		.build();

	private static final Grammar ISIS = new Builder()
		.name("ISIS")
		.reservedCharacters(PVL_RESERVED.replace("+", ""))
		.comments(List.of(BLOCK_COMMENT, LINE_COMMENT))
		.groupKeywords(Map.of("GROUP", "END_GROUP"))
		.objectKeywords(Map.of("OBJECT", "END_OBJECT"))
		.preferredGroupKeywords(new Keywords("Group", "End_Group"))
		.preferredObjectKeywords(new Keywords("Object", "End_Object"))
		.build();

	private static final Grammar OMNI = new Builder()
		.name("Omni")
		.reservedCharacters(PVL_RESERVED.replace("+", ""))
		.comments(List.of(BLOCK_COMMENT, LINE_COMMENT))
		.nonDecimal(OMNI_NON_DECIMAL, OMNI_NON_DECIMAL_PREFIX)
		.build();
}

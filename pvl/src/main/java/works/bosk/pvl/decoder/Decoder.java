package works.bosk.pvl.decoder;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.bosk.pvl.exceptions.PvlDecodeException;
import works.bosk.pvl.grammar.Delimiters;
import works.bosk.pvl.grammar.Grammar;
import works.bosk.pvl.model.BooleanValue;
import works.bosk.pvl.model.DateTimeValue;
import works.bosk.pvl.model.DateValue;
import works.bosk.pvl.model.IntegerValue;
import works.bosk.pvl.model.NullValue;
import works.bosk.pvl.model.Quantity;
import works.bosk.pvl.model.RealValue;
import works.bosk.pvl.model.StringValue;
import works.bosk.pvl.model.TimeValue;
import works.bosk.pvl.model.Value;

import static java.util.Objects.requireNonNull;

/**
 * Converts the text of a single token into a {@link Value}.
 * <p>
 * Candidate interpretations are tried in a fixed order:
 * quoted string, non-decimal integer, decimal number, date/time,
 * boolean, null, and finally unquoted string.
 * The first that fits wins.
 * <p>
 * Immutable and thread-safe.
 */
public final class Decoder {
	private final Grammar grammar;
	private final boolean allowNumericTimezoneOffsets;
	private final boolean foldQuotedStrings;
	private final boolean unitsOnlyOnNumbers;
	private final Pattern continuationPattern;
	private final Pattern whitespaceRunPattern;

	private Decoder(Builder b) {
		this.grammar = b.grammar;
		this.allowNumericTimezoneOffsets = b.allowNumericTimezoneOffsets;
		this.foldQuotedStrings = b.foldQuotedStrings;
		this.unitsOnlyOnNumbers = b.unitsOnlyOnNumbers;
		String fe = charClass(grammar.formatEffectors());
		String ws = charClass(grammar.whitespace());
		this.continuationPattern = Pattern.compile("-[" + fe + "][" + ws + "]*");
		this.whitespaceRunPattern = Pattern.compile("[" + ws + "]+");
	}

	public static Builder builder(Grammar grammar) {
		return new Builder(grammar);
	}

	public Builder toBuilder() {
		return new Builder(grammar)
			.allowNumericTimezoneOffsets(allowNumericTimezoneOffsets)
			.foldQuotedStrings(foldQuotedStrings)
			.unitsOnlyOnNumbers(unitsOnlyOnNumbers);
	}

	public static Decoder pvl() {
		return PVL;
	}

	public static Decoder odl() {
		return ODL;
	}

	public static Decoder isis() {
		return ISIS;
	}

	public static Decoder omni() {
		return OMNI;
	}

	public Grammar grammar() {
		return grammar;
	}

	public boolean allowsNumericTimezoneOffsets() {
		return allowNumericTimezoneOffsets;
	}

	public boolean foldsQuotedStrings() {
		return foldQuotedStrings;
	}

	public boolean unitsOnlyOnNumbers() {
		return unitsOnlyOnNumbers;
	}

	/**
	 * @throws PvlDecodeException if <code>text</code> is not a simple value
	 */
	public Value decode(String text) {
		if (isQuotedString(text)) {
			return new StringValue(decodeQuotedString(text));
		}
		Optional<IntegerValue> nonDecimal = decodeNonDecimal(text);
		if (nonDecimal.isPresent()) {
			return nonDecimal.get();
		}
		Optional<Value> decimal = decodeDecimal(text);
		if (decimal.isPresent()) {
			return decimal.get();
		}
		Optional<Value> dateTime = decodeDatetime(text);
		if (dateTime.isPresent()) {
			return dateTime.get();
		}
		if (text.equalsIgnoreCase(grammar.trueKeyword())) {
			return BooleanValue.TRUE;
		} else if (text.equalsIgnoreCase(grammar.falseKeyword())) {
			return BooleanValue.FALSE;
		} else if (text.equalsIgnoreCase(grammar.nullKeyword())) {
			return NullValue.NULL;
		}
		return decodeUnquotedString(text);
	}

	public boolean isQuotedString(String text) {
		if (text.length() < 2) {
			return false;
		}
		char open = text.charAt(0);
		char close = text.charAt(text.length() - 1);
		if (!grammar.isQuote(open) || !grammar.isQuote(close)) {
			return false;
		}
		return open == close || grammar.allowMismatchedQuotes();
	}

	/**
	 * Strips the quotes, removes line continuations and folds whitespace
	 * if this decoder does that, and then replaces escape sequences.
	 *
	 * @throws PvlDecodeException if <code>text</code> is not a quoted string
	 */
	public String decodeQuotedString(String text) {
		if (!isQuotedString(text)) {
			throw new PvlDecodeException("Not a quoted string: " + text);
		}
		String s = text.substring(1, text.length() - 1);
		if (foldQuotedStrings) {
			s = continuationPattern.matcher(s).replaceAll("");
			s = whitespaceRunPattern.matcher(s).replaceAll(" ").strip();
		}
		return unescape(s);
	}

	static String unescape(String s) {
		if (s.indexOf('\\') == -1) {
			return s;
		}
		StringBuilder sb = new StringBuilder(s.length());
		for (int i = 0; i < s.length(); i++) {
			char c = s.charAt(i);
			if (c == '\\' && i + 1 < s.length()) {
				char e = s.charAt(i + 1);
				switch (e) {
					case 'n' -> { sb.append('\n'); i++; }
					case 't' -> { sb.append('\t'); i++; }
					case 'f' -> { sb.append('\f'); i++; }
					case 'v' -> { sb.append('\u000B'); i++; }
					case '\\' -> { sb.append('\\'); i++; }
					default -> sb.append(c);
				}
			} else {
				sb.append(c);
			}
		}
		return sb.toString();
	}

	/**
	 * @return empty if <code>text</code> does not have the form of a non-decimal literal
	 * @throws PvlDecodeException if it has the form, but the digits are invalid for the radix
	 * or the literal has a sign in both positions
	 */
	public Optional<IntegerValue> decodeNonDecimal(String text) {
		Matcher m = grammar.nonDecimalPattern().matcher(text);
		if (!m.matches()) {
			return Optional.empty();
		}
		String sign = group(m, "sign");
		String sign2 = group(m, "sign2");
		if (!sign.isEmpty() && !sign2.isEmpty()) {
			throw new PvlDecodeException("Non-decimal literal has two signs: " + text);
		}
		int radix = Integer.parseInt(m.group("radix"));
		try {
			BigInteger magnitude = new BigInteger(m.group("digits"), radix);
			boolean negative = "-".equals(sign) || "-".equals(sign2);
			return Optional.of(new IntegerValue(negative ? magnitude.negate() : magnitude));
		} catch (NumberFormatException e) {
			throw new PvlDecodeException("Invalid digits for radix " + radix + ": " + text, e);
		}
	}

	private static String group(Matcher m, String name) {
		if (!m.pattern().pattern().contains("(?<" + name + ">")) {
			return "";
		}
		String result = m.group(name);
		return (result == null) ? "" : result;
	}

	/**
	 * @return an {@link IntegerValue} or {@link RealValue}, or empty if <code>text</code> is not a decimal number
	 * @throws PvlDecodeException if it has the form of a number, but the exponent is out of range
	 */
	public Optional<Value> decodeDecimal(String text) {
		if (INTEGER.matcher(text).matches()) {
			return Optional.of(new IntegerValue(new BigInteger(text)));
		} else if (FLOAT.matcher(text).matches() || EXPONENTIAL.matcher(text).matches()) {
			try {
				return Optional.of(new RealValue(new BigDecimal(text)));
			} catch (NumberFormatException e) {
				throw new PvlDecodeException("Exponent out of range: " + text, e);
			}
		} else {
			return Optional.empty();
		}
	}

	public boolean isDecimal(String text) {
		return INTEGER.matcher(text).matches()
			|| FLOAT.matcher(text).matches()
			|| EXPONENTIAL.matcher(text).matches();
	}

	/**
	 * Includes non-decimal literals whose digits are invalid for their radix.
	 */
	public boolean isNumeric(String text) {
		return isDecimal(text) || grammar.nonDecimalPattern().matcher(text).matches();
	}

	/**
	 * @return a {@link DateValue}, {@link TimeValue} or {@link DateTimeValue},
	 * or empty if <code>text</code> is not one of the date/time forms this decoder accepts
	 */
	public Optional<Value> decodeDatetime(String text) {
		Optional<LocalDate> date = parseDate(text, true);
		if (date.isPresent()) {
			return Optional.of(new DateValue(date.get()));
		}
		int t = text.indexOf('T');
		if (t >= 0) {
			Optional<LocalDate> d = parseDate(text.substring(0, t), false);
			if (d.isEmpty()) {
				return Optional.empty();
			}
			return parseTime(text.substring(t + 1), text)
				.map(time -> new DateTimeValue(d.get(), time));
		}
		return parseTime(text, text).map(Value.class::cast);
	}

	public boolean isDatetime(String text) {
		return decodeDatetime(text).isPresent();
	}

	private static Optional<LocalDate> parseDate(String text, boolean allowZ) {
		String s = text;
		if (allowZ && (s.endsWith("Z") || s.endsWith("z"))) {
			s = s.substring(0, s.length() - 1);
		}
		try {
			Matcher ymd = DATE_YMD.matcher(s);
			if (ymd.matches()) {
				return Optional.of(LocalDate.of(
					Integer.parseInt(ymd.group("year")),
					Integer.parseInt(ymd.group("month")),
					Integer.parseInt(ymd.group("day"))));
			}
			Matcher yj = DATE_YJ.matcher(s);
			if (yj.matches()) {
				return Optional.of(LocalDate.ofYearDay(
					Integer.parseInt(yj.group("year")),
					Integer.parseInt(yj.group("doy"))));
			}
		} catch (DateTimeException e) {
			LOGGER.trace("Not a valid calendar date: {}", text, e);
		}
		return Optional.empty();
	}

	/**
	 * @param whole the entire token, used to match leap-second patterns
	 */
	private Optional<TimeValue> parseTime(String text, String whole) {
		Matcher m = TIME.matcher(text);
		if (!m.matches()) {
			return Optional.empty();
		}
		int hour = Integer.parseInt(m.group("hour"));
		int minute = Integer.parseInt(m.group("minute"));
		int second = (m.group("second") == null) ? 0 : Integer.parseInt(m.group("second"));
		String fraction = m.group("fraction");
		if (hour > 23 || minute > 59 || second > TimeValue.LEAP_SECOND) {
			return Optional.empty();
		}
		if (second == TimeValue.LEAP_SECOND && !grammar.isLeapSecond(whole)) {
			return Optional.empty();
		}
		int nanos = 0;
		if (fraction != null) {
			if (fraction.length() > 9) {
				return Optional.empty();
			}
			nanos = Integer.parseInt((fraction + "000000000").substring(0, 9));
		}

		ZoneOffset offset = ZoneOffset.UTC;
		String zoneSign = m.group("zoneSign");
		if (zoneSign != null) {
			if (!allowNumericTimezoneOffsets) {
				return Optional.empty();
			}
			int zoneHours = Integer.parseInt(m.group("zoneHours"));
			int zoneMinutes = (m.group("zoneMinutes") == null) ? 0 : Integer.parseInt(m.group("zoneMinutes"));
			if (zoneSign.equals("-")) {
				zoneHours = -zoneHours;
				zoneMinutes = -zoneMinutes;
			}
			offset = ZoneOffset.ofHoursMinutes(zoneHours, zoneMinutes);
		}
		return Optional.of(new TimeValue(hour, minute, second, nanos, offset));
	}

	/**
	 * @throws PvlDecodeException if <code>text</code> contains characters or words
	 * that can't appear in an unquoted string
	 */
	public StringValue decodeUnquotedString(String text) {
		for (int i = 0; i < text.length(); i++) {
			char c = text.charAt(i);
			if (grammar.isWhitespace(c)) {
				throw new PvlDecodeException("Expected a simple value, but encountered whitespace in \"" + text + "\"");
			}
			if (grammar.isReserved(c)) {
				throw new PvlDecodeException("Expected a simple value, but encountered a reserved character '" + c + "' in \"" + text + "\"");
			}
		}
		for (Delimiters comment : grammar.comments()) {
			if (text.contains(comment.open()) || text.contains(comment.close())) {
				throw new PvlDecodeException("Expected a simple value, but encountered a comment marker in \"" + text + "\"");
			}
		}
		if (grammar.isBeginAggregation(text) || grammar.isEndAggregation(text)) {
			throw new PvlDecodeException("Expected a simple value, but encountered an aggregation keyword: \"" + text + "\"");
		}
		if (grammar.isEndStatement(text)) {
			throw new PvlDecodeException("Expected a simple value, but encountered an end statement: \"" + text + "\"");
		}
		if (text.isEmpty() || isDatetime(text)) {
			throw new PvlDecodeException("Not an unquoted string: \"" + text + "\"");
		}
		return new StringValue(text);
	}

	/**
	 * @param units the units expression, without its delimiters
	 * @throws PvlDecodeException if this decoder only allows units on numbers and <code>value</code> isn't one
	 */
	public Quantity decodeQuantity(Value value, String units) {
		if (unitsOnlyOnNumbers && !value.isNumeric()) {
			throw new PvlDecodeException("Units expressions can only follow numeric values: " + value + " <" + units + ">");
		}
		try {
			return new Quantity(value, units);
		} catch (IllegalArgumentException e) {
			throw new PvlDecodeException(e.getMessage(), e);
		}
	}

	private static String charClass(String chars) {
		StringBuilder sb = new StringBuilder();
		chars.chars().forEach(c -> sb.append(String.format("\\x{%x}", c)));
		return sb.toString();
	}

	@Override
	public String toString() {
		return "Decoder(" + grammar.name()
			+ (allowNumericTimezoneOffsets ? ", numericTimezones" : "")
			+ (foldQuotedStrings ? ", folding" : "")
			+ (unitsOnlyOnNumbers ? ", unitsOnlyOnNumbers" : "")
			+ ")";
	}

	public static final class Builder {
		private final Grammar grammar;
		private boolean allowNumericTimezoneOffsets = false;
		private boolean foldQuotedStrings = false;
		private boolean unitsOnlyOnNumbers = false;

		Builder(Grammar grammar) {
			this.grammar = requireNonNull(grammar);
		}

		/**
		 * Accept times like <code>12:00+7</code> and <code>12:00-07:30</code>.
		 */
		public Builder allowNumericTimezoneOffsets(boolean value) {
			this.allowNumericTimezoneOffsets = value;
			return this;
		}

		/**
		 * Remove dash line continuations from quoted strings, collapse runs of whitespace
		 * into single spaces, and trim.
		 */
		public Builder foldQuotedStrings(boolean value) {
			this.foldQuotedStrings = value;
			return this;
		}

		public Builder unitsOnlyOnNumbers(boolean value) {
			this.unitsOnlyOnNumbers = value;
			return this;
		}

		public Decoder build() {
			return new Decoder(this);
		}
	}

	private static final Pattern INTEGER = Pattern.compile("[+-]?\\d+");
	private static final Pattern FLOAT = Pattern.compile("[+-]?(\\d+\\.\\d*|\\d*\\.\\d+)");
	private static final Pattern EXPONENTIAL = Pattern.compile("[+-]?(\\d+|\\d+\\.\\d*|\\d*\\.\\d+)[eE][+-]?\\d+");
	private static final Pattern DATE_YMD = Pattern.compile("(?<year>\\d{4})-(?<month>\\d{2})-(?<day>\\d{2})");
	private static final Pattern DATE_YJ = Pattern.compile("(?<year>\\d{4})-(?<doy>\\d{3})");
	private static final Pattern TIME = Pattern.compile(
		"(?<hour>\\d{2}):(?<minute>\\d{2})(:(?<second>\\d{2})(\\.(?<fraction>\\d+))?)?"
			+ "([Zz]|(?<zoneSign>[+-])(?<zoneHours>0?\\d|1[0-2])(:?(?<zoneMinutes>[0-5]\\d))?)?");

	private static final Decoder PVL = new Builder(Grammar.pvl()).build();
	private static final Decoder ODL = new Builder(Grammar.odl())
		.allowNumericTimezoneOffsets(true)
		.foldQuotedStrings(true)
		.unitsOnlyOnNumbers(true)
		.build();
	private static final Decoder ISIS = new Builder(Grammar.isis()).build();
	private static final Decoder OMNI = new Builder(Grammar.omni())
		.allowNumericTimezoneOffsets(true)
		.foldQuotedStrings(true)
		.build();

	private static final Logger LOGGER = LoggerFactory.getLogger(Decoder.class);
}

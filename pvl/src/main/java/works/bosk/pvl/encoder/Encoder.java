package works.bosk.pvl.encoder;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.bosk.pvl.decoder.Decoder;
import works.bosk.pvl.exceptions.PvlEncodeException;
import works.bosk.pvl.exceptions.PvlException;
import works.bosk.pvl.grammar.Grammar;
import works.bosk.pvl.grammar.Keywords;
import works.bosk.pvl.lexer.TokenClassifier;
import works.bosk.pvl.model.BooleanValue;
import works.bosk.pvl.model.DateTimeValue;
import works.bosk.pvl.model.DateValue;
import works.bosk.pvl.model.EmptyValue;
import works.bosk.pvl.model.IntegerValue;
import works.bosk.pvl.model.NullValue;
import works.bosk.pvl.model.PvlContainer;
import works.bosk.pvl.model.PvlContainer.Entry;
import works.bosk.pvl.model.PvlGroup;
import works.bosk.pvl.model.PvlObject;
import works.bosk.pvl.model.Quantity;
import works.bosk.pvl.model.RealValue;
import works.bosk.pvl.model.SequenceValue;
import works.bosk.pvl.model.SetValue;
import works.bosk.pvl.model.StringValue;
import works.bosk.pvl.model.TimeValue;
import works.bosk.pvl.model.Value;

import static java.util.Objects.requireNonNull;
import static works.bosk.pvl.encoder.Conformance.PDS3;

/**
 * Writes a {@link PvlContainer} as text according to some {@link EncoderRules}.
 * <p>
 * Anything that can't be written in a way that the rules' decoder
 * would read back as the same value causes {@link PvlEncodeException};
 * values are never approximated.
 * Encoding the same container twice produces identical text.
 */
public final class Encoder {
	private final EncoderRules rules;
	private final Grammar grammar;
	private final Decoder decoder;
	private final TokenClassifier classifier;

	public Encoder(EncoderRules rules) {
		this.rules = requireNonNull(rules);
		this.grammar = rules.getGrammar();
		this.decoder = rules.getDecoder();
		this.classifier = new TokenClassifier(decoder);
	}

	public EncoderRules rules() {
		return rules;
	}

	/**
	 * @throws PvlEncodeException if <code>module</code> can't be represented under these rules
	 */
	public String encode(PvlContainer module) {
		LOGGER.debug("Encoding {} entries with {} conformance", module.size(), rules.getConformance());
		Set<PvlContainer> forcedObjects = Collections.newSetFromMap(new IdentityHashMap<>());
		if (rules.getConformance() == PDS3) {
			chooseTopLevelObject(module, forcedObjects);
		}

		List<String> lines = new ArrayList<>();
		encodeBlock(module, 0, forcedObjects, lines);
		String endLine = grammar.endStatement();
		if (rules.isEndDelimiter()) {
			endLine += grammar.statementDelimiter();
		}
		lines.add(endLine);

		String result = String.join(rules.getNewline(), lines);
		if (rules.isNewlineAfterEnd()) {
			result += rules.getNewline();
		}
		checkCharacters(result);
		if (rules.getConformance() == PDS3 && rules.getTabReplace() > 0) {
			result = result.replace("\t", " ".repeat(rules.getTabReplace()));
		}
		return result;
	}

	private void checkCharacters(String text) {
		for (int i = 0; i < text.length(); i++) {
			char c = text.charAt(i);
			if (!grammar.isCharAllowed(c)) {
				String context = text.substring(Math.max(0, i - 5), Math.min(text.length(), i + 5));
				throw new PvlEncodeException(String.format(
					"Character U+%04X is not allowed by the %s grammar, near \"%s\"", (int) c, grammar.name(), context));
			}
		}
	}

	/**
	 * PDS requires at least one object in a label that has any groups.
	 */
	private void chooseTopLevelObject(PvlContainer module, Set<PvlContainer> forcedObjects) {
		int objects = 0;
		int groups = 0;
		for (Entry e : module) {
			if (e.value() instanceof PvlObject) {
				objects++;
			} else if (e.value() instanceof PvlGroup) {
				groups++;
			}
		}
		if (groups == 0 || objects > 0) {
			return;
		}
		if (!rules.isConvertGroupsToObjects()) {
			throw new PvlEncodeException("PDS labels with groups must contain at least one object");
		}
		PvlGroup first = null;
		for (Entry e : module) {
			if (e.value() instanceof PvlGroup g) {
				if (!isPdsGroup(g)) {
					forcedObjects.add(g);
					LOGGER.debug("Writing group \"{}\" as an object", e.key());
					return;
				} else if (first == null) {
					first = g;
				}
			}
		}
		LOGGER.debug("Writing first group as an object so the label has one");
		forcedObjects.add(first);
	}

	/**
	 * PDS groups may not nest aggregations, repeat keys, or hold data location pointers.
	 */
	static boolean isPdsGroup(PvlGroup group) {
		Set<String> seen = new HashSet<>();
		for (Entry e : group) {
			if (e.value() instanceof PvlContainer) {
				return false;
			}
			if (!seen.add(e.key())) {
				return false;
			}
			if (e.key().startsWith("^")) {
				Value v = e.value();
				if (v instanceof IntegerValue || (v instanceof Quantity q && q.value() instanceof IntegerValue)) {
					return false;
				}
			}
		}
		return true;
	}

	private void encodeBlock(PvlContainer container, int level, Set<PvlContainer> forcedObjects, List<String> lines) {
		int keyWidth = 0;
		for (Entry e : container) {
			if (!(e.value() instanceof PvlContainer)) {
				keyWidth = Math.max(keyWidth, e.key().length());
			}
		}
		for (Entry e : container) {
			if (e.value() instanceof PvlContainer c) {
				encodeAggregation(e.key(), c, level, forcedObjects, lines);
			} else {
				lines.addAll(encodeAssignment(e.key(), e.value(), level, keyWidth));
			}
		}
	}

	private void encodeAggregation(String name, PvlContainer aggregation, int level, Set<PvlContainer> forcedObjects, List<String> lines) {
		checkKey(name);
		boolean asObject = aggregation instanceof PvlObject || forcedObjects.contains(aggregation);
		if (!asObject && rules.getConformance() == PDS3 && !isPdsGroup((PvlGroup) aggregation)) {
			if (!rules.isConvertGroupsToObjects()) {
				throw new PvlEncodeException("Group \"" + name + "\" is not a valid PDS group");
			}
			LOGGER.debug("Writing group \"{}\" as an object", name);
			asObject = true;
		}
		Keywords keywords = asObject ? grammar.preferredObjectKeywords() : grammar.preferredGroupKeywords();
		String indent = indent(level);
		String delimiter = rules.isEndDelimiter() ? String.valueOf(grammar.statementDelimiter()) : "";

		lines.add(indent + keywords.begin() + " = " + name + delimiter);
		encodeBlock(aggregation, level + 1, forcedObjects, lines);
		if (rules.isAggregationEnd()) {
			lines.add(indent + keywords.end() + " = " + name + delimiter);
		} else {
			lines.add(indent + keywords.end() + delimiter);
		}
	}

	private List<String> encodeAssignment(String key, Value value, int level, int keyWidth) {
		checkKey(key);
		StringBuilder sb = new StringBuilder(indent(level));
		sb.append(key);
		while (sb.length() < indent(level).length() + keyWidth) {
			sb.append(' ');
		}
		sb.append(" = ");
		int valueColumn = sb.length();
		try {
			sb.append(encodeValue(value));
		} catch (PvlEncodeException e) {
			throw PvlException.wrap(e, "Parameter \"" + key + "\"");
		}
		if (rules.isEndDelimiter()) {
			sb.append(grammar.statementDelimiter());
		}
		return wrap(sb.toString(), valueColumn);
	}

	/**
	 * Breaks <code>line</code> at spaces that are outside quotes and units expressions,
	 * indenting continuation lines to <code>valueColumn</code>.
	 */
	List<String> wrap(String line, int valueColumn) {
		int limit = rules.getWidth() - rules.getNewline().length();
		if (line.length() <= limit) {
			return List.of(line);
		}
		List<String> result = new ArrayList<>();
		String continuation = " ".repeat(valueColumn);
		int lineStart = 0;
		int lastBreak = -1;
		char quote = 0;
		boolean inUnits = false;
		for (int i = valueColumn; i < line.length(); i++) {
			char c = line.charAt(i);
			if (quote != 0) {
				if (c == quote) {
					quote = 0;
				}
			} else if (inUnits) {
				if (c == grammar.unitsDelimiters().closeChar()) {
					inUnits = false;
				}
			} else if (grammar.isQuote(c)) {
				quote = c;
			} else if (c == grammar.unitsDelimiters().openChar()) {
				inUnits = true;
			} else if (c == ' ') {
				lastBreak = i;
			}
			int currentLength = i + 1 - lineStart + (result.isEmpty() ? 0 : continuation.length());
			if (currentLength > limit && lastBreak > lineStart) {
				result.add((result.isEmpty() ? "" : continuation) + line.substring(lineStart, lastBreak));
				lineStart = lastBreak + 1;
				lastBreak = -1;
			}
		}
		result.add((result.isEmpty() ? "" : continuation) + line.substring(lineStart));
		return result;
	}

	private void checkKey(String key) {
		if (!classifier.isUnquotedString(key) || grammar.isReservedKeyword(key)) {
			throw new PvlEncodeException("Not a valid parameter name: \"" + key + "\"");
		}
		if (rules.getConformance() != Conformance.PVL) {
			if (key.length() > MAX_ODL_KEY_LENGTH) {
				throw new PvlEncodeException("ODL keywords must be " + MAX_ODL_KEY_LENGTH + " characters or less: " + key);
			}
			String k = key.startsWith("^") ? key.substring(1) : key;
			if (!isIdentifier(k) && !isNamespacedIdentifier(k)) {
				throw new PvlEncodeException("Not a valid ODL identifier: \"" + key + "\"");
			}
		}
	}

	/**
	 * @throws PvlEncodeException if <code>value</code> can't be written
	 */
	public String encodeValue(Value value) {
		if (value instanceof Quantity q) {
			return encodeQuantity(q);
		} else {
			return encodeSimpleValue(value);
		}
	}

	private String encodeQuantity(Quantity q) {
		String units = q.units();
		if (units.contains(grammar.unitsDelimiters().open()) || units.contains(grammar.unitsDelimiters().close())) {
			throw new PvlEncodeException("Units contain a units delimiter: " + units);
		}
		if (!units.equals(units.strip())) {
			throw new PvlEncodeException("Units have leading or trailing whitespace: \"" + units + "\"");
		}
		if (rules.getConformance() != Conformance.PVL) {
			if (!q.value().isNumeric()) {
				throw new PvlEncodeException("ODL units expressions can only follow numeric values: " + q);
			}
			checkOdlUnits(units);
		} else if (decoder.unitsOnlyOnNumbers() && !q.value().isNumeric()) {
			throw new PvlEncodeException("Units expressions can only follow numeric values: " + q);
		}
		return encodeSimpleValue(q.value())
			+ " " + grammar.unitsDelimiters().open() + units + grammar.unitsDelimiters().close();
	}

	private static void checkOdlUnits(String units) {
		if (!isIdentifier(ODL_UNITS_PUNCTUATION.matcher(units).replaceAll(""))) {
			throw new PvlEncodeException("Not a valid ODL units expression: \"" + units + "\"");
		}
		int i = units.indexOf("**");
		while (i >= 0) {
			if (!ODL_EXPONENT.matcher(units).region(i, units.length()).lookingAt()) {
				throw new PvlEncodeException("The exponent in ODL units expression \"" + units + "\" is not a decimal integer");
			}
			i = units.indexOf("**", i + 2);
		}
	}

	private String encodeSimpleValue(Value value) {
		if (value instanceof NullValue) {
			return grammar.nullKeyword();
		} else if (value instanceof BooleanValue b) {
			return b.value() ? grammar.trueKeyword() : grammar.falseKeyword();
		} else if (value instanceof IntegerValue i) {
			return i.value().toString();
		} else if (value instanceof RealValue r) {
			return encodeReal(r.value());
		} else if (value instanceof StringValue s) {
			return encodeString(s.value());
		} else if (value instanceof DateValue d) {
			return encodeDate(d.date());
		} else if (value instanceof TimeValue t) {
			return encodeTime(t);
		} else if (value instanceof DateTimeValue dt) {
			return encodeDate(dt.date()) + "T" + encodeTime(dt.time());
		} else if (value instanceof SequenceValue s) {
			return encodeSequence(s);
		} else if (value instanceof SetValue s) {
			return encodeSet(s);
		} else if (value instanceof EmptyValue e) {
			throw new PvlEncodeException("Cannot encode the empty value recovered from line " + e.line());
		} else if (value instanceof Quantity q) {
			throw new PvlEncodeException("Quantities cannot be nested: " + q);
		} else {
			throw new PvlEncodeException("Aggregations can only be values of assignment statements, not elements of sets or sequences");
		}
	}

	static String encodeReal(BigDecimal value) {
		String s = value.toString();
		if (s.indexOf('.') == -1 && s.indexOf('E') == -1) {
			s += ".0";
		}
		return s;
	}

	private static String encodeDate(LocalDate date) {
		if (date.getYear() < 0 || date.getYear() > 9999) {
			throw new PvlEncodeException("Year out of range: " + date);
		}
		return String.format("%04d-%02d-%02d", date.getYear(), date.getMonthValue(), date.getDayOfMonth());
	}

	private String encodeTime(TimeValue t) {
		if (t.isLeapSecond() && grammar.leapSecondPatterns().isEmpty()) {
			throw new PvlEncodeException("The " + grammar.name() + " grammar does not allow leap seconds: " + t);
		}
		StringBuilder sb = new StringBuilder();
		sb.append(String.format("%02d:%02d", t.hour(), t.minute()));
		if (t.nanos() != 0) {
			sb.append(String.format(":%02d.", t.second())).append(TimeValue.fraction(t.nanos()));
		} else if (t.second() != 0) {
			sb.append(String.format(":%02d", t.second()));
		}
		switch (rules.getConformance()) {
			case PVL, PDS3 -> {
				if (!t.isUtc()) {
					throw new PvlEncodeException(rules.getConformance() + " times must be UTC: " + t);
				}
				if (rules.getConformance() == PDS3) {
					sb.append('Z');
				}
			}
			case ODL -> sb.append(encodeOffset(t.offset()));
		}
		return sb.toString();
	}

	private String encodeOffset(ZoneOffset offset) {
		if (offset.equals(ZoneOffset.UTC)) {
			return "Z";
		}
		if (!decoder.allowsNumericTimezoneOffsets()) {
			throw new PvlEncodeException("Decoder does not accept numeric time zone offsets: " + offset);
		}
		int totalSeconds = offset.getTotalSeconds();
		if (totalSeconds % 60 != 0) {
			throw new PvlEncodeException("ODL time zone offsets cannot have seconds: " + offset);
		}
		int abs = Math.abs(totalSeconds);
		int hours = abs / 3600;
		int minutes = (abs % 3600) / 60;
		if (hours > 12) {
			throw new PvlEncodeException("ODL time zone offsets must be within 12 hours: " + offset);
		}
		String sign = (totalSeconds < 0) ? "-" : "+";
		return (minutes == 0)
			? sign + hours
			: sign + hours + String.format(":%02d", minutes);
	}

	private String encodeSequence(SequenceValue s) {
		if (rules.getConformance() != Conformance.PVL) {
			if (s.values().isEmpty()) {
				throw new PvlEncodeException("ODL does not allow empty sequences");
			}
			if (s.dimensions() > 2) {
				throw new PvlEncodeException("ODL only allows one- and two-dimensional sequences: " + s);
			}
			for (Value v : s.values()) {
				if (v instanceof SequenceValue inner) {
					inner.values().forEach(i -> requireScalar(i, "sequences"));
				} else {
					requireScalar(v, "sequences");
				}
			}
		}
		return grammar.sequenceDelimiters().open() + encodeElements(s.values()) + grammar.sequenceDelimiters().close();
	}

	private String encodeSet(SetValue s) {
		if (rules.getConformance() == Conformance.ODL) {
			s.values().forEach(v -> requireScalar(v, "sets"));
		} else if (rules.getConformance() == PDS3) {
			for (Value v : s.values()) {
				if (!(v instanceof IntegerValue) && !(v instanceof StringValue sv && isSymbol(sv.value()))) {
					throw new PvlEncodeException("PDS only allows integers and symbols in sets: " + s);
				}
			}
		}
		return grammar.setDelimiters().open() + encodeElements(s.values()) + grammar.setDelimiters().close();
	}

	private String encodeElements(Collection<Value> values) {
		List<String> encoded = new ArrayList<>(values.size());
		for (Value v : values) {
			encoded.add(encodeValue(v));
		}
		return String.join(", ", encoded);
	}

	private static void requireScalar(Value v, String where) {
		if (!v.isScalar()) {
			throw new PvlEncodeException("ODL only allows scalar values in " + where + ": " + v);
		}
	}

	String encodeString(String s) {
		if (decoder.foldsQuotedStrings()) {
			checkSurvivesFolding(s);
		}
		if (rules.getConformance() != Conformance.PVL) {
			if (isIdentifier(s) && isSafeBare(s)) {
				return s;
			} else if (isSymbol(s)) {
				return "'" + escape(s) + "'";
			}
		} else if (isSafeBare(s)) {
			return s;
		}
		String escaped = escape(s);
		for (char q : grammar.quotes().toCharArray()) {
			if (escaped.indexOf(q) == -1) {
				return q + escaped + q;
			}
		}
		throw new PvlEncodeException("String contains every quote character, so it cannot be quoted: " + s);
	}

	/**
	 * @return true if <code>s</code> decodes as itself without quotes
	 */
	private boolean isSafeBare(String s) {
		return classifier.isUnquotedString(s)
			&& !grammar.isReservedKeyword(s)
			&& !s.equalsIgnoreCase(grammar.nullKeyword())
			&& !s.equalsIgnoreCase(grammar.trueKeyword())
			&& !s.equalsIgnoreCase(grammar.falseKeyword());
	}

	private void checkSurvivesFolding(String s) {
		if (!s.equals(s.strip())) {
			throw new PvlEncodeException("String would lose its leading or trailing whitespace when decoded: \"" + s + "\"");
		}
		if (s.contains("  ")) {
			throw new PvlEncodeException("String would lose repeated spaces when decoded: \"" + s + "\"");
		}
		if (s.indexOf('\r') >= 0) {
			throw new PvlEncodeException("String would lose its carriage returns when decoded: \"" + s + "\"");
		}
	}

	static String escape(String s) {
		StringBuilder sb = new StringBuilder(s.length());
		for (int i = 0; i < s.length(); i++) {
			char c = s.charAt(i);
			switch (c) {
				case '\\' -> sb.append("\\\\");
				case '\n' -> sb.append("\\n");
				case '\t' -> sb.append("\\t");
				case '\f' -> sb.append("\\f");
				case '\u000B' -> sb.append("\\v");
				default -> sb.append(c);
			}
		}
		return sb.toString();
	}

	/**
	 * Letters, digits and underscores, starting with a letter and not ending with an underscore.
	 */
	static boolean isIdentifier(String s) {
		return ODL_IDENTIFIER.matcher(s).matches();
	}

	static boolean isNamespacedIdentifier(String s) {
		int colon = s.indexOf(':');
		return colon > 0 && isIdentifier(s.substring(0, colon)) && isIdentifier(s.substring(colon + 1));
	}

	/**
	 * A string that ODL can write in single quotes: printable ASCII with no apostrophe.
	 */
	static boolean isSymbol(String s) {
		if (s.isEmpty()) {
			return false;
		}
		for (int i = 0; i < s.length(); i++) {
			char c = s.charAt(i);
			if (c == '\'' || c < 0x20 || c > 0x7E) {
				return false;
			}
		}
		return true;
	}

	private String indent(int level) {
		return " ".repeat(level * rules.getIndent());
	}

	private static final int MAX_ODL_KEY_LENGTH = 30;
	private static final Pattern ODL_IDENTIFIER = Pattern.compile("[A-Za-z]([A-Za-z0-9_]*[A-Za-z0-9])?");
	private static final Pattern ODL_UNITS_PUNCTUATION = Pattern.compile("[\\s*/()-]");
	private static final Pattern ODL_EXPONENT = Pattern.compile("\\*\\*-?\\d+");

	private static final Logger LOGGER = LoggerFactory.getLogger(Encoder.class);
}

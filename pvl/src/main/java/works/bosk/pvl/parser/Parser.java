package works.bosk.pvl.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.bosk.pvl.decoder.Decoder;
import works.bosk.pvl.exceptions.PvlDecodeException;
import works.bosk.pvl.exceptions.PvlLexerException;
import works.bosk.pvl.exceptions.PvlParseException;
import works.bosk.pvl.grammar.Delimiters;
import works.bosk.pvl.grammar.Grammar;
import works.bosk.pvl.lexer.Lexer;
import works.bosk.pvl.lexer.Token;
import works.bosk.pvl.lexer.TokenClassifier;
import works.bosk.pvl.model.EmptyValue;
import works.bosk.pvl.model.PvlContainer;
import works.bosk.pvl.model.PvlGroup;
import works.bosk.pvl.model.PvlModule;
import works.bosk.pvl.model.PvlObject;
import works.bosk.pvl.model.SequenceValue;
import works.bosk.pvl.model.SetValue;
import works.bosk.pvl.model.Value;

import static java.util.Objects.requireNonNull;

/**
 * Recursive-descent parser that turns text into a {@link PvlModule}.
 * <pre>
 * Module        ::= (WSC | Aggregation | Assignment)* EndStatement?
 * Aggregation   ::= BeginAgg '=' Name StmtDelim (WSC | Aggregation | Assignment)* EndAgg ('=' Name)? StmtDelim
 * Assignment    ::= Name '=' Value StmtDelim
 * Value         ::= (Simple | Set | Sequence) UnitsExpr?
 * Set           ::= '{' (Value (',' Value)*)? '}'
 * Sequence      ::= '(' (Value (',' Value)*)? ')'
 * </pre>
 * Anything after the end statement is ignored, even if it isn't valid text.
 * <p>
 * Immutable; each call to {@link #parse} is independent.
 */
public final class Parser {
	private final Decoder decoder;
	private final Grammar grammar;
	private final TokenClassifier classifier;
	private final Leniency leniency;

	public Parser(Decoder decoder, Leniency leniency) {
		this.decoder = requireNonNull(decoder);
		this.grammar = decoder.grammar();
		this.classifier = new TokenClassifier(decoder);
		this.leniency = requireNonNull(leniency);
	}

	public Decoder decoder() {
		return decoder;
	}

	public Leniency leniency() {
		return leniency;
	}

	/**
	 * @throws works.bosk.pvl.exceptions.PvlLexerException if the text can't be split into tokens
	 * @throws PvlParseException if the tokens don't form a module
	 */
	public PvlModule parse(CharSequence text) {
		String doc = text.toString();
		if (leniency == Leniency.LENIENT) {
			doc = DASH_CONTINUATION.matcher(doc).replaceAll("");
		}
		LOGGER.debug("Parsing {} characters with {} ({})", doc.length(), decoder, leniency);
		PvlModule result = new Run(doc).parseModule();
		LOGGER.debug("Parsed {} entries with {} recovered errors", result.size(), result.errors().size());
		return result;
	}

	/**
	 * The state of a single call to {@link #parse}.
	 */
	private final class Run {
		final String doc;
		final Lexer lexer;
		final PvlModule module = new PvlModule();

		Run(String doc) {
			this.doc = doc;
			this.lexer = new Lexer(doc, decoder);
		}

		PvlModule parseModule() {
			while (true) {
				skipWSC();
				if (!lexer.hasNext()) {
					return module;
				}
				Token t = lexer.peek();
				if (classifier.isEndStatement(t)) {
					lexer.next();
					parseAfterEnd();
					return module;
				} else if (classifier.isBeginAggregation(t)) {
					parseAggregation(module);
				} else if (classifier.isParameterName(t)) {
					parseAssignment(module);
				} else {
					throw error("Expecting an aggregation block, an assignment statement, or an end statement", t);
				}
			}
		}

		/**
		 * Consumes one trailing comment or delimiter, if present.
		 * Everything beyond that is none of our business.
		 */
		void parseAfterEnd() {
			try {
				if (lexer.hasNext()) {
					Token t = lexer.next();
					if (!classifier.isWSC(t) && !classifier.isDelimiter(t)) {
						lexer.pushBack(t);
					}
				}
			} catch (PvlLexerException e) {
				LOGGER.debug("Ignoring undecodable text after end statement: {}", e.getMessage());
			}
		}

		void parseAggregation(PvlContainer parent) {
			Token begin = lexer.next();
			expectEquals(begin);
			Token name = nextOrFail("Expecting a block name after \"" + begin.text() + " =\"");
			if (!classifier.isParameterName(name)) {
				throw error("Expecting a block name after \"" + begin.text() + " =\"", name);
			}
			parseStatementDelimiter();

			PvlContainer aggregation = grammar.isGroupBegin(begin.text()) ? new PvlGroup() : new PvlObject();
			String endKeyword = grammar.endKeywordFor(begin.text()).orElseThrow();
			while (true) {
				skipWSC();
				Token t = nextOrFail("Expecting " + endKeyword + " for \"" + name.text() + "\"");
				lexer.pushBack(t);
				if (classifier.isBeginAggregation(t)) {
					parseAggregation(aggregation);
				} else if (classifier.isParameterName(t)) {
					parseAssignment(aggregation);
				} else if (t.text().equalsIgnoreCase(endKeyword)) {
					lexer.next();
					parseEndAggregation(name);
					break;
				} else {
					throw error("Expecting an assignment statement, a nested aggregation, or " + endKeyword + " for \"" + name.text() + "\"", t);
				}
			}
			parent.append(name.text(), (Value) aggregation);
		}

		void parseEndAggregation(Token blockName) {
			skipWSC();
			if (lexer.hasNext() && lexer.peek().is('=')) {
				lexer.next();
				skipWSC();
				Token name = nextOrFail("Expecting a block name to match \"" + blockName.text() + "\"");
				if (!name.text().equalsIgnoreCase(blockName.text())) {
					throw error("Expecting block name \"" + blockName.text() + "\" at end of aggregation", name);
				}
			}
			parseStatementDelimiter();
		}

		void parseAssignment(PvlContainer container) {
			Token name = lexer.next();
			Token equals = expectEquals(name);
			Value value = parseValueOrRecover(equals);
			parseStatementDelimiter();
			container.append(name.text(), value);
		}

		Value parseValueOrRecover(Token equals) {
			skipWSC();
			if (!lexer.hasNext()) {
				if (leniency == Leniency.LENIENT) {
					return emptyValue(equals);
				}
				throw error("Ran out of tokens after the equals sign", equals);
			}
			if (leniency == Leniency.LENIENT) {
				Token t = lexer.peek();
				if (classifier.isReservedKeyword(t) || classifier.isDelimiter(t)) {
					return emptyValue(equals);
				} else if (classifier.isParameterName(t)) {
					// Is this the start of the following statement?
					lexer.next();
					skipWSC();
					boolean followedByEquals = lexer.hasNext() && lexer.peek().is('=');
					lexer.pushBack(t);
					if (followedByEquals) {
						return emptyValue(equals);
					}
				}
			}
			return parseValue();
		}

		Value parseValue() {
			Token t = nextOrFail("Expecting a value");
			Value value;
			if (t.is(grammar.setDelimiters().open())) {
				value = SetValue.copyOf(parseElements(grammar.setDelimiters()));
			} else if (t.is(grammar.sequenceDelimiters().open())) {
				value = new SequenceValue(parseElements(grammar.sequenceDelimiters()));
			} else {
				try {
					value = decoder.decode(t.text());
				} catch (PvlDecodeException e) {
					throw error("Expecting a simple value, or the beginning of a set or sequence: " + e.getMessage(), t, e);
				}
			}
			skipWSC();
			if (lexer.hasNext() && lexer.peek().text().startsWith(grammar.unitsDelimiters().open())) {
				return parseUnits(value, lexer.next());
			}
			return value;
		}

		List<Value> parseElements(Delimiters delimiters) {
			List<Value> result = new ArrayList<>();
			skipWSC();
			Token t = nextOrFail("Expecting a value or \"" + delimiters.close() + "\"");
			if (t.is(delimiters.close())) {
				return result;
			}
			lexer.pushBack(t);
			result.add(parseValue());
			while (true) {
				skipWSC();
				t = nextOrFail("Expecting \",\" or \"" + delimiters.close() + "\"");
				if (t.is(delimiters.close())) {
					return result;
				} else if (t.is(',')) {
					skipWSC();
					result.add(parseValue());
				} else {
					throw error("Expecting \",\" or \"" + delimiters.close() + "\"", t);
				}
			}
		}

		Value parseUnits(Value value, Token units) {
			Delimiters d = grammar.unitsDelimiters();
			String s = units.text();
			if (!s.endsWith(d.close()) || s.length() < d.open().length() + d.close().length()) {
				throw error("Expecting the end of a units expression", units);
			}
			String inner = strip(s.substring(d.open().length(), s.length() - d.close().length()));
			if (inner.contains(d.open()) || inner.contains(d.close())) {
				throw error("Units expression contains a units delimiter", units);
			}
			try {
				return decoder.decodeQuantity(value, inner);
			} catch (PvlDecodeException e) {
				throw error(e.getMessage(), units, e);
			}
		}

		String strip(String s) {
			int start = 0;
			int end = s.length();
			while (start < end && grammar.isWhitespace(s.charAt(start))) {
				start++;
			}
			while (end > start && grammar.isWhitespace(s.charAt(end - 1))) {
				end--;
			}
			return s.substring(start, end);
		}

		/**
		 * @return true if a statement delimiter was consumed
		 */
		boolean parseStatementDelimiter() {
			while (lexer.hasNext()) {
				Token t = lexer.next();
				if (classifier.isWSC(t)) {
					continue;
				}
				if (classifier.isDelimiter(t)) {
					return true;
				}
				lexer.pushBack(t);
				return false;
			}
			return false;
		}

		Token expectEquals(Token before) {
			skipWSC();
			Token t = nextOrFail("Expecting \"=\" after \"" + before.text() + "\"");
			if (!t.is('=')) {
				throw error("Expecting \"=\" after \"" + before.text() + "\"", t);
			}
			return t;
		}

		void skipWSC() {
			while (lexer.hasNext()) {
				Token t = lexer.next();
				if (!classifier.isWSC(t)) {
					lexer.pushBack(t);
					return;
				}
			}
		}

		Token nextOrFail(String expectation) {
			if (!lexer.hasNext()) {
				throw new PvlParseException(expectation + ", but ran out of tokens");
			}
			return lexer.next();
		}

		EmptyValue emptyValue(Token equals) {
			int line = lineOf(equals.offset());
			LOGGER.debug("Recovering from missing value at line {}", line);
			module.addError(line);
			return new EmptyValue(line);
		}

		int lineOf(int offset) {
			int line = 1;
			for (int i = 0; i < offset && i < doc.length(); i++) {
				if (doc.charAt(i) == '\n') {
					line++;
				}
			}
			return line;
		}

		PvlParseException error(String message, Token t) {
			return new PvlParseException(message + " at line " + lineOf(t.offset()) + ", but found \"" + t.text() + "\"");
		}

		PvlParseException error(String message, Token t, Throwable cause) {
			return new PvlParseException(message + " at line " + lineOf(t.offset()) + ", but found \"" + t.text() + "\"", cause);
		}
	}

	private static final Pattern DASH_CONTINUATION = Pattern.compile("-[\\n\\r\\f]\\s*");

	private static final Logger LOGGER = LoggerFactory.getLogger(Parser.class);
}

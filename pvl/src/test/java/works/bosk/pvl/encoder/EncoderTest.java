package works.bosk.pvl.encoder;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import works.bosk.pvl.decoder.Decoder;
import works.bosk.pvl.exceptions.PvlEncodeException;
import works.bosk.pvl.model.BooleanValue;
import works.bosk.pvl.model.DateTimeValue;
import works.bosk.pvl.model.DateValue;
import works.bosk.pvl.model.EmptyValue;
import works.bosk.pvl.model.IntegerValue;
import works.bosk.pvl.model.NullValue;
import works.bosk.pvl.model.PvlGroup;
import works.bosk.pvl.model.PvlModule;
import works.bosk.pvl.model.PvlObject;
import works.bosk.pvl.model.Quantity;
import works.bosk.pvl.model.RealValue;
import works.bosk.pvl.model.SequenceValue;
import works.bosk.pvl.model.SetValue;
import works.bosk.pvl.model.StringValue;
import works.bosk.pvl.model.TimeValue;
import works.bosk.pvl.model.Value;
import works.bosk.pvl.parser.Leniency;
import works.bosk.pvl.parser.Parser;

import static java.time.ZoneOffset.UTC;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EncoderTest {
	Encoder pvl;
	Encoder odl;
	Encoder pds3;
	Encoder isis;
	PvlModule module;

	@BeforeEach
	void setup() {
		pvl = new Encoder(EncoderRules.pvl());
		odl = new Encoder(EncoderRules.odl());
		pds3 = new Encoder(EncoderRules.pds3());
		isis = new Encoder(EncoderRules.isis());

		module = new PvlModule();
		module.append("a", IntegerValue.of(1));
		module.append("long_name", StringValue.of("hi there"));
		PvlGroup g = new PvlGroup();
		g.append("x", RealValue.of("1.5"));
		module.append("g", g);
	}

	@Test
	void pvlLayout() {
		assertEquals("""
			a         = 1;
			long_name = "hi there";
			BEGIN_GROUP = g;
			  x = 1.5;
			END_GROUP = g;
			END;""", pvl.encode(module));
	}

	@Test
	void odlLayout() {
		assertEquals(
			"a         = 1\r\n"
				+ "long_name = 'hi there'\r\n"
				+ "GROUP = g\r\n"
				+ "  x = 1.5\r\n"
				+ "END_GROUP = g\r\n"
				+ "END\r\n",
			odl.encode(module));
	}

	@Test
	void isisLayout() {
		PvlModule label = new PvlModule();
		PvlObject cube = new PvlObject();
		cube.append("Samples", IntegerValue.of(5));
		label.append("IsisCube", cube);
		assertEquals("""
			Object = IsisCube
			  Samples = 5
			End_Object = IsisCube
			END""", isis.encode(label));
	}

	@Test
	void withoutAggregationNames() {
		Encoder encoder = new Encoder(EncoderRules.pvl().toBuilder()
			.aggregationEnd(false)
			.endDelimiter(false)
			.indent(4)
			.build());
		PvlModule m = new PvlModule();
		PvlObject o = new PvlObject();
		o.append("x", BooleanValue.TRUE);
		m.append("o", o);
		assertEquals("""
			BEGIN_OBJECT = o
			    x = TRUE
			END_OBJECT
			END""", encoder.encode(m));
	}

	@Test
	void emptyModule() {
		assertEquals("END;", pvl.encode(new PvlModule()));
	}

	@Test
	void pds3ConvertsTheOnlyGroup() {
		PvlModule m = new PvlModule();
		PvlGroup g = new PvlGroup();
		g.append("x", IntegerValue.of(1));
		m.append("g", g);
		assertEquals("OBJECT = g\r\n  x = 1\r\nEND_OBJECT = g\r\nEND\r\n", pds3.encode(m));
		assertEquals("GROUP = g\r\n  x = 1\r\nEND_GROUP = g\r\nEND\r\n", odl.encode(m));
	}

	@Test
	void pds3ConvertsTheFirstInvalidGroup() {
		PvlModule m = new PvlModule();
		PvlGroup valid = new PvlGroup();
		valid.append("x", IntegerValue.of(1));
		PvlGroup repeats = new PvlGroup();
		repeats.append("y", IntegerValue.of(1));
		repeats.append("y", IntegerValue.of(2));
		m.append("valid", valid);
		m.append("repeats", repeats);
		String text = pds3.encode(m);
		assertThat(text, containsString("GROUP = valid\r\n"));
		assertThat(text, containsString("OBJECT = repeats\r\n"));
	}

	@Test
	void pds3NestedGroupBecomesObject() {
		PvlModule m = new PvlModule();
		PvlObject o = new PvlObject();
		PvlGroup outer = new PvlGroup();
		PvlGroup inner = new PvlGroup();
		inner.append("y", IntegerValue.of(1));
		outer.append("inner", inner);
		o.append("outer", outer);
		m.append("o", o);
		String text = pds3.encode(m);
		assertThat(text, containsString("  OBJECT = outer\r\n"));
		assertThat(text, containsString("    GROUP = inner\r\n"));
	}

	@Test
	void pds3PointerInGroup() {
		PvlGroup g = new PvlGroup();
		g.append("^IMAGE", new Quantity(IntegerValue.of(12), "BYTES"));
		assertFalse(Encoder.isPdsGroup(g));
		PvlGroup h = new PvlGroup();
		h.append("^IMAGE", StringValue.of("IMAGE.IMG"));
		assertTrue(Encoder.isPdsGroup(h));
	}

	@Test
	void pds3WithoutConversion() {
		Encoder strict = new Encoder(EncoderRules.pds3().toBuilder().convertGroupsToObjects(false).build());
		PvlModule m = new PvlModule();
		m.append("g", new PvlGroup());
		assertThrows(PvlEncodeException.class, () -> strict.encode(m));
	}

	@Test
	void pds3LabelsHaveNoTabs() {
		PvlModule m = new PvlModule();
		m.append("s", StringValue.of("a\tb"));
		String text = pds3.encode(m);
		assertEquals("s = \"a\\tb\"\r\nEND\r\n", text);
		assertFalse(text.contains("\t"));
	}

	@Test
	void keywords() {
		assertEquals("NULL", pvl.encodeValue(NullValue.NULL));
		assertEquals("TRUE", pvl.encodeValue(BooleanValue.TRUE));
		assertEquals("FALSE", odl.encodeValue(BooleanValue.FALSE));
	}

	@Test
	void numbers() {
		assertEquals("-12", pvl.encodeValue(IntegerValue.of(-12)));
		assertEquals("1.0", pvl.encodeValue(RealValue.of("1")));
		assertEquals("1.50", pvl.encodeValue(RealValue.of("1.50")));
		assertEquals("1E+3", pvl.encodeValue(RealValue.of("1E+3")));
	}

	@Test
	void dates() {
		assertEquals("2001-02-03", pvl.encodeValue(DateValue.of(2001, 2, 3)));
		assertThrows(PvlEncodeException.class, () -> pvl.encodeValue(DateValue.of(10000, 1, 1)));
	}

	@Test
	void times() {
		TimeValue noon = new TimeValue(12, 0, 0, 0, UTC);
		assertEquals("12:00", pvl.encodeValue(noon));
		assertEquals("12:00Z", odl.encodeValue(noon));
		assertEquals("12:00:00.1234567891", pvl.encodeValue(StringValue.of("12:00:00.1234567891")));
		assertEquals("12:00Z", pds3.encodeValue(noon));
		assertEquals("12:00:01.25", pvl.encodeValue(new TimeValue(12, 0, 1, 250_000_000, UTC)));
		assertEquals("12:00:00.5", pvl.encodeValue(new TimeValue(12, 0, 0, 500_000_000, UTC)));
		assertEquals("2001-02-03T04:05:06Z", odl.encodeValue(
			new DateTimeValue(LocalDate.of(2001, 2, 3), new TimeValue(4, 5, 6, 0, UTC))));
	}

	@Test
	void timeZones() {
		assertEquals("12:00+7", odl.encodeValue(new TimeValue(12, 0, 0, 0, ZoneOffset.ofHours(7))));
		assertEquals("12:00-7:30", odl.encodeValue(new TimeValue(12, 0, 0, 0, ZoneOffset.ofHoursMinutes(-7, -30))));
		TimeValue plusSeven = new TimeValue(12, 0, 0, 0, ZoneOffset.ofHours(7));
		assertThrows(PvlEncodeException.class, () -> pvl.encodeValue(plusSeven));
		assertThrows(PvlEncodeException.class, () -> pds3.encodeValue(plusSeven));
		assertThrows(PvlEncodeException.class, () -> odl.encodeValue(new TimeValue(12, 0, 0, 0, ZoneOffset.ofHours(13))));
		assertThrows(PvlEncodeException.class, () -> odl.encodeValue(new TimeValue(12, 0, 0, 0, ZoneOffset.ofTotalSeconds(3601))));
	}

	@Test
	void leapSeconds() {
		TimeValue leap = new TimeValue(23, 59, 60, 0, UTC);
		assertEquals("23:59:60", pvl.encodeValue(leap));
		assertThrows(PvlEncodeException.class, () -> odl.encodeValue(leap));
		assertThrows(PvlEncodeException.class, () -> pds3.encodeValue(leap));
	}

	@Test
	void bareStrings() {
		assertEquals("hello", pvl.encodeValue(StringValue.of("hello")));
		assertEquals("^IMAGE", pvl.encodeValue(StringValue.of("^IMAGE")));
		assertEquals("HELLO", odl.encodeValue(StringValue.of("HELLO")));
	}

	@ParameterizedTest
	@ValueSource(strings = {"END", "end_group", "TRUE", "Null", "123", "1.5", "2001-01-01", "a b", "a=b", "", "16#FF#"})
	void stringsThatNeedQuotes(String s) {
		String encoded = pvl.encodeValue(StringValue.of(s));
		assertEquals("\"" + s + "\"", encoded);
		assertEquals(StringValue.of(s), Decoder.pvl().decode(encoded));
	}

	@Test
	void quoteSelection() {
		assertEquals("'say \"hi\"'", pvl.encodeValue(StringValue.of("say \"hi\"")));
		assertEquals("\"it's\"", pvl.encodeValue(StringValue.of("it's")));
		assertThrows(PvlEncodeException.class, () -> pvl.encodeValue(StringValue.of("it's \"both\"")));
	}

	@Test
	void escapes() {
		assertEquals("\"a\\tb\\nc\\\\d\"", pvl.encodeValue(StringValue.of("a\tb\nc\\d")));
	}

	@Test
	void odlStrings() {
		assertEquals("'N/A'", odl.encodeValue(StringValue.of("N/A")));
		assertEquals("'two words'", odl.encodeValue(StringValue.of("two words")));
		assertEquals("\"it's\"", odl.encodeValue(StringValue.of("it's")));
		assertThrows(PvlEncodeException.class, () -> odl.encodeValue(StringValue.of("two  spaces")));
		assertThrows(PvlEncodeException.class, () -> odl.encodeValue(StringValue.of(" leading")));
	}

	@Test
	void collections() {
		assertEquals("(1, 2, (3, 4))", pvl.encodeValue(SequenceValue.of(
			IntegerValue.of(1), IntegerValue.of(2), SequenceValue.of(IntegerValue.of(3), IntegerValue.of(4)))));
		assertEquals("{a, b}", pvl.encodeValue(SetValue.of(StringValue.of("a"), StringValue.of("b"))));
		assertEquals("()", pvl.encodeValue(SequenceValue.of()));
		assertEquals("{}", pvl.encodeValue(SetValue.of()));
	}

	@Test
	void odlCollections() {
		assertThrows(PvlEncodeException.class, () -> odl.encodeValue(SequenceValue.of()));
		Value threeDee = SequenceValue.of(SequenceValue.of(SequenceValue.of(IntegerValue.of(1))));
		assertThrows(PvlEncodeException.class, () -> odl.encodeValue(threeDee));
		assertThrows(PvlEncodeException.class, () -> odl.encodeValue(SetValue.of(SequenceValue.of(IntegerValue.of(1)))));
		assertEquals("{1, 'x y'}", odl.encodeValue(SetValue.of(IntegerValue.of(1), StringValue.of("x y"))));
		assertThrows(PvlEncodeException.class, () -> pds3.encodeValue(SetValue.of(RealValue.of("1.5"))));
		assertEquals("{1, ABC}", pds3.encodeValue(SetValue.of(IntegerValue.of(1), StringValue.of("ABC"))));
	}

	@Test
	void quantities() {
		assertEquals("5 <m>", pvl.encodeValue(new Quantity(IntegerValue.of(5), "m")));
		assertEquals("x <m>", pvl.encodeValue(new Quantity(StringValue.of("x"), "m")));
		assertEquals("9.8 <m/s**2>", odl.encodeValue(new Quantity(RealValue.of("9.8"), "m/s**2")));
		assertThrows(PvlEncodeException.class, () -> odl.encodeValue(new Quantity(StringValue.of("x"), "m")));
		assertThrows(PvlEncodeException.class, () -> odl.encodeValue(new Quantity(IntegerValue.of(1), "m**x")));
		assertThrows(PvlEncodeException.class, () -> odl.encodeValue(new Quantity(IntegerValue.of(1), "")));
		assertThrows(PvlEncodeException.class, () -> pvl.encodeValue(new Quantity(IntegerValue.of(1), "a>b")));
		assertThrows(PvlEncodeException.class, () -> pvl.encodeValue(new Quantity(IntegerValue.of(1), " m")));
	}

	@Test
	void unencodableValues() {
		PvlModule m = new PvlModule();
		m.append("broken", new EmptyValue(3));
		PvlEncodeException e = assertThrows(PvlEncodeException.class, () -> pvl.encode(m));
		assertThat(e.getMessage(), containsString("line 3"));
		assertThat(e.getMessage(), containsString("\"broken\""));
		assertThrows(PvlEncodeException.class, () -> pvl.encodeValue(SequenceValue.of(new PvlGroup())));
	}

	@Test
	void keys() {
		PvlModule spaced = new PvlModule();
		spaced.append("bad key", IntegerValue.of(1));
		assertThrows(PvlEncodeException.class, () -> pvl.encode(spaced));

		PvlModule reserved = new PvlModule();
		reserved.append("END", IntegerValue.of(1));
		assertThrows(PvlEncodeException.class, () -> pvl.encode(reserved));

		PvlModule longKey = new PvlModule();
		longKey.append("A".repeat(31), IntegerValue.of(1));
		assertEquals(1, pvlParser().parse(pvl.encode(longKey)).size());
		assertThrows(PvlEncodeException.class, () -> odl.encode(longKey));

		PvlModule pointer = new PvlModule();
		pointer.append("^IMAGE", IntegerValue.of(3));
		pointer.append("PDS:NAME", IntegerValue.of(4));
		assertEquals("^IMAGE   = 3\r\nPDS:NAME = 4\r\nEND\r\n", odl.encode(pointer));

		PvlModule dotted = new PvlModule();
		dotted.append("a.b", IntegerValue.of(1));
		assertThrows(PvlEncodeException.class, () -> odl.encode(dotted));
	}

	@Test
	void odlRejectsNonAscii() {
		PvlModule m = new PvlModule();
		m.append("s", StringValue.of("café"));
		assertThrows(PvlEncodeException.class, () -> odl.encode(m));
		assertEquals("s = café;\nEND;", pvl.encode(m));
	}

	@Test
	void longLinesWrap() {
		List<Value> numbers = new ArrayList<>();
		for (int i = 0; i < 60; i++) {
			numbers.add(IntegerValue.of(1000 + i));
		}
		PvlModule m = new PvlModule();
		m.append("numbers", new SequenceValue(numbers));
		String text = pvl.encode(m);
		String[] lines = text.split("\n");
		assertTrue(lines.length > 3, "Should wrap");
		for (String line : lines) {
			assertTrue(line.length() <= 79, () -> "Line too long: " + line);
		}
		assertTrue(lines[1].startsWith(" ".repeat(10) + "1"), "Continuation is aligned under the value");
		assertEquals(m, pvlParser().parse(text));
	}

	@Test
	void quotedStringsDoNotWrap() {
		String words = "word ".repeat(30).strip();
		PvlModule m = new PvlModule();
		m.append("s", StringValue.of(words));
		String text = pvl.encode(m);
		assertEquals("s = \"" + words + "\";\nEND;", text);
	}

	@Test
	void encodingIsDeterministic() {
		assertEquals(pvl.encode(module), pvl.encode(module));
	}

	static Parser pvlParser() {
		return new Parser(Decoder.pvl(), Leniency.STRICT);
	}
}

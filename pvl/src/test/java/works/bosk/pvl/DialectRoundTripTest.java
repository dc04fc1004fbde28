package works.bosk.pvl;

import java.time.LocalDate;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.Parameter;
import org.junit.jupiter.params.ParameterizedClass;
import org.junit.jupiter.params.provider.EnumSource;
import works.bosk.pvl.model.BooleanValue;
import works.bosk.pvl.model.DateTimeValue;
import works.bosk.pvl.model.DateValue;
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

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Anything a dialect can encode, it decodes back to an equal module.
 */
@ParameterizedClass
@EnumSource(value = Dialect.class, names = {"PVL", "ODL", "PDS3", "ISIS"})
class DialectRoundTripTest {
	@Parameter
	Dialect dialect;

	PvlModule module;

	@BeforeEach
	void setup() {
		module = new PvlModule();
		module.append("a", IntegerValue.of(1));
		module.append("b", RealValue.of("2.5"));
		module.append("c", StringValue.of("hello world"));
		module.append("d", DateValue.of(2001, 2, 3));
		module.append("e", SequenceValue.of(IntegerValue.of(1), IntegerValue.of(2)));
		module.append("f", SetValue.of(IntegerValue.of(1), IntegerValue.of(2)));
		module.append("q", new Quantity(IntegerValue.of(1), "m"));
		module.append("flag", BooleanValue.TRUE);
		module.append("nothing", NullValue.NULL);
		module.append("repeated", IntegerValue.of(1));
		module.append("repeated", IntegerValue.of(2));

		PvlObject object = new PvlObject();
		object.append("t", new TimeValue(12, 0, 0, 0, ZoneOffset.UTC));
		object.append("when", new DateTimeValue(LocalDate.of(2001, 2, 3), new TimeValue(4, 5, 6, 700_000_000, ZoneOffset.UTC)));
		PvlGroup group = new PvlGroup();
		group.append("matrix", SequenceValue.of(
			SequenceValue.of(IntegerValue.of(1), IntegerValue.of(2)),
			SequenceValue.of(IntegerValue.of(3), IntegerValue.of(4))));
		group.append("speed", new Quantity(RealValue.of("1.5"), "km/s"));
		object.append("inner", group);
		module.append("outer", object);
	}

	@Test
	void roundTrip() {
		String text = Pvl.encode(module, dialect);
		assertEquals(module, Pvl.decode(text, dialect), text);
	}

	@Test
	void encodingIsIdempotent() {
		String text = Pvl.encode(module, dialect);
		assertEquals(text, Pvl.encode(Pvl.decode(text, dialect), dialect));
	}

	@Test
	void omniReadsEverything() {
		assertEquals(module, Pvl.decode(Pvl.encode(module, dialect)));
	}
}

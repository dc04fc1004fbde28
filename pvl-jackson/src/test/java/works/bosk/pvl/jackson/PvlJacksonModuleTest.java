package works.bosk.pvl.jackson;

import java.time.LocalDate;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;
import works.bosk.pvl.Pvl;
import works.bosk.pvl.model.BooleanValue;
import works.bosk.pvl.model.DateTimeValue;
import works.bosk.pvl.model.DateValue;
import works.bosk.pvl.model.EmptyValue;
import works.bosk.pvl.model.IntegerValue;
import works.bosk.pvl.model.NullValue;
import works.bosk.pvl.model.PvlGroup;
import works.bosk.pvl.model.PvlModule;
import works.bosk.pvl.model.Quantity;
import works.bosk.pvl.model.RealValue;
import works.bosk.pvl.model.SequenceValue;
import works.bosk.pvl.model.SetValue;
import works.bosk.pvl.model.StringValue;
import works.bosk.pvl.model.TimeValue;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertEquals;

class PvlJacksonModuleTest {
	ObjectMapper mapper;

	@BeforeEach
	void setup() {
		mapper = JsonMapper.builder()
			.addModule(new PvlJacksonModule())
			.build();
	}

	@Test
	void scalars() {
		PvlModule module = new PvlModule();
		module.append("a", IntegerValue.of(1));
		module.append("b", RealValue.of("2.5"));
		module.append("s", StringValue.of("x y"));
		module.append("flag", BooleanValue.TRUE);
		module.append("n", NullValue.NULL);
		module.append("e", new EmptyValue(4));
		assertEquals(
			"{\"a\":1,\"b\":2.5,\"s\":\"x y\",\"flag\":true,\"n\":null,\"e\":null}",
			mapper.writeValueAsString(module));
	}

	@Test
	void datesAndTimes() {
		PvlModule module = new PvlModule();
		module.append("d", DateValue.of(2001, 2, 3));
		module.append("t", new TimeValue(12, 0, 0, 0, ZoneOffset.UTC));
		module.append("leap", new TimeValue(23, 59, 60, 0, ZoneOffset.UTC));
		module.append("dt", new DateTimeValue(LocalDate.of(2001, 2, 3), new TimeValue(4, 5, 6, 0, ZoneOffset.ofHours(-7))));
		assertEquals(
			"{\"d\":\"2001-02-03\",\"t\":\"12:00Z\",\"leap\":\"23:59:60Z\",\"dt\":\"2001-02-03T04:05:06-07:00\"}",
			mapper.writeValueAsString(module));
	}

	@Test
	void collectionsAndQuantities() {
		PvlModule module = new PvlModule();
		module.append("seq", SequenceValue.of(IntegerValue.of(1), SequenceValue.of(IntegerValue.of(2))));
		module.append("set", SetValue.of(StringValue.of("x")));
		module.append("q", new Quantity(IntegerValue.of(5), "m"));
		assertEquals(
			"{\"seq\":[1,[2]],\"set\":[\"x\"],\"q\":{\"value\":5,\"units\":\"m\"}}",
			mapper.writeValueAsString(module));
	}

	@Test
	void aggregationsAndRepeatedKeys() {
		PvlModule module = new PvlModule();
		PvlGroup g = new PvlGroup();
		g.append("x", IntegerValue.of(1));
		module.append("rep", IntegerValue.of(1));
		module.append("g", g);
		module.append("rep", IntegerValue.of(2));
		assertEquals(
			"{\"rep\":1,\"g\":{\"x\":1},\"rep\":2}",
			mapper.writeValueAsString(module));
	}

	@Test
	void standaloneValues() {
		assertEquals("3", mapper.writeValueAsString(IntegerValue.of(3)));
		assertEquals("{\"value\":1.5,\"units\":\"km\"}", mapper.writeValueAsString(new Quantity(RealValue.of("1.5"), "km")));
	}

	@Test
	void decodedLabel() {
		PvlModule module = Pvl.decode("""
			Object = IsisCube
			  Group = Dimensions
			    Samples = 5
			    Lines   = 10
			  End_Group
			End_Object
			End
			""");
		JsonNode tree = mapper.readTree(mapper.writeValueAsString(module));
		assertEquals(10, tree.get("IsisCube").get("Dimensions").get("Lines").asInt());
	}

	@Test
	void toJsonIsIndented() {
		PvlModule module = new PvlModule();
		module.append("a", IntegerValue.of(1));
		String json = PvlJson.toJson(module);
		assertThat(json, containsString("\n"));
		assertThat(json, containsString("\"a\""));
		assertEquals(1, PvlJson.mapper().readTree(json).get("a").asInt());
	}
}

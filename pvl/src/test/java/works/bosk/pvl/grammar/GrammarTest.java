package works.bosk.pvl.grammar;

import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GrammarTest {

	@Test
	void pvlKeywords() {
		Grammar g = Grammar.pvl();
		assertTrue(g.isGroupBegin("begin_group"));
		assertTrue(g.isGroupBegin("GROUP"));
		assertTrue(g.isObjectBegin("Object"));
		assertTrue(g.isEndAggregation("End_Object"));
		assertTrue(g.isEndStatement("end"));
		assertEquals("END_GROUP", g.endKeywordFor("Begin_Group").orElseThrow());
		assertTrue(g.endKeywordFor("foo").isEmpty());
		assertEquals(new Keywords("BEGIN_GROUP", "END_GROUP"), g.preferredGroupKeywords());
	}

	@ParameterizedTest
	@ValueSource(strings = {"END", "end", "GROUP", "begin_object", "END_GROUP"})
	void reservedKeywords(String word) {
		assertTrue(Grammar.pvl().isReservedKeyword(word));
	}

	@ParameterizedTest
	@ValueSource(strings = {"TRUE", "NULL", "ENDING", "groups"})
	void notReservedKeywords(String word) {
		assertFalse(Grammar.pvl().isReservedKeyword(word));
	}

	@Test
	void isisKeywords() {
		Grammar g = Grammar.isis();
		assertTrue(g.isGroupBegin("Group"));
		assertFalse(g.isGroupBegin("BEGIN_GROUP"));
		assertEquals("Group", g.preferredGroupKeywords().begin());
		assertEquals("End_Object", g.preferredObjectKeywords().end());
		assertFalse(g.isReserved('+'));
		assertTrue(Grammar.pvl().isReserved('+'));
	}

	@Test
	void characterSets() {
		assertTrue(Grammar.pvl().isCharAllowed('é'));
		assertFalse(Grammar.odl().isCharAllowed('é'));
		assertFalse(Grammar.pvl().isCharAllowed('\u0000'));
		assertFalse(Grammar.pvl().isCharAllowed('Ā'));
		assertTrue(Grammar.pvl().isCharAllowed('\t'));
	}

	@Test
	void comments() {
		Grammar omni = Grammar.omni();
		assertEquals(new Delimiters("/*", "*/"), omni.commentStartingAt("a /* b */", 2).orElseThrow());
		assertTrue(omni.commentStartingAt("a /* b */", 1).isEmpty());
		assertTrue(omni.lineCommentStartingWith('#').isPresent());
		assertTrue(Grammar.pvl().lineCommentStartingWith('#').isEmpty());
		assertTrue(omni.isBlockCommentChar('*'));
		assertFalse(omni.isBlockCommentChar('#'));
	}

	@Test
	void leapSeconds() {
		assertTrue(Grammar.pvl().isLeapSecond("23:59:60"));
		assertTrue(Grammar.pvl().isLeapSecond("2016-12-31T23:59:60.5Z"));
		assertTrue(Grammar.pvl().isLeapSecond("2016-366T23:59:60"));
		assertFalse(Grammar.pvl().isLeapSecond("23:59:59"));
		assertFalse(Grammar.odl().isLeapSecond("23:59:60"));
	}

	@Test
	void nonDecimalPatterns() {
		assertTrue(Grammar.pvl().nonDecimalPattern().matcher("-16#FF#").matches());
		assertFalse(Grammar.pvl().nonDecimalPattern().matcher("10#99#").matches());
		assertTrue(Grammar.odl().nonDecimalPattern().matcher("10#-99#").matches());
		assertTrue(Grammar.omni().nonDecimalPattern().matcher("+8#17#").matches());
	}

	@Test
	void builderOverrides() {
		Grammar custom = Grammar.pvl().toBuilder()
			.name("custom")
			.endStatement("FINISH")
			.comments(List.of())
			.build();
		assertTrue(custom.isEndStatement("finish"));
		assertFalse(custom.isEndStatement("END"));
		assertTrue(custom.isReservedKeyword("FINISH"));
		assertTrue(custom.comments().isEmpty());
		assertEquals("PVL", Grammar.pvl().name(), "Original is unchanged");
	}

	@Test
	void invalidDelimiters() {
		assertThrows(IllegalArgumentException.class, () -> Grammar.builder()
			.setDelimiters(new Delimiters("{{", "}}"))
			.build());
		assertThrows(IllegalArgumentException.class, () -> new Delimiters("<", "<"));
	}
}

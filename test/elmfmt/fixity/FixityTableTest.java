package elmfmt.fixity;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;
import static elmfmt.model.elm.ElmBuilder.*;

import org.json.JSONArray;
import org.junit.Test;

import elmfmt.FormatterOptionException;

public class FixityTableTest {

	@Test
	public void testCoreTable() {
		FixityTable core = FixityTable.core();
		assertEquals(new Fixity("+", 6, Associativity.LEFT), core.lookup("+"));
		assertEquals(new Fixity("|>", 0, Associativity.LEFT), core.lookup("|>"));
		assertEquals(new Fixity("<|", 0, Associativity.RIGHT), core.lookup("<|"));
		assertEquals(new Fixity("::", 5, Associativity.RIGHT), core.lookup("::"));
		assertEquals(new Fixity("==", 4, Associativity.NONE), core.lookup("=="));
		assertEquals(new Fixity("<<", 9, Associativity.RIGHT), core.lookup("<<"));
		assertEquals(new Fixity(">>", 9, Associativity.LEFT), core.lookup(">>"));
		assertThat(core.lookup("<?>"), is(nullValue()));
	}

	@Test
	public void testEmptyTableKnowsNothing() {
		assertTrue(FixityTable.empty().isEmpty());
		assertThat(FixityTable.empty().lookup("+"), is(nullValue()));
	}

	@Test
	public void testFromJSON() throws FormatterOptionException {
		FixityTable table = FixityTable.fromJSON(new JSONArray(
				"[{\"operator\": \"|=\", \"precedence\": 5, \"associativity\": \"left\"}," +
				" {\"operator\": \"|.\", \"precedence\": 6, \"associativity\": \"non\"}]"));
		assertThat(table.size(), is(2));
		assertEquals(new Fixity("|=", 5, Associativity.LEFT), table.lookup("|="));
		assertEquals(new Fixity("|.", 6, Associativity.NONE), table.lookup("|."));
	}

	@Test(expected = FormatterOptionException.class)
	public void testFromJSONRejectsUnknownAssociativity() throws FormatterOptionException {
		FixityTable.fromJSON(new JSONArray(
				"[{\"operator\": \"|=\", \"precedence\": 5, \"associativity\": \"sideways\"}]"));
	}

	@Test(expected = FormatterOptionException.class)
	public void testFromJSONRejectsMissingPrecedence() throws FormatterOptionException {
		FixityTable.fromJSON(new JSONArray("[{\"operator\": \"|=\", \"associativity\": \"left\"}]"));
	}

	@Test
	public void testLocalDeclarationsWin() {
		FixityTable table = FixityTable.core().withDeclarations(decls(
				infix(Associativity.RIGHT, 1, "+", "myAdd"),
				infix(Associativity.NONE, 4, "<?>", "compare"),
				function("x", args(), num(1))));
		assertEquals(new Fixity("+", 1, Associativity.RIGHT), table.lookup("+"));
		assertEquals(new Fixity("<?>", 4, Associativity.NONE), table.lookup("<?>"));
		assertEquals(new Fixity("*", 7, Associativity.LEFT), table.lookup("*"));
	}

	@Test
	public void testAssociativityKeywords() {
		assertThat(Associativity.fromKeyword("non"), is(Associativity.NONE));
		assertThat(Associativity.fromKeyword("LEFT"), is(Associativity.LEFT));
		assertThat(Associativity.RIGHT.getKeyword(), is("right"));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testUnknownAssociativityKeyword() {
		Associativity.fromKeyword("sideways");
	}
}

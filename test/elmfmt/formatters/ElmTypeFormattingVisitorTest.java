package elmfmt.formatters;

import static org.junit.Assert.*;
import static elmfmt.model.elm.ElmBuilder.*;

import java.util.Arrays;
import java.util.List;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import elmfmt.doc.DocRenderer;
import elmfmt.errors.TopLevelIssueContext;
import elmfmt.fixity.FixityTable;
import elmfmt.model.elm.ElmType;

@RunWith(Parameterized.class)
public class ElmTypeFormattingVisitorTest {

	@Parameters
	public static List<Object[]> data() {
		return Arrays.asList(new Object[][] {
			{ tvar("a"), 80, "a" },
			{ tfuns(tcon("Int"), tcon("String"), tcon("Bool")), 80, "Int -> String -> Bool" },
			{ tfuns(tcon("Int"), tcon("String"), tcon("Bool")), 10, "Int\n-> String\n-> Bool" },
			{ tfun(tfun(tvar("a"), tvar("b")), tvar("c")), 80, "(a -> b) -> c" },
			{ tfun(tcon("List", tvar("a")), tvar("b")), 80, "List a -> b" },
			{ tcon("List", tcon("Maybe", tvar("a"))), 80, "List (Maybe a)" },
			{ tcon("Maybe", tfun(tvar("a"), tvar("b"))), 80, "Maybe (a -> b)" },
			{ qtcon("Dict", "Dict", tcon("String"), tvar("v")), 80, "Dict.Dict String v" },
			{ ttuple(tcon("Int"), tvar("a")), 80, "( Int, a )" },
			{ tunit(), 80, "()" },
			{ trecord(tfield("x", tcon("Int")), tfield("y", tcon("Int"))), 80, "{ x : Int, y : Int }" },
			{ trecord(), 80, "{}" },
			{ textensible("a", tfield("name", tcon("String"))), 80, "{ a | name : String }" },
			{
				trecord(tfield("name", tcon("String")), tfield("age", tcon("Int"))),
				20,
				"{ name : String\n, age : Int\n}"
			},
		});
	}

	private final ElmType type;
	private final int width;
	private final String expected;

	public ElmTypeFormattingVisitorTest(ElmType type, int width, String expected) {
		this.type = type;
		this.width = width;
		this.expected = expected;
	}

	@Test
	public void test() {
		FormattingContext ctx = new FormattingContext(
				width, new FixityResolver(FixityTable.core()), new TopLevelIssueContext());
		assertEquals(expected, new DocRenderer(width).render(type.accept(new ElmTypeFormattingVisitor(ctx))));
	}
}

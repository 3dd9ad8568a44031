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
import elmfmt.fixity.Associativity;
import elmfmt.fixity.FixityTable;
import elmfmt.model.elm.ElmDeclaration;

@RunWith(Parameterized.class)
public class ElmDeclarationFormattingVisitorTest {

	@Parameters
	public static List<Object[]> data() {
		return Arrays.asList(new Object[][] {
			{ function("answer", args(), num(42)), 80, "answer = 42" },
			{
				function(null, tfuns(tcon("Int"), tcon("Int")), "inc", args(pvar("n")), binop("+", var("n"), num(1))),
				80,
				"inc : Int -> Int\ninc n = n + 1"
			},
			{
				function("total", args(), binop("+", binop("+", var("alpha"), var("beta")), var("gamma"))),
				20,
				"total =\n    alpha\n        + beta\n        + gamma"
			},
			{
				function(null, tfuns(tcon("String"), tcon("Int"), tcon("Bool")), "check", args(pvar("s"), pvar("n")), var("True")),
				20,
				"check :\n    String\n    -> Int\n    -> Bool\ncheck s n = True"
			},
			{
				function("f", args(pctor("Just", pvar("x")), pwild()), var("x")),
				80,
				"f (Just x) _ = x"
			},
			{
				function("update", args(pvar("msg")), caseOf(var("msg"), branch(pwild(), num(0)))),
				80,
				"update msg =\n    case msg of\n        _ ->\n            0"
			},
			{
				function(docComment(" Adds one.\n"), null, "inc", args(pvar("n")), binop("+", var("n"), num(1))),
				80,
				"{-| Adds one.\n-}\ninc n = n + 1"
			},
			{
				function(docComment("\n    x = 1\n"), null, "x", args(), num(1)),
				80,
				"{-|\n    x = 1\n-}\nx = 1"
			},
			{
				function("s", args(), multilineStr("a\n  b")),
				80,
				"s =\n    \"\"\"a\n  b\"\"\""
			},
			{
				typeAlias("Model", vars(), trecord(tfield("count", tcon("Int")))),
				80,
				"type alias Model =\n    { count : Int }"
			},
			{
				typeAlias("Pair", vars("a", "b"), ttuple(tvar("a"), tvar("b"))),
				80,
				"type alias Pair a b =\n    ( a, b )"
			},
			{
				customType("Msg", vars("a"),
						constructor("Increment"),
						constructor("Set", tvar("a"), tcon("Maybe", tcon("Int")))),
				80,
				"type Msg a\n    = Increment\n    | Set a (Maybe Int)"
			},
			{ port("send", tfun(tcon("String"), tcon("Cmd", tvar("msg")))), 80, "port send : String -> Cmd msg" },
			{ infix(Associativity.LEFT, 6, "+", "add"), 80, "infix left 6 (+) = add" },
			{ infix(Associativity.NONE, 4, "==", "eq"), 80, "infix non 4 (==) = eq" },
			{ destructure(ptuple(pvar("a"), pvar("b")), var("pair")), 80, "( a, b ) = pair" },
			{ lineComment(" one", " two"), 80, "-- one\n-- two" },
			{ lineComment("  note   ", "\t"), 80, "--  note\n--" },
		});
	}

	private final ElmDeclaration declaration;
	private final int width;
	private final String expected;

	public ElmDeclarationFormattingVisitorTest(ElmDeclaration declaration, int width, String expected) {
		this.declaration = declaration;
		this.width = width;
		this.expected = expected;
	}

	@Test
	public void test() {
		TopLevelIssueContext issues = new TopLevelIssueContext();
		FormattingContext ctx = new FormattingContext(width, new FixityResolver(FixityTable.core()), issues);
		String actual = new DocRenderer(width).render(
				declaration.accept(new ElmDeclarationFormattingVisitor(ctx)));
		assertEquals(expected, actual);
		assertFalse(issues.hasIssues());
	}
}

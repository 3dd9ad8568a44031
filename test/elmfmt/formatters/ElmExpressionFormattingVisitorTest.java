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
import elmfmt.model.elm.ElmExpression;
import elmfmt.model.elm.ElmNumberLiteral;

@RunWith(Parameterized.class)
public class ElmExpressionFormattingVisitorTest {

	@Parameters
	public static List<Object[]> data() {
		return Arrays.asList(new Object[][] {
			// precedence
			{ binop("+", num(1), binop("*", num(2), num(3))), 80, "1 + 2 * 3" },
			{ binop("*", binop("+", num(1), num(2)), num(3)), 80, "(1 + 2) * 3" },
			{ binop("+", num(1), paren(binop("*", num(2), num(3)))), 80, "1 + (2 * 3)" },
			{ binop("-", binop("+", var("a"), var("b")), var("c")), 80, "a + b - c" },
			{ binop("-", var("a"), binop("-", var("b"), var("c"))), 80, "a - (b - c)" },
			{ binop("++", var("a"), binop("++", var("b"), var("c"))), 80, "a ++ b ++ c" },
			{ binop("++", binop("++", var("a"), var("b")), var("c")), 80, "(a ++ b) ++ c" },
			{ binop("==", binop("==", var("a"), var("b")), var("c")), 80, "(a == b) == c" },
			{ binop("&&", binop("==", var("a"), var("b")), binop("<", var("c"), var("d"))), 80, "a == b && c < d" },
			{ binop("<?>", var("a"), binop("+", var("b"), var("c"))), 80, "a <?> (b + c)" },

			// operator chains
			{
				binop("|>", binop("|>", var("model"), app(qvar("List", "map"), var("f"))), qvar("List", "reverse")),
				20,
				"model\n    |> List.map f\n    |> List.reverse"
			},
			{ binop("<|", var("f"), lambda(args(pvar("x")), var("x"))), 80, "f <| \\x -> x" },
			{ binop("|>", lambda(args(pvar("x")), var("x")), var("g")), 80, "(\\x -> x) |> g" },
			{
				binop("<|", var("f"), binop("<|", var("g"), ifThenElse(var("c"), var("a"), var("b")))),
				80,
				"f\n    <| g\n    <| if c then\n        a\n\n    else\n        b"
			},

			// applications
			{
				app(var("f"), app(var("g"), var("x")), negate(num(1)), binop("+", var("a"), var("b"))),
				80,
				"f (g x) (-1) (a + b)"
			},
			{
				app(var("function"), var("argumentOne"), var("argumentTwo")),
				20,
				"function\n    argumentOne\n    argumentTwo"
			},
			{ app(prefixOp("+"), num(1)), 80, "(+) 1" },
			{ negate(var("x")), 80, "-x" },
			{ negate(app(var("f"), var("x"))), 80, "-(f x)" },

			// literals
			{ str("hi"), 80, "\"hi\"" },
			{ chr("a"), 80, "'a'" },
			{ num("0xFF", ElmNumberLiteral.Base.HEXADECIMAL), 80, "0xFF" },
			{ num("1.5e3", ElmNumberLiteral.Base.FLOAT), 80, "1.5e3" },
			{ multilineStr("line one\n  line two"), 80, "\"\"\"line one\n  line two\"\"\"" },
			{ glsl("void main() {}"), 80, "[glsl|void main() {}|]" },
			{ unit(), 80, "()" },

			// collections and records
			{ list(num(1), num(2), num(3)), 80, "[ 1, 2, 3 ]" },
			{ list(num(1), num(2), num(3)), 5, "[ 1\n, 2\n, 3\n]" },
			{ list(), 80, "[]" },
			{ tuple(var("a"), var("b")), 80, "( a, b )" },
			{ record(field("x", num(1)), field("y", num(2))), 80, "{ x = 1, y = 2 }" },
			{ record(), 80, "{}" },
			{ recordUpdate("model", field("count", num(0))), 80, "{ model | count = 0 }" },
			{
				recordUpdate("model", field("count", num(0)), field("name", str("x"))),
				20,
				"{ model\n    | count = 0\n    , name = \"x\"\n}"
			},
			{ access(app(var("f"), var("x")), "field"), 80, "(f x).field" },
			{ access(var("model"), "count"), 80, "model.count" },
			{ accessor("name"), 80, ".name" },

			// control flow
			{ lambda(args(pvar("x"), pwild()), var("x")), 80, "\\x _ -> x" },
			{ ifThenElse(var("c"), num(1), num(2)), 80, "if c then\n    1\n\nelse\n    2" },
			{
				ifChain(Arrays.asList(elseIf(var("a"), num(1)), elseIf(var("b"), num(2))), num(3)),
				80,
				"if a then\n    1\n\nelse if b then\n    2\n\nelse\n    3"
			},
			{
				caseOf(var("msg"),
						branch(pctor("Increment"), binop("+", var("model"), num(1))),
						branch(pwild(), var("model"))),
				80,
				"case msg of\n    Increment ->\n        model + 1\n\n    _ ->\n        model"
			},
			{
				let(decls(function("x", args(), num(1)), function("y", args(), num(2))), binop("+", var("x"), var("y"))),
				80,
				"let\n    x = 1\n\n    y = 2\nin\nx + y"
			},
		});
	}

	private final ElmExpression expression;
	private final int width;
	private final String expected;

	public ElmExpressionFormattingVisitorTest(ElmExpression expression, int width, String expected) {
		this.expression = expression;
		this.width = width;
		this.expected = expected;
	}

	@Test
	public void test() {
		FormattingContext ctx = new FormattingContext(
				width, new FixityResolver(FixityTable.core()), new TopLevelIssueContext());
		String actual = new DocRenderer(width).render(
				expression.accept(new ElmExpressionFormattingVisitor(ctx)));
		assertEquals(expected, actual);
	}
}

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
import elmfmt.model.elm.ElmPattern;

@RunWith(Parameterized.class)
public class ElmPatternFormattingVisitorTest {

	@Parameters
	public static List<Object[]> data() {
		return Arrays.asList(new Object[][] {
			{ pwild(), "_" },
			{ pvar("x"), "x" },
			{ punit(), "()" },
			{ plit(num(3)), "3" },
			{ plit(str("a")), "\"a\"" },
			{ ptuple(pvar("a"), pvar("b")), "( a, b )" },
			{ plist(), "[]" },
			{ plist(pvar("a"), pwild()), "[ a, _ ]" },
			{ pcons(pvar("x"), pcons(pvar("y"), pvar("rest"))), "x :: y :: rest" },
			{ pcons(pcons(pvar("x"), pvar("y")), pvar("z")), "(x :: y) :: z" },
			{ pcons(pctor("Just", pvar("x")), pvar("rest")), "Just x :: rest" },
			{ precord("x", "y"), "{ x, y }" },
			{ precord(), "{}" },
			{ pctor("Nothing"), "Nothing" },
			{ pctor("Just", pctor("Ok", pvar("v"))), "Just (Ok v)" },
			{ pctor("Just", pctor("Nothing")), "Just Nothing" },
			{ pctor("Maybe", "Just", pvar("x")), "Maybe.Just x" },
			{ palias(ptuple(pvar("a"), pvar("b")), "pair"), "( a, b ) as pair" },
			{ palias(pctor("Just", pvar("x")), "m"), "(Just x) as m" },
			{ pcons(pvar("x"), palias(pvar("xs"), "rest")), "x :: (xs as rest)" },
			{ pparen(pvar("x")), "(x)" },
		});
	}

	private final ElmPattern pattern;
	private final String expected;

	public ElmPatternFormattingVisitorTest(ElmPattern pattern, String expected) {
		this.pattern = pattern;
		this.expected = expected;
	}

	@Test
	public void test() {
		FormattingContext ctx = new FormattingContext(
				80, new FixityResolver(FixityTable.core()), new TopLevelIssueContext());
		assertEquals(expected, new DocRenderer(80).render(pattern.accept(new ElmPatternFormattingVisitor(ctx))));
	}
}

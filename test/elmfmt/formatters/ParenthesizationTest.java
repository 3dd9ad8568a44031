package elmfmt.formatters;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.List;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import elmfmt.fixity.Fixity;
import elmfmt.fixity.FixityTable;
import elmfmt.formatters.Parenthesization.Side;

@RunWith(Parameterized.class)
public class ParenthesizationTest {

	private static final FixityTable CORE = FixityTable.core();

	@Parameters
	public static List<Object[]> data() {
		return Arrays.asList(new Object[][] {
			// parent, child, side, parenthesized
			{ "+", "*", Side.LEFT, false },
			{ "+", "*", Side.RIGHT, false },
			{ "*", "+", Side.LEFT, true },
			{ "*", "+", Side.RIGHT, true },
			{ "+", "-", Side.LEFT, false },
			{ "+", "-", Side.RIGHT, true },
			{ "++", "++", Side.LEFT, true },
			{ "++", "++", Side.RIGHT, false },
			{ "==", "==", Side.LEFT, true },
			{ "==", "==", Side.RIGHT, true },
			{ "|>", "<|", Side.LEFT, true },
			{ "<|", "|>", Side.RIGHT, true },
			{ "&&", "==", Side.RIGHT, false },
			{ "<?>", "+", Side.RIGHT, true },
			{ "+", "<?>", Side.LEFT, true },
		});
	}

	private final String parent;
	private final String child;
	private final Side side;
	private final boolean expected;

	public ParenthesizationTest(String parent, String child, Side side, boolean expected) {
		this.parent = parent;
		this.child = child;
		this.side = side;
		this.expected = expected;
	}

	@Test
	public void test() {
		Fixity parentFixity = CORE.lookup(parent);
		Fixity childFixity = CORE.lookup(child);
		assertEquals(parent + " over " + child + " on the " + side,
				expected, Parenthesization.needsParentheses(parentFixity, childFixity, side));
		if (!expected) {
			assertEquals(parentFixity.getPrecedence() == childFixity.getPrecedence(),
					Parenthesization.continuesChain(parentFixity, childFixity, side));
		}
	}
}

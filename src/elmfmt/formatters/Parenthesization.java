package elmfmt.formatters;

import elmfmt.Unreachable;
import elmfmt.fixity.Fixity;

/**
 * 
 * Decides whether an operator application that is itself the operand of another
 * operator must be wrapped in parentheses to parse back with the same grouping.
 * 
 * <ul>
 *   <li>a looser operand is always wrapped</li>
 *   <li>a tighter operand never is</li>
 *   <li>at equal precedence, the operand is wrapped unless both operators associate
 *       the same way, towards the operand's side</li>
 *   <li>an operator with unknown fixity is always wrapped, and wraps its operators</li>
 * </ul>
 *
 */
public class Parenthesization {
	private Parenthesization() {}

	public enum Side {
		LEFT,
		RIGHT,
	}

	/**
	 * @param parent the enclosing operator's fixity, null if unknown
	 * @param child the operand operator's fixity, null if unknown
	 */
	public static boolean needsParentheses(Fixity parent, Fixity child, Side side) {
		if (parent == null || child == null) {
			return true;
		}
		if (child.getPrecedence() != parent.getPrecedence()) {
			return child.getPrecedence() < parent.getPrecedence();
		}
		if (child.getAssociativity() != parent.getAssociativity()) {
			return true;
		}
		switch (parent.getAssociativity()) {
			case LEFT:
				return side == Side.RIGHT;
			case RIGHT:
				return side == Side.LEFT;
			case NONE:
				return true;
		}
		throw new Unreachable();
	}

	/**
	 * @return true when an unparenthesized operand can join its parent's operator chain
	 */
	public static boolean continuesChain(Fixity parent, Fixity child, Side side) {
		return !needsParentheses(parent, child, side) && parent.getPrecedence() == child.getPrecedence();
	}
}

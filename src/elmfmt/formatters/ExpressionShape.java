package elmfmt.formatters;

/**
 * How an expression binds when placed next to other syntax.
 */
public enum ExpressionShape {
	/**
	 * self-delimited: literals, names, brackets, braces, parentheses
	 */
	ATOMIC,
	APPLICATION,
	NEGATION,
	OPERATOR,
	/**
	 * lambda, let, case and if, which extend as far to the right as they can
	 */
	OPEN_ENDED,
}

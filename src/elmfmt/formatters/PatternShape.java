package elmfmt.formatters;

/**
 * How a pattern binds when placed next to other syntax.
 */
public enum PatternShape {
	ATOMIC,
	/**
	 * a constructor applied to at least one argument
	 */
	CONSTRUCTOR,
	CONS,
	ALIAS,
}

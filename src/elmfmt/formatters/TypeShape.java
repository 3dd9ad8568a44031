package elmfmt.formatters;

/**
 * How a type expression binds when placed next to other syntax.
 */
public enum TypeShape {
	ATOMIC,
	/**
	 * a type constructor applied to at least one argument
	 */
	APPLICATION,
	FUNCTION,
}

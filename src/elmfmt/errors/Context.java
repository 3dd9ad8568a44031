package elmfmt.errors;

/**
 * Describes where the formatter was when an issue came up.
 */
public abstract class Context {

	public abstract <T, E extends Throwable> T accept(ContextVisitor<T, E> v) throws E;

}

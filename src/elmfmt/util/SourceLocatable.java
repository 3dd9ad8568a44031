package elmfmt.util;

/**
 * 
 * A common abstract base for syntax tree nodes that can be traced back to
 * where the parser found them.
 *
 */
public abstract class SourceLocatable {
	
	public abstract SourceLocation getLocation();

}

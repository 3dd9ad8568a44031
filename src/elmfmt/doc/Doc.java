package elmfmt.doc;

/**
 * 
 * A layout document: an immutable tree describing text, places where a line
 * may or must break, indentation, and groups that are laid out either fully
 * flat or fully broken. Documents know nothing about the language being
 * formatted; {@link DocRenderer} decides the actual breaks for a page width.
 *
 */
public abstract class Doc {

	Doc() {}

	public abstract <T, E extends Throwable> T accept(DocVisitor<T, E> v) throws E;

}

package elmfmt.doc;

public abstract class DocVisitor<T, E extends Throwable> {
	public abstract T visit(DocEmpty docEmpty) throws E;
	public abstract T visit(DocText docText) throws E;
	public abstract T visit(DocConcat docConcat) throws E;
	public abstract T visit(DocLine docLine) throws E;
	public abstract T visit(DocNest docNest) throws E;
	public abstract T visit(DocGroup docGroup) throws E;
	public abstract T visit(DocFlatAlt docFlatAlt) throws E;
}

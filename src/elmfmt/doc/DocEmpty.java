package elmfmt.doc;

public final class DocEmpty extends Doc {

	static final DocEmpty INSTANCE = new DocEmpty();

	private DocEmpty() {}

	@Override
	public <T, E extends Throwable> T accept(DocVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}

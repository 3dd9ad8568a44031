package elmfmt.doc;

public final class DocConcat extends Doc {

	private final Doc left;
	private final Doc right;

	DocConcat(Doc left, Doc right) {
		this.left = left;
		this.right = right;
	}

	public Doc getLeft() {
		return left;
	}

	public Doc getRight() {
		return right;
	}

	@Override
	public <T, E extends Throwable> T accept(DocVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}

package elmfmt.doc;

/**
 * A unit laid out either entirely on one line or with all of its own soft
 * lines broken. Nested groups decide for themselves.
 */
public final class DocGroup extends Doc {

	private final Doc body;

	DocGroup(Doc body) {
		this.body = body;
	}

	public Doc getBody() {
		return body;
	}

	@Override
	public <T, E extends Throwable> T accept(DocVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}

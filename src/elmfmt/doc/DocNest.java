package elmfmt.doc;

/**
 * Adds {@code indent} columns to every line break produced inside the body.
 */
public final class DocNest extends Doc {

	private final int indent;
	private final Doc body;

	DocNest(int indent, Doc body) {
		this.indent = indent;
		this.body = body;
	}

	public int getIndent() {
		return indent;
	}

	public Doc getBody() {
		return body;
	}

	@Override
	public <T, E extends Throwable> T accept(DocVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}

package elmfmt.doc;

/**
 * 
 * A potential or mandatory line break.
 *
 */
public final class DocLine extends Doc {

	public enum Kind {
		/**
		 * always breaks, and makes any enclosing group break too
		 */
		HARD,
		/**
		 * breaks only when the enclosing group does not fit; a single space otherwise
		 */
		SOFT,
		/**
		 * like HARD, but the next line starts at column 0 regardless of nesting
		 */
		LITERAL,
	}

	static final DocLine HARD = new DocLine(Kind.HARD);
	static final DocLine SOFT = new DocLine(Kind.SOFT);
	static final DocLine LITERAL = new DocLine(Kind.LITERAL);

	private final Kind kind;

	private DocLine(Kind kind) {
		this.kind = kind;
	}

	public Kind getKind() {
		return kind;
	}

	@Override
	public <T, E extends Throwable> T accept(DocVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}

package elmfmt.doc;

/**
 * Chooses between two layouts depending on whether the enclosing group was
 * flattened.
 */
public final class DocFlatAlt extends Doc {

	private final Doc broken;
	private final Doc flat;

	DocFlatAlt(Doc broken, Doc flat) {
		this.broken = broken;
		this.flat = flat;
	}

	public Doc getBroken() {
		return broken;
	}

	public Doc getFlat() {
		return flat;
	}

	@Override
	public <T, E extends Throwable> T accept(DocVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}

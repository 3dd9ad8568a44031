package elmfmt.errors;

/**
 * The doc comment of a declaration, or of the module when {@code owner} is null.
 */
public class WhileReadingDocComment extends Context {
	private final String owner;

	public WhileReadingDocComment(String owner) {
		this.owner = owner;
	}

	public String getOwner() {
		return owner;
	}

	public boolean isModuleComment() {
		return owner == null;
	}

	@Override
	public <T, E extends Throwable> T accept(ContextVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}

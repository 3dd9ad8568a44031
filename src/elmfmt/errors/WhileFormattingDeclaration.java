package elmfmt.errors;

public class WhileFormattingDeclaration extends Context {
	private final String name;

	public WhileFormattingDeclaration(String name) {
		this.name = name;
	}

	public String getName() {
		return name;
	}

	@Override
	public <T, E extends Throwable> T accept(ContextVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}

package elmfmt.errors;

public abstract class ContextVisitor<T, E extends Throwable> {
	public abstract T visit(WhileFormattingDeclaration whileFormattingDeclaration) throws E;
	public abstract T visit(WhileReadingDocComment whileReadingDocComment) throws E;
}

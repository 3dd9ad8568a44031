package elmfmt.model.elm;

public abstract class ElmExposingVisitor<T, E extends Throwable> {
	public abstract T visit(ElmExposingAll elmExposingAll) throws E;
	public abstract T visit(ElmExposingList elmExposingList) throws E;
}

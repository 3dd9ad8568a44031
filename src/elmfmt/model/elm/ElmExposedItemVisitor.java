package elmfmt.model.elm;

public abstract class ElmExposedItemVisitor<T, E extends Throwable> {
	public abstract T visit(ElmExposedValue elmExposedValue) throws E;
	public abstract T visit(ElmExposedType elmExposedType) throws E;
	public abstract T visit(ElmExposedOperator elmExposedOperator) throws E;
}

package elmfmt.model.elm;

public abstract class ElmTypeVisitor<T, E extends Throwable> {
	public abstract T visit(ElmTypeVariable elmTypeVariable) throws E;
	public abstract T visit(ElmTypeConstructor elmTypeConstructor) throws E;
	public abstract T visit(ElmFunctionType elmFunctionType) throws E;
	public abstract T visit(ElmTupleType elmTupleType) throws E;
	public abstract T visit(ElmUnitType elmUnitType) throws E;
	public abstract T visit(ElmRecordType elmRecordType) throws E;
}

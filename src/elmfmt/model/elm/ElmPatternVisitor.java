package elmfmt.model.elm;

public abstract class ElmPatternVisitor<T, E extends Throwable> {
	public abstract T visit(ElmWildcardPattern elmWildcardPattern) throws E;
	public abstract T visit(ElmVariablePattern elmVariablePattern) throws E;
	public abstract T visit(ElmLiteralPattern elmLiteralPattern) throws E;
	public abstract T visit(ElmUnitPattern elmUnitPattern) throws E;
	public abstract T visit(ElmTuplePattern elmTuplePattern) throws E;
	public abstract T visit(ElmListPattern elmListPattern) throws E;
	public abstract T visit(ElmConsPattern elmConsPattern) throws E;
	public abstract T visit(ElmRecordPattern elmRecordPattern) throws E;
	public abstract T visit(ElmConstructorPattern elmConstructorPattern) throws E;
	public abstract T visit(ElmAliasPattern elmAliasPattern) throws E;
	public abstract T visit(ElmParenthesizedPattern elmParenthesizedPattern) throws E;
}

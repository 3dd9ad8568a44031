package elmfmt.model.elm;

public abstract class ElmExpressionVisitor<T, E extends Throwable> {
	public abstract T visit(ElmStringLiteral elmStringLiteral) throws E;
	public abstract T visit(ElmCharLiteral elmCharLiteral) throws E;
	public abstract T visit(ElmNumberLiteral elmNumberLiteral) throws E;
	public abstract T visit(ElmUnit elmUnit) throws E;
	public abstract T visit(ElmVariable elmVariable) throws E;
	public abstract T visit(ElmApplication elmApplication) throws E;
	public abstract T visit(ElmBinaryOperation elmBinaryOperation) throws E;
	public abstract T visit(ElmNegation elmNegation) throws E;
	public abstract T visit(ElmPrefixOperator elmPrefixOperator) throws E;
	public abstract T visit(ElmTuple elmTuple) throws E;
	public abstract T visit(ElmList elmList) throws E;
	public abstract T visit(ElmRecord elmRecord) throws E;
	public abstract T visit(ElmRecordUpdate elmRecordUpdate) throws E;
	public abstract T visit(ElmRecordAccess elmRecordAccess) throws E;
	public abstract T visit(ElmRecordAccessFunction elmRecordAccessFunction) throws E;
	public abstract T visit(ElmLambda elmLambda) throws E;
	public abstract T visit(ElmLet elmLet) throws E;
	public abstract T visit(ElmCase elmCase) throws E;
	public abstract T visit(ElmIf elmIf) throws E;
	public abstract T visit(ElmParenthesized elmParenthesized) throws E;
	public abstract T visit(ElmGlsl elmGlsl) throws E;
}

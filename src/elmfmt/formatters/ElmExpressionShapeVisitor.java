package elmfmt.formatters;

import elmfmt.model.elm.*;

public class ElmExpressionShapeVisitor extends ElmExpressionVisitor<ExpressionShape, RuntimeException> {

	@Override
	public ExpressionShape visit(ElmStringLiteral elmStringLiteral) {
		return ExpressionShape.ATOMIC;
	}

	@Override
	public ExpressionShape visit(ElmCharLiteral elmCharLiteral) {
		return ExpressionShape.ATOMIC;
	}

	@Override
	public ExpressionShape visit(ElmNumberLiteral elmNumberLiteral) {
		return ExpressionShape.ATOMIC;
	}

	@Override
	public ExpressionShape visit(ElmUnit elmUnit) {
		return ExpressionShape.ATOMIC;
	}

	@Override
	public ExpressionShape visit(ElmVariable elmVariable) {
		return ExpressionShape.ATOMIC;
	}

	@Override
	public ExpressionShape visit(ElmApplication elmApplication) {
		if (elmApplication.getArguments().isEmpty()) {
			return elmApplication.getFunction().accept(this);
		}
		return ExpressionShape.APPLICATION;
	}

	@Override
	public ExpressionShape visit(ElmBinaryOperation elmBinaryOperation) {
		return ExpressionShape.OPERATOR;
	}

	@Override
	public ExpressionShape visit(ElmNegation elmNegation) {
		return ExpressionShape.NEGATION;
	}

	@Override
	public ExpressionShape visit(ElmPrefixOperator elmPrefixOperator) {
		return ExpressionShape.ATOMIC;
	}

	@Override
	public ExpressionShape visit(ElmTuple elmTuple) {
		return ExpressionShape.ATOMIC;
	}

	@Override
	public ExpressionShape visit(ElmList elmList) {
		return ExpressionShape.ATOMIC;
	}

	@Override
	public ExpressionShape visit(ElmRecord elmRecord) {
		return ExpressionShape.ATOMIC;
	}

	@Override
	public ExpressionShape visit(ElmRecordUpdate elmRecordUpdate) {
		return ExpressionShape.ATOMIC;
	}

	@Override
	public ExpressionShape visit(ElmRecordAccess elmRecordAccess) {
		return ExpressionShape.ATOMIC;
	}

	@Override
	public ExpressionShape visit(ElmRecordAccessFunction elmRecordAccessFunction) {
		return ExpressionShape.ATOMIC;
	}

	@Override
	public ExpressionShape visit(ElmLambda elmLambda) {
		return ExpressionShape.OPEN_ENDED;
	}

	@Override
	public ExpressionShape visit(ElmLet elmLet) {
		return ExpressionShape.OPEN_ENDED;
	}

	@Override
	public ExpressionShape visit(ElmCase elmCase) {
		return ExpressionShape.OPEN_ENDED;
	}

	@Override
	public ExpressionShape visit(ElmIf elmIf) {
		return ExpressionShape.OPEN_ENDED;
	}

	@Override
	public ExpressionShape visit(ElmParenthesized elmParenthesized) {
		return ExpressionShape.ATOMIC;
	}

	@Override
	public ExpressionShape visit(ElmGlsl elmGlsl) {
		return ExpressionShape.ATOMIC;
	}
}

package elmfmt.formatters;

import elmfmt.model.elm.*;

public class ElmPatternShapeVisitor extends ElmPatternVisitor<PatternShape, RuntimeException> {

	@Override
	public PatternShape visit(ElmWildcardPattern elmWildcardPattern) {
		return PatternShape.ATOMIC;
	}

	@Override
	public PatternShape visit(ElmVariablePattern elmVariablePattern) {
		return PatternShape.ATOMIC;
	}

	@Override
	public PatternShape visit(ElmLiteralPattern elmLiteralPattern) {
		return PatternShape.ATOMIC;
	}

	@Override
	public PatternShape visit(ElmUnitPattern elmUnitPattern) {
		return PatternShape.ATOMIC;
	}

	@Override
	public PatternShape visit(ElmTuplePattern elmTuplePattern) {
		return PatternShape.ATOMIC;
	}

	@Override
	public PatternShape visit(ElmListPattern elmListPattern) {
		return PatternShape.ATOMIC;
	}

	@Override
	public PatternShape visit(ElmConsPattern elmConsPattern) {
		return PatternShape.CONS;
	}

	@Override
	public PatternShape visit(ElmRecordPattern elmRecordPattern) {
		return PatternShape.ATOMIC;
	}

	@Override
	public PatternShape visit(ElmConstructorPattern elmConstructorPattern) {
		if (elmConstructorPattern.getArguments().isEmpty()) {
			return PatternShape.ATOMIC;
		}
		return PatternShape.CONSTRUCTOR;
	}

	@Override
	public PatternShape visit(ElmAliasPattern elmAliasPattern) {
		return PatternShape.ALIAS;
	}

	@Override
	public PatternShape visit(ElmParenthesizedPattern elmParenthesizedPattern) {
		return PatternShape.ATOMIC;
	}
}

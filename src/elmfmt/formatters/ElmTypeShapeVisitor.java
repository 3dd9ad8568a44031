package elmfmt.formatters;

import elmfmt.model.elm.*;

public class ElmTypeShapeVisitor extends ElmTypeVisitor<TypeShape, RuntimeException> {

	@Override
	public TypeShape visit(ElmTypeVariable elmTypeVariable) {
		return TypeShape.ATOMIC;
	}

	@Override
	public TypeShape visit(ElmTypeConstructor elmTypeConstructor) {
		if (elmTypeConstructor.getArguments().isEmpty()) {
			return TypeShape.ATOMIC;
		}
		return TypeShape.APPLICATION;
	}

	@Override
	public TypeShape visit(ElmFunctionType elmFunctionType) {
		return TypeShape.FUNCTION;
	}

	@Override
	public TypeShape visit(ElmTupleType elmTupleType) {
		return TypeShape.ATOMIC;
	}

	@Override
	public TypeShape visit(ElmUnitType elmUnitType) {
		return TypeShape.ATOMIC;
	}

	@Override
	public TypeShape visit(ElmRecordType elmRecordType) {
		return TypeShape.ATOMIC;
	}
}

package elmfmt.formatters;

import elmfmt.doc.Doc;
import elmfmt.model.elm.ElmExposedItemVisitor;
import elmfmt.model.elm.ElmExposedOperator;
import elmfmt.model.elm.ElmExposedType;
import elmfmt.model.elm.ElmExposedValue;

import static elmfmt.doc.DocBuilder.*;

public class ElmExposedItemFormattingVisitor extends ElmExposedItemVisitor<Doc, RuntimeException> {

	@Override
	public Doc visit(ElmExposedValue elmExposedValue) {
		return text(elmExposedValue.getName());
	}

	@Override
	public Doc visit(ElmExposedType elmExposedType) {
		if (elmExposedType.isConstructorsExposed()) {
			return text(elmExposedType.getName() + "(..)");
		}
		return text(elmExposedType.getName());
	}

	@Override
	public Doc visit(ElmExposedOperator elmExposedOperator) {
		return text("(" + elmExposedOperator.getSymbol() + ")");
	}
}

package elmfmt.formatters;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import elmfmt.doc.Doc;
import elmfmt.model.elm.*;

import static elmfmt.doc.DocBuilder.*;
import static elmfmt.formatters.FormattingTools.*;

public class ElmTypeFormattingVisitor extends ElmTypeVisitor<Doc, RuntimeException> {

	private final FormattingContext ctx;

	public ElmTypeFormattingVisitor(FormattingContext ctx) {
		this.ctx = ctx;
	}

	private static TypeShape shapeOf(ElmType type) {
		return type.accept(new ElmTypeShapeVisitor());
	}

	/**
	 * Formats {@code type} as the argument of a type or value constructor.
	 */
	public Doc argument(ElmType type) {
		Doc doc = type.accept(this);
		if (shapeOf(type) == TypeShape.ATOMIC) {
			return doc;
		}
		return parenthesize(doc);
	}

	/**
	 * {@code name arg1 arg2}, with the arguments moving to indented lines when they do not
	 * fit.
	 */
	public Doc application(String name, List<ElmType> arguments) {
		List<Doc> parts = new ArrayList<>();
		for (ElmType argument : arguments) {
			parts.add(concat(softline(), argument(argument)));
		}
		return group(concat(text(name), nest(INDENT, concat(parts))));
	}

	@Override
	public Doc visit(ElmTypeVariable elmTypeVariable) {
		return text(elmTypeVariable.getName());
	}

	@Override
	public Doc visit(ElmTypeConstructor elmTypeConstructor) {
		return application(
				qualified(elmTypeConstructor.getModuleQualifier(), elmTypeConstructor.getName()),
				elmTypeConstructor.getArguments());
	}

	@Override
	public Doc visit(ElmFunctionType elmFunctionType) {
		// -> associates to the right, so a chain is a right spine of function types
		List<Doc> parts = new ArrayList<>();
		ElmType current = elmFunctionType;
		while (current instanceof ElmFunctionType) {
			ElmType from = ((ElmFunctionType) current).getFrom();
			Doc fromDoc = from.accept(this);
			parts.add(shapeOf(from) == TypeShape.FUNCTION ? parenthesize(fromDoc) : fromDoc);
			current = ((ElmFunctionType) current).getTo();
		}
		parts.add(current.accept(this));
		return group(join(concat(softline(), text("-> ")), parts));
	}

	@Override
	public Doc visit(ElmTupleType elmTupleType) {
		return commaSequence("(", ")", elmTupleType.getElements().stream()
				.map(t -> t.accept(this))
				.collect(Collectors.toList()));
	}

	@Override
	public Doc visit(ElmUnitType elmUnitType) {
		return text("()");
	}

	@Override
	public Doc visit(ElmRecordType elmRecordType) {
		List<Doc> fields = elmRecordType.getFields().stream()
				.map(f -> f.accept(new ElmNodeFormattingVisitor(ctx)))
				.collect(Collectors.toList());
		if (elmRecordType.getExtendedVariable() == null) {
			return commaSequence("{", "}", fields);
		}
		return extensionSequence(elmRecordType.getExtendedVariable(), fields);
	}
}

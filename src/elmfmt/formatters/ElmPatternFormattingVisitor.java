package elmfmt.formatters;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import elmfmt.doc.Doc;
import elmfmt.model.elm.*;

import static elmfmt.doc.DocBuilder.*;
import static elmfmt.formatters.FormattingTools.*;

public class ElmPatternFormattingVisitor extends ElmPatternVisitor<Doc, RuntimeException> {

	private final FormattingContext ctx;

	public ElmPatternFormattingVisitor(FormattingContext ctx) {
		this.ctx = ctx;
	}

	private static PatternShape shapeOf(ElmPattern pattern) {
		return pattern.accept(new ElmPatternShapeVisitor());
	}

	/**
	 * Formats {@code pattern} for a position that only takes atomic patterns: function and
	 * lambda arguments, constructor arguments.
	 */
	public Doc argument(ElmPattern pattern) {
		Doc doc = pattern.accept(this);
		if (shapeOf(pattern) == PatternShape.ATOMIC) {
			return doc;
		}
		return parenthesize(doc);
	}

	@Override
	public Doc visit(ElmWildcardPattern elmWildcardPattern) {
		return text("_");
	}

	@Override
	public Doc visit(ElmVariablePattern elmVariablePattern) {
		return text(elmVariablePattern.getName());
	}

	@Override
	public Doc visit(ElmLiteralPattern elmLiteralPattern) {
		return elmLiteralPattern.getLiteral().accept(new ElmExpressionFormattingVisitor(ctx));
	}

	@Override
	public Doc visit(ElmUnitPattern elmUnitPattern) {
		return text("()");
	}

	@Override
	public Doc visit(ElmTuplePattern elmTuplePattern) {
		return commaSequence("(", ")", elmTuplePattern.getElements().stream()
				.map(p -> p.accept(this))
				.collect(Collectors.toList()));
	}

	@Override
	public Doc visit(ElmListPattern elmListPattern) {
		return commaSequence("[", "]", elmListPattern.getElements().stream()
				.map(p -> p.accept(this))
				.collect(Collectors.toList()));
	}

	@Override
	public Doc visit(ElmConsPattern elmConsPattern) {
		// :: associates to the right
		ElmPattern head = elmConsPattern.getHead();
		Doc headDoc = head.accept(this);
		PatternShape headShape = shapeOf(head);
		if (headShape == PatternShape.CONS || headShape == PatternShape.ALIAS) {
			headDoc = parenthesize(headDoc);
		}
		ElmPattern tail = elmConsPattern.getTail();
		Doc tailDoc = tail.accept(this);
		if (shapeOf(tail) == PatternShape.ALIAS) {
			tailDoc = parenthesize(tailDoc);
		}
		return concat(headDoc, text(" :: "), tailDoc);
	}

	@Override
	public Doc visit(ElmRecordPattern elmRecordPattern) {
		if (elmRecordPattern.getFields().isEmpty()) {
			return text("{}");
		}
		return text("{ " + String.join(", ", elmRecordPattern.getFields()) + " }");
	}

	@Override
	public Doc visit(ElmConstructorPattern elmConstructorPattern) {
		List<Doc> parts = new ArrayList<>();
		parts.add(text(qualified(elmConstructorPattern.getModuleQualifier(), elmConstructorPattern.getName())));
		for (ElmPattern argument : elmConstructorPattern.getArguments()) {
			parts.add(argument(argument));
		}
		return words(parts);
	}

	@Override
	public Doc visit(ElmAliasPattern elmAliasPattern) {
		return concat(argument(elmAliasPattern.getPattern()), text(" as " + elmAliasPattern.getName()));
	}

	@Override
	public Doc visit(ElmParenthesizedPattern elmParenthesizedPattern) {
		return parenthesize(elmParenthesizedPattern.getPattern().accept(this));
	}
}

package elmfmt.formatters;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import elmfmt.doc.Doc;
import elmfmt.fixity.Fixity;
import elmfmt.formatters.Parenthesization.Side;
import elmfmt.model.elm.*;

import static elmfmt.doc.DocBuilder.*;
import static elmfmt.formatters.FormattingTools.*;

public class ElmExpressionFormattingVisitor extends ElmExpressionVisitor<Doc, RuntimeException> {

	private final FormattingContext ctx;

	public ElmExpressionFormattingVisitor(FormattingContext ctx) {
		this.ctx = ctx;
	}

	private static ExpressionShape shapeOf(ElmExpression expression) {
		return expression.accept(new ElmExpressionShapeVisitor());
	}

	/**
	 * Formats {@code expression} so that it can stand as a function argument or record
	 * access target.
	 */
	Doc argument(ElmExpression expression) {
		Doc doc = expression.accept(this);
		if (shapeOf(expression) == ExpressionShape.ATOMIC) {
			return doc;
		}
		return parenthesize(doc);
	}

	private Doc node(ElmNode node) {
		return node.accept(new ElmNodeFormattingVisitor(ctx));
	}

	private Fixity resolve(String operator) {
		return ctx.getFixities().resolve(operator, ctx.getIssues());
	}

	/**
	 * @param trailing true when nothing follows the operation in its enclosing expression,
	 *                 so that an open-ended last operand needs no parentheses
	 */
	private Doc formatOperation(ElmBinaryOperation operation, boolean trailing) {
		List<Doc> operands = new ArrayList<>();
		List<String> operators = new ArrayList<>();
		collectChain(operation, resolve(operation.getOperator()), trailing, operands, operators);

		List<Doc> continuation = new ArrayList<>();
		for (int i = 0; i < operators.size(); i++) {
			continuation.add(concat(softline(), text(operators.get(i) + " "), operands.get(i + 1)));
		}
		return group(concat(operands.get(0), nest(INDENT, concat(continuation))));
	}

	/**
	 * Flattens a run of operators sharing one precedence level into operands and the
	 * operators between them.
	 */
	private void collectChain(ElmBinaryOperation operation, Fixity fixity, boolean trailing,
							  List<Doc> operands, List<String> operators) {
		ElmExpression lhs = operation.getLhs();
		Fixity lhsFixity = chainFixity(lhs, fixity, Side.LEFT);
		if (lhsFixity != null) {
			collectChain((ElmBinaryOperation) lhs, lhsFixity, false, operands, operators);
		} else {
			operands.add(operand(lhs, fixity, Side.LEFT, false));
		}

		operators.add(operation.getOperator());

		ElmExpression rhs = operation.getRhs();
		Fixity rhsFixity = chainFixity(rhs, fixity, Side.RIGHT);
		if (rhsFixity != null) {
			collectChain((ElmBinaryOperation) rhs, rhsFixity, trailing, operands, operators);
		} else {
			operands.add(operand(rhs, fixity, Side.RIGHT, trailing));
		}
	}

	/**
	 * @return the operand's fixity when it continues the parent's chain, null otherwise
	 */
	private Fixity chainFixity(ElmExpression operand, Fixity parent, Side side) {
		if (!(operand instanceof ElmBinaryOperation) || parent == null) {
			return null;
		}
		Fixity child = resolve(((ElmBinaryOperation) operand).getOperator());
		if (child == null || !Parenthesization.continuesChain(parent, child, side)) {
			return null;
		}
		return child;
	}

	private Doc operand(ElmExpression operand, Fixity parent, Side side, boolean trailing) {
		switch (shapeOf(operand)) {
			case OPERATOR:
				ElmBinaryOperation child = (ElmBinaryOperation) operand;
				if (Parenthesization.needsParentheses(parent, resolve(child.getOperator()), side)) {
					return parenthesize(formatOperation(child, true));
				}
				return formatOperation(child, trailing);
			case OPEN_ENDED:
				if (trailing) {
					return operand.accept(this);
				}
				return parenthesize(operand.accept(this));
			default:
				return operand.accept(this);
		}
	}

	@Override
	public Doc visit(ElmStringLiteral elmStringLiteral) {
		String delimiter = elmStringLiteral.getQuoting().getDelimiter();
		if (elmStringLiteral.getQuoting() == ElmStringLiteral.Quoting.SINGLE) {
			return text(delimiter + elmStringLiteral.getValue() + delimiter);
		}
		// the content lines keep their own leading whitespace
		String[] lines = elmStringLiteral.getValue().split("\n", -1);
		List<Doc> parts = new ArrayList<>();
		parts.add(text(delimiter + lines[0]));
		for (int i = 1; i < lines.length; i++) {
			parts.add(literalline());
			parts.add(text(lines[i]));
		}
		parts.add(text(delimiter));
		return concat(parts);
	}

	@Override
	public Doc visit(ElmCharLiteral elmCharLiteral) {
		return text("'" + elmCharLiteral.getValue() + "'");
	}

	@Override
	public Doc visit(ElmNumberLiteral elmNumberLiteral) {
		return text(elmNumberLiteral.getText());
	}

	@Override
	public Doc visit(ElmUnit elmUnit) {
		return text("()");
	}

	@Override
	public Doc visit(ElmVariable elmVariable) {
		return text(qualified(elmVariable.getModuleQualifier(), elmVariable.getName()));
	}

	@Override
	public Doc visit(ElmApplication elmApplication) {
		if (elmApplication.getArguments().isEmpty()) {
			return elmApplication.getFunction().accept(this);
		}
		List<Doc> arguments = new ArrayList<>();
		for (ElmExpression argument : elmApplication.getArguments()) {
			arguments.add(concat(softline(), argument(argument)));
		}
		return group(concat(argument(elmApplication.getFunction()), nest(INDENT, concat(arguments))));
	}

	@Override
	public Doc visit(ElmBinaryOperation elmBinaryOperation) {
		return formatOperation(elmBinaryOperation, true);
	}

	@Override
	public Doc visit(ElmNegation elmNegation) {
		return concat(text("-"), argument(elmNegation.getOperand()));
	}

	@Override
	public Doc visit(ElmPrefixOperator elmPrefixOperator) {
		return text("(" + elmPrefixOperator.getSymbol() + ")");
	}

	@Override
	public Doc visit(ElmTuple elmTuple) {
		return commaSequence("(", ")", elmTuple.getElements().stream()
				.map(e -> e.accept(this))
				.collect(Collectors.toList()));
	}

	@Override
	public Doc visit(ElmList elmList) {
		return commaSequence("[", "]", elmList.getElements().stream()
				.map(e -> e.accept(this))
				.collect(Collectors.toList()));
	}

	@Override
	public Doc visit(ElmRecord elmRecord) {
		return commaSequence("{", "}", elmRecord.getFields().stream()
				.map(this::node)
				.collect(Collectors.toList()));
	}

	@Override
	public Doc visit(ElmRecordUpdate elmRecordUpdate) {
		return extensionSequence(elmRecordUpdate.getRecord(), elmRecordUpdate.getFields().stream()
				.map(this::node)
				.collect(Collectors.toList()));
	}

	@Override
	public Doc visit(ElmRecordAccess elmRecordAccess) {
		return concat(argument(elmRecordAccess.getRecord()), text("." + elmRecordAccess.getField()));
	}

	@Override
	public Doc visit(ElmRecordAccessFunction elmRecordAccessFunction) {
		return text("." + elmRecordAccessFunction.getField());
	}

	@Override
	public Doc visit(ElmLambda elmLambda) {
		ElmPatternFormattingVisitor patterns = new ElmPatternFormattingVisitor(ctx);
		Doc arguments = words(elmLambda.getArguments().stream()
				.map(patterns::argument)
				.collect(Collectors.toList()));
		return hangingBody(concat(text("\\"), arguments, text(" ->")), elmLambda.getBody().accept(this));
	}

	@Override
	public Doc visit(ElmLet elmLet) {
		ElmDeclarationFormattingVisitor declarations = new ElmDeclarationFormattingVisitor(ctx);
		Doc bindings = join(blankLine(), elmLet.getDeclarations().stream()
				.map(d -> d.accept(declarations))
				.collect(Collectors.toList()));
		return concat(
				indentedBlock(text("let"), bindings),
				hardline(),
				text("in"),
				hardline(),
				elmLet.getBody().accept(this));
	}

	@Override
	public Doc visit(ElmCase elmCase) {
		Doc head = group(concat(
				text("case"),
				nest(INDENT, concat(softline(), elmCase.getSubject().accept(this))),
				softline(),
				text("of")));
		Doc branches = join(blankLine(), elmCase.getBranches().stream()
				.map(this::node)
				.collect(Collectors.toList()));
		return indentedBlock(head, branches);
	}

	@Override
	public Doc visit(ElmIf elmIf) {
		List<Doc> parts = new ArrayList<>();
		for (ElmIfBranch branch : elmIf.getBranches()) {
			Doc part = node(branch);
			parts.add(parts.isEmpty() ? part : concat(text("else "), part));
		}
		parts.add(indentedBlock(text("else"), elmIf.getOtherwise().accept(this)));
		return join(blankLine(), parts);
	}

	@Override
	public Doc visit(ElmParenthesized elmParenthesized) {
		return parenthesize(elmParenthesized.getExpression().accept(this));
	}

	@Override
	public Doc visit(ElmGlsl elmGlsl) {
		String[] lines = elmGlsl.getCode().split("\n", -1);
		List<Doc> parts = new ArrayList<>();
		parts.add(text("[glsl|" + lines[0]));
		for (int i = 1; i < lines.length; i++) {
			parts.add(literalline());
			parts.add(text(lines[i]));
		}
		parts.add(text("|]"));
		return concat(parts);
	}
}

package elmfmt.formatters;

import java.util.ArrayList;
import java.util.List;

import elmfmt.comment.CommentParser;
import elmfmt.doc.Doc;
import elmfmt.model.elm.*;

import static elmfmt.doc.DocBuilder.*;
import static elmfmt.formatters.FormattingTools.*;

public class ElmDeclarationFormattingVisitor extends ElmDeclarationVisitor<Doc, RuntimeException> {

	private final FormattingContext ctx;

	public ElmDeclarationFormattingVisitor(FormattingContext ctx) {
		this.ctx = ctx;
	}

	private Doc withDocComment(ElmDocComment docComment, String owner, Doc declaration) {
		if (docComment == null) {
			return declaration;
		}
		return concat(DocCommentFormatting.format(docComment, owner, ctx), hardline(), declaration);
	}

	private static String nameWithVariables(String name, List<String> typeVariables) {
		if (typeVariables.isEmpty()) {
			return name;
		}
		return name + " " + String.join(" ", typeVariables);
	}

	@Override
	public Doc visit(ElmFunctionDeclaration elmFunctionDeclaration) {
		ElmPatternFormattingVisitor patterns = new ElmPatternFormattingVisitor(ctx);
		List<Doc> head = new ArrayList<>();
		head.add(text(elmFunctionDeclaration.getName()));
		for (ElmPattern argument : elmFunctionDeclaration.getArguments()) {
			head.add(patterns.argument(argument));
		}
		Doc definition = hangingBody(
				concat(words(head), text(" =")),
				elmFunctionDeclaration.getBody().accept(new ElmExpressionFormattingVisitor(ctx)));
		if (elmFunctionDeclaration.getSignature() != null) {
			definition = concat(
					elmFunctionDeclaration.getSignature().accept(new ElmNodeFormattingVisitor(ctx)),
					hardline(),
					definition);
		}
		return withDocComment(elmFunctionDeclaration.getDocComment(), elmFunctionDeclaration.getName(), definition);
	}

	@Override
	public Doc visit(ElmTypeAlias elmTypeAlias) {
		Doc alias = indentedBlock(
				text("type alias " + nameWithVariables(elmTypeAlias.getName(), elmTypeAlias.getTypeVariables()) + " ="),
				elmTypeAlias.getType().accept(new ElmTypeFormattingVisitor(ctx)));
		return withDocComment(elmTypeAlias.getDocComment(), elmTypeAlias.getName(), alias);
	}

	@Override
	public Doc visit(ElmCustomType elmCustomType) {
		ElmNodeFormattingVisitor nodes = new ElmNodeFormattingVisitor(ctx);
		List<Doc> constructors = new ArrayList<>();
		for (ElmValueConstructor constructor : elmCustomType.getConstructors()) {
			String marker = constructors.isEmpty() ? "= " : "| ";
			constructors.add(concat(text(marker), constructor.accept(nodes)));
		}
		Doc type = indentedBlock(
				text("type " + nameWithVariables(elmCustomType.getName(), elmCustomType.getTypeVariables())),
				lines(constructors));
		return withDocComment(elmCustomType.getDocComment(), elmCustomType.getName(), type);
	}

	@Override
	public Doc visit(ElmPortDeclaration elmPortDeclaration) {
		Doc port = hangingBody(
				text("port " + elmPortDeclaration.getName() + " :"),
				elmPortDeclaration.getType().accept(new ElmTypeFormattingVisitor(ctx)));
		return withDocComment(elmPortDeclaration.getDocComment(), elmPortDeclaration.getName(), port);
	}

	@Override
	public Doc visit(ElmInfixDeclaration elmInfixDeclaration) {
		return text("infix " + elmInfixDeclaration.getAssociativity().getKeyword()
				+ " " + elmInfixDeclaration.getPrecedence()
				+ " (" + elmInfixDeclaration.getOperator() + ")"
				+ " = " + elmInfixDeclaration.getFunction());
	}

	@Override
	public Doc visit(ElmDestructuring elmDestructuring) {
		return hangingBody(
				concat(elmDestructuring.getPattern().accept(new ElmPatternFormattingVisitor(ctx)), text(" =")),
				elmDestructuring.getBody().accept(new ElmExpressionFormattingVisitor(ctx)));
	}

	@Override
	public Doc visit(ElmTopLevelComment elmTopLevelComment) {
		List<Doc> lines = new ArrayList<>();
		for (String line : elmTopLevelComment.getLines()) {
			lines.add(text("--" + CommentParser.stripTrailing(line)));
		}
		return lines(lines);
	}
}

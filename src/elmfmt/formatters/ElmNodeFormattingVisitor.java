package elmfmt.formatters;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

import elmfmt.comment.Comment;
import elmfmt.comment.CommentParser;
import elmfmt.comment.CommentReflow;
import elmfmt.comment.ReflowedComment;
import elmfmt.doc.Doc;
import elmfmt.errors.IssueContext;
import elmfmt.errors.WhileFormattingDeclaration;
import elmfmt.errors.WhileReadingDocComment;
import elmfmt.exports.DocTagExportOrderer;
import elmfmt.exports.ExportOrderer;
import elmfmt.model.elm.*;

import static elmfmt.doc.DocBuilder.*;
import static elmfmt.formatters.FormattingTools.*;

/**
 * Entry point for formatting any syntax tree node. Visiting an {@link ElmModule}
 * lays out a whole file:
 * <ol>
 *   <li>the module doc comment is parsed and re-flowed, collecting its doc tags</li>
 *   <li>the header's exposing list is reordered from those tags</li>
 *   <li>header, doc comment, imports and declarations are stacked with the blank lines
 *       between sections</li>
 * </ol>
 */
public class ElmNodeFormattingVisitor extends ElmNodeVisitor<Doc, RuntimeException> {

	private static final Logger logger = Logger.getLogger("Elm Formatter");

	private final FormattingContext ctx;
	private final ExportOrderer orderer;

	public ElmNodeFormattingVisitor(FormattingContext ctx) {
		this(ctx, new DocTagExportOrderer());
	}

	public ElmNodeFormattingVisitor(FormattingContext ctx, ExportOrderer orderer) {
		this.ctx = ctx;
		this.orderer = orderer;
	}

	@Override
	public Doc visit(ElmModule elmModule) {
		IssueContext moduleComment = ctx.getIssues().withContext(new WhileReadingDocComment(null));

		Doc docComment = null;
		List<List<String>> tagGroups = Collections.emptyList();
		if (elmModule.getDocComment() != null) {
			Comment comment = CommentParser.parse(elmModule.getDocComment().getText(), moduleComment);
			ReflowedComment reflowed = CommentReflow.reflowFileComment(
					comment, DocCommentFormatting.commentWidth(ctx.getWidth()));
			tagGroups = reflowed.getTagGroups();
			docComment = DocCommentFormatting.layout(DocCommentFormatting.splitLines(reflowed.getText()));
			logger.fine("module doc comment has " + tagGroups.size() + " doc tag group(s)");
		}

		ElmModuleHeader header = elmModule.getHeader();
		ElmExposing exposing = header.getExposing().accept(
				new ExposingOrderingVisitor(orderer, tagGroups, moduleComment));

		List<Doc> sections = new ArrayList<>();
		sections.add(header.accept(new ElmModuleHeaderFormattingVisitor(exposing)));
		if (docComment != null) {
			sections.add(docComment);
		}
		if (!elmModule.getImports().isEmpty()) {
			List<Doc> imports = new ArrayList<>();
			for (ElmImport elmImport : elmModule.getImports()) {
				imports.add(elmImport.accept(this));
			}
			sections.add(lines(imports));
		}
		Doc result = join(blankLine(), sections);

		if (!elmModule.getDeclarations().isEmpty()) {
			Doc separator = concat(hardline(), hardline(), hardline());
			List<Doc> declarations = new ArrayList<>();
			for (ElmDeclaration declaration : elmModule.getDeclarations()) {
				declarations.add(declaration.accept(this));
			}
			result = concat(result, separator, join(separator, declarations));
		}
		return result;
	}

	@Override
	public Doc visit(ElmModuleHeader elmModuleHeader) {
		return elmModuleHeader.accept(new ElmModuleHeaderFormattingVisitor(elmModuleHeader.getExposing()));
	}

	@Override
	public Doc visit(ElmImport elmImport) {
		String head = "import " + elmImport.getModuleName();
		if (elmImport.getAlias() != null) {
			head += " as " + elmImport.getAlias();
		}
		if (elmImport.getExposing() == null) {
			return text(head);
		}
		return elmImport.getExposing().accept(new ElmExposingFormattingVisitor(head));
	}

	@Override
	public Doc visit(ElmExposing elmExposing) {
		return elmExposing.accept(new ElmExposingFormattingVisitor(""));
	}

	@Override
	public Doc visit(ElmExposedItem elmExposedItem) {
		return elmExposedItem.accept(new ElmExposedItemFormattingVisitor());
	}

	@Override
	public Doc visit(ElmDeclaration elmDeclaration) {
		String name = elmDeclaration.accept(new ElmDeclarationNameVisitor());
		FormattingContext declarationCtx = name == null ? ctx : ctx.withContext(new WhileFormattingDeclaration(name));
		return elmDeclaration.accept(new ElmDeclarationFormattingVisitor(declarationCtx));
	}

	@Override
	public Doc visit(ElmPattern elmPattern) {
		return elmPattern.accept(new ElmPatternFormattingVisitor(ctx));
	}

	@Override
	public Doc visit(ElmExpression elmExpression) {
		return elmExpression.accept(new ElmExpressionFormattingVisitor(ctx));
	}

	@Override
	public Doc visit(ElmType elmType) {
		return elmType.accept(new ElmTypeFormattingVisitor(ctx));
	}

	@Override
	public Doc visit(ElmEffectManagerField elmEffectManagerField) {
		return text(elmEffectManagerField.getKind() + " = " + elmEffectManagerField.getTypeName());
	}

	@Override
	public Doc visit(ElmTypeSignature elmTypeSignature) {
		return hangingBody(
				text(elmTypeSignature.getName() + " :"),
				elmTypeSignature.getType().accept(new ElmTypeFormattingVisitor(ctx)));
	}

	@Override
	public Doc visit(ElmDocComment elmDocComment) {
		return DocCommentFormatting.format(elmDocComment, null, ctx);
	}

	@Override
	public Doc visit(ElmValueConstructor elmValueConstructor) {
		return new ElmTypeFormattingVisitor(ctx).application(
				elmValueConstructor.getName(), elmValueConstructor.getArguments());
	}

	@Override
	public Doc visit(ElmRecordField elmRecordField) {
		return hangingBody(
				text(elmRecordField.getName() + " ="),
				elmRecordField.getValue().accept(new ElmExpressionFormattingVisitor(ctx)));
	}

	@Override
	public Doc visit(ElmRecordFieldType elmRecordFieldType) {
		return hangingBody(
				text(elmRecordFieldType.getName() + " :"),
				elmRecordFieldType.getType().accept(new ElmTypeFormattingVisitor(ctx)));
	}

	@Override
	public Doc visit(ElmCaseBranch elmCaseBranch) {
		return indentedBlock(
				concat(elmCaseBranch.getPattern().accept(new ElmPatternFormattingVisitor(ctx)), text(" ->")),
				elmCaseBranch.getBody().accept(new ElmExpressionFormattingVisitor(ctx)));
	}

	@Override
	public Doc visit(ElmIfBranch elmIfBranch) {
		Doc head = group(concat(
				text("if"),
				nest(INDENT, concat(softline(), elmIfBranch.getCondition().accept(new ElmExpressionFormattingVisitor(ctx)))),
				softline(),
				text("then")));
		return indentedBlock(head, elmIfBranch.getBody().accept(new ElmExpressionFormattingVisitor(ctx)));
	}
}

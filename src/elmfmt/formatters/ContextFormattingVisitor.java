package elmfmt.formatters;

import elmfmt.doc.Doc;
import elmfmt.errors.ContextVisitor;
import elmfmt.errors.WhileFormattingDeclaration;
import elmfmt.errors.WhileReadingDocComment;

import static elmfmt.doc.DocBuilder.*;

public class ContextFormattingVisitor extends ContextVisitor<Doc, RuntimeException> {

	@Override
	public Doc visit(WhileFormattingDeclaration whileFormattingDeclaration) {
		return text("while formatting declaration " + whileFormattingDeclaration.getName() + ":");
	}

	@Override
	public Doc visit(WhileReadingDocComment whileReadingDocComment) {
		if (whileReadingDocComment.isModuleComment()) {
			return text("while reading the module doc comment:");
		}
		return text("while reading the doc comment of " + whileReadingDocComment.getOwner() + ":");
	}
}

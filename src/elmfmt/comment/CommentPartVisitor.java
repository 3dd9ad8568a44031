package elmfmt.comment;

public abstract class CommentPartVisitor<T, E extends Throwable> {
	public abstract T visit(MarkdownPart markdownPart) throws E;
	public abstract T visit(CodePart codePart) throws E;
	public abstract T visit(DocTagsPart docTagsPart) throws E;
}

package elmfmt.comment;

public abstract class CommentPart {

	public abstract <T, E extends Throwable> T accept(CommentPartVisitor<T, E> v) throws E;

}

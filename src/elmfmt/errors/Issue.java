package elmfmt.errors;

import elmfmt.doc.DocRenderer;
import elmfmt.formatters.IssueFormattingVisitor;

/**
 * 
 * A recoverable problem noticed while formatting. Issues never abort a
 * formatting pass; they are collected by an {@link IssueContext} and handed
 * back to the caller next to the formatted text.
 *
 */
public abstract class Issue {

	private static final int MESSAGE_WIDTH = 100;

	public String getMessage() {
		return new DocRenderer(MESSAGE_WIDTH).render(accept(new IssueFormattingVisitor()));
	}

	public Issue withContext(Context ctx) {
		return new IssueWithContext(this, ctx);
	}

	public abstract <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E;

	@Override
	public String toString() {
		return getMessage();
	}

}

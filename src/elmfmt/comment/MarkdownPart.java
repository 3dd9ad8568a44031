package elmfmt.comment;

import java.util.Objects;

/**
 * Prose, possibly several paragraphs separated by blank lines. Re-wrapped on output.
 */
public class MarkdownPart extends CommentPart {
	private final String text;

	public MarkdownPart(String text) {
		this.text = text;
	}

	public String getText() {
		return text;
	}

	@Override
	public <T, E extends Throwable> T accept(CommentPartVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(text);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		return text.equals(((MarkdownPart) obj).text);
	}

	@Override
	public String toString() {
		return "Markdown(" + text + ")";
	}
}

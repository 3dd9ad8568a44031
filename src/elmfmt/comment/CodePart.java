package elmfmt.comment;

import java.util.Objects;

/**
 * Example code, without its block indentation. Emitted line for line, never re-wrapped.
 */
public class CodePart extends CommentPart {
	private final String text;

	public CodePart(String text) {
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
		return text.equals(((CodePart) obj).text);
	}

	@Override
	public String toString() {
		return "Code(" + text + ")";
	}
}

package elmfmt.model.elm;

import elmfmt.util.SourceLocation;

import java.util.Objects;

/**
 * The raw body of a <code>{-| ... -}</code> comment.
 */
public class ElmDocComment extends ElmNode {

	private final String text;

	public ElmDocComment(SourceLocation location, String text) {
		super(location);
		this.text = text;
	}

	public String getText() {
		return text;
	}

	@Override
	public <T, E extends Throwable> T accept(ElmNodeVisitor<T, E> v) throws E {
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
		ElmDocComment other = (ElmDocComment) obj;
		return Objects.equals(text, other.text);
	}

}

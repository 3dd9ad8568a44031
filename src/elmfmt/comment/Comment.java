package elmfmt.comment;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 
 * The structured content of a doc comment: prose, example code and
 * {@code @doc} tag lines, in the order they were written.
 *
 */
public class Comment {
	private final List<CommentPart> parts;

	public Comment(List<CommentPart> parts) {
		this.parts = Collections.unmodifiableList(new ArrayList<>(parts));
	}

	public List<CommentPart> getParts() {
		return parts;
	}

	public boolean isEmpty() {
		return parts.isEmpty();
	}

	@Override
	public int hashCode() {
		return Objects.hash(parts);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		return parts.equals(((Comment) obj).parts);
	}

	@Override
	public String toString() {
		return "Comment" + parts;
	}
}

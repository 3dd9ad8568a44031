package elmfmt.comment;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One {@code @doc} line. The names keep the order they were written in.
 */
public class DocTagsPart extends CommentPart {
	private final List<String> names;

	public DocTagsPart(List<String> names) {
		this.names = Collections.unmodifiableList(new ArrayList<>(names));
	}

	public List<String> getNames() {
		return names;
	}

	@Override
	public <T, E extends Throwable> T accept(CommentPartVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(names);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		return names.equals(((DocTagsPart) obj).names);
	}

	@Override
	public String toString() {
		return "DocTags" + names;
	}
}

package elmfmt.model.elm;

import elmfmt.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * A free-standing comment between declarations, one entry per source line without the leading --.
 */
public class ElmTopLevelComment extends ElmDeclaration {

	private final List<String> lines;

	public ElmTopLevelComment(SourceLocation location, List<String> lines) {
		super(location);
		this.lines = lines;
	}

	public List<String> getLines() {
		return lines;
	}

	@Override
	public <T, E extends Throwable> T accept(ElmDeclarationVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(lines);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		ElmTopLevelComment other = (ElmTopLevelComment) obj;
		return Objects.equals(lines, other.lines);
	}

}

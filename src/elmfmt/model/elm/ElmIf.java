package elmfmt.model.elm;

import elmfmt.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * AST node: {@code if c1 then e1 else if c2 then e2 else e3}
 */
public class ElmIf extends ElmExpression {

	private final List<ElmIfBranch> branches;
	private final ElmExpression otherwise;

	public ElmIf(SourceLocation location, List<ElmIfBranch> branches, ElmExpression otherwise) {
		super(location);
		this.branches = branches;
		this.otherwise = otherwise;
	}

	public List<ElmIfBranch> getBranches() {
		return branches;
	}

	public ElmExpression getOtherwise() {
		return otherwise;
	}

	@Override
	public <T, E extends Throwable> T accept(ElmExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(branches, otherwise);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		ElmIf other = (ElmIf) obj;
		return Objects.equals(branches, other.branches) &&
				Objects.equals(otherwise, other.otherwise);
	}

}

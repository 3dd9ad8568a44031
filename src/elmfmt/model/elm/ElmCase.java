package elmfmt.model.elm;

import elmfmt.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * AST node: {@code case subject of branches}
 */
public class ElmCase extends ElmExpression {

	private final ElmExpression subject;
	private final List<ElmCaseBranch> branches;

	public ElmCase(SourceLocation location, ElmExpression subject, List<ElmCaseBranch> branches) {
		super(location);
		this.subject = subject;
		this.branches = branches;
	}

	public ElmExpression getSubject() {
		return subject;
	}

	public List<ElmCaseBranch> getBranches() {
		return branches;
	}

	@Override
	public <T, E extends Throwable> T accept(ElmExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(subject, branches);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		ElmCase other = (ElmCase) obj;
		return Objects.equals(subject, other.subject) &&
				Objects.equals(branches, other.branches);
	}

}

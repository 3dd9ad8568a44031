package elmfmt.model.elm;

import elmfmt.util.SourceLocation;

import java.util.Objects;

/**
 * AST node: {@code if condition then body}
 */
public class ElmIfBranch extends ElmNode {

	private final ElmExpression condition;
	private final ElmExpression body;

	public ElmIfBranch(SourceLocation location, ElmExpression condition, ElmExpression body) {
		super(location);
		this.condition = condition;
		this.body = body;
	}

	public ElmExpression getCondition() {
		return condition;
	}

	public ElmExpression getBody() {
		return body;
	}

	@Override
	public <T, E extends Throwable> T accept(ElmNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(condition, body);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		ElmIfBranch other = (ElmIfBranch) obj;
		return Objects.equals(condition, other.condition) &&
				Objects.equals(body, other.body);
	}

}

package elmfmt.model.elm;

import elmfmt.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * AST node: {@code let declarations in body}
 */
public class ElmLet extends ElmExpression {

	private final List<ElmDeclaration> declarations;
	private final ElmExpression body;

	public ElmLet(SourceLocation location, List<ElmDeclaration> declarations, ElmExpression body) {
		super(location);
		this.declarations = declarations;
		this.body = body;
	}

	public List<ElmDeclaration> getDeclarations() {
		return declarations;
	}

	public ElmExpression getBody() {
		return body;
	}

	@Override
	public <T, E extends Throwable> T accept(ElmExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(declarations, body);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		ElmLet other = (ElmLet) obj;
		return Objects.equals(declarations, other.declarations) &&
				Objects.equals(body, other.body);
	}

}

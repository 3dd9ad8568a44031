package elmfmt.model.elm;

import elmfmt.util.SourceLocation;

import java.util.Objects;

/**
 * AST node: {@code pattern = body}, as found in let blocks.
 */
public class ElmDestructuring extends ElmDeclaration {

	private final ElmPattern pattern;
	private final ElmExpression body;

	public ElmDestructuring(SourceLocation location, ElmPattern pattern, ElmExpression body) {
		super(location);
		this.pattern = pattern;
		this.body = body;
	}

	public ElmPattern getPattern() {
		return pattern;
	}

	public ElmExpression getBody() {
		return body;
	}

	@Override
	public <T, E extends Throwable> T accept(ElmDeclarationVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(pattern, body);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		ElmDestructuring other = (ElmDestructuring) obj;
		return Objects.equals(pattern, other.pattern) &&
				Objects.equals(body, other.body);
	}

}

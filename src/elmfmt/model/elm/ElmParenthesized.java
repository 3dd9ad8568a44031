package elmfmt.model.elm;

import elmfmt.util.SourceLocation;

import java.util.Objects;

/**
 * Parentheses written in the source. They are kept as written.
 */
public class ElmParenthesized extends ElmExpression {

	private final ElmExpression expression;

	public ElmParenthesized(SourceLocation location, ElmExpression expression) {
		super(location);
		this.expression = expression;
	}

	public ElmExpression getExpression() {
		return expression;
	}

	@Override
	public <T, E extends Throwable> T accept(ElmExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(expression);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		ElmParenthesized other = (ElmParenthesized) obj;
		return Objects.equals(expression, other.expression);
	}

}

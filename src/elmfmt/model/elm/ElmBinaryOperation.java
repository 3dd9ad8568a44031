package elmfmt.model.elm;

import elmfmt.util.SourceLocation;

import java.util.Objects;

/**
 * AST node: {@code lhs op rhs}
 */
public class ElmBinaryOperation extends ElmExpression {

	private final String operator;
	private final ElmExpression lhs;
	private final ElmExpression rhs;

	public ElmBinaryOperation(SourceLocation location, String operator, ElmExpression lhs, ElmExpression rhs) {
		super(location);
		this.operator = operator;
		this.lhs = lhs;
		this.rhs = rhs;
	}

	public String getOperator() {
		return operator;
	}

	public ElmExpression getLhs() {
		return lhs;
	}

	public ElmExpression getRhs() {
		return rhs;
	}

	@Override
	public <T, E extends Throwable> T accept(ElmExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(operator, lhs, rhs);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		ElmBinaryOperation other = (ElmBinaryOperation) obj;
		return Objects.equals(operator, other.operator) &&
				Objects.equals(lhs, other.lhs) &&
				Objects.equals(rhs, other.rhs);
	}

}

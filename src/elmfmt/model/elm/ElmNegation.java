package elmfmt.model.elm;

import elmfmt.util.SourceLocation;

import java.util.Objects;

/**
 * AST node: {@code -expression}
 */
public class ElmNegation extends ElmExpression {

	private final ElmExpression operand;

	public ElmNegation(SourceLocation location, ElmExpression operand) {
		super(location);
		this.operand = operand;
	}

	public ElmExpression getOperand() {
		return operand;
	}

	@Override
	public <T, E extends Throwable> T accept(ElmExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(operand);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		ElmNegation other = (ElmNegation) obj;
		return Objects.equals(operand, other.operand);
	}

}

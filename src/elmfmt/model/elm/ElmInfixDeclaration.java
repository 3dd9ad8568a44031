package elmfmt.model.elm;

import elmfmt.fixity.Associativity;
import elmfmt.fixity.Fixity;
import elmfmt.util.SourceLocation;

import java.util.Objects;

/**
 * AST node: {@code infix left 6 (+) = add}
 */
public class ElmInfixDeclaration extends ElmDeclaration {

	private final Associativity associativity;
	private final int precedence;
	private final String operator;
	private final String function;

	public ElmInfixDeclaration(SourceLocation location, Associativity associativity, int precedence, String operator, String function) {
		super(location);
		this.associativity = associativity;
		this.precedence = precedence;
		this.operator = operator;
		this.function = function;
	}

	public Associativity getAssociativity() {
		return associativity;
	}

	public int getPrecedence() {
		return precedence;
	}

	public String getOperator() {
		return operator;
	}

	public String getFunction() {
		return function;
	}

	public Fixity toFixity() {
		return new Fixity(operator, precedence, associativity);
	}

	@Override
	public <T, E extends Throwable> T accept(ElmDeclarationVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(associativity, precedence, operator, function);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		ElmInfixDeclaration other = (ElmInfixDeclaration) obj;
		return Objects.equals(associativity, other.associativity) &&
				precedence == other.precedence &&
				Objects.equals(operator, other.operator) &&
				Objects.equals(function, other.function);
	}

}

package elmfmt.model.elm;

import elmfmt.util.SourceLocation;

import java.util.Objects;

/**
 * An operator used as a function: (+).
 */
public class ElmPrefixOperator extends ElmExpression {

	private final String symbol;

	public ElmPrefixOperator(SourceLocation location, String symbol) {
		super(location);
		this.symbol = symbol;
	}

	public String getSymbol() {
		return symbol;
	}

	@Override
	public <T, E extends Throwable> T accept(ElmExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(symbol);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		ElmPrefixOperator other = (ElmPrefixOperator) obj;
		return Objects.equals(symbol, other.symbol);
	}

}

package elmfmt.model.elm;

import elmfmt.util.SourceLocation;

import java.util.Objects;

public class ElmExposedOperator extends ElmExposedItem {

	private final String symbol;

	public ElmExposedOperator(SourceLocation location, String symbol) {
		super(location);
		this.symbol = symbol;
	}

	public String getSymbol() {
		return symbol;
	}

	@Override
	public String getTagName() {
		return "(" + symbol + ")";
	}

	@Override
	public <T, E extends Throwable> T accept(ElmExposedItemVisitor<T, E> v) throws E {
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
		ElmExposedOperator other = (ElmExposedOperator) obj;
		return Objects.equals(symbol, other.symbol);
	}

}

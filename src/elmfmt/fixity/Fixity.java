package elmfmt.fixity;

import java.util.Objects;

/**
 * The precedence and associativity of one infix operator.
 */
public class Fixity {
	private final String symbol;
	private final int precedence;
	private final Associativity associativity;

	public Fixity(String symbol, int precedence, Associativity associativity) {
		this.symbol = symbol;
		this.precedence = precedence;
		this.associativity = associativity;
	}

	public String getSymbol() {
		return symbol;
	}

	public int getPrecedence() {
		return precedence;
	}

	public Associativity getAssociativity() {
		return associativity;
	}

	@Override
	public int hashCode() {
		return Objects.hash(symbol, precedence, associativity);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		Fixity other = (Fixity) obj;
		return precedence == other.precedence && associativity == other.associativity && symbol.equals(other.symbol);
	}

	@Override
	public String toString() {
		return "infix " + associativity.getKeyword() + " " + precedence + " (" + symbol + ")";
	}
}

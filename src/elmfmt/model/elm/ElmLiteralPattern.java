package elmfmt.model.elm;

import elmfmt.util.SourceLocation;

import java.util.Objects;

public class ElmLiteralPattern extends ElmPattern {

	private final ElmLiteral literal;

	public ElmLiteralPattern(SourceLocation location, ElmLiteral literal) {
		super(location);
		this.literal = literal;
	}

	public ElmLiteral getLiteral() {
		return literal;
	}

	@Override
	public <T, E extends Throwable> T accept(ElmPatternVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(literal);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		ElmLiteralPattern other = (ElmLiteralPattern) obj;
		return Objects.equals(literal, other.literal);
	}

}

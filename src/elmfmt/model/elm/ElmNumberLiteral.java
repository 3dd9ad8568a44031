package elmfmt.model.elm;

import elmfmt.util.SourceLocation;

import java.util.Objects;

/**
 * Numbers keep the exact text they were written with, so 0xFF stays 0xFF.
 */
public class ElmNumberLiteral extends ElmLiteral {

	public enum Base {
		DECIMAL,
		HEXADECIMAL,
		FLOAT,
	}

	private final String text;
	private final Base base;

	public ElmNumberLiteral(SourceLocation location, String text, Base base) {
		super(location);
		this.text = text;
		this.base = base;
	}

	public String getText() {
		return text;
	}

	public Base getBase() {
		return base;
	}

	@Override
	public <T, E extends Throwable> T accept(ElmExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(text, base);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		ElmNumberLiteral other = (ElmNumberLiteral) obj;
		return Objects.equals(text, other.text) &&
				Objects.equals(base, other.base);
	}

}

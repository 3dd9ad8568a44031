package elmfmt.model.elm;

import elmfmt.util.SourceLocation;

import java.util.Objects;

/**
 * The raw text between the single quotes.
 */
public class ElmCharLiteral extends ElmLiteral {

	private final String value;

	public ElmCharLiteral(SourceLocation location, String value) {
		super(location);
		this.value = value;
	}

	public String getValue() {
		return value;
	}

	@Override
	public <T, E extends Throwable> T accept(ElmExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(value);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		ElmCharLiteral other = (ElmCharLiteral) obj;
		return Objects.equals(value, other.value);
	}

}

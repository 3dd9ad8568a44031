package elmfmt.model.elm;

import elmfmt.util.SourceLocation;

import java.util.Objects;

/**
 * AST node: {@code .field}
 */
public class ElmRecordAccessFunction extends ElmExpression {

	private final String field;

	public ElmRecordAccessFunction(SourceLocation location, String field) {
		super(location);
		this.field = field;
	}

	public String getField() {
		return field;
	}

	@Override
	public <T, E extends Throwable> T accept(ElmExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(field);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		ElmRecordAccessFunction other = (ElmRecordAccessFunction) obj;
		return Objects.equals(field, other.field);
	}

}

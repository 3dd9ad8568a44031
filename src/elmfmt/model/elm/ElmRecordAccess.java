package elmfmt.model.elm;

import elmfmt.util.SourceLocation;

import java.util.Objects;

/**
 * AST node: {@code expression.field}
 */
public class ElmRecordAccess extends ElmExpression {

	private final ElmExpression record;
	private final String field;

	public ElmRecordAccess(SourceLocation location, ElmExpression record, String field) {
		super(location);
		this.record = record;
		this.field = field;
	}

	public ElmExpression getRecord() {
		return record;
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
		return Objects.hash(record, field);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		ElmRecordAccess other = (ElmRecordAccess) obj;
		return Objects.equals(record, other.record) &&
				Objects.equals(field, other.field);
	}

}

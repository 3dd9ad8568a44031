package elmfmt.model.elm;

import elmfmt.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * AST node: {@code { a = 1, b = 2 }}
 */
public class ElmRecord extends ElmExpression {

	private final List<ElmRecordField> fields;

	public ElmRecord(SourceLocation location, List<ElmRecordField> fields) {
		super(location);
		this.fields = fields;
	}

	public List<ElmRecordField> getFields() {
		return fields;
	}

	@Override
	public <T, E extends Throwable> T accept(ElmExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(fields);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		ElmRecord other = (ElmRecord) obj;
		return Objects.equals(fields, other.fields);
	}

}

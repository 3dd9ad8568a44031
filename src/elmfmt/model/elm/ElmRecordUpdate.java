package elmfmt.model.elm;

import elmfmt.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * AST node: {@code { record | a = 1 }}
 */
public class ElmRecordUpdate extends ElmExpression {

	private final String record;
	private final List<ElmRecordField> fields;

	public ElmRecordUpdate(SourceLocation location, String record, List<ElmRecordField> fields) {
		super(location);
		this.record = record;
		this.fields = fields;
	}

	public String getRecord() {
		return record;
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
		return Objects.hash(record, fields);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		ElmRecordUpdate other = (ElmRecordUpdate) obj;
		return Objects.equals(record, other.record) &&
				Objects.equals(fields, other.fields);
	}

}

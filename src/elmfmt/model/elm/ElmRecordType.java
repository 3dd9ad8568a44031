package elmfmt.model.elm;

import elmfmt.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * AST node: {@code { r | a : Int }}, where the extended variable may be null.
 */
public class ElmRecordType extends ElmType {

	private final String extendedVariable;
	private final List<ElmRecordFieldType> fields;

	public ElmRecordType(SourceLocation location, String extendedVariable, List<ElmRecordFieldType> fields) {
		super(location);
		this.extendedVariable = extendedVariable;
		this.fields = fields;
	}

	public String getExtendedVariable() {
		return extendedVariable;
	}

	public List<ElmRecordFieldType> getFields() {
		return fields;
	}

	@Override
	public <T, E extends Throwable> T accept(ElmTypeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(extendedVariable, fields);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		ElmRecordType other = (ElmRecordType) obj;
		return Objects.equals(extendedVariable, other.extendedVariable) &&
				Objects.equals(fields, other.fields);
	}

}

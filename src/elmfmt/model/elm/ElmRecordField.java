package elmfmt.model.elm;

import elmfmt.util.SourceLocation;

import java.util.Objects;

/**
 * AST node: {@code name = value}
 */
public class ElmRecordField extends ElmNode {

	private final String name;
	private final ElmExpression value;

	public ElmRecordField(SourceLocation location, String name, ElmExpression value) {
		super(location);
		this.name = name;
		this.value = value;
	}

	public String getName() {
		return name;
	}

	public ElmExpression getValue() {
		return value;
	}

	@Override
	public <T, E extends Throwable> T accept(ElmNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, value);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		ElmRecordField other = (ElmRecordField) obj;
		return Objects.equals(name, other.name) &&
				Objects.equals(value, other.value);
	}

}

package elmfmt.model.elm;

import elmfmt.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * AST node: {@code { a, b }}
 */
public class ElmRecordPattern extends ElmPattern {

	private final List<String> fields;

	public ElmRecordPattern(SourceLocation location, List<String> fields) {
		super(location);
		this.fields = fields;
	}

	public List<String> getFields() {
		return fields;
	}

	@Override
	public <T, E extends Throwable> T accept(ElmPatternVisitor<T, E> v) throws E {
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
		ElmRecordPattern other = (ElmRecordPattern) obj;
		return Objects.equals(fields, other.fields);
	}

}

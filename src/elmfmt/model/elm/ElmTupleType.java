package elmfmt.model.elm;

import elmfmt.util.SourceLocation;

import java.util.List;
import java.util.Objects;

public class ElmTupleType extends ElmType {

	private final List<ElmType> elements;

	public ElmTupleType(SourceLocation location, List<ElmType> elements) {
		super(location);
		this.elements = elements;
	}

	public List<ElmType> getElements() {
		return elements;
	}

	@Override
	public <T, E extends Throwable> T accept(ElmTypeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(elements);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		ElmTupleType other = (ElmTupleType) obj;
		return Objects.equals(elements, other.elements);
	}

}

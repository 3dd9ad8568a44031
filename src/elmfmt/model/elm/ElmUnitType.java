package elmfmt.model.elm;

import elmfmt.util.SourceLocation;

public class ElmUnitType extends ElmType {
	public ElmUnitType(SourceLocation location) {
		super(location);
	}

	@Override
	public <T, E extends Throwable> T accept(ElmTypeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return ElmUnitType.class.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		return true;
	}

}

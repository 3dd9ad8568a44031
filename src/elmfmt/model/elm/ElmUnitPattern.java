package elmfmt.model.elm;

import elmfmt.util.SourceLocation;

public class ElmUnitPattern extends ElmPattern {
	public ElmUnitPattern(SourceLocation location) {
		super(location);
	}

	@Override
	public <T, E extends Throwable> T accept(ElmPatternVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return ElmUnitPattern.class.hashCode();
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

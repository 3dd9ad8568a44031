package elmfmt.model.elm;

import elmfmt.util.SourceLocation;

/**
 * AST node: {@code exposing (..)}
 */
public class ElmExposingAll extends ElmExposing {
	public ElmExposingAll(SourceLocation location) {
		super(location);
	}

	@Override
	public <T, E extends Throwable> T accept(ElmExposingVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return ElmExposingAll.class.hashCode();
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

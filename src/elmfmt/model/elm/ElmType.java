package elmfmt.model.elm;

import elmfmt.util.SourceLocation;

/**
 * A type expression, as found in signatures, aliases, constructors and ports.
 */
public abstract class ElmType extends ElmNode {

	public ElmType(SourceLocation location) {
		super(location);
	}

	@Override
	public <T, E extends Throwable> T accept(ElmNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	public abstract <T, E extends Throwable> T accept(ElmTypeVisitor<T, E> v) throws E;

}

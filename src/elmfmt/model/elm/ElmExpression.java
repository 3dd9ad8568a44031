package elmfmt.model.elm;

import elmfmt.util.SourceLocation;

/**
 * Base Elm expression representation
 *
 */
public abstract class ElmExpression extends ElmNode {

	public ElmExpression(SourceLocation location) {
		super(location);
	}

	@Override
	public <T, E extends Throwable> T accept(ElmNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	public abstract <T, E extends Throwable> T accept(ElmExpressionVisitor<T, E> v) throws E;

}

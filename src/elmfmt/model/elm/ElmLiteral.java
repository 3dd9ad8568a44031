package elmfmt.model.elm;

import elmfmt.util.SourceLocation;

/**
 * Literal values, shared by expressions and patterns.
 */
public abstract class ElmLiteral extends ElmExpression {

	public ElmLiteral(SourceLocation location) {
		super(location);
	}

}

package elmfmt.model.elm;

import elmfmt.util.SourceLocation;

public abstract class ElmExposing extends ElmNode {

	public ElmExposing(SourceLocation location) {
		super(location);
	}

	@Override
	public <T, E extends Throwable> T accept(ElmNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	public abstract <T, E extends Throwable> T accept(ElmExposingVisitor<T, E> v) throws E;

}

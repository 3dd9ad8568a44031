package elmfmt.model.elm;

import elmfmt.util.SourceLocation;

public abstract class ElmModuleHeader extends ElmNode {

	public ElmModuleHeader(SourceLocation location) {
		super(location);
	}

	public abstract String getName();

	public abstract ElmExposing getExposing();

	@Override
	public <T, E extends Throwable> T accept(ElmNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	public abstract <T, E extends Throwable> T accept(ElmModuleHeaderVisitor<T, E> v) throws E;

}

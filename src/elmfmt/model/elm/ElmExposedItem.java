package elmfmt.model.elm;

import elmfmt.util.SourceLocation;

public abstract class ElmExposedItem extends ElmNode {

	public ElmExposedItem(SourceLocation location) {
		super(location);
	}

	/**
	 * @return the name a doc tag refers to this item by
	 */
	public abstract String getTagName();

	@Override
	public <T, E extends Throwable> T accept(ElmNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	public abstract <T, E extends Throwable> T accept(ElmExposedItemVisitor<T, E> v) throws E;

}

package elmfmt.model.elm;

import elmfmt.util.SourceLocatable;
import elmfmt.util.SourceLocation;

/**
 * 
 * The base class for every node of a parsed Elm file. Nodes are immutable and
 * carry the location the parser found them at; the formatter lays out only
 * their structure.
 *
 */
public abstract class ElmNode extends SourceLocatable {
	private final SourceLocation location;

	public ElmNode(SourceLocation location) {
		this.location = location;
	}

	@Override
	public SourceLocation getLocation() {
		return location;
	}

	@Override
	public abstract int hashCode();

	@Override
	public abstract boolean equals(Object obj);

	public abstract <T, E extends Throwable> T accept(ElmNodeVisitor<T, E> v) throws E;

}

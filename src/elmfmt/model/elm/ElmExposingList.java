package elmfmt.model.elm;

import elmfmt.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * AST node: {@code exposing (a, B, C(..))}
 */
public class ElmExposingList extends ElmExposing {

	private final List<ElmExposedItem> items;

	public ElmExposingList(SourceLocation location, List<ElmExposedItem> items) {
		super(location);
		this.items = items;
	}

	public List<ElmExposedItem> getItems() {
		return items;
	}

	@Override
	public <T, E extends Throwable> T accept(ElmExposingVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(items);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		ElmExposingList other = (ElmExposingList) obj;
		return Objects.equals(items, other.items);
	}

}

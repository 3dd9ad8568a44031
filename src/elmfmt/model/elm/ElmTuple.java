package elmfmt.model.elm;

import elmfmt.util.SourceLocation;

import java.util.List;
import java.util.Objects;

public class ElmTuple extends ElmExpression {

	private final List<ElmExpression> elements;

	public ElmTuple(SourceLocation location, List<ElmExpression> elements) {
		super(location);
		this.elements = elements;
	}

	public List<ElmExpression> getElements() {
		return elements;
	}

	@Override
	public <T, E extends Throwable> T accept(ElmExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(elements);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		ElmTuple other = (ElmTuple) obj;
		return Objects.equals(elements, other.elements);
	}

}

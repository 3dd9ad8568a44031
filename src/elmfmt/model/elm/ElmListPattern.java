package elmfmt.model.elm;

import elmfmt.util.SourceLocation;

import java.util.List;
import java.util.Objects;

public class ElmListPattern extends ElmPattern {

	private final List<ElmPattern> elements;

	public ElmListPattern(SourceLocation location, List<ElmPattern> elements) {
		super(location);
		this.elements = elements;
	}

	public List<ElmPattern> getElements() {
		return elements;
	}

	@Override
	public <T, E extends Throwable> T accept(ElmPatternVisitor<T, E> v) throws E {
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
		ElmListPattern other = (ElmListPattern) obj;
		return Objects.equals(elements, other.elements);
	}

}

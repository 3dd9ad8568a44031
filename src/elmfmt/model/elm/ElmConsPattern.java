package elmfmt.model.elm;

import elmfmt.util.SourceLocation;

import java.util.Objects;

/**
 * AST node: {@code head :: tail}
 */
public class ElmConsPattern extends ElmPattern {

	private final ElmPattern head;
	private final ElmPattern tail;

	public ElmConsPattern(SourceLocation location, ElmPattern head, ElmPattern tail) {
		super(location);
		this.head = head;
		this.tail = tail;
	}

	public ElmPattern getHead() {
		return head;
	}

	public ElmPattern getTail() {
		return tail;
	}

	@Override
	public <T, E extends Throwable> T accept(ElmPatternVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(head, tail);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		ElmConsPattern other = (ElmConsPattern) obj;
		return Objects.equals(head, other.head) &&
				Objects.equals(tail, other.tail);
	}

}

package elmfmt.model.elm;

import elmfmt.util.SourceLocation;

import java.util.Objects;

/**
 * AST node: {@code from -> to}
 */
public class ElmFunctionType extends ElmType {

	private final ElmType from;
	private final ElmType to;

	public ElmFunctionType(SourceLocation location, ElmType from, ElmType to) {
		super(location);
		this.from = from;
		this.to = to;
	}

	public ElmType getFrom() {
		return from;
	}

	public ElmType getTo() {
		return to;
	}

	@Override
	public <T, E extends Throwable> T accept(ElmTypeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(from, to);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		ElmFunctionType other = (ElmFunctionType) obj;
		return Objects.equals(from, other.from) &&
				Objects.equals(to, other.to);
	}

}

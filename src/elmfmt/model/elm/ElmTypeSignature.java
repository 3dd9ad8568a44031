package elmfmt.model.elm;

import elmfmt.util.SourceLocation;

import java.util.Objects;

/**
 * AST node: {@code name : type}
 */
public class ElmTypeSignature extends ElmNode {

	private final String name;
	private final ElmType type;

	public ElmTypeSignature(SourceLocation location, String name, ElmType type) {
		super(location);
		this.name = name;
		this.type = type;
	}

	public String getName() {
		return name;
	}

	public ElmType getType() {
		return type;
	}

	@Override
	public <T, E extends Throwable> T accept(ElmNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, type);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		ElmTypeSignature other = (ElmTypeSignature) obj;
		return Objects.equals(name, other.name) &&
				Objects.equals(type, other.type);
	}

}

package elmfmt.model.elm;

import elmfmt.util.SourceLocation;

import java.util.Objects;

/**
 * AST node: {@code command = MyCmd}, in an effect module header.
 */
public class ElmEffectManagerField extends ElmNode {

	private final String kind;
	private final String typeName;

	public ElmEffectManagerField(SourceLocation location, String kind, String typeName) {
		super(location);
		this.kind = kind;
		this.typeName = typeName;
	}

	public String getKind() {
		return kind;
	}

	public String getTypeName() {
		return typeName;
	}

	@Override
	public <T, E extends Throwable> T accept(ElmNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(kind, typeName);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		ElmEffectManagerField other = (ElmEffectManagerField) obj;
		return Objects.equals(kind, other.kind) &&
				Objects.equals(typeName, other.typeName);
	}

}

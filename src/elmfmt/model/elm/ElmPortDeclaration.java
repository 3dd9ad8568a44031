package elmfmt.model.elm;

import elmfmt.util.SourceLocation;

import java.util.Objects;

/**
 * AST node: {@code port name : type}
 */
public class ElmPortDeclaration extends ElmDeclaration {

	private final ElmDocComment docComment;
	private final String name;
	private final ElmType type;

	public ElmPortDeclaration(SourceLocation location, ElmDocComment docComment, String name, ElmType type) {
		super(location);
		this.docComment = docComment;
		this.name = name;
		this.type = type;
	}

	public ElmDocComment getDocComment() {
		return docComment;
	}

	public String getName() {
		return name;
	}

	public ElmType getType() {
		return type;
	}

	@Override
	public <T, E extends Throwable> T accept(ElmDeclarationVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(docComment, name, type);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		ElmPortDeclaration other = (ElmPortDeclaration) obj;
		return Objects.equals(docComment, other.docComment) &&
				Objects.equals(name, other.name) &&
				Objects.equals(type, other.type);
	}

}

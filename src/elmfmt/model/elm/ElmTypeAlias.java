package elmfmt.model.elm;

import elmfmt.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * AST node: {@code type alias Name a b = type}
 */
public class ElmTypeAlias extends ElmDeclaration {

	private final ElmDocComment docComment;
	private final String name;
	private final List<String> typeVariables;
	private final ElmType type;

	public ElmTypeAlias(SourceLocation location, ElmDocComment docComment, String name, List<String> typeVariables, ElmType type) {
		super(location);
		this.docComment = docComment;
		this.name = name;
		this.typeVariables = typeVariables;
		this.type = type;
	}

	public ElmDocComment getDocComment() {
		return docComment;
	}

	public String getName() {
		return name;
	}

	public List<String> getTypeVariables() {
		return typeVariables;
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
		return Objects.hash(docComment, name, typeVariables, type);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		ElmTypeAlias other = (ElmTypeAlias) obj;
		return Objects.equals(docComment, other.docComment) &&
				Objects.equals(name, other.name) &&
				Objects.equals(typeVariables, other.typeVariables) &&
				Objects.equals(type, other.type);
	}

}

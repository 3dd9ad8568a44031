package elmfmt.model.elm;

import elmfmt.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * AST node: {@code type Name a = A a | B}
 */
public class ElmCustomType extends ElmDeclaration {

	private final ElmDocComment docComment;
	private final String name;
	private final List<String> typeVariables;
	private final List<ElmValueConstructor> constructors;

	public ElmCustomType(SourceLocation location, ElmDocComment docComment, String name, List<String> typeVariables, List<ElmValueConstructor> constructors) {
		super(location);
		this.docComment = docComment;
		this.name = name;
		this.typeVariables = typeVariables;
		this.constructors = constructors;
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

	public List<ElmValueConstructor> getConstructors() {
		return constructors;
	}

	@Override
	public <T, E extends Throwable> T accept(ElmDeclarationVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(docComment, name, typeVariables, constructors);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		ElmCustomType other = (ElmCustomType) obj;
		return Objects.equals(docComment, other.docComment) &&
				Objects.equals(name, other.name) &&
				Objects.equals(typeVariables, other.typeVariables) &&
				Objects.equals(constructors, other.constructors);
	}

}

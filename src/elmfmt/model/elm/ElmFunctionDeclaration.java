package elmfmt.model.elm;

import elmfmt.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * 
 * AST node:
 * <pre>
 * [doc comment]
 * [name : type]
 * name arg1 arg2 = body
 * </pre>
 *
 */
public class ElmFunctionDeclaration extends ElmDeclaration {

	private final ElmDocComment docComment;
	private final ElmTypeSignature signature;
	private final String name;
	private final List<ElmPattern> arguments;
	private final ElmExpression body;

	public ElmFunctionDeclaration(SourceLocation location, ElmDocComment docComment, ElmTypeSignature signature, String name, List<ElmPattern> arguments, ElmExpression body) {
		super(location);
		this.docComment = docComment;
		this.signature = signature;
		this.name = name;
		this.arguments = arguments;
		this.body = body;
	}

	public ElmDocComment getDocComment() {
		return docComment;
	}

	public ElmTypeSignature getSignature() {
		return signature;
	}

	public String getName() {
		return name;
	}

	public List<ElmPattern> getArguments() {
		return arguments;
	}

	public ElmExpression getBody() {
		return body;
	}

	@Override
	public <T, E extends Throwable> T accept(ElmDeclarationVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(docComment, signature, name, arguments, body);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		ElmFunctionDeclaration other = (ElmFunctionDeclaration) obj;
		return Objects.equals(docComment, other.docComment) &&
				Objects.equals(signature, other.signature) &&
				Objects.equals(name, other.name) &&
				Objects.equals(arguments, other.arguments) &&
				Objects.equals(body, other.body);
	}

}

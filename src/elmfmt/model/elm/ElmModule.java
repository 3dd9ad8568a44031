package elmfmt.model.elm;

import elmfmt.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * One parsed file.
 */
public class ElmModule extends ElmNode {

	private final ElmModuleHeader header;
	private final ElmDocComment docComment;
	private final List<ElmImport> imports;
	private final List<ElmDeclaration> declarations;

	public ElmModule(SourceLocation location, ElmModuleHeader header, ElmDocComment docComment, List<ElmImport> imports, List<ElmDeclaration> declarations) {
		super(location);
		this.header = header;
		this.docComment = docComment;
		this.imports = imports;
		this.declarations = declarations;
	}

	public ElmModuleHeader getHeader() {
		return header;
	}

	public ElmDocComment getDocComment() {
		return docComment;
	}

	public List<ElmImport> getImports() {
		return imports;
	}

	public List<ElmDeclaration> getDeclarations() {
		return declarations;
	}

	@Override
	public <T, E extends Throwable> T accept(ElmNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(header, docComment, imports, declarations);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		ElmModule other = (ElmModule) obj;
		return Objects.equals(header, other.header) &&
				Objects.equals(docComment, other.docComment) &&
				Objects.equals(imports, other.imports) &&
				Objects.equals(declarations, other.declarations);
	}

}

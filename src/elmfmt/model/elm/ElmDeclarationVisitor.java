package elmfmt.model.elm;

public abstract class ElmDeclarationVisitor<T, E extends Throwable> {
	public abstract T visit(ElmFunctionDeclaration elmFunctionDeclaration) throws E;
	public abstract T visit(ElmTypeAlias elmTypeAlias) throws E;
	public abstract T visit(ElmCustomType elmCustomType) throws E;
	public abstract T visit(ElmPortDeclaration elmPortDeclaration) throws E;
	public abstract T visit(ElmInfixDeclaration elmInfixDeclaration) throws E;
	public abstract T visit(ElmDestructuring elmDestructuring) throws E;
	public abstract T visit(ElmTopLevelComment elmTopLevelComment) throws E;
}

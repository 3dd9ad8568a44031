package elmfmt.formatters;

import elmfmt.model.elm.*;

/**
 * The name a declaration is reported under, or null for declarations that bind no single
 * name.
 */
public class ElmDeclarationNameVisitor extends ElmDeclarationVisitor<String, RuntimeException> {

	@Override
	public String visit(ElmFunctionDeclaration elmFunctionDeclaration) {
		return elmFunctionDeclaration.getName();
	}

	@Override
	public String visit(ElmTypeAlias elmTypeAlias) {
		return elmTypeAlias.getName();
	}

	@Override
	public String visit(ElmCustomType elmCustomType) {
		return elmCustomType.getName();
	}

	@Override
	public String visit(ElmPortDeclaration elmPortDeclaration) {
		return elmPortDeclaration.getName();
	}

	@Override
	public String visit(ElmInfixDeclaration elmInfixDeclaration) {
		return "(" + elmInfixDeclaration.getOperator() + ")";
	}

	@Override
	public String visit(ElmDestructuring elmDestructuring) {
		return null;
	}

	@Override
	public String visit(ElmTopLevelComment elmTopLevelComment) {
		return null;
	}
}

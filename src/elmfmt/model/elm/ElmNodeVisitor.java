package elmfmt.model.elm;

public abstract class ElmNodeVisitor<T, E extends Throwable> {
	public abstract T visit(ElmModule elmModule) throws E;
	public abstract T visit(ElmModuleHeader elmModuleHeader) throws E;
	public abstract T visit(ElmImport elmImport) throws E;
	public abstract T visit(ElmExposing elmExposing) throws E;
	public abstract T visit(ElmExposedItem elmExposedItem) throws E;
	public abstract T visit(ElmDeclaration elmDeclaration) throws E;
	public abstract T visit(ElmPattern elmPattern) throws E;
	public abstract T visit(ElmExpression elmExpression) throws E;
	public abstract T visit(ElmType elmType) throws E;
	public abstract T visit(ElmEffectManagerField elmEffectManagerField) throws E;
	public abstract T visit(ElmTypeSignature elmTypeSignature) throws E;
	public abstract T visit(ElmDocComment elmDocComment) throws E;
	public abstract T visit(ElmValueConstructor elmValueConstructor) throws E;
	public abstract T visit(ElmRecordField elmRecordField) throws E;
	public abstract T visit(ElmRecordFieldType elmRecordFieldType) throws E;
	public abstract T visit(ElmCaseBranch elmCaseBranch) throws E;
	public abstract T visit(ElmIfBranch elmIfBranch) throws E;
}

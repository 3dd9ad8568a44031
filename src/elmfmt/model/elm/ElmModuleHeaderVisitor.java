package elmfmt.model.elm;

public abstract class ElmModuleHeaderVisitor<T, E extends Throwable> {
	public abstract T visit(ElmPlainModuleHeader elmPlainModuleHeader) throws E;
	public abstract T visit(ElmPortModuleHeader elmPortModuleHeader) throws E;
	public abstract T visit(ElmEffectModuleHeader elmEffectModuleHeader) throws E;
}

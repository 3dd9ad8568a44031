package elmfmt.model.elm;

import elmfmt.util.SourceLocation;

import java.util.Objects;

/**
 * AST node: {@code import Name as Alias exposing (..)}, alias and exposing being optional.
 */
public class ElmImport extends ElmNode {

	private final String moduleName;
	private final String alias;
	private final ElmExposing exposing;

	public ElmImport(SourceLocation location, String moduleName, String alias, ElmExposing exposing) {
		super(location);
		this.moduleName = moduleName;
		this.alias = alias;
		this.exposing = exposing;
	}

	public String getModuleName() {
		return moduleName;
	}

	public String getAlias() {
		return alias;
	}

	public ElmExposing getExposing() {
		return exposing;
	}

	@Override
	public <T, E extends Throwable> T accept(ElmNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(moduleName, alias, exposing);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		ElmImport other = (ElmImport) obj;
		return Objects.equals(moduleName, other.moduleName) &&
				Objects.equals(alias, other.alias) &&
				Objects.equals(exposing, other.exposing);
	}

}

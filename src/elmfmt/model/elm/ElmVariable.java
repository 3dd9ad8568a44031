package elmfmt.model.elm;

import elmfmt.util.SourceLocation;

import java.util.Objects;

/**
 * A value or constructor reference, optionally qualified: List.map, x, Just.
 */
public class ElmVariable extends ElmExpression {

	private final String moduleQualifier;
	private final String name;

	public ElmVariable(SourceLocation location, String moduleQualifier, String name) {
		super(location);
		this.moduleQualifier = moduleQualifier;
		this.name = name;
	}

	public String getModuleQualifier() {
		return moduleQualifier;
	}

	public String getName() {
		return name;
	}

	@Override
	public <T, E extends Throwable> T accept(ElmExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(moduleQualifier, name);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		ElmVariable other = (ElmVariable) obj;
		return Objects.equals(moduleQualifier, other.moduleQualifier) &&
				Objects.equals(name, other.name);
	}

}

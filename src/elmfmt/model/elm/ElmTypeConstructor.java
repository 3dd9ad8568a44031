package elmfmt.model.elm;

import elmfmt.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * AST node: {@code Dict.Dict String a}, where the module qualifier may be null.
 */
public class ElmTypeConstructor extends ElmType {

	private final String moduleQualifier;
	private final String name;
	private final List<ElmType> arguments;

	public ElmTypeConstructor(SourceLocation location, String moduleQualifier, String name, List<ElmType> arguments) {
		super(location);
		this.moduleQualifier = moduleQualifier;
		this.name = name;
		this.arguments = arguments;
	}

	public String getModuleQualifier() {
		return moduleQualifier;
	}

	public String getName() {
		return name;
	}

	public List<ElmType> getArguments() {
		return arguments;
	}

	@Override
	public <T, E extends Throwable> T accept(ElmTypeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(moduleQualifier, name, arguments);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		ElmTypeConstructor other = (ElmTypeConstructor) obj;
		return Objects.equals(moduleQualifier, other.moduleQualifier) &&
				Objects.equals(name, other.name) &&
				Objects.equals(arguments, other.arguments);
	}

}

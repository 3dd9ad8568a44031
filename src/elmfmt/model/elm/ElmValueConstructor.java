package elmfmt.model.elm;

import elmfmt.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * A constructor of a custom type, with its argument types.
 */
public class ElmValueConstructor extends ElmNode {

	private final String name;
	private final List<ElmType> arguments;

	public ElmValueConstructor(SourceLocation location, String name, List<ElmType> arguments) {
		super(location);
		this.name = name;
		this.arguments = arguments;
	}

	public String getName() {
		return name;
	}

	public List<ElmType> getArguments() {
		return arguments;
	}

	@Override
	public <T, E extends Throwable> T accept(ElmNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, arguments);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		ElmValueConstructor other = (ElmValueConstructor) obj;
		return Objects.equals(name, other.name) &&
				Objects.equals(arguments, other.arguments);
	}

}

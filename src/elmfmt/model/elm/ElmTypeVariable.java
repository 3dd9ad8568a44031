package elmfmt.model.elm;

import elmfmt.util.SourceLocation;

import java.util.Objects;

public class ElmTypeVariable extends ElmType {

	private final String name;

	public ElmTypeVariable(SourceLocation location, String name) {
		super(location);
		this.name = name;
	}

	public String getName() {
		return name;
	}

	@Override
	public <T, E extends Throwable> T accept(ElmTypeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		ElmTypeVariable other = (ElmTypeVariable) obj;
		return Objects.equals(name, other.name);
	}

}

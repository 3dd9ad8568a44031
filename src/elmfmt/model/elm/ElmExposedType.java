package elmfmt.model.elm;

import elmfmt.util.SourceLocation;

import java.util.Objects;

/**
 * A type name, with (..) when its constructors are exposed too.
 */
public class ElmExposedType extends ElmExposedItem {

	private final String name;
	private final boolean constructorsExposed;

	public ElmExposedType(SourceLocation location, String name, boolean constructorsExposed) {
		super(location);
		this.name = name;
		this.constructorsExposed = constructorsExposed;
	}

	public String getName() {
		return name;
	}

	public boolean isConstructorsExposed() {
		return constructorsExposed;
	}

	@Override
	public String getTagName() {
		return name;
	}

	@Override
	public <T, E extends Throwable> T accept(ElmExposedItemVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, constructorsExposed);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		ElmExposedType other = (ElmExposedType) obj;
		return Objects.equals(name, other.name) &&
				constructorsExposed == other.constructorsExposed;
	}

}

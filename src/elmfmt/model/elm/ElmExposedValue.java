package elmfmt.model.elm;

import elmfmt.util.SourceLocation;

import java.util.Objects;

public class ElmExposedValue extends ElmExposedItem {

	private final String name;

	public ElmExposedValue(SourceLocation location, String name) {
		super(location);
		this.name = name;
	}

	public String getName() {
		return name;
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
		return Objects.hash(name);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		ElmExposedValue other = (ElmExposedValue) obj;
		return Objects.equals(name, other.name);
	}

}

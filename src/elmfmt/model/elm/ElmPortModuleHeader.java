package elmfmt.model.elm;

import elmfmt.util.SourceLocation;

import java.util.Objects;

/**
 * AST node: {@code port module Name exposing (..)}
 */
public class ElmPortModuleHeader extends ElmModuleHeader {

	private final String name;
	private final ElmExposing exposing;

	public ElmPortModuleHeader(SourceLocation location, String name, ElmExposing exposing) {
		super(location);
		this.name = name;
		this.exposing = exposing;
	}

	public String getName() {
		return name;
	}

	public ElmExposing getExposing() {
		return exposing;
	}

	@Override
	public <T, E extends Throwable> T accept(ElmModuleHeaderVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, exposing);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		ElmPortModuleHeader other = (ElmPortModuleHeader) obj;
		return Objects.equals(name, other.name) &&
				Objects.equals(exposing, other.exposing);
	}

}

package elmfmt.model.elm;

import elmfmt.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * AST node: {@code effect module Name where { command = MyCmd } exposing (..)}
 */
public class ElmEffectModuleHeader extends ElmModuleHeader {

	private final String name;
	private final List<ElmEffectManagerField> managerFields;
	private final ElmExposing exposing;

	public ElmEffectModuleHeader(SourceLocation location, String name, List<ElmEffectManagerField> managerFields, ElmExposing exposing) {
		super(location);
		this.name = name;
		this.managerFields = managerFields;
		this.exposing = exposing;
	}

	public String getName() {
		return name;
	}

	public List<ElmEffectManagerField> getManagerFields() {
		return managerFields;
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
		return Objects.hash(name, managerFields, exposing);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		ElmEffectModuleHeader other = (ElmEffectModuleHeader) obj;
		return Objects.equals(name, other.name) &&
				Objects.equals(managerFields, other.managerFields) &&
				Objects.equals(exposing, other.exposing);
	}

}

package elmfmt.model.elm;

import elmfmt.util.SourceLocation;

import java.util.Objects;

/**
 * Embedded shader code: [glsl| ... |]. The code is reproduced exactly.
 */
public class ElmGlsl extends ElmExpression {

	private final String code;

	public ElmGlsl(SourceLocation location, String code) {
		super(location);
		this.code = code;
	}

	public String getCode() {
		return code;
	}

	@Override
	public <T, E extends Throwable> T accept(ElmExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(code);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		ElmGlsl other = (ElmGlsl) obj;
		return Objects.equals(code, other.code);
	}

}

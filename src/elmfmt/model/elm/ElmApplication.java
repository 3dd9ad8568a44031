package elmfmt.model.elm;

import elmfmt.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * AST node: {@code function arg1 arg2}
 */
public class ElmApplication extends ElmExpression {

	private final ElmExpression function;
	private final List<ElmExpression> arguments;

	public ElmApplication(SourceLocation location, ElmExpression function, List<ElmExpression> arguments) {
		super(location);
		this.function = function;
		this.arguments = arguments;
	}

	public ElmExpression getFunction() {
		return function;
	}

	public List<ElmExpression> getArguments() {
		return arguments;
	}

	@Override
	public <T, E extends Throwable> T accept(ElmExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(function, arguments);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		ElmApplication other = (ElmApplication) obj;
		return Objects.equals(function, other.function) &&
				Objects.equals(arguments, other.arguments);
	}

}

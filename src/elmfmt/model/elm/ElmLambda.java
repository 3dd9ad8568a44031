package elmfmt.model.elm;

import elmfmt.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * AST node: {@code \a b -> body}
 */
public class ElmLambda extends ElmExpression {

	private final List<ElmPattern> arguments;
	private final ElmExpression body;

	public ElmLambda(SourceLocation location, List<ElmPattern> arguments, ElmExpression body) {
		super(location);
		this.arguments = arguments;
		this.body = body;
	}

	public List<ElmPattern> getArguments() {
		return arguments;
	}

	public ElmExpression getBody() {
		return body;
	}

	@Override
	public <T, E extends Throwable> T accept(ElmExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(arguments, body);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		ElmLambda other = (ElmLambda) obj;
		return Objects.equals(arguments, other.arguments) &&
				Objects.equals(body, other.body);
	}

}

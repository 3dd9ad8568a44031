package elmfmt.model.elm;

import elmfmt.util.SourceLocation;

import java.util.Objects;

/**
 * AST node: {@code pattern as name}
 */
public class ElmAliasPattern extends ElmPattern {

	private final ElmPattern pattern;
	private final String name;

	public ElmAliasPattern(SourceLocation location, ElmPattern pattern, String name) {
		super(location);
		this.pattern = pattern;
		this.name = name;
	}

	public ElmPattern getPattern() {
		return pattern;
	}

	public String getName() {
		return name;
	}

	@Override
	public <T, E extends Throwable> T accept(ElmPatternVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(pattern, name);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		ElmAliasPattern other = (ElmAliasPattern) obj;
		return Objects.equals(pattern, other.pattern) &&
				Objects.equals(name, other.name);
	}

}

package elmfmt.model.elm;

import elmfmt.util.SourceLocation;

import java.util.Objects;

public class ElmParenthesizedPattern extends ElmPattern {

	private final ElmPattern pattern;

	public ElmParenthesizedPattern(SourceLocation location, ElmPattern pattern) {
		super(location);
		this.pattern = pattern;
	}

	public ElmPattern getPattern() {
		return pattern;
	}

	@Override
	public <T, E extends Throwable> T accept(ElmPatternVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(pattern);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		ElmParenthesizedPattern other = (ElmParenthesizedPattern) obj;
		return Objects.equals(pattern, other.pattern);
	}

}

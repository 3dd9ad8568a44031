package elmfmt.model.elm;

import elmfmt.util.SourceLocation;

import java.util.Objects;

/**
 * The raw text between the quotes, escapes untouched, and the quoting it was written with.
 */
public class ElmStringLiteral extends ElmLiteral {

	public enum Quoting {
		SINGLE("\""),
		TRIPLE("\"\"\"");

		private final String delimiter;

		Quoting(String delimiter) {
			this.delimiter = delimiter;
		}

		public String getDelimiter() {
			return delimiter;
		}
	}

	private final String value;
	private final Quoting quoting;

	public ElmStringLiteral(SourceLocation location, String value, Quoting quoting) {
		super(location);
		this.value = value;
		this.quoting = quoting;
	}

	public String getValue() {
		return value;
	}

	public Quoting getQuoting() {
		return quoting;
	}

	@Override
	public <T, E extends Throwable> T accept(ElmExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(value, quoting);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		ElmStringLiteral other = (ElmStringLiteral) obj;
		return Objects.equals(value, other.value) &&
				Objects.equals(quoting, other.quoting);
	}

}

package elmfmt.util;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Position metadata attached to syntax tree nodes by the parser. The formatter
 * carries it along but never lays anything out from it.
 */
public class SourceLocation {
	private final Path file;
	private final int startLine;
	private final int endLine;
	private final int startColumn;
	private final int endColumn;

	public SourceLocation(Path file, int startLine, int endLine, int startColumn, int endColumn) {
		this.file = file;
		this.startLine = startLine;
		this.endLine = endLine;
		this.startColumn = startColumn;
		this.endColumn = endColumn;
	}

	public static SourceLocation unknown() {
		return new SourceLocation(null, -1, -1, -1, -1);
	}

	public boolean isUnknown() {
		return file == null;
	}

	public Path getFile() {
		return file;
	}

	public int getStartLine() {
		return startLine;
	}

	public int getEndLine() {
		return endLine;
	}

	public int getStartColumn() {
		return startColumn;
	}

	public int getEndColumn() {
		return endColumn;
	}

	@Override
	public int hashCode() {
		return Objects.hash(file, startLine, endLine, startColumn, endColumn);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		SourceLocation other = (SourceLocation) obj;
		return startLine == other.startLine && endLine == other.endLine && startColumn == other.startColumn &&
				endColumn == other.endColumn && Objects.equals(file, other.file);
	}

	@Override
	public String toString() {
		if (isUnknown()) {
			return "unknown source location";
		}
		return file + ":" + startLine + ":" + startColumn + "-" + endLine + ":" + endColumn;
	}
}

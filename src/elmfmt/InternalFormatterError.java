package elmfmt;

/**
 * Signals a defect in the formatter itself rather than in its input. The
 * formatting call that raised it has no trustworthy output.
 */
public class InternalFormatterError extends RuntimeException {
	public InternalFormatterError(String message) {
		super("internal formatter error: " + message);
	}

	public InternalFormatterError(Exception e) {
		super("internal formatter error", e);
	}
}

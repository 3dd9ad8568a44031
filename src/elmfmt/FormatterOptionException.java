package elmfmt;

/**
 * Thrown when the formatter configuration cannot be read or makes no sense.
 */
public class FormatterOptionException extends Exception {
	private static final long serialVersionUID = 4418530713094026112L;

	public FormatterOptionException(String msg) {
		super(msg);
	}

	public FormatterOptionException(String msg, Throwable cause) {
		super(msg, cause);
	}
}

package elmfmt;

public class Unreachable extends RuntimeException {
	public Unreachable() {
		super("unreachable");
	}
}

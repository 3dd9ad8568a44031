package elmfmt.doc;

import elmfmt.InternalFormatterError;

/**
 * A fragment of text emitted verbatim. It never contains a line break: multi-line
 * content has to be split into text fragments separated by {@link DocLine}s.
 */
public final class DocText extends Doc {

	private final String text;

	DocText(String text) {
		if (text.indexOf('\n') != -1 || text.indexOf('\r') != -1) {
			throw new InternalFormatterError("text fragment contains a line break: \"" + text + "\"");
		}
		this.text = text;
	}

	public String getText() {
		return text;
	}

	public int getWidth() {
		return text.length();
	}

	@Override
	public <T, E extends Throwable> T accept(DocVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}

package elmfmt.doc;

import java.util.Arrays;
import java.util.List;

/**
 * Static constructors for {@link Doc} values, meant to be statically imported.
 */
public class DocBuilder {
	private DocBuilder() {}

	public static Doc empty() {
		return DocEmpty.INSTANCE;
	}

	public static Doc text(String text) {
		if (text.isEmpty()) {
			return DocEmpty.INSTANCE;
		}
		return new DocText(text);
	}

	public static Doc space() {
		return text(" ");
	}

	public static Doc hardline() {
		return DocLine.HARD;
	}

	public static Doc softline() {
		return DocLine.SOFT;
	}

	public static Doc literalline() {
		return DocLine.LITERAL;
	}

	/**
	 * A break that disappears entirely when its group is flattened.
	 */
	public static Doc softbreak() {
		return flatAlt(DocLine.SOFT, DocEmpty.INSTANCE);
	}

	public static Doc flatAlt(Doc broken, Doc flat) {
		return new DocFlatAlt(broken, flat);
	}

	public static Doc concat(Doc left, Doc right) {
		if (left == DocEmpty.INSTANCE) {
			return right;
		}
		if (right == DocEmpty.INSTANCE) {
			return left;
		}
		return new DocConcat(left, right);
	}

	public static Doc concat(Doc... docs) {
		return concat(Arrays.asList(docs));
	}

	public static Doc concat(List<Doc> docs) {
		// right-nested, so the renderer stack stays shallow on long sequences
		Doc result = DocEmpty.INSTANCE;
		for (int i = docs.size() - 1; i >= 0; i--) {
			result = concat(docs.get(i), result);
		}
		return result;
	}

	public static Doc nest(int indent, Doc body) {
		if (indent == 0 || body == DocEmpty.INSTANCE) {
			return body;
		}
		return new DocNest(indent, body);
	}

	public static Doc group(Doc body) {
		if (body instanceof DocGroup || body == DocEmpty.INSTANCE) {
			return body;
		}
		return new DocGroup(body);
	}

	/**
	 * Places {@code separator} between consecutive elements, with none after the last.
	 */
	public static Doc join(Doc separator, List<Doc> docs) {
		Doc[] parts = new Doc[Math.max(0, docs.size() * 2 - 1)];
		for (int i = 0; i < docs.size(); i++) {
			if (i > 0) {
				parts[i * 2 - 1] = separator;
			}
			parts[i * 2] = docs.get(i);
		}
		return concat(parts);
	}

	public static Doc words(List<Doc> docs) {
		return join(space(), docs);
	}

	public static Doc lines(List<Doc> docs) {
		return join(hardline(), docs);
	}
}

package elmfmt.formatters;

import java.util.List;

import elmfmt.doc.Doc;

import static elmfmt.doc.DocBuilder.*;

/**
 * Layout shapes shared by several formatters.
 */
public class FormattingTools {
	
	private FormattingTools() {}

	public static final int INDENT = 4;

	/**
	 * Leading-comma layout: {@code [ a, b ]} when it fits, otherwise one element per line
	 * <pre>
	 * [ a
	 * , b
	 * ]
	 * </pre>
	 */
	public static Doc commaSequence(String open, String close, List<Doc> items) {
		if (items.isEmpty()) {
			return text(open + close);
		}
		return group(concat(
				text(open + " "),
				join(concat(softbreak(), text(", ")), items),
				softline(),
				text(close)));
	}

	/**
	 * {@code { base | a = 1, b = 2 }}, or when broken
	 * <pre>
	 * { base
	 *     | a = 1
	 *     , b = 2
	 * }
	 * </pre>
	 */
	public static Doc extensionSequence(String base, List<Doc> items) {
		return group(concat(
				text("{ " + base),
				nest(INDENT, concat(softline(), text("| "), join(concat(softbreak(), text(", ")), items))),
				softline(),
				text("}")));
	}

	/**
	 * {@code (a, b)} when it fits, otherwise the leading-comma layout, starting on a new line
	 * indented under {@code keyword}.
	 */
	public static Doc exposingList(String keyword, List<Doc> items) {
		if (items.isEmpty()) {
			return text(keyword + " ()");
		}
		return group(concat(
				text(keyword),
				nest(INDENT, concat(
						softline(),
						text("("),
						flatAlt(text(" "), empty()),
						join(concat(softbreak(), text(", ")), items),
						softbreak(),
						text(")")))));
	}

	/**
	 * {@code head} followed by {@code body} on the same line when it fits, otherwise on an
	 * indented line of its own.
	 */
	public static Doc hangingBody(Doc head, Doc body) {
		return group(concat(head, nest(INDENT, concat(softline(), body))));
	}

	/**
	 * {@code head} with {@code body} always on the next, indented line.
	 */
	public static Doc indentedBlock(Doc head, Doc body) {
		return concat(head, nest(INDENT, concat(hardline(), body)));
	}

	public static Doc parenthesize(Doc doc) {
		return concat(text("("), doc, text(")"));
	}

	public static Doc blankLine() {
		return concat(hardline(), hardline());
	}

	public static String qualified(String moduleQualifier, String name) {
		if (moduleQualifier == null || moduleQualifier.isEmpty()) {
			return name;
		}
		return moduleQualifier + "." + name;
	}
}

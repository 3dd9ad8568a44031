package elmfmt.comment;

import java.util.ArrayList;
import java.util.List;

/**
 * 
 * Renders a {@link Comment} as text wrapped to a target width.
 * 
 * Markdown is wrapped greedily, one paragraph at a time. Headings and list
 * items start their own lines, and continuation lines of a list item hang
 * under its text. Code keeps its lines exactly, indented by four spaces. Tag
 * lines come out as {@code @doc a, b, c} and are never wrapped. Parts are
 * separated by a blank line.
 *
 */
public class CommentReflow {
	private CommentReflow() {}

	public static String reflow(Comment comment, int width) {
		return String.join("\n", reflowLines(comment, width));
	}

	public static ReflowedComment reflowFileComment(Comment comment, int width) {
		List<List<String>> tagGroups = new ArrayList<>();
		for (CommentPart part : comment.getParts()) {
			if (part instanceof DocTagsPart) {
				tagGroups.add(((DocTagsPart) part).getNames());
			}
		}
		return new ReflowedComment(reflow(comment, width), tagGroups);
	}

	public static List<String> reflowLines(Comment comment, int width) {
		List<String> lines = new ArrayList<>();
		PartReflowVisitor visitor = new PartReflowVisitor(width);
		for (CommentPart part : comment.getParts()) {
			if (!lines.isEmpty()) {
				lines.add("");
			}
			lines.addAll(part.accept(visitor));
		}
		return lines;
	}

	private static final class PartReflowVisitor extends CommentPartVisitor<List<String>, RuntimeException> {
		private final int width;

		PartReflowVisitor(int width) {
			this.width = width;
		}

		@Override
		public List<String> visit(MarkdownPart markdownPart) {
			List<String> out = new ArrayList<>();
			StringBuilder line = new StringBuilder();
			boolean blankPending = false;
			String hang = "";
			for (String source : markdownPart.getText().split("\n", -1)) {
				String trimmed = source.trim();
				if (trimmed.isEmpty()) {
					flush(line, out);
					blankPending = !out.isEmpty();
					hang = "";
					continue;
				}
				if (blankPending) {
					out.add("");
					blankPending = false;
				}
				if (trimmed.startsWith("#")) {
					flush(line, out);
					out.add(trimmed);
					hang = "";
					continue;
				}
				String[] words = trimmed.split("\\s+");
				boolean item = isListMarker(words[0]);
				if (item) {
					flush(line, out);
					hang = spaces(words[0].length() + 1);
				}
				for (String word : words) {
					// a word that would open a block must not start a wrapped line
					if (line.length() > 0 && line.length() + 1 + word.length() > width && !opensBlock(word)) {
						flush(line, out);
					}
					if (line.length() > 0) {
						line.append(' ');
					} else if (!item) {
						line.append(hang);
					}
					line.append(word);
					item = false;
				}
			}
			flush(line, out);
			return out;
		}

		private static boolean opensBlock(String word) {
			return CommentParser.isTagLine(word)
					|| word.startsWith(CommentParser.FENCE)
					|| word.startsWith("#")
					|| isListMarker(word);
		}

		private static boolean isListMarker(String word) {
			return word.equals("-") || word.equals("*") || word.equals("+") || word.matches("\\d+[.)]");
		}

		private static String spaces(int n) {
			StringBuilder sb = new StringBuilder();
			for (int i = 0; i < n; i++) {
				sb.append(' ');
			}
			return sb.toString();
		}

		private static void flush(StringBuilder line, List<String> out) {
			if (line.length() > 0) {
				out.add(line.toString());
				line.setLength(0);
			}
		}

		@Override
		public List<String> visit(CodePart codePart) {
			List<String> out = new ArrayList<>();
			for (String line : codePart.getText().split("\n", -1)) {
				out.add(line.isEmpty() ? "" : "    " + line);
			}
			return out;
		}

		@Override
		public List<String> visit(DocTagsPart docTagsPart) {
			List<String> out = new ArrayList<>();
			if (docTagsPart.getNames().isEmpty()) {
				out.add("@doc");
			} else {
				out.add("@doc " + String.join(", ", docTagsPart.getNames()));
			}
			return out;
		}
	}
}

package elmfmt.formatters;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import elmfmt.comment.Comment;
import elmfmt.comment.CommentParser;
import elmfmt.comment.CommentReflow;
import elmfmt.doc.Doc;
import elmfmt.errors.WhileReadingDocComment;
import elmfmt.model.elm.ElmDocComment;

import static elmfmt.doc.DocBuilder.*;

/**
 * Lays re-flowed doc comment lines out between the comment's opening and closing markers.
 */
public class DocCommentFormatting {
	private DocCommentFormatting() {}

	private static final String OPEN = "{-|";
	private static final String CLOSE = "-}";

	/**
	 * The width comment text is re-flowed to, leaving room for the opening marker.
	 */
	public static int commentWidth(int pageWidth) {
		return Math.max(1, pageWidth - (OPEN.length() + 1));
	}

	/**
	 * Parses, re-flows and lays out the doc comment of declaration {@code owner}.
	 */
	public static Doc format(ElmDocComment docComment, String owner, FormattingContext ctx) {
		Comment comment = CommentParser.parse(
				docComment.getText(),
				ctx.getIssues().withContext(new WhileReadingDocComment(owner)));
		return layout(CommentReflow.reflowLines(comment, commentWidth(ctx.getWidth())));
	}

	public static List<String> splitLines(String text) {
		if (text.isEmpty()) {
			return Collections.emptyList();
		}
		return Arrays.asList(text.split("\n", -1));
	}

	public static Doc layout(List<String> lines) {
		List<Doc> docs = new ArrayList<>();
		if (lines.isEmpty()) {
			docs.add(text(OPEN));
		} else if (lines.get(0).isEmpty() || lines.get(0).startsWith(" ")) {
			// indented code cannot share the opening line
			docs.add(text(OPEN));
			for (String line : lines) {
				docs.add(text(line));
			}
		} else {
			docs.add(text(OPEN + " " + lines.get(0)));
			for (String line : lines.subList(1, lines.size())) {
				docs.add(text(line));
			}
		}
		docs.add(text(CLOSE));
		return lines(docs);
	}
}

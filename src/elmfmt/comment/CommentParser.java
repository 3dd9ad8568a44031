package elmfmt.comment;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Logger;
import java.util.stream.Collectors;

import elmfmt.errors.IssueContext;

/**
 * 
 * Splits the raw body of a doc comment (the text between <code>{-|</code> and
 * <code>-}</code>) into {@link CommentPart}s.
 * 
 * <ul>
 *   <li>a line starting with {@code @docs} or {@code @doc} is a tag line, names separated by commas</li>
 *   <li>a line starting with three backticks opens a fenced code block, closed by the next such line</li>
 *   <li>lines indented by four spaces after a blank line form an indented code block</li>
 *   <li>everything else is markdown</li>
 * </ul>
 * 
 * An unterminated fence is reported as a {@link MalformedCommentIssue}, and the rest of
 * the comment, fence included, is read as markdown.
 *
 */
public class CommentParser {
	private static final Logger logger = Logger.getLogger("Comment Parser");

	static final String FENCE = "```";
	private static final String CODE_INDENT = "    ";

	private CommentParser() {}

	public static Comment parse(String raw, IssueContext ctx) {
		String[] lines = raw.replace("\r\n", "\n").split("\n", -1);
		if (lines.length > 0) {
			lines[0] = stripLeading(lines[0]);
		}
		List<CommentPart> parts = new ArrayList<>();
		List<String> markdown = new ArrayList<>();
		int i = 0;
		while (i < lines.length) {
			String line = stripTrailing(lines[i]);
			String trimmed = line.trim();
			if (isTagLine(trimmed)) {
				flushMarkdown(markdown, parts);
				parts.add(new DocTagsPart(readTagNames(trimmed)));
				i++;
			} else if (trimmed.startsWith(FENCE)) {
				int close = findClosingFence(lines, i + 1);
				if (close == -1) {
					logger.fine("unterminated code fence at comment line " + i);
					ctx.report(new MalformedCommentIssue("unterminated code block", i));
					for (int j = i; j < lines.length; j++) {
						markdown.add(stripTrailing(lines[j]));
					}
					break;
				}
				flushMarkdown(markdown, parts);
				List<String> code = new ArrayList<>();
				for (int j = i + 1; j < close; j++) {
					code.add(stripTrailing(lines[j]));
				}
				if (code.stream().anyMatch(codeLine -> !codeLine.isEmpty())) {
					parts.add(new CodePart(String.join("\n", code)));
				}
				i = close + 1;
			} else if (line.startsWith(CODE_INDENT) && endsParagraph(markdown)) {
				int end = i;
				while (end < lines.length && (lines[end].startsWith(CODE_INDENT) || lines[end].trim().isEmpty())) {
					end++;
				}
				while (end > i && lines[end - 1].trim().isEmpty()) {
					end--;
				}
				flushMarkdown(markdown, parts);
				List<String> code = new ArrayList<>();
				for (int j = i; j < end; j++) {
					String codeLine = stripTrailing(lines[j]);
					code.add(codeLine.isEmpty() ? "" : codeLine.substring(CODE_INDENT.length()));
				}
				parts.add(new CodePart(String.join("\n", code)));
				i = end;
			} else {
				markdown.add(line);
				i++;
			}
		}
		flushMarkdown(markdown, parts);
		return new Comment(parts);
	}

	static boolean isTagLine(String trimmed) {
		for (String keyword : Arrays.asList("@docs", "@doc")) {
			if (trimmed.startsWith(keyword)) {
				return trimmed.length() == keyword.length() || Character.isWhitespace(trimmed.charAt(keyword.length()));
			}
		}
		return false;
	}

	private static List<String> readTagNames(String trimmed) {
		String names = trimmed.substring(trimmed.startsWith("@docs") ? "@docs".length() : "@doc".length());
		return Arrays.stream(names.split(","))
				.map(String::trim)
				.filter(name -> !name.isEmpty())
				.collect(Collectors.toList());
	}

	private static int findClosingFence(String[] lines, int from) {
		for (int j = from; j < lines.length; j++) {
			if (lines[j].trim().startsWith(FENCE)) {
				return j;
			}
		}
		return -1;
	}

	private static boolean endsParagraph(List<String> markdown) {
		return markdown.isEmpty() || markdown.get(markdown.size() - 1).trim().isEmpty();
	}

	private static void flushMarkdown(List<String> markdown, List<CommentPart> parts) {
		int start = 0;
		int end = markdown.size();
		while (start < end && markdown.get(start).trim().isEmpty()) {
			start++;
		}
		while (end > start && markdown.get(end - 1).trim().isEmpty()) {
			end--;
		}
		if (start < end) {
			parts.add(new MarkdownPart(String.join("\n", markdown.subList(start, end))));
		}
		markdown.clear();
	}

	private static String stripLeading(String line) {
		int i = 0;
		while (i < line.length() && Character.isWhitespace(line.charAt(i))) {
			i++;
		}
		return line.substring(i);
	}

	public static String stripTrailing(String line) {
		int end = line.length();
		while (end > 0 && Character.isWhitespace(line.charAt(end - 1))) {
			end--;
		}
		return line.substring(0, end);
	}
}

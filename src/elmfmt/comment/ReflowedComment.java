package elmfmt.comment;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A file-level comment after re-flow, along with its tag lines in document order.
 */
public class ReflowedComment {
	private final String text;
	private final List<List<String>> tagGroups;

	public ReflowedComment(String text, List<List<String>> tagGroups) {
		this.text = text;
		List<List<String>> groups = new ArrayList<>();
		for (List<String> group : tagGroups) {
			groups.add(Collections.unmodifiableList(new ArrayList<>(group)));
		}
		this.tagGroups = Collections.unmodifiableList(groups);
	}

	public String getText() {
		return text;
	}

	public List<List<String>> getTagGroups() {
		return tagGroups;
	}
}

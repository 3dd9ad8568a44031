package elmfmt.exports;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

import elmfmt.errors.Issue;

/**
 * 
 * Orders exposed names by the {@code @doc} lines of the module comment.
 * 
 * The tag lines are read as one sequence, groups and names in the order they
 * appear. Tagged names that are exposed come first, in tag order; exposed names
 * that no tag mentions follow in declaration order. A tag naming nothing exposed
 * yields an {@link UnresolvedDocTagIssue} and takes no position. Every exposed
 * name appears exactly once.
 *
 */
public class DocTagExportOrderer implements ExportOrderer {
	private static final Logger logger = Logger.getLogger("Export Orderer");

	@Override
	public ExportOrdering order(List<List<String>> tagGroups, List<String> declaredNames) {
		Set<String> declared = new LinkedHashSet<>(declaredNames);
		Set<String> placed = new LinkedHashSet<>();
		Set<String> reported = new HashSet<>();
		List<Issue> issues = new ArrayList<>();
		for (List<String> group : tagGroups) {
			for (String tag : group) {
				if (declared.contains(tag)) {
					placed.add(tag);
				} else if (reported.add(tag)) {
					logger.fine("doc tag " + tag + " matches no exposed name");
					issues.add(new UnresolvedDocTagIssue(tag));
				}
			}
		}
		List<String> ordered = new ArrayList<>(placed);
		for (String name : declared) {
			if (!placed.contains(name)) {
				ordered.add(name);
			}
		}
		return new ExportOrdering(ordered, issues);
	}
}

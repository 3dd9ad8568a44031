package elmfmt.formatters;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

import elmfmt.InternalFormatterError;
import elmfmt.errors.Issue;
import elmfmt.errors.IssueContext;
import elmfmt.exports.ExportOrderer;
import elmfmt.exports.ExportOrdering;
import elmfmt.model.elm.ElmExposedItem;
import elmfmt.model.elm.ElmExposing;
import elmfmt.model.elm.ElmExposingAll;
import elmfmt.model.elm.ElmExposingList;
import elmfmt.model.elm.ElmExposingVisitor;

/**
 * Rearranges a module header's exposing list into the order the module's doc
 * tags ask for. Wildcard exposing is left as it is.
 */
public class ExposingOrderingVisitor extends ElmExposingVisitor<ElmExposing, RuntimeException> {

	private static final Logger logger = Logger.getLogger("Export Orderer");

	private final ExportOrderer orderer;
	private final List<List<String>> tagGroups;
	private final IssueContext ctx;

	public ExposingOrderingVisitor(ExportOrderer orderer, List<List<String>> tagGroups, IssueContext ctx) {
		this.orderer = orderer;
		this.tagGroups = tagGroups;
		this.ctx = ctx;
	}

	@Override
	public ElmExposing visit(ElmExposingAll elmExposingAll) {
		return elmExposingAll;
	}

	@Override
	public ElmExposing visit(ElmExposingList elmExposingList) {
		Map<String, ElmExposedItem> byName = new LinkedHashMap<>();
		for (ElmExposedItem item : elmExposingList.getItems()) {
			byName.putIfAbsent(item.getTagName(), item);
		}
		ExportOrdering ordering = orderer.order(tagGroups, new ArrayList<>(byName.keySet()));
		for (Issue issue : ordering.getIssues()) {
			ctx.report(issue);
		}

		List<ElmExposedItem> ordered = new ArrayList<>();
		for (String name : ordering.getOrderedNames()) {
			ElmExposedItem item = byName.get(name);
			if (item == null) {
				throw new InternalFormatterError("export orderer produced undeclared name " + name);
			}
			ordered.add(item);
		}
		logger.fine("ordered " + ordered.size() + " exposed item(s)");
		return new ElmExposingList(elmExposingList.getLocation(), ordered);
	}
}

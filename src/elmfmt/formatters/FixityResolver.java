package elmfmt.formatters;

import java.util.HashSet;
import java.util.Set;
import java.util.logging.Logger;

import elmfmt.errors.IssueContext;
import elmfmt.fixity.Fixity;
import elmfmt.fixity.FixityTable;
import elmfmt.fixity.UnknownFixityIssue;

/**
 * Looks operators up for one file, reporting each operator without a known
 * fixity the first time it is met.
 */
public class FixityResolver {
	private static final Logger logger = Logger.getLogger("Elm Formatter");

	private final FixityTable table;
	private final Set<String> reported = new HashSet<>();

	public FixityResolver(FixityTable table) {
		this.table = table;
	}

	public FixityTable getTable() {
		return table;
	}

	/**
	 * @return the operator's fixity, or null when the table does not know it
	 */
	public Fixity resolve(String symbol, IssueContext ctx) {
		Fixity fixity = table.lookup(symbol);
		if (fixity == null && reported.add(symbol)) {
			logger.fine("no fixity for operator " + symbol + ", parenthesizing its operands");
			ctx.report(new UnknownFixityIssue(symbol));
		}
		return fixity;
	}
}

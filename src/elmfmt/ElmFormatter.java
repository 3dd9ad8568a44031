package elmfmt;

import java.util.logging.Logger;

import elmfmt.doc.Doc;
import elmfmt.doc.DocRenderer;
import elmfmt.errors.TopLevelIssueContext;
import elmfmt.exports.DocTagExportOrderer;
import elmfmt.exports.ExportOrderer;
import elmfmt.fixity.FixityTable;
import elmfmt.formatters.ElmNodeFormattingVisitor;
import elmfmt.formatters.FixityResolver;
import elmfmt.formatters.FormattingContext;
import elmfmt.model.elm.ElmModule;

/**
 * Formats parsed Elm modules. An instance holds only its options and may be
 * shared between threads; every call works on its own issue context.
 */
public class ElmFormatter {
	private static final Logger logger = Logger.getLogger("Elm Formatter");

	private final FormatterOptions options;
	private final ExportOrderer orderer;

	public ElmFormatter(FormatterOptions options) {
		this(options, new DocTagExportOrderer());
	}

	public ElmFormatter(FormatterOptions options, ExportOrderer orderer) {
		this.options = options;
		this.orderer = orderer;
	}

	public FormatterOptions getOptions() {
		return options;
	}

	public FormatResult format(ElmModule module) {
		TopLevelIssueContext ctx = new TopLevelIssueContext();

		FixityTable fixities = options.getFixities().withDeclarations(module.getDeclarations());
		logger.info("Formatting module " + module.getHeader().getName()
				+ " with " + fixities.size() + " known operators");

		FormattingContext formattingContext = new FormattingContext(
				options.getWidth(), new FixityResolver(fixities), ctx);
		Doc doc = module.accept(new ElmNodeFormattingVisitor(formattingContext, orderer));

		logger.info("Rendering at width " + options.getWidth());
		String text = new DocRenderer(options.getWidth()).render(doc);
		if (ctx.hasIssues()) {
			logger.warning(ctx.format(options.getWidth()));
		}
		return new FormatResult(endWithNewline(text), ctx.getIssues());
	}

	private static String endWithNewline(String text) {
		int end = text.length();
		while (end > 0 && text.charAt(end - 1) == '\n') {
			end--;
		}
		return text.substring(0, end) + "\n";
	}
}

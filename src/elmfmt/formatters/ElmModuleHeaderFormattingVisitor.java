package elmfmt.formatters;

import java.util.stream.Collectors;

import elmfmt.doc.Doc;
import elmfmt.model.elm.*;

/**
 * Formats a module header with {@code exposing} in place of the header's own exposing
 * clause, so that the caller can substitute a reordered list.
 */
public class ElmModuleHeaderFormattingVisitor extends ElmModuleHeaderVisitor<Doc, RuntimeException> {

	private final ElmExposing exposing;

	public ElmModuleHeaderFormattingVisitor(ElmExposing exposing) {
		this.exposing = exposing;
	}

	@Override
	public Doc visit(ElmPlainModuleHeader elmPlainModuleHeader) {
		return exposing.accept(new ElmExposingFormattingVisitor("module " + elmPlainModuleHeader.getName()));
	}

	@Override
	public Doc visit(ElmPortModuleHeader elmPortModuleHeader) {
		return exposing.accept(new ElmExposingFormattingVisitor("port module " + elmPortModuleHeader.getName()));
	}

	@Override
	public Doc visit(ElmEffectModuleHeader elmEffectModuleHeader) {
		String fields = elmEffectModuleHeader.getManagerFields().stream()
				.map(f -> f.getKind() + " = " + f.getTypeName())
				.collect(Collectors.joining(", "));
		return exposing.accept(new ElmExposingFormattingVisitor(
				"effect module " + elmEffectModuleHeader.getName() + " where { " + fields + " }"));
	}
}

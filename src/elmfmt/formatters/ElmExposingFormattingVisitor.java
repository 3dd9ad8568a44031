package elmfmt.formatters;

import java.util.stream.Collectors;

import elmfmt.doc.Doc;
import elmfmt.model.elm.ElmExposingAll;
import elmfmt.model.elm.ElmExposingList;
import elmfmt.model.elm.ElmExposingVisitor;

import static elmfmt.doc.DocBuilder.*;
import static elmfmt.formatters.FormattingTools.*;

/**
 * Formats an exposing clause after {@code prefix}, e.g. {@code module Main} or
 * {@code import Html}.
 */
public class ElmExposingFormattingVisitor extends ElmExposingVisitor<Doc, RuntimeException> {

	private final String prefix;

	public ElmExposingFormattingVisitor(String prefix) {
		this.prefix = prefix;
	}

	private String keyword() {
		return prefix.isEmpty() ? "exposing" : prefix + " exposing";
	}

	@Override
	public Doc visit(ElmExposingAll elmExposingAll) {
		return text(keyword() + " (..)");
	}

	@Override
	public Doc visit(ElmExposingList elmExposingList) {
		ElmExposedItemFormattingVisitor items = new ElmExposedItemFormattingVisitor();
		return exposingList(keyword(), elmExposingList.getItems().stream()
				.map(i -> i.accept(items))
				.collect(Collectors.toList()));
	}
}

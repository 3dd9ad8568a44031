package elmfmt;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;
import static elmfmt.model.elm.ElmBuilder.*;

import java.util.Arrays;

import org.junit.Test;

import elmfmt.errors.IssueWithContext;
import elmfmt.exports.UnresolvedDocTagIssue;
import elmfmt.fixity.Associativity;
import elmfmt.fixity.UnknownFixityIssue;
import elmfmt.model.elm.ElmModule;

public class ElmFormatterTest {

	private static String join(String... lines) {
		return String.join("\n", lines) + "\n";
	}

	private static FormatResult format(int width, ElmModule module) {
		return new ElmFormatter(FormatterOptions.defaults().withWidth(width)).format(module);
	}

	@Test
	public void testModuleLayoutAndExportOrder() {
		ElmModule module = module(
				moduleHeader("Main", exposing(
						exposedValue("bar"), exposedValue("baz"), exposedValue("foo"), exposedValue("qux"))),
				docComment(" Utilities.\n\n@docs foo, bar\n@docs baz\n"),
				imports(
						importModule("Html"),
						importModule("Json.Decode", "D", exposing(exposedType("Decoder")))),
				decls(
						function("foo", args(), num(1)),
						function("bar", args(), num(2))));
		FormatResult result = format(80, module);
		assertEquals(join(
				"module Main exposing (foo, bar, baz, qux)",
				"",
				"{-| Utilities.",
				"",
				"@doc foo, bar",
				"",
				"@doc baz",
				"-}",
				"",
				"import Html",
				"import Json.Decode as D exposing (Decoder)",
				"",
				"",
				"foo = 1",
				"",
				"",
				"bar = 2"), result.getText());
		assertFalse(result.hasIssues());
	}

	@Test
	public void testWildcardExposingIsUntouched() {
		ElmModule module = module(
				moduleHeader("Main", exposingAll()),
				docComment(" @docs foo, missing\n"),
				imports(importModule("Html", null, exposingAll())),
				decls());
		FormatResult result = format(80, module);
		assertEquals(join(
				"module Main exposing (..)",
				"",
				"{-| @doc foo, missing",
				"-}",
				"",
				"import Html exposing (..)"), result.getText());
		assertFalse(result.hasIssues());
	}

	@Test
	public void testBrokenExposingList() {
		ElmModule module = module(
				moduleHeader("Main", exposing(
						exposedValue("alpha"), exposedValue("beta"), exposedTypeWithConstructors("Gamma"))),
				null,
				imports(),
				decls());
		assertEquals(join(
				"module Main exposing",
				"    ( alpha",
				"    , beta",
				"    , Gamma(..)",
				"    )"), format(30, module).getText());
	}

	@Test
	public void testUnresolvedDocTag() {
		ElmModule module = module(
				moduleHeader("Main", exposing(exposedValue("foo"), exposedOperator("+"))),
				docComment(" @docs nothing, (+)\n"),
				imports(),
				decls());
		FormatResult result = format(80, module);
		assertThat(result.getText(), startsWith("module Main exposing ((+), foo)\n"));
		assertThat(result.getIssues().size(), is(1));
		IssueWithContext issue = (IssueWithContext) result.getIssues().get(0);
		assertThat(issue.getIssue(), instanceOf(UnresolvedDocTagIssue.class));
		assertThat(issue.getMessage(), startsWith("while reading the module doc comment:\n    @doc tag nothing"));
	}

	@Test
	public void testUnknownOperatorIsParenthesizedAndReported() {
		ElmModule module = module(
				moduleHeader("Main", exposing(exposedValue("x"))),
				null,
				imports(),
				decls(function("x", args(), binop("<?>", binop("<?>", var("a"), var("b")), var("c")))));
		FormatResult result = format(80, module);
		assertEquals(join(
				"module Main exposing (x)",
				"",
				"",
				"x = (a <?> b) <?> c"), result.getText());
		assertThat(result.getIssues().size(), is(1));
		IssueWithContext issue = (IssueWithContext) result.getIssues().get(0);
		assertThat(issue.getIssue(), instanceOf(UnknownFixityIssue.class));
		assertEquals("while formatting declaration x:\n"
				+ "    no fixity known for operator (<?>); its operands were parenthesized", issue.getMessage());
	}

	@Test
	public void testLocalInfixDeclarationIsUsed() {
		ElmModule module = module(
				moduleHeader("Main", exposing(exposedValue("x"), exposedOperator("<?>"))),
				null,
				imports(),
				decls(
						infix(Associativity.LEFT, 6, "<?>", "combine"),
						function("x", args(), binop("<?>", binop("<?>", var("a"), var("b")), var("c")))));
		FormatResult result = format(80, module);
		assertEquals(join(
				"module Main exposing (x, (<?>))",
				"",
				"",
				"infix left 6 (<?>) = combine",
				"",
				"",
				"x = a <?> b <?> c"), result.getText());
		assertFalse(result.hasIssues());
	}

	@Test
	public void testPortAndEffectHeaders() {
		assertEquals("port module Ports exposing (send)\n", format(80, module(
				portModuleHeader("Ports", exposing(exposedValue("send"))), null, imports(), decls())).getText());
		assertEquals("effect module Task where { command = MyCmd } exposing (perform)\n", format(80, module(
				effectModuleHeader("Task", Arrays.asList(managerField("command", "MyCmd")),
						exposing(exposedValue("perform"))),
				null, imports(), decls())).getText());
	}

	@Test
	public void testLinesStayWithinWidth() {
		ElmModule module = module(
				moduleHeader("Main", exposing(exposedValue("main"))),
				docComment(" A long module comment that certainly needs to be wrapped over several lines to fit.\n"),
				imports(),
				decls(function(null,
						tfuns(tcon("String"), tcon("Int"), tcon("List", tcon("String"))),
						"main",
						args(pvar("name"), pvar("count")),
						app(qvar("List", "repeat"), var("count"),
								binop("++", str("hello "), binop("++", var("name"), str("!")))))));
		int width = 40;
		for (String line : format(width, module).getText().split("\n")) {
			assertTrue(line, line.length() <= width);
			assertFalse(line, line.endsWith(" "));
		}
	}
}

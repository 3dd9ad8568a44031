package elmfmt.model.elm;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import elmfmt.fixity.Associativity;
import elmfmt.util.SourceLocation;

/**
 * Static constructors for syntax trees with unknown source locations, for
 * building trees by hand. Meant to be statically imported.
 */
public class ElmBuilder {
	private ElmBuilder() {}

	private static SourceLocation loc() {
		return SourceLocation.unknown();
	}

	// module structure

	public static ElmModule module(ElmModuleHeader header, ElmDocComment docComment, List<ElmImport> imports,
	                               List<ElmDeclaration> declarations) {
		return new ElmModule(loc(), header, docComment, imports, declarations);
	}

	public static ElmModuleHeader moduleHeader(String name, ElmExposing exposing) {
		return new ElmPlainModuleHeader(loc(), name, exposing);
	}

	public static ElmModuleHeader portModuleHeader(String name, ElmExposing exposing) {
		return new ElmPortModuleHeader(loc(), name, exposing);
	}

	public static ElmModuleHeader effectModuleHeader(String name, List<ElmEffectManagerField> fields,
	                                                 ElmExposing exposing) {
		return new ElmEffectModuleHeader(loc(), name, fields, exposing);
	}

	public static ElmEffectManagerField managerField(String kind, String typeName) {
		return new ElmEffectManagerField(loc(), kind, typeName);
	}

	public static ElmDocComment docComment(String text) {
		return new ElmDocComment(loc(), text);
	}

	public static ElmImport importModule(String name) {
		return new ElmImport(loc(), name, null, null);
	}

	public static ElmImport importModule(String name, String alias, ElmExposing exposing) {
		return new ElmImport(loc(), name, alias, exposing);
	}

	public static List<ElmImport> imports(ElmImport... imports) {
		return Arrays.asList(imports);
	}

	public static ElmExposing exposingAll() {
		return new ElmExposingAll(loc());
	}

	public static ElmExposing exposing(ElmExposedItem... items) {
		return new ElmExposingList(loc(), Arrays.asList(items));
	}

	public static ElmExposedItem exposedValue(String name) {
		return new ElmExposedValue(loc(), name);
	}

	public static ElmExposedItem exposedType(String name) {
		return new ElmExposedType(loc(), name, false);
	}

	public static ElmExposedItem exposedTypeWithConstructors(String name) {
		return new ElmExposedType(loc(), name, true);
	}

	public static ElmExposedItem exposedOperator(String symbol) {
		return new ElmExposedOperator(loc(), symbol);
	}

	// declarations

	public static List<ElmDeclaration> decls(ElmDeclaration... declarations) {
		return Arrays.asList(declarations);
	}

	public static ElmFunctionDeclaration function(String name, List<ElmPattern> arguments, ElmExpression body) {
		return new ElmFunctionDeclaration(loc(), null, null, name, arguments, body);
	}

	public static ElmFunctionDeclaration function(ElmDocComment docComment, ElmType signature, String name,
	                                              List<ElmPattern> arguments, ElmExpression body) {
		ElmTypeSignature sig = signature == null ? null : new ElmTypeSignature(loc(), name, signature);
		return new ElmFunctionDeclaration(loc(), docComment, sig, name, arguments, body);
	}

	public static ElmTypeAlias typeAlias(String name, List<String> typeVariables, ElmType type) {
		return new ElmTypeAlias(loc(), null, name, typeVariables, type);
	}

	public static ElmCustomType customType(String name, List<String> typeVariables,
	                                       ElmValueConstructor... constructors) {
		return new ElmCustomType(loc(), null, name, typeVariables, Arrays.asList(constructors));
	}

	public static ElmValueConstructor constructor(String name, ElmType... arguments) {
		return new ElmValueConstructor(loc(), name, Arrays.asList(arguments));
	}

	public static ElmPortDeclaration port(String name, ElmType type) {
		return new ElmPortDeclaration(loc(), null, name, type);
	}

	public static ElmInfixDeclaration infix(Associativity associativity, int precedence, String operator,
	                                        String function) {
		return new ElmInfixDeclaration(loc(), associativity, precedence, operator, function);
	}

	public static ElmDestructuring destructure(ElmPattern pattern, ElmExpression body) {
		return new ElmDestructuring(loc(), pattern, body);
	}

	public static ElmTopLevelComment lineComment(String... lines) {
		return new ElmTopLevelComment(loc(), Arrays.asList(lines));
	}

	public static List<String> vars(String... names) {
		return Arrays.asList(names);
	}

	// patterns

	public static List<ElmPattern> args(ElmPattern... patterns) {
		return Arrays.asList(patterns);
	}

	public static ElmPattern pwild() {
		return new ElmWildcardPattern(loc());
	}

	public static ElmPattern pvar(String name) {
		return new ElmVariablePattern(loc(), name);
	}

	public static ElmPattern plit(ElmLiteral literal) {
		return new ElmLiteralPattern(loc(), literal);
	}

	public static ElmPattern punit() {
		return new ElmUnitPattern(loc());
	}

	public static ElmPattern ptuple(ElmPattern... elements) {
		return new ElmTuplePattern(loc(), Arrays.asList(elements));
	}

	public static ElmPattern plist(ElmPattern... elements) {
		return new ElmListPattern(loc(), Arrays.asList(elements));
	}

	public static ElmPattern pcons(ElmPattern head, ElmPattern tail) {
		return new ElmConsPattern(loc(), head, tail);
	}

	public static ElmPattern precord(String... fields) {
		return new ElmRecordPattern(loc(), Arrays.asList(fields));
	}

	public static ElmPattern pctor(String name, ElmPattern... arguments) {
		return new ElmConstructorPattern(loc(), null, name, Arrays.asList(arguments));
	}

	public static ElmPattern pctor(String moduleQualifier, String name, ElmPattern... arguments) {
		return new ElmConstructorPattern(loc(), moduleQualifier, name, Arrays.asList(arguments));
	}

	public static ElmPattern palias(ElmPattern pattern, String name) {
		return new ElmAliasPattern(loc(), pattern, name);
	}

	public static ElmPattern pparen(ElmPattern pattern) {
		return new ElmParenthesizedPattern(loc(), pattern);
	}

	// expressions

	public static ElmStringLiteral str(String value) {
		return new ElmStringLiteral(loc(), value, ElmStringLiteral.Quoting.SINGLE);
	}

	public static ElmStringLiteral multilineStr(String value) {
		return new ElmStringLiteral(loc(), value, ElmStringLiteral.Quoting.TRIPLE);
	}

	public static ElmCharLiteral chr(String value) {
		return new ElmCharLiteral(loc(), value);
	}

	public static ElmNumberLiteral num(int value) {
		return new ElmNumberLiteral(loc(), Integer.toString(value), ElmNumberLiteral.Base.DECIMAL);
	}

	public static ElmNumberLiteral num(String text, ElmNumberLiteral.Base base) {
		return new ElmNumberLiteral(loc(), text, base);
	}

	public static ElmExpression unit() {
		return new ElmUnit(loc());
	}

	public static ElmExpression var(String name) {
		return new ElmVariable(loc(), null, name);
	}

	public static ElmExpression qvar(String moduleQualifier, String name) {
		return new ElmVariable(loc(), moduleQualifier, name);
	}

	public static ElmExpression app(ElmExpression function, ElmExpression... arguments) {
		return new ElmApplication(loc(), function, Arrays.asList(arguments));
	}

	public static ElmExpression binop(String operator, ElmExpression lhs, ElmExpression rhs) {
		return new ElmBinaryOperation(loc(), operator, lhs, rhs);
	}

	public static ElmExpression negate(ElmExpression operand) {
		return new ElmNegation(loc(), operand);
	}

	public static ElmExpression prefixOp(String symbol) {
		return new ElmPrefixOperator(loc(), symbol);
	}

	public static ElmExpression tuple(ElmExpression... elements) {
		return new ElmTuple(loc(), Arrays.asList(elements));
	}

	public static ElmExpression list(ElmExpression... elements) {
		return new ElmList(loc(), Arrays.asList(elements));
	}

	public static ElmRecordField field(String name, ElmExpression value) {
		return new ElmRecordField(loc(), name, value);
	}

	public static ElmExpression record(ElmRecordField... fields) {
		return new ElmRecord(loc(), Arrays.asList(fields));
	}

	public static ElmExpression recordUpdate(String record, ElmRecordField... fields) {
		return new ElmRecordUpdate(loc(), record, Arrays.asList(fields));
	}

	public static ElmExpression access(ElmExpression record, String field) {
		return new ElmRecordAccess(loc(), record, field);
	}

	public static ElmExpression accessor(String field) {
		return new ElmRecordAccessFunction(loc(), field);
	}

	public static ElmExpression lambda(List<ElmPattern> arguments, ElmExpression body) {
		return new ElmLambda(loc(), arguments, body);
	}

	public static ElmExpression let(List<ElmDeclaration> declarations, ElmExpression body) {
		return new ElmLet(loc(), declarations, body);
	}

	public static ElmCaseBranch branch(ElmPattern pattern, ElmExpression body) {
		return new ElmCaseBranch(loc(), pattern, body);
	}

	public static ElmExpression caseOf(ElmExpression subject, ElmCaseBranch... branches) {
		return new ElmCase(loc(), subject, Arrays.asList(branches));
	}

	public static ElmExpression ifThenElse(ElmExpression condition, ElmExpression then, ElmExpression otherwise) {
		return new ElmIf(loc(), Collections.singletonList(new ElmIfBranch(loc(), condition, then)), otherwise);
	}

	public static ElmIfBranch elseIf(ElmExpression condition, ElmExpression then) {
		return new ElmIfBranch(loc(), condition, then);
	}

	public static ElmExpression ifChain(List<ElmIfBranch> branches, ElmExpression otherwise) {
		return new ElmIf(loc(), branches, otherwise);
	}

	public static ElmExpression paren(ElmExpression expression) {
		return new ElmParenthesized(loc(), expression);
	}

	public static ElmExpression glsl(String code) {
		return new ElmGlsl(loc(), code);
	}

	// types

	public static ElmType tvar(String name) {
		return new ElmTypeVariable(loc(), name);
	}

	public static ElmType tcon(String name, ElmType... arguments) {
		return new ElmTypeConstructor(loc(), null, name, Arrays.asList(arguments));
	}

	public static ElmType qtcon(String moduleQualifier, String name, ElmType... arguments) {
		return new ElmTypeConstructor(loc(), moduleQualifier, name, Arrays.asList(arguments));
	}

	public static ElmType tfun(ElmType from, ElmType to) {
		return new ElmFunctionType(loc(), from, to);
	}

	/**
	 * Builds {@code a -> b -> c} from {@code a, b, c}, nesting to the right.
	 */
	public static ElmType tfuns(ElmType... types) {
		ElmType result = types[types.length - 1];
		for (int i = types.length - 2; i >= 0; i--) {
			result = tfun(types[i], result);
		}
		return result;
	}

	public static ElmType ttuple(ElmType... elements) {
		return new ElmTupleType(loc(), Arrays.asList(elements));
	}

	public static ElmType tunit() {
		return new ElmUnitType(loc());
	}

	public static ElmRecordFieldType tfield(String name, ElmType type) {
		return new ElmRecordFieldType(loc(), name, type);
	}

	public static ElmType trecord(ElmRecordFieldType... fields) {
		return new ElmRecordType(loc(), null, Arrays.asList(fields));
	}

	public static ElmType textensible(String extendedVariable, ElmRecordFieldType... fields) {
		return new ElmRecordType(loc(), extendedVariable, Arrays.asList(fields));
	}
}

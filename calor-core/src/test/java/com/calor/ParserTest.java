package com.calor;

import com.calor.ast.*;
import com.calor.catalog.OperatorCatalog;
import com.calor.diagnostics.Diagnostic;
import com.calor.diagnostics.DiagnosticCode;
import com.calor.diagnostics.SyntaxErrorException;
import com.calor.diagnostics.TextEdit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end parsing of small modules: tree shape, id matching and recovery.
 */
public class ParserTest {

    private static String module(String... lines) {
        return "§M{m1:Test}\n" + String.join("\n", lines) + "\n§/M{m1}";
    }

    /**
     * A single public function {@code f1} returning {@code expr}.
     */
    private static String returning(String expr) {
        return module("§F{f1:Check:pub}", "§O{i32}", "§R " + expr, "§/F{f1}");
    }

    private static Expression returnedExpression(ParseResult result) {
        FunctionDefinition function = result.program().functions().get(0);
        return ((ReturnStatement) function.body().get(0)).expression();
    }

    private static List<String> codes(ParseResult result) {
        return result.diagnostics().getDiagnostics().stream().map(Diagnostic::code).collect(Collectors.toList());
    }

    @Test
    @DisplayName("Add function: header, parameters, output and return")
    void testAddFunction() {
        ParseResult result = Parser.parseSource(module(
            "§F{f1:Add:pub}",
            "  §I{i32:a}",
            "  §I{i32:b}",
            "  §O{i32}",
            "  §R (+ a b)",
            "§/F{f1}"));

        assertTrue(result.diagnostics().isEmpty(), () -> result.diagnostics().getDiagnostics().toString());
        Program program = result.program();
        assertEquals("m1", program.id());
        assertEquals("Test", program.name());
        assertEquals(1, program.functions().size());

        FunctionDefinition add = program.functions().get(0);
        assertEquals("f1", add.id());
        assertEquals("Add", add.name());
        assertEquals(Visibility.PUBLIC, add.visibility());
        assertFalse(add.async());
        assertEquals(2, add.parameters().size());
        assertEquals("a", add.parameters().get(0).name());
        assertEquals("INT", add.parameters().get(0).typeName());
        assertEquals("b", add.parameters().get(1).name());
        assertEquals("INT", add.parameters().get(1).typeName());
        assertEquals("INT", add.output().typeName());

        assertEquals(1, add.body().size());
        ReturnStatement ret = assertInstanceOf(ReturnStatement.class, add.body().get(0));
        BinaryOperation sum = assertInstanceOf(BinaryOperation.class, ret.expression());
        assertEquals(BinaryOperator.ADD, sum.operator());
        assertEquals("a", ((Reference) sum.left()).name());
        assertEquals("b", ((Reference) sum.right()).name());
    }

    @Test
    @DisplayName("(+ 1 2 3) folds to the left")
    void testLeftAssociativeChain() {
        ParseResult result = Parser.parseSource(returning("(+ 1 2 3)"));

        assertFalse(result.hasErrors());
        BinaryOperation outer = assertInstanceOf(BinaryOperation.class, returnedExpression(result));
        assertEquals(BinaryOperator.ADD, outer.operator());
        assertEquals(3, ((IntLiteral) outer.right()).value());

        BinaryOperation inner = assertInstanceOf(BinaryOperation.class, outer.left());
        assertEquals(1, ((IntLiteral) inner.left()).value());
        assertEquals(2, ((IntLiteral) inner.right()).value());
    }

    @Test
    @DisplayName("Nested prefix expressions and word operators")
    void testNestedPrefix() {
        ParseResult result = Parser.parseSource(returning("(and (> x 0) (not done))"));

        assertFalse(result.hasErrors());
        BinaryOperation and = assertInstanceOf(BinaryOperation.class, returnedExpression(result));
        assertEquals(BinaryOperator.AND, and.operator());
        assertEquals(BinaryOperator.GREATER_THAN, ((BinaryOperation) and.left()).operator());
        UnaryOperation not = assertInstanceOf(UnaryOperation.class, and.right());
        assertEquals(UnaryOperator.NOT, not.operator());
    }

    @Test
    @DisplayName("Matching ids produce no mismatch diagnostic")
    void testMatchingIds() {
        ParseResult result = Parser.parseSource(module(
            "§F{f1:Loop:pub}",
            "§L{l1:i:0:10}",
            "  §P i",
            "§/L{l1}",
            "§WH{w1} (< i 3)",
            "  §BK",
            "§/WH{w1}",
            "§/F{f1}"));

        assertFalse(codes(result).contains(DiagnosticCode.MISMATCHED_ID), () -> codes(result).toString());
        assertTrue(result.diagnostics().isEmpty(), () -> result.diagnostics().getDiagnostics().toString());
    }

    @Test
    @DisplayName("Differing close id: one diagnostic, open id kept")
    void testFunctionIdMismatch() {
        ParseResult result = Parser.parseSource(module(
            "§F{f1:Add:pub}",
            "§R 1",
            "§/F{f2}"));

        assertEquals(List.of(DiagnosticCode.MISMATCHED_ID), codes(result));
        assertEquals("f1", result.program().functions().get(0).id());
    }

    @Test
    @DisplayName("Try block t1 closed as t2")
    void testTryIdMismatch() {
        ParseResult result = Parser.parseSource(module(
            "§F{f1:Run:pub}",
            "§TR{t1}",
            "  §P \"hi\"",
            "§/TR{t2}",
            "§/F{f1}"));

        FunctionDefinition run = result.program().functions().get(0);
        TryStatement tryStatement = assertInstanceOf(TryStatement.class, run.body().get(0));
        assertEquals("t1", tryStatement.id());

        assertEquals(1, result.diagnostics().size());
        Diagnostic diagnostic = result.diagnostics().getDiagnostics().get(0);
        assertEquals(DiagnosticCode.MISMATCHED_ID, diagnostic.code());
        assertTrue(diagnostic.message().contains("t1"), diagnostic.message());
        assertTrue(diagnostic.message().contains("t2"), diagnostic.message());
        assertTrue(diagnostic.hasFix());
        assertEquals("t1", diagnostic.fix().edits().get(0).newText());
    }

    @Test
    @DisplayName("Missing close tag is reported once, without an id mismatch")
    void testMissingCloseTag() {
        ParseResult result = Parser.parseSource("§M{m1:Test}\n§F{f1:Run:pub}\n§R 1\n§/F{f1}\n");

        assertEquals(List.of(DiagnosticCode.UNEXPECTED_TOKEN), codes(result));
        assertEquals("m1", result.program().id());
        assertEquals(1, result.program().functions().size());
    }

    @Test
    @DisplayName("(forall () body) keeps parsing with a dummy binding")
    void testForallWithoutBindings() {
        ParseResult result = Parser.parseSource(returning("(forall () flag)"));

        assertEquals(List.of(DiagnosticCode.QUANTIFIER_NO_BOUND_VARS), codes(result));
        QuantifierExpression forall = assertInstanceOf(QuantifierExpression.class, returnedExpression(result));
        assertEquals(QuantifierKind.FORALL, forall.kind());
        assertEquals(1, forall.boundVariables().size());
        assertEquals("_dummy", forall.boundVariables().get(0).name());
        assertEquals("flag", ((Reference) forall.body()).name());
    }

    @Test
    @DisplayName("Quantifier with typed bindings")
    void testForallWithBindings() {
        ParseResult result = Parser.parseSource(returning("(forall ((x i32) (y i32)) (>= (+ x y) x))"));

        assertFalse(result.hasErrors(), () -> codes(result).toString());
        QuantifierExpression forall = assertInstanceOf(QuantifierExpression.class, returnedExpression(result));
        assertEquals(List.of("x", "y"),
            forall.boundVariables().stream().map(QuantifierVariable::name).collect(Collectors.toList()));
        assertInstanceOf(BinaryOperation.class, forall.body());
    }

    @Test
    @DisplayName("Misspelled operator gets a replacement fix")
    void testOperatorTypoFix() {
        ParseResult result = Parser.parseSource(returning("(contans name \"x\")"));

        assertEquals(1, result.diagnostics().size());
        Diagnostic diagnostic = result.diagnostics().getDiagnostics().get(0);
        assertEquals(DiagnosticCode.INVALID_OPERATOR, diagnostic.code());
        assertTrue(diagnostic.message().contains("Did you mean 'contains'?"), diagnostic.message());
        assertEquals("contains", diagnostic.fix().edits().get(0).newText());
        assertEquals("name", ((Reference) returnedExpression(result)).name());
    }

    @Test
    @DisplayName("Infix order is pointed out")
    void testInfixHint() {
        ParseResult result = Parser.parseSource(returning("(1 + 2)"));

        assertTrue(result.hasErrors());
        Diagnostic first = result.diagnostics().getDiagnostics().get(0);
        assertEquals(DiagnosticCode.INVALID_LISP_EXPRESSION, first.code());
        assertTrue(first.message().contains("(+ 1 2) not (1 + 2)"));
    }

    @Test
    @DisplayName("Loop bound written as an embedded expression")
    void testEmbeddedLoopBound() {
        ParseResult result = Parser.parseSource(module(
            "§F{f1:Loop:pub}",
            "§L{l1:i:0:(- n 1)}",
            "  §P i",
            "§/L{l1}",
            "§/F{f1}"));

        assertTrue(result.diagnostics().isEmpty(), () -> codes(result).toString());
        ForStatement loop = assertInstanceOf(ForStatement.class, result.program().functions().get(0).body().get(0));
        assertEquals("i", loop.variable());
        assertEquals(0, ((IntLiteral) loop.from()).value());
        BinaryOperation to = assertInstanceOf(BinaryOperation.class, loop.to());
        assertEquals(BinaryOperator.SUBTRACT, to.operator());
        assertEquals(1, ((IntLiteral) loop.step()).value());
    }

    @Test
    @DisplayName("Malformed embedded expression degrades to a reference")
    void testMalformedEmbeddedExpression() {
        ParseResult result = Parser.parseSource(module(
            "§F{f1:Loop:pub}",
            "§L{l1:i:0:(+ n)}",
            "§/L{l1}",
            "§/F{f1}"));

        assertTrue(result.hasErrors());
        ForStatement loop = assertInstanceOf(ForStatement.class, result.program().functions().get(0).body().get(0));
        Reference to = assertInstanceOf(Reference.class, loop.to());
        assertEquals("+ n", to.name());
    }

    @Test
    @DisplayName("Unknown statement start is skipped")
    void testUnknownStatementRecovery() {
        ParseResult result = Parser.parseSource(module(
            "§F{f1:Run:pub}",
            "42",
            "§R 1",
            "§/F{f1}"));

        assertEquals(List.of(DiagnosticCode.UNEXPECTED_TOKEN), codes(result));
        assertEquals(1, result.program().functions().get(0).body().size());
    }

    @Test
    @DisplayName("Missing module name is reported")
    void testMissingModuleName() {
        ParseResult result = Parser.parseSource("§M{m1}\n§/M{m1}");
        assertEquals(List.of(DiagnosticCode.MISSING_REQUIRED_ATTRIBUTE), codes(result));
        assertEquals("", result.program().name());
    }

    @Test
    @DisplayName("Inline and block call statements")
    void testCalls() {
        ParseResult result = Parser.parseSource(module(
            "§F{f1:Run:pub}",
            "§C{Console.WriteLine} \"one\"",
            "§C{Math.Max}",
            "  §A 1",
            "  §A 2",
            "§/C",
            "§/F{f1}"));

        assertTrue(result.diagnostics().isEmpty(), () -> codes(result).toString());
        List<Statement> body = result.program().functions().get(0).body();
        CallStatement inline = assertInstanceOf(CallStatement.class, body.get(0));
        assertEquals("Console.WriteLine", inline.target());
        assertEquals(1, inline.arguments().size());
        CallStatement block = assertInstanceOf(CallStatement.class, body.get(1));
        assertEquals(2, block.arguments().size());
    }

    @Test
    @DisplayName("Binding with mutable marker and declared type")
    void testBind() {
        ParseResult result = Parser.parseSource(module(
            "§F{f1:Run:pub}",
            "§B{~count:i32} 0",
            "§/F{f1}"));

        assertTrue(result.diagnostics().isEmpty(), () -> codes(result).toString());
        BindStatement bind = assertInstanceOf(BindStatement.class, result.program().functions().get(0).body().get(0));
        assertEquals("count", bind.name());
        assertTrue(bind.mutable());
        assertEquals("INT", bind.typeName());
    }

    @Test
    @DisplayName("If statement with else-if and else branches")
    void testIfStatement() {
        ParseResult result = Parser.parseSource(module(
            "§F{f1:Sign:pub}",
            "§I{i32:n}",
            "§O{i32}",
            "§IF{if1} (> n 0) → §R 1",
            "§EI (< n 0) → §R -1",
            "§EL → §R 0",
            "§/I{if1}",
            "§/F{f1}"));

        assertTrue(result.diagnostics().isEmpty(), () -> codes(result).toString());
        IfStatement ifStatement = assertInstanceOf(IfStatement.class,
            result.program().functions().get(0).body().get(0));
        assertEquals("if1", ifStatement.id());
        assertEquals(1, ifStatement.thenBody().size());
        assertEquals(1, ifStatement.elseIfClauses().size());
        assertEquals(1, ifStatement.elseBody().size());
    }

    @Test
    @DisplayName("parseOrThrow raises on errors and returns the tree otherwise")
    void testParseOrThrow() {
        SyntaxErrorException e = assertThrows(SyntaxErrorException.class,
            () -> Parser.parseOrThrow(returning("(forall () flag)")));
        assertEquals(1, e.getDiagnostics().size());
        assertTrue(e.getMessage().contains(DiagnosticCode.QUANTIFIER_NO_BOUND_VARS));

        Program program = Parser.parseOrThrow(returning("(* 2 3)"));
        assertEquals(1, program.functions().size());
    }

    @Test
    @DisplayName("File path from options is stamped on diagnostics")
    void testFilePath() {
        ParseResult result = Parser.parseSource("§M{m1}\n§/M{m1}", new ParserOptions("src/demo.calr"));
        assertEquals("src/demo.calr", result.diagnostics().getDiagnostics().get(0).filePath());
    }

    @Test
    @DisplayName("Embedded expression spans point into the source file")
    void testEmbeddedExpressionSpan() {
        String source = module(
            "§F{f1:Loop:pub}",
            "§L{l1:i:0:(- n 1)}",
            "§/L{l1}",
            "§/F{f1}");
        ParseResult result = Parser.parseSource(source);

        assertTrue(result.diagnostics().isEmpty(), () -> codes(result).toString());
        ForStatement loop = (ForStatement) result.program().functions().get(0).body().get(0);
        TextSpan span = loop.to().span();
        assertEquals(3, span.line());
        assertEquals(11, span.column());
        assertEquals(source.indexOf("(- n 1)"), span.start());
        assertEquals("(- n 1)".length(), span.length());
    }

    @Test
    @DisplayName("Operator fix inside an embedded expression edits the right column")
    void testEmbeddedExpressionFixLocation() {
        ParseResult result = Parser.parseSource(module(
            "§F{f1:Loop:pub}",
            "§L{l1:i:0:(modd n 2)}",
            "§/L{l1}",
            "§/F{f1}"));

        Diagnostic diagnostic = result.diagnostics().getDiagnostics().get(0);
        assertEquals(DiagnosticCode.INVALID_OPERATOR, diagnostic.code());
        assertEquals(3, diagnostic.span().line());
        assertEquals(12, diagnostic.span().column());
        TextEdit edit = diagnostic.fix().edits().get(0);
        assertEquals(3, edit.startLine());
        assertEquals(12, edit.startColumn());
        assertEquals(16, edit.endColumn());
        assertEquals("mod", edit.newText());
    }

    @Test
    @DisplayName("Unknown tag with attributes at module level is reported once")
    void testUnknownTagReportedOnce() {
        ParseResult result = Parser.parseSource(module(
            "§FUNCTION{f1:Run:pub}",
            "  §I{i32:a}",
            "  §R a",
            "§/F{f1}"));

        assertEquals(List.of(DiagnosticCode.UNKNOWN_SECTION_MARKER), codes(result));
        assertEquals("m1", result.program().id());
    }

    @Test
    @DisplayName("Unknown tag inside a function body is reported once")
    void testUnknownTagInBody() {
        ParseResult result = Parser.parseSource(module(
            "§F{f1:Run:pub}",
            "§FUNCTION{f2:Other}",
            "§R 1",
            "§/F{f1}"));

        assertEquals(List.of(DiagnosticCode.UNKNOWN_SECTION_MARKER), codes(result));
        assertEquals(1, result.program().functions().get(0).body().size());
    }

    @Test
    @DisplayName("A run of stray tokens gives a single diagnostic")
    void testStrayTokenRun() {
        ParseResult result = Parser.parseSource(module(
            "§F{f1:Run:pub}",
            "42 43 44",
            "§R 1",
            "§/F{f1}"));

        assertEquals(List.of(DiagnosticCode.UNEXPECTED_TOKEN), codes(result));
        assertEquals(1, result.program().functions().get(0).body().size());
    }

    @Test
    @DisplayName("Function left open before the module close tag")
    void testFunctionOpenAtModuleEnd() {
        ParseResult result = Parser.parseSource("§M{m1:Test}\n§F{f1:Run:pub}\n§R 1\n§/M{m1}");

        assertEquals(List.of(DiagnosticCode.UNEXPECTED_TOKEN), codes(result));
        assertEquals(1, result.program().functions().size());
        assertEquals(1, result.program().functions().get(0).body().size());
    }

    @Test
    @DisplayName("typeof, is and as read nested generics closed by >>")
    void testTypeOperatorsWithNestedGenerics() {
        ParseResult typeOf = Parser.parseSource(returning("(typeof List<List<i32>>)"));
        assertTrue(typeOf.diagnostics().isEmpty(), () -> codes(typeOf).toString());
        assertEquals("List<List<i32>>", ((TypeOfExpression) returnedExpression(typeOf)).typeName());

        ParseResult is = Parser.parseSource(returning("(is x Dictionary<str, List<i32>>)"));
        assertTrue(is.diagnostics().isEmpty(), () -> codes(is).toString());
        IsPatternExpression pattern = (IsPatternExpression) returnedExpression(is);
        assertEquals("x", ((Reference) pattern.operand()).name());
        assertEquals("Dictionary<str, List<i32>>", pattern.typeName());
        assertNull(pattern.variableName());

        ParseResult as = Parser.parseSource(returning("(as x List<List<i32>>)"));
        assertTrue(as.diagnostics().isEmpty(), () -> codes(as).toString());
        TypeOperation operation = (TypeOperation) returnedExpression(as);
        assertEquals(TypeOp.AS, operation.operation());
        assertEquals("List<List<i32>>", operation.targetType());
    }

    @Test
    @DisplayName("A single >> closing one level ends the type name")
    void testTypeNameWithStrayClose() {
        ParseResult result = Parser.parseSource(returning("(typeof List<i32>>)"));

        assertEquals("List<i32>", ((TypeOfExpression) returnedExpression(result)).typeName());
    }

    @Test
    @DisplayName("cast takes a type name then one operand")
    void testCast() {
        ParseResult result = Parser.parseSource(returning("(cast List<List<i32>> x)"));

        assertTrue(result.diagnostics().isEmpty(), () -> codes(result).toString());
        TypeOperation cast = assertInstanceOf(TypeOperation.class, returnedExpression(result));
        assertEquals(TypeOp.CAST, cast.operation());
        assertEquals("List<List<i32>>", cast.targetType());
        assertEquals("x", ((Reference) cast.operand()).name());

        ParseResult missing = Parser.parseSource(returning("(cast i32)"));
        assertEquals(List.of(DiagnosticCode.OPERATOR_ARGUMENT_COUNT), codes(missing));
        assertEquals(0, ((IntLiteral) returnedExpression(missing)).value());
    }

    @Test
    @DisplayName("Conditional and null-coalescing check their operand counts")
    void testConditionalArity() {
        ParseResult conditional = Parser.parseSource(returning("(? c a b)"));
        assertTrue(conditional.diagnostics().isEmpty(), () -> codes(conditional).toString());
        ConditionalExpression choice = assertInstanceOf(ConditionalExpression.class, returnedExpression(conditional));
        assertEquals("c", ((Reference) choice.condition()).name());
        assertEquals("a", ((Reference) choice.whenTrue()).name());
        assertEquals("b", ((Reference) choice.whenFalse()).name());

        ParseResult shortConditional = Parser.parseSource(returning("(? a b)"));
        assertEquals(List.of(DiagnosticCode.OPERATOR_ARGUMENT_COUNT), codes(shortConditional));
        assertFalse(shortConditional.diagnostics().getDiagnostics().get(0).hasFix());
        assertEquals("a", ((Reference) returnedExpression(shortConditional)).name());

        ParseResult coalesce = Parser.parseSource(returning("(?? a b)"));
        assertInstanceOf(NullCoalesce.class, returnedExpression(coalesce));

        ParseResult shortCoalesce = Parser.parseSource(returning("(?? a)"));
        assertEquals(List.of(DiagnosticCode.OPERATOR_ARGUMENT_COUNT), codes(shortCoalesce));
    }

    @Test
    @DisplayName("Comparison mode keyword on string operations")
    void testComparisonMode() {
        ParseResult accepted = Parser.parseSource(returning("(contains s \"x\" :ignore-case)"));
        assertTrue(accepted.diagnostics().isEmpty(), () -> codes(accepted).toString());
        StringOperation contains = (StringOperation) returnedExpression(accepted);
        assertEquals(StringOp.CONTAINS, contains.operation());
        assertEquals(StringComparisonMode.IGNORE_CASE, contains.comparisonMode());
        assertEquals(2, contains.arguments().size());

        ParseResult rejected = Parser.parseSource(returning("(upper s :ignore-case)"));
        assertEquals(List.of(DiagnosticCode.INVALID_COMPARISON_MODE), codes(rejected));
        StringOperation upper = (StringOperation) returnedExpression(rejected);
        assertNull(upper.comparisonMode());
        assertEquals(1, upper.arguments().size());

        ParseResult unknown = Parser.parseSource(returning("(contains s \"x\" :loose)"));
        assertEquals(List.of(DiagnosticCode.INVALID_COMPARISON_MODE), codes(unknown));
    }

    @Test
    @DisplayName("char-lit needs exactly one character")
    void testCharLiteralLength() {
        ParseResult single = Parser.parseSource(returning("(char-lit \"Y\")"));
        assertTrue(single.diagnostics().isEmpty(), () -> codes(single).toString());
        assertEquals(CharOp.CHAR_LITERAL, ((CharOperation) returnedExpression(single)).operation());

        ParseResult twoChars = Parser.parseSource(returning("(char-lit \"ab\")"));
        assertEquals(List.of(DiagnosticCode.INVALID_CHAR_LITERAL), codes(twoChars));
        assertTrue(twoChars.diagnostics().getDiagnostics().get(0).message().contains("2 characters"));
    }

    @Test
    @DisplayName("substr with a start only, with start and length, and with too few arguments")
    void testSubstringForms() {
        ParseResult from = Parser.parseSource(returning("(substr s 1)"));
        assertTrue(from.diagnostics().isEmpty(), () -> codes(from).toString());
        assertEquals(StringOp.SUBSTRING_FROM, ((StringOperation) returnedExpression(from)).operation());

        ParseResult range = Parser.parseSource(returning("(substr s 1 2)"));
        assertTrue(range.diagnostics().isEmpty(), () -> codes(range).toString());
        assertEquals(StringOp.SUBSTRING, ((StringOperation) returnedExpression(range)).operation());

        ParseResult tooFew = Parser.parseSource(returning("(substr s)"));
        assertEquals(List.of(DiagnosticCode.OPERATOR_ARGUMENT_COUNT), codes(tooFew));
    }

    @Test
    @DisplayName("Unary operators by symbol and by name, in any case")
    void testUnaryForms() {
        assertUnary("(- x)", UnaryOperator.NEGATE);
        assertUnary("(neg x)", UnaryOperator.NEGATE);
        assertUnary("(NEGATE x)", UnaryOperator.NEGATE);
        assertUnary("(++ x)", UnaryOperator.PRE_INCREMENT);
        assertUnary("(-- x)", UnaryOperator.PRE_DECREMENT);
        assertUnary("(post-inc x)", UnaryOperator.POST_INCREMENT);
        assertUnary("(NOT x)", UnaryOperator.NOT);
        assertUnary("(BNOT x)", UnaryOperator.BITWISE_NOT);
        assertUnary("(~ x)", UnaryOperator.BITWISE_NOT);
    }

    private static void assertUnary(String expr, UnaryOperator expected) {
        ParseResult result = Parser.parseSource(returning(expr));
        assertTrue(result.diagnostics().isEmpty(), () -> expr + " " + codes(result));
        UnaryOperation unary = assertInstanceOf(UnaryOperation.class, returnedExpression(result), expr);
        assertEquals(expected, unary.operator(), expr);
        assertEquals("x", ((Reference) unary.operand()).name());
    }

    @Test
    @DisplayName("Foreign method name gets its hint instead of a typo fix")
    void testForeignHintBeforeTypoFix() {
        assertNotNull(OperatorCatalog.findSimilarOperator("ToLower"));

        ParseResult result = Parser.parseSource(returning("(ToLower s)"));

        assertEquals(List.of(DiagnosticCode.INVALID_OPERATOR), codes(result));
        Diagnostic diagnostic = result.diagnostics().getDiagnostics().get(0);
        assertTrue(diagnostic.message().contains("(lower s)"), diagnostic.message());
        assertFalse(diagnostic.hasFix());
    }

    @Test
    @DisplayName("Generic parameter types closed by >>")
    void testGenericParameterTypes() {
        ParseResult result = Parser.parseSource(module(
            "§F{f1:Sum:pub}",
            "  §I{List<List<i32>>:grid}",
            "  §I{List<i32>>:row}",
            "  §O{i32}",
            "  §R 0",
            "§/F{f1}"));

        List<Parameter> parameters = result.program().functions().get(0).parameters();
        assertEquals("List<List<i32>>", parameters.get(0).typeName());
        assertEquals("grid", parameters.get(0).name());
        assertEquals("List<i32>", parameters.get(1).typeName());
        assertEquals("row", parameters.get(1).name());
    }

    @Test
    @DisplayName("Tree lists cannot be modified after parsing")
    void testTreeListsAreImmutable() {
        ParseResult result = Parser.parseSource(returning("(+ a b)"));
        Program program = result.program();
        FunctionDefinition function = program.functions().get(0);

        assertThrows(UnsupportedOperationException.class, () -> program.functions().add(function));
        assertThrows(UnsupportedOperationException.class, () -> function.body().clear());
        assertThrows(UnsupportedOperationException.class, () -> function.parameters().add(null));
    }
}

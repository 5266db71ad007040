package com.calor;

import com.calor.ast.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Statement bodies: match, collections, exceptions, lambdas and function metadata.
 */
public class ParserStatementTest {

    private static FunctionDefinition parseFunction(String... lines) {
        String source = "§M{m1:Test}\n" + String.join("\n", lines) + "\n§/M{m1}";
        ParseResult result = Parser.parseSource(source);
        assertTrue(result.diagnostics().isEmpty(), () -> result.diagnostics().getDiagnostics().toString());
        return result.program().functions().get(0);
    }

    private static List<Statement> body(String... statements) {
        String[] lines = new String[statements.length + 2];
        lines[0] = "§F{f1:Run:pub}";
        System.arraycopy(statements, 0, lines, 1, statements.length);
        lines[lines.length - 1] = "§/F{f1}";
        return parseFunction(lines).body();
    }

    private static Expression returned(MatchCase matchCase) {
        return ((ReturnStatement) matchCase.body().get(0)).expression();
    }

    @Test
    @DisplayName("Match statement with literal, relational, list and wildcard cases")
    void testMatchStatement() {
        List<Statement> statements = body(
            "§W{m1} n",
            "  §K 0 → \"zero\"",
            "  §K gte 10 → \"big\"",
            "  §K §PLIST 1 §REST{tail} → \"one first\"",
            "  §K _ → \"other\"",
            "§/W{m1}");

        MatchStatement match = assertInstanceOf(MatchStatement.class, statements.get(0));
        assertEquals("m1", match.id());
        assertEquals("n", ((Reference) match.target()).name());
        assertEquals(4, match.cases().size());

        LiteralPattern zero = assertInstanceOf(LiteralPattern.class, match.cases().get(0).pattern());
        assertEquals(0, ((IntLiteral) zero.literal()).value());
        assertEquals("zero", ((StringLiteral) returned(match.cases().get(0))).value());

        RelationalPattern big = assertInstanceOf(RelationalPattern.class, match.cases().get(1).pattern());
        assertEquals(">=", big.operator());
        assertEquals(10, ((IntLiteral) big.value()).value());

        ListPattern list = assertInstanceOf(ListPattern.class, match.cases().get(2).pattern());
        assertEquals(1, list.patterns().size());
        assertEquals("tail", list.rest());

        assertInstanceOf(WildcardPattern.class, match.cases().get(3).pattern());
        assertNull(match.cases().get(3).guard());
    }

    @Test
    @DisplayName("List creation binds a typed list; push and clear name the collection")
    void testListStatements() {
        List<Statement> statements = body(
            "§LIST{names:str} \"a\" \"b\" §/LIST{names}",
            "§PUSH{names} \"c\"",
            "§CLR{names}");

        BindStatement bind = assertInstanceOf(BindStatement.class, statements.get(0));
        assertEquals("names", bind.name());
        assertEquals("List<str>", bind.typeName());
        ListCreation list = assertInstanceOf(ListCreation.class, bind.initializer());
        assertEquals(2, list.elements().size());

        CollectionPush push = assertInstanceOf(CollectionPush.class, statements.get(1));
        assertEquals("names", push.collection());
        assertEquals("c", ((StringLiteral) push.value()).value());

        assertEquals("names", assertInstanceOf(CollectionClear.class, statements.get(2)).collection());
    }

    @Test
    @DisplayName("Dictionary creation, put and key/value iteration")
    void testDictionaryStatements() {
        List<Statement> statements = body(
            "§DICT{ages:str:i32}",
            "  §KV \"bob\" 42",
            "§/DICT{ages}",
            "§PUT{ages} \"amy\" 7",
            "§EACHKV{e1:name:age} ages",
            "  §P name",
            "§/EACHKV{e1}");

        BindStatement bind = assertInstanceOf(BindStatement.class, statements.get(0));
        assertEquals("Dictionary<str,i32>", bind.typeName());
        DictionaryCreation dict = assertInstanceOf(DictionaryCreation.class, bind.initializer());
        assertEquals(1, dict.entries().size());
        assertEquals(42, ((IntLiteral) dict.entries().get(0).value()).value());

        DictionaryPut put = assertInstanceOf(DictionaryPut.class, statements.get(1));
        assertEquals("ages", put.dictionary());

        DictionaryForeach each = assertInstanceOf(DictionaryForeach.class, statements.get(2));
        assertEquals("e1", each.id());
        assertEquals("name", each.keyVariable());
        assertEquals("age", each.valueVariable());
        assertEquals(1, each.body().size());
        assertTrue(((PrintStatement) each.body().get(0)).writeLine());
    }

    @Test
    @DisplayName("Try with filtered catch, catch-all and finally")
    void testTryCatchFinally() {
        List<Statement> statements = body(
            "§TR{t1}",
            "  §P \"try\"",
            "§CA{IOException:ex} §WHEN flag",
            "  §P \"io\"",
            "§CA",
            "  §P \"any\"",
            "§FI",
            "  §P \"done\"",
            "§/TR{t1}");

        TryStatement tryStatement = assertInstanceOf(TryStatement.class, statements.get(0));
        assertEquals("t1", tryStatement.id());
        assertEquals(1, tryStatement.tryBody().size());
        assertEquals(2, tryStatement.catchClauses().size());

        CatchClause io = tryStatement.catchClauses().get(0);
        assertEquals("IOException", io.exceptionType());
        assertEquals("ex", io.variable());
        assertEquals("flag", ((Reference) io.filter()).name());

        CatchClause any = tryStatement.catchClauses().get(1);
        assertNull(any.exceptionType());
        assertNull(any.variable());
        assertNull(any.filter());

        assertNotNull(tryStatement.finallyBody());
        assertEquals(1, tryStatement.finallyBody().size());
    }

    @Test
    @DisplayName("Lambdas with an expression body and with a statement body")
    void testLambdas() {
        List<Statement> statements = body(
            "§B{double} §LAM{l1:x:i32} (* x 2) §/LAM{l1}",
            "§B{show} §LAM{l2:s:str} §P s §/LAM{l2}");

        LambdaExpression doubler = (LambdaExpression) ((BindStatement) statements.get(0)).initializer();
        assertEquals("l1", doubler.id());
        assertFalse(doubler.async());
        assertEquals(1, doubler.parameters().size());
        assertEquals("x", doubler.parameters().get(0).name());
        assertEquals("i32", doubler.parameters().get(0).typeName());
        BinaryOperation product = assertInstanceOf(BinaryOperation.class, doubler.expressionBody());
        assertEquals(BinaryOperator.MULTIPLY, product.operator());
        assertNull(doubler.statementBody());

        LambdaExpression show = (LambdaExpression) ((BindStatement) statements.get(1)).initializer();
        assertNull(show.expressionBody());
        assertEquals(1, show.statementBody().size());
        assertInstanceOf(PrintStatement.class, show.statementBody().get(0));
    }

    @Test
    @DisplayName("Function metadata sections are collected before the body")
    void testFunctionMetadata() {
        FunctionDefinition function = parseFunction(
            "§F{f1:Add:pub}",
            "  §I{i32:a}",
            "  §I{i32:b}",
            "  §O{i32}",
            "  §EX{ex1} (+ 1 2) → 3",
            "  §TD{t1:perf:high} \"Cache results\"",
            "  §US{Math.Abs:Logger}",
            "  §CX{O(n):O(1)}",
            "  §SN{\"1.2.0\"}",
            "  §R (+ a b)",
            "§/F{f1}");

        FunctionMetadata metadata = function.metadata();
        assertEquals(1, metadata.examples().size());
        Example example = metadata.examples().get(0);
        assertEquals("ex1", example.id());
        assertEquals(3, ((IntLiteral) example.expected()).value());

        Issue issue = metadata.issues().get(0);
        assertEquals(IssueKind.TODO, issue.kind());
        assertEquals("perf", issue.category());
        assertEquals(IssuePriority.HIGH, issue.priority());
        assertEquals("Cache results", issue.description());

        assertEquals(2, metadata.uses().dependencies().size());
        assertEquals("Math.Abs", metadata.uses().dependencies().get(0).target());
        assertNull(metadata.uses().dependencies().get(0).version());

        assertEquals(ComplexityClass.O_N, metadata.complexity().time());
        assertEquals(ComplexityClass.O1, metadata.complexity().space());
        assertEquals("1.2.0", metadata.since().version());

        assertEquals(1, function.body().size());
        assertInstanceOf(ReturnStatement.class, function.body().get(0));
    }
}

package com.calor;

import com.calor.diagnostics.Diagnostic;
import com.calor.diagnostics.DiagnosticBag;
import com.calor.diagnostics.DiagnosticCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class LexerTest {

    private static List<Token> lex(String source, DiagnosticBag diagnostics) {
        return new Lexer(source, diagnostics).tokenize();
    }

    private static List<TokenType> types(List<Token> tokens) {
        return tokens.stream().map(Token::type).collect(Collectors.toList());
    }

    @Test
    @DisplayName("Section markers and their close forms map to keyword tokens")
    void testSectionMarkers() {
        DiagnosticBag diagnostics = new DiagnosticBag();
        List<Token> tokens = lex("§M{m1:Demo} §/M{m1}", diagnostics);

        assertEquals(List.of(
            TokenType.MODULE, TokenType.OPEN_BRACE, TokenType.IDENTIFIER, TokenType.COLON, TokenType.IDENTIFIER,
            TokenType.CLOSE_BRACE, TokenType.END_MODULE, TokenType.OPEN_BRACE, TokenType.IDENTIFIER,
            TokenType.CLOSE_BRACE, TokenType.EOF), types(tokens));
        assertTrue(diagnostics.isEmpty());
    }

    @Test
    @DisplayName("Token stream always ends with EOF, even for empty input")
    void testEmptyInput() {
        List<Token> tokens = lex("", new DiagnosticBag());
        assertEquals(1, tokens.size());
        assertEquals(TokenType.EOF, tokens.get(0).type());
    }

    @Test
    @DisplayName("Comments and whitespace are dropped")
    void testCommentsDropped() {
        List<Token> tokens = lex("// heading\n  42 // trailing\n", new DiagnosticBag());
        assertEquals(List.of(TokenType.INT_LITERAL, TokenType.EOF), types(tokens));
        assertEquals(42, tokens.get(0).value());
        assertEquals(2, tokens.get(0).line());
        assertEquals(3, tokens.get(0).column());
    }

    @Test
    @DisplayName("Numeric literals carry typed values")
    void testNumericLiterals() {
        List<Token> tokens = lex("7 -3 2.5 19.99m INT:12 DEC:1.5", new DiagnosticBag());

        assertEquals(7, tokens.get(0).value());
        assertEquals(-3, tokens.get(1).value());
        assertEquals(TokenType.FLOAT_LITERAL, tokens.get(2).type());
        assertEquals(2.5, tokens.get(2).value());
        assertEquals(TokenType.DECIMAL_LITERAL, tokens.get(3).type());
        assertEquals(new BigDecimal("19.99"), tokens.get(3).value());
        assertEquals(TokenType.INT_LITERAL, tokens.get(4).type());
        assertEquals(12, tokens.get(4).value());
        assertEquals(new BigDecimal("1.5"), tokens.get(5).value());
    }

    @Test
    @DisplayName("String escapes are decoded into the token value")
    void testStringEscapes() {
        List<Token> tokens = lex("\"a\\tb\\n\"", new DiagnosticBag());
        assertEquals(TokenType.STR_LITERAL, tokens.get(0).type());
        assertEquals("a\tb\n", tokens.get(0).value());
    }

    @Test
    @DisplayName("Unterminated string is reported")
    void testUnterminatedString() {
        DiagnosticBag diagnostics = new DiagnosticBag();
        List<Token> tokens = lex("\"never closed", diagnostics);

        assertEquals(TokenType.ERROR, tokens.get(0).type());
        assertEquals(1, diagnostics.size());
        assertEquals(DiagnosticCode.UNTERMINATED_STRING, diagnostics.getDiagnostics().get(0).code());
    }

    @Test
    @DisplayName("Spelled-out marker suggests its short form")
    void testUnknownMarkerSuggestion() {
        DiagnosticBag diagnostics = new DiagnosticBag();
        List<Token> tokens = lex("§FUNCTION", diagnostics);

        assertEquals(TokenType.ERROR, tokens.get(0).type());
        Diagnostic diagnostic = diagnostics.getDiagnostics().get(0);
        assertEquals(DiagnosticCode.UNKNOWN_SECTION_MARKER, diagnostic.code());
        assertTrue(diagnostic.message().contains("Did you mean '§F'"), diagnostic.message());
    }

    @Test
    @DisplayName("§CAST points at the prefix cast form")
    void testCastMarkerHint() {
        DiagnosticBag diagnostics = new DiagnosticBag();
        lex("§CAST", diagnostics);
        assertTrue(diagnostics.getDiagnostics().get(0).message().contains("(cast TargetType expr)"));
    }

    @Test
    @DisplayName("Raw blocks keep their content verbatim")
    void testRawBlock() {
        List<Token> tokens = lex("§RAW\nvar x = 1;\n§/RAW", new DiagnosticBag());
        assertEquals(TokenType.RAW_CSHARP, tokens.get(0).type());
        assertEquals("var x = 1;", tokens.get(0).value());
    }

    @Test
    @DisplayName("Arrow, null-coalesce and quantifier symbols")
    void testSymbols() {
        List<Token> tokens = lex("→ -> ?? ?. ∀", new DiagnosticBag());
        assertEquals(List.of(TokenType.ARROW, TokenType.ARROW, TokenType.NULL_COALESCE,
            TokenType.NULL_CONDITIONAL, TokenType.IDENTIFIER, TokenType.EOF), types(tokens));
        assertEquals("forall", tokens.get(4).text());
    }
}

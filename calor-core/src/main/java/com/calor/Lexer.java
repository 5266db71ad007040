package com.calor;

import com.calor.ast.TextSpan;
import com.calor.catalog.TagCatalog;
import com.calor.diagnostics.DiagnosticBag;
import com.calor.diagnostics.DiagnosticCode;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Turns Calor source text into tokens. Whitespace, newlines and {@code //} comments are
 * dropped; the returned list always ends with an {@link TokenType#EOF} token.
 */
public class Lexer {

    private static final Map<String, TokenType> KEYWORDS = buildKeywords();

    private final String source;
    private final DiagnosticBag diagnostics;
    private final int maxSuggestionDistance;

    private int position = 0;
    private int line = 1;
    private int column = 1;
    private int tokenStart;
    private int tokenLine;
    private int tokenColumn;

    public Lexer(String source, DiagnosticBag diagnostics) {
        this(source, diagnostics, TagCatalog.DEFAULT_MAX_DISTANCE);
    }

    public Lexer(String source, DiagnosticBag diagnostics, int maxSuggestionDistance) {
        this.source = Objects.requireNonNull(source, "source");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
        this.maxSuggestionDistance = maxSuggestionDistance;
    }

    public static Map<String, TokenType> keywords() {
        return KEYWORDS;
    }

    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        while (!isAtEnd()) {
            Token token = nextToken();
            if (token != null) {
                tokens.add(token);
            }
        }
        startToken();
        tokens.add(makeToken(TokenType.EOF));
        return tokens;
    }

    // ========================================================================
    // Character cursor
    // ========================================================================

    private char current() {
        return peek(0);
    }

    private char lookahead() {
        return peek(1);
    }

    private char peek(int offset) {
        int index = position + offset;
        return index < source.length() ? source.charAt(index) : '\0';
    }

    private boolean isAtEnd() {
        return position >= source.length();
    }

    private void advance() {
        if (!isAtEnd()) {
            if (current() == '\n') {
                line++;
                column = 1;
            } else {
                column++;
            }
            position++;
        }
    }

    private void startToken() {
        tokenStart = position;
        tokenLine = line;
        tokenColumn = column;
    }

    private TextSpan currentSpan() {
        return new TextSpan(tokenStart, position - tokenStart, tokenLine, tokenColumn);
    }

    private String currentText() {
        return source.substring(tokenStart, position);
    }

    private Token makeToken(TokenType type) {
        return new Token(type, currentText(), null, currentSpan());
    }

    private Token makeToken(TokenType type, Object value) {
        return new Token(type, currentText(), value, currentSpan());
    }

    // ========================================================================
    // Dispatch
    // ========================================================================

    /**
     * Scans one token, or returns null for trivia (whitespace, newlines, comments).
     */
    private Token nextToken() {
        startToken();
        char c = current();
        switch (c) {
            case '§': return scanSectionMarker();
            case '[': return scanSingle(TokenType.OPEN_BRACKET);
            case ']': return scanSingle(TokenType.CLOSE_BRACKET);
            case '{': return scanSingle(TokenType.OPEN_BRACE);
            case '}': return scanSingle(TokenType.CLOSE_BRACE);
            case '(': return scanSingle(TokenType.OPEN_PAREN);
            case ')': return scanSingle(TokenType.CLOSE_PAREN);
            case '=': return scanPair('=', TokenType.EQUAL_EQUAL, TokenType.EQUALS);
            case ':': return scanSingle(TokenType.COLON);
            case '!': return scanPair('=', TokenType.BANG_EQUAL, TokenType.EXCLAMATION);
            case '~': return scanSingle(TokenType.TILDE);
            case '#': return scanSingle(TokenType.HASH);
            case '?': return scanQuestion();
            case '@': return scanSingle(TokenType.AT);
            case ',': return scanSingle(TokenType.COMMA);
            case '"': return scanStringLiteral();
            case '\r':
            case '\n':
            case ' ':
            case '\t':
                advance();
                return null;
            case '+': return scanSingle(TokenType.PLUS);
            case '*': return scanPair('*', TokenType.STAR_STAR, TokenType.STAR);
            case '/': return scanSlashOrComment();
            case '\\': return scanSingle(TokenType.BACKSLASH);
            case '%': return scanSingle(TokenType.PERCENT);
            case '<': return scanAngle('<', TokenType.LESS_EQUAL, TokenType.LESS_LESS, TokenType.LESS);
            case '>': return scanAngle('>', TokenType.GREATER_EQUAL, TokenType.GREATER_GREATER, TokenType.GREATER);
            case '&': return scanPair('&', TokenType.AMP_AMP, TokenType.AMP);
            case '|': return scanPair('|', TokenType.PIPE_PIPE, TokenType.PIPE);
            case '^': return scanSingle(TokenType.CARET);
            case '.': return scanDotOrNumber();
            case '→': return scanSingle(TokenType.ARROW);
            case '-': return scanMinusOrArrowOrNumber();
            case '∀': return scanQuantifierSymbol("forall");
            case '∃': return scanQuantifierSymbol("exists");
            case '`': return scanBacktickIdentifier();
            case '\'': return scanCharLiteral();
            default:
                if (Character.isLetter(c) || c == '_') {
                    return scanIdentifierOrTypedLiteral();
                }
                if (Character.isDigit(c)) {
                    return scanNumber();
                }
                diagnostics.reportUnexpectedCharacter(currentSpan(), c);
                advance();
                return makeToken(TokenType.ERROR);
        }
    }

    private Token scanSingle(TokenType type) {
        advance();
        return makeToken(type);
    }

    private Token scanPair(char second, TokenType pairType, TokenType singleType) {
        advance();
        if (current() == second) {
            advance();
            return makeToken(pairType);
        }
        return makeToken(singleType);
    }

    private Token scanAngle(char self, TokenType withEquals, TokenType doubled, TokenType single) {
        advance();
        if (current() == '=') {
            advance();
            return makeToken(withEquals);
        }
        if (current() == self) {
            advance();
            return makeToken(doubled);
        }
        return makeToken(single);
    }

    private Token scanQuestion() {
        advance();
        if (current() == '.') {
            advance();
            return makeToken(TokenType.NULL_CONDITIONAL);
        }
        if (current() == '?') {
            advance();
            return makeToken(TokenType.NULL_COALESCE);
        }
        return makeToken(TokenType.QUESTION);
    }

    private Token scanSlashOrComment() {
        if (lookahead() == '/') {
            while (current() != '\n' && current() != '\r' && !isAtEnd()) {
                advance();
            }
            return null;
        }
        advance();
        return makeToken(TokenType.SLASH);
    }

    private Token scanMinusOrArrowOrNumber() {
        if (lookahead() == '>') {
            advance();
            advance();
            return makeToken(TokenType.ARROW);
        }
        if (Character.isDigit(lookahead())) {
            return scanNumber();
        }
        advance();
        return makeToken(TokenType.MINUS);
    }

    private Token scanDotOrNumber() {
        if (Character.isDigit(lookahead())) {
            return scanNumber();
        }
        advance();
        return makeToken(TokenType.DOT);
    }

    private Token scanQuantifierSymbol(String keyword) {
        advance();
        return new Token(TokenType.IDENTIFIER, keyword, keyword, currentSpan());
    }

    private Token scanBacktickIdentifier() {
        advance();
        StringBuilder sb = new StringBuilder();
        while (!isAtEnd() && current() != '`') {
            if (current() == '\n') {
                diagnostics.reportUnterminatedString(currentSpan());
                return makeToken(TokenType.ERROR);
            }
            sb.append(current());
            advance();
        }
        if (isAtEnd()) {
            diagnostics.reportUnterminatedString(currentSpan());
            return makeToken(TokenType.ERROR);
        }
        advance();
        return new Token(TokenType.IDENTIFIER, sb.toString(), sb.toString(), currentSpan());
    }

    // ========================================================================
    // Section markers
    // ========================================================================

    private Token scanSectionMarker() {
        advance(); // §

        if (current() == '/') {
            advance();
            while (Character.isLetterOrDigit(current()) || current() == '_') {
                advance();
            }
            String keyword = currentText().substring(1);
            TokenType type = KEYWORDS.get(keyword);
            if (type != null && keyword.length() > 1) {
                return makeToken(type);
            }
            reportUnknownSectionMarker(keyword);
            return makeToken(TokenType.ERROR);
        }

        if (current() == '?') {
            advance();
            if (current() == '?') {
                advance();
                return makeToken(TokenType.NULL_COALESCE);
            }
            if (current() == '.') {
                advance();
                return makeToken(TokenType.NULL_CONDITIONAL);
            }
            diagnostics.reportError(currentSpan(), DiagnosticCode.INVALID_SECTION_OPERATOR,
                "Invalid section operator '§?'. Expected '§??' (null-coalesce) or '§?.' (null-conditional).");
            return makeToken(TokenType.ERROR);
        }

        if (current() == '^') {
            advance();
            return makeToken(TokenType.INDEX_END);
        }

        while (Character.isLetterOrDigit(current()) || current() == '_') {
            advance();
        }
        String keyword = currentText().substring(1);

        if (keyword.equals("RAW")) {
            return scanRawBlock();
        }

        TokenType type = KEYWORDS.get(keyword);
        if (type != null) {
            return makeToken(type);
        }
        reportUnknownSectionMarker(keyword);
        return makeToken(TokenType.ERROR);
    }

    private Token scanRawBlock() {
        if (current() == '\n') {
            advance();
        } else if (current() == '\r' && lookahead() == '\n') {
            advance();
            advance();
        }

        int contentStart = position;
        String endMarker = "§/RAW";
        while (!isAtEnd()) {
            if (current() == '§' && source.startsWith(endMarker, position)) {
                String raw = source.substring(contentStart, position);
                if (raw.endsWith("\r\n")) {
                    raw = raw.substring(0, raw.length() - 2);
                } else if (raw.endsWith("\n")) {
                    raw = raw.substring(0, raw.length() - 1);
                }
                for (int i = 0; i < endMarker.length(); i++) {
                    advance();
                }
                return makeToken(TokenType.RAW_CSHARP, raw);
            }
            advance();
        }

        diagnostics.reportError(currentSpan(), DiagnosticCode.UNTERMINATED_RAW_BLOCK,
            "Unterminated §RAW block: expected §/RAW before end of file.");
        return makeToken(TokenType.ERROR);
    }

    private void reportUnknownSectionMarker(String keyword) {
        if (keyword.equalsIgnoreCase("CAST")) {
            diagnostics.reportError(currentSpan(), DiagnosticCode.UNKNOWN_SECTION_MARKER,
                "Unknown section marker '§" + keyword + "'. Calor uses Lisp syntax for casts: "
                    + "(cast TargetType expr). Example: (cast i32 myFloat)");
            return;
        }

        String suggestion = TagCatalog.findSimilarMarker(keyword, maxSuggestionDistance);
        if (suggestion != null) {
            String description = TagCatalog.describe(suggestion);
            String suffix = description != null ? " (" + description + ")" : "";
            diagnostics.reportError(currentSpan(), DiagnosticCode.UNKNOWN_SECTION_MARKER,
                "Unknown section marker '§" + keyword + "'. Did you mean '§" + suggestion + "'" + suffix + "?");
        } else {
            diagnostics.reportError(currentSpan(), DiagnosticCode.UNKNOWN_SECTION_MARKER,
                "Unknown section marker '§" + keyword + "'. Common markers: " + TagCatalog.getCommonMarkers());
        }
    }

    // ========================================================================
    // Identifiers and literals
    // ========================================================================

    private Token scanIdentifierOrTypedLiteral() {
        while (Character.isLetterOrDigit(current()) || current() == '_' || current() == '.') {
            advance();
        }
        String text = currentText();

        if (current() == ':') {
            String upper = text.toUpperCase(Locale.ROOT);
            char next = peek(1);
            if (upper.equals("INT") && (Character.isDigit(next) || next == '-')) {
                return scanTypedNumber("INT");
            }
            if (upper.equals("STR") && next == '"') {
                advance();
                return scanQuotedString();
            }
            if (upper.equals("BOOL") && (source.startsWith("true", position + 1) || source.startsWith("false", position + 1))) {
                return scanTypedBool();
            }
            if (upper.equals("FLOAT") && (Character.isDigit(next) || next == '-' || next == '.')) {
                return scanTypedNumber("FLOAT");
            }
            if ((upper.equals("DECIMAL") || upper.equals("DEC")) && (Character.isDigit(next) || next == '-' || next == '.')) {
                return scanTypedNumber("DECIMAL");
            }
        }

        if (text.equals("true")) {
            return makeToken(TokenType.BOOL_LITERAL, Boolean.TRUE);
        }
        if (text.equals("false")) {
            return makeToken(TokenType.BOOL_LITERAL, Boolean.FALSE);
        }
        return makeToken(TokenType.IDENTIFIER);
    }

    private Token scanTypedBool() {
        advance(); // :
        int valueStart = position;
        while (Character.isLetter(current())) {
            advance();
        }
        String value = source.substring(valueStart, position).toLowerCase(Locale.ROOT);
        if (value.equals("true")) {
            return makeToken(TokenType.BOOL_LITERAL, Boolean.TRUE);
        }
        if (value.equals("false")) {
            return makeToken(TokenType.BOOL_LITERAL, Boolean.FALSE);
        }
        diagnostics.reportInvalidTypedLiteral(currentSpan(), "BOOL");
        return makeToken(TokenType.ERROR);
    }

    private Token scanTypedNumber(String kind) {
        advance(); // :
        int valueStart = position;
        if (current() == '-') {
            advance();
        }
        while (Character.isDigit(current())) {
            advance();
        }
        if (!kind.equals("INT")) {
            if (current() == '.') {
                advance();
                while (Character.isDigit(current())) {
                    advance();
                }
            }
            if (current() == 'e' || current() == 'E') {
                advance();
                if (current() == '+' || current() == '-') {
                    advance();
                }
                while (Character.isDigit(current())) {
                    advance();
                }
            }
            if (kind.equals("DECIMAL") && (current() == 'M' || current() == 'm')) {
                advance();
            }
        }

        String valueText = trimDecimalSuffix(source.substring(valueStart, position));
        try {
            switch (kind) {
                case "INT":
                    return makeToken(TokenType.INT_LITERAL, Integer.parseInt(valueText));
                case "FLOAT":
                    return makeToken(TokenType.FLOAT_LITERAL, Double.parseDouble(valueText));
                default:
                    return makeToken(TokenType.DECIMAL_LITERAL, new BigDecimal(valueText));
            }
        } catch (NumberFormatException e) {
            diagnostics.reportInvalidTypedLiteral(currentSpan(), kind);
            return makeToken(TokenType.ERROR);
        }
    }

    private Token scanCharLiteral() {
        advance(); // opening '
        if (current() == '\\') {
            advance();
            advance();
        } else if (current() != '\'' && current() != '\0' && current() != '\n') {
            advance();
        }
        if (current() == '\'') {
            advance();
            return makeToken(TokenType.STR_LITERAL, source.substring(tokenStart + 1, position - 1));
        }
        return makeToken(TokenType.ERROR);
    }

    private Token scanStringLiteral() {
        if (lookahead() == '"' && peek(2) == '"') {
            return scanMultilineString();
        }
        return scanQuotedString();
    }

    private Token scanMultilineString() {
        advance();
        advance();
        advance();
        if (current() == '\r') {
            advance();
        }
        if (current() == '\n') {
            advance();
        }

        StringBuilder sb = new StringBuilder();
        while (!isAtEnd()) {
            if (current() == '"' && lookahead() == '"' && peek(2) == '"') {
                advance();
                advance();
                advance();
                return makeToken(TokenType.STR_LITERAL, sb.toString());
            }
            if (current() == '\\') {
                advance();
                appendEscape(sb);
            } else {
                sb.append(current());
                advance();
            }
        }
        diagnostics.reportUnterminatedString(currentSpan());
        return makeToken(TokenType.ERROR);
    }

    private Token scanQuotedString() {
        advance(); // opening quote
        StringBuilder sb = new StringBuilder();
        while (!isAtEnd() && current() != '"') {
            if (current() == '\\') {
                advance();
                appendEscape(sb);
            } else if (current() == '\n') {
                diagnostics.reportUnterminatedString(currentSpan());
                return makeToken(TokenType.ERROR);
            } else {
                sb.append(current());
                advance();
            }
        }
        if (isAtEnd()) {
            diagnostics.reportUnterminatedString(currentSpan());
            return makeToken(TokenType.ERROR);
        }
        advance(); // closing quote
        return makeToken(TokenType.STR_LITERAL, sb.toString());
    }

    private void appendEscape(StringBuilder sb) {
        char c = current();
        switch (c) {
            case 'n' -> sb.append('\n');
            case 'r' -> sb.append('\r');
            case 't' -> sb.append('\t');
            case '0' -> sb.append('\0');
            case '\\' -> sb.append('\\');
            case '"' -> sb.append('"');
            default -> diagnostics.reportInvalidEscapeSequence(currentSpan(), c);
        }
        advance();
    }

    private Token scanNumber() {
        if (current() == '-') {
            advance();
        }
        while (Character.isDigit(current())) {
            advance();
        }

        if (current() == '.' && Character.isDigit(lookahead())) {
            advance();
            while (Character.isDigit(current())) {
                advance();
            }
            if (current() == 'M' || current() == 'm') {
                advance();
                try {
                    return makeToken(TokenType.DECIMAL_LITERAL, new BigDecimal(trimDecimalSuffix(currentText())));
                } catch (NumberFormatException e) {
                    diagnostics.reportInvalidTypedLiteral(currentSpan(), "number");
                    return makeToken(TokenType.ERROR);
                }
            }
            try {
                return makeToken(TokenType.FLOAT_LITERAL, Double.parseDouble(currentText()));
            } catch (NumberFormatException e) {
                diagnostics.reportInvalidTypedLiteral(currentSpan(), "number");
                return makeToken(TokenType.ERROR);
            }
        }

        if (current() == 'M' || current() == 'm') {
            advance();
            try {
                return makeToken(TokenType.DECIMAL_LITERAL, new BigDecimal(trimDecimalSuffix(currentText())));
            } catch (NumberFormatException e) {
                diagnostics.reportInvalidTypedLiteral(currentSpan(), "number");
                return makeToken(TokenType.ERROR);
            }
        }

        try {
            return makeToken(TokenType.INT_LITERAL, Integer.parseInt(currentText()));
        } catch (NumberFormatException e) {
            diagnostics.reportInvalidTypedLiteral(currentSpan(), "number");
            return makeToken(TokenType.ERROR);
        }
    }

    private static String trimDecimalSuffix(String text) {
        int end = text.length();
        while (end > 0 && (text.charAt(end - 1) == 'M' || text.charAt(end - 1) == 'm')) {
            end--;
        }
        return text.substring(0, end);
    }

    // ========================================================================
    // Keyword table
    // ========================================================================

    private static Map<String, TokenType> buildKeywords() {
        Map<String, TokenType> k = new HashMap<>();

        k.put("M", TokenType.MODULE);
        k.put("F", TokenType.FUNC);
        k.put("C", TokenType.CALL);
        k.put("B", TokenType.BIND);
        k.put("R", TokenType.RETURN);
        k.put("I", TokenType.IN);
        k.put("O", TokenType.OUT);
        k.put("A", TokenType.ARG);
        k.put("E", TokenType.EFFECTS);
        k.put("L", TokenType.FOR);
        k.put("W", TokenType.MATCH);
        k.put("K", TokenType.CASE);
        k.put("Q", TokenType.REQUIRES);
        k.put("S", TokenType.ENSURES);
        k.put("T", TokenType.TYPE);
        k.put("D", TokenType.RECORD);
        k.put("V", TokenType.VARIANT);
        k.put("U", TokenType.USING);
        k.put("/M", TokenType.END_MODULE);
        k.put("/F", TokenType.END_FUNC);
        k.put("/C", TokenType.END_CALL);
        k.put("/I", TokenType.END_IF);
        k.put("/L", TokenType.END_FOR);
        k.put("/W", TokenType.END_MATCH);
        k.put("/K", TokenType.END_CASE);
        k.put("/T", TokenType.END_TYPE);
        k.put("/D", TokenType.END_RECORD);

        k.put("IF", TokenType.IF);
        k.put("EI", TokenType.ELSE_IF);
        k.put("EL", TokenType.ELSE);
        k.put("WH", TokenType.WHILE);
        k.put("/WH", TokenType.END_WHILE);
        k.put("DO", TokenType.DO);
        k.put("/DO", TokenType.END_DO);
        k.put("SW", TokenType.MATCH);
        k.put("/SW", TokenType.END_MATCH);
        k.put("BK", TokenType.BREAK);
        k.put("CN", TokenType.CONTINUE);
        k.put("BODY", TokenType.BODY);
        k.put("END_BODY", TokenType.END_BODY);

        k.put("SM", TokenType.SOME);
        k.put("NN", TokenType.NONE);
        k.put("OK", TokenType.OK);
        k.put("ERR", TokenType.ERR);
        k.put("FL", TokenType.FIELD);
        k.put("IV", TokenType.INVARIANT);

        k.put("USE", TokenType.USE);
        k.put("/USE", TokenType.END_USE);

        k.put("ARR", TokenType.ARRAY);
        k.put("/ARR", TokenType.END_ARRAY);
        k.put("IDX", TokenType.INDEX);
        k.put("LEN", TokenType.LENGTH);
        k.put("EACH", TokenType.FOREACH);
        k.put("/EACH", TokenType.END_FOREACH);
        k.put("LIST", TokenType.LIST);
        k.put("/LIST", TokenType.END_LIST);
        k.put("DICT", TokenType.DICT);
        k.put("/DICT", TokenType.END_DICT);
        k.put("HSET", TokenType.HASH_SET);
        k.put("/HSET", TokenType.END_HASH_SET);
        k.put("KV", TokenType.KEY_VALUE);
        k.put("PUSH", TokenType.PUSH);
        k.put("ADD", TokenType.ADD);
        k.put("PUT", TokenType.PUT);
        k.put("REM", TokenType.REMOVE);
        k.put("SETIDX", TokenType.SET_INDEX);
        k.put("CLR", TokenType.CLEAR);
        k.put("INS", TokenType.INSERT);
        k.put("HAS", TokenType.HAS);
        k.put("KEY", TokenType.KEY);
        k.put("VAL", TokenType.VAL);
        k.put("EACHKV", TokenType.EACH_KV);
        k.put("/EACHKV", TokenType.END_EACH_KV);
        k.put("CNT", TokenType.COUNT);

        k.put("WR", TokenType.WHERE);
        k.put("WHERE", TokenType.WHERE);

        k.put("CL", TokenType.CLASS);
        k.put("/CL", TokenType.END_CLASS);
        k.put("IFACE", TokenType.INTERFACE);
        k.put("/IFACE", TokenType.END_INTERFACE);
        k.put("IMPL", TokenType.IMPLEMENTS);
        k.put("EXT", TokenType.EXTENDS);
        k.put("MT", TokenType.METHOD);
        k.put("/MT", TokenType.END_METHOD);
        k.put("VR", TokenType.VIRTUAL);
        k.put("OV", TokenType.OVERRIDE);
        k.put("AB", TokenType.ABSTRACT);
        k.put("SD", TokenType.SEALED);
        k.put("THIS", TokenType.THIS);
        k.put("/THIS", TokenType.END_THIS);
        k.put("BASE", TokenType.BASE);
        k.put("/BASE", TokenType.END_BASE);
        k.put("NEW", TokenType.NEW);
        k.put("/NEW", TokenType.END_NEW);
        k.put("FLD", TokenType.FIELD_DEF);

        k.put("PROP", TokenType.PROPERTY);
        k.put("/PROP", TokenType.END_PROPERTY);
        k.put("GET", TokenType.GET);
        k.put("/GET", TokenType.END_GET);
        k.put("SET", TokenType.SET);
        k.put("/SET", TokenType.END_SET);
        k.put("INIT", TokenType.INIT);
        k.put("CTOR", TokenType.CONSTRUCTOR);
        k.put("/CTOR", TokenType.END_CONSTRUCTOR);
        k.put("ASSIGN", TokenType.ASSIGN);
        k.put("DEFAULT", TokenType.DEFAULT);

        k.put("TR", TokenType.TRY);
        k.put("/TR", TokenType.END_TRY);
        k.put("CA", TokenType.CATCH);
        k.put("FI", TokenType.FINALLY);
        k.put("TH", TokenType.THROW);
        k.put("RT", TokenType.RETHROW);
        k.put("WHEN", TokenType.WHEN);

        k.put("LAM", TokenType.LAMBDA);
        k.put("/LAM", TokenType.END_LAMBDA);
        k.put("DEL", TokenType.DELEGATE);
        k.put("/DEL", TokenType.END_DELEGATE);
        k.put("EVT", TokenType.EVENT);
        k.put("SUB", TokenType.SUBSCRIBE);
        k.put("UNSUB", TokenType.UNSUBSCRIBE);

        k.put("ASYNC", TokenType.ASYNC);
        k.put("AWAIT", TokenType.AWAIT);
        k.put("AF", TokenType.ASYNC_FUNC);
        k.put("/AF", TokenType.END_ASYNC_FUNC);
        k.put("AMT", TokenType.ASYNC_METHOD);
        k.put("/AMT", TokenType.END_ASYNC_METHOD);

        k.put("INTERP", TokenType.INTERPOLATE);
        k.put("/INTERP", TokenType.END_INTERPOLATE);
        k.put("RANGE", TokenType.RANGE_OP);
        k.put("EXP", TokenType.EXPRESSION);
        k.put("WITH", TokenType.WITH);
        k.put("/WITH", TokenType.END_WITH);

        k.put("PPOS", TokenType.POSITIONAL_PATTERN);
        k.put("PPROP", TokenType.PROPERTY_PATTERN);
        k.put("PMATCH", TokenType.PROPERTY_MATCH);
        k.put("PREL", TokenType.RELATIONAL_PATTERN);
        k.put("PLIST", TokenType.LIST_PATTERN);
        k.put("VAR", TokenType.VAR);
        k.put("REST", TokenType.REST);

        k.put("EN", TokenType.ENUM);
        k.put("ENUM", TokenType.ENUM);
        k.put("/EN", TokenType.END_ENUM);
        k.put("/ENUM", TokenType.END_ENUM);
        k.put("EEXT", TokenType.ENUM_EXTENSION);
        k.put("/EEXT", TokenType.END_ENUM_EXTENSION);

        k.put("EX", TokenType.EXAMPLE);
        k.put("TD", TokenType.TODO);
        k.put("FX", TokenType.FIXME);
        k.put("HK", TokenType.HACK);
        k.put("US", TokenType.USES);
        k.put("/US", TokenType.END_USES);
        k.put("UB", TokenType.USED_BY);
        k.put("/UB", TokenType.END_USED_BY);
        k.put("AS", TokenType.ASSUME);
        k.put("CX", TokenType.COMPLEXITY);
        k.put("SN", TokenType.SINCE);
        k.put("DP", TokenType.DEPRECATED);
        k.put("BR", TokenType.BREAKING);
        k.put("XP", TokenType.EXPERIMENTAL);
        k.put("SB", TokenType.STABLE);
        k.put("DC", TokenType.DECISION);
        k.put("/DC", TokenType.END_DECISION);
        k.put("CHOSEN", TokenType.CHOSEN);
        k.put("REJECTED", TokenType.REJECTED);
        k.put("REASON", TokenType.REASON);
        k.put("CT", TokenType.CONTEXT);
        k.put("/CT", TokenType.END_CONTEXT);
        k.put("VS", TokenType.VISIBLE);
        k.put("/VS", TokenType.END_VISIBLE);
        k.put("HD", TokenType.HIDDEN_SECTION);
        k.put("/HD", TokenType.END_HIDDEN_SECTION);
        k.put("FC", TokenType.FOCUS);
        k.put("FILE", TokenType.FILE_REF);
        k.put("PT", TokenType.PROPERTY_TEST);
        k.put("LK", TokenType.LOCK);
        k.put("AU", TokenType.AGENT_AUTHOR);
        k.put("TASK", TokenType.TASK_REF);
        k.put("DATE", TokenType.DATE_MARKER);

        k.put("YIELD", TokenType.YIELD);
        k.put("YBRK", TokenType.YIELD_BREAK);
        k.put("ANON", TokenType.ANONYMOUS_OBJECT);
        k.put("/ANON", TokenType.END_ANONYMOUS_OBJECT);

        k.put("P", TokenType.PRINT);
        k.put("Pf", TokenType.PRINT_F);

        return Collections.unmodifiableMap(k);
    }
}

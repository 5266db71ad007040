package com.calor;

import com.calor.ast.*;
import com.calor.attributes.AttributeCollection;
import com.calor.attributes.AttributeInterpreter;
import com.calor.catalog.OperatorCatalog;
import com.calor.diagnostics.DiagnosticBag;
import com.calor.diagnostics.DiagnosticCode;
import com.calor.diagnostics.SuggestedFix;
import com.calor.diagnostics.TextEdit;
import org.apache.log4j.Logger;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Recursive-descent parser for Calor source. Malformed input never throws: every problem is
 * reported to the shared {@link DiagnosticBag} and parsing continues with a placeholder, so
 * {@link #parse()} always returns a tree.
 */
public class Parser {

    private static final Logger LOG = Logging.getCalorLogger();

    private static final Set<String> VISIBILITY_KEYWORDS = Set.of(
        "pub", "pri", "pro", "int", "public", "private", "protected", "internal");

    private static final Set<String> CLASS_MODIFIER_KEYWORDS = Set.of(
        "abs", "abstract", "seal", "sealed", "stat", "static",
        "partial", "struct", "readonly",
        "pub", "pri", "pro", "int",
        "public", "private", "protected", "internal");

    private final List<Token> tokens;
    private final DiagnosticBag diagnostics;
    private final ParserOptions options;
    private int position = 0;

    // Set while parsing a §A argument, so §NEW does not swallow the caller's remaining §A tags
    private boolean insideArgContext = false;

    // Position just past the last skipped token; a skip starting here is part of the same run
    private int skippedUntil = -1;

    public Parser(String source) {
        this(source, ParserOptions.DEFAULTS);
    }

    public Parser(String source, ParserOptions options) {
        this(source, new DiagnosticBag(options.filePath()), options);
    }

    private Parser(String source, DiagnosticBag diagnostics, ParserOptions options) {
        this(new Lexer(Objects.requireNonNull(source, "source"), diagnostics, options.maxSuggestionDistance()).tokenize(),
            diagnostics, options);
    }

    public Parser(List<Token> tokens, DiagnosticBag diagnostics, ParserOptions options) {
        Objects.requireNonNull(tokens, "tokens");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
        this.options = options == null ? ParserOptions.DEFAULTS : options;
        List<Token> copy = new ArrayList<>(tokens);
        if (copy.isEmpty() || copy.get(copy.size() - 1).type() != TokenType.EOF) {
            TextSpan eofSpan = copy.isEmpty() ? TextSpan.EMPTY : copy.get(copy.size() - 1).span();
            copy.add(new Token(TokenType.EOF, "", eofSpan));
        }
        this.tokens = List.copyOf(copy);
    }

    public DiagnosticBag getDiagnostics() {
        return diagnostics;
    }

    /**
     * Parses one module. Diagnostics accumulate in {@link #getDiagnostics()}.
     */
    public Program parse() {
        LOG.debug("Parsing " + tokens.size() + " tokens" + describeFile());
        Program program = parseModule();
        if (LOG.isDebugEnabled()) {
            LOG.debug("Parsed module '" + program.name() + "' with " + diagnostics.size() + " diagnostic(s)");
        }
        return program;
    }

    private String describeFile() {
        return options.filePath().isEmpty() ? "" : " from " + options.filePath();
    }

    /** Immutable copy for a node component; a missing optional list stays null. */
    private static <T> List<T> frozen(List<T> list) {
        return list == null ? null : List.copyOf(list);
    }

    // ========================================================================
    // Token cursor
    // ========================================================================

    private Token current() {
        return peek(0);
    }

    private Token peek(int offset) {
        int index = position + offset;
        if (index < 0) {
            index = 0;
        }
        if (index >= tokens.size()) {
            return tokens.get(tokens.size() - 1);
        }
        return tokens.get(index);
    }

    private Token previous() {
        return peek(-1);
    }

    private boolean isAtEnd() {
        return current().type() == TokenType.EOF;
    }

    private Token advance() {
        Token token = current();
        if (!isAtEnd()) {
            position++;
        }
        return token;
    }

    private boolean check(TokenType type) {
        return current().type() == type;
    }

    private boolean checkAhead(int offset, TokenType type) {
        return peek(offset).type() == type;
    }

    private boolean checkAny(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                return true;
            }
        }
        return false;
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    /**
     * Consumes a token of the given type. On mismatch reports the problem and returns a
     * synthesized empty token at the current position without advancing.
     */
    private Token expect(TokenType type) {
        if (check(type)) {
            return advance();
        }
        diagnostics.reportUnexpectedToken(current().span(), type, current().type());
        return new Token(type, "", current().span());
    }

    /**
     * Consumes a close tag and its attribute block, reporting a mismatch when the close id
     * differs from {@code openId}. A missing close tag is reported once, without a second
     * id-mismatch diagnostic.
     */
    private Token expectClose(TokenType closeType, String openTag, String openId, String closeTag) {
        boolean present = check(closeType);
        Token endToken = expect(closeType);
        if (!present) {
            return endToken;
        }
        String endId = AttributeInterpreter.interpretEndId(parseAttributes());
        if (!endId.equals(openId)) {
            diagnostics.reportMismatchedIdWithFix(endToken.span(), openTag, openId, closeTag, endId);
        }
        return endToken;
    }

    /**
     * Skips a token that starts nothing valid here, together with its attribute block. Only the
     * first token of a contiguous run is reported, and {@code ERROR} tokens never are since the
     * lexer has already reported them.
     */
    private void skipUnexpected(String expected) {
        Token token = current();
        if (position != skippedUntil && token.type() != TokenType.ERROR) {
            diagnostics.reportUnexpectedToken(token.span(), expected, token.type());
        }
        advance();
        skipAttributeGroups();
        skippedUntil = position;
    }

    private void skipAttributeGroups() {
        while (check(TokenType.OPEN_BRACE)) {
            int depth = 0;
            do {
                if (check(TokenType.OPEN_BRACE)) {
                    depth++;
                } else if (check(TokenType.CLOSE_BRACE)) {
                    depth--;
                }
                advance();
            } while (depth > 0 && !isAtEnd());
        }
    }

    private String requireId(String id, Token startToken, String tag) {
        if (id == null || id.isEmpty()) {
            diagnostics.reportMissingRequiredAttribute(startToken.span(), tag, "id");
            return "";
        }
        return id;
    }

    private String getRequiredAttribute(AttributeCollection attrs, String name, String tag, TextSpan span) {
        String value = attrs.positionalOrNamed(0, name);
        if (value == null || value.isEmpty()) {
            diagnostics.reportMissingRequiredAttribute(span, tag, name);
            return "";
        }
        return value;
    }

    private static <T> T lastOrNull(List<T> list) {
        return list.isEmpty() ? null : list.get(list.size() - 1);
    }

    // ========================================================================
    // Module
    // ========================================================================

    private Program parseModule() {
        Token startToken = expect(TokenType.MODULE);
        AttributeCollection attrs = parseAttributes();
        String[] header = AttributeInterpreter.interpretModule(attrs);
        String id = header[0];
        String moduleName = header[1];
        if (id.isEmpty()) {
            diagnostics.reportMissingRequiredAttribute(startToken.span(), "MODULE", "id");
        }
        if (moduleName.isEmpty()) {
            diagnostics.reportMissingRequiredAttribute(startToken.span(), "MODULE", "name");
        }

        List<UsingDirective> usings = new ArrayList<>();
        List<InterfaceDefinition> interfaces = new ArrayList<>();
        List<ClassDefinition> classes = new ArrayList<>();
        List<FunctionDefinition> functions = new ArrayList<>();
        List<DelegateDefinition> delegates = new ArrayList<>();
        List<EnumDefinition> enums = new ArrayList<>();
        List<EnumExtension> enumExtensions = new ArrayList<>();
        List<Issue> issues = new ArrayList<>();
        List<Assumption> assumptions = new ArrayList<>();
        List<Invariant> invariants = new ArrayList<>();
        List<Decision> decisions = new ArrayList<>();
        ContextBlock context = null;

        while (!isAtEnd() && !check(TokenType.END_MODULE)) {
            switch (current().type()) {
                case USING -> usings.add(parseUsingDirective());
                case INTERFACE -> interfaces.add(parseInterfaceDefinition());
                case CLASS -> classes.add(parseClassDefinition());
                case FUNC -> functions.add(parseFunction(false));
                case ASYNC_FUNC -> functions.add(parseFunction(true));
                case DELEGATE -> delegates.add(parseDelegateDefinition());
                case ENUM -> enums.add(parseEnumDefinition());
                case ENUM_EXTENSION -> enumExtensions.add(parseEnumExtension());
                case TODO, FIXME, HACK -> issues.add(parseIssue());
                case ASSUME -> assumptions.add(parseAssume());
                case INVARIANT -> invariants.add(parseInvariant());
                case DECISION -> decisions.add(parseDecision());
                case CONTEXT -> context = parseContext();
                default -> {
                    skipUnexpected("USING, IFACE, CLASS, DEL, FUNC, or END_MODULE");
                }
            }
        }

        Token endToken = expectClose(TokenType.END_MODULE, "MODULE", id, "END_MODULE");
        TextSpan span = startToken.span().union(endToken.span());
        return new Program(span, id, moduleName, frozen(usings), frozen(interfaces), frozen(classes),
            frozen(functions), frozen(delegates), frozen(enums), frozen(enumExtensions), frozen(issues),
            frozen(assumptions), frozen(invariants), frozen(decisions), context);
    }

    private UsingDirective parseUsingDirective() {
        Token startToken = expect(TokenType.USING);
        AttributeCollection attrs = parseAttributes();
        String pos0 = attrs.getOrDefault("_pos0", "");
        String pos1 = attrs.positional(1);

        String namespace;
        String alias = null;
        boolean isStatic = false;
        if (pos1 != null) {
            if (pos0.equalsIgnoreCase("static")) {
                isStatic = true;
            } else {
                alias = pos0;
            }
            namespace = pos1;
        } else {
            namespace = pos0;
        }
        if (namespace.isEmpty()) {
            diagnostics.reportMissingRequiredAttribute(startToken.span(), "USING", "namespace");
        }
        return new UsingDirective(startToken.span(), namespace, alias, isStatic);
    }

    private Invariant parseInvariant() {
        Token startToken = expect(TokenType.INVARIANT);
        AttributeCollection attrs = parseAttributes();
        String message = attrs.get("message");
        if (message == null) {
            message = attrs.positional(0);
        }
        Expression condition = parseExpression();
        return new Invariant(startToken.span().union(condition.span()), condition, message);
    }

    // ========================================================================
    // Functions
    // ========================================================================

    /**
     * Parses {@code §F{id:name:vis}} or {@code §AF{...}}: header sections in any order, then an
     * explicit {@code §BODY} block or an implicit body running to the close tag.
     */
    private FunctionDefinition parseFunction(boolean isAsync) {
        TokenType openType = isAsync ? TokenType.ASYNC_FUNC : TokenType.FUNC;
        TokenType closeType = isAsync ? TokenType.END_ASYNC_FUNC : TokenType.END_FUNC;
        String tag = isAsync ? "AF" : "FUNC";

        Token startToken = expect(openType);
        AttributeCollection attrs = parseAttributes();
        AttributeInterpreter.FunctionHeader header = AttributeInterpreter.interpretFunction(attrs);
        String id = requireId(header.id(), startToken, tag);
        String name = header.name();
        if (name.isEmpty()) {
            diagnostics.reportMissingRequiredAttribute(startToken.span(), tag, "name");
        }

        List<TypeParameter> typeParameters = parseOptionalTypeParameterList();
        List<Parameter> parameters = new ArrayList<>();
        OutputSpec output = null;
        EffectsSpec effects = null;
        List<RequiresClause> preconditions = new ArrayList<>();
        List<EnsuresClause> postconditions = new ArrayList<>();
        MetadataCollector metadata = new MetadataCollector();

        boolean inHeader = true;
        while (inHeader && !isAtEnd() && !check(TokenType.BODY) && !check(closeType)) {
            switch (current().type()) {
                case WHERE -> parseWhereClause(typeParameters);
                case IN -> parameters.add(parseParameter());
                case OUT -> output = parseOutput();
                case EFFECTS -> effects = parseEffects();
                case REQUIRES -> preconditions.add(parseRequires());
                case ENSURES -> postconditions.add(parseEnsures());
                default -> inHeader = metadata.tryParse();
            }
        }

        List<Statement> body;
        if (check(TokenType.BODY)) {
            body = parseBody();
        } else {
            body = parseStatementBlock(closeType, TokenType.END_FUNC, TokenType.END_ASYNC_FUNC);
        }

        Token endToken = expectClose(closeType, tag, id, isAsync ? "END_AF" : "END_FUNC");
        TextSpan span = startToken.span().union(endToken.span());
        return new FunctionDefinition(span, id, name, header.visibility(), List.copyOf(typeParameters), frozen(parameters),
            output, effects, frozen(preconditions), frozen(postconditions), frozen(body), metadata.build(), isAsync);
    }

    /**
     * Accumulates the optional metadata sections of a function header.
     */
    private final class MetadataCollector {
        private final List<Example> examples = new ArrayList<>();
        private final List<Issue> issues = new ArrayList<>();
        private final List<Assumption> assumptions = new ArrayList<>();
        private final List<BreakingChange> breakingChanges = new ArrayList<>();
        private final List<PropertyTest> propertyTests = new ArrayList<>();
        private Uses uses;
        private UsedBy usedBy;
        private Complexity complexity;
        private Since since;
        private Deprecation deprecated;
        private Lock lock;
        private Author author;
        private TaskRef taskRef;

        /**
         * @return true if the current token started a metadata section and it was consumed
         */
        boolean tryParse() {
            switch (current().type()) {
                case EXAMPLE -> examples.add(parseExample());
                case TODO, FIXME, HACK -> issues.add(parseIssue());
                case USES -> uses = parseUses();
                case USED_BY -> usedBy = parseUsedBy();
                case ASSUME -> assumptions.add(parseAssume());
                case COMPLEXITY -> complexity = parseComplexity();
                case SINCE -> since = parseSince();
                case DEPRECATED -> deprecated = parseDeprecated();
                case BREAKING -> breakingChanges.add(parseBreaking());
                case PROPERTY_TEST -> propertyTests.add(parsePropertyTest());
                case LOCK -> lock = parseLock();
                case AGENT_AUTHOR -> author = parseAuthor();
                case TASK_REF -> taskRef = parseTaskRef();
                default -> {
                    return false;
                }
            }
            return true;
        }

        FunctionMetadata build() {
            return new FunctionMetadata(frozen(examples), frozen(issues), uses, usedBy, frozen(assumptions),
                complexity, since, deprecated, frozen(breakingChanges), frozen(propertyTests), lock, author, taskRef);
        }
    }

    private Parameter parseParameter() {
        Token startToken = expect(TokenType.IN);
        AttributeInterpreter.InputSpec input = AttributeInterpreter.interpretInput(parseAttributes());
        if (input.name().isEmpty()) {
            diagnostics.reportMissingRequiredAttribute(startToken.span(), "IN", "name");
        }
        if (input.type() == null || input.type().isEmpty()) {
            diagnostics.reportMissingRequiredAttribute(startToken.span(), "IN", "type");
        }
        String typeName = input.type() == null ? "" : input.type();
        return new Parameter(startToken.span(), input.name(), typeName, input.semantic());
    }

    private OutputSpec parseOutput() {
        Token startToken = expect(TokenType.OUT);
        String typeName = AttributeInterpreter.interpretOutput(parseAttributes());
        if (typeName == null || typeName.isEmpty()) {
            diagnostics.reportMissingRequiredAttribute(startToken.span(), "OUT", "type");
            typeName = "";
        }
        return new OutputSpec(startToken.span(), typeName);
    }

    private EffectsSpec parseEffects() {
        Token startToken = expect(TokenType.EFFECTS);
        Map<String, String> effects = AttributeInterpreter.interpretEffects(parseAttributes());
        return new EffectsSpec(startToken.span(), effects);
    }

    private RequiresClause parseRequires() {
        Token startToken = expect(TokenType.REQUIRES);
        String message = parseAttributes().positional(0);
        Expression condition = parseExpression();
        return new RequiresClause(startToken.span().union(condition.span()), condition, message);
    }

    private EnsuresClause parseEnsures() {
        Token startToken = expect(TokenType.ENSURES);
        String message = parseAttributes().positional(0);
        Expression condition = parseExpression();
        return new EnsuresClause(startToken.span().union(condition.span()), condition, message);
    }

    private List<Statement> parseBody() {
        expect(TokenType.BODY);
        List<Statement> statements = parseStatementBlock(TokenType.END_BODY);
        expect(TokenType.END_BODY);
        return statements;
    }

    /**
     * Statements until one of {@code terminators} (not consumed), a module close tag, or end
     * of input.
     */
    private List<Statement> parseStatementBlock(TokenType... terminators) {
        List<Statement> statements = new ArrayList<>();
        while (!isAtEnd() && !check(TokenType.END_MODULE) && !checkAny(terminators)) {
            Statement statement = parseStatement();
            if (statement != null) {
                statements.add(statement);
            }
        }
        return statements;
    }

    // ========================================================================
    // Statements
    // ========================================================================

    /**
     * @return the statement, or null when the current token starts no statement (it is
     *         reported and skipped)
     */
    private Statement parseStatement() {
        switch (current().type()) {
            case CALL: return parseCallStatement();
            case RETURN: return parseReturnStatement();
            case FOR: return parseForStatement();
            case WHILE: return parseWhileStatement();
            case DO: return parseDoWhileStatement();
            case IF: return parseIfStatement();
            case BIND: return parseBindStatement();
            case MATCH: return parseMatchStatement();
            case FOREACH: return parseForeachStatement();
            case ASSIGN: return parseAssignmentStatement();
            case TRY: return parseTryStatement();
            case USE: return parseUsingStatement();
            case THROW: return parseThrowStatement();
            case RETHROW: return new RethrowStatement(advance().span());
            case SUBSCRIBE: return parseEventSubscription(true);
            case UNSUBSCRIBE: return parseEventSubscription(false);
            case BREAK: return new BreakStatement(advance().span());
            case CONTINUE: return new ContinueStatement(advance().span());
            case PRINT: return parsePrintStatement(true);
            case PRINT_F: return parsePrintStatement(false);
            case LIST: return parseListCreationStatement();
            case DICT: return parseDictionaryCreationStatement();
            case HASH_SET: return parseSetCreationStatement();
            case PUSH:
            case ADD:
                return parseCollectionPush();
            case PUT: return parseDictionaryPut();
            case REMOVE: return parseCollectionRemove();
            case SET_INDEX: return parseCollectionSetIndex();
            case CLEAR: return parseCollectionClear();
            case INSERT: return parseCollectionInsert();
            case EACH_KV: return parseDictionaryForeach();
            case OPEN_PAREN: {
                Expression expression = parseExpression();
                return new ExpressionStatement(expression.span(), expression);
            }
            default:
                skipUnexpected("statement");
                return null;
        }
    }

    private PrintStatement parsePrintStatement(boolean writeLine) {
        Token startToken = advance();
        Expression expression = parseExpression();
        return new PrintStatement(startToken.span().union(expression.span()), expression, writeLine);
    }

    /**
     * {@code §C{target[!]}} followed either by one inline argument, or by {@code §A}
     * arguments and {@code §/C}.
     */
    private CallStatement parseCallStatement() {
        Token startToken = expect(TokenType.CALL);
        AttributeInterpreter.CallTarget call = AttributeInterpreter.interpretCall(parseAttributes());
        if (call.target().isEmpty()) {
            diagnostics.reportMissingRequiredAttribute(startToken.span(), "CALL", "target");
        }

        List<Expression> arguments = new ArrayList<>();
        if (isExpressionStart() && !check(TokenType.ARG)) {
            arguments.add(parseExpression());
            TextSpan span = startToken.span().union(arguments.get(0).span());
            return new CallStatement(span, call.target(), call.fallible(), frozen(arguments));
        }

        while (check(TokenType.ARG)) {
            arguments.add(parseArgument());
        }
        Token endToken = expect(TokenType.END_CALL);
        return new CallStatement(startToken.span().union(endToken.span()), call.target(), call.fallible(),
            frozen(arguments));
    }

    private Expression parseArgument() {
        expect(TokenType.ARG);
        boolean saved = insideArgContext;
        insideArgContext = true;
        try {
            return parseExpression();
        } finally {
            insideArgContext = saved;
        }
    }

    private ReturnStatement parseReturnStatement() {
        Token startToken = expect(TokenType.RETURN);
        Expression expression = null;
        if (isExpressionStart()) {
            expression = parseExpression();
        }
        TextSpan span = expression != null ? startToken.span().union(expression.span()) : startToken.span();
        return new ReturnStatement(span, expression);
    }

    private BindStatement parseBindStatement() {
        Token startToken = expect(TokenType.BIND);
        AttributeInterpreter.BindSpec bind = AttributeInterpreter.interpretBind(parseAttributes());
        if (bind.name().isEmpty()) {
            diagnostics.reportMissingRequiredAttribute(startToken.span(), "BIND", "name");
        }
        Expression initializer = null;
        if (isExpressionStart()) {
            initializer = parseExpression();
        }
        TextSpan span = initializer != null ? startToken.span().union(initializer.span()) : startToken.span();
        return new BindStatement(span, bind.name(), bind.typeName(), bind.mutable(), initializer);
    }

    private AssignmentStatement parseAssignmentStatement() {
        Token startToken = expect(TokenType.ASSIGN);
        Expression target = parseExpression();
        Expression value = parseExpression();
        return new AssignmentStatement(startToken.span().union(value.span()), target, value);
    }

    private ThrowStatement parseThrowStatement() {
        Token startToken = expect(TokenType.THROW);
        Expression exception = null;
        if (isExpressionStart()) {
            exception = parseExpression();
        }
        TextSpan span = exception != null ? startToken.span().union(exception.span()) : startToken.span();
        return new ThrowStatement(span, exception);
    }

    private EventSubscription parseEventSubscription(boolean subscribe) {
        Token startToken = advance();
        Expression event = parseExpression();
        Expression handler = parseExpression();
        return new EventSubscription(startToken.span().union(handler.span()), event, handler, subscribe);
    }

    // ========================================================================
    // Expressions
    // ========================================================================

    private boolean isExpressionStart() {
        switch (current().type()) {
            case INT_LITERAL:
            case STR_LITERAL:
            case BOOL_LITERAL:
            case FLOAT_LITERAL:
            case DECIMAL_LITERAL:
            case IDENTIFIER:
            case OPEN_PAREN:
            case IF:
            case SOME:
            case NONE:
            case OK:
            case ERR:
            case MATCH:
            case RECORD:
            case ARRAY:
            case INDEX:
            case LENGTH:
            case LIST:
            case DICT:
            case HASH_SET:
            case HAS:
            case COUNT:
            case NEW:
            case ANONYMOUS_OBJECT:
            case THIS:
            case BASE:
            case CALL:
            case LAMBDA:
            case AWAIT:
            case INTERPOLATE:
            case NULL_COALESCE:
            case NULL_CONDITIONAL:
            case RANGE_OP:
            case INDEX_END:
            case WITH:
                return true;
            default:
                return false;
        }
    }

    /**
     * Parses one expression. A token that starts no expression is reported and skipped, and an
     * integer zero stands in for the missing value.
     */
    Expression parseExpression() {
        switch (current().type()) {
            case INT_LITERAL: return parseIntLiteral();
            case STR_LITERAL: return parseStringLiteral();
            case BOOL_LITERAL: return parseBoolLiteral();
            case FLOAT_LITERAL: return parseFloatLiteral();
            case DECIMAL_LITERAL: return parseDecimalLiteral();
            case IDENTIFIER: return parseReference();
            case OPEN_PAREN: return parseParenExpressionOrInlineLambda();
            case OPEN_BRACE: return parseCollectionInitializer();
            case IF: return parseIfExpression();
            case SOME: return parseSomeExpression();
            case NONE: return parseNoneExpression();
            case OK: return parseOkExpression();
            case ERR: return parseErrExpression();
            case MATCH: return parseMatchExpression();
            case RECORD: return parseRecordCreation();
            case ARRAY: return parseArrayCreation();
            case INDEX: return parseArrayAccess();
            case LENGTH: return parseArrayLength();
            case LIST: return parseListCreation();
            case DICT: return parseDictionaryCreation();
            case HASH_SET: return parseSetCreation();
            case HAS: return parseCollectionContains();
            case COUNT: return parseCollectionCount();
            case NEW: return parseNewExpression();
            case ANONYMOUS_OBJECT: return parseAnonymousObject();
            case THIS: return parseThisExpression();
            case BASE: return parseBaseExpression();
            case CALL: return parseCallExpression();
            case LAMBDA: return parseLambdaExpression();
            case AWAIT: return parseAwaitExpression();
            case INTERPOLATE: return parseInterpolatedString();
            case NULL_COALESCE: return parseNullCoalesce();
            case NULL_CONDITIONAL: return parseNullConditional();
            case RANGE_OP: return parseRangeExpression();
            case INDEX_END: return parseIndexFromEnd();
            case WITH: return parseWithExpression();
            default: {
                Token token = advance();
                diagnostics.reportUnexpectedToken(token.span(), "expression", token.type());
                LOG.debug("Substituting placeholder for unexpected " + token.type() + " at line " + token.line());
                return new IntLiteral(token.span(), 0);
            }
        }
    }

    /**
     * {@code {a, b, c}} as an untyped array literal.
     */
    private Expression parseCollectionInitializer() {
        Token startToken = expect(TokenType.OPEN_BRACE);
        List<Expression> elements = new ArrayList<>();
        while (!isAtEnd() && !check(TokenType.CLOSE_BRACE)) {
            elements.add(parseExpression());
            if (!match(TokenType.COMMA) && !check(TokenType.CLOSE_BRACE)) {
                break;
            }
        }
        Token endToken = expect(TokenType.CLOSE_BRACE);
        return new ArrayCreation(startToken.span().union(endToken.span()), "arr_init", "arr_init", "any", null,
            frozen(elements));
    }

    /**
     * Distinguishes an inline lambda, {@code () → body}, {@code (x) → body} or
     * {@code (type:x) → body}, from a prefix expression. The lookahead only inspects tokens and
     * rewinds the cursor, so nothing is reported for the abandoned branch.
     */
    private Expression parseParenExpressionOrInlineLambda() {
        int savedPosition = position;
        Token startToken = advance();

        List<LambdaParameter> parameters = null;
        if (check(TokenType.CLOSE_PAREN)) {
            advance();
            parameters = List.of();
        } else if (check(TokenType.IDENTIFIER)) {
            Token first = advance();
            String name = first.text();
            String typeName = null;
            boolean wellFormed = true;
            if (check(TokenType.COLON)) {
                advance();
                if (check(TokenType.IDENTIFIER)) {
                    typeName = name;
                    name = advance().text();
                } else {
                    wellFormed = false;
                }
            }
            if (wellFormed && match(TokenType.CLOSE_PAREN)) {
                parameters = List.of(new LambdaParameter(first.span(), name, typeName));
            }
        }

        if (parameters != null && check(TokenType.ARROW)) {
            advance();
            return parseInlineLambdaBody(startToken, parameters);
        }

        position = savedPosition;
        return parseLispExpression();
    }

    private LambdaExpression parseInlineLambdaBody(Token startToken, List<LambdaParameter> parameters) {
        if (check(TokenType.OPEN_BRACE)) {
            advance();
            List<Statement> statements = parseStatementBlock(TokenType.CLOSE_BRACE);
            Token endToken = expect(TokenType.CLOSE_BRACE);
            return new LambdaExpression(startToken.span().union(endToken.span()), "inline", frozen(parameters), null,
                false, null, frozen(statements));
        }
        Expression body = parseExpression();
        return new LambdaExpression(startToken.span().union(body.span()), "inline", frozen(parameters), null,
            false, body, null);
    }

    // ========================================================================
    // Prefix expressions: (op arg...)
    // ========================================================================

    /**
     * Operator position of a prefix expression. {@code valid} is false when some other token
     * sat in operator position; that has already been reported.
     */
    private record LispOperator(TokenType kind, String text, TextSpan span, boolean valid) {}

    private Expression parseLispExpression() {
        Token startToken = expect(TokenType.OPEN_PAREN);
        LispOperator op = parseLispOperator();
        String opText = op.text();

        if (op.valid()) {
            switch (opText) {
                case "forall":
                    return parseQuantifierExpression(startToken, QuantifierKind.FORALL);
                case "exists":
                    return parseQuantifierExpression(startToken, QuantifierKind.EXISTS);
                case "->":
                    return parseImplicationExpression(startToken);
                case "typeof": {
                    String typeName = parseLispTypeName();
                    Token endToken = expect(TokenType.CLOSE_PAREN);
                    return new TypeOfExpression(startToken.span().union(endToken.span()), typeName);
                }
                case "is":
                    return parseLispIsExpression(startToken);
                case "as":
                    return parseLispAsExpression(startToken);
                case "cast":
                    return parseLispCastExpression(startToken);
                default:
                    break;
            }
        }

        List<Expression> args = new ArrayList<>();
        while (!check(TokenType.CLOSE_PAREN) && !isAtEnd()) {
            args.add(parseLispArgument());
        }
        Token endToken = expect(TokenType.CLOSE_PAREN);
        TextSpan span = startToken.span().union(endToken.span());

        if (!op.valid()) {
            return firstOrZero(args, span);
        }

        if (opText.equals("?")) {
            if (args.size() == 3) {
                return new ConditionalExpression(span, args.get(0), args.get(1), args.get(2));
            }
            diagnostics.reportError(span, DiagnosticCode.OPERATOR_ARGUMENT_COUNT,
                "Conditional '?' requires exactly 3 operands (condition, then, else), got " + args.size());
            return firstOrZero(args, span);
        }

        if (opText.equals("??")) {
            if (args.size() == 2) {
                return new NullCoalesce(span, args.get(0), args.get(1));
            }
            diagnostics.reportError(span, DiagnosticCode.OPERATOR_ARGUMENT_COUNT,
                "Null-coalescing '??' requires exactly 2 operands, got " + args.size());
            return firstOrZero(args, span);
        }

        if (args.size() == 1 && isUnaryOperatorKind(op.kind())) {
            UnaryOperator unary = UnaryOperator.fromString(opText);
            if (unary != null) {
                return new UnaryOperation(span, unary, args.get(0));
            }
        }

        BinaryOperator binary = BinaryOperator.fromString(opText);
        if (binary != null) {
            if (args.size() >= 2) {
                // (+ a b c) => ((a + b) + c)
                Expression result = args.get(0);
                for (int i = 1; i < args.size(); i++) {
                    result = new BinaryOperation(span, binary, result, args.get(i));
                }
                return result;
            }
            if (args.size() == 1) {
                diagnostics.reportError(span, DiagnosticCode.UNEXPECTED_TOKEN,
                    "Binary operator '" + opText + "' requires at least two operands");
                return args.get(0);
            }
        }

        StringOp stringOp = StringOp.fromString(opText);
        if (stringOp != null) {
            return buildStringOperation(span, opText, stringOp, args);
        }

        CharOp charOp = CharOp.fromString(opText);
        if (charOp != null) {
            return buildCharOperation(span, opText, charOp, args);
        }

        StringBuilderOp builderOp = StringBuilderOp.fromString(opText);
        if (builderOp != null) {
            checkArgumentCount(span, "StringBuilder operation", opText, builderOp.minArgs(), builderOp.maxArgs(),
                args.size(), OperatorCatalog.getStringBuilderOpExample(opText));
            return new StringBuilderOperation(span, builderOp, frozen(args));
        }

        reportUnknownOperator(op, args.size());
        LOG.debug("Substituting placeholder for unknown operator '" + opText + "' at line " + op.span().line());
        return firstOrZero(args, span);
    }

    private static Expression firstOrZero(List<Expression> args, TextSpan span) {
        return args.isEmpty() ? new IntLiteral(span, 0) : args.get(0);
    }

    private static boolean isUnaryOperatorKind(TokenType kind) {
        return kind == TokenType.EXCLAMATION || kind == TokenType.TILDE
            || kind == TokenType.PLUS || kind == TokenType.MINUS || kind == TokenType.IDENTIFIER;
    }

    private StringOperation buildStringOperation(TextSpan span, String opText, StringOp op, List<Expression> args) {
        StringComparisonMode comparisonMode = null;
        List<Expression> values = args;

        Expression last = lastOrNull(args);
        if (last instanceof KeywordArgument keyword) {
            comparisonMode = StringComparisonMode.fromKeyword(keyword.name());
            if (comparisonMode == null) {
                diagnostics.reportError(keyword.span(), DiagnosticCode.INVALID_COMPARISON_MODE,
                    "Unknown comparison mode ':" + keyword.name()
                        + "'. Valid modes: ordinal, ignore-case, invariant, invariant-ignore-case");
            } else if (!op.supportsComparisonMode()) {
                diagnostics.reportError(keyword.span(), DiagnosticCode.INVALID_COMPARISON_MODE,
                    "Operation '" + opText + "' does not support comparison modes");
                comparisonMode = null;
            }
            values = args.subList(0, args.size() - 1);
        }

        StringOp resolved = op;
        int min = op.minArgs();
        int max = op.maxArgs();
        if (op == StringOp.SUBSTRING) {
            if (values.size() == 2) {
                resolved = StringOp.SUBSTRING_FROM;
            }
            min = StringOp.SUBSTRING_FROM.minArgs();
            max = StringOp.SUBSTRING.maxArgs();
        }

        checkArgumentCount(span, "String operation", opText, min, max, values.size(),
            OperatorCatalog.getStringOpExample(opText));
        return new StringOperation(span, resolved, List.copyOf(values), comparisonMode);
    }

    private CharOperation buildCharOperation(TextSpan span, String opText, CharOp op, List<Expression> args) {
        checkArgumentCount(span, "Char operation", opText, op.minArgs(), op.maxArgs(), args.size(),
            OperatorCatalog.getCharOpExample(opText));

        if (op == CharOp.CHAR_LITERAL && args.size() == 1) {
            if (args.get(0) instanceof StringLiteral literal) {
                // The lexer has already unescaped the value
                if (literal.value().length() != 1) {
                    diagnostics.reportError(span, DiagnosticCode.INVALID_CHAR_LITERAL,
                        "char-lit requires a single character, got \"" + literal.value() + "\" ("
                            + literal.value().length() + " characters). Example: (char-lit \"Y\")");
                }
            } else {
                diagnostics.reportError(span, DiagnosticCode.INVALID_CHAR_LITERAL,
                    "char-lit requires a string literal argument. Example: (char-lit \"Y\")");
            }
        }
        return new CharOperation(span, op, frozen(args));
    }

    private void checkArgumentCount(TextSpan span, String family, String opText, int min, int max,
                                    int actual, String example) {
        if (actual < min) {
            diagnostics.reportError(span, DiagnosticCode.OPERATOR_ARGUMENT_COUNT,
                family + " '" + opText + "' requires at least " + min + " argument(s), got " + actual
                    + ". Example: " + example);
        } else if (actual > max) {
            diagnostics.reportError(span, DiagnosticCode.OPERATOR_ARGUMENT_COUNT,
                family + " '" + opText + "' accepts at most " + max + " argument(s), got " + actual
                    + ". Example: " + example);
        }
    }

    /**
     * One diagnostic per unresolved operator: a hint for a construct from another language,
     * else a typo fix anchored on the operator token, else the list of operator families.
     */
    private void reportUnknownOperator(LispOperator op, int argumentCount) {
        String opText = op.text();
        TextSpan opSpan = op.span();

        String hint = OperatorCatalog.getForeignHint(opText);
        if (hint != null) {
            diagnostics.reportError(opSpan, DiagnosticCode.INVALID_OPERATOR,
                "Unknown operator '" + opText + "'. " + hint);
            return;
        }

        if (OperatorCatalog.isKnownOperator(opText)) {
            diagnostics.reportError(opSpan, DiagnosticCode.OPERATOR_ARGUMENT_COUNT,
                "Operator '" + opText + "' cannot be applied to " + argumentCount + " argument(s)");
            return;
        }

        String suggestion = OperatorCatalog.findSimilarOperator(opText, options.maxSuggestionDistance());
        if (suggestion != null) {
            TextEdit edit = TextEdit.replace(diagnostics.getCurrentFilePath(), opSpan.line(), opSpan.column(),
                opSpan.line(), opSpan.column() + opText.length(), suggestion);
            SuggestedFix fix = new SuggestedFix("Replace '" + opText + "' with '" + suggestion + "'", edit);
            diagnostics.reportErrorWithFix(opSpan, DiagnosticCode.INVALID_OPERATOR,
                "Unknown operator '" + opText + "'. Did you mean '" + suggestion + "'?", fix);
            return;
        }

        diagnostics.reportError(opSpan, DiagnosticCode.INVALID_OPERATOR,
            "Unknown operator '" + opText + "'. Valid operators include: " + OperatorCatalog.getOperatorCategories());
    }

    private LispOperator parseLispOperator() {
        Token token = current();
        TextSpan span = token.span();
        String symbol = operatorSymbol(token.type());
        if (symbol != null) {
            advance();
            // The lexer has no ++ or -- token: join two adjacent signs
            if ((token.type() == TokenType.PLUS || token.type() == TokenType.MINUS)
                && check(token.type()) && current().span().start() == span.end()) {
                Token second = advance();
                return new LispOperator(token.type(), symbol + symbol, span.union(second.span()), true);
            }
            return new LispOperator(token.type(), symbol, span, true);
        }

        if (token.type() == TokenType.IDENTIFIER) {
            advance();
            // Hyphenated names arrive as separate tokens: char - at
            StringBuilder name = new StringBuilder(token.text());
            TextSpan endSpan = span;
            while (check(TokenType.MINUS) && checkAhead(1, TokenType.IDENTIFIER)) {
                advance();
                Token part = advance();
                name.append('-').append(part.text());
                endSpan = part.span();
            }
            String text = name.toString();
            return new LispOperator(TokenType.IDENTIFIER, normalizeWordOperator(text), span.union(endSpan), true);
        }

        String hint;
        switch (token.type()) {
            case INT_LITERAL:
            case FLOAT_LITERAL:
            case DECIMAL_LITERAL:
                hint = "Operators come before arguments: (+ 1 2) not (1 + 2)";
                break;
            case STR_LITERAL:
                hint = "Operators come before arguments: (contains str \"x\") not (str contains \"x\")";
                break;
            case OPEN_PAREN:
                hint = "Nested expression found where operator expected. Check parentheses balance.";
                break;
            case CLOSE_PAREN:
                hint = "Unexpected closing parenthesis. Check parentheses balance.";
                break;
            default:
                hint = "Valid operators: " + OperatorCatalog.getOperatorCategories();
                break;
        }
        diagnostics.reportError(span, DiagnosticCode.INVALID_LISP_EXPRESSION,
            "Expected operator in Lisp expression, found '" + token.text() + "'. " + hint);
        // A stray ')' closes the expression, so leave it for the caller
        if (token.type() != TokenType.CLOSE_PAREN) {
            advance();
        }
        return new LispOperator(token.type(), token.text(), span, false);
    }

    private static String operatorSymbol(TokenType type) {
        switch (type) {
            case PLUS: return "+";
            case MINUS: return "-";
            case STAR: return "*";
            case STAR_STAR: return "**";
            case SLASH: return "/";
            case PERCENT: return "%";
            case EQUAL_EQUAL: return "==";
            case BANG_EQUAL: return "!=";
            case LESS: return "<";
            case LESS_EQUAL: return "<=";
            case GREATER: return ">";
            case GREATER_EQUAL: return ">=";
            case AMP_AMP: return "&&";
            case PIPE_PIPE: return "||";
            case AMP: return "&";
            case PIPE: return "|";
            case CARET: return "^";
            case LESS_LESS: return "<<";
            case GREATER_GREATER: return ">>";
            case EXCLAMATION: return "!";
            case TILDE: return "~";
            case NULL_COALESCE: return "??";
            case QUESTION: return "?";
            case ARROW: return "->";
            default: return null;
        }
    }

    private static String normalizeWordOperator(String text) {
        switch (text.toLowerCase(Locale.ROOT)) {
            case "and": return "&&";
            case "or": return "||";
            case "not": return "!";
            case "mod": return "%";
            case "eq": return "==";
            case "ne":
            case "neq":
                return "!=";
            case "lt": return "<";
            case "le":
            case "lte":
                return "<=";
            case "gt": return ">";
            case "ge":
            case "gte":
                return ">=";
            default: return text;
        }
    }

    /**
     * {@code (forall ((x i32) (y i32)) body)}. An empty binding list is reported and replaced
     * by a single {@code _dummy} binding so the body still parses.
     */
    private Expression parseQuantifierExpression(Token startToken, QuantifierKind kind) {
        expect(TokenType.OPEN_PAREN);
        List<QuantifierVariable> bound = new ArrayList<>();
        while (check(TokenType.OPEN_PAREN)) {
            Token bindingStart = advance();
            Token nameToken = expect(TokenType.IDENTIFIER);
            Token typeToken = expect(TokenType.IDENTIFIER);
            Token bindingEnd = expect(TokenType.CLOSE_PAREN);
            bound.add(new QuantifierVariable(bindingStart.span().union(bindingEnd.span()),
                nameToken.text(), typeToken.text()));
        }
        expect(TokenType.CLOSE_PAREN);

        if (bound.isEmpty()) {
            String keyword = kind == QuantifierKind.FORALL ? "forall" : "exists";
            diagnostics.reportError(startToken.span(), DiagnosticCode.QUANTIFIER_NO_BOUND_VARS,
                "Quantifier '" + keyword + "' must have at least one bound variable");
            bound.add(new QuantifierVariable(startToken.span(), "_dummy", "i32"));
        }

        Expression body = parseLispArgument();
        Token endToken = expect(TokenType.CLOSE_PAREN);
        return new QuantifierExpression(startToken.span().union(endToken.span()), kind, frozen(bound), body);
    }

    private Expression parseImplicationExpression(Token startToken) {
        Expression antecedent = parseLispArgument();
        Expression consequent = parseLispArgument();
        Token endToken = expect(TokenType.CLOSE_PAREN);
        return new ImplicationExpression(startToken.span().union(endToken.span()), antecedent, consequent);
    }

    /**
     * A prefix-expression argument: a literal, a bare name, a nested expression, a call,
     * {@code §NEW} or {@code §AWAIT}, or a {@code :keyword}. Member access, indexing and an
     * {@code is} pattern may follow.
     */
    private Expression parseLispArgument() {
        if (check(TokenType.COLON)) {
            return parseKeywordArgument();
        }

        Expression expr;
        switch (current().type()) {
            case INT_LITERAL: expr = parseIntLiteral(); break;
            case STR_LITERAL: expr = parseStringLiteral(); break;
            case BOOL_LITERAL: expr = parseBoolLiteral(); break;
            case FLOAT_LITERAL: expr = parseFloatLiteral(); break;
            case DECIMAL_LITERAL: expr = parseDecimalLiteral(); break;
            case IDENTIFIER: {
                Token token = advance();
                expr = new Reference(token.span(), token.text());
                break;
            }
            case OPEN_PAREN: expr = parseLispExpression(); break;
            case CALL: expr = parseCallExpression(); break;
            case NEW: expr = parseNewExpression(); break;
            case AWAIT: expr = parseAwaitExpression(); break;
            default: {
                Token token = current();
                String hint;
                switch (token.type()) {
                    case PLUS:
                    case MINUS:
                    case STAR:
                    case SLASH:
                        hint = "Operators come before arguments in Lisp syntax: (+ a b) not (a + b)";
                        break;
                    case EQUAL_EQUAL:
                    case BANG_EQUAL:
                    case LESS:
                    case GREATER:
                        hint = "Comparison operators come first: (== a b) not (a == b)";
                        break;
                    case AMP_AMP:
                    case PIPE_PIPE:
                        hint = "Logical operators come first: (&& a b) not (a && b)";
                        break;
                    case CLOSE_PAREN:
                        hint = "Unexpected closing parenthesis. Check expression structure.";
                        break;
                    default:
                        hint = "Expected a value (number, string, variable) or nested expression";
                        break;
                }
                diagnostics.reportError(token.span(), DiagnosticCode.UNEXPECTED_TOKEN,
                    "Unexpected token '" + token.text() + "' in expression argument. " + hint);
                advance();
                expr = new IntLiteral(token.span(), 0);
                break;
            }
        }

        expr = parseTrailingMemberAccess(expr);

        if (check(TokenType.IDENTIFIER) && current().text().equals("is")) {
            expr = parseIsPatternExpression(expr);
        }
        return expr;
    }

    private Expression parseKeywordArgument() {
        Token colon = advance();
        if (!check(TokenType.IDENTIFIER)) {
            diagnostics.reportError(colon.span(), DiagnosticCode.UNEXPECTED_TOKEN,
                "Expected identifier after ':' for keyword argument");
            return new IntLiteral(colon.span(), 0);
        }
        Token first = advance();
        StringBuilder name = new StringBuilder(first.text());
        TextSpan endSpan = first.span();
        while (check(TokenType.MINUS) && checkAhead(1, TokenType.IDENTIFIER)) {
            advance();
            Token part = advance();
            name.append('-').append(part.text());
            endSpan = part.span();
        }
        return new KeywordArgument(colon.span().union(endSpan), name.toString());
    }

    /**
     * {@code .Member}, {@code ?.Member} and {@code {index}} chains after an operand.
     */
    private Expression parseTrailingMemberAccess(Expression expr) {
        while (check(TokenType.DOT) || check(TokenType.NULL_CONDITIONAL) || check(TokenType.OPEN_BRACE)) {
            if (match(TokenType.OPEN_BRACE)) {
                Expression index = parseLispArgument();
                Token endToken = expect(TokenType.CLOSE_BRACE);
                expr = new ArrayAccess(expr.span().union(endToken.span()), expr, index);
                continue;
            }
            boolean nullConditional = check(TokenType.NULL_CONDITIONAL);
            advance();
            Token member = expect(TokenType.IDENTIFIER);
            TextSpan span = expr.span().union(member.span());
            expr = nullConditional
                ? new NullConditional(span, expr, member.text())
                : new FieldAccess(span, expr, member.text());
        }
        return expr;
    }

    /**
     * Type name inside a prefix expression: dotted names, generic arguments (a {@code >>}
     * token closes two levels), then an optional {@code ?} and {@code []}.
     */
    private String parseLispTypeName() {
        if (!check(TokenType.IDENTIFIER)) {
            diagnostics.reportError(current().span(), DiagnosticCode.EXPECTED_TYPE_NAME,
                "Expected type name, found '" + current().text() + "'");
            return "object";
        }

        StringBuilder sb = new StringBuilder(advance().text());
        while (check(TokenType.DOT) || check(TokenType.LESS)) {
            if (match(TokenType.DOT)) {
                sb.append('.');
                if (check(TokenType.IDENTIFIER)) {
                    sb.append(advance().text());
                }
                continue;
            }
            advance();
            sb.append('<');
            int depth = 1;
            while (depth > 0 && !isAtEnd()) {
                if (match(TokenType.LESS)) {
                    depth++;
                    sb.append('<');
                } else if (match(TokenType.GREATER_GREATER)) {
                    if (depth == 1) {
                        depth = 0;
                        sb.append('>');
                    } else {
                        depth -= 2;
                        sb.append(">>");
                    }
                } else if (match(TokenType.GREATER)) {
                    depth--;
                    sb.append('>');
                } else if (check(TokenType.CLOSE_PAREN)) {
                    break;
                } else {
                    sb.append(current().text());
                    if (check(TokenType.COMMA)) {
                        sb.append(' ');
                    }
                    advance();
                }
            }
        }

        if (match(TokenType.QUESTION)) {
            sb.append('?');
        }
        if (check(TokenType.OPEN_BRACKET) && checkAhead(1, TokenType.CLOSE_BRACKET)) {
            advance();
            advance();
            sb.append("[]");
        }
        return sb.toString();
    }

    private Expression parseLispIsExpression(Token startToken) {
        Expression operand = parseLispArgument();
        String typeName = parseLispTypeName();
        String variableName = parsePatternVariableName();
        Token endToken = expect(TokenType.CLOSE_PAREN);
        return new IsPatternExpression(startToken.span().union(endToken.span()), operand, typeName, variableName);
    }

    /**
     * {@code (cast Type expr)}. The target uses the same type-name grammar as {@code is} and
     * {@code as}, so generic and nullable targets survive.
     */
    private Expression parseLispCastExpression(Token startToken) {
        String typeName = parseLispTypeName();
        List<Expression> args = new ArrayList<>();
        while (!check(TokenType.CLOSE_PAREN) && !isAtEnd()) {
            args.add(parseLispArgument());
        }
        Token endToken = expect(TokenType.CLOSE_PAREN);
        TextSpan span = startToken.span().union(endToken.span());
        if (args.size() != 1) {
            diagnostics.reportError(span, DiagnosticCode.OPERATOR_ARGUMENT_COUNT,
                "Type operation 'cast' requires exactly 2 arguments, got " + (args.size() + 1)
                    + ". Example: " + OperatorCatalog.getTypeOpExample("cast"));
            return firstOrZero(args, span);
        }
        return new TypeOperation(span, TypeOp.CAST, args.get(0), typeName);
    }

    private Expression parseLispAsExpression(Token startToken) {
        Expression operand = parseLispArgument();
        String typeName = parseLispTypeName();
        Token endToken = expect(TokenType.CLOSE_PAREN);
        return new TypeOperation(startToken.span().union(endToken.span()), TypeOp.AS, operand, typeName);
    }

    /**
     * {@code operand is Type [name]}, with the cursor on {@code is}.
     */
    private Expression parseIsPatternExpression(Expression left) {
        advance();
        String typeName = parseLispTypeName();
        String variableName = parsePatternVariableName();
        return new IsPatternExpression(left.span().union(previous().span()), left, typeName, variableName);
    }

    private String parsePatternVariableName() {
        if (check(TokenType.IDENTIFIER)) {
            String text = current().text();
            if (!text.equals("and") && !text.equals("or") && !text.equals("not")) {
                advance();
                return text;
            }
        }
        return null;
    }

    // ========================================================================
    // Literals and references
    // ========================================================================

    private IntLiteral parseIntLiteral() {
        Token token = expect(TokenType.INT_LITERAL);
        int value = token.value() instanceof Integer i ? i : 0;
        return new IntLiteral(token.span(), value);
    }

    private StringLiteral parseStringLiteral() {
        Token token = expect(TokenType.STR_LITERAL);
        String value = token.value() instanceof String s ? s : "";
        return new StringLiteral(token.span(), value, token.text().startsWith("\"\"\""));
    }

    private BoolLiteral parseBoolLiteral() {
        Token token = expect(TokenType.BOOL_LITERAL);
        return new BoolLiteral(token.span(), Boolean.TRUE.equals(token.value()));
    }

    private FloatLiteral parseFloatLiteral() {
        Token token = expect(TokenType.FLOAT_LITERAL);
        double value = token.value() instanceof Double d ? d : 0.0;
        return new FloatLiteral(token.span(), value);
    }

    private DecimalLiteral parseDecimalLiteral() {
        Token token = expect(TokenType.DECIMAL_LITERAL);
        BigDecimal value = token.value() instanceof BigDecimal d ? d : BigDecimal.ZERO;
        return new DecimalLiteral(token.span(), value);
    }

    private Expression parseReference() {
        Token token = expect(TokenType.IDENTIFIER);
        Expression expr = new Reference(token.span(), token.text());
        while (check(TokenType.DOT) || check(TokenType.NULL_CONDITIONAL)) {
            boolean nullConditional = check(TokenType.NULL_CONDITIONAL);
            advance();
            Token member = expect(TokenType.IDENTIFIER);
            TextSpan span = expr.span().union(member.span());
            expr = nullConditional
                ? new NullConditional(span, expr, member.text())
                : new FieldAccess(span, expr, member.text());
        }
        return expr;
    }

    // ========================================================================
    // Option, Result and records
    // ========================================================================

    private SomeExpression parseSomeExpression() {
        Token startToken = expect(TokenType.SOME);
        Expression value = parseExpression();
        return new SomeExpression(startToken.span().union(value.span()), value);
    }

    private NoneExpression parseNoneExpression() {
        Token startToken = expect(TokenType.NONE);
        String typeName = parseAttributes().positional(0);
        if (typeName != null && !typeName.isEmpty()) {
            typeName = AttributeInterpreter.expandType(typeName);
        }
        return new NoneExpression(startToken.span(), typeName);
    }

    private OkExpression parseOkExpression() {
        Token startToken = expect(TokenType.OK);
        Expression value = parseExpression();
        return new OkExpression(startToken.span().union(value.span()), value);
    }

    private ErrExpression parseErrExpression() {
        Token startToken = expect(TokenType.ERR);
        Expression error = parseExpression();
        return new ErrExpression(startToken.span().union(error.span()), error);
    }

    private RecordCreation parseRecordCreation() {
        Token startToken = expect(TokenType.RECORD);
        String typeName = getRequiredAttribute(parseAttributes(), "type", "RECORD", startToken.span());

        List<FieldAssignment> fields = new ArrayList<>();
        while (check(TokenType.FIELD)) {
            Token fieldToken = advance();
            String fieldName = getRequiredAttribute(parseAttributes(), "name", "FIELD", fieldToken.span());
            Expression value = parseExpression();
            fields.add(new FieldAssignment(fieldToken.span().union(value.span()), fieldName, value));
        }

        FieldAssignment last = lastOrNull(fields);
        TextSpan span = last != null ? startToken.span().union(last.span()) : startToken.span();
        return new RecordCreation(span, typeName, frozen(fields));
    }

    // ========================================================================
    // Match and patterns
    // ========================================================================

    private MatchExpression parseMatchExpression() {
        Token startToken = expect(TokenType.MATCH);
        String id = requireId(parseAttributes().positional(0), startToken, "MATCH");
        Expression target = parseExpression();
        List<MatchCase> cases = parseMatchCases();
        Token endToken = expectClose(TokenType.END_MATCH, "MATCH", id, "END_MATCH");
        return new MatchExpression(startToken.span().union(endToken.span()), id, target, frozen(cases));
    }

    /**
     * {@code §W{id}} as a statement. {@code §W{id:expr}} marks the match as the value of the
     * enclosing function and comes back wrapped in a return.
     */
    private Statement parseMatchStatement() {
        Token startToken = expect(TokenType.MATCH);
        AttributeCollection attrs = parseAttributes();
        String id = requireId(attrs.positional(0), startToken, "MATCH");
        boolean asExpression = "expr".equals(attrs.positional(1));

        Expression target = parseExpression();
        List<MatchCase> cases = parseMatchCases();
        Token endToken = expectClose(TokenType.END_MATCH, "MATCH", id, "END_MATCH");
        TextSpan span = startToken.span().union(endToken.span());

        if (asExpression) {
            return new ReturnStatement(span, new MatchExpression(span, id, target, frozen(cases)));
        }
        return new MatchStatement(span, id, target, frozen(cases));
    }

    private List<MatchCase> parseMatchCases() {
        List<MatchCase> cases = new ArrayList<>();
        while (check(TokenType.CASE)) {
            Token caseToken = advance();
            Pattern pattern = parsePattern();

            Expression guard = null;
            if (match(TokenType.WHEN)) {
                guard = parseExpression();
            }

            List<Statement> body = new ArrayList<>();
            if (match(TokenType.ARROW)) {
                Expression value = parseExpression();
                body.add(new ReturnStatement(value.span(), value));
            } else {
                body.addAll(parseStatementBlock(TokenType.CASE, TokenType.END_MATCH, TokenType.END_CASE));
                match(TokenType.END_CASE);
            }

            Statement last = lastOrNull(body);
            TextSpan span = last != null ? caseToken.span().union(last.span()) : caseToken.span();
            cases.add(new MatchCase(span, pattern, guard, frozen(body)));
        }
        return cases;
    }

    private boolean isPatternStart() {
        return checkAny(TokenType.POSITIONAL_PATTERN, TokenType.PROPERTY_PATTERN, TokenType.LIST_PATTERN,
            TokenType.VAR, TokenType.RELATIONAL_PATTERN) || isExpressionStart();
    }

    private Pattern parsePattern() {
        switch (current().type()) {
            case VAR: {
                Token token = advance();
                AttributeCollection attrs = parseAttributes();
                String name = attrs.positionalOrNamed(0, "name");
                return new VarPattern(token.span(), name == null ? "_" : name);
            }
            case RELATIONAL_PATTERN: {
                Token token = advance();
                String op = attrs0OrDefault(parseAttributes(), "op", "gte");
                Expression operand = parseExpression();
                return new RelationalPattern(token.span().union(operand.span()), relationalSymbol(op), operand);
            }
            case POSITIONAL_PATTERN:
                return parsePositionalPattern();
            case PROPERTY_PATTERN:
                return parsePropertyPattern();
            case LIST_PATTERN:
                return parseListPattern();
            case IDENTIFIER:
                return parseIdentifierPattern();
            case INT_LITERAL:
            case STR_LITERAL:
            case BOOL_LITERAL:
            case FLOAT_LITERAL:
            case DECIMAL_LITERAL: {
                Expression literal = parseExpression();
                return new LiteralPattern(literal.span(), literal);
            }
            case SOME: {
                Token token = advance();
                Pattern inner = parsePattern();
                return new SomePattern(token.span().union(inner.span()), inner);
            }
            case NONE:
                return new NonePattern(advance().span());
            case OK: {
                Token token = advance();
                Pattern inner = parsePattern();
                return new OkPattern(token.span().union(inner.span()), inner);
            }
            case ERR: {
                Token token = advance();
                Pattern inner = parsePattern();
                return new ErrPattern(token.span().union(inner.span()), inner);
            }
            default:
                if (isExpressionStart()) {
                    Expression value = parseExpression();
                    return new ConstantPattern(value.span(), value);
                }
                // Nothing to match against: the case matches everything
                return new WildcardPattern(current().span());
        }
    }

    private static String attrs0OrDefault(AttributeCollection attrs, String name, String defaultValue) {
        String value = attrs.positionalOrNamed(0, name);
        return value == null || value.isEmpty() ? defaultValue : value;
    }

    private static String relationalSymbol(String keyword) {
        switch (keyword) {
            case "lte": return "<=";
            case "gt": return ">";
            case "lt": return "<";
            default: return ">=";
        }
    }

    /**
     * Legacy bare-word patterns: {@code gte 18}, {@code var x}, {@code null}, {@code _} or a name.
     */
    private Pattern parseIdentifierPattern() {
        Token token = current();
        String text = token.text();
        if (text.equals("gte") || text.equals("lte") || text.equals("gt") || text.equals("lt")) {
            advance();
            Expression operand = parseExpression();
            return new RelationalPattern(token.span().union(operand.span()), relationalSymbol(text), operand);
        }
        if (text.equals("var") && checkAhead(1, TokenType.IDENTIFIER)) {
            advance();
            Token name = advance();
            return new VarPattern(token.span().union(name.span()), name.text());
        }
        advance();
        if (text.equals("null")) {
            return new ConstantPattern(token.span(), new Reference(token.span(), "null"));
        }
        if (text.equals("_")) {
            return new WildcardPattern(token.span());
        }
        return new VariablePattern(token.span(), text);
    }

    private PositionalPattern parsePositionalPattern() {
        Token startToken = expect(TokenType.POSITIONAL_PATTERN);
        String typeName = parseAttributes().positionalOr(0, "");
        List<Pattern> patterns = new ArrayList<>();
        while (!isAtEnd() && isPatternStart()) {
            patterns.add(parsePattern());
        }
        Pattern last = lastOrNull(patterns);
        TextSpan span = last != null ? startToken.span().union(last.span()) : startToken.span();
        return new PositionalPattern(span, typeName, frozen(patterns));
    }

    private PropertyPattern parsePropertyPattern() {
        Token startToken = expect(TokenType.PROPERTY_PATTERN);
        String typeName = parseAttributes().positional(0);
        List<PropertyMatch> matches = new ArrayList<>();
        while (check(TokenType.PROPERTY_MATCH)) {
            Token matchToken = advance();
            String propertyName = parseAttributes().positionalOr(0, "");
            Pattern pattern = parsePattern();
            matches.add(new PropertyMatch(matchToken.span().union(pattern.span()), propertyName, pattern));
        }
        PropertyMatch last = lastOrNull(matches);
        TextSpan span = last != null ? startToken.span().union(last.span()) : startToken.span();
        return new PropertyPattern(span, typeName, frozen(matches));
    }

    private ListPattern parseListPattern() {
        Token startToken = expect(TokenType.LIST_PATTERN);
        List<Pattern> patterns = new ArrayList<>();
        String rest = null;
        TextSpan endSpan = startToken.span();
        while (!isAtEnd() && (check(TokenType.REST) || isPatternStart())) {
            if (check(TokenType.REST)) {
                Token restToken = advance();
                rest = parseAttributes().positionalOr(0, "_");
                endSpan = restToken.span();
            } else {
                Pattern pattern = parsePattern();
                patterns.add(pattern);
                endSpan = pattern.span();
            }
        }
        return new ListPattern(startToken.span().union(endSpan), frozen(patterns), rest);
    }

    // ========================================================================
    // Loops and conditionals
    // ========================================================================

    /**
     * {@code §L{id:var:from:to[:step]}}. Bounds are literals, names or parenthesized
     * expressions written inside the attribute block.
     */
    private ForStatement parseForStatement() {
        Token startToken = expect(TokenType.FOR);
        AttributeCollection attrs = parseAttributes();
        AttributeInterpreter.ForSpec spec = AttributeInterpreter.interpretFor(attrs);
        String id = requireId(spec.id(), startToken, "FOR");
        if (spec.variable().isEmpty()) {
            diagnostics.reportMissingRequiredAttribute(startToken.span(), "FOR", "var");
        }

        Expression from = spec.from().isEmpty()
            ? parseExpression()
            : parseIsland(spec.from(), attrs.positionalSpan(2), startToken.span());
        Expression to = spec.to().isEmpty()
            ? parseExpression()
            : parseIsland(spec.to(), attrs.positionalSpan(3), startToken.span());
        Expression step = parseIsland(spec.step(), attrs.positionalSpan(4), startToken.span());

        List<Statement> body = parseStatementBlock(TokenType.END_FOR);
        Token endToken = expectClose(TokenType.END_FOR, "FOR", id, "END_FOR");
        return new ForStatement(startToken.span().union(endToken.span()), id, spec.variable(), from, to, step, frozen(body));
    }

    private WhileStatement parseWhileStatement() {
        Token startToken = expect(TokenType.WHILE);
        String id = requireId(parseAttributes().positionalOrNamed(0, "id"), startToken, "WHILE");
        Expression condition = parseExpression();
        List<Statement> body = parseStatementBlock(TokenType.END_WHILE);
        Token endToken = expectClose(TokenType.END_WHILE, "WHILE", id, "END_WHILE");
        return new WhileStatement(startToken.span().union(endToken.span()), id, condition, frozen(body));
    }

    /**
     * {@code §DO{id} ... §/DO{id} condition}: the condition follows the close tag.
     */
    private DoWhileStatement parseDoWhileStatement() {
        Token startToken = expect(TokenType.DO);
        String id = requireId(parseAttributes().positionalOrNamed(0, "id"), startToken, "DO");
        List<Statement> body = parseStatementBlock(TokenType.END_DO);
        expectClose(TokenType.END_DO, "DO", id, "END_DO");
        Expression condition = parseExpression();
        return new DoWhileStatement(startToken.span().union(condition.span()), id, frozen(body), condition);
    }

    /**
     * {@code §IF{id} cond → a §EL → b §/I{id}} as a conditional expression.
     */
    private Expression parseIfExpression() {
        Token startToken = expect(TokenType.IF);
        parseAttributes();
        Expression condition = parseExpression();

        if (!match(TokenType.ARROW)) {
            diagnostics.reportError(current().span(), DiagnosticCode.UNEXPECTED_TOKEN,
                "Expected '→' after IF condition in expression context");
            return new IntLiteral(startToken.span(), 0);
        }
        Expression whenTrue = parseExpression();

        if (!match(TokenType.ELSE)) {
            diagnostics.reportError(current().span(), DiagnosticCode.MISMATCHED_ID,
                "IF expression requires an else clause (§EL)");
            return whenTrue;
        }
        if (!match(TokenType.ARROW)) {
            diagnostics.reportError(current().span(), DiagnosticCode.MISSING_REQUIRED_ATTRIBUTE,
                "Expected '→' after §EL in IF expression");
            return whenTrue;
        }
        Expression whenFalse = parseExpression();

        TextSpan endSpan = whenFalse.span();
        if (check(TokenType.END_IF)) {
            endSpan = advance().span();
            parseAttributes();
        }
        return new ConditionalExpression(startToken.span().union(endSpan), condition, whenTrue, whenFalse);
    }

    /**
     * Block form, or arrow form where each branch is {@code → statement}. Both accept
     * {@code §EI} and {@code §EL} clauses before {@code §/I}.
     */
    private IfStatement parseIfStatement() {
        Token startToken = expect(TokenType.IF);
        String id = requireId(parseAttributes().positionalOrNamed(0, "id"), startToken, "IF");
        Expression condition = parseExpression();

        List<Statement> thenBody = parseBranch();
        List<ElseIfClause> elseIfClauses = new ArrayList<>();
        while (check(TokenType.ELSE_IF)) {
            Token elseIfToken = advance();
            Expression elseIfCondition = parseExpression();
            List<Statement> elseIfBody = parseBranch();
            elseIfClauses.add(new ElseIfClause(elseIfToken.span(), elseIfCondition, frozen(elseIfBody)));
        }

        List<Statement> elseBody = null;
        if (match(TokenType.ELSE)) {
            elseBody = parseBranch();
        }

        Token endToken = expectClose(TokenType.END_IF, "IF", id, "END_IF");
        return new IfStatement(startToken.span().union(endToken.span()), id, condition, frozen(thenBody),
            frozen(elseIfClauses), frozen(elseBody));
    }

    private List<Statement> parseBranch() {
        if (match(TokenType.ARROW)) {
            List<Statement> single = new ArrayList<>();
            Statement statement = parseStatement();
            if (statement != null) {
                single.add(statement);
            }
            return single;
        }
        return parseStatementBlock(TokenType.END_IF, TokenType.ELSE, TokenType.ELSE_IF);
    }

    // ========================================================================
    // Attribute blocks
    // ========================================================================

    /**
     * Zero or more {@code {a:b:c}} groups. Positions continue across groups, so
     * {@code {a}{b}} and {@code {a:b}} are read the same way.
     */
    private AttributeCollection parseAttributes() {
        AttributeCollection attrs = new AttributeCollection();
        while (match(TokenType.OPEN_BRACE)) {
            do {
                int first = position;
                String value = parseValue();
                TextSpan span = position > first ? tokens.get(first).span().union(previous().span()) : null;
                attrs.addPositional(value, span);
            } while (match(TokenType.COLON));
            expect(TokenType.CLOSE_BRACE);
        }
        return attrs;
    }

    private String parseValue() {
        StringBuilder sb = new StringBuilder();

        if (match(TokenType.TILDE)) {
            sb.append('~');
        }
        if (match(TokenType.HASH)) {
            sb.append('#');
        }
        if (match(TokenType.QUESTION)) {
            sb.append('?');
        }

        if (check(TokenType.OPEN_BRACKET)) {
            return parseArrayTypeValue(sb);
        }

        if (check(TokenType.IDENTIFIER)) {
            sb.append(advance().text());
            if (check(TokenType.LESS)) {
                appendGenericArguments(sb);
            }
            while (check(TokenType.DOT)) {
                sb.append('.');
                advance();
                if (check(TokenType.IDENTIFIER)) {
                    sb.append(advance().text());
                }
            }
            // Modifier lists such as partial,static
            while (check(TokenType.COMMA) && checkAhead(1, TokenType.IDENTIFIER)) {
                advance();
                sb.append(',').append(advance().text());
            }
        } else if (check(TokenType.STR_LITERAL)) {
            sb.append(literalText(advance()));
        } else if (check(TokenType.INT_LITERAL) || check(TokenType.BOOL_LITERAL)) {
            sb.append(literalText(advance()));
        }

        // Fallible call target or T!E result type
        if (match(TokenType.EXCLAMATION)) {
            sb.append('!');
            if (check(TokenType.IDENTIFIER)) {
                sb.append(advance().text());
            }
        }

        appendValueContinuation(sb);
        return sb.toString();
    }

    private String parseArrayTypeValue(StringBuilder sb) {
        int depth = 0;
        while (match(TokenType.OPEN_BRACKET)) {
            sb.append('[');
            depth++;
        }
        if (check(TokenType.IDENTIFIER)) {
            sb.append(advance().text());
            if (check(TokenType.LESS)) {
                appendGenericArguments(sb);
            }
        }
        while (depth > 0 && match(TokenType.CLOSE_BRACKET)) {
            sb.append(']');
            depth--;
        }
        return sb.toString();
    }

    /**
     * Copies {@code <...>} verbatim, tracking nesting; a {@code >>} token closes two levels,
     * or only the last open one.
     */
    private void appendGenericArguments(StringBuilder sb) {
        advance();
        sb.append('<');
        int depth = 1;
        while (!isAtEnd() && depth > 0) {
            if (match(TokenType.LESS)) {
                sb.append('<');
                depth++;
            } else if (match(TokenType.GREATER)) {
                sb.append('>');
                depth--;
            } else if (match(TokenType.GREATER_GREATER)) {
                if (depth == 1) {
                    sb.append('>');
                    depth = 0;
                } else {
                    sb.append(">>");
                    depth -= 2;
                }
            } else if (check(TokenType.IDENTIFIER)) {
                sb.append(advance().text());
            } else if (match(TokenType.COMMA)) {
                sb.append(',');
            } else if (match(TokenType.QUESTION)) {
                sb.append('?');
            } else if (match(TokenType.DOT)) {
                sb.append('.');
            } else {
                break;
            }
        }
    }

    /**
     * Remaining tokens up to the next {@code :} or closing brace, re-spaced so that a
     * parenthesized expression survives being lexed again.
     */
    private void appendValueContinuation(StringBuilder sb) {
        while (!isAtEnd() && !check(TokenType.COLON) && !check(TokenType.CLOSE_BRACE)) {
            if (check(TokenType.BACKSLASH)
                && (checkAhead(1, TokenType.OPEN_BRACE) || checkAhead(1, TokenType.CLOSE_BRACE))) {
                advance();
                sb.append(advance().type() == TokenType.OPEN_BRACE ? '{' : '}');
                continue;
            }

            Token token = current();
            switch (token.type()) {
                case IDENTIFIER:
                case INT_LITERAL:
                case FLOAT_LITERAL:
                case DECIMAL_LITERAL:
                case BOOL_LITERAL:
                    separate(sb);
                    sb.append(literalText(token));
                    break;
                case STR_LITERAL:
                    separate(sb);
                    sb.append('"').append(literalText(token)).append('"');
                    break;
                case DOT: sb.append('.'); break;
                case OPEN_PAREN: sb.append('('); break;
                case CLOSE_PAREN: sb.append(')'); break;
                case LESS: sb.append('<'); break;
                case GREATER: sb.append('>'); break;
                case EXCLAMATION: sb.append('!'); break;
                case COMMA:
                    if (checkAhead(1, TokenType.CLOSE_BRACE)) {
                        return;
                    }
                    sb.append(',');
                    break;
                default: {
                    String symbol = spacedOperator(token.type());
                    if (symbol == null) {
                        return;
                    }
                    sb.append(' ').append(symbol).append(' ');
                    break;
                }
            }
            advance();
        }
    }

    private static void separate(StringBuilder sb) {
        if (sb.length() > 0) {
            char last = sb.charAt(sb.length() - 1);
            if (!Character.isWhitespace(last) && last != '(') {
                sb.append(' ');
            }
        }
    }

    private static String spacedOperator(TokenType type) {
        switch (type) {
            case PLUS: return "+";
            case MINUS: return "-";
            case STAR: return "*";
            case SLASH: return "/";
            case PERCENT: return "%";
            case EQUAL_EQUAL: return "==";
            case BANG_EQUAL: return "!=";
            case LESS_EQUAL: return "<=";
            case GREATER_EQUAL: return ">=";
            case AMP_AMP: return "&&";
            case PIPE_PIPE: return "||";
            case AMP: return "&";
            case PIPE: return "|";
            case CARET: return "^";
            default: return null;
        }
    }

    private static String literalText(Token token) {
        Object value = token.value();
        if (value == null) {
            return token.text();
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.toPlainString();
        }
        return value.toString();
    }

    // ========================================================================
    // Embedded expressions
    // ========================================================================

    /**
     * Expression written as text inside an attribute position. Parenthesized text is lexed
     * again and parsed with a nested parser sharing this parser's diagnostics; anything it
     * cannot parse cleanly degrades to a reference to the raw text. When {@code valueSpan} is
     * known the island is re-read from the source tokens it came from, and its spans are
     * shifted to file coordinates.
     */
    private Expression parseIsland(String text, TextSpan valueSpan, TextSpan fallbackSpan) {
        TextSpan span = valueSpan != null ? valueSpan : fallbackSpan;
        if (text.isBlank()) {
            diagnostics.reportError(span, DiagnosticCode.EXPECTED_KEYWORD, "Empty embedded expression");
            return new IntLiteral(span, 0);
        }
        if (!text.startsWith("(")) {
            try {
                return new IntLiteral(span, Integer.parseInt(text));
            } catch (NumberFormatException e) {
                return new Reference(span, text);
            }
        }

        String source = valueSpan != null ? sourceText(valueSpan) : text;
        // Characters were already reported when the enclosing source was lexed
        List<Token> lexed = new Lexer(source, new DiagnosticBag(), options.maxSuggestionDistance()).tokenize();
        List<Token> islandTokens = new ArrayList<>(lexed.size());
        for (Token token : lexed) {
            islandTokens.add(new Token(token.type(), token.text(), token.value(), shift(token.span(), span)));
        }

        int errorsBefore = diagnostics.errorCount();
        LOG.debug("Parsing embedded expression '" + text + "' at " + span.line() + ":" + span.column());
        Parser island = new Parser(islandTokens, diagnostics, options);
        Expression expression = island.parseExpression();
        if (!island.isAtEnd()) {
            diagnostics.reportError(span, DiagnosticCode.EXPECTED_EXPRESSION,
                "Failed to parse embedded expression: " + text);
        }
        if (diagnostics.errorCount() > errorsBefore) {
            LOG.debug("Embedded expression '" + text + "' degraded to a reference");
            return new Reference(span, stripParens(text));
        }
        return expression;
    }

    /**
     * Source text covered by {@code span}, rebuilt from the raw token texts with the original
     * line breaks and spacing.
     */
    private String sourceText(TextSpan span) {
        StringBuilder sb = new StringBuilder();
        Token previousToken = null;
        for (Token token : tokens) {
            TextSpan tokenSpan = token.span();
            if (token.type() == TokenType.EOF || tokenSpan.start() < span.start()) {
                continue;
            }
            if (tokenSpan.end() > span.end()) {
                break;
            }
            if (previousToken != null) {
                TextSpan previousSpan = previousToken.span();
                if (tokenSpan.line() > previousSpan.line()) {
                    sb.append("\n".repeat(tokenSpan.line() - previousSpan.line()));
                    sb.append(" ".repeat(Math.max(0, tokenSpan.column() - 1)));
                } else {
                    sb.append(" ".repeat(Math.max(0, tokenSpan.start() - previousSpan.end())));
                }
            }
            sb.append(token.text());
            previousToken = token;
        }
        return sb.toString();
    }

    /**
     * Moves a span relative to island text so it is relative to the file, given where the
     * island starts.
     */
    private static TextSpan shift(TextSpan local, TextSpan origin) {
        int line = origin.line() + local.line() - 1;
        int column = local.line() == 1 ? origin.column() + local.column() - 1 : local.column();
        return new TextSpan(origin.start() + local.start(), local.length(), line, column);
    }

    private static String stripParens(String text) {
        int start = 0;
        int end = text.length();
        while (start < end && isParenOrSpace(text.charAt(start))) {
            start++;
        }
        while (end > start && isParenOrSpace(text.charAt(end - 1))) {
            end--;
        }
        return text.substring(start, end);
    }

    private static boolean isParenOrSpace(char c) {
        return c == '(' || c == ')' || c == ' ';
    }

    // ========================================================================
    // Type parameters
    // ========================================================================

    /**
     * {@code <T, U>} directly after a header's attribute block. The returned list is mutable
     * so where-clauses can attach constraints.
     */
    private List<TypeParameter> parseOptionalTypeParameterList() {
        List<TypeParameter> typeParameters = new ArrayList<>();
        if (!match(TokenType.LESS)) {
            return typeParameters;
        }
        do {
            if (!check(TokenType.IDENTIFIER)) {
                diagnostics.reportUnexpectedToken(current().span(), "type parameter name", current().type());
                break;
            }
            Token nameToken = advance();
            typeParameters.add(new TypeParameter(nameToken.span(), nameToken.text(), List.of()));
        } while (match(TokenType.COMMA));
        expect(TokenType.GREATER);
        return typeParameters;
    }

    /**
     * Legacy {@code Name<T, U>} in a name attribute: adds the parameters to {@code typeParameters}
     * and returns the bare name.
     */
    private static String extractLegacyTypeParameters(String name, TextSpan span, List<TypeParameter> typeParameters) {
        int open = name.indexOf('<');
        int close = name.lastIndexOf('>');
        if (open < 0 || close <= open) {
            return name;
        }
        for (String part : name.substring(open + 1, close).split(",")) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                typeParameters.add(new TypeParameter(span, trimmed, List.of()));
            }
        }
        return name.substring(0, open);
    }

    /**
     * {@code §WHERE T : class, IComparable<T>} or the older {@code §WR{T:class,IComparable}}.
     * Replaces the named entry of {@code typeParameters} with one carrying the new constraints.
     */
    private void parseWhereClause(List<TypeParameter> typeParameters) {
        Token startToken = expect(TokenType.WHERE);
        String name;
        List<String> constraints = new ArrayList<>();

        if (check(TokenType.IDENTIFIER)) {
            name = advance().text();
            expect(TokenType.COLON);
            do {
                String constraint = parseConstraintTypeName();
                if (!constraint.isEmpty()) {
                    constraints.add(constraint);
                }
            } while (match(TokenType.COMMA));
        } else if (check(TokenType.OPEN_BRACE)) {
            AttributeCollection attrs = parseAttributes();
            name = attrs.positionalOr(0, "");
            if (name.isEmpty()) {
                diagnostics.reportMissingRequiredAttribute(startToken.span(), "WHERE", "type parameter name");
                return;
            }
            for (String part : attrs.positionalOr(1, "").split(",")) {
                if (!part.isBlank()) {
                    constraints.add(part.trim());
                }
            }
        } else {
            diagnostics.reportUnexpectedToken(current().span(), "type parameter name or {", current().type());
            return;
        }

        int index = -1;
        for (int i = 0; i < typeParameters.size(); i++) {
            if (typeParameters.get(i).name().equals(name)) {
                index = i;
                break;
            }
        }
        if (index < 0) {
            diagnostics.reportError(startToken.span(), DiagnosticCode.TYPE_PARAMETER_NOT_FOUND,
                "Type parameter '" + name + "' not found");
            return;
        }

        TypeParameter existing = typeParameters.get(index);
        List<TypeConstraint> merged = new ArrayList<>(existing.constraints());
        for (String text : constraints) {
            switch (text.toLowerCase(Locale.ROOT)) {
                case "class" -> merged.add(new TypeConstraint(startToken.span(), TypeConstraintKind.CLASS, null));
                case "struct" -> merged.add(new TypeConstraint(startToken.span(), TypeConstraintKind.STRUCT, null));
                case "new", "new()" -> merged.add(new TypeConstraint(startToken.span(), TypeConstraintKind.NEW, null));
                default -> merged.add(new TypeConstraint(startToken.span(), TypeConstraintKind.TYPE_NAME, text));
            }
        }
        typeParameters.set(index, new TypeParameter(existing.span(), existing.name(), frozen(merged)));
    }

    private String parseConstraintTypeName() {
        if (!check(TokenType.IDENTIFIER)) {
            diagnostics.reportUnexpectedToken(current().span(), "constraint type name", current().type());
            return "";
        }
        String lower = current().text().toLowerCase(Locale.ROOT);
        if (lower.equals("class") || lower.equals("struct")) {
            advance();
            return lower;
        }
        if (lower.equals("new")) {
            advance();
            if (match(TokenType.OPEN_PAREN)) {
                expect(TokenType.CLOSE_PAREN);
            }
            return "new()";
        }

        StringBuilder sb = new StringBuilder(advance().text());
        if (match(TokenType.LESS)) {
            sb.append('<');
            int depth = 1;
            while (!isAtEnd() && depth > 0) {
                if (match(TokenType.LESS)) {
                    sb.append('<');
                    depth++;
                } else if (match(TokenType.GREATER)) {
                    sb.append('>');
                    depth--;
                } else if (check(TokenType.GREATER_GREATER) && depth >= 2) {
                    advance();
                    sb.append(">>");
                    depth -= 2;
                } else if (match(TokenType.COMMA)) {
                    sb.append(", ");
                } else if (check(TokenType.IDENTIFIER)) {
                    sb.append(advance().text());
                } else {
                    break;
                }
            }
        }
        return sb.toString();
    }

    // ========================================================================
    // Interfaces and classes
    // ========================================================================

    private InterfaceDefinition parseInterfaceDefinition() {
        Token startToken = expect(TokenType.INTERFACE);
        AttributeCollection attrs = parseAttributes();
        String id = requireId(attrs.positional(0), startToken, "IFACE");
        String name = attrs.positionalOr(1, "");
        if (name.isEmpty()) {
            diagnostics.reportMissingRequiredAttribute(startToken.span(), "IFACE", "name");
        }

        List<TypeParameter> typeParameters = parseOptionalTypeParameterList();
        List<String> baseInterfaces = new ArrayList<>();
        List<MethodSignature> methods = new ArrayList<>();
        while (!isAtEnd() && !check(TokenType.END_INTERFACE)) {
            switch (current().type()) {
                case WHERE -> parseWhereClause(typeParameters);
                case EXTENDS -> {
                    advance();
                    String base = parseAttributes().positionalOr(0, "");
                    if (!base.isEmpty()) {
                        baseInterfaces.add(base);
                    }
                }
                case METHOD -> methods.add(parseMethodSignature());
                default -> {
                    skipUnexpected("EXT, METHOD, or END_IFACE");
                }
            }
        }

        Token endToken = expectClose(TokenType.END_INTERFACE, "IFACE", id, "END_IFACE");
        return new InterfaceDefinition(startToken.span().union(endToken.span()), id, name,
            List.copyOf(typeParameters), frozen(baseInterfaces), frozen(methods));
    }

    private MethodSignature parseMethodSignature() {
        Token startToken = expect(TokenType.METHOD);
        AttributeCollection attrs = parseAttributes();
        String id = requireId(attrs.positional(0), startToken, "METHOD");
        String name = attrs.positionalOr(1, "");

        List<TypeParameter> typeParameters = parseOptionalTypeParameterList();
        List<Parameter> parameters = new ArrayList<>();
        OutputSpec output = null;
        EffectsSpec effects = null;
        List<RequiresClause> preconditions = new ArrayList<>();
        List<EnsuresClause> postconditions = new ArrayList<>();

        boolean inSignature = true;
        while (inSignature && !isAtEnd() && !check(TokenType.END_METHOD)) {
            switch (current().type()) {
                case WHERE -> parseWhereClause(typeParameters);
                case IN -> parameters.add(parseParameter());
                case OUT -> output = parseOutput();
                case EFFECTS -> effects = parseEffects();
                case REQUIRES -> preconditions.add(parseRequires());
                case ENSURES -> postconditions.add(parseEnsures());
                default -> inSignature = false;
            }
        }

        Token endToken = expectClose(TokenType.END_METHOD, "METHOD", id, "END_METHOD");
        return new MethodSignature(startToken.span().union(endToken.span()), id, name, List.copyOf(typeParameters),
            frozen(parameters), output, effects, frozen(preconditions), frozen(postconditions));
    }

    /**
     * {@code §CL{id:Name[:base][:modifiers]}}. With three positions the third is read as
     * modifiers when every comma-separated word is a modifier or visibility keyword, and as a
     * base class otherwise; a base class named like a modifier is therefore misread.
     */
    private ClassDefinition parseClassDefinition() {
        Token startToken = expect(TokenType.CLASS);
        AttributeCollection attrs = parseAttributes();
        String id = requireId(attrs.positional(0), startToken, "CLASS");
        String name = attrs.positionalOr(1, "");
        if (name.isEmpty()) {
            diagnostics.reportMissingRequiredAttribute(startToken.span(), "CLASS", "name");
        }
        String pos2 = attrs.positionalOr(2, "");
        String pos3 = attrs.positional(3);

        String modifiers;
        String baseClass = null;
        if (pos3 != null) {
            if (!isVisibilityKeyword(pos2)) {
                baseClass = pos2;
            }
            modifiers = pos3;
        } else if (isClassModifierOrVisibility(pos2)) {
            modifiers = pos2;
        } else {
            baseClass = pos2;
            modifiers = "";
        }

        String lowerModifiers = modifiers.toLowerCase(Locale.ROOT);
        boolean isAbstract = lowerModifiers.contains("abs");
        boolean isSealed = lowerModifiers.contains("seal");
        boolean isStatic = lowerModifiers.contains("stat");
        boolean isPartial = lowerModifiers.contains("partial");
        boolean isStruct = lowerModifiers.contains("struct");
        boolean isReadOnly = lowerModifiers.contains("readonly");
        if (isStruct && isAbstract) {
            diagnostics.reportError(startToken.span(), DiagnosticCode.INVALID_MODIFIER,
                "Structs cannot be abstract. The 'abs' modifier will be ignored.");
            isAbstract = false;
        }

        List<TypeParameter> typeParameters = parseOptionalTypeParameterList();
        if (typeParameters.isEmpty()) {
            name = extractLegacyTypeParameters(name, startToken.span(), typeParameters);
        }

        List<String> interfaces = new ArrayList<>();
        List<FieldDefinition> fields = new ArrayList<>();
        List<PropertyDefinition> properties = new ArrayList<>();
        List<ConstructorDefinition> constructors = new ArrayList<>();
        List<MethodDefinition> methods = new ArrayList<>();
        List<EventDefinition> events = new ArrayList<>();

        while (!isAtEnd() && !check(TokenType.END_CLASS)) {
            switch (current().type()) {
                case WHERE -> parseWhereClause(typeParameters);
                case EXTENDS -> {
                    advance();
                    baseClass = parseAttributes().positionalOr(0, "");
                }
                case IMPLEMENTS -> {
                    advance();
                    String iface = parseAttributes().positionalOr(0, "");
                    if (!iface.isEmpty()) {
                        interfaces.add(iface);
                    }
                }
                case FIELD_DEF -> fields.add(parseClassField());
                case PROPERTY -> properties.add(parseProperty());
                case CONSTRUCTOR -> constructors.add(parseConstructor());
                case METHOD -> methods.add(parseMethodDefinition(false));
                case ASYNC_METHOD -> methods.add(parseMethodDefinition(true));
                case EVENT -> events.add(parseEventDefinition());
                default -> {
                    skipUnexpected("WHERE, EXT, IMPL, FLD, PROP, CTOR, METHOD, AMT, EVT, or END_CLASS");
                }
            }
        }

        Token endToken = expectClose(TokenType.END_CLASS, "CLASS", id, "END_CLASS");
        if (baseClass != null && baseClass.isEmpty()) {
            baseClass = null;
        }
        return new ClassDefinition(startToken.span().union(endToken.span()), id, name, baseClass, frozen(interfaces),
            List.copyOf(typeParameters), isAbstract, isSealed, isStatic, isPartial, isStruct, isReadOnly,
            frozen(fields), frozen(properties), frozen(constructors), frozen(methods), frozen(events));
    }

    /**
     * {@code §FLD{type:name[:vis][:modifiers]}} with an optional default value, written either
     * as {@code = expr} or as a bare expression.
     */
    private FieldDefinition parseClassField() {
        Token startToken = expect(TokenType.FIELD_DEF);
        AttributeCollection attrs = parseAttributes();
        String typeName = attrs.positionalOr(0, "object");
        String name = attrs.positionalOr(1, "");
        if (name.isEmpty()) {
            diagnostics.reportMissingRequiredAttribute(startToken.span(), "FLD", "name");
        }
        Visibility visibility = AttributeInterpreter.parseVisibility(attrs.positional(2), Visibility.PRIVATE);
        List<MemberModifier> modifiers = parseMemberModifiers(attrs.positionalOr(3, ""));

        Expression defaultValue = null;
        if (match(TokenType.EQUALS) || isExpressionStart()) {
            defaultValue = parseExpression();
        }
        TextSpan span = defaultValue != null ? startToken.span().union(defaultValue.span()) : startToken.span();
        return new FieldDefinition(span, name, typeName, visibility, frozen(modifiers), defaultValue);
    }

    /**
     * {@code §MT{id:name[:vis][:modifiers]}} or {@code §AMT{...}}. Header sections and body
     * statements may interleave up to the close tag.
     */
    private MethodDefinition parseMethodDefinition(boolean isAsync) {
        TokenType closeType = isAsync ? TokenType.END_ASYNC_METHOD : TokenType.END_METHOD;
        String tag = isAsync ? "AMT" : "METHOD";

        Token startToken = expect(isAsync ? TokenType.ASYNC_METHOD : TokenType.METHOD);
        AttributeCollection attrs = parseAttributes();
        String id = requireId(attrs.positional(0), startToken, tag);
        String name = attrs.positionalOr(1, "");
        Visibility visibility = AttributeInterpreter.parseVisibility(attrs.positional(2), Visibility.PRIVATE);
        List<MemberModifier> modifiers = parseMemberModifiers(attrs.positionalOr(3, ""));

        List<TypeParameter> typeParameters = parseOptionalTypeParameterList();
        if (typeParameters.isEmpty()) {
            name = extractLegacyTypeParameters(name, startToken.span(), typeParameters);
        }

        List<Parameter> parameters = new ArrayList<>();
        OutputSpec output = null;
        EffectsSpec effects = null;
        List<RequiresClause> preconditions = new ArrayList<>();
        List<EnsuresClause> postconditions = new ArrayList<>();
        List<Statement> body = new ArrayList<>();

        while (!isAtEnd() && !check(closeType)) {
            switch (current().type()) {
                case WHERE -> parseWhereClause(typeParameters);
                case IN -> parameters.add(parseParameter());
                case OUT -> output = parseOutput();
                case EFFECTS -> effects = parseEffects();
                case REQUIRES -> preconditions.add(parseRequires());
                case ENSURES -> postconditions.add(parseEnsures());
                default -> {
                    Statement statement = parseStatement();
                    if (statement != null) {
                        body.add(statement);
                    }
                }
            }
        }

        Token endToken = expectClose(closeType, tag, id, isAsync ? "END_AMT" : "END_METHOD");
        return new MethodDefinition(startToken.span().union(endToken.span()), id, name, visibility, frozen(modifiers),
            List.copyOf(typeParameters), frozen(parameters), output, effects, frozen(preconditions),
            frozen(postconditions), frozen(body), isAsync);
    }

    private static List<MemberModifier> parseMemberModifiers(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        List<MemberModifier> modifiers = new ArrayList<>();
        if (lower.contains("virt")) {
            modifiers.add(MemberModifier.VIRTUAL);
        }
        if (lower.contains("over")) {
            modifiers.add(MemberModifier.OVERRIDE);
        }
        if (lower.contains("abs")) {
            modifiers.add(MemberModifier.ABSTRACT);
        }
        if (lower.contains("seal")) {
            modifiers.add(MemberModifier.SEALED);
        }
        if (lower.contains("stat")) {
            modifiers.add(MemberModifier.STATIC);
        }
        if (lower.contains("const")) {
            modifiers.add(MemberModifier.CONST);
        }
        if (lower.contains("readonly")) {
            modifiers.add(MemberModifier.READONLY);
        }
        return modifiers;
    }

    private static boolean isVisibilityKeyword(String value) {
        return VISIBILITY_KEYWORDS.contains(value.toLowerCase(Locale.ROOT));
    }

    private static boolean isClassModifierOrVisibility(String value) {
        if (value.isEmpty()) {
            return true;
        }
        for (String part : value.split("[, ]+")) {
            if (!part.isEmpty() && !CLASS_MODIFIER_KEYWORDS.contains(part.toLowerCase(Locale.ROOT))) {
                return false;
            }
        }
        return true;
    }

    /**
     * {@code §PROP{id:name:type[:vis][:modifiers]}} with optional {@code §GET}, {@code §SET},
     * {@code §INIT} accessors and a default value.
     */
    private PropertyDefinition parseProperty() {
        Token startToken = expect(TokenType.PROPERTY);
        AttributeCollection attrs = parseAttributes();
        String id = requireId(attrs.positional(0), startToken, "PROP");
        String name = attrs.positionalOr(1, "");
        String typeName = attrs.positionalOr(2, "object");
        Visibility visibility = AttributeInterpreter.parseVisibility(attrs.positional(3), Visibility.PUBLIC);
        List<MemberModifier> modifiers = parseMemberModifiers(attrs.positionalOr(4, ""));

        PropertyAccessor getter = null;
        PropertyAccessor setter = null;
        PropertyAccessor initer = null;
        Expression defaultValue = null;
        while (!isAtEnd() && !check(TokenType.END_PROPERTY)) {
            if (check(TokenType.GET)) {
                getter = parsePropertyAccessor(AccessorKind.GET);
            } else if (check(TokenType.SET)) {
                setter = parsePropertyAccessor(AccessorKind.SET);
            } else if (check(TokenType.INIT)) {
                initer = parsePropertyAccessor(AccessorKind.INIT);
            } else if (match(TokenType.EQUALS) || isExpressionStart()) {
                defaultValue = parseExpression();
            } else {
                break;
            }
        }

        Token endToken = expectClose(TokenType.END_PROPERTY, "PROP", id, "END_PROP");
        return new PropertyDefinition(startToken.span().union(endToken.span()), id, name, typeName, visibility,
            frozen(modifiers), getter, setter, initer, defaultValue);
    }

    private PropertyAccessor parsePropertyAccessor(AccessorKind kind) {
        Token startToken = advance();
        String visibilityText = parseAttributes().positional(0);
        Visibility visibility = visibilityText == null || visibilityText.isEmpty()
            ? null
            : AttributeInterpreter.parseVisibility(visibilityText);

        List<RequiresClause> preconditions = new ArrayList<>();
        List<Statement> body = new ArrayList<>();
        while (!isAtEnd() && !checkAny(TokenType.GET, TokenType.SET, TokenType.INIT, TokenType.END_PROPERTY,
            TokenType.EQUALS, TokenType.END_GET, TokenType.END_SET)) {
            if (check(TokenType.REQUIRES)) {
                preconditions.add(parseRequires());
            } else {
                Statement statement = parseStatement();
                if (statement != null) {
                    body.add(statement);
                }
            }
        }

        // §INIT has no close tag of its own
        if (kind == AccessorKind.GET) {
            match(TokenType.END_GET);
        } else if (kind == AccessorKind.SET) {
            match(TokenType.END_SET);
        }
        return new PropertyAccessor(startToken.span(), kind, visibility, frozen(preconditions), frozen(body));
    }

    private ConstructorDefinition parseConstructor() {
        Token startToken = expect(TokenType.CONSTRUCTOR);
        AttributeCollection attrs = parseAttributes();
        String id = requireId(attrs.positional(0), startToken, "CTOR");
        Visibility visibility = AttributeInterpreter.parseVisibility(attrs.positional(1), Visibility.PUBLIC);

        List<Parameter> parameters = new ArrayList<>();
        List<RequiresClause> preconditions = new ArrayList<>();
        ConstructorInitializer initializer = null;
        List<Statement> body = new ArrayList<>();
        while (!isAtEnd() && !check(TokenType.END_CONSTRUCTOR)) {
            switch (current().type()) {
                case IN -> parameters.add(parseParameter());
                case REQUIRES -> preconditions.add(parseRequires());
                case BASE -> initializer = parseConstructorInitializer(true);
                case THIS -> initializer = parseConstructorInitializer(false);
                default -> {
                    Statement statement = parseStatement();
                    if (statement != null) {
                        body.add(statement);
                    }
                }
            }
        }

        Token endToken = expectClose(TokenType.END_CONSTRUCTOR, "CTOR", id, "END_CTOR");
        return new ConstructorDefinition(startToken.span().union(endToken.span()), id, visibility, frozen(parameters),
            frozen(preconditions), initializer, frozen(body));
    }

    private ConstructorInitializer parseConstructorInitializer(boolean isBase) {
        Token startToken = advance();
        List<Expression> arguments = new ArrayList<>();
        while (check(TokenType.ARG)) {
            arguments.add(parseArgument());
        }
        match(isBase ? TokenType.END_BASE : TokenType.END_THIS);
        return new ConstructorInitializer(startToken.span(), isBase, frozen(arguments));
    }

    private EventDefinition parseEventDefinition() {
        Token startToken = expect(TokenType.EVENT);
        AttributeCollection attrs = parseAttributes();
        String id = requireId(attrs.positional(0), startToken, "EVT");
        String name = attrs.positionalOr(1, "");
        if (name.isEmpty()) {
            diagnostics.reportMissingRequiredAttribute(startToken.span(), "EVT", "name");
        }
        Visibility visibility = AttributeInterpreter.parseVisibility(attrs.positional(2), Visibility.PRIVATE);
        String delegateType = attrs.positionalOr(3, "");
        if (delegateType.isEmpty()) {
            diagnostics.reportMissingRequiredAttribute(startToken.span(), "EVT", "delegateType");
        }
        return new EventDefinition(startToken.span(), id, name, visibility, delegateType);
    }

    private DelegateDefinition parseDelegateDefinition() {
        Token startToken = expect(TokenType.DELEGATE);
        AttributeCollection attrs = parseAttributes();
        String id = requireId(attrs.positional(0), startToken, "DEL");
        String name = attrs.positionalOr(1, "");
        if (name.isEmpty()) {
            diagnostics.reportMissingRequiredAttribute(startToken.span(), "DEL", "name");
        }

        List<Parameter> parameters = new ArrayList<>();
        OutputSpec output = null;
        EffectsSpec effects = null;
        while (!isAtEnd() && !check(TokenType.END_DELEGATE)) {
            switch (current().type()) {
                case IN -> parameters.add(parseParameter());
                case OUT -> output = parseOutput();
                case EFFECTS -> effects = parseEffects();
                default -> {
                    skipUnexpected("I, O, E, or END_DEL");
                }
            }
        }

        Token endToken = expectClose(TokenType.END_DELEGATE, "DEL", id, "END_DEL");
        return new DelegateDefinition(startToken.span().union(endToken.span()), id, name, frozen(parameters), output,
            effects);
    }

    // ========================================================================
    // Object creation and calls
    // ========================================================================

    /**
     * {@code §NEW{Type[:TypeArg...]}} with {@code §A} arguments, {@code §INIT{Prop} expr} or
     * {@code Prop = expr} initializers and an optional {@code §/NEW}.
     */
    private Expression parseNewExpression() {
        Token startToken = expect(TokenType.NEW);
        AttributeCollection attrs = parseAttributes();
        String rawTypeName = attrs.positionalOr(0, "object");

        String typeName;
        List<String> typeArguments = new ArrayList<>();
        int angle = rawTypeName.indexOf('<');
        if (angle >= 0 && rawTypeName.endsWith(">")) {
            typeName = rawTypeName.substring(0, angle);
            for (String part : rawTypeName.substring(angle + 1, rawTypeName.length() - 1).split(",")) {
                typeArguments.add(part.trim());
            }
        } else {
            typeName = rawTypeName;
            for (int i = 1; i < attrs.positionalCount(); i++) {
                String typeArgument = attrs.positional(i);
                if (typeArgument != null && !typeArgument.isEmpty()) {
                    typeArguments.add(typeArgument);
                }
            }
        }

        // §A tags inside an argument belong to the enclosing call
        List<Expression> arguments = new ArrayList<>();
        if (!insideArgContext) {
            while (check(TokenType.ARG)) {
                arguments.add(parseArgument());
            }
        }

        List<ObjectInitializer> initializers = new ArrayList<>();
        while (check(TokenType.INIT)) {
            Token initToken = advance();
            String property = parseAttributes().positionalOr(0, "");
            Expression value = parseExpression();
            initializers.add(new ObjectInitializer(initToken.span().union(value.span()), property, value));
        }
        parseNamedInitializers(initializers, TokenType.END_NEW, false);

        TextSpan span = startToken.span();
        if (check(TokenType.END_NEW)) {
            span = span.union(advance().span());
        } else if (!arguments.isEmpty()) {
            span = span.union(lastOrNull(arguments).span());
        }
        Expression expr = new NewExpression(span, typeName, frozen(typeArguments), frozen(arguments), frozen(initializers));
        return parseTrailingMemberAccess(expr);
    }

    /**
     * {@code Name = expr} pairs up to {@code terminator}. With {@code allowShorthand} a bare
     * name stands for {@code name = name}; otherwise it ends the list unconsumed.
     */
    private void parseNamedInitializers(List<ObjectInitializer> initializers, TokenType terminator,
                                        boolean allowShorthand) {
        while (!isAtEnd() && !check(terminator) && check(TokenType.IDENTIFIER)) {
            if (checkAhead(1, TokenType.EQUALS)) {
                Token nameToken = advance();
                advance();
                Expression value = parseExpression();
                initializers.add(new ObjectInitializer(nameToken.span().union(value.span()), nameToken.text(), value));
            } else if (allowShorthand) {
                Token nameToken = advance();
                initializers.add(new ObjectInitializer(nameToken.span(), nameToken.text(),
                    new Reference(nameToken.span(), nameToken.text())));
            } else {
                return;
            }
        }
    }

    private AnonymousObject parseAnonymousObject() {
        Token startToken = expect(TokenType.ANONYMOUS_OBJECT);
        List<ObjectInitializer> initializers = new ArrayList<>();
        parseNamedInitializers(initializers, TokenType.END_ANONYMOUS_OBJECT, true);
        TextSpan span = startToken.span();
        if (check(TokenType.END_ANONYMOUS_OBJECT)) {
            span = span.union(advance().span());
        }
        return new AnonymousObject(span, frozen(initializers));
    }

    private Expression parseThisExpression() {
        Token token = expect(TokenType.THIS);
        return parseTrailingMemberAccess(new ThisExpression(token.span()));
    }

    private Expression parseBaseExpression() {
        Token token = expect(TokenType.BASE);
        return parseTrailingMemberAccess(new BaseExpression(token.span()));
    }

    /**
     * {@code §C{target} args §/C}, or {@code §C expr args §/C} when no target attribute is
     * given, e.g. {@code §C §NEW{object}§/NEW.GetType §/C}.
     */
    private Expression parseCallExpression() {
        Token startToken = expect(TokenType.CALL);
        AttributeInterpreter.CallTarget call = AttributeInterpreter.interpretCall(parseAttributes());

        Expression targetExpression = null;
        if (call.target().isEmpty() && !check(TokenType.ARG) && !check(TokenType.END_CALL) && isExpressionStart()) {
            targetExpression = parseExpression();
        }

        List<Expression> arguments = new ArrayList<>();
        while (!isAtEnd() && !check(TokenType.END_CALL)) {
            if (check(TokenType.ARG)) {
                arguments.add(parseArgument());
            } else if (isExpressionStart()) {
                arguments.add(parseExpression());
            } else {
                break;
            }
        }
        Token endToken = expect(TokenType.END_CALL);
        TextSpan span = startToken.span().union(endToken.span());

        Expression expr = targetExpression != null
            ? new ExpressionCall(span, targetExpression, frozen(arguments))
            : new CallExpression(span, call.target(), call.fallible(), frozen(arguments));
        return parseTrailingMemberAccess(expr);
    }

    // ========================================================================
    // Arrays and collections
    // ========================================================================

    /**
     * {@code §ARR{id:type[:size]}} or {@code §ARR{type:id[:size]}}. Without a size, elements
     * follow as {@code §A} arguments or bare expressions up to {@code §/ARR}; a lone element
     * with no close tag is taken as the size.
     */
    private ArrayCreation parseArrayCreation() {
        Token startToken = expect(TokenType.ARRAY);
        AttributeCollection attrs = parseAttributes();
        String pos0 = attrs.positionalOr(0, "");
        String pos1 = attrs.positionalOr(1, "i32");
        String sizeText = attrs.positional(2);

        String id;
        String elementType;
        if (AttributeInterpreter.isLikelyType(pos0) && !AttributeInterpreter.isLikelyType(pos1)) {
            elementType = pos0;
            id = pos1;
        } else {
            id = pos0;
            elementType = pos1;
        }
        if (id.isEmpty()) {
            id = "_arr" + startToken.span().start();
        }

        Expression size = null;
        List<Expression> elements = new ArrayList<>();
        if (sizeText != null && !sizeText.isEmpty()) {
            size = parseIsland(sizeText, attrs.positionalSpan(2), startToken.span());
        } else {
            while (!isAtEnd() && check(TokenType.ARG)) {
                elements.add(parseArgument());
            }
            if (elements.isEmpty()) {
                while (!isAtEnd() && !check(TokenType.END_ARRAY) && isExpressionStart()) {
                    elements.add(parseExpression());
                }
            }
            if (elements.size() == 1 && !check(TokenType.END_ARRAY)) {
                size = elements.remove(0);
            }
        }

        TextSpan span = startToken.span();
        if (check(TokenType.END_ARRAY)) {
            span = span.union(expectClose(TokenType.END_ARRAY, "ARR", id, "END_ARR").span());
        }
        return new ArrayCreation(span, id, id, elementType, size, frozen(elements));
    }

    private ArrayAccess parseArrayAccess() {
        Token startToken = expect(TokenType.INDEX);
        String arrayName = parseAttributes().positional(0);
        Expression array = arrayName == null || arrayName.isEmpty()
            ? parseExpression()
            : new Reference(startToken.span(), arrayName);
        Expression index = parseExpression();
        return new ArrayAccess(startToken.span().union(index.span()), array, index);
    }

    private ArrayLength parseArrayLength() {
        Token startToken = expect(TokenType.LENGTH);
        Expression array = parseExpression();
        return new ArrayLength(startToken.span().union(array.span()), array);
    }

    private ForeachStatement parseForeachStatement() {
        Token startToken = expect(TokenType.FOREACH);
        AttributeCollection attrs = parseAttributes();
        String id = requireId(attrs.positional(0), startToken, "EACH");
        String variable = attrs.positionalOr(1, "item");
        String variableType = attrs.positionalOr(2, "var");

        Expression collection = parseExpression();
        List<Statement> body = parseStatementBlock(TokenType.END_FOREACH);
        Token endToken = expectClose(TokenType.END_FOREACH, "EACH", id, "END_EACH");
        return new ForeachStatement(startToken.span().union(endToken.span()), id, variable, variableType,
            collection, frozen(body));
    }

    private ListCreation parseListCreation() {
        Token startToken = expect(TokenType.LIST);
        AttributeCollection attrs = parseAttributes();
        String id = requireId(attrs.positional(0), startToken, "LIST");
        String elementType = attrs.positionalOr(1, "i32");

        List<Expression> elements = new ArrayList<>();
        while (!isAtEnd() && !check(TokenType.END_LIST) && isExpressionStart()) {
            elements.add(parseExpression());
        }
        Token endToken = expectClose(TokenType.END_LIST, "LIST", id, "END_LIST");
        return new ListCreation(startToken.span().union(endToken.span()), id, id, elementType, frozen(elements));
    }

    private BindStatement parseListCreationStatement() {
        ListCreation list = parseListCreation();
        return new BindStatement(list.span(), list.name(), "List<" + list.elementType() + ">", false, list);
    }

    private DictionaryCreation parseDictionaryCreation() {
        Token startToken = expect(TokenType.DICT);
        AttributeCollection attrs = parseAttributes();
        String id = requireId(attrs.positional(0), startToken, "DICT");
        String keyType = attrs.positionalOr(1, "str");
        String valueType = attrs.positionalOr(2, "i32");

        List<KeyValuePair> entries = new ArrayList<>();
        while (!isAtEnd() && check(TokenType.KEY_VALUE)) {
            Token entryToken = advance();
            Expression key = parseExpression();
            Expression value = parseExpression();
            entries.add(new KeyValuePair(entryToken.span().union(value.span()), key, value));
        }
        Token endToken = expectClose(TokenType.END_DICT, "DICT", id, "END_DICT");
        return new DictionaryCreation(startToken.span().union(endToken.span()), id, id, keyType, valueType, frozen(entries));
    }

    private BindStatement parseDictionaryCreationStatement() {
        DictionaryCreation dict = parseDictionaryCreation();
        return new BindStatement(dict.span(), dict.name(),
            "Dictionary<" + dict.keyType() + "," + dict.valueType() + ">", false, dict);
    }

    private SetCreation parseSetCreation() {
        Token startToken = expect(TokenType.HASH_SET);
        AttributeCollection attrs = parseAttributes();
        String id = requireId(attrs.positional(0), startToken, "HSET");
        String elementType = attrs.positionalOr(1, "str");

        List<Expression> elements = new ArrayList<>();
        while (!isAtEnd() && !check(TokenType.END_HASH_SET) && isExpressionStart()) {
            elements.add(parseExpression());
        }
        Token endToken = expectClose(TokenType.END_HASH_SET, "HSET", id, "END_HSET");
        return new SetCreation(startToken.span().union(endToken.span()), id, id, elementType, frozen(elements));
    }

    private BindStatement parseSetCreationStatement() {
        SetCreation set = parseSetCreation();
        return new BindStatement(set.span(), set.name(), "HashSet<" + set.elementType() + ">", false, set);
    }

    /**
     * Target name of a collection mutation, from the first attribute position.
     */
    private String parseCollectionName(Token startToken, String tag, String what) {
        String name = parseAttributes().positionalOr(0, "");
        if (name.isEmpty()) {
            diagnostics.reportMissingRequiredAttribute(startToken.span(), tag, what);
        }
        return name;
    }

    private CollectionPush parseCollectionPush() {
        Token startToken = advance();
        String tag = startToken.type() == TokenType.PUSH ? "PUSH" : "ADD";
        String collection = parseCollectionName(startToken, tag, "collection name");
        Expression value = parseExpression();
        return new CollectionPush(startToken.span().union(value.span()), collection, value);
    }

    private DictionaryPut parseDictionaryPut() {
        Token startToken = expect(TokenType.PUT);
        String dictionary = parseCollectionName(startToken, "PUT", "dictionary name");
        Expression key = parseExpression();
        Expression value = parseExpression();
        return new DictionaryPut(startToken.span().union(value.span()), dictionary, key, value);
    }

    private CollectionRemove parseCollectionRemove() {
        Token startToken = expect(TokenType.REMOVE);
        String collection = parseCollectionName(startToken, "REM", "collection name");
        Expression value = parseExpression();
        return new CollectionRemove(startToken.span().union(value.span()), collection, value);
    }

    private CollectionSetIndex parseCollectionSetIndex() {
        Token startToken = expect(TokenType.SET_INDEX);
        String collection = parseCollectionName(startToken, "SETIDX", "collection name");
        Expression index = parseExpression();
        Expression value = parseExpression();
        return new CollectionSetIndex(startToken.span().union(value.span()), collection, index, value);
    }

    private CollectionClear parseCollectionClear() {
        Token startToken = expect(TokenType.CLEAR);
        String collection = parseCollectionName(startToken, "CLR", "collection name");
        return new CollectionClear(startToken.span(), collection);
    }

    private CollectionInsert parseCollectionInsert() {
        Token startToken = expect(TokenType.INSERT);
        String collection = parseCollectionName(startToken, "INS", "collection name");
        Expression index = parseExpression();
        Expression value = parseExpression();
        return new CollectionInsert(startToken.span().union(value.span()), collection, index, value);
    }

    /**
     * {@code §HAS{coll} value}, {@code §HAS{dict} §KEY key} or {@code §HAS{dict} §VAL value}.
     */
    private CollectionContains parseCollectionContains() {
        Token startToken = expect(TokenType.HAS);
        String collection = parseCollectionName(startToken, "HAS", "collection name");
        ContainsMode mode = ContainsMode.VALUE;
        if (match(TokenType.KEY)) {
            mode = ContainsMode.KEY;
        } else if (match(TokenType.VAL)) {
            mode = ContainsMode.DICT_VALUE;
        }
        Expression value = parseExpression();
        return new CollectionContains(startToken.span().union(value.span()), collection, mode, value);
    }

    /**
     * {@code §CNT{name}} or {@code §CNT expr}.
     */
    private CollectionCount parseCollectionCount() {
        Token startToken = expect(TokenType.COUNT);
        Expression collection;
        if (check(TokenType.OPEN_BRACE)) {
            String name = parseCollectionName(startToken, "CNT", "collection name");
            collection = new Reference(startToken.span(), name);
        } else {
            collection = parseExpression();
        }
        return new CollectionCount(startToken.span().union(collection.span()), collection);
    }

    private DictionaryForeach parseDictionaryForeach() {
        Token startToken = expect(TokenType.EACH_KV);
        AttributeCollection attrs = parseAttributes();
        String id = requireId(attrs.positional(0), startToken, "EACHKV");
        String keyVariable = attrs.positionalOr(1, "key");
        String valueVariable = attrs.positionalOr(2, "value");

        Expression dictionary = parseExpression();
        List<Statement> body = parseStatementBlock(TokenType.END_EACH_KV);
        Token endToken = expectClose(TokenType.END_EACH_KV, "EACHKV", id, "END_EACHKV");
        return new DictionaryForeach(startToken.span().union(endToken.span()), id, keyVariable, valueVariable,
            dictionary, frozen(body));
    }

    // ========================================================================
    // Resources and exceptions
    // ========================================================================

    private UsingStatement parseUsingStatement() {
        Token startToken = expect(TokenType.USE);
        AttributeCollection attrs = parseAttributes();
        String id = requireId(attrs.positional(0), startToken, "USE");
        String variable = attrs.positional(1);
        String typeName = attrs.positional(2);

        Expression resource = parseExpression();
        List<Statement> body = parseStatementBlock(TokenType.END_USE);
        Token endToken = expectClose(TokenType.END_USE, "USE", id, "END_USE");
        return new UsingStatement(startToken.span().union(endToken.span()), id, variable, typeName, resource, frozen(body));
    }

    /**
     * {@code §TR{id} ... §CA{Type:var} [§WHEN cond] ... §FI ... §/TR{id}}.
     */
    private TryStatement parseTryStatement() {
        Token startToken = expect(TokenType.TRY);
        String id = requireId(parseAttributes().positional(0), startToken, "TRY");

        List<Statement> tryBody = parseStatementBlock(TokenType.CATCH, TokenType.FINALLY, TokenType.END_TRY);
        List<CatchClause> catchClauses = new ArrayList<>();
        while (check(TokenType.CATCH)) {
            catchClauses.add(parseCatchClause());
        }
        List<Statement> finallyBody = null;
        if (match(TokenType.FINALLY)) {
            finallyBody = parseStatementBlock(TokenType.END_TRY);
        }

        Token endToken = expectClose(TokenType.END_TRY, "TRY", id, "END_TRY");
        return new TryStatement(startToken.span().union(endToken.span()), id, frozen(tryBody), frozen(catchClauses),
            frozen(finallyBody));
    }

    private CatchClause parseCatchClause() {
        Token startToken = expect(TokenType.CATCH);
        AttributeCollection attrs = parseAttributes();
        String exceptionType = emptyToNull(attrs.positional(0));
        String variable = emptyToNull(attrs.positional(1));

        Expression filter = null;
        if (match(TokenType.WHEN)) {
            filter = parseExpression();
        }
        List<Statement> body = parseStatementBlock(TokenType.CATCH, TokenType.FINALLY, TokenType.END_TRY);
        Statement last = lastOrNull(body);
        TextSpan span = last != null ? startToken.span().union(last.span()) : startToken.span();
        return new CatchClause(span, exceptionType, variable, filter, frozen(body));
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }

    // ========================================================================
    // Lambdas and modern operators
    // ========================================================================

    /**
     * {@code §LAM{id[:async]:p1:t1:p2:t2...}} with an expression body, statements, or both
     * up to {@code §/LAM}.
     */
    private LambdaExpression parseLambdaExpression() {
        Token startToken = expect(TokenType.LAMBDA);
        AttributeCollection attrs = parseAttributes();
        String id = requireId(attrs.positional(0), startToken, "LAM");

        boolean isAsync = false;
        int index = 1;
        if ("async".equalsIgnoreCase(attrs.positional(1))) {
            isAsync = true;
            index = 2;
        }
        List<LambdaParameter> parameters = new ArrayList<>();
        for (; index < attrs.positionalCount(); index += 2) {
            String name = attrs.positional(index);
            if (name != null && !name.isEmpty()) {
                parameters.add(new LambdaParameter(startToken.span(), name, attrs.positional(index + 1)));
            }
        }

        EffectsSpec effects = null;
        if (check(TokenType.EFFECTS)) {
            effects = parseEffects();
        }

        Expression expressionBody = null;
        if (isExpressionStart()) {
            expressionBody = parseExpression();
        }
        List<Statement> statementBody = null;
        if (!isAtEnd() && !check(TokenType.END_LAMBDA)) {
            statementBody = parseStatementBlock(TokenType.END_LAMBDA);
        }

        Token endToken = expectClose(TokenType.END_LAMBDA, "LAM", id, "END_LAM");
        return new LambdaExpression(startToken.span().union(endToken.span()), id, frozen(parameters), effects, isAsync,
            expressionBody, frozen(statementBody));
    }

    private AwaitExpression parseAwaitExpression() {
        Token startToken = expect(TokenType.AWAIT);
        String configText = parseAttributes().positional(0);
        Boolean configureAwait = null;
        if ("false".equalsIgnoreCase(configText)) {
            configureAwait = Boolean.FALSE;
        } else if ("true".equalsIgnoreCase(configText)) {
            configureAwait = Boolean.TRUE;
        }
        Expression awaited = parseExpression();
        return new AwaitExpression(startToken.span().union(awaited.span()), awaited, configureAwait);
    }

    /**
     * {@code §INTERP "text" §EXP expr "more" §/INTERP}. Text segments become string literals.
     */
    private InterpolatedString parseInterpolatedString() {
        Token startToken = expect(TokenType.INTERPOLATE);
        parseAttributes();
        List<Expression> parts = new ArrayList<>();
        while (!isAtEnd() && !check(TokenType.END_INTERPOLATE)) {
            if (check(TokenType.STR_LITERAL)) {
                parts.add(parseStringLiteral());
            } else {
                match(TokenType.EXPRESSION);
                parts.add(parseExpression());
            }
        }
        Token endToken = expect(TokenType.END_INTERPOLATE);
        return new InterpolatedString(startToken.span().union(endToken.span()), frozen(parts));
    }

    private NullCoalesce parseNullCoalesce() {
        Token startToken = expect(TokenType.NULL_COALESCE);
        Expression left = parseExpression();
        Expression right = parseExpression();
        return new NullCoalesce(startToken.span().union(right.span()), left, right);
    }

    private NullConditional parseNullConditional() {
        Token startToken = expect(TokenType.NULL_CONDITIONAL);
        Expression target = parseExpression();
        Token member = expect(TokenType.IDENTIFIER);
        return new NullConditional(startToken.span().union(member.span()), target, member.text());
    }

    private RangeExpression parseRangeExpression() {
        Token startToken = expect(TokenType.RANGE_OP);
        Expression start = isExpressionStart() ? parseExpression() : null;
        Expression end = isExpressionStart() ? parseExpression() : null;
        TextSpan span = startToken.span();
        if (end != null) {
            span = span.union(end.span());
        } else if (start != null) {
            span = span.union(start.span());
        }
        return new RangeExpression(span, start, end);
    }

    private IndexFromEnd parseIndexFromEnd() {
        Token startToken = expect(TokenType.INDEX_END);
        Expression offset = parseExpression();
        return new IndexFromEnd(startToken.span().union(offset.span()), offset);
    }

    /**
     * {@code §WITH target §SET{Prop} value ... §/WITH}.
     */
    private WithExpression parseWithExpression() {
        Token startToken = expect(TokenType.WITH);
        Expression target = parseExpression();
        List<ObjectInitializer> assignments = new ArrayList<>();
        while (!isAtEnd() && !check(TokenType.END_WITH)) {
            if (check(TokenType.SET)) {
                Token setToken = advance();
                String property = parseAttributes().positionalOr(0, "");
                Expression value = parseExpression();
                assignments.add(new ObjectInitializer(setToken.span().union(value.span()), property, value));
            } else {
                skipUnexpected("SET or END_WITH");
            }
        }
        Token endToken = expect(TokenType.END_WITH);
        return new WithExpression(startToken.span().union(endToken.span()), target, frozen(assignments));
    }

    // ========================================================================
    // Metadata
    // ========================================================================

    private String parseOptionalDescription() {
        if (check(TokenType.STR_LITERAL)) {
            return parseStringLiteral().value();
        }
        return null;
    }

    private String parseRequiredDescription(Token startToken, String tag) {
        String description = parseOptionalDescription();
        if (description == null) {
            diagnostics.reportMissingRequiredAttribute(startToken.span(), tag, "description");
            return "";
        }
        return description;
    }

    /**
     * {@code §EX{id[:msg]} expr → expected}.
     */
    private Example parseExample() {
        Token startToken = expect(TokenType.EXAMPLE);
        AttributeInterpreter.ExampleSpec spec = AttributeInterpreter.interpretExample(parseAttributes());
        Expression expression = parseExpression();
        expect(TokenType.ARROW);
        Expression expected = parseExpression();
        String id = spec.id() == null ? "" : spec.id();
        return new Example(startToken.span().union(expected.span()), id, spec.message(), expression, expected);
    }

    private Issue parseIssue() {
        Token startToken = advance();
        IssueKind kind;
        switch (startToken.type()) {
            case FIXME: kind = IssueKind.FIXME; break;
            case HACK: kind = IssueKind.HACK; break;
            default: kind = IssueKind.TODO; break;
        }
        AttributeInterpreter.IssueSpec spec = AttributeInterpreter.interpretIssue(parseAttributes());
        String description = parseRequiredDescription(startToken, kind.name());
        return new Issue(startToken.span(), kind, spec.id() == null ? "" : spec.id(), spec.category(),
            spec.priority(), description);
    }

    private Uses parseUses() {
        Token startToken = expect(TokenType.USES);
        AttributeInterpreter.DependencyList list =
            AttributeInterpreter.interpretDependencies(AttributeInterpreter.positionalValues(parseAttributes()));
        return new Uses(startToken.span(), frozen(toDependencies(startToken.span(), list)));
    }

    private UsedBy parseUsedBy() {
        Token startToken = expect(TokenType.USED_BY);
        AttributeInterpreter.DependencyList list =
            AttributeInterpreter.interpretDependencies(AttributeInterpreter.positionalValues(parseAttributes()));
        return new UsedBy(startToken.span(), frozen(toDependencies(startToken.span(), list)), list.unknownCallers());
    }

    private static List<Dependency> toDependencies(TextSpan span, AttributeInterpreter.DependencyList list) {
        List<Dependency> dependencies = new ArrayList<>();
        for (AttributeInterpreter.Dependency entry : list.dependencies()) {
            dependencies.add(new Dependency(span, entry.target(), entry.version(), entry.optional()));
        }
        return dependencies;
    }

    private Assumption parseAssume() {
        Token startToken = expect(TokenType.ASSUME);
        AssumptionCategory category = AttributeInterpreter.parseAssumptionCategory(parseAttributes().positional(0));
        String text = parseRequiredDescription(startToken, "ASSUME");
        return new Assumption(startToken.span(), category, text);
    }

    private Complexity parseComplexity() {
        Token startToken = expect(TokenType.COMPLEXITY);
        AttributeInterpreter.ComplexitySpec spec = AttributeInterpreter.interpretComplexity(parseAttributes());
        return new Complexity(startToken.span(), spec.time(), spec.space());
    }

    private Since parseSince() {
        Token startToken = expect(TokenType.SINCE);
        String version = parseAttributes().positionalOr(0, "");
        if (version.isEmpty()) {
            diagnostics.reportMissingRequiredAttribute(startToken.span(), "SINCE", "version");
            version = "0.0.0";
        }
        return new Since(startToken.span(), version);
    }

    private Deprecation parseDeprecated() {
        Token startToken = expect(TokenType.DEPRECATED);
        AttributeInterpreter.DeprecatedSpec spec = AttributeInterpreter.interpretDeprecated(parseAttributes());
        String since = spec.since();
        if (since.isEmpty()) {
            diagnostics.reportMissingRequiredAttribute(startToken.span(), "DEPRECATED", "since");
            since = "0.0.0";
        }
        return new Deprecation(startToken.span(), since, spec.replacement());
    }

    private BreakingChange parseBreaking() {
        Token startToken = expect(TokenType.BREAKING);
        String version = parseAttributes().positionalOr(0, "");
        if (version.isEmpty()) {
            diagnostics.reportMissingRequiredAttribute(startToken.span(), "BREAKING", "version");
            version = "0.0.0";
        }
        String description = parseRequiredDescription(startToken, "BREAKING");
        return new BreakingChange(startToken.span(), version, description);
    }

    /**
     * {@code §DC{id} "title" §CHOSEN "x" §REASON "..." §REJECTED "y" §REASON "..." ... §/DC{id}}.
     * A {@code §REASON} belongs to the chosen option until the first rejected option appears.
     */
    private Decision parseDecision() {
        Token startToken = expect(TokenType.DECISION);
        String id = parseAttributes().positionalOr(0, "");
        if (id.isEmpty()) {
            diagnostics.reportMissingRequiredAttribute(startToken.span(), "DECISION", "id");
            id = "unknown";
        }
        String title = Objects.requireNonNullElse(parseOptionalDescription(), "");

        String chosen = "";
        List<String> chosenReasons = new ArrayList<>();
        List<RejectedOption> rejected = new ArrayList<>();
        String context = null;
        LocalDate date = null;
        String author = null;

        while (!isAtEnd() && !check(TokenType.END_DECISION)) {
            switch (current().type()) {
                case CHOSEN -> {
                    advance();
                    chosen = Objects.requireNonNullElse(parseOptionalDescription(), chosen);
                }
                case REASON -> {
                    advance();
                    String reason = parseOptionalDescription();
                    if (reason != null && !chosen.isEmpty() && rejected.isEmpty()) {
                        chosenReasons.add(reason);
                    }
                }
                case REJECTED -> rejected.add(parseRejectedOption());
                case CONTEXT -> {
                    advance();
                    context = parseOptionalDescription();
                }
                case DATE_MARKER -> {
                    advance();
                    date = AttributeInterpreter.parseDate(parseAttributes().positional(0));
                    if (date == null && check(TokenType.IDENTIFIER)) {
                        date = AttributeInterpreter.parseDate(advance().text());
                    }
                }
                case AGENT_AUTHOR -> {
                    advance();
                    author = parseOptionalDescription();
                }
                default -> {
                    skipUnexpected("CHOSEN, REASON, REJECTED, CONTEXT, DATE, AU, or END_DECISION");
                }
            }
        }

        Token endToken = expectClose(TokenType.END_DECISION, "DECISION", id, "END_DECISION");
        return new Decision(startToken.span().union(endToken.span()), id, title, chosen, frozen(chosenReasons),
            frozen(rejected), context, date, author);
    }

    private RejectedOption parseRejectedOption() {
        Token startToken = expect(TokenType.REJECTED);
        String name = Objects.requireNonNullElse(parseOptionalDescription(), "");
        List<String> reasons = new ArrayList<>();
        while (match(TokenType.REASON)) {
            String reason = parseOptionalDescription();
            if (reason != null) {
                reasons.add(reason);
            }
        }
        return new RejectedOption(startToken.span(), name, frozen(reasons));
    }

    /**
     * {@code §CT{[partial]} §VS §FILE{..} §/VS §HD §FILE{..} §/HD §FC{target} §/CT}. A bare
     * {@code §FILE} counts as visible.
     */
    private ContextBlock parseContext() {
        Token startToken = expect(TokenType.CONTEXT);
        boolean partial = AttributeInterpreter.interpretContextPartial(parseAttributes());
        List<FileRef> visibleFiles = new ArrayList<>();
        List<FileRef> hiddenFiles = new ArrayList<>();
        String focus = null;

        while (!isAtEnd() && !check(TokenType.END_CONTEXT)) {
            switch (current().type()) {
                case VISIBLE -> {
                    advance();
                    parseFileRefs(visibleFiles, TokenType.END_VISIBLE);
                }
                case HIDDEN_SECTION -> {
                    advance();
                    parseFileRefs(hiddenFiles, TokenType.END_HIDDEN_SECTION);
                }
                case FOCUS -> {
                    advance();
                    focus = emptyToNull(parseAttributes().positional(0));
                }
                case FILE_REF -> visibleFiles.add(parseFileRef());
                default -> {
                    skipUnexpected("VS, HD, FC, FILE, or END_CONTEXT");
                }
            }
        }

        Token endToken = expect(TokenType.END_CONTEXT);
        return new ContextBlock(startToken.span().union(endToken.span()), partial, frozen(visibleFiles),
            frozen(hiddenFiles), focus);
    }

    private void parseFileRefs(List<FileRef> into, TokenType terminator) {
        while (!isAtEnd() && !check(terminator)) {
            if (check(TokenType.FILE_REF)) {
                into.add(parseFileRef());
            } else {
                skipUnexpected("FILE");
            }
        }
        match(terminator);
    }

    private FileRef parseFileRef() {
        Token startToken = expect(TokenType.FILE_REF);
        String path = parseAttributes().positionalOr(0, "");
        return new FileRef(startToken.span(), path, parseOptionalDescription());
    }

    /**
     * {@code §PT [forall x, y:] predicate}. The quantifier prefix names the generated inputs.
     */
    private PropertyTest parsePropertyTest() {
        Token startToken = expect(TokenType.PROPERTY_TEST);
        parseAttributes();
        List<String> quantifiers = new ArrayList<>();
        if (check(TokenType.IDENTIFIER) && current().text().equalsIgnoreCase("forall")) {
            advance();
            while (check(TokenType.IDENTIFIER) || check(TokenType.COMMA)) {
                Token token = advance();
                if (token.type() == TokenType.IDENTIFIER) {
                    String name = token.text().endsWith(":")
                        ? token.text().substring(0, token.text().length() - 1)
                        : token.text();
                    if (!name.isEmpty()) {
                        quantifiers.add(name);
                    }
                }
                if (match(TokenType.COLON)) {
                    break;
                }
            }
        }
        Expression predicate = parseExpression();
        return new PropertyTest(startToken.span().union(predicate.span()), frozen(quantifiers), predicate);
    }

    private Lock parseLock() {
        Token startToken = expect(TokenType.LOCK);
        AttributeCollection attrs = parseAttributes();
        String agentId = Objects.requireNonNullElse(attrs.positionalOrNamed(0, "agent"), "");
        if (agentId.isEmpty()) {
            diagnostics.reportMissingRequiredAttribute(startToken.span(), "LOCK", "agent");
            agentId = "unknown";
        }
        return new Lock(startToken.span(), agentId,
            AttributeInterpreter.parseDateTime(attrs.positionalOrNamed(1, "acquired")),
            AttributeInterpreter.parseDateTime(attrs.positionalOrNamed(2, "expires")));
    }

    private Author parseAuthor() {
        Token startToken = expect(TokenType.AGENT_AUTHOR);
        AttributeInterpreter.AuthorSpec spec = AttributeInterpreter.interpretAuthor(parseAttributes());
        String agentId = spec.agentId();
        if (agentId.isEmpty()) {
            diagnostics.reportMissingRequiredAttribute(startToken.span(), "AUTHOR", "agent");
            agentId = "unknown";
        }
        return new Author(startToken.span(), agentId, spec.date(), spec.taskId());
    }

    private TaskRef parseTaskRef() {
        Token startToken = expect(TokenType.TASK_REF);
        String taskId = parseAttributes().positionalOr(0, "");
        if (taskId.isEmpty()) {
            diagnostics.reportMissingRequiredAttribute(startToken.span(), "TASK", "id");
            taskId = "unknown";
        }
        return new TaskRef(startToken.span(), taskId, Objects.requireNonNullElse(parseOptionalDescription(), ""));
    }

    // ========================================================================
    // Enumerations
    // ========================================================================

    /**
     * {@code §EN{id:Name[:underlying]} A B = 2 C = -1 §/EN{id}}.
     */
    private EnumDefinition parseEnumDefinition() {
        Token startToken = expect(TokenType.ENUM);
        AttributeCollection attrs = parseAttributes();
        String id = requireId(attrs.positional(0), startToken, "EN");
        String name = attrs.positionalOr(1, "");
        if (name.isEmpty()) {
            diagnostics.reportMissingRequiredAttribute(startToken.span(), "EN", "name");
        }
        String underlyingType = emptyToNull(attrs.positional(2));

        List<EnumMember> members = new ArrayList<>();
        while (!isAtEnd() && !check(TokenType.END_ENUM)) {
            if (!check(TokenType.IDENTIFIER)) {
                skipUnexpected("enum member name");
                continue;
            }
            Token memberToken = advance();
            String value = null;
            if (match(TokenType.EQUALS)) {
                if (check(TokenType.INT_LITERAL)) {
                    value = literalText(advance());
                } else if (check(TokenType.IDENTIFIER)) {
                    value = advance().text();
                } else if (check(TokenType.MINUS) && checkAhead(1, TokenType.INT_LITERAL)) {
                    advance();
                    value = "-" + literalText(advance());
                }
            }
            members.add(new EnumMember(memberToken.span().union(previous().span()), memberToken.text(), value));
        }

        Token endToken = expectClose(TokenType.END_ENUM, "EN", id, "END_EN");
        return new EnumDefinition(startToken.span().union(endToken.span()), id, name, underlyingType, frozen(members));
    }

    /**
     * {@code §EEXT{id:EnumName}} holding functions; each must take the enum as a parameter.
     */
    private EnumExtension parseEnumExtension() {
        Token startToken = expect(TokenType.ENUM_EXTENSION);
        AttributeCollection attrs = parseAttributes();
        String id = requireId(attrs.positional(0), startToken, "EXT");
        String enumName = attrs.positionalOr(1, "");
        if (enumName.isEmpty()) {
            diagnostics.reportMissingRequiredAttribute(startToken.span(), "EXT", "enumName");
        }

        List<FunctionDefinition> methods = new ArrayList<>();
        while (!isAtEnd() && !check(TokenType.END_ENUM_EXTENSION)) {
            if (check(TokenType.FUNC)) {
                methods.add(parseFunction(false));
            } else if (check(TokenType.ASYNC_FUNC)) {
                methods.add(parseFunction(true));
            } else {
                skipUnexpected("F or AF (function definition)");
            }
        }

        Token endToken = expectClose(TokenType.END_ENUM_EXTENSION, "EXT", id, "END_EXT");
        if (!enumName.isEmpty()) {
            for (FunctionDefinition method : methods) {
                boolean hasSelf = method.parameters().stream()
                    .anyMatch(p -> p.typeName().equalsIgnoreCase(enumName));
                if (!hasSelf) {
                    diagnostics.reportMissingExtensionSelf(method.span(), method.name(), enumName);
                }
            }
        }
        return new EnumExtension(startToken.span().union(endToken.span()), id, enumName, frozen(methods));
    }

    // ========================================================================
    // Convenience entry points
    // ========================================================================

    public static ParseResult parseSource(String source) {
        return parseSource(source, ParserOptions.DEFAULTS);
    }

    public static ParseResult parseSource(String source, ParserOptions options) {
        Parser parser = new Parser(source, options);
        Program program = parser.parse();
        return new ParseResult(program, parser.getDiagnostics());
    }

    /**
     * @throws com.calor.diagnostics.SyntaxErrorException if lexing or parsing reported an error
     */
    public static Program parseOrThrow(String source) {
        ParseResult result = parseSource(source);
        result.diagnostics().throwIfErrors();
        return result.program();
    }
}

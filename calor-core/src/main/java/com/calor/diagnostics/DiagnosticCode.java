package com.calor.diagnostics;

/**
 * Stable diagnostic codes. Lexer codes occupy 0001-0099, parser codes 0100-0199.
 */
public final class DiagnosticCode {

    private DiagnosticCode() {
    }

    // Lexer
    public static final String UNEXPECTED_CHARACTER = "Calor0001";
    public static final String UNTERMINATED_STRING = "Calor0002";
    public static final String INVALID_TYPED_LITERAL = "Calor0003";
    public static final String INVALID_ESCAPE_SEQUENCE = "Calor0004";
    public static final String UNTERMINATED_RAW_BLOCK = "Calor0005";
    public static final String UNKNOWN_SECTION_MARKER = "Calor0006";
    public static final String INVALID_SECTION_OPERATOR = "Calor0007";

    // Parser
    public static final String UNEXPECTED_TOKEN = "Calor0100";
    public static final String MISMATCHED_ID = "Calor0101";
    public static final String MISSING_REQUIRED_ATTRIBUTE = "Calor0102";
    public static final String EXPECTED_KEYWORD = "Calor0103";
    public static final String EXPECTED_EXPRESSION = "Calor0104";
    public static final String EXPECTED_CLOSING_TAG = "Calor0105";
    public static final String INVALID_OPERATOR = "Calor0106";
    public static final String INVALID_MODIFIER = "Calor0107";
    public static final String OPERATOR_ARGUMENT_COUNT = "Calor0110";
    public static final String INVALID_COMPARISON_MODE = "Calor0111";
    public static final String INVALID_CHAR_LITERAL = "Calor0112";
    public static final String EXPECTED_TYPE_NAME = "Calor0113";
    public static final String INVALID_LISP_EXPRESSION = "Calor0114";
    public static final String TYPE_PARAMETER_NOT_FOUND = "Calor0115";

    // Declarations
    public static final String MISSING_EXTENSION_SELF = "Calor0204";

    // Contracts
    public static final String QUANTIFIER_NO_BOUND_VARS = "Calor0320";
}

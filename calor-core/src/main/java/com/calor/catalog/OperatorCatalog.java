package com.calor.catalog;

import com.calor.Logging;
import org.apache.log4j.Logger;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Valid prefix-expression operators, hints for constructs borrowed from other languages,
 * and a typo matcher for unknown operator text.
 */
public final class OperatorCatalog {

    private static final Logger LOG = Logging.getCalorLogger();

    public static final int DEFAULT_MAX_DISTANCE = 2;

    private OperatorCatalog() {
    }

    public static final List<String> ALL_OPERATORS = List.of(
        // arithmetic
        "+", "-", "*", "/", "%", "**",
        // comparison
        "==", "!=", "<", "<=", ">", ">=",
        // logical
        "&&", "||", "!",
        // word forms
        "and", "or", "not", "mod", "eq", "ne", "neq", "lt", "le", "lte", "gt", "ge", "gte",
        // bitwise
        "&", "|", "^", "<<", ">>", "~",
        // quantifiers and implication
        "forall", "exists", "->",
        // control flow
        "if", "cond", "let", "return", "set",
        // string
        "len", "contains", "starts", "ends", "indexof", "isempty", "isblank", "equals",
        "substr", "replace", "upper", "lower", "trim", "ltrim", "rtrim", "lpad", "rpad",
        "join", "fmt", "concat", "split", "str",
        "regex-test", "regex-match", "regex-replace", "regex-split",
        // char
        "char-at", "char-code", "char-from-code",
        "is-letter", "is-digit", "is-whitespace", "is-upper", "is-lower",
        "char-upper", "char-lower", "char-lit",
        // string builder
        "sb-new", "sb-append", "sb-appendline", "sb-insert", "sb-remove",
        "sb-clear", "sb-tostring", "sb-length",
        // list
        "list", "cons", "car", "cdr", "nth", "map", "filter", "reduce", "reverse",
        "append", "length",
        // option
        "some", "none", "is-some", "is-none", "unwrap", "unwrap-or", "map-opt",
        // result
        "ok", "err", "is-ok", "is-err", "unwrap-result",
        // async
        "await",
        // type
        "cast", "as", "is",
        // conditional and null-coalescing
        "?", "??",
        // unary aliases
        "++", "--", "neg", "negate", "bnot", "bitwisenot",
        "inc", "dec", "pre-inc", "pre-dec", "post-inc", "post-dec"
    );

    private static final Set<String> OPERATOR_SET =
        Collections.unmodifiableSet(new LinkedHashSet<>(ALL_OPERATORS));

    private static final Map<String, String> FOREIGN_HINTS = buildForeignHints();

    static {
        LOG.trace("Operator catalog: " + OPERATOR_SET.size() + " operators, "
            + FOREIGN_HINTS.size() + " foreign hints");
    }

    private static Map<String, String> buildForeignHints() {
        Map<String, String> hints = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);

        // keywords
        hints.put("nameof", "Use a string literal instead: \"VariableName\"");
        hints.put("typeof", "Type reflection is not supported in Calor. Use type names directly in expressions.");
        hints.put("sizeof", "Size operations are not supported in Calor. Use constants for known sizes.");
        hints.put("default", "Use explicit default values (0 for numbers, \"\" for strings, §NN for None).");
        hints.put("new", "Use §NEW for object creation: §NEW[Type] ... §/NEW");
        hints.put("await", "Use (await expr) for async operations");
        hints.put("async", "Mark functions with §AWAIT effect, then use (await ...) in expressions");
        hints.put("throw", "Use (err message) to create error results, or §THROW for exceptions");
        hints.put("try", "Use Result types with (ok ...) and (err ...) instead of try-catch");
        hints.put("catch", "Use pattern matching on Result types: §MATCH[result] §ARM[Ok] ... §ARM[Err] ...");
        hints.put("finally", "Use §DEFER for cleanup code that must run");
        hints.put("lock", "Concurrency primitives are not supported in Calor");
        hints.put("using", "Use §USING for resource management: §USING[var] ... §/USING");
        hints.put("yield", "Use list comprehensions or §SEQ for lazy sequences");
        hints.put("unsafe", "Unsafe code is not supported in Calor");
        hints.put("fixed", "Fixed pointers are not supported in Calor");
        hints.put("stackalloc", "Stack allocation is not supported in Calor");
        hints.put("checked", "Use explicit overflow checking if needed");
        hints.put("unchecked", "All arithmetic is unchecked by default in Calor");
        hints.put("delegate", "Use lambda expressions: §LAM[params] ... §/LAM");
        hints.put("event", "Events are not directly supported. Use callback functions.");
        hints.put("volatile", "Volatile is not supported in Calor");
        hints.put("extern", "Use §EXTERN for external function declarations");

        // compound operators
        hints.put("++", "Use (+ x 1) or (set x (+ x 1))");
        hints.put("--", "Use (- x 1) or (set x (- x 1))");
        hints.put("+=", "Use (set x (+ x value))");
        hints.put("-=", "Use (set x (- x value))");
        hints.put("*=", "Use (set x (* x value))");
        hints.put("/=", "Use (set x (/ x value))");
        hints.put("??", "Use (unwrap-or option default) for null-coalescing");
        hints.put("?.", "Use pattern matching or (map-opt option fn) for null-conditional");
        hints.put("?[", "Use (if (is-some opt) (nth (unwrap opt) i) default)");
        hints.put("!.", "Use (unwrap option) to assert non-null");
        hints.put("::", "Namespace resolution is automatic in Calor");

        // methods
        hints.put("ToString", "Use (str expr) to convert to string");
        hints.put("ToLower", "Use (lower s) for lowercase conversion");
        hints.put("ToUpper", "Use (upper s) for uppercase conversion");
        hints.put("Substring", "Use (substr s start length) or (substr s start)");
        hints.put("Contains", "Use (contains s substring)");
        hints.put("StartsWith", "Use (starts s prefix)");
        hints.put("EndsWith", "Use (ends s suffix)");
        hints.put("IndexOf", "Use (indexof s substring)");
        hints.put("Replace", "Use (replace s old new)");
        hints.put("Split", "Use (split s separator)");
        hints.put("Join", "Use (join separator items)");
        hints.put("Trim", "Use (trim s)");
        hints.put("Length", "Use (len s) for string length");
        hints.put("Count", "Use (length list) for collection count");
        hints.put("Add", "Use (append list item) or (cons item list)");
        hints.put("Remove", "Use (filter list (not (== item x)))");
        hints.put("FirstOrDefault", "Use (if (> (length list) 0) (nth list 0) default)");
        hints.put("Where", "Use (filter list predicate)");
        hints.put("Select", "Use (map list transform)");
        hints.put("Any", "Use (exists (x) (in list) condition)");
        hints.put("All", "Use (forall (x) (in list) condition)");
        hints.put("Sum", "Use (reduce list + 0)");

        // literals
        hints.put("null", "Use Option types: §SM for Some, §NN for None");
        hints.put("true", "Use #true for boolean true");
        hints.put("false", "Use #false for boolean false");

        // static helpers
        hints.put("string.IsNullOrEmpty", "Use (isempty s)");
        hints.put("string.IsNullOrWhiteSpace", "Use (isblank s)");
        hints.put("string.Format", "Use (fmt template arg1 arg2 ...)");
        hints.put("Console.WriteLine", "Use §PRINT or (print ...)");
        hints.put("Math.Abs", "Math.Abs is not directly supported. Use (if (< x 0) (- 0 x) x) for absolute value.");
        hints.put("Math.Max", "Math.Max is not directly supported. Use (if (> a b) a b) for maximum.");
        hints.put("Math.Min", "Math.Min is not directly supported. Use (if (< a b) a b) for minimum.");
        hints.put("Math.Pow", "Use (** base exponent) for exponentiation");
        hints.put("Math.Sqrt", "Math.Sqrt is not directly supported. Use (** x 0.5) for square root.");
        hints.put("Math.Floor", "Math.Floor is not directly supported. Use (cast i32 x) to truncate.");
        hints.put("Math.Ceiling", "Math.Ceiling is not directly supported.");
        hints.put("Math.Round", "Math.Round is not directly supported.");

        return Collections.unmodifiableMap(hints);
    }

    public static boolean isKnownOperator(String text) {
        return text != null && OPERATOR_SET.contains(text.toLowerCase(Locale.ROOT));
    }

    public static String findSimilarOperator(String unknown) {
        return findSimilarOperator(unknown, DEFAULT_MAX_DISTANCE);
    }

    /**
     * Nearest catalog operator within {@code maxDistance} edits, or null. An entry that is a
     * prefix of the input (or the other way round) gets its distance reduced by one; the first
     * entry reaching the best distance wins.
     */
    public static String findSimilarOperator(String unknown, int maxDistance) {
        if (unknown == null || unknown.isEmpty()) {
            return null;
        }

        String lowerUnknown = unknown.toLowerCase(Locale.ROOT);
        String bestMatch = null;
        int bestDistance = Integer.MAX_VALUE;

        for (String op : ALL_OPERATORS) {
            String lowerOp = op.toLowerCase(Locale.ROOT);
            int distance = Levenshtein.distance(lowerUnknown, lowerOp);
            if (distance <= maxDistance && distance < bestDistance) {
                if (lowerOp.startsWith(lowerUnknown) || lowerUnknown.startsWith(lowerOp)) {
                    distance--;
                }
                if (distance < bestDistance) {
                    bestDistance = distance;
                    bestMatch = op;
                }
            }
        }

        if (LOG.isTraceEnabled()) {
            LOG.trace("Nearest operator to '" + unknown + "': " + bestMatch);
        }
        return bestMatch;
    }

    /**
     * Hint for a construct from another language: exact lookup first, then the member name
     * after the last dot (so {@code x.ToString()} finds the {@code ToString} hint).
     */
    public static String getForeignHint(String unknown) {
        if (unknown == null || unknown.isEmpty()) {
            return null;
        }

        String hint = FOREIGN_HINTS.get(unknown);
        if (hint != null) {
            return hint;
        }

        int dotIndex = unknown.lastIndexOf('.');
        if (dotIndex >= 0 && dotIndex < unknown.length() - 1) {
            String memberPart = stripTrailingParens(unknown.substring(dotIndex + 1));
            return FOREIGN_HINTS.get(memberPart);
        }

        return null;
    }

    private static String stripTrailingParens(String s) {
        int end = s.length();
        while (end > 0 && (s.charAt(end - 1) == '(' || s.charAt(end - 1) == ')')) {
            end--;
        }
        return s.substring(0, end);
    }

    public static String getOperatorCategories() {
        return "arithmetic (+, -, *, /, %), comparison (==, !=, <, <=, >, >=), "
            + "logical (&&, ||, !), string (len, contains, substr, ...), "
            + "or char (char-at, is-letter, ...)";
    }

    public static String getStringOpExample(String opName) {
        return switch (opName.toLowerCase(Locale.ROOT)) {
            case "len" -> "(len str)";
            case "contains" -> "(contains str \"substring\")";
            case "starts" -> "(starts str \"prefix\")";
            case "ends" -> "(ends str \"suffix\")";
            case "indexof" -> "(indexof str \"substring\")";
            case "isempty" -> "(isempty str)";
            case "isblank" -> "(isblank str)";
            case "equals" -> "(equals str1 str2)";
            case "substr" -> "(substr str start) or (substr str start length)";
            case "replace" -> "(replace str \"old\" \"new\")";
            case "upper" -> "(upper str)";
            case "lower" -> "(lower str)";
            case "trim" -> "(trim str)";
            case "ltrim" -> "(ltrim str)";
            case "rtrim" -> "(rtrim str)";
            case "lpad" -> "(lpad str width)";
            case "rpad" -> "(rpad str width)";
            case "join" -> "(join separator list)";
            case "fmt" -> "(fmt \"template {0}\" arg1 arg2 ...)";
            case "concat" -> "(concat str1 str2 ...)";
            case "split" -> "(split str separator)";
            case "str" -> "(str value)";
            case "regex-test" -> "(regex-test str pattern)";
            case "regex-match" -> "(regex-match str pattern)";
            case "regex-replace" -> "(regex-replace str pattern replacement)";
            case "regex-split" -> "(regex-split str pattern)";
            default -> "(" + opName + " ...)";
        };
    }

    public static String getCharOpExample(String opName) {
        return switch (opName.toLowerCase(Locale.ROOT)) {
            case "char-at" -> "(char-at str index)";
            case "char-code" -> "(char-code char)";
            case "char-from-code" -> "(char-from-code int)";
            case "is-letter" -> "(is-letter char)";
            case "is-digit" -> "(is-digit char)";
            case "is-whitespace" -> "(is-whitespace char)";
            case "is-upper" -> "(is-upper char)";
            case "is-lower" -> "(is-lower char)";
            case "char-upper" -> "(char-upper char)";
            case "char-lower" -> "(char-lower char)";
            case "char-lit" -> "(char-lit \"Y\")";
            default -> "(" + opName + " ...)";
        };
    }

    public static String getStringBuilderOpExample(String opName) {
        return switch (opName.toLowerCase(Locale.ROOT)) {
            case "sb-new" -> "(sb-new) or (sb-new \"initial\")";
            case "sb-append" -> "(sb-append builder \"text\")";
            case "sb-appendline" -> "(sb-appendline builder \"text\")";
            case "sb-insert" -> "(sb-insert builder index \"text\")";
            case "sb-remove" -> "(sb-remove builder start length)";
            case "sb-clear" -> "(sb-clear builder)";
            case "sb-tostring" -> "(sb-tostring builder)";
            case "sb-length" -> "(sb-length builder)";
            default -> "(" + opName + " ...)";
        };
    }

    public static String getTypeOpExample(String opName) {
        return switch (opName.toLowerCase(Locale.ROOT)) {
            case "cast" -> "(cast i32 value)";
            case "is" -> "(is value Type)";
            case "as" -> "(as value Type)";
            default -> "(" + opName + " ...)";
        };
    }
}

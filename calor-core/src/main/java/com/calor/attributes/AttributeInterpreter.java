package com.calor.attributes;

import com.calor.ast.AssumptionCategory;
import com.calor.ast.ComplexityClass;
import com.calor.ast.IssuePriority;
import com.calor.ast.Visibility;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Maps a tag's positional attributes to typed values. Every method is a pure function of
 * its input collection; absent positions fall back to the documented defaults.
 */
public final class AttributeInterpreter {

    private AttributeInterpreter() {
    }

    public record FunctionHeader(String id, String name, Visibility visibility) {}

    public record InputSpec(String type, String name, String semantic) {}

    public record CallTarget(String target, boolean fallible) {}

    public record BindSpec(String name, boolean mutable, String typeName) {}

    public record ForSpec(String id, String variable, String from, String to, String step) {}

    public record ExampleSpec(String id, String message) {}

    public record IssueSpec(String id, String category, IssuePriority priority) {}

    public record ComplexitySpec(ComplexityClass time, ComplexityClass space) {}

    public record DeprecatedSpec(String since, String replacement) {}

    public record AuthorSpec(String agentId, LocalDate date, String taskId) {}

    /**
     * A dependency entry from {@code §US}/{@code §UB}. {@code version} is null when no
     * {@code @version} suffix was given.
     */
    public record Dependency(String target, boolean optional, String version) {}

    public record DependencyList(List<Dependency> dependencies, boolean unknownCallers) {}

    // ========================================================================
    // Module / function / call
    // ========================================================================

    public static String[] interpretModule(AttributeCollection attrs) {
        return new String[] {attrs.getOrDefault("_pos0", ""), attrs.getOrDefault("_pos1", "")};
    }

    public static String interpretEndId(AttributeCollection attrs) {
        String id = attrs.positionalOrNamed(0, "id");
        return id == null ? "" : id;
    }

    public static FunctionHeader interpretFunction(AttributeCollection attrs) {
        return new FunctionHeader(
            attrs.getOrDefault("_pos0", ""),
            attrs.getOrDefault("_pos1", ""),
            parseVisibility(attrs.positional(2)));
    }

    public static InputSpec interpretInput(AttributeCollection attrs) {
        String semantic = attrs.positional(2);
        if (semantic != null && semantic.startsWith("#")) {
            semantic = expandSemanticShortcode(semantic);
        }
        return new InputSpec(expandType(attrs.getOrDefault("_pos0", "")), attrs.getOrDefault("_pos1", ""), semantic);
    }

    public static String interpretOutput(AttributeCollection attrs) {
        return expandType(attrs.getOrDefault("_pos0", ""));
    }

    public static CallTarget interpretCall(AttributeCollection attrs) {
        String target = attrs.getOrDefault("_pos0", "");
        boolean fallible = target.endsWith("!");
        if (fallible) {
            target = target.substring(0, target.length() - 1);
        }
        return new CallTarget(target, fallible);
    }

    public static BindSpec interpretBind(AttributeCollection attrs) {
        String name = attrs.getOrDefault("_pos0", "");
        boolean mutable = name.startsWith("~");
        if (mutable) {
            name = name.substring(1);
        }
        String typeName = attrs.positional(1);
        if (typeName != null && !typeName.isEmpty()) {
            typeName = expandType(typeName);
        }
        return new BindSpec(name, mutable, typeName);
    }

    public static ForSpec interpretFor(AttributeCollection attrs) {
        return new ForSpec(
            attrs.getOrDefault("_pos0", ""),
            attrs.getOrDefault("_pos1", ""),
            attrs.getOrDefault("_pos2", ""),
            attrs.getOrDefault("_pos3", ""),
            attrs.positionalOr(4, "1"));
    }

    /**
     * Effect codes from every position, grouped by category. Repeated codes in one category
     * are joined with commas in the order given.
     */
    public static Map<String, String> interpretEffects(AttributeCollection attrs) {
        Map<String, String> effects = new LinkedHashMap<>();
        for (int i = 0; ; i++) {
            String code = attrs.positional(i);
            if (code == null || code.isEmpty()) {
                break;
            }
            String[] expanded = expandEffectCode(code);
            effects.merge(expanded[0], expanded[1], (a, b) -> a + "," + b);
        }
        return effects;
    }

    // ========================================================================
    // Shortcode expansion
    // ========================================================================

    /**
     * Expands compact type notation. {@code ?T} becomes an option, {@code T!E} a result whose
     * error type defaults to STRING, primitive codes map to canonical descriptors and anything
     * else passes through with its original casing.
     */
    public static String expandType(String compactType) {
        if (compactType == null || compactType.isEmpty()) {
            return compactType;
        }

        if (compactType.startsWith("?")) {
            return "OPTION[inner=" + expandType(compactType.substring(1)) + "]";
        }

        int bang = compactType.indexOf('!');
        if (bang >= 0) {
            String ok = expandType(compactType.substring(0, bang));
            String errPart = compactType.substring(bang + 1);
            String err = errPart.isEmpty() ? "STRING" : expandType(errPart);
            return "RESULT[ok=" + ok + "][err=" + err + "]";
        }

        return switch (compactType.toLowerCase(Locale.ROOT)) {
            case "i8" -> "INT[bits=8][signed=true]";
            case "i16" -> "INT[bits=16][signed=true]";
            case "i32", "int" -> "INT";
            case "i64" -> "INT[bits=64][signed=true]";
            case "u8" -> "INT[bits=8][signed=false]";
            case "u16" -> "INT[bits=16][signed=false]";
            case "u32" -> "INT[bits=32][signed=false]";
            case "u64" -> "INT[bits=64][signed=false]";
            case "f32" -> "FLOAT[bits=32]";
            case "f64", "float" -> "FLOAT";
            case "str", "string" -> "STRING";
            case "bool" -> "BOOL";
            case "void" -> "VOID";
            case "never" -> "NEVER";
            case "char" -> "CHAR";
            default -> compactType;
        };
    }

    /**
     * @return a two-element array: category, value
     */
    public static String[] expandEffectCode(String code) {
        return switch (code.toLowerCase(Locale.ROOT)) {
            case "cw" -> new String[] {"io", "console_write"};
            case "cr" -> new String[] {"io", "console_read"};
            case "fw" -> new String[] {"io", "file_write"};
            case "fr" -> new String[] {"io", "file_read"};
            case "fd" -> new String[] {"io", "file_delete"};
            case "net" -> new String[] {"io", "network"};
            case "http" -> new String[] {"io", "http"};
            case "db" -> new String[] {"io", "database"};
            case "dbr" -> new String[] {"io", "database_read"};
            case "dbw" -> new String[] {"io", "database_write"};
            case "env" -> new String[] {"io", "environment"};
            case "proc" -> new String[] {"io", "process"};
            case "alloc" -> new String[] {"memory", "allocation"};
            case "time" -> new String[] {"nondeterminism", "time"};
            case "rand" -> new String[] {"nondeterminism", "random"};
            default -> new String[] {"io", code};
        };
    }

    public static String expandSemanticShortcode(String shortcode) {
        if (shortcode == null || shortcode.isEmpty()) {
            return null;
        }
        if (!shortcode.startsWith("#")) {
            return shortcode;
        }
        if (shortcode.length() >= 3 && shortcode.startsWith("#\"") && shortcode.endsWith("\"")) {
            return shortcode.substring(2, shortcode.length() - 1);
        }
        return switch (shortcode.toLowerCase(Locale.ROOT)) {
            case "#input" -> "user input";
            case "#dbid" -> "database identifier";
            case "#errmsg" -> "error message";
            case "#counter" -> "loop counter";
            case "#retval" -> "return value";
            case "#index" -> "array index";
            case "#count" -> "count value";
            case "#name" -> "name identifier";
            case "#path" -> "file path";
            case "#url" -> "URL";
            default -> shortcode.substring(1);
        };
    }

    public static Visibility parseVisibility(String value) {
        if (value == null) {
            return Visibility.PRIVATE;
        }
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "public", "pub" -> Visibility.PUBLIC;
            case "internal", "int" -> Visibility.INTERNAL;
            case "protected", "pro", "prot" -> Visibility.PROTECTED;
            default -> Visibility.PRIVATE;
        };
    }

    public static Visibility parseVisibility(String value, Visibility defaultVisibility) {
        if (value == null || value.isEmpty()) {
            return defaultVisibility;
        }
        return parseVisibility(value);
    }

    // ========================================================================
    // Metadata
    // ========================================================================

    public static ExampleSpec interpretExample(AttributeCollection attrs) {
        String message = attrs.positional(1);
        if (message != null && message.startsWith("msg:")) {
            message = message.substring(4);
        }
        return new ExampleSpec(attrs.positional(0), message);
    }

    public static IssueSpec interpretIssue(AttributeCollection attrs) {
        return new IssueSpec(attrs.positional(0), attrs.positional(1), parseIssuePriority(attrs.positional(2)));
    }

    public static IssuePriority parseIssuePriority(String value) {
        if (value == null) {
            return IssuePriority.MEDIUM;
        }
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "low" -> IssuePriority.LOW;
            case "high" -> IssuePriority.HIGH;
            case "critical", "crit" -> IssuePriority.CRITICAL;
            default -> IssuePriority.MEDIUM;
        };
    }

    /**
     * Parses dependency entries. A trailing {@code ?} marks the entry optional, an
     * {@code @version} suffix is split off, and the sentinels {@code *} and {@code external}
     * set {@code unknownCallers} instead of producing an entry.
     */
    public static DependencyList interpretDependencies(List<String> entries) {
        List<Dependency> dependencies = new ArrayList<>();
        boolean unknownCallers = false;
        for (String raw : entries) {
            if (raw == null || raw.isEmpty()) {
                continue;
            }
            String entry = raw.trim();
            if (entry.equals("*") || entry.equalsIgnoreCase("external")) {
                unknownCallers = true;
                continue;
            }
            boolean optional = entry.endsWith("?");
            if (optional) {
                entry = entry.substring(0, entry.length() - 1);
            }
            String version = null;
            int at = entry.indexOf('@');
            if (at > 0) {
                version = entry.substring(at + 1);
                entry = entry.substring(0, at);
            }
            dependencies.add(new Dependency(entry, optional, version));
        }
        return new DependencyList(Collections.unmodifiableList(dependencies), unknownCallers);
    }

    public static List<String> positionalValues(AttributeCollection attrs) {
        List<String> values = new ArrayList<>();
        for (int i = 0; ; i++) {
            String value = attrs.positional(i);
            if (value == null || value.isEmpty()) {
                break;
            }
            values.add(value);
        }
        return values;
    }

    public static AssumptionCategory parseAssumptionCategory(String value) {
        if (value == null) {
            return null;
        }
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "env", "environment" -> AssumptionCategory.ENV;
            case "auth", "authentication" -> AssumptionCategory.AUTH;
            case "data" -> AssumptionCategory.DATA;
            case "timing", "time" -> AssumptionCategory.TIMING;
            case "resource", "res" -> AssumptionCategory.RESOURCE;
            default -> null;
        };
    }

    public static ComplexitySpec interpretComplexity(AttributeCollection attrs) {
        return new ComplexitySpec(parseComplexityClass(attrs.positional(0)), parseComplexityClass(attrs.positional(1)));
    }

    /**
     * Normalizes Big-O text ignoring spaces and case; returns null for anything outside the table.
     */
    public static ComplexityClass parseComplexityClass(String value) {
        if (value == null || value.isEmpty()) {
            return null;
        }
        String normalized = value.replace(" ", "").toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "o(1)" -> ComplexityClass.O1;
            case "o(logn)", "o(log(n))" -> ComplexityClass.O_LOG_N;
            case "o(n)" -> ComplexityClass.O_N;
            case "o(nlogn)", "o(n*logn)", "o(nlog(n))" -> ComplexityClass.O_N_LOG_N;
            case "o(n^2)", "o(n2)" -> ComplexityClass.O_N2;
            case "o(n^3)", "o(n3)" -> ComplexityClass.O_N3;
            case "o(2^n)", "o(2n)" -> ComplexityClass.O_2N;
            case "o(n!)" -> ComplexityClass.O_N_FACT;
            default -> null;
        };
    }

    public static DeprecatedSpec interpretDeprecated(AttributeCollection attrs) {
        String replacement = attrs.positional(1);
        if (replacement != null && replacement.isEmpty()) {
            replacement = null;
        }
        return new DeprecatedSpec(attrs.getOrDefault("_pos0", ""), replacement);
    }

    public static boolean interpretContextPartial(AttributeCollection attrs) {
        String pos0 = attrs.positional(0);
        return pos0 != null && pos0.equalsIgnoreCase("partial");
    }

    public static AuthorSpec interpretAuthor(AttributeCollection attrs) {
        String taskId = attrs.positional(1);
        if (taskId != null && taskId.isEmpty()) {
            taskId = null;
        }
        return new AuthorSpec(attrs.getOrDefault("_pos0", ""), LocalDate.now(), taskId);
    }

    public static LocalDate parseDate(String value) {
        if (value == null || value.isEmpty()) {
            return null;
        }
        try {
            return LocalDate.parse(value);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    public static LocalDateTime parseDateTime(String value) {
        if (value == null || value.isEmpty()) {
            return null;
        }
        try {
            return LocalDateTime.parse(value);
        } catch (DateTimeParseException e) {
            LocalDate date = parseDate(value);
            return date == null ? null : date.atStartOfDay();
        }
    }

    // ========================================================================
    // Arrays
    // ========================================================================

    /**
     * Whether an array attribute value reads as an element type rather than a name: a
     * primitive code, an array or option form, or a generic type.
     */
    public static boolean isLikelyType(String value) {
        if (value == null || value.isEmpty()) {
            return false;
        }
        if (value.startsWith("[") || value.startsWith("?") || value.contains("<")) {
            return true;
        }
        return PRIMITIVE_CODES.contains(value.toLowerCase(Locale.ROOT));
    }

    private static final Set<String> PRIMITIVE_CODES = Set.of(
        "i8", "i16", "i32", "i64", "u8", "u16", "u32", "u64", "f32", "f64",
        "int", "float", "str", "string", "bool", "void", "char", "object", "decimal");
}

package com.calor.catalog;

import com.calor.Logging;
import org.apache.log4j.Logger;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Section markers (the text after {@code §}) with short descriptions, the spelled-out
 * forms people tend to type instead of them, and a typo matcher.
 */
public final class TagCatalog {

    private static final Logger LOG = Logging.getCalorLogger();

    public static final int DEFAULT_MAX_DISTANCE = 2;

    private TagCatalog() {
    }

    public static final List<String> ALL_MARKERS = List.of(
        // core
        "M", "F", "C", "B", "R", "I", "O", "A", "E", "L", "W", "K", "Q", "S", "T", "D", "V", "U",
        "/M", "/F", "/C", "/I", "/L", "/W", "/K", "/T", "/D",
        // control flow
        "IF", "EI", "EL", "WH", "/WH", "DO", "/DO", "SW", "/SW", "BK", "CN", "BODY", "END_BODY",
        // option / result
        "SM", "NN", "OK", "ERR", "FL", "IV",
        // collections
        "ARR", "LIST", "DICT", "SET", "TUPLE", "SPAN", "RANGE", "NEW", "/NEW", "ADD", "DEL", "IDX", "ITER",
        // async
        "ASYNC", "/ASYNC", "AWAIT", "TASK", "LOCK", "/LOCK", "SEM", "ATOMIC",
        // access modifiers
        "PUB", "PRIV", "INT", "PROT", "STAT", "RO", "CONST",
        // generics
        "WR", "WHERE",
        // classes and interfaces
        "CL", "/CL", "IFACE", "/IFACE", "IMPL", "EXT", "MT", "/MT", "VR", "OV", "AB", "SD",
        "THIS", "/THIS", "BASE", "CTOR", "/CTOR", "DTOR", "/DTOR", "PROP", "/PROP", "GET", "SET", "INIT",
        // patterns
        "MATCH", "/MATCH", "ARM", "/ARM", "GUARD", "DEFAULT",
        // exceptions
        "TR", "/TR", "CA", "FI", "TH", "RT", "WHEN",
        // lambdas and delegates
        "LAM", "/LAM", "DEL", "/DEL", "EVENT", "/EVENT", "FIRE", "SUBSCRIBE", "/SUBSCRIBE",
        // documentation
        "DOC", "/DOC", "PARAM", "RETURNS", "THROWS", "SEE", "LINK", "NOTE", "WARN", "REF", "VER", "ID",
        // assembly
        "ASM", "/ASM", "NAME", "DEPS", "/DEPS", "TESTS", "/TESTS", "SIG", "REST",
        // enums
        "EN", "ENUM", "/EN", "/ENUM", "EEXT", "/EEXT",
        // metadata
        "EX", "TD", "FX", "HK",
        "US", "/US", "UB", "/UB", "AS",
        "CX", "SN", "DP", "BR", "XP", "SB",
        "DC", "/DC", "CHOSEN", "REJECTED", "REASON", "CT", "/CT", "VS", "/VS", "HD", "/HD",
        "FC", "FILE", "PT", "LK", "AU", "DATE",
        // print
        "P", "Pf"
    );

    public static final Map<String, String> MARKER_DESCRIPTIONS = buildDescriptions();

    private static final Map<String, String> EXPANDED_FORMS = buildExpandedForms();

    static {
        LOG.trace("Tag catalog: " + ALL_MARKERS.size() + " markers, "
            + EXPANDED_FORMS.size() + " expanded forms");
    }

    private static Map<String, String> buildDescriptions() {
        Map<String, String> d = new HashMap<>();
        d.put("M", "Module");
        d.put("F", "Function");
        d.put("C", "Call");
        d.put("B", "Bind (let)");
        d.put("R", "Return");
        d.put("I", "Input parameter");
        d.put("O", "Output");
        d.put("A", "Argument");
        d.put("E", "Effects");
        d.put("L", "Loop (for)");
        d.put("W", "Match (switch)");
        d.put("K", "Case");
        d.put("Q", "Requires (precondition)");
        d.put("S", "Ensures (postcondition)");
        d.put("T", "Type");
        d.put("D", "Record (data)");
        d.put("V", "Variant");
        d.put("U", "Using");
        d.put("IF", "If");
        d.put("EI", "ElseIf");
        d.put("EL", "Else");
        d.put("WH", "While");
        d.put("DO", "Do-while");
        d.put("SW", "Switch/Match");
        d.put("BK", "Break");
        d.put("CN", "Continue");
        d.put("SM", "Some (Option)");
        d.put("NN", "None (Option)");
        d.put("OK", "Ok (Result)");
        d.put("ERR", "Error (Result)");
        d.put("FL", "Field");
        d.put("IV", "Invariant");
        d.put("ARR", "Array");
        d.put("LIST", "List");
        d.put("DICT", "Dictionary");
        d.put("NEW", "New object");
        d.put("CL", "Class");
        d.put("IFACE", "Interface");
        d.put("MT", "Method");
        d.put("CTOR", "Constructor");
        d.put("PROP", "Property");
        d.put("TR", "Try");
        d.put("CA", "Catch");
        d.put("FI", "Finally");
        d.put("TH", "Throw");
        d.put("LAM", "Lambda");
        d.put("DOC", "Documentation");
        d.put("EN", "Enum");
        d.put("P", "Print (Console.WriteLine)");
        return Collections.unmodifiableMap(d);
    }

    private static Map<String, String> buildExpandedForms() {
        Map<String, String> e = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        e.put("FUNC", "F");
        e.put("FUNCTION", "F");
        e.put("MOD", "M");
        e.put("MODULE", "M");
        e.put("CALL", "C");
        e.put("BIND", "B");
        e.put("LET", "B");
        e.put("RETURN", "R");
        e.put("RET", "R");
        e.put("INPUT", "I");
        e.put("OUTPUT", "O");
        e.put("ARG", "A");
        e.put("ARGUMENT", "A");
        e.put("EFFECTS", "E");
        e.put("LOOP", "L");
        e.put("FOREACH", "L");
        e.put("FOR", "L");
        e.put("SWITCH", "W");
        e.put("CASE", "K");
        e.put("REQUIRES", "Q");
        e.put("PRECONDITION", "Q");
        e.put("PRE", "Q");
        e.put("ENSURES", "S");
        e.put("POSTCONDITION", "S");
        e.put("POST", "S");
        e.put("TYPE", "T");
        e.put("RECORD", "D");
        e.put("DATA", "D");
        e.put("VARIANT", "V");
        e.put("USING", "U");
        e.put("/FUNC", "/F");
        e.put("/FUNCTION", "/F");
        e.put("/MOD", "/M");
        e.put("/MODULE", "/M");
        e.put("/CALL", "/C");
        e.put("/LOOP", "/L");
        return Collections.unmodifiableMap(e);
    }

    public static String findSimilarMarker(String unknown) {
        return findSimilarMarker(unknown, DEFAULT_MAX_DISTANCE);
    }

    /**
     * Nearest marker for {@code unknown}: a spelled-out alias wins outright, otherwise the
     * marker with the smallest case-insensitive edit distance within {@code maxDistance},
     * preferring the shorter marker on ties.
     */
    public static String findSimilarMarker(String unknown, int maxDistance) {
        if (unknown == null || unknown.isEmpty()) {
            return null;
        }

        String upperUnknown = unknown.toUpperCase(Locale.ROOT);
        String expanded = EXPANDED_FORMS.get(upperUnknown);
        if (expanded != null) {
            return expanded;
        }

        String bestMatch = null;
        int bestDistance = Integer.MAX_VALUE;
        int bestLength = Integer.MAX_VALUE;

        for (String marker : ALL_MARKERS) {
            int distance = Levenshtein.distance(upperUnknown, marker.toUpperCase(Locale.ROOT));
            if (distance <= maxDistance
                && (distance < bestDistance || (distance == bestDistance && marker.length() < bestLength))) {
                bestDistance = distance;
                bestMatch = marker;
                bestLength = marker.length();
            }
        }

        if (LOG.isTraceEnabled()) {
            LOG.trace("Nearest marker to '" + unknown + "': " + bestMatch);
        }
        return bestMatch;
    }

    public static String describe(String marker) {
        if (marker == null) {
            return null;
        }
        return MARKER_DESCRIPTIONS.get(marker.startsWith("/") ? marker.substring(1) : marker);
    }

    public static String getCommonMarkers() {
        return "§M (Module), §F (Function), §B (Bind), §C (Call), §IF, §L (Loop), §W (Match)";
    }
}

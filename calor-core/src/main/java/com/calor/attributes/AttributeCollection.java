package com.calor.attributes;

import com.calor.ast.TextSpan;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Values from the brace groups after a tag. Positional values live under {@code _pos0..N}
 * and {@code _posCount} tracks how many there are; the index keeps counting across
 * successive brace groups on the same tag, so {@code {a}{b}} reads the same as {@code {a:b}}.
 */
public final class AttributeCollection {

    public static final String POSITION_COUNT_KEY = "_posCount";

    private final Map<String, String> values = new LinkedHashMap<>();
    private final Map<Integer, TextSpan> positionalSpans = new HashMap<>();
    private int positionalCount = 0;

    public static String positionKey(int index) {
        return "_pos" + index;
    }

    public String get(String key) {
        return values.get(key);
    }

    public String getOrDefault(String key, String defaultValue) {
        String value = values.get(key);
        return value == null ? defaultValue : value;
    }

    /**
     * Positional value at {@code index}, or null when absent.
     */
    public String positional(int index) {
        return values.get(positionKey(index));
    }

    /**
     * Positional value, or {@code defaultValue} when absent or empty.
     */
    public String positionalOr(int index, String defaultValue) {
        String value = positional(index);
        return value == null || value.isEmpty() ? defaultValue : value;
    }

    /**
     * First non-null of the positional value and the named value.
     */
    public String positionalOrNamed(int index, String name) {
        String value = positional(index);
        return value != null ? value : values.get(name);
    }

    public void addPositional(String value) {
        addPositional(value, null);
    }

    /**
     * @param span source range the value was read from; null when it was empty
     */
    public void addPositional(String value, TextSpan span) {
        if (span != null) {
            positionalSpans.put(positionalCount, span);
        }
        values.put(positionKey(positionalCount), value);
        positionalCount++;
        values.put(POSITION_COUNT_KEY, Integer.toString(positionalCount));
    }

    /**
     * Source range of the positional value at {@code index}, or null when unknown.
     */
    public TextSpan positionalSpan(int index) {
        return positionalSpans.get(index);
    }

    public void put(String key, String value) {
        values.put(key, value);
    }

    public boolean containsKey(String key) {
        return values.containsKey(key);
    }

    public int positionalCount() {
        return positionalCount;
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public Map<String, String> asMap() {
        return Collections.unmodifiableMap(values);
    }

    @Override
    public String toString() {
        return values.toString();
    }
}

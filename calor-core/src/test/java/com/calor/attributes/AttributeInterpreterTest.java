package com.calor.attributes;

import com.calor.ast.ComplexityClass;
import com.calor.ast.IssuePriority;
import com.calor.ast.Visibility;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class AttributeInterpreterTest {

    private static AttributeCollection attrs(String... positional) {
        AttributeCollection attrs = new AttributeCollection();
        for (String value : positional) {
            attrs.addPositional(value);
        }
        return attrs;
    }

    @Test
    @DisplayName("i32 and int expand to the same descriptor")
    void testIntAliases() {
        assertEquals("INT", AttributeInterpreter.expandType("i32"));
        assertEquals(AttributeInterpreter.expandType("i32"), AttributeInterpreter.expandType("int"));
    }

    @Test
    @DisplayName("Option and result forms wrap the expanded inner types")
    void testOptionAndResult() {
        assertEquals("OPTION[inner=INT]", AttributeInterpreter.expandType("?i32"));
        assertEquals("RESULT[ok=INT][err=STRING]", AttributeInterpreter.expandType("i32!str"));
        assertEquals("RESULT[ok=BOOL][err=STRING]", AttributeInterpreter.expandType("bool!"));
    }

    @Test
    @DisplayName("Unknown and already expanded types pass through")
    void testPassThrough() {
        assertEquals("Foo", AttributeInterpreter.expandType("Foo"));
        assertEquals("INT", AttributeInterpreter.expandType(AttributeInterpreter.expandType("int")));
        assertEquals("INT[bits=64][signed=true]", AttributeInterpreter.expandType("i64"));
        assertEquals("", AttributeInterpreter.expandType(""));
        assertNull(AttributeInterpreter.expandType(null));
    }

    @Test
    @DisplayName("Function header reads id, name and visibility")
    void testFunctionHeader() {
        AttributeInterpreter.FunctionHeader header = AttributeInterpreter.interpretFunction(attrs("f1", "Add", "pub"));
        assertEquals("f1", header.id());
        assertEquals("Add", header.name());
        assertEquals(Visibility.PUBLIC, header.visibility());

        assertEquals(Visibility.PRIVATE, AttributeInterpreter.interpretFunction(attrs("f2", "Sub")).visibility());
    }

    @Test
    @DisplayName("Input attributes expand type and semantic shortcode")
    void testInput() {
        AttributeInterpreter.InputSpec input = AttributeInterpreter.interpretInput(attrs("str", "path", "#path"));
        assertEquals("STRING", input.type());
        assertEquals("path", input.name());
        assertEquals("file path", input.semantic());
    }

    @Test
    @DisplayName("Bind marks a tilde name as mutable")
    void testBind() {
        AttributeInterpreter.BindSpec bind = AttributeInterpreter.interpretBind(attrs("~count", "i32"));
        assertEquals("count", bind.name());
        assertTrue(bind.mutable());
        assertEquals("INT", bind.typeName());

        assertFalse(AttributeInterpreter.interpretBind(attrs("total")).mutable());
    }

    @Test
    @DisplayName("Fallible call target drops the bang")
    void testCallTarget() {
        AttributeInterpreter.CallTarget call = AttributeInterpreter.interpretCall(attrs("File.Read!"));
        assertEquals("File.Read", call.target());
        assertTrue(call.fallible());
    }

    @Test
    @DisplayName("For loop step defaults to one")
    void testForDefaults() {
        AttributeInterpreter.ForSpec spec = AttributeInterpreter.interpretFor(attrs("l1", "i", "0", "10"));
        assertEquals("1", spec.step());
        assertEquals("10", spec.to());
    }

    @Test
    @DisplayName("Effect codes group by category")
    void testEffects() {
        Map<String, String> effects = AttributeInterpreter.interpretEffects(attrs("cw", "fr", "rand"));
        assertEquals("console_write,file_read", effects.get("io"));
        assertEquals("random", effects.get("nondeterminism"));
    }

    @Test
    @DisplayName("Dependencies split optional markers and versions")
    void testDependencies() {
        AttributeInterpreter.DependencyList list = AttributeInterpreter.interpretDependencies(
            List.of("Parser.parse", "Cache.get?", "Json@2.1", "*"));

        assertTrue(list.unknownCallers());
        assertEquals(3, list.dependencies().size());
        assertTrue(list.dependencies().get(1).optional());
        assertEquals("Cache.get", list.dependencies().get(1).target());
        assertEquals("Json", list.dependencies().get(2).target());
        assertEquals("2.1", list.dependencies().get(2).version());
        assertNull(list.dependencies().get(0).version());
    }

    @Test
    @DisplayName("A leading @ is not a version separator")
    void testLeadingAt() {
        AttributeInterpreter.DependencyList list = AttributeInterpreter.interpretDependencies(List.of("@scope"));
        assertEquals("@scope", list.dependencies().get(0).target());
        assertNull(list.dependencies().get(0).version());
    }

    @Test
    @DisplayName("Complexity notation is normalized")
    void testComplexity() {
        assertEquals(ComplexityClass.O_N_LOG_N, AttributeInterpreter.parseComplexityClass("O(n log n)"));
        assertEquals(ComplexityClass.O1, AttributeInterpreter.parseComplexityClass("o(1)"));
        assertNull(AttributeInterpreter.parseComplexityClass("fast"));
    }

    @Test
    @DisplayName("Issue priority defaults to medium")
    void testIssuePriority() {
        assertEquals(IssuePriority.MEDIUM, AttributeInterpreter.parseIssuePriority(null));
        assertEquals(IssuePriority.CRITICAL, AttributeInterpreter.parseIssuePriority("crit"));
    }

    @Test
    @DisplayName("Date-time accepts a bare date")
    void testDateTime() {
        assertEquals(LocalDateTime.of(2024, 3, 1, 0, 0), AttributeInterpreter.parseDateTime("2024-03-01"));
        assertEquals(LocalDateTime.of(2024, 3, 1, 12, 30), AttributeInterpreter.parseDateTime("2024-03-01T12:30"));
        assertNull(AttributeInterpreter.parseDateTime("soon"));
    }

    @Test
    @DisplayName("Positions keep counting across brace groups")
    void testPositionsAcrossGroups() {
        AttributeCollection attrs = attrs("a", "b");
        attrs.addPositional("c");
        assertEquals("c", attrs.positional(2));
        assertEquals(3, attrs.positionalCount());
        assertEquals("3", attrs.get(AttributeCollection.POSITION_COUNT_KEY));
    }
}

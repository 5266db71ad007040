package com.calor;

import com.calor.ast.*;
import com.calor.diagnostics.Diagnostic;
import com.calor.diagnostics.DiagnosticCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Classes, interfaces, enums and enum extensions.
 */
public class ParserDeclarationTest {

    private static ParseResult parse(String... lines) {
        return Parser.parseSource("§M{m1:Decls}\n" + String.join("\n", lines) + "\n§/M{m1}");
    }

    private static List<String> codes(ParseResult result) {
        return result.diagnostics().getDiagnostics().stream().map(Diagnostic::code).collect(Collectors.toList());
    }

    private static ClassDefinition onlyClass(ParseResult result) {
        assertEquals(1, result.program().classes().size());
        return result.program().classes().get(0);
    }

    @Test
    @DisplayName("Class with base, field, property and method")
    void testClassMembers() {
        ParseResult result = parse(
            "§CL{c1:Dog:Animal:pub}",
            "  §FLD{i32:age}",
            "  §PROP{p1:Name:str}",
            "    §GET",
            "    §SET",
            "  §/PROP{p1}",
            "  §MT{mt1:Speak:pub:over}",
            "    §O{str}",
            "    §R \"woof\"",
            "  §/MT{mt1}",
            "§/CL{c1}");

        assertTrue(result.diagnostics().isEmpty(), () -> codes(result).toString());
        ClassDefinition dog = onlyClass(result);
        assertEquals("Dog", dog.name());
        assertEquals("Animal", dog.baseClass());

        assertEquals(1, dog.fields().size());
        FieldDefinition age = dog.fields().get(0);
        assertEquals("age", age.name());
        assertEquals(Visibility.PRIVATE, age.visibility());

        PropertyDefinition name = dog.properties().get(0);
        assertEquals("Name", name.name());
        assertEquals(Visibility.PUBLIC, name.visibility());
        assertNotNull(name.getter());
        assertNotNull(name.setter());
        assertNull(name.initer());

        MethodDefinition speak = dog.methods().get(0);
        assertEquals("Speak", speak.name());
        assertEquals(Visibility.PUBLIC, speak.visibility());
        assertEquals(List.of(MemberModifier.OVERRIDE), speak.modifiers());
        assertEquals("STRING", speak.output().typeName());
        assertEquals(1, speak.body().size());
    }

    @Test
    @DisplayName("Four positions: a visibility keyword in position 2 is dropped")
    void testFourPositionHeaderWithVisibility() {
        ClassDefinition shape = onlyClass(parse("§CL{c1:Shape:pub:abs}", "§/CL{c1}"));
        assertNull(shape.baseClass());
        assertTrue(shape.abstractClass());
    }

    @Test
    @DisplayName("Three positions: modifier words are read as modifiers")
    void testThreePositionModifiers() {
        ClassDefinition util = onlyClass(parse("§CL{c1:Util:stat,partial}", "§/CL{c1}"));
        assertNull(util.baseClass());
        assertTrue(util.staticClass());
        assertTrue(util.partial());
    }

    @Test
    @DisplayName("Three positions: anything else is a base class")
    void testThreePositionBaseClass() {
        ClassDefinition dog = onlyClass(parse("§CL{c1:Dog:Animal}", "§/CL{c1}"));
        assertEquals("Animal", dog.baseClass());
        assertFalse(dog.abstractClass());
    }

    /**
     * Known ambiguity: in the three-position header a base class whose name is also a
     * modifier keyword cannot be told apart from a modifier list. The keyword reading wins.
     * This pins the current behavior; it is not a statement of the desired one.
     */
    @Test
    @DisplayName("KNOWN AMBIGUITY: base class named like a modifier is read as a modifier")
    void testBaseClassNamedLikeModifierIsMisread() {
        ParseResult result = parse("§CL{c1:Widget:sealed}", "§/CL{c1}");

        assertTrue(result.diagnostics().isEmpty());
        ClassDefinition widget = onlyClass(result);
        assertNull(widget.baseClass(), "a base class literally named 'sealed' is not recoverable here");
        assertTrue(widget.sealedClass());
    }

    @Test
    @DisplayName("Abstract struct: flag dropped and reported, parsing continues")
    void testAbstractStruct() {
        ParseResult result = parse("§CL{c1:Point:struct,abs}", "§FLD{i32:x}", "§/CL{c1}");

        assertEquals(List.of(DiagnosticCode.INVALID_MODIFIER), codes(result));
        ClassDefinition point = onlyClass(result);
        assertTrue(point.struct());
        assertFalse(point.abstractClass());
        assertEquals(1, point.fields().size());
    }

    @Test
    @DisplayName("Generic class with a where clause")
    void testWhereClause() {
        ParseResult result = parse(
            "§CL{c1:Box}<T>",
            "  §WHERE T : class, IComparable<T>",
            "§/CL{c1}");

        assertTrue(result.diagnostics().isEmpty(), () -> codes(result).toString());
        TypeParameter t = onlyClass(result).typeParameters().get(0);
        assertEquals("T", t.name());
        assertEquals(2, t.constraints().size());
        assertEquals(TypeConstraintKind.CLASS, t.constraints().get(0).kind());
        assertEquals(TypeConstraintKind.TYPE_NAME, t.constraints().get(1).kind());
        assertEquals("IComparable<T>", t.constraints().get(1).typeName());
    }

    @Test
    @DisplayName("Where clause naming an undeclared type parameter")
    void testWhereClauseUnknownParameter() {
        ParseResult result = parse("§CL{c1:Box}<T>", "  §WHERE U : class", "§/CL{c1}");
        assertEquals(List.of(DiagnosticCode.TYPE_PARAMETER_NOT_FOUND), codes(result));
        assertTrue(onlyClass(result).typeParameters().get(0).constraints().isEmpty());
    }

    @Test
    @DisplayName("Class close id mismatch keeps the open id")
    void testClassIdMismatch() {
        ParseResult result = parse("§CL{c1:Dog}", "§/CL{c9}");
        assertEquals(List.of(DiagnosticCode.MISMATCHED_ID), codes(result));
        assertEquals("c1", onlyClass(result).id());
    }

    @Test
    @DisplayName("Interface with base interface and method signatures")
    void testInterface() {
        ParseResult result = parse(
            "§IFACE{i1:IShape}",
            "  §EXT{IDrawable}",
            "  §MT{m1:Area}",
            "    §O{f64}",
            "  §/MT{m1}",
            "§/IFACE{i1}");

        assertTrue(result.diagnostics().isEmpty(), () -> codes(result).toString());
        InterfaceDefinition shape = result.program().interfaces().get(0);
        assertEquals("IShape", shape.name());
        assertEquals(List.of("IDrawable"), shape.baseInterfaces());
        assertEquals("Area", shape.methods().get(0).name());
        assertEquals("FLOAT", shape.methods().get(0).output().typeName());
    }

    @Test
    @DisplayName("Enum members with and without explicit values")
    void testEnum() {
        ParseResult result = parse(
            "§EN{e1:Color:u8}",
            "  Red",
            "  Green = 2",
            "  Blue = -1",
            "§/EN{e1}");

        assertTrue(result.diagnostics().isEmpty(), () -> codes(result).toString());
        EnumDefinition color = result.program().enums().get(0);
        assertEquals("Color", color.name());
        assertEquals("u8", color.underlyingType());
        assertEquals(List.of("Red", "Green", "Blue"),
            color.members().stream().map(EnumMember::name).collect(Collectors.toList()));
        assertNull(color.members().get(0).value());
        assertEquals("2", color.members().get(1).value());
        assertEquals("-1", color.members().get(2).value());
    }

    @Test
    @DisplayName("Enum extension methods take the enum as a parameter")
    void testEnumExtension() {
        ParseResult result = parse(
            "§EEXT{x1:Color}",
            "  §F{f1:IsWarm:pub}",
            "    §I{Color:self}",
            "    §O{bool}",
            "    §R (== self Red)",
            "  §/F{f1}",
            "§/EEXT{x1}");

        assertTrue(result.diagnostics().isEmpty(), () -> codes(result).toString());
        EnumExtension extension = result.program().enumExtensions().get(0);
        assertEquals("Color", extension.enumName());
        assertEquals("IsWarm", extension.methods().get(0).name());
    }

    @Test
    @DisplayName("Enum extension method without a self parameter")
    void testEnumExtensionMissingSelf() {
        ParseResult result = parse(
            "§EEXT{x1:Color}",
            "  §F{f1:Count:pub}",
            "    §O{i32}",
            "    §R 3",
            "  §/F{f1}",
            "§/EEXT{x1}");

        assertEquals(List.of(DiagnosticCode.MISSING_EXTENSION_SELF), codes(result));
        Diagnostic diagnostic = result.diagnostics().getDiagnostics().get(0);
        assertEquals("Calor0204", diagnostic.code());
        assertTrue(diagnostic.message().contains("Count"));
        assertTrue(diagnostic.message().contains("Color"));
    }

    @Test
    @DisplayName("Using directives: plain, aliased and static")
    void testUsings() {
        ParseResult result = parse(
            "§U{System.Text}",
            "§U{Json:Newtonsoft.Json}",
            "§U{static:System.Math}");

        assertTrue(result.diagnostics().isEmpty(), () -> codes(result).toString());
        List<UsingDirective> usings = result.program().usings();
        assertEquals("System.Text", usings.get(0).namespace());
        assertEquals("Json", usings.get(1).alias());
        assertEquals("Newtonsoft.Json", usings.get(1).namespace());
        assertTrue(usings.get(2).staticImport());
        assertEquals("System.Math", usings.get(2).namespace());
    }
}

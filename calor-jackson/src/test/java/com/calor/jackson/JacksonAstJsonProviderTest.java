package com.calor.jackson;

import com.calor.Parser;
import com.calor.ast.*;
import com.calor.json.AstJsonException;
import com.calor.json.AstJsonProvider;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class JacksonAstJsonProviderTest {

    private static final String SOURCE = String.join("\n",
        "§M{m1:Shapes}",
        "§EN{e1:Color}",
        "  Red",
        "  Green = 2",
        "§/EN{e1}",
        "§CL{c1:Circle}",
        "  §FLD{f64:radius:priv}",
        "§/CL{c1}",
        "§F{f1:Add:pub}",
        "  §I{i32:a}",
        "  §I{i32:b}",
        "  §O{i32}",
        "  §R (+ a b)",
        "§/F{f1}",
        "§F{f2:Price:pub}",
        "  §O{dec}",
        "  §R 19.99m",
        "§/F{f2}",
        "§/M{m1}");

    private static Program parse() {
        return Parser.parseOrThrow(SOURCE);
    }

    @Test
    @DisplayName("Provider is discoverable through the service loader")
    void testServiceLoader() {
        assertTrue(AstJsonProvider.isProviderAvailable());
        AstJsonProvider provider = AstJsonProvider.getProvider("jackson");
        assertEquals("Jackson", provider.getName());
        assertInstanceOf(JacksonAstJsonProvider.class, AstJsonProvider.getProvider());
    }

    @Test
    @DisplayName("Unknown provider name is rejected")
    void testUnknownProvider() {
        assertThrows(IllegalStateException.class, () -> AstJsonProvider.getProvider("gson"));
    }

    @Test
    @DisplayName("Program survives a serialize/deserialize round trip")
    void testRoundTrip() {
        Program program = parse();
        AstJsonProvider provider = new JacksonAstJsonProvider();

        String json = provider.getSerializer().serialize(program);
        Program copy = provider.getDeserializer().deserializeProgram(json);

        assertEquals(program, copy);
    }

    @Test
    @DisplayName("Node kinds are written as a type property")
    void testTypeProperty() throws Exception {
        JacksonAstJsonProvider provider = new JacksonAstJsonProvider();
        ObjectMapper mapper = provider.getObjectMapper();
        JsonNode tree = mapper.readTree(provider.getSerializer().serialize(parse()));

        assertEquals("Program", tree.get("type").asText());
        assertEquals("m1", tree.get("id").asText());
        assertEquals("FunctionDefinition", tree.get("functions").get(0).get("type").asText());
        assertEquals("EnumDefinition", tree.get("enums").get(0).get("type").asText());

        JsonNode returned = tree.get("functions").get(0).get("body").get(0);
        assertEquals("ReturnStatement", returned.get("type").asText());
        assertEquals("BinaryOperation", returned.get("expression").get("type").asText());
    }

    @Test
    @DisplayName("Decimal literals are written as strings")
    void testDecimalAsString() throws Exception {
        JacksonAstJsonProvider provider = new JacksonAstJsonProvider();
        JsonNode tree = provider.getObjectMapper().readTree(provider.getSerializer().serialize(parse()));

        JsonNode literal = tree.get("functions").get(1).get("body").get(0).get("expression");
        assertEquals("DecimalLiteral", literal.get("type").asText());
        assertTrue(literal.get("value").isTextual());
        assertEquals("19.99", literal.get("value").asText());
    }

    @Test
    @DisplayName("Single expressions can be read back by their declared type")
    void testExpressionRoundTrip() {
        Program program = parse();
        Expression expression = ((ReturnStatement) program.functions().get(0).body().get(0)).expression();
        AstJsonProvider provider = new JacksonAstJsonProvider();

        String json = provider.getSerializer().serializePretty(expression);
        assertEquals(expression, provider.getDeserializer().deserialize(json, Expression.class));
    }

    @Test
    @DisplayName("Malformed JSON raises AstJsonException")
    void testMalformedJson() {
        AstJsonProvider provider = new JacksonAstJsonProvider();
        assertThrows(AstJsonException.class, () -> provider.getDeserializer().deserializeProgram("{\"type\":"));
    }

    @Test
    @DisplayName("Every concrete node record is registered")
    void testNodeTypes() {
        assertTrue(AstModule.nodeTypes().contains(IntLiteral.class));
        assertTrue(AstModule.nodeTypes().contains(Program.class));
        assertTrue(AstModule.nodeTypes().contains(WildcardPattern.class));
        assertFalse(AstModule.nodeTypes().contains(Expression.class));
    }
}

package com.calor.json;

import com.calor.ast.Node;
import com.calor.ast.Program;

/**
 * Reads Calor tree nodes back from the JSON written by an {@link AstJsonSerializer}.
 */
public interface AstJsonDeserializer {

    /**
     * @throws AstJsonException if the text is not a serialized module
     */
    Program deserializeProgram(String json);

    /**
     * Reads a node of the given kind. {@code type} may be an interface such as
     * {@code Expression}; the {@code "type"} property picks the concrete node.
     *
     * @throws AstJsonException if the text does not describe a {@code type}
     */
    <T extends Node> T deserialize(String json, Class<T> type);
}

package com.calor.json;

import com.calor.ast.Node;

/**
 * Writes Calor tree nodes as JSON. Every node object carries a {@code "type"} property
 * naming its node kind.
 */
public interface AstJsonSerializer {

    /**
     * @throws AstJsonException if the node cannot be written
     */
    String serialize(Node node);

    /**
     * Same as {@link #serialize(Node)} with indentation.
     */
    String serializePretty(Node node);
}

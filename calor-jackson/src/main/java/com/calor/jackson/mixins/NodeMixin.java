package com.calor.jackson.mixins;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Polymorphic type handling for tree nodes. The node kind is written as a {@code "type"}
 * property holding the record's simple name; {@link com.calor.jackson.AstModule} registers
 * every concrete node under that name.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
public abstract class NodeMixin {

    // Written by the type id, not as a regular property
    @JsonIgnore
    abstract String type();
}

package com.calor.ast;

/**
 * What {@code §HAS} tests: a list/set element, a dictionary key, or a dictionary value.
 */
public enum ContainsMode {
    VALUE,
    KEY,
    DICT_VALUE
}

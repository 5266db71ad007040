package com.calor.ast;

/**
 * Big-O classes accepted by {@code §CX}.
 */
public enum ComplexityClass {
    O1("O(1)"),
    O_LOG_N("O(log n)"),
    O_N("O(n)"),
    O_N_LOG_N("O(n log n)"),
    O_N2("O(n^2)"),
    O_N3("O(n^3)"),
    O_2N("O(2^n)"),
    O_N_FACT("O(n!)");

    private final String notation;

    ComplexityClass(String notation) {
        this.notation = notation;
    }

    public String notation() {
        return notation;
    }
}

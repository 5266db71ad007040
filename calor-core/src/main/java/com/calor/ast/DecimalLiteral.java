package com.calor.ast;

import java.math.BigDecimal;

public record DecimalLiteral(
    TextSpan span,
    BigDecimal value
) implements Expression {

    @Override
    public String type() {
        return "DecimalLiteral";
    }
}

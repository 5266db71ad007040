package com.calor.ast;

import java.time.LocalDate;
import java.util.List;

public record Decision(
    TextSpan span,
    String id,
    String title,
    String chosen,
    List<String> chosenReasons,
    List<RejectedOption> rejected,
    String context,  // Can be null
    LocalDate date,  // Can be null
    String author  // Can be null
) implements Node {

    @Override
    public String type() {
        return "Decision";
    }
}

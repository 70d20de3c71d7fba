package com.example.guestcode.model;

import java.util.List;

public record RunOutcome(boolean hadError, List<String> summaryLines) {

    public RunOutcome {
        summaryLines = summaryLines == null ? List.of() : List.copyOf(summaryLines);
    }

    /** Report body: one paragraph per summary line. */
    public String body() {
        return String.join("\n\n", summaryLines);
    }
}

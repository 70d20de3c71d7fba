package com.example.guestcode.model;

import java.util.List;

/**
 * What reconciling one unit did. One message per externally visible step:
 * the code creation (if any) and the window action or no-op.
 */
public record ReconcileOutcome(ReconcileAction action, boolean created, List<String> messages) {

    public ReconcileOutcome {
        messages = messages == null ? List.of() : List.copyOf(messages);
    }
}

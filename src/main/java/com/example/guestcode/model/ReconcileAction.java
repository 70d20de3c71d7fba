package com.example.guestcode.model;

public enum ReconcileAction {
    UPDATED(true),
    CLEARED(true),
    ALREADY_CORRECT(false),
    ALREADY_DISABLED(false);

    private final boolean write;

    ReconcileAction(boolean write) {
        this.write = write;
    }

    public boolean isWrite() {
        return write;
    }
}

package com.github.salilvnair.convflow.engine.journal;

public enum JournalEventType {

    NODE_TRIGGERED("node_triggered"),
    RESPONSE("response"),
    DIGRESSION_FROM("digression_from"),
    SLOT_FILLING("slot_filling"),
    FOUND("found"),
    NOT_FOUND("not_found"),
    PROMPT("prompt"),
    SLOT_HANDLER("slot_handler"),
    ASSIGN("assign"),
    DELETE("delete"),
    LOG("log");

    private final String value;

    JournalEventType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}

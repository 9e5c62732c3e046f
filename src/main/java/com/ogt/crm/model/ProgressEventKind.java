package com.ogt.crm.model;

public enum ProgressEventKind {
    CONNECTED("connected"),
    PROGRESS("progress"),
    SHEET_STARTED("sheet-started"),
    SHEET_COMPLETED("sheet-completed"),
    PING("ping"),
    ERROR("error"),
    DONE("done");

    private final String eventName;

    ProgressEventKind(String eventName) {
        this.eventName = eventName;
    }

    // Nombre del evento SSE
    public String getEventName() {
        return eventName;
    }
}

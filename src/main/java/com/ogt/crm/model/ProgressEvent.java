package com.ogt.crm.model;

import lombok.Value;

import java.time.Instant;
import java.util.Map;

@Value
public class ProgressEvent {
    ProgressEventKind kind;
    Object payload;
    Instant timestamp;

    public static ProgressEvent of(ProgressEventKind kind, Object payload) {
        return new ProgressEvent(kind, payload != null ? payload : Map.of(), Instant.now());
    }
}

package com.ogt.crm.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Nivel de confianza de una sugerencia. El orden de declaración es el orden de presentación (HIGH primero).
 */
public enum ConfidenceTier {
    HIGH,
    MEDIUM,
    LOW;

    @JsonValue
    public String toJson() {
        return name().toLowerCase();
    }
}

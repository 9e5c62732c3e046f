package com.ogt.crm.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ColumnDataType {
    STRING,
    NUMBER,
    DATE,
    EMAIL,
    PHONE,
    UNKNOWN;

    @JsonValue
    public String toJson() {
        return name().toLowerCase();
    }
}

package com.ogt.crm.model;

import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Una fila ya transformada: campo destino → valor normalizado (String, BigDecimal o LocalDate).
 */
@Getter
@ToString
public class EntityRecord {

    private final TargetEntity entity;
    private final int sourceRow;
    private final Map<String, Object> values;

    public EntityRecord(TargetEntity entity, int sourceRow, Map<String, Object> values) {
        this.entity = entity;
        this.sourceRow = sourceRow;
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public boolean has(String field) {
        return values.get(field) != null;
    }

    public String getString(String field) {
        Object value = values.get(field);
        return value != null ? value.toString() : null;
    }

    public BigDecimal getDecimal(String field) {
        Object value = values.get(field);
        return value instanceof BigDecimal d ? d : null;
    }

    public LocalDate getDate(String field) {
        Object value = values.get(field);
        return value instanceof LocalDate d ? d : null;
    }
}

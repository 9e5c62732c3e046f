package com.ogt.crm.model;

/**
 * Cómo se normaliza el valor de una celda antes de escribirlo en el campo destino.
 */
public enum FieldType {
    TEXT,
    UPPER_TEXT,
    PRIORITY,
    PHONE,
    EMAIL,
    ZIP,
    DATE,
    NUMBER,
    PERCENT,
    STAGE,
    OPPORTUNITY_STATUS,
    INTERACTION_TYPE
}

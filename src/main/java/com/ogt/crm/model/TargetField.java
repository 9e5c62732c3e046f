package com.ogt.crm.model;

import lombok.Value;

import java.util.List;

@Value
public class TargetField {
    String name;
    List<String> keywords;
    int priority; // 1 = más fuerte
    boolean required;
    FieldType type;

    public static TargetField of(String name, FieldType type, int priority, String... keywords) {
        return new TargetField(name, List.of(keywords), priority, false, type);
    }

    public static TargetField required(String name, FieldType type, int priority, String... keywords) {
        return new TargetField(name, List.of(keywords), priority, true, type);
    }
}

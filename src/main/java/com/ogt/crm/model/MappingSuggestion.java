package com.ogt.crm.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class MappingSuggestion {
    int columnIndex;
    String sourceColumn;
    String targetField;
    ConfidenceTier confidence;
    String reason; // Exact match, Contains keyword, Partial match
}

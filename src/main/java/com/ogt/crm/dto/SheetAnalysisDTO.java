package com.ogt.crm.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.ogt.crm.model.MappingSuggestion;
import com.ogt.crm.model.SheetAnalysis;
import com.ogt.crm.model.TargetEntity;
import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SheetAnalysisDTO {
    private SheetAnalysis analysis;
    private TargetEntity targetEntity;            // null si la hoja no corresponde a ninguna entidad
    private List<MappingSuggestion> suggestions;
}

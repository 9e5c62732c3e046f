package com.ogt.crm.dto;

import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class WorkbookAnalysisDTO {
    private String fileName;
    private int sheetCount;
    private List<SheetAnalysisDTO> sheets;
}

package com.ogt.crm.controller;

import com.ogt.crm.config.OpenApiConfig;
import com.ogt.crm.dto.WorkbookAnalysisDTO;
import com.ogt.crm.service.WorkbookAnalysisService;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

@RestController
@RequestMapping("/api/migration/analysis")
@RequiredArgsConstructor
@Tag(name = OpenApiConfig.TAG_ANALYSIS)
public class WorkbookAnalysisController {

    private final WorkbookAnalysisService analysisService;

    // Planilla configurada en crm.migration.workbook-path
    @GetMapping
    public ResponseEntity<WorkbookAnalysisDTO> analyzeConfigured() {
        return ResponseEntity.ok(analysisService.analyzeConfiguredWorkbook());
    }

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<WorkbookAnalysisDTO> analyzeUpload(@RequestParam("file") MultipartFile file) {
        return ResponseEntity.ok(analysisService.analyzeUpload(file));
    }
}

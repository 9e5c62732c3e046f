package com.ogt.crm.service;

import com.ogt.crm.config.MigrationProperties;
import com.ogt.crm.dto.SheetAnalysisDTO;
import com.ogt.crm.dto.WorkbookAnalysisDTO;
import com.ogt.crm.exception.BusinessException;
import com.ogt.crm.exception.WorkbookReadException;
import com.ogt.crm.model.SheetAnalysis;
import com.ogt.crm.model.SheetMatrix;
import com.ogt.crm.model.TargetEntity;
import com.ogt.crm.model.WorkbookData;
import com.ogt.crm.reader.WorkbookReader;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Vista previa de la migración: encabezados, perfiles y sugerencias de mapeo por hoja. No escribe nada.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WorkbookAnalysisService {

    private final WorkbookReader reader;
    private final WorkbookAnalyzer analyzer;
    private final MappingAdvisor advisor;
    private final MigrationProperties properties;

    public WorkbookAnalysisDTO analyzeConfiguredWorkbook() {
        return analyze(reader.read(Path.of(properties.getWorkbookPath())));
    }

    public WorkbookAnalysisDTO analyzeUpload(MultipartFile file) {
        if (file == null || file.isEmpty()) throw new BusinessException("Empty file");

        String name = file.getOriginalFilename() != null ? file.getOriginalFilename() : "upload.xlsx";
        try (InputStream input = file.getInputStream()) {
            return analyze(reader.read(input, name));
        } catch (IOException e) {
            throw new WorkbookReadException("Could not read uploaded workbook " + name, e);
        }
    }

    WorkbookAnalysisDTO analyze(WorkbookData workbook) {
        log.info("🔍 Analizando planilla '{}' ({} hojas)", workbook.getFileName(), workbook.getSheets().size());

        List<SheetAnalysisDTO> sheets = new ArrayList<>();
        for (SheetMatrix sheet : workbook.getSheets()) {
            SheetAnalysis analysis = analyzer.analyze(sheet);
            Optional<TargetEntity> entity = TargetEntity.forSheet(sheet.getName());

            sheets.add(SheetAnalysisDTO.builder()
                    .analysis(analysis)
                    .targetEntity(entity.orElse(null))
                    .suggestions(entity.map(e -> advisor.suggest(analysis, e)).orElse(List.of()))
                    .build());
        }

        return WorkbookAnalysisDTO.builder()
                .fileName(workbook.getFileName())
                .sheetCount(sheets.size())
                .sheets(sheets)
                .build();
    }
}

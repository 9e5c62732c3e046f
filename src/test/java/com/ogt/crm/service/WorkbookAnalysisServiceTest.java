package com.ogt.crm.service;

import com.ogt.crm.config.MigrationProperties;
import com.ogt.crm.dto.SheetAnalysisDTO;
import com.ogt.crm.dto.WorkbookAnalysisDTO;
import com.ogt.crm.exception.BusinessException;
import com.ogt.crm.model.TargetEntity;
import com.ogt.crm.model.WorkbookData;
import com.ogt.crm.reader.WorkbookReader;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockMultipartFile;

import java.io.InputStream;
import java.nio.file.Path;
import java.util.List;

import static com.ogt.crm.TestSheets.r;
import static com.ogt.crm.TestSheets.sheet;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class WorkbookAnalysisServiceTest {

    private final MigrationProperties properties = new MigrationProperties();
    private final WorkbookReader reader = mock(WorkbookReader.class);
    private final TargetFieldCatalog catalog = new TargetFieldCatalog();
    private final WorkbookAnalysisService service = new WorkbookAnalysisService(
            reader, new WorkbookAnalyzer(properties), new MappingAdvisor(catalog), properties);

    private final WorkbookData workbook = new WorkbookData("CRM-WORKBOOK.xlsx", List.of(
            sheet("Organizations",
                    r("Organization Name", "Priority", "Segment"),
                    r("Acme Foods", "A", "Restaurant")),
            sheet("Instructions",
                    r("Fill one row per customer, one tab per entity"))));

    @Test
    void configuredWorkbookIsAnalyzedPerSheet() {
        when(reader.read(Path.of(properties.getWorkbookPath()))).thenReturn(workbook);

        WorkbookAnalysisDTO analysis = service.analyzeConfiguredWorkbook();

        assertThat(analysis.getFileName()).isEqualTo("CRM-WORKBOOK.xlsx");
        assertThat(analysis.getSheetCount()).isEqualTo(2);

        SheetAnalysisDTO organizations = analysis.getSheets().get(0);
        assertThat(organizations.getTargetEntity()).isEqualTo(TargetEntity.ORGANIZATIONS);
        assertThat(organizations.getSuggestions()).extracting("targetField")
                .containsExactlyInAnyOrder("name", "priority", "segment");

        SheetAnalysisDTO instructions = analysis.getSheets().get(1);
        assertThat(instructions.getTargetEntity()).isNull();
        assertThat(instructions.getSuggestions()).isEmpty();
    }

    @Test
    void uploadedWorkbookIsReadFromTheRequest() {
        when(reader.read(any(InputStream.class), eq("legacy.xlsx"))).thenReturn(workbook);

        WorkbookAnalysisDTO analysis = service.analyzeUpload(
                new MockMultipartFile("file", "legacy.xlsx", "application/octet-stream", new byte[]{1, 2, 3}));

        assertThat(analysis.getSheets()).hasSize(2);
    }

    @Test
    void emptyUploadIsRejected() {
        assertThatThrownBy(() -> service.analyzeUpload(
                new MockMultipartFile("file", "legacy.xlsx", "application/octet-stream", new byte[0])))
                .isInstanceOf(BusinessException.class);
    }
}

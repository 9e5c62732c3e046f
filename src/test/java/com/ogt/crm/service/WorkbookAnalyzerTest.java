package com.ogt.crm.service;

import com.ogt.crm.config.MigrationProperties;
import com.ogt.crm.model.CellValue;
import com.ogt.crm.model.ColumnDataType;
import com.ogt.crm.model.ColumnProfile;
import com.ogt.crm.model.SheetAnalysis;
import com.ogt.crm.model.SheetMatrix;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static com.ogt.crm.TestSheets.r;
import static com.ogt.crm.TestSheets.sheet;
import static org.assertj.core.api.Assertions.assertThat;

class WorkbookAnalyzerTest {

    private final WorkbookAnalyzer analyzer = new WorkbookAnalyzer(new MigrationProperties());

    @Test
    void headerBelowTitleBannerIsDetected() {
        SheetMatrix sheet = sheet("Organizations",
                r("Legacy CRM export - Organizations"),
                r("Organization Name", "Priority", "Segment", "Email"),
                r("Acme Foods", "A", "Restaurant", "info@acme.com"),
                r("Bistro 21", "B", "Cafe", "hello@bistro21.com"));

        SheetAnalysis analysis = analyzer.analyze(sheet);

        assertThat(analysis.isSkipped()).isFalse();
        assertThat(analysis.getHeaderRowIndex()).isEqualTo(1);
        assertThat(analysis.getDataStartRow()).isEqualTo(2);
        assertThat(analysis.getDataRows()).isEqualTo(2);
        assertThat(analysis.getHeaders()).containsExactly("Organization Name", "Priority", "Segment", "Email");
    }

    @Test
    void repeatedAnalysisIsIdentical() {
        SheetMatrix sheet = sheet("Organizations",
                r("Report generated 2024-01-01"),
                r(),
                r("Organization", "Contact", "Phone", "City", "State"),
                r("Acme Foods", "Jane Doe", "555-123-4567", "Austin", "TX"));

        SheetAnalysis first = analyzer.analyze(sheet);
        SheetAnalysis second = analyzer.analyze(sheet);

        assertThat(first.getHeaderRowIndex()).isEqualTo(2);
        assertThat(second).isEqualTo(first);
    }

    @Test
    void columnsWithoutSampledValuesAreDropped() {
        List<Object[]> rows = new ArrayList<>();
        rows.add(r("Organization Name", "Priority", "Fax", "Email"));
        for (int i = 0; i < 120; i++) {
            rows.add(r("Org " + i, "A", null, "org" + i + "@example.com"));
        }
        SheetMatrix sheet = sheet("Organizations", rows.toArray(new Object[0][]));

        SheetAnalysis analysis = analyzer.analyze(sheet);

        assertThat(analysis.getHeaders()).contains("Fax");
        assertThat(analysis.getColumnProfiles())
                .extracting(ColumnProfile::getHeader)
                .containsExactly("Organization Name", "Priority", "Email");
        assertThat(analysis.getColumnProfiles()).allMatch(p -> p.getNonEmptyCount() > 0);

        ColumnProfile name = analysis.getColumnProfiles().get(0);
        assertThat(name.getNonEmptyCount()).isEqualTo(100); // solo las primeras 100 filas
        assertThat(name.getSampleValues()).containsExactly("Org 0", "Org 1", "Org 2");
        assertThat(analysis.getColumnProfiles().get(2).getDataType()).isEqualTo(ColumnDataType.EMAIL);
    }

    @Test
    void blankHeaderCellGetsPositionalLabel() {
        SheetMatrix sheet = sheet("Contacts",
                r("Contact Name", "Organization", null, "Email"),
                r("Jane Doe", "Acme Foods", "VIP", "jane@acme.com"));

        SheetAnalysis analysis = analyzer.analyze(sheet);

        assertThat(analysis.getHeaders()).containsExactly("Contact Name", "Organization", "Column3", "Email");
        assertThat(analysis.getColumnProfiles()).extracting(ColumnProfile::getHeader).contains("Column3");
    }

    @Test
    void emptySheetIsSkipped() {
        assertThat(analyzer.analyze(sheet("Interactions")).isSkipped()).isTrue();

        SheetAnalysis blank = analyzer.analyze(sheet("Interactions", r(null, "  "), r()));
        assertThat(blank.isSkipped()).isTrue();
        assertThat(blank.getSkipReason()).isEqualTo("Empty sheet");
        assertThat(blank.getColumnProfiles()).isEmpty();
    }

    @Test
    void knownSheetFallsBackToKeywordRow() {
        SheetMatrix sheet = sheet("Contacts",
                r("CONTACT LIST"),
                r("Contact", "Organization"),
                r("Jane Doe", "Acme Foods"));

        assertThat(analyzer.analyze(sheet).getHeaderRowIndex()).isEqualTo(1);
    }

    @Test
    void unknownSheetWithoutHeaderDefaultsToFirstRow() {
        SheetMatrix sheet = sheet("Notes",
                r("alpha", "beta"),
                r("gamma", "delta"));

        assertThat(analyzer.analyze(sheet).getHeaderRowIndex()).isZero();
    }

    @Test
    void numericOnlyRowIsNotAHeader() {
        SheetMatrix sheet = sheet("Opportunities",
                r(2024, 2025, 2026, 2027, 2028),
                r("Organization", "Opportunity", "Stage", "Status"),
                r("Acme Foods", "Spring menu", "Proposal", "Open"));

        assertThat(analyzer.analyze(sheet).getHeaderRowIndex()).isEqualTo(1);
    }

    @Test
    void typeIsInferredFromFirstSample() {
        assertThat(WorkbookAnalyzer.inferType(CellValue.text("2024-01-05"))).isEqualTo(ColumnDataType.DATE);
        assertThat(WorkbookAnalyzer.inferType(CellValue.text("3/7/24"))).isEqualTo(ColumnDataType.DATE);
        assertThat(WorkbookAnalyzer.inferType(CellValue.text("jane@acme.com"))).isEqualTo(ColumnDataType.EMAIL);
        assertThat(WorkbookAnalyzer.inferType(CellValue.text("+1 555-123-4567"))).isEqualTo(ColumnDataType.PHONE);
        assertThat(WorkbookAnalyzer.inferType(CellValue.text("12.5"))).isEqualTo(ColumnDataType.NUMBER);
        assertThat(WorkbookAnalyzer.inferType(CellValue.text("Acme"))).isEqualTo(ColumnDataType.STRING);
        assertThat(WorkbookAnalyzer.inferType(CellValue.number(42))).isEqualTo(ColumnDataType.NUMBER);
        assertThat(WorkbookAnalyzer.inferType(CellValue.date(LocalDate.of(2024, 1, 5).atStartOfDay())))
                .isEqualTo(ColumnDataType.DATE);
        assertThat(WorkbookAnalyzer.inferType(CellValue.bool(true))).isEqualTo(ColumnDataType.UNKNOWN);
    }
}

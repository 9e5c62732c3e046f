package com.ogt.crm.service;

import com.ogt.crm.config.MigrationProperties;
import com.ogt.crm.model.CellValue;
import com.ogt.crm.model.ColumnDataType;
import com.ogt.crm.model.ColumnProfile;
import com.ogt.crm.model.SheetAnalysis;
import com.ogt.crm.model.SheetMatrix;
import com.ogt.crm.model.TargetEntity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Detecta la fila de encabezados de una hoja irregular (banners, títulos) y perfila sus columnas.
 * Sin estado: el mismo input produce siempre el mismo resultado.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WorkbookAnalyzer {

    static final List<String> HEADER_KEYWORDS = List.of(
            "name", "organization", "contact", "email", "phone", "date",
            "priority", "status", "stage", "type", "manager", "opportunity",
            "interaction", "notes", "address", "city", "state");

    // Fallback de hojas conocidas: filas 1 a 3
    private static final List<String> FALLBACK_KEYWORDS = List.of("organization", "contact", "priority", "email");

    private static final Pattern DATE = Pattern.compile("^(\\d{4}-\\d{2}-\\d{2}|\\d{1,2}/\\d{1,2}/\\d{2,4}).*");
    private static final Pattern EMAIL = Pattern.compile("^[\\w._%+-]+@[\\w.-]+\\.[A-Z]{2,}$", Pattern.CASE_INSENSITIVE);
    private static final Pattern PHONE = Pattern.compile("^\\+?\\d[\\d\\s()-]+$");
    private static final Pattern NUMERIC = Pattern.compile("^-?\\d+(\\.\\d+)?$");
    private static final Pattern DIGITS_ONLY = Pattern.compile("^\\d+$");

    private final MigrationProperties properties;

    public SheetAnalysis analyze(SheetMatrix sheet) {
        if (sheet.getRowCount() == 0 || sheet.isBlank()) {
            log.warn("⚠️ Hoja '{}' vacía, se omite", sheet.getName());
            return SheetAnalysis.skipped(sheet.getName(), "Empty sheet");
        }

        int headerRowIndex = findHeaderRow(sheet);
        int dataStartRow = headerRowIndex + 1;
        List<String> headers = buildHeaders(sheet.row(headerRowIndex));

        List<ColumnProfile> profiles = new ArrayList<>();
        for (int col = 0; col < headers.size(); col++) {
            ColumnProfile profile = profileColumn(sheet, col, headers.get(col), dataStartRow);
            // Solo columnas con datos
            if (profile.getNonEmptyCount() > 0) {
                profiles.add(profile);
            }
        }

        log.debug("Hoja '{}': encabezado en fila {}, {} columnas con datos de {}",
                sheet.getName(), headerRowIndex + 1, profiles.size(), headers.size());

        return SheetAnalysis.builder()
                .name(sheet.getName())
                .skipped(false)
                .headerRowIndex(headerRowIndex)
                .dataStartRow(dataStartRow)
                .totalRows(sheet.getRowCount())
                .headers(List.copyOf(headers))
                .columnProfiles(List.copyOf(profiles))
                .sheet(sheet)
                .build();
    }

    // =================================================================================
    // 🔍 BÚSQUEDA DE ENCABEZADOS
    // =================================================================================

    int findHeaderRow(SheetMatrix sheet) {
        int limit = Math.min(properties.getHeaderScanRows(), sheet.getRowCount());
        for (int i = 0; i < limit; i++) {
            if (looksLikeHeader(sheet.row(i))) {
                return i;
            }
        }

        // Hojas conocidas: el encabezado suele estar en la fila 2 o 3
        if (TargetEntity.forSheet(sheet.getName()).isPresent()) {
            for (int i = 1; i < 4 && i < sheet.getRowCount(); i++) {
                String rowText = joinRow(sheet.row(i));
                if (FALLBACK_KEYWORDS.stream().anyMatch(rowText::contains)) {
                    return i;
                }
            }
        }
        return 0;
    }

    private boolean looksLikeHeader(List<CellValue> row) {
        List<CellValue> nonEmpty = row.stream().filter(c -> !c.isEmpty()).toList();
        if (nonEmpty.size() < 3) return false;

        boolean hasText = nonEmpty.stream().anyMatch(this::isTextual);
        if (!hasText) return false;

        String rowText = joinRow(nonEmpty);
        long keywordMatches = HEADER_KEYWORDS.stream().filter(rowText::contains).count();

        return keywordMatches >= 2 || nonEmpty.size() >= 5;
    }

    private boolean isTextual(CellValue cell) {
        if (!cell.isText()) return false;
        String text = cell.asText();
        return text.length() > 2 && !DIGITS_ONLY.matcher(text).matches();
    }

    private String joinRow(List<CellValue> row) {
        StringBuilder sb = new StringBuilder();
        for (CellValue cell : row) {
            String text = cell.asText();
            if (text == null) continue;
            if (sb.length() > 0) sb.append(' ');
            sb.append(text);
        }
        return sb.toString().toLowerCase(Locale.ROOT);
    }

    private List<String> buildHeaders(List<CellValue> headerRow) {
        List<String> headers = new ArrayList<>(headerRow.size());
        for (int idx = 0; idx < headerRow.size(); idx++) {
            CellValue cell = headerRow.get(idx);
            headers.add(cell.isEmpty() ? "Column" + (idx + 1) : cell.asText().trim());
        }
        return headers;
    }

    // =================================================================================
    // 📊 PERFIL DE COLUMNAS
    // =================================================================================

    private ColumnProfile profileColumn(SheetMatrix sheet, int col, String header, int dataStartRow) {
        int end = Math.min(dataStartRow + properties.getProfileSampleRows(), sheet.getRowCount());
        int nonEmpty = 0;
        CellValue first = null;
        List<String> samples = new ArrayList<>();

        for (int r = dataStartRow; r < end; r++) {
            CellValue cell = sheet.cell(r, col);
            if (cell.isEmpty()) continue;
            nonEmpty++;
            if (first == null) first = cell;
            if (samples.size() < properties.getProfileExampleValues()) {
                samples.add(cell.asText());
            }
        }

        return ColumnProfile.builder()
                .index(col)
                .header(header)
                .dataType(first != null ? inferType(first) : ColumnDataType.UNKNOWN)
                .sampleValues(List.copyOf(samples))
                .nonEmptyCount(nonEmpty)
                .build();
    }

    static ColumnDataType inferType(CellValue sample) {
        CellValue value = sample.resolved();
        switch (value.getType()) {
            case NUMBER:
                return ColumnDataType.NUMBER;
            case DATE:
                return ColumnDataType.DATE;
            case TEXT:
                String text = value.getText().trim();
                if (DATE.matcher(text).matches()) return ColumnDataType.DATE;
                if (EMAIL.matcher(text).matches()) return ColumnDataType.EMAIL;
                if (PHONE.matcher(text).matches()) return ColumnDataType.PHONE;
                if (NUMERIC.matcher(text).matches()) return ColumnDataType.NUMBER;
                return ColumnDataType.STRING;
            default:
                return ColumnDataType.UNKNOWN;
        }
    }
}

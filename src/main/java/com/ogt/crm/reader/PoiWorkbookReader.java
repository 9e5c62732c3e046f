package com.ogt.crm.reader;

import com.ogt.crm.exception.WorkbookReadException;
import com.ogt.crm.model.CellValue;
import com.ogt.crm.model.SheetMatrix;
import com.ogt.crm.model.WorkbookData;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

@Component
@Slf4j
public class PoiWorkbookReader implements WorkbookReader {

    @Override
    public WorkbookData read(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new WorkbookReadException("Workbook not found: " + path, null);
        }
        try (InputStream in = Files.newInputStream(path)) {
            return read(in, path.getFileName().toString());
        } catch (IOException e) {
            throw new WorkbookReadException("Could not open workbook " + path + ": " + e.getMessage(), e);
        }
    }

    @Override
    public WorkbookData read(InputStream input, String fileName) {
        try (Workbook workbook = WorkbookFactory.create(input)) {
            List<SheetMatrix> sheets = new ArrayList<>();
            for (Sheet sheet : workbook) {
                sheets.add(readSheet(sheet));
            }
            log.info("📊 Planilla {} leída: {} hojas", fileName, sheets.size());
            return new WorkbookData(fileName, sheets);
        } catch (IOException | RuntimeException e) {
            // POI lanza IllegalArgumentException / NotOfficeXmlFileException ante archivos que no son Excel
            throw new WorkbookReadException("Could not read workbook " + fileName + ": " + e.getMessage(), e);
        }
    }

    private SheetMatrix readSheet(Sheet sheet) {
        List<List<CellValue>> rows = new ArrayList<>();
        int lastRow = sheet.getPhysicalNumberOfRows() == 0 ? -1 : sheet.getLastRowNum();

        for (int r = 0; r <= lastRow; r++) {
            Row row = sheet.getRow(r);
            if (row == null || row.getLastCellNum() < 0) {
                rows.add(List.of());
                continue;
            }
            List<CellValue> cells = new ArrayList<>(row.getLastCellNum());
            for (int c = 0; c < row.getLastCellNum(); c++) {
                cells.add(toCellValue(row.getCell(c)));
            }
            rows.add(cells);
        }
        return new SheetMatrix(sheet.getSheetName(), rows);
    }

    static CellValue toCellValue(Cell cell) {
        if (cell == null) return CellValue.empty();
        if (cell.getCellType() == CellType.FORMULA) {
            return CellValue.formula(cell.getCellFormula(), resolve(cell, cell.getCachedFormulaResultType()));
        }
        return resolve(cell, cell.getCellType());
    }

    private static CellValue resolve(Cell cell, CellType type) {
        switch (type) {
            case STRING:
                return CellValue.text(cell.getStringCellValue());
            case NUMERIC:
                if (DateUtil.isCellDateFormatted(cell)) return CellValue.date(cell.getLocalDateTimeCellValue());
                return CellValue.number(cell.getNumericCellValue());
            case BOOLEAN:
                return CellValue.bool(cell.getBooleanCellValue());
            default:
                // BLANK, ERROR, _NONE
                return CellValue.empty();
        }
    }
}

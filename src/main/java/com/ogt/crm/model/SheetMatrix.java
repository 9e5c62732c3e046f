package com.ogt.crm.model;

import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Una hoja de la planilla como matriz de celdas tipadas. Las filas pueden tener largo distinto.
 */
@Getter
@ToString(exclude = "rows")
public class SheetMatrix {

    private final String name;
    private final List<List<CellValue>> rows;

    public SheetMatrix(String name, List<List<CellValue>> rows) {
        this.name = name;
        List<List<CellValue>> copy = new ArrayList<>(rows.size());
        for (List<CellValue> row : rows) {
            copy.add(row == null ? List.of() : List.copyOf(row));
        }
        this.rows = Collections.unmodifiableList(copy);
    }

    public int getRowCount() {
        return rows.size();
    }

    public List<CellValue> row(int index) {
        if (index < 0 || index >= rows.size()) return List.of();
        return rows.get(index);
    }

    public CellValue cell(int rowIndex, int columnIndex) {
        List<CellValue> row = row(rowIndex);
        if (columnIndex < 0 || columnIndex >= row.size()) return CellValue.empty();
        return row.get(columnIndex);
    }

    public boolean isBlank() {
        return rows.stream().allMatch(r -> r.stream().allMatch(CellValue::isEmpty));
    }
}

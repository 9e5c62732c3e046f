package com.ogt.crm.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Resultado de analizar una hoja: fila de encabezados, perfiles de columna y la matriz original.
 * Una hoja vacía produce {@link #skipped(String, String)} en vez de un perfil degenerado.
 */
@Value
@Builder
public class SheetAnalysis {

    String name;
    boolean skipped;
    String skipReason;

    int headerRowIndex;
    int dataStartRow;
    int totalRows;
    List<String> headers;
    List<ColumnProfile> columnProfiles;

    @JsonIgnore
    SheetMatrix sheet;

    public static SheetAnalysis skipped(String name, String reason) {
        return SheetAnalysis.builder()
                .name(name)
                .skipped(true)
                .skipReason(reason)
                .headerRowIndex(-1)
                .dataStartRow(-1)
                .totalRows(0)
                .headers(List.of())
                .columnProfiles(List.of())
                .build();
    }

    public int getDataRows() {
        return skipped ? 0 : Math.max(0, totalRows - dataStartRow);
    }
}

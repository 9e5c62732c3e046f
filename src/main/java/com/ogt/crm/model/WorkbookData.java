package com.ogt.crm.model;

import lombok.Getter;

import java.util.List;
import java.util.Optional;

@Getter
public class WorkbookData {

    private final String fileName;
    private final List<SheetMatrix> sheets;

    public WorkbookData(String fileName, List<SheetMatrix> sheets) {
        this.fileName = fileName;
        this.sheets = List.copyOf(sheets);
    }

    public Optional<SheetMatrix> findSheet(String name) {
        return sheets.stream().filter(s -> s.getName().equals(name)).findFirst();
    }
}

package com.ogt.crm.reader;

import com.ogt.crm.model.WorkbookData;

import java.io.InputStream;
import java.nio.file.Path;

/**
 * Lee una planilla completa y resuelve cada celda a {@link com.ogt.crm.model.CellValue}.
 *
 * @throws com.ogt.crm.exception.WorkbookReadException si el archivo no existe o no se puede interpretar
 */
public interface WorkbookReader {

    WorkbookData read(Path path);

    WorkbookData read(InputStream input, String fileName);
}

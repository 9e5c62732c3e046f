package com.ogt.crm.worker;

import com.ogt.crm.config.MigrationProperties;
import com.ogt.crm.dto.MigrationRunDTO;
import com.ogt.crm.exception.DataStoreUnavailableException;
import com.ogt.crm.exception.RowValidationException;
import com.ogt.crm.exception.WorkbookReadException;
import com.ogt.crm.model.EntityCounters;
import com.ogt.crm.model.EntityRecord;
import com.ogt.crm.model.MappingSuggestion;
import com.ogt.crm.model.MigrationRun;
import com.ogt.crm.model.ProgressEventKind;
import com.ogt.crm.model.SheetAnalysis;
import com.ogt.crm.model.SheetMatrix;
import com.ogt.crm.model.TargetEntity;
import com.ogt.crm.model.WorkbookData;
import com.ogt.crm.model.WriteOutcome;
import com.ogt.crm.progress.ProgressBroadcaster;
import com.ogt.crm.reader.WorkbookReader;
import com.ogt.crm.service.CrmDataStore;
import com.ogt.crm.service.MappingAdvisor;
import com.ogt.crm.service.RowTransformer;
import com.ogt.crm.service.WorkbookAnalyzer;
import com.ogt.crm.util.MigrationErrorLog;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ejecuta una corrida: hojas en el orden de {@link TargetEntity}, filas en orden dentro de cada hoja.
 * <p>
 * El pedido de abort se revisa una vez por fila, antes de transformarla: la escritura en curso
 * termina y no se escribe nada más. Un error de fila se cuenta y la corrida sigue; un almacén caído
 * o una planilla ilegible terminan la corrida en FAILED. Siempre publica {@code done} al final.
 */
@Slf4j
public class MigrationExecutor {

    private final Path workbookPath;
    private final WorkbookReader reader;
    private final WorkbookAnalyzer analyzer;
    private final MappingAdvisor advisor;
    private final RowTransformer transformer;
    private final CrmDataStore store;
    private final ProgressBroadcaster broadcaster;
    private final MigrationProperties properties;

    private final MigrationRun run = new MigrationRun();
    private volatile boolean abortRequested;

    MigrationExecutor(Path workbookPath, WorkbookReader reader, WorkbookAnalyzer analyzer, MappingAdvisor advisor,
                      RowTransformer transformer, CrmDataStore store, ProgressBroadcaster broadcaster,
                      MigrationProperties properties) {
        this.workbookPath = workbookPath;
        this.reader = reader;
        this.analyzer = analyzer;
        this.advisor = advisor;
        this.transformer = transformer;
        this.store = store;
        this.broadcaster = broadcaster;
        this.properties = properties;
    }

    public MigrationRun getRun() {
        return run;
    }

    public void abort() {
        abortRequested = true;
        log.info("🛑 Abort solicitado para la corrida {}", run.getId());
    }

    public boolean isAbortRequested() {
        return abortRequested;
    }

    public void execute() {
        if (abortRequested) {
            // Abortada mientras esperaba en la cola: no se abre la planilla
            run.markAborted();
            log.info("🛑 Migración {} abortada antes de iniciar", run.getId());
            broadcaster.publish(ProgressEventKind.DONE,
                    MigrationRunDTO.summary(run, properties.getSummaryErrorLimit()));
            return;
        }

        try {
            run.markRunning();
            log.info("▶️ Iniciando migración {} desde {}", run.getId(), workbookPath);

            WorkbookData workbook = reader.read(workbookPath);

            for (TargetEntity entity : TargetEntity.values()) {
                if (abortRequested) break;

                Optional<SheetMatrix> sheet = findSheet(workbook, entity);
                if (sheet.isEmpty()) {
                    structuralError(entity, entity.getSheetName(), "Sheet not found in workbook");
                    continue;
                }
                processSheet(entity, sheet.get());
            }

            if (abortRequested) {
                run.markAborted();
                log.info("🛑 Migración {} abortada", run.getId());
            } else {
                run.markCompleted();
                log.info("✅ Migración {} completada. Errores: {}", run.getId(), run.getErrorLog().getErrorCount());
            }

        } catch (DataStoreUnavailableException e) {
            fail(MigrationErrorLog.CONNECTIVITY, e.getMessage(), e);
        } catch (WorkbookReadException e) {
            fail(MigrationErrorLog.STRUCTURE, e.getMessage(), e);
        } catch (RuntimeException e) {
            fail(MigrationErrorLog.SYSTEM, "Unexpected error: " + e.getMessage(), e);
        } finally {
            if (run.getErrorLog().hasErrors()) {
                log.info("📊 Resumen de errores de la corrida {}:\n{}", run.getId(), run.getErrorLog().getSummary());
            }
            broadcaster.publish(ProgressEventKind.DONE,
                    MigrationRunDTO.summary(run, properties.getSummaryErrorLimit()));
        }
    }

    /**
     * La corrida no llegó a arrancar (por ejemplo, el pool rechazó la tarea).
     */
    public void failBeforeStart(String message) {
        run.getErrorLog().addError(null, 0, MigrationErrorLog.SYSTEM, message);
        run.markFailed(message);
        log.error("❌ Migración {} no pudo iniciar: {}", run.getId(), message);
        broadcaster.publish(ProgressEventKind.DONE, MigrationRunDTO.summary(run, properties.getSummaryErrorLimit()));
    }

    // =================================================================================
    // 📄 HOJAS
    // =================================================================================

    // Nombre exacto en toda la planilla antes que contención
    private Optional<SheetMatrix> findSheet(WorkbookData workbook, TargetEntity entity) {
        Optional<SheetMatrix> exact = workbook.getSheets().stream()
                .filter(s -> entity.getSheetName().equals(s.getName()))
                .findFirst();
        if (exact.isPresent()) return exact;

        return workbook.getSheets().stream()
                .filter(s -> TargetEntity.forSheet(s.getName()).filter(entity::equals).isPresent())
                .findFirst();
    }

    private void processSheet(TargetEntity entity, SheetMatrix sheet) {
        SheetAnalysis analysis = analyzer.analyze(sheet);
        if (analysis.isSkipped()) {
            structuralError(entity, sheet.getName(), analysis.getSkipReason());
            return;
        }

        List<MappingSuggestion> suggestions = advisor.suggest(analysis, entity);
        Map<String, Integer> columns = transformer.columnsByField(suggestions);
        if (columns.isEmpty()) {
            structuralError(entity, sheet.getName(), "No mappable columns");
            return;
        }

        log.info("📄 Procesando hoja '{}' ({}): {} filas de datos, campos {}",
                sheet.getName(), entity.getStatsKey(), analysis.getDataRows(), columns.keySet());

        Map<String, Object> started = basePayload(entity, sheet.getName());
        started.put("headerRowIndex", analysis.getHeaderRowIndex());
        started.put("totalRows", analysis.getDataRows());
        started.put("mappedFields", List.copyOf(columns.keySet()));
        broadcaster.publish(ProgressEventKind.SHEET_STARTED, started);

        EntityCounters counters = run.countersFor(entity);
        int interval = Math.max(1, properties.getProgressIntervalRows());

        for (int r = analysis.getDataStartRow(); r < sheet.getRowCount(); r++) {
            if (abortRequested) {
                log.info("🛑 Hoja '{}' detenida en la fila {}", sheet.getName(), r + 1);
                return;
            }

            processRow(entity, sheet, columns, r, counters);

            if (counters.getProcessed() % interval == 0) {
                Map<String, Object> progress = countersPayload(entity, sheet.getName(), counters);
                progress.put("totalRows", analysis.getDataRows());
                broadcaster.publish(ProgressEventKind.PROGRESS, progress);
            }
        }

        log.info("✅ Hoja '{}' terminada: {}", sheet.getName(), counters.snapshot());
        broadcaster.publish(ProgressEventKind.SHEET_COMPLETED, countersPayload(entity, sheet.getName(), counters));
    }

    private void structuralError(TargetEntity entity, String sheetName, String reason) {
        log.warn("⚠️ Hoja '{}' omitida: {}", sheetName, reason);
        run.getErrorLog().addError(entity, 0, MigrationErrorLog.STRUCTURE, sheetName + ": " + reason);

        Map<String, Object> payload = basePayload(entity, sheetName);
        payload.put("type", MigrationErrorLog.STRUCTURE);
        payload.put("message", reason);
        broadcaster.publish(ProgressEventKind.ERROR, payload);
    }

    // =================================================================================
    // 🧾 FILAS
    // =================================================================================

    private void processRow(TargetEntity entity, SheetMatrix sheet, Map<String, Integer> columns,
                            int rowIndex, EntityCounters counters) {
        try {
            Optional<EntityRecord> record = transformer.transform(entity, columns, sheet.row(rowIndex), rowIndex);
            if (record.isEmpty()) {
                counters.recordSkipped();
                return;
            }

            WriteOutcome outcome = store.create(entity, record.get());
            if (outcome == WriteOutcome.CREATED) {
                counters.recordCreated();
            } else {
                counters.recordSkipped();
            }

        } catch (DataStoreUnavailableException e) {
            throw e;
        } catch (RowValidationException e) {
            counters.recordErrored();
            rowError(entity, sheet, rowIndex, MigrationErrorLog.VALIDATION, e.getMessage(), e.getFieldName());
        } catch (RuntimeException e) {
            counters.recordErrored();
            log.warn("⚠️ Error procesando fila {} de '{}': {}", rowIndex + 1, sheet.getName(), e.getMessage());
            rowError(entity, sheet, rowIndex, MigrationErrorLog.PROCESSING, e.getMessage(), null);
        }
    }

    private void rowError(TargetEntity entity, SheetMatrix sheet, int rowIndex, String type, String message, String field) {
        log.debug("Fila {} de '{}' con error {}: {}", rowIndex + 1, sheet.getName(), type, message);
        run.getErrorLog().addError(entity, rowIndex + 1, type, message, field);

        Map<String, Object> payload = basePayload(entity, sheet.getName());
        payload.put("row", rowIndex + 1);
        payload.put("type", type);
        payload.put("message", message);
        if (field != null) {
            payload.put("field", field);
        }
        broadcaster.publish(ProgressEventKind.ERROR, payload);
    }

    private void fail(String errorType, String message, RuntimeException e) {
        log.error("❌ Migración {} fallida: {}", run.getId(), message, e);
        run.getErrorLog().addError(null, 0, errorType, message);
        run.markFailed(message);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("runId", run.getId());
        payload.put("type", errorType);
        payload.put("message", message);
        broadcaster.publish(ProgressEventKind.ERROR, payload);
    }

    // =================================================================================
    // 📨 PAYLOADS
    // =================================================================================

    private Map<String, Object> basePayload(TargetEntity entity, String sheetName) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("runId", run.getId());
        payload.put("entity", entity.getStatsKey());
        payload.put("sheet", sheetName);
        return payload;
    }

    private Map<String, Object> countersPayload(TargetEntity entity, String sheetName, EntityCounters counters) {
        Map<String, Object> payload = basePayload(entity, sheetName);
        payload.put("processed", counters.getProcessed());
        payload.put("created", counters.getCreated());
        payload.put("skipped", counters.getSkipped());
        payload.put("errored", counters.getErrored());
        return payload;
    }
}

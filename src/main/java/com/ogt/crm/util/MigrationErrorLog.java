package com.ogt.crm.util;

import com.ogt.crm.model.TargetEntity;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Errores acumulados durante una corrida. Lo escribe el hilo de la corrida y lo leen status/eventos,
 * por eso todos los accesos son sincronizados y las lecturas devuelven copias.
 */
public class MigrationErrorLog {

    public static final String VALIDATION = "VALIDATION";
    public static final String PROCESSING = "PROCESSING";
    public static final String STRUCTURE = "STRUCTURE";
    public static final String CONNECTIVITY = "CONNECTIVITY";
    public static final String SYSTEM = "SYSTEM";

    private final List<MigrationError> errors = new ArrayList<>();
    private final Map<String, Integer> errorCounts = new LinkedHashMap<>();

    @Data
    public static class MigrationError {
        private final String entity;
        private final int rowIndex; // fila de la planilla (1-based), 0 si no aplica
        private final String errorType;
        private final String message;
        private final String fieldName;
    }

    public synchronized void addError(TargetEntity entity, int rowIndex, String errorType, String message) {
        addError(entity, rowIndex, errorType, message, null);
    }

    public synchronized void addError(TargetEntity entity, int rowIndex, String errorType, String message, String fieldName) {
        String entityName = entity != null ? entity.getSheetName() : "System";
        errors.add(new MigrationError(entityName, rowIndex, errorType, message, fieldName));
        errorCounts.merge(errorType, 1, Integer::sum);
    }

    public synchronized int getErrorCount() {
        return errors.size();
    }

    public synchronized boolean hasErrors() {
        return !errors.isEmpty();
    }

    public synchronized Map<String, Integer> getErrorCounts() {
        return new LinkedHashMap<>(errorCounts);
    }

    public synchronized List<MigrationError> firstErrors(int limit) {
        return List.copyOf(errors.subList(0, Math.min(limit, errors.size())));
    }

    public synchronized String getSummary() {
        if (errors.isEmpty()) {
            return "No errors";
        }

        StringBuilder sb = new StringBuilder();
        sb.append(String.format("Total errors: %d%n", errors.size()));

        errorCounts.forEach((type, count) ->
                sb.append(String.format("- %s: %d%n", type, count))
        );

        // Primeros 5 errores
        sb.append(String.format("%nFirst errors:%n"));
        errors.stream()
                .limit(5)
                .forEach(e -> sb.append(String.format("%s row %d: %s%n", e.entity, e.rowIndex, e.message)));

        if (errors.size() > 5) {
            sb.append(String.format("... and %d more%n", errors.size() - 5));
        }

        return sb.toString();
    }
}

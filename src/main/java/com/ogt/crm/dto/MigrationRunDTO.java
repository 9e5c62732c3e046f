package com.ogt.crm.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.ogt.crm.model.EntityCounters;
import com.ogt.crm.model.MigrationRun;
import com.ogt.crm.model.RunStatus;
import com.ogt.crm.util.MigrationErrorLog;
import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Vista de una corrida: snapshot para {@code status} y resumen completo para el evento {@code done}.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MigrationRunDTO {

    private UUID id;
    private RunStatus status;
    private Map<String, EntityCounters.Snapshot> counters; // clave: organizations, contacts, ...
    private LocalDateTime startedAt;
    private LocalDateTime endedAt;
    private String failureMessage;

    // Solo en el resumen final
    private Integer errorCount;
    private Map<String, Integer> errorCounts;
    private List<MigrationErrorLog.MigrationError> errors;

    public static MigrationRunDTO from(MigrationRun run) {
        return MigrationRunDTO.builder()
                .id(run.getId())
                .status(run.getStatus())
                .counters(countersByKey(run))
                .startedAt(run.getStartedAt())
                .endedAt(run.getEndedAt())
                .failureMessage(run.getFailureMessage())
                .build();
    }

    public static MigrationRunDTO summary(MigrationRun run, int errorLimit) {
        MigrationRunDTO dto = from(run);
        MigrationErrorLog errorLog = run.getErrorLog();
        dto.setErrorCount(errorLog.getErrorCount());
        dto.setErrorCounts(errorLog.getErrorCounts());
        dto.setErrors(errorLog.firstErrors(errorLimit));
        return dto;
    }

    private static Map<String, EntityCounters.Snapshot> countersByKey(MigrationRun run) {
        Map<String, EntityCounters.Snapshot> byKey = new LinkedHashMap<>();
        run.counterSnapshots().forEach((entity, snapshot) -> byKey.put(entity.getStatsKey(), snapshot));
        return byKey;
    }
}

package com.ogt.crm.service;

import com.ogt.crm.dto.MigrationActionResponse;
import com.ogt.crm.dto.MigrationRunDTO;
import com.ogt.crm.dto.MigrationStatisticsDTO;
import com.ogt.crm.exception.DataStoreUnavailableException;
import com.ogt.crm.exception.MigrationConflictException;
import com.ogt.crm.exception.ResourceNotFoundException;
import com.ogt.crm.model.TargetEntity;
import com.ogt.crm.worker.MigrationExecutor;
import com.ogt.crm.worker.MigrationExecutorFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Superficie de control de la migración: start / pause / abort / status y estadísticas.
 */
@Service
@Slf4j
public class MigrationService {

    private final MigrationRunRegistry registry;
    private final MigrationExecutorFactory executorFactory;
    private final CrmDataStore store;
    private final TaskExecutor taskExecutor;

    public MigrationService(MigrationRunRegistry registry,
                            MigrationExecutorFactory executorFactory,
                            CrmDataStore store,
                            @Qualifier("migrationTaskExecutor") TaskExecutor taskExecutor) {
        this.registry = registry;
        this.executorFactory = executorFactory;
        this.store = store;
        this.taskExecutor = taskExecutor;
    }

    /**
     * Registra una corrida nueva y la lanza en segundo plano. No espera a que termine.
     *
     * @throws MigrationConflictException si ya hay una corrida activa (sin efectos sobre ella)
     */
    public MigrationActionResponse start() {
        MigrationExecutor executor = executorFactory.create();
        if (!registry.tryRegister(executor)) {
            log.warn("⚠️ Start rechazado: ya hay una migración en curso");
            throw new MigrationConflictException("Migration already in progress");
        }

        try {
            taskExecutor.execute(() -> runAndRelease(executor));
        } catch (TaskRejectedException e) {
            executor.failBeforeStart("Migration executor unavailable");
            registry.remove(executor);
            throw new IllegalStateException("Migration executor unavailable", e);
        }

        log.info("▶️ Migración {} encolada", executor.getRun().getId());
        return MigrationActionResponse.builder()
                .message("Migration started")
                .id(executor.getRun().getId())
                .build();
    }

    private void runAndRelease(MigrationExecutor executor) {
        try {
            executor.execute();
        } finally {
            registry.remove(executor);
        }
    }

    public MigrationActionResponse pause() {
        log.info("Pause solicitado: no soportado, se ignora");
        return MigrationActionResponse.builder()
                .message("Pause is not supported; use abort to stop the active migration")
                .supported(false)
                .build();
    }

    /**
     * Marca la corrida activa para abortar y libera el slot. La fila en curso termina en el hilo de la corrida.
     *
     * @throws ResourceNotFoundException si no hay corrida activa
     */
    public MigrationActionResponse abort() {
        MigrationExecutor executor = registry.current()
                .orElseThrow(() -> new ResourceNotFoundException("No active migration"));

        executor.abort();
        registry.remove(executor);

        return MigrationActionResponse.builder()
                .message("Migration aborted")
                .build();
    }

    public MigrationActionResponse status() {
        Optional<MigrationExecutor> current = registry.current();
        return MigrationActionResponse.builder()
                .active(current.isPresent())
                .message(current.isPresent() ? "Migration in progress" : "No active migration")
                .run(current.map(e -> MigrationRunDTO.from(e.getRun())).orElse(null))
                .build();
    }

    public MigrationStatisticsDTO getStatistics() {
        try {
            Map<String, Long> counts = new LinkedHashMap<>();
            for (TargetEntity entity : TargetEntity.values()) {
                counts.put(entity.getStatsKey(), store.count(entity));
            }
            return MigrationStatisticsDTO.builder()
                    .counts(counts)
                    .migrationActive(registry.isActive())
                    .build();
        } catch (RuntimeException e) {
            log.error("❌ Error obteniendo estadísticas: {}", e.getMessage());
            throw new DataStoreUnavailableException("Failed to fetch statistics", e);
        }
    }
}

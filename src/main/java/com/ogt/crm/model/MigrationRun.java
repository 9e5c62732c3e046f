package com.ogt.crm.model;

import com.ogt.crm.util.MigrationErrorLog;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.UUID;

/**
 * Estado en memoria de una corrida de migración. No se persiste.
 */
@Slf4j
@Getter
public class MigrationRun {

    private final UUID id = UUID.randomUUID();
    private final Map<TargetEntity, EntityCounters> counters;
    private final MigrationErrorLog errorLog = new MigrationErrorLog();

    private volatile RunStatus status = RunStatus.IDLE;
    private volatile LocalDateTime startedAt;
    private volatile LocalDateTime endedAt;
    private volatile String failureMessage;

    public MigrationRun() {
        Map<TargetEntity, EntityCounters> map = new EnumMap<>(TargetEntity.class);
        for (TargetEntity entity : TargetEntity.values()) {
            map.put(entity, new EntityCounters());
        }
        this.counters = Collections.unmodifiableMap(map);
    }

    public EntityCounters countersFor(TargetEntity entity) {
        return counters.get(entity);
    }

    public synchronized void markRunning() {
        transitionTo(RunStatus.RUNNING);
        startedAt = LocalDateTime.now();
    }

    public synchronized void markCompleted() {
        transitionTo(RunStatus.COMPLETED);
        endedAt = LocalDateTime.now();
    }

    public synchronized void markAborted() {
        transitionTo(RunStatus.ABORTED);
        endedAt = LocalDateTime.now();
    }

    public synchronized void markFailed(String message) {
        transitionTo(RunStatus.FAILED);
        failureMessage = message;
        endedAt = LocalDateTime.now();
    }

    private void transitionTo(RunStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Invalid run transition " + status + " -> " + next + " (run " + id + ")");
        }
        log.debug("Corrida {}: {} -> {}", id, status, next);
        status = next;
    }

    public Map<TargetEntity, EntityCounters.Snapshot> counterSnapshots() {
        Map<TargetEntity, EntityCounters.Snapshot> snapshot = new EnumMap<>(TargetEntity.class);
        counters.forEach((entity, c) -> snapshot.put(entity, c.snapshot()));
        return snapshot;
    }
}

package com.ogt.crm.model;

import lombok.Value;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Contadores de una entidad durante una corrida. Los escribe solo el hilo de la corrida;
 * los lee cualquiera (status, eventos).
 * <p>
 * Invariante: {@code processed == created + skipped + errored}.
 */
public class EntityCounters {

    private final AtomicLong processed = new AtomicLong();
    private final AtomicLong created = new AtomicLong();
    private final AtomicLong skipped = new AtomicLong();
    private final AtomicLong errored = new AtomicLong();

    public void recordCreated() {
        created.incrementAndGet();
        processed.incrementAndGet();
    }

    public void recordSkipped() {
        skipped.incrementAndGet();
        processed.incrementAndGet();
    }

    public void recordErrored() {
        errored.incrementAndGet();
        processed.incrementAndGet();
    }

    public long getProcessed() {
        return processed.get();
    }

    public long getCreated() {
        return created.get();
    }

    public long getSkipped() {
        return skipped.get();
    }

    public long getErrored() {
        return errored.get();
    }

    public Snapshot snapshot() {
        return new Snapshot(getProcessed(), getCreated(), getSkipped(), getErrored());
    }

    @Value
    public static class Snapshot {
        long processed;
        long created;
        long skipped;
        long errored;
    }
}

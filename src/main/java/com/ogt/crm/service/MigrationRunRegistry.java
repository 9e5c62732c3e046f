package com.ogt.crm.service;

import com.ogt.crm.worker.MigrationExecutor;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Único lugar del proceso donde vive la corrida activa.
 * <p>
 * {@link #tryRegister} y {@link #remove} son atómicos: de dos altas simultáneas gana exactamente una,
 * y una baja solo libera el slot si sigue ocupado por el mismo executor.
 */
@Component
public class MigrationRunRegistry {

    private final AtomicReference<MigrationExecutor> active = new AtomicReference<>();

    public boolean tryRegister(MigrationExecutor executor) {
        return active.compareAndSet(null, executor);
    }

    public boolean remove(MigrationExecutor executor) {
        return active.compareAndSet(executor, null);
    }

    public Optional<MigrationExecutor> current() {
        return Optional.ofNullable(active.get());
    }

    public boolean isActive() {
        return active.get() != null;
    }
}

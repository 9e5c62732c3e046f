package com.ogt.crm.progress;

import com.ogt.crm.model.ProgressEvent;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Cola de salida acotada de un observador.
 * <p>
 * Contrato: entrega a lo sumo una vez, en orden de publicación. Si la cola se llena o una entrega
 * falla, la suscripción se da de baja y lo pendiente se descarta. Nunca hay más de un drenado
 * en curso por suscripción.
 */
@Slf4j
public class ProgressSubscription {

    @Getter
    private final UUID id = UUID.randomUUID();

    private final ProgressObserver observer;
    private final BlockingQueue<ProgressEvent> queue;
    private final Executor executor;
    private final Consumer<ProgressSubscription> onFailure;

    private final AtomicBoolean draining = new AtomicBoolean();
    private final AtomicBoolean closed = new AtomicBoolean();
    private volatile ScheduledFuture<?> pingTask;

    ProgressSubscription(ProgressObserver observer, int capacity, Executor executor,
                         Consumer<ProgressSubscription> onFailure) {
        this.observer = observer;
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.executor = executor;
        this.onFailure = onFailure;
    }

    /**
     * Encola sin bloquear.
     *
     * @return {@code false} si la suscripción está cerrada o la cola llena
     */
    boolean offer(ProgressEvent event) {
        if (closed.get()) return false;
        if (!queue.offer(event)) {
            log.warn("⚠️ Cola llena para el observador {}, se da de baja", id);
            return false;
        }
        scheduleDrain();
        return true;
    }

    private void scheduleDrain() {
        if (!draining.compareAndSet(false, true)) return;
        try {
            executor.execute(this::drain);
        } catch (RejectedExecutionException e) {
            draining.set(false);
            log.warn("⚠️ Entrega rechazada para el observador {}: {}", id, e.getMessage());
            onFailure.accept(this);
        }
    }

    private void drain() {
        try {
            ProgressEvent event;
            while (!closed.get() && (event = queue.poll()) != null) {
                observer.deliver(event);
            }
        } catch (IOException | RuntimeException e) {
            log.debug("Observador {} desconectado: {}", id, e.getMessage());
            draining.set(false);
            onFailure.accept(this);
            return;
        }
        draining.set(false);

        // Eventos que llegaron mientras se liberaba el flag
        if (!closed.get() && !queue.isEmpty()) {
            scheduleDrain();
        }
    }

    void setPingTask(ScheduledFuture<?> task) {
        this.pingTask = task;
        if (closed.get()) {
            task.cancel(false);
        }
    }

    /**
     * Idempotente.
     */
    void close() {
        if (!closed.compareAndSet(false, true)) return;
        ScheduledFuture<?> task = pingTask;
        if (task != null) {
            task.cancel(false);
        }
        queue.clear();
        observer.close();
    }

    public boolean isClosed() {
        return closed.get();
    }
}

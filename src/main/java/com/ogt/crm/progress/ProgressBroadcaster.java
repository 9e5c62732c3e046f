package com.ogt.crm.progress;

import com.ogt.crm.config.MigrationProperties;
import com.ogt.crm.model.ProgressEvent;
import com.ogt.crm.model.ProgressEventKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledFuture;

/**
 * Publica eventos de progreso a todos los observadores registrados.
 * <p>
 * Entrega a lo sumo una vez y sin reintentos: un observador recibe solo lo publicado después de
 * registrarse, y la primera entrega fallida lo da de baja. {@link #publish} nunca bloquea al
 * llamador; cada observador drena su propia cola en {@code progressDeliveryExecutor}.
 */
@Component
@Slf4j
public class ProgressBroadcaster {

    private final Executor deliveryExecutor;
    private final TaskScheduler pingScheduler;
    private final MigrationProperties properties;

    private final Set<ProgressSubscription> subscriptions = ConcurrentHashMap.newKeySet();

    public ProgressBroadcaster(@Qualifier("progressDeliveryExecutor") Executor deliveryExecutor,
                               @Qualifier("progressPingScheduler") TaskScheduler pingScheduler,
                               MigrationProperties properties) {
        this.deliveryExecutor = deliveryExecutor;
        this.pingScheduler = pingScheduler;
        this.properties = properties;
    }

    public ProgressSubscription register(ProgressObserver observer) {
        ProgressSubscription subscription = new ProgressSubscription(
                observer,
                properties.getProgress().getObserverQueueCapacity(),
                deliveryExecutor,
                this::deregister);

        // "connected" entra a la cola antes que cualquier evento publicado
        subscription.offer(ProgressEvent.of(ProgressEventKind.CONNECTED,
                Map.of("message", "Connected to migration progress", "subscriptionId", subscription.getId())));
        subscriptions.add(subscription);

        Duration interval = properties.getProgress().getPingInterval();
        ScheduledFuture<?> ping = pingScheduler.scheduleAtFixedRate(
                () -> ping(subscription), Instant.now().plus(interval), interval);
        subscription.setPingTask(ping);

        // La entrega de "connected" pudo fallar antes de entrar al set
        if (subscription.isClosed()) {
            deregister(subscription);
        }

        log.debug("Observador {} registrado ({} activos)", subscription.getId(), subscriptions.size());
        return subscription;
    }

    public void deregister(ProgressSubscription subscription) {
        if (subscriptions.remove(subscription)) {
            log.debug("Observador {} dado de baja ({} activos)", subscription.getId(), subscriptions.size());
        }
        subscription.close();
    }

    public void publish(ProgressEventKind kind, Object payload) {
        ProgressEvent event = ProgressEvent.of(kind, payload);
        for (ProgressSubscription subscription : subscriptions) {
            if (!subscription.offer(event)) {
                deregister(subscription);
            }
        }
    }

    public int getObserverCount() {
        return subscriptions.size();
    }

    private void ping(ProgressSubscription subscription) {
        if (!subscription.offer(ProgressEvent.of(ProgressEventKind.PING, Map.of()))) {
            deregister(subscription);
        }
    }
}

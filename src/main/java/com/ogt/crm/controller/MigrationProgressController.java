package com.ogt.crm.controller;

import com.ogt.crm.config.OpenApiConfig;
import com.ogt.crm.progress.ProgressBroadcaster;
import com.ogt.crm.progress.ProgressSubscription;
import com.ogt.crm.progress.SseProgressObserver;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

@RestController
@RequestMapping("/api/migration/progress")
@RequiredArgsConstructor
@Slf4j
@Tag(name = OpenApiConfig.TAG_PROGRESS)
public class MigrationProgressController {

    private final ProgressBroadcaster broadcaster;

    @GetMapping(produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream() {
        SseEmitter emitter = new SseEmitter(0L); // sin timeout: el ping mantiene viva la conexión
        ProgressSubscription subscription = broadcaster.register(new SseProgressObserver(emitter));

        emitter.onCompletion(() -> broadcaster.deregister(subscription));
        emitter.onTimeout(() -> broadcaster.deregister(subscription));
        emitter.onError(e -> {
            log.debug("Conexión SSE {} cerrada con error: {}", subscription.getId(), e.getMessage());
            broadcaster.deregister(subscription);
        });
        return emitter;
    }
}

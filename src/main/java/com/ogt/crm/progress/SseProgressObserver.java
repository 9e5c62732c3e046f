package com.ogt.crm.progress;

import com.ogt.crm.model.ProgressEvent;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;

/**
 * Observador sobre una conexión SSE: evento con nombre y {@code data} en JSON.
 */
@RequiredArgsConstructor
public class SseProgressObserver implements ProgressObserver {

    private final SseEmitter emitter;

    @Override
    public void deliver(ProgressEvent event) throws IOException {
        emitter.send(SseEmitter.event()
                .name(event.getKind().getEventName())
                .data(event.getPayload(), MediaType.APPLICATION_JSON));
    }

    @Override
    public void close() {
        emitter.complete();
    }
}

package com.ogt.crm.progress;

import com.ogt.crm.model.ProgressEvent;

import java.io.IOException;

/**
 * Cliente conectado al canal de progreso.
 * Un {@link IOException} en {@link #deliver} da de baja al observador: no hay reintentos.
 */
public interface ProgressObserver {

    void deliver(ProgressEvent event) throws IOException;

    default void close() {
    }
}

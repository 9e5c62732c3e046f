package com.ogt.crm.exception;

/**
 * El almacén relacional no responde. Fatal para la corrida.
 */
public class DataStoreUnavailableException extends RuntimeException {
    public DataStoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
